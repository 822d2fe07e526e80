package org.janelia.fuzzer.detection.parameters;

import org.janelia.fuzzer.detection.ImageContext;
import org.janelia.fuzzer.detection.RegionOfInterest;
import org.janelia.fuzzer.detection.SourceImage;

/**
 * Immutable detector configuration for one image.
 * Subclasses add the algorithm specific fields.
 */
public abstract class DetectionParameters {

    private final ImageContext imageContext;

    protected DetectionParameters(final ImageContext imageContext) {
        this.imageContext = imageContext;
    }

    public ImageContext getImageContext() {
        return imageContext;
    }

    public SourceImage getImage() {
        return imageContext.getImage();
    }

    public String getFileName() {
        return imageContext.getFileName();
    }

    public RegionOfInterest getRegionOfInterest() {
        return imageContext.getRegionOfInterest();
    }

    /**
     * @return quoted, order stable description of the algorithm specific fields
     *         (e.g. "threshold: 10, useNonMaxSuppression: true") used verbatim in reports.
     */
    public abstract String toParameterString();

    @Override
    public String toString() {
        return toParameterString();
    }

    protected static String quote(final String fieldList) {
        return '"' + fieldList + '"';
    }
}
