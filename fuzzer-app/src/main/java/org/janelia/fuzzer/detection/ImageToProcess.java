package org.janelia.fuzzer.detection;

import java.io.Serializable;

/**
 * An input image name paired with the region where keypoints are wanted.
 * Instances are loaded from the fuzzer input file.
 */
public class ImageToProcess implements Serializable {

    private final String fileName;
    private final RegionOfInterest regionOfInterest;

    @SuppressWarnings("unused")
    ImageToProcess() {
        this(null, null);
    }

    public ImageToProcess(final String fileName,
                          final RegionOfInterest regionOfInterest) {
        this.fileName = fileName;
        this.regionOfInterest = regionOfInterest;
    }

    public String getFileName() {
        return fileName;
    }

    public RegionOfInterest getRegionOfInterest() {
        return regionOfInterest;
    }

    @Override
    public String toString() {
        return fileName;
    }
}
