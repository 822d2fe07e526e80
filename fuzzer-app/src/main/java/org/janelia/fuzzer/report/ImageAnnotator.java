package org.janelia.fuzzer.report;

import java.io.File;
import java.io.IOException;

import org.janelia.fuzzer.detection.DetectionResult;
import org.janelia.fuzzer.detection.FeatureDetectorAlgorithm;
import org.janelia.fuzzer.detection.RegionOfInterest;
import org.janelia.fuzzer.detection.SourceImage;
import org.janelia.fuzzer.util.FileUtil;

/**
 * Draws the region of interest and detected keypoints onto a copy of the source image.
 * Implementations are called concurrently and must never modify the source image.
 */
public interface ImageAnnotator {

    String OUTPUT_FORMAT = "jpg";

    /**
     * @return false if annotated images should not be written.
     */
    default boolean isEnabled() {
        return true;
    }

    /**
     * Writes an annotated copy of the source image.
     *
     * @throws IOException
     *   if the annotated image cannot be written.
     */
    void annotate(SourceImage sourceImage,
                  RegionOfInterest regionOfInterest,
                  DetectionResult result,
                  File outputFile)
            throws IOException;

    /**
     * @return name of the annotated image for a result (e.g. "scan-AGAST-12.jpg").
     */
    static String getOutputFileName(final String inputFileName,
                                    final FeatureDetectorAlgorithm algorithm,
                                    final int iteration) {
        return FileUtil.getBaseName(inputFileName) + '-' + algorithm + '-' + iteration + '.' + OUTPUT_FORMAT;
    }

    /** Annotator that writes nothing. */
    ImageAnnotator DISABLED = new ImageAnnotator() {
        @Override
        public boolean isEnabled() {
            return false;
        }

        @Override
        public void annotate(final SourceImage sourceImage,
                             final RegionOfInterest regionOfInterest,
                             final DetectionResult result,
                             final File outputFile) {
        }
    };
}
