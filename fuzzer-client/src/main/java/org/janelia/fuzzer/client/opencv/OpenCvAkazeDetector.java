package org.janelia.fuzzer.client.opencv;

import org.bytedeco.opencv.opencv_features2d.AKAZE;
import org.janelia.fuzzer.detection.parameters.AkazeParameters;

/**
 * AKAZE detection backed by OpenCV.
 */
public class OpenCvAkazeDetector
        extends OpenCvKeypointDetector<AkazeParameters, AKAZE> {

    @Override
    protected AKAZE createDetector(final AkazeParameters parameters) {
        return AKAZE.create();
    }

    @Override
    protected void configureDetector(final AKAZE detector,
                                     final AkazeParameters parameters) {
        detector.setDescriptorType(parameters.getDescriptorType().getCode());
        detector.setDiffusivity(parameters.getDiffusivityType().getCode());
        detector.setThreshold(parameters.getThreshold());
        detector.setNOctaves(parameters.getOctaves());
        detector.setNOctaveLayers(parameters.getOctaveLayers());
    }
}
