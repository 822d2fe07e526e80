package org.janelia.fuzzer.client.opencv;

import org.bytedeco.opencv.opencv_features2d.SIFT;
import org.janelia.fuzzer.detection.parameters.SiftParameters;

/**
 * SIFT detection backed by OpenCV.
 */
public class OpenCvSiftDetector
        extends OpenCvKeypointDetector<SiftParameters, SIFT> {

    @Override
    protected SIFT createDetector(final SiftParameters parameters) {
        return SIFT.create(parameters.getFeatures(),
                           parameters.getOctaveLayers(),
                           parameters.getContrastThreshold(),
                           parameters.getEdgeThreshold(),
                           parameters.getSigma());
    }
}
