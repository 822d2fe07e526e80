package org.janelia.fuzzer.client.opencv;

import org.bytedeco.opencv.opencv_features2d.AgastFeatureDetector;
import org.janelia.fuzzer.detection.parameters.AgastParameters;

/**
 * AGAST detection backed by OpenCV.
 */
public class OpenCvAgastDetector
        extends OpenCvKeypointDetector<AgastParameters, AgastFeatureDetector> {

    @Override
    protected AgastFeatureDetector createDetector(final AgastParameters parameters) {
        return AgastFeatureDetector.create();
    }

    @Override
    protected void configureDetector(final AgastFeatureDetector detector,
                                     final AgastParameters parameters) {
        detector.setType(parameters.getAgastType().getCode());
        detector.setThreshold(parameters.getThreshold());
        detector.setNonmaxSuppression(parameters.isUseNonMaxSuppression());
    }
}
