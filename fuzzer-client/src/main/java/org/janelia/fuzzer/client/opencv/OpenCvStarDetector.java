package org.janelia.fuzzer.client.opencv;

import org.bytedeco.opencv.opencv_xfeatures2d.StarDetector;
import org.janelia.fuzzer.detection.parameters.StarParameters;

/**
 * STAR (CenSurE) detection backed by the OpenCV contrib modules.
 */
public class OpenCvStarDetector
        extends OpenCvKeypointDetector<StarParameters, StarDetector> {

    @Override
    protected StarDetector createDetector(final StarParameters parameters) {
        return StarDetector.create(parameters.getMaxSize(),
                                   parameters.getResponseThreshold(),
                                   parameters.getLineThresholdProjected(),
                                   parameters.getLineThresholdBinarized(),
                                   parameters.getSuppressNonMaxSize());
    }
}
