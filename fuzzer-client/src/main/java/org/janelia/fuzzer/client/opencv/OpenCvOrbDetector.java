package org.janelia.fuzzer.client.opencv;

import org.bytedeco.opencv.opencv_features2d.ORB;
import org.janelia.fuzzer.detection.parameters.OrbParameters;

/**
 * ORB detection backed by OpenCV.
 */
public class OpenCvOrbDetector
        extends OpenCvKeypointDetector<OrbParameters, ORB> {

    @Override
    protected ORB createDetector(final OrbParameters parameters) {
        return ORB.create();
    }

    @Override
    protected void configureDetector(final ORB detector,
                                     final OrbParameters parameters) {
        detector.setMaxFeatures(parameters.getNumberOfFeatures());
        detector.setScaleFactor(parameters.getScaleFactor());
        detector.setNLevels(parameters.getLevels());
        detector.setEdgeThreshold(parameters.getEdgeThreshold());
        detector.setScoreType(parameters.getScoreType().getCode());
        detector.setPatchSize(parameters.getPatchSize());
        detector.setFastThreshold(parameters.getFastThreshold());
    }
}
