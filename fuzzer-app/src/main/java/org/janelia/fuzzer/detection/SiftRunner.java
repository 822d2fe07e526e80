package org.janelia.fuzzer.detection;

import java.util.Arrays;

import org.janelia.fuzzer.detection.parameters.ParameterAxis;
import org.janelia.fuzzer.detection.parameters.ParameterGrid;
import org.janelia.fuzzer.detection.parameters.SiftParameters;

/**
 * Fuzzes parameters of the SIFT feature detector.
 */
public class SiftRunner
        extends FeatureDetectorRunner<SiftParameters> {

    // 0 features means unlimited
    static final ParameterAxis<Integer> FEATURES =
            ParameterAxis.ofIntegers("features", 0, 1500, 250, false);
    static final ParameterAxis<Integer> OCTAVE_LAYERS =
            ParameterAxis.ofIntegers("octaveLayers", 1, 6, 1, true);
    static final ParameterAxis<Double> CONTRAST_THRESHOLDS =
            ParameterAxis.ofDecimals("contrastThreshold", "0.01", "0.10", "0.01", true);
    static final ParameterAxis<Double> EDGE_THRESHOLDS =
            ParameterAxis.ofDecimals("edgeThreshold", "2", "20", "2", true);
    static final ParameterAxis<Double> SIGMAS =
            ParameterAxis.ofDecimals("sigma", "1.1", "2.0", "0.1", true);

    public SiftRunner(final KeypointDetector<SiftParameters> keypointDetector) {
        super(FeatureDetectorAlgorithm.SIFT, keypointDetector);
    }

    @Override
    public ParameterGrid<SiftParameters> generateParameters(final ImageContext imageContext) {
        return new ParameterGrid<>(Arrays.asList(FEATURES,
                                                 OCTAVE_LAYERS,
                                                 CONTRAST_THRESHOLDS,
                                                 EDGE_THRESHOLDS,
                                                 SIGMAS),
                                   i -> new SiftParameters(imageContext,
                                                           FEATURES.get(i[0]),
                                                           OCTAVE_LAYERS.get(i[1]),
                                                           CONTRAST_THRESHOLDS.get(i[2]),
                                                           EDGE_THRESHOLDS.get(i[3]),
                                                           SIGMAS.get(i[4])));
    }
}
