package org.janelia.fuzzer.detection;

import java.util.Arrays;

import org.janelia.fuzzer.detection.parameters.OrbParameters;
import org.janelia.fuzzer.detection.parameters.OrbParameters.ScoreType;
import org.janelia.fuzzer.detection.parameters.ParameterAxis;
import org.janelia.fuzzer.detection.parameters.ParameterGrid;

/**
 * Fuzzes parameters of the ORB feature detector.
 * This is one of the largest grids (tens of thousands of combinations per image).
 */
public class OrbRunner
        extends FeatureDetectorRunner<OrbParameters> {

    static final ParameterAxis<Integer> NUMBER_OF_FEATURES =
            ParameterAxis.ofIntegers("numberOfFeatures", 250, 1500, 250, true);
    static final ParameterAxis<Double> SCALE_FACTORS =
            ParameterAxis.ofDecimals("scaleFactor", "1.1", "1.4", "0.1", true);
    static final ParameterAxis<Integer> LEVELS =
            ParameterAxis.ofIntegers("levels", 1, 4, 1, true);
    static final ParameterAxis<Integer> EDGE_THRESHOLDS =
            ParameterAxis.ofIntegers("edgeThreshold", 11, 46, 5, true);
    static final ParameterAxis<ScoreType> SCORE_TYPES =
            ParameterAxis.ofValues("scoreType", ScoreType.FAST, ScoreType.HARRIS);
    static final ParameterAxis<Integer> PATCH_SIZES =
            ParameterAxis.ofIntegers("patchSize", 11, 46, 5, true);
    static final ParameterAxis<Integer> FAST_THRESHOLDS =
            ParameterAxis.ofIntegers("fastThreshold", 10, 30, 5, true);

    public OrbRunner(final KeypointDetector<OrbParameters> keypointDetector) {
        super(FeatureDetectorAlgorithm.ORB, keypointDetector);
    }

    @Override
    public ParameterGrid<OrbParameters> generateParameters(final ImageContext imageContext) {
        return new ParameterGrid<>(Arrays.asList(NUMBER_OF_FEATURES,
                                                 SCALE_FACTORS,
                                                 LEVELS,
                                                 EDGE_THRESHOLDS,
                                                 SCORE_TYPES,
                                                 PATCH_SIZES,
                                                 FAST_THRESHOLDS),
                                   i -> new OrbParameters(imageContext,
                                                          NUMBER_OF_FEATURES.get(i[0]),
                                                          SCALE_FACTORS.get(i[1]).floatValue(),
                                                          LEVELS.get(i[2]),
                                                          EDGE_THRESHOLDS.get(i[3]),
                                                          SCORE_TYPES.get(i[4]),
                                                          PATCH_SIZES.get(i[5]),
                                                          FAST_THRESHOLDS.get(i[6])));
    }
}
