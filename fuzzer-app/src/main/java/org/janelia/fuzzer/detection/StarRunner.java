package org.janelia.fuzzer.detection;

import java.util.Arrays;

import org.janelia.fuzzer.detection.parameters.ParameterAxis;
import org.janelia.fuzzer.detection.parameters.ParameterGrid;
import org.janelia.fuzzer.detection.parameters.StarParameters;

/**
 * Fuzzes parameters of the STAR feature detector.
 */
public class StarRunner
        extends FeatureDetectorRunner<StarParameters> {

    static final ParameterAxis<Integer> MAX_SIZES =
            ParameterAxis.ofIntegers("maxSize", 25, 65, 5, true);
    static final ParameterAxis<Integer> RESPONSE_THRESHOLDS =
            ParameterAxis.ofIntegers("responseThreshold", 10, 50, 10, true);
    static final ParameterAxis<Integer> LINE_THRESHOLDS_PROJECTED =
            ParameterAxis.ofIntegers("lineThresholdProjected", 4, 16, 2, true);
    static final ParameterAxis<Integer> LINE_THRESHOLDS_BINARIZED =
            ParameterAxis.ofIntegers("lineThresholdBinarized", 4, 14, 2, true);
    static final ParameterAxis<Integer> SUPPRESS_NON_MAX_SIZES =
            ParameterAxis.ofIntegers("suppressNonMaxSize", 1, 15, 2, true);

    public StarRunner(final KeypointDetector<StarParameters> keypointDetector) {
        super(FeatureDetectorAlgorithm.STAR, keypointDetector);
    }

    @Override
    public ParameterGrid<StarParameters> generateParameters(final ImageContext imageContext) {
        return new ParameterGrid<>(Arrays.asList(MAX_SIZES,
                                                 RESPONSE_THRESHOLDS,
                                                 LINE_THRESHOLDS_PROJECTED,
                                                 LINE_THRESHOLDS_BINARIZED,
                                                 SUPPRESS_NON_MAX_SIZES),
                                   i -> new StarParameters(imageContext,
                                                           MAX_SIZES.get(i[0]),
                                                           RESPONSE_THRESHOLDS.get(i[1]),
                                                           LINE_THRESHOLDS_PROJECTED.get(i[2]),
                                                           LINE_THRESHOLDS_BINARIZED.get(i[3]),
                                                           SUPPRESS_NON_MAX_SIZES.get(i[4])));
    }
}
