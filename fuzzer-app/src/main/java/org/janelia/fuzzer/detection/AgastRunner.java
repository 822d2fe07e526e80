package org.janelia.fuzzer.detection;

import java.util.Arrays;

import org.janelia.fuzzer.detection.parameters.AgastParameters;
import org.janelia.fuzzer.detection.parameters.AgastParameters.AgastType;
import org.janelia.fuzzer.detection.parameters.ParameterAxis;
import org.janelia.fuzzer.detection.parameters.ParameterGrid;

/**
 * Fuzzes parameters of the AGAST corner detector.
 */
public class AgastRunner
        extends FeatureDetectorRunner<AgastParameters> {

    static final ParameterAxis<AgastType> AGAST_TYPES =
            ParameterAxis.ofValues("agastType", AgastType.values());
    static final ParameterAxis<Integer> THRESHOLDS =
            ParameterAxis.ofIntegers("threshold", 2, 20, 2, false);
    static final ParameterAxis<Boolean> NON_MAX_SUPPRESSION =
            ParameterAxis.ofBooleans("useNonMaxSuppression");

    public AgastRunner(final KeypointDetector<AgastParameters> keypointDetector) {
        super(FeatureDetectorAlgorithm.AGAST, keypointDetector);
    }

    @Override
    public ParameterGrid<AgastParameters> generateParameters(final ImageContext imageContext) {
        return new ParameterGrid<>(Arrays.asList(AGAST_TYPES, THRESHOLDS, NON_MAX_SUPPRESSION),
                                   i -> new AgastParameters(imageContext,
                                                            AGAST_TYPES.get(i[0]),
                                                            THRESHOLDS.get(i[1]),
                                                            NON_MAX_SUPPRESSION.get(i[2])));
    }
}
