package org.janelia.fuzzer.detection;

import java.util.Arrays;

import org.janelia.fuzzer.detection.parameters.AkazeParameters;
import org.janelia.fuzzer.detection.parameters.AkazeParameters.DescriptorType;
import org.janelia.fuzzer.detection.parameters.AkazeParameters.Diffusivity;
import org.janelia.fuzzer.detection.parameters.ParameterAxis;
import org.janelia.fuzzer.detection.parameters.ParameterGrid;

/**
 * Fuzzes parameters of the AKAZE feature detector.
 *
 * Descriptor size and channel count are left at their defaults.  Only the upright
 * (rotation variant) descriptors are swept.  The default threshold is 0.001 and the
 * default octave and octave layer counts are 4.
 */
public class AkazeRunner
        extends FeatureDetectorRunner<AkazeParameters> {

    static final ParameterAxis<DescriptorType> DESCRIPTOR_TYPES =
            ParameterAxis.ofValues("descriptorType", DescriptorType.KAZE_UPRIGHT, DescriptorType.MLDB_UPRIGHT);
    static final ParameterAxis<Diffusivity> DIFFUSIVITY_TYPES =
            ParameterAxis.ofValues("diffusivityType", Diffusivity.values());
    static final ParameterAxis<Double> THRESHOLDS =
            ParameterAxis.ofDecimals("threshold", "0.001", "0.051", "0.005", false);
    static final ParameterAxis<Integer> OCTAVES =
            ParameterAxis.ofIntegers("octaves", 1, 6, 1, true);
    static final ParameterAxis<Integer> OCTAVE_LAYERS =
            ParameterAxis.ofIntegers("octaveLayers", 1, 6, 1, true);

    public AkazeRunner(final KeypointDetector<AkazeParameters> keypointDetector) {
        super(FeatureDetectorAlgorithm.AKAZE, keypointDetector);
    }

    @Override
    public ParameterGrid<AkazeParameters> generateParameters(final ImageContext imageContext) {
        return new ParameterGrid<>(Arrays.asList(DESCRIPTOR_TYPES, DIFFUSIVITY_TYPES, THRESHOLDS, OCTAVES, OCTAVE_LAYERS),
                                   i -> new AkazeParameters(imageContext,
                                                            DESCRIPTOR_TYPES.get(i[0]),
                                                            DIFFUSIVITY_TYPES.get(i[1]),
                                                            THRESHOLDS.get(i[2]).floatValue(),
                                                            OCTAVES.get(i[3]),
                                                            OCTAVE_LAYERS.get(i[4])));
    }
}
