package org.janelia.fuzzer.detection.parameters;

import org.janelia.fuzzer.detection.ImageContext;

/**
 * Parameters describing an AKAZE feature detector.
 */
public class AkazeParameters
        extends DetectionParameters {

    /** Descriptor variants with their OpenCV constant values. */
    public enum DescriptorType {
        KAZE_UPRIGHT(2),
        MLDB_UPRIGHT(4);

        private final int code;

        DescriptorType(final int code) {
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }

    /** Diffusivity types with their OpenCV constant values. */
    public enum Diffusivity {
        PM_G1(0),
        PM_G2(1),
        WEICKERT(2),
        CHARBONNIER(3);

        private final int code;

        Diffusivity(final int code) {
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }

    private final DescriptorType descriptorType;
    private final Diffusivity diffusivityType;
    private final float threshold;
    private final int octaves;
    private final int octaveLayers;

    public AkazeParameters(final ImageContext imageContext,
                           final DescriptorType descriptorType,
                           final Diffusivity diffusivityType,
                           final float threshold,
                           final int octaves,
                           final int octaveLayers) {
        super(imageContext);
        this.descriptorType = descriptorType;
        this.diffusivityType = diffusivityType;
        this.threshold = threshold;
        this.octaves = octaves;
        this.octaveLayers = octaveLayers;
    }

    public DescriptorType getDescriptorType() {
        return descriptorType;
    }

    public Diffusivity getDiffusivityType() {
        return diffusivityType;
    }

    public float getThreshold() {
        return threshold;
    }

    public int getOctaves() {
        return octaves;
    }

    public int getOctaveLayers() {
        return octaveLayers;
    }

    @Override
    public String toParameterString() {
        return quote("descriptorType: " + descriptorType +
                     ", diffusivityType: " + diffusivityType +
                     ", threshold: " + threshold +
                     ", octaves: " + octaves +
                     ", octaveLayers: " + octaveLayers);
    }
}
