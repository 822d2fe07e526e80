package org.janelia.fuzzer.detection.parameters;

import org.janelia.fuzzer.detection.ImageContext;

/**
 * Parameters describing an AGAST feature detector.
 */
public class AgastParameters
        extends DetectionParameters {

    /** Detector variants with their OpenCV constant values. */
    public enum AgastType {
        AGAST_5_8(0),
        AGAST_7_12d(1),
        AGAST_7_12s(2),
        OAST_9_16(3);

        private final int code;

        AgastType(final int code) {
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }

    private final AgastType agastType;
    private final int threshold;
    private final boolean useNonMaxSuppression;

    public AgastParameters(final ImageContext imageContext,
                           final AgastType agastType,
                           final int threshold,
                           final boolean useNonMaxSuppression) {
        super(imageContext);
        this.agastType = agastType;
        this.threshold = threshold;
        this.useNonMaxSuppression = useNonMaxSuppression;
    }

    public AgastType getAgastType() {
        return agastType;
    }

    public int getThreshold() {
        return threshold;
    }

    public boolean isUseNonMaxSuppression() {
        return useNonMaxSuppression;
    }

    @Override
    public String toParameterString() {
        return quote("agastType: " + agastType +
                     ", threshold: " + threshold +
                     ", useNonMaxSuppression: " + useNonMaxSuppression);
    }
}
