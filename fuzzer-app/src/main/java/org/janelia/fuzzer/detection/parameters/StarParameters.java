package org.janelia.fuzzer.detection.parameters;

import org.janelia.fuzzer.detection.ImageContext;

/**
 * Parameters describing a STAR (CenSurE) feature detector.
 */
public class StarParameters
        extends DetectionParameters {

    private final int maxSize;
    private final int responseThreshold;
    private final int lineThresholdProjected;
    private final int lineThresholdBinarized;
    private final int suppressNonMaxSize;

    public StarParameters(final ImageContext imageContext,
                          final int maxSize,
                          final int responseThreshold,
                          final int lineThresholdProjected,
                          final int lineThresholdBinarized,
                          final int suppressNonMaxSize) {
        super(imageContext);
        this.maxSize = maxSize;
        this.responseThreshold = responseThreshold;
        this.lineThresholdProjected = lineThresholdProjected;
        this.lineThresholdBinarized = lineThresholdBinarized;
        this.suppressNonMaxSize = suppressNonMaxSize;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public int getResponseThreshold() {
        return responseThreshold;
    }

    public int getLineThresholdProjected() {
        return lineThresholdProjected;
    }

    public int getLineThresholdBinarized() {
        return lineThresholdBinarized;
    }

    public int getSuppressNonMaxSize() {
        return suppressNonMaxSize;
    }

    @Override
    public String toParameterString() {
        return quote("maxSize: " + maxSize +
                     ", responseThreshold: " + responseThreshold +
                     ", lineThresholdProjected: " + lineThresholdProjected +
                     ", lineThresholdBinarized: " + lineThresholdBinarized +
                     ", suppressNonMaxSize: " + suppressNonMaxSize);
    }
}
