package org.janelia.fuzzer.session;

import java.io.Serializable;

import org.janelia.fuzzer.detection.DetectionResult;

/**
 * Persistence shaped view of one {@link DetectionResult}, tagged with its iteration.
 */
public class FeatureDetectionRecord implements Serializable {

    private final String inputFileName;
    private final String algorithm;
    private final int iteration;
    private final int inlierCount;
    private final int totalCount;
    private final float inlierOutlierRatio;
    private final long executionTimeMs;
    private final String parameters;

    public FeatureDetectionRecord(final String inputFileName,
                                  final String algorithm,
                                  final int iteration,
                                  final int inlierCount,
                                  final int totalCount,
                                  final float inlierOutlierRatio,
                                  final long executionTimeMs,
                                  final String parameters) {
        this.inputFileName = inputFileName;
        this.algorithm = algorithm;
        this.iteration = iteration;
        this.inlierCount = inlierCount;
        this.totalCount = totalCount;
        this.inlierOutlierRatio = normalizeRatio(inlierOutlierRatio);
        this.executionTimeMs = executionTimeMs;
        this.parameters = parameters;
    }

    public static FeatureDetectionRecord fromResult(final DetectionResult result,
                                                    final int iteration) {
        return new FeatureDetectionRecord(result.getFileName(),
                                          result.getFeatureDetector().name(),
                                          iteration,
                                          result.getInlierFeatureCount(),
                                          result.getTotalFeatureCount(),
                                          result.getInlierOutlierRatio(),
                                          result.getExecutionTimeMs(),
                                          result.getFeatureDetectorConfiguration());
    }

    public String getInputFileName() {
        return inputFileName;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public int getIteration() {
        return iteration;
    }

    public int getInlierCount() {
        return inlierCount;
    }

    public int getTotalCount() {
        return totalCount;
    }

    public float getInlierOutlierRatio() {
        return inlierOutlierRatio;
    }

    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    public String getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return algorithm + " iteration " + iteration + " for " + inputFileName +
               ": " + inlierCount + "/" + totalCount;
    }

    // stores cannot hold NaN or infinity
    private static float normalizeRatio(final float ratio) {
        return (Float.isNaN(ratio) || Float.isInfinite(ratio)) ? 0.0f : ratio;
    }
}
