package org.janelia.fuzzer.engine;

import org.janelia.fuzzer.detection.FeatureDetectorAlgorithm;

/**
 * Detection that did not produce a result.
 */
public class DetectionFailure {

    private final FeatureDetectorAlgorithm algorithm;
    private final String fileName;
    private final int iteration;
    private final String parameterDescription;
    private final Throwable cause;

    public DetectionFailure(final FeatureDetectorAlgorithm algorithm,
                            final String fileName,
                            final int iteration,
                            final String parameterDescription,
                            final Throwable cause) {
        this.algorithm = algorithm;
        this.fileName = fileName;
        this.iteration = iteration;
        this.parameterDescription = parameterDescription;
        this.cause = cause;
    }

    public FeatureDetectorAlgorithm getAlgorithm() {
        return algorithm;
    }

    public String getFileName() {
        return fileName;
    }

    public int getIteration() {
        return iteration;
    }

    public String getParameterDescription() {
        return parameterDescription;
    }

    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return algorithm + " iteration " + iteration + " for " + fileName + " with " + parameterDescription +
               " failed: " + (cause == null ? "unknown cause" : cause.getMessage());
    }
}
