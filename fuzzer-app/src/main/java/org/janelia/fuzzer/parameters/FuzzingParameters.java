package org.janelia.fuzzer.parameters;

import com.beust.jcommander.Parameter;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.File;
import java.io.Serializable;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.janelia.fuzzer.detection.FeatureDetectorAlgorithm;
import org.janelia.fuzzer.engine.BatchedDetectionExecutor;
import org.janelia.fuzzer.engine.FailurePolicy;

/**
 * Parameters for a feature detector fuzzing session.
 */
public class FuzzingParameters
        implements Serializable {

    @Parameter(
            names = "-InputPath",
            description = "Directory containing fuzzer-input.json and the images it lists",
            required = true)
    public String inputPath;

    @Parameter(
            names = "-OutputPath",
            description = "Directory for the CSV report, annotated images, and default result database",
            required = true)
    public String outputPath;

    @Parameter(
            names = "-Algorithms",
            description = "Comma separated algorithms to fuzz (AKAZE, AGAST, ORB, STAR, SIFT).  " +
                          "Omit to fuzz all of them.",
            listConverter = AlgorithmListConverter.class)
    public List<FeatureDetectorAlgorithm> algorithms;

    @Parameter(
            names = "--batchSize",
            description = "Number of detections run concurrently in each batch")
    public int batchSize = BatchedDetectionExecutor.DEFAULT_BATCH_SIZE;

    @Parameter(
            names = "--failurePolicy",
            description = "How a failed detection is handled")
    public FailurePolicy failurePolicy = FailurePolicy.FAIL_FAST;

    @Parameter(
            names = "--detectionTimeoutSeconds",
            description = "Maximum number of seconds to wait for one batch of detections (omit for no limit)")
    public Long detectionTimeoutSeconds;

    public FuzzingParameters() {
    }

    public FuzzingParameters(final String inputPath,
                             final String outputPath,
                             final List<FeatureDetectorAlgorithm> algorithms) {
        this.inputPath = inputPath;
        this.outputPath = outputPath;
        this.algorithms = algorithms;
    }

    @JsonIgnore
    public File getInputDirectory() {
        return new File(inputPath).getAbsoluteFile();
    }

    @JsonIgnore
    public File getOutputDirectory() {
        return new File(outputPath).getAbsoluteFile();
    }

    /**
     * @return enabled algorithms in run order.
     */
    @JsonIgnore
    public Set<FeatureDetectorAlgorithm> getEnabledAlgorithms() {
        final Set<FeatureDetectorAlgorithm> enabled;
        if (algorithms == null) {
            enabled = FeatureDetectorAlgorithm.all();
        } else if (algorithms.isEmpty()) {
            enabled = EnumSet.noneOf(FeatureDetectorAlgorithm.class);
        } else {
            enabled = EnumSet.copyOf(algorithms);
        }
        return enabled;
    }

    @JsonIgnore
    public Long getBatchTimeoutMilliseconds() {
        return detectionTimeoutSeconds == null ? null : detectionTimeoutSeconds * 1000;
    }

    public void validate()
            throws IllegalArgumentException {

        if ((inputPath == null) || (outputPath == null)) {
            throw new IllegalArgumentException("input and output paths must be specified");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("--batchSize must be at least 1");
        }
        if ((detectionTimeoutSeconds != null) && (detectionTimeoutSeconds < 1)) {
            throw new IllegalArgumentException("--detectionTimeoutSeconds must be at least 1");
        }
    }
}
