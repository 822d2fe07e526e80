package org.janelia.fuzzer.detection;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one detector invocation for one parameter set.
 */
public class DetectionResult implements Serializable {

    private final String fileName;
    private final List<Keypoint> keypoints;
    private final int totalFeatureCount;
    private final int inlierFeatureCount;
    private final long executionTimeMs;
    private final FeatureDetectorAlgorithm featureDetector;
    private final String featureDetectorConfiguration;

    public DetectionResult(final String fileName,
                           final List<Keypoint> keypoints,
                           final int inlierFeatureCount,
                           final long executionTimeMs,
                           final FeatureDetectorAlgorithm featureDetector,
                           final String featureDetectorConfiguration)
            throws IllegalArgumentException {

        this.fileName = fileName;
        this.keypoints = Collections.unmodifiableList(keypoints);
        this.totalFeatureCount = keypoints.size();

        if ((inlierFeatureCount < 0) || (inlierFeatureCount > totalFeatureCount)) {
            throw new IllegalArgumentException("inlier count " + inlierFeatureCount +
                                               " must be between 0 and total count " + totalFeatureCount);
        }

        this.inlierFeatureCount = inlierFeatureCount;
        this.executionTimeMs = executionTimeMs;
        this.featureDetector = featureDetector;
        this.featureDetectorConfiguration = featureDetectorConfiguration;
    }

    public String getFileName() {
        return fileName;
    }

    public List<Keypoint> getKeypoints() {
        return keypoints;
    }

    public int getTotalFeatureCount() {
        return totalFeatureCount;
    }

    public int getInlierFeatureCount() {
        return inlierFeatureCount;
    }

    /**
     * @return fraction of keypoints inside the region of interest,
     *         or 0 when nothing was detected (instead of NaN).
     */
    public float getInlierOutlierRatio() {
        if (totalFeatureCount == 0) {
            return 0.0f;
        }
        return (float) inlierFeatureCount / (float) totalFeatureCount;
    }

    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    public FeatureDetectorAlgorithm getFeatureDetector() {
        return featureDetector;
    }

    public String getFeatureDetectorConfiguration() {
        return featureDetectorConfiguration;
    }

    @Override
    public String toString() {
        return featureDetector + " " + featureDetectorConfiguration +
               " found " + inlierFeatureCount + " of " + totalFeatureCount + " features in " + fileName;
    }
}
