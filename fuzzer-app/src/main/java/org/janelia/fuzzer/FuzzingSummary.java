package org.janelia.fuzzer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.fuzzer.detection.DetectionResult;

/**
 * Counts and best results for one fuzzing session.
 */
public class FuzzingSummary {

    private final Long sessionId;
    private int processedImageCount;
    private int skippedImageCount;
    private long resultCount;
    private int failedDetectionCount;
    private int abortedFamilyCount;
    private final List<DetectionResult> bestResults;

    public FuzzingSummary(final Long sessionId) {
        this.sessionId = sessionId;
        this.bestResults = new ArrayList<>();
    }

    public Long getSessionId() {
        return sessionId;
    }

    public int getProcessedImageCount() {
        return processedImageCount;
    }

    public int getSkippedImageCount() {
        return skippedImageCount;
    }

    public long getResultCount() {
        return resultCount;
    }

    public int getFailedDetectionCount() {
        return failedDetectionCount;
    }

    /**
     * @return number of image/algorithm combinations that stopped early because a batch failed.
     */
    public int getAbortedFamilyCount() {
        return abortedFamilyCount;
    }

    /**
     * @return best result for each image and algorithm that produced at least one result.
     */
    public List<DetectionResult> getBestResults() {
        return Collections.unmodifiableList(bestResults);
    }

    void addProcessedImage() {
        processedImageCount++;
    }

    void addSkippedImage() {
        skippedImageCount++;
    }

    void addResults(final long count) {
        resultCount += count;
    }

    void addFailedDetections(final int count) {
        failedDetectionCount += count;
    }

    void addAbortedFamily() {
        abortedFamilyCount++;
    }

    void addBestResult(final DetectionResult result) {
        bestResults.add(result);
    }

    /**
     * @return true if the candidate has a higher ratio than the current best
     *         (or the same ratio with more inliers).
     */
    static boolean isBetter(final DetectionResult candidate,
                            final DetectionResult currentBest) {
        final boolean isBetter;
        if (currentBest == null) {
            isBetter = true;
        } else {
            final int ratioComparison = Float.compare(candidate.getInlierOutlierRatio(),
                                                      currentBest.getInlierOutlierRatio());
            isBetter = (ratioComparison > 0) ||
                       ((ratioComparison == 0) &&
                        (candidate.getInlierFeatureCount() > currentBest.getInlierFeatureCount()));
        }
        return isBetter;
    }

    @Override
    public String toString() {
        return "session " + sessionId + ": " + processedImageCount + " images processed, " +
               skippedImageCount + " skipped, " + resultCount + " results, " +
               failedDetectionCount + " failed detections, " + abortedFamilyCount + " aborted families";
    }
}
