package org.janelia.fuzzer.session;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * One top-level sweep across all configured images and algorithm families.
 *
 * Records accumulate here until they are drained for a commit.
 * The end time stays null until every image and family has been attempted,
 * so a session without an end time marks an incomplete run.
 */
public class FuzzingSession {

    private Long id;
    private final Date startTime;
    private Date endTime;
    private final List<FeatureDetectionRecord> pendingRecords;
    private long recordedCount;

    public FuzzingSession() {
        this(null, new Date(), null);
    }

    public FuzzingSession(final Long id,
                          final Date startTime,
                          final Date endTime) {
        this.id = id;
        this.startTime = startTime;
        this.endTime = endTime;
        this.pendingRecords = new ArrayList<>();
        this.recordedCount = 0;
    }

    public Long getId() {
        return id;
    }

    public void setId(final Long id) {
        this.id = id;
    }

    public Date getStartTime() {
        return startTime;
    }

    public Date getEndTime() {
        return endTime;
    }

    public void markComplete() {
        this.endTime = new Date();
    }

    public synchronized void addRecord(final FeatureDetectionRecord record) {
        pendingRecords.add(record);
        recordedCount++;
    }

    /**
     * @return total number of records ever added to this session.
     */
    public synchronized long getRecordedCount() {
        return recordedCount;
    }

    /**
     * @return all pending records (in the order they were added), leaving none pending.
     */
    public synchronized List<FeatureDetectionRecord> drainPendingRecords() {
        final List<FeatureDetectionRecord> drained = new ArrayList<>(pendingRecords);
        pendingRecords.clear();
        return drained;
    }

    @Override
    public String toString() {
        return "session " + id;
    }
}
