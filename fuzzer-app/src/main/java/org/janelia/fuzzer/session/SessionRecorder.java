package org.janelia.fuzzer.session;

import java.util.List;

import org.janelia.fuzzer.detection.DetectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accumulates results from concurrently running detections into their session
 * and commits them to a store in one batch.
 */
public class SessionRecorder {

    private final FuzzingSessionStore store;

    public SessionRecorder(final FuzzingSessionStore store) {
        this.store = store;
    }

    /**
     * Safe to call from any number of detection threads.
     */
    public void record(final FuzzingSession session,
                       final DetectionResult result,
                       final int iteration) {
        session.addRecord(FeatureDetectionRecord.fromResult(result, iteration));
    }

    /**
     * Saves every pending record of the session in a single store transaction.
     *
     * @return number of records committed.
     *
     * @throws FuzzingSessionStoreException
     *   if the store fails to save the records (they are not retried).
     */
    public int commit(final FuzzingSession session)
            throws FuzzingSessionStoreException {

        final List<FeatureDetectionRecord> records = session.drainPendingRecords();
        if (records.size() > 0) {
            store.saveRecords(session, records);
            LOG.debug("commit: saved {} records for {}", records.size(), session);
        }
        return records.size();
    }

    private static final Logger LOG = LoggerFactory.getLogger(SessionRecorder.class);
}
