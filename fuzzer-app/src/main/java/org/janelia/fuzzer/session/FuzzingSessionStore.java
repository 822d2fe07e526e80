package org.janelia.fuzzer.session;

import java.util.Collections;
import java.util.List;

/**
 * Durable storage for fuzzing sessions and their detection records.
 */
public interface FuzzingSessionStore
        extends AutoCloseable {

    /**
     * Persists a new session and assigns its id.
     */
    void startSession(FuzzingSession session)
            throws FuzzingSessionStoreException;

    /**
     * Persists all records for the session as one unit of work.
     */
    void saveRecords(FuzzingSession session,
                     List<FeatureDetectionRecord> records)
            throws FuzzingSessionStoreException;

    /**
     * Persists the session's end time.
     */
    void completeSession(FuzzingSession session)
            throws FuzzingSessionStoreException;

    /**
     * @return the session with the specified id or null if it does not exist.
     */
    FuzzingSession getSession(long sessionId)
            throws FuzzingSessionStoreException;

    /**
     * @return records for the specified session in the order they were saved.
     */
    List<FeatureDetectionRecord> getRecords(long sessionId)
            throws FuzzingSessionStoreException;

    @Override
    void close()
            throws FuzzingSessionStoreException;

    /** Store that keeps nothing. */
    FuzzingSessionStore DISABLED = new FuzzingSessionStore() {

        @Override
        public void startSession(final FuzzingSession session) {
        }

        @Override
        public void saveRecords(final FuzzingSession session,
                                final List<FeatureDetectionRecord> records) {
        }

        @Override
        public void completeSession(final FuzzingSession session) {
        }

        @Override
        public FuzzingSession getSession(final long sessionId) {
            return null;
        }

        @Override
        public List<FeatureDetectionRecord> getRecords(final long sessionId) {
            return Collections.emptyList();
        }

        @Override
        public void close() {
        }

        @Override
        public String toString() {
            return "disabled store";
        }
    };
}
