package org.janelia.fuzzer.session;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link JdbcFuzzingSessionStore} class against an in-memory H2 database.
 */
public class JdbcFuzzingSessionStoreTest {

    private JdbcFuzzingSessionStore store;
    private DbConfig dbConfig;

    @Before
    public void setup() {
        dbConfig = new DbConfig("jdbc:h2:mem:fuzzer-" + System.nanoTime() + ";DB_CLOSE_DELAY=-1", "sa", "");
        store = new JdbcFuzzingSessionStore(dbConfig);
    }

    @After
    public void tearDown() {
        store.close();
    }

    @Test
    public void testSessionLifecycle() {

        final FuzzingSession session = new FuzzingSession();
        store.startSession(session);

        Assert.assertNotNull("session id should be assigned", session.getId());

        FuzzingSession loadedSession = store.getSession(session.getId());
        Assert.assertNotNull("session should be persisted", loadedSession);
        Assert.assertEquals("invalid start time",
                            session.getStartTime().getTime(), loadedSession.getStartTime().getTime());
        Assert.assertNull("incomplete session should have no end time", loadedSession.getEndTime());

        final List<FeatureDetectionRecord> records = Arrays.asList(
                new FeatureDetectionRecord("a.png", "AGAST", 0, 6, 10, 0.6f, 12,
                                           "\"agastType: AGAST_5_8, threshold: 2, useNonMaxSuppression: true\""),
                new FeatureDetectionRecord("a.png", "AGAST", 1, 0, 0, 0.0f, 3,
                                           "\"agastType: AGAST_5_8, threshold: 2, useNonMaxSuppression: false\""));
        store.saveRecords(session, records);

        session.markComplete();
        store.completeSession(session);

        loadedSession = store.getSession(session.getId());
        Assert.assertNotNull("completed session should have an end time", loadedSession.getEndTime());

        final List<FeatureDetectionRecord> loadedRecords = store.getRecords(session.getId());
        Assert.assertEquals("invalid number of records", 2, loadedRecords.size());

        final FeatureDetectionRecord first = loadedRecords.get(0);
        Assert.assertEquals("invalid file name", "a.png", first.getInputFileName());
        Assert.assertEquals("invalid iteration", 0, first.getIteration());
        Assert.assertEquals("invalid inlier count", 6, first.getInlierCount());
        Assert.assertEquals("invalid total count", 10, first.getTotalCount());
        Assert.assertEquals("invalid ratio", 0.6f, first.getInlierOutlierRatio(), 0.0001f);
        Assert.assertEquals("invalid execution time", 12, first.getExecutionTimeMs());
        Assert.assertEquals("invalid parameters", records.get(0).getParameters(), first.getParameters());
        Assert.assertEquals("invalid second iteration", 1, loadedRecords.get(1).getIteration());
    }

    @Test
    public void testSessionsAreIsolated() {

        final FuzzingSession first = new FuzzingSession();
        final FuzzingSession second = new FuzzingSession();
        store.startSession(first);
        store.startSession(second);

        Assert.assertNotEquals("sessions should have distinct ids", first.getId(), second.getId());

        store.saveRecords(first, Collections.singletonList(
                new FeatureDetectionRecord("a.png", "ORB", 0, 1, 2, 0.5f, 1, "\"\"")));

        Assert.assertEquals("first session should have one record", 1, store.getRecords(first.getId()).size());
        Assert.assertEquals("second session should have no records", 0, store.getRecords(second.getId()).size());
        Assert.assertNull("unknown session should not be found", store.getSession(second.getId() + 100));
    }

    @Test
    public void testSchemaCreationIsRepeatable() {
        final FuzzingSession session = new FuzzingSession();
        store.startSession(session);

        try (final JdbcFuzzingSessionStore secondStore = new JdbcFuzzingSessionStore(dbConfig)) {
            Assert.assertNotNull("existing session should be visible after reopening",
                                 secondStore.getSession(session.getId()));
        }
    }

    @Test
    public void testUnstartedSessionIsRejected() {
        try {
            store.saveRecords(new FuzzingSession(), Collections.emptyList());
            Assert.fail("saving records for an unstarted session should fail");
        } catch (final FuzzingSessionStoreException e) {
            Assert.assertTrue("message should explain the problem", e.getMessage().contains("not been started"));
        }
    }

    @Test
    public void testFailedSaveRollsBack() {

        final FuzzingSession session = new FuzzingSession();
        store.startSession(session);

        final List<FeatureDetectionRecord> records = Arrays.asList(
                new FeatureDetectionRecord("a.png", "ORB", 0, 1, 2, 0.5f, 1, "\"\""),
                new FeatureDetectionRecord(null, "ORB", 1, 1, 2, 0.5f, 1, "\"\""));
        try {
            store.saveRecords(session, records);
            Assert.fail("record without a file name should fail");
        } catch (final FuzzingSessionStoreException e) {
            Assert.assertNotNull("SQL failure should be kept", e.getCause());
        }

        Assert.assertEquals("partial batch should be rolled back", 0, store.getRecords(session.getId()).size());
    }
}
