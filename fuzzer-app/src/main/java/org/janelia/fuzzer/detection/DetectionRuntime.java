package org.janelia.fuzzer.detection;

/**
 * Process wide setup for a detection capability (e.g. loading native libraries).
 * The fuzzer initializes the runtime once before any image is processed
 * and closes it after the session ends.
 */
public interface DetectionRuntime extends AutoCloseable {

    void initialize();

    @Override
    void close();

    /** Runtime for capabilities that need no process wide setup. */
    DetectionRuntime NONE = new DetectionRuntime() {
        @Override
        public void initialize() {
        }

        @Override
        public void close() {
        }
    };
}
