package org.janelia.fuzzer.detection;

/**
 * Decoded image shared read-only by every detection run for that image.
 * Implementations wrap whatever native representation the detection capability needs.
 * Detections must never modify the wrapped pixels; annotation works on a copy.
 */
public interface SourceImage extends AutoCloseable {

    String getName();

    int getWidth();

    int getHeight();

    /**
     * Releases any native resources held by this image.
     */
    @Override
    void close();
}
