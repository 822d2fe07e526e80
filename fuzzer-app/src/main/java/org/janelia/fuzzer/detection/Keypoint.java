package org.janelia.fuzzer.detection;

import java.io.Serializable;

/**
 * Salient point found by a feature detector.
 * Location is in image pixel coordinates; the remaining fields are detector specific metadata.
 */
public class Keypoint implements Serializable {

    private final float x;
    private final float y;
    private final float size;
    private final float angle;
    private final float response;
    private final int octave;

    public Keypoint(final float x,
                    final float y) {
        this(x, y, 1.0f, -1.0f, 0.0f, 0);
    }

    public Keypoint(final float x,
                    final float y,
                    final float size,
                    final float angle,
                    final float response,
                    final int octave) {
        this.x = x;
        this.y = y;
        this.size = size;
        this.angle = angle;
        this.response = response;
        this.octave = octave;
    }

    public float getX() {
        return x;
    }

    public float getY() {
        return y;
    }

    public float getSize() {
        return size;
    }

    public float getAngle() {
        return angle;
    }

    public float getResponse() {
        return response;
    }

    public int getOctave() {
        return octave;
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
