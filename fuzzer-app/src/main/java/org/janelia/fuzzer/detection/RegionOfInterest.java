package org.janelia.fuzzer.detection;

import java.io.Serializable;
import java.util.Objects;

/**
 * Axis aligned rectangle within an image where detected keypoints are considered inliers.
 *
 * Image coordinates grow downward (row 0 is the top of the image), so the top edge
 * is {@link #getY()} and the bottom edge is {@link #getY()} + {@link #getHeight()}.
 * All four edges are inside the region.
 */
public class RegionOfInterest implements Serializable {

    private final int x;
    private final int y;
    private final int width;
    private final int height;

    @SuppressWarnings("unused")
    RegionOfInterest() {
        this(0, 0, 0, 0);
    }

    public RegionOfInterest(final int x,
                            final int y,
                            final int width,
                            final int height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getLeft() {
        return x;
    }

    public int getRight() {
        return x + width;
    }

    public int getTop() {
        return y;
    }

    public int getBottom() {
        return y + height;
    }

    /**
     * @return true if the specified point lies within this region (edges inclusive).
     */
    public boolean contains(final double pointX,
                            final double pointY) {
        return (getLeft() <= pointX) && (pointX <= getRight()) &&
               (getTop() <= pointY) && (pointY <= getBottom());
    }

    public boolean contains(final Keypoint keypoint) {
        return contains(keypoint.getX(), keypoint.getY());
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final RegionOfInterest that = (RegionOfInterest) o;
        return x == that.x && y == that.y && width == that.width && height == that.height;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, width, height);
    }

    @Override
    public String toString() {
        return "{X: " + x + ", Y: " + y + ", Width: " + width + ", Height: " + height + '}';
    }
}
