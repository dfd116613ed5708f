package au.org.ala.scalers;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * Width and height of an image, in pixels.
 */
public final class Dimension {

    public final int width;
    public final int height;

    public Dimension(int width, int height) {
        Preconditions.checkArgument(width >= 0, "width must not be negative: %s", width);
        Preconditions.checkArgument(height >= 0, "height must not be negative: %s", height);
        this.width = width;
        this.height = height;
    }

    public boolean covers(int width, int height) {
        return this.width >= width && this.height >= height;
    }

    public long area() {
        return (long) width * height;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Dimension)) return false;
        Dimension that = (Dimension) o;
        return width == that.width && height == that.height;
    }

    @Override
    public int hashCode() {
        return Objects.hash(width, height);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("width", width)
                .add("height", height)
                .toString();
    }
}
