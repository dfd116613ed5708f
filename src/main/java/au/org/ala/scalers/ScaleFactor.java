package au.org.ala.scalers;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;

/**
 * Immutable horizontal and vertical scale ratio.
 * <p>
 * Discrete scalers use whole factors ({@code 2x}, {@code 3x}); resamplers use arbitrary positive ratios.
 * {@link #apply(int, int)} is exact for whole factors. For fractional factors each axis is rounded down,
 * with a tolerance of {@value #ROUNDING_TOLERANCE} so that {@code n * (m / n)} yields {@code m} despite
 * binary representation error. This matches the truncation of partial blocks done by downscalers.
 */
public final class ScaleFactor {

    static final double ROUNDING_TOLERANCE = 1e-9;

    private final double x;
    private final double y;

    private ScaleFactor(double x, double y) {
        this.x = x;
        this.y = y;
    }

    /**
     * @throws IllegalArgumentException if either component is not a finite, positive number
     */
    public static ScaleFactor of(double x, double y) {
        Preconditions.checkArgument(isValidComponent(x), "scale x must be positive and finite: %s", x);
        Preconditions.checkArgument(isValidComponent(y), "scale y must be positive and finite: %s", y);
        return new ScaleFactor(x, y);
    }

    public static ScaleFactor uniform(double scale) {
        return of(scale, scale);
    }

    /**
     * Parses the form produced by {@link #toString()}, e.g. {@code "2x"}, {@code "2x3"} or {@code "1.5x"}.
     */
    public static ScaleFactor parse(String text) {
        Preconditions.checkArgument(StringUtils.isNotBlank(text), "scale must not be blank");
        String[] parts = StringUtils.splitPreserveAllTokens(text.trim().toLowerCase(), 'x');
        try {
            if (parts.length == 2 && parts[1].isEmpty()) {
                return uniform(Double.parseDouble(parts[0]));
            }
            if (parts.length == 2) {
                return of(Double.parseDouble(parts[0]), Double.parseDouble(parts[1]));
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid scale: " + text, e);
        }
        throw new IllegalArgumentException("Invalid scale: " + text);
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public boolean isUniform() {
        return x == y;
    }

    public boolean isIntegral() {
        return isWhole(x) && isWhole(y);
    }

    /**
     * Computes the target size for a source of the given size.
     *
     * @throws IllegalArgumentException if either source dimension is negative
     * @throws ArithmeticException if the result does not fit in an {@code int}
     */
    public Dimension apply(int width, int height) {
        Preconditions.checkArgument(width >= 0, "source width must not be negative: %s", width);
        Preconditions.checkArgument(height >= 0, "source height must not be negative: %s", height);
        return new Dimension(scaleLength(width, x), scaleLength(height, y));
    }

    public Dimension apply(Dimension source) {
        return apply(source.width, source.height);
    }

    private static int scaleLength(int length, double factor) {
        if (isWhole(factor)) {
            return Math.toIntExact(Math.multiplyExact((long) length, (long) factor));
        }
        double scaled = Math.floor(length * factor + ROUNDING_TOLERANCE);
        if (scaled > Integer.MAX_VALUE) {
            throw new ArithmeticException("integer overflow scaling " + length + " by " + factor);
        }
        return (int) scaled;
    }

    private static boolean isValidComponent(double value) {
        return value > 0 && !Double.isInfinite(value);
    }

    private static boolean isWhole(double value) {
        return value == Math.rint(value);
    }

    private static String format(double value) {
        if (isWhole(value) && Math.abs(value) < Long.MAX_VALUE) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScaleFactor)) return false;
        ScaleFactor that = (ScaleFactor) o;
        return Double.compare(x, that.x) == 0 && Double.compare(y, that.y) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(x) + Double.hashCode(y);
    }

    @Override
    public String toString() {
        return isUniform() ? format(x) + "x" : format(x) + "x" + format(y);
    }
}
