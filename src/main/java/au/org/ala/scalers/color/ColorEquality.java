package au.org.ala.scalers.color;

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * Decides whether two key colors count as the same color for pattern matching.
 *
 * @param <K> key color
 */
@FunctionalInterface
public interface ColorEquality<K> {

    boolean test(K a, K b);

    static <K> ColorEquality<K> exact() {
        return Objects::equals;
    }

    /**
     * Oklab colors closer than {@code threshold} are equal.
     */
    static ColorEquality<OklabF> oklab(float threshold) {
        Preconditions.checkArgument(threshold >= 0, "threshold must not be negative: %s", threshold);
        return (a, b) -> a.distanceTo(b) <= threshold;
    }
}
