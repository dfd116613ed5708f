package au.org.ala.scalers.resize;

import au.org.ala.scalers.ScalerCategory;
import au.org.ala.scalers.ScalerInfo;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The scalers shipped with the library.
 */
public final class ScalerRegistry {

    private static final List<ScalerDescriptor<?>> ALL = ImmutableList.of(
            Scale.DESCRIPTOR,
            BoxDownscale.DESCRIPTOR,
            Bilinear.DESCRIPTOR,
            MitchellNetravali.DESCRIPTOR,
            MitchellNetravali.CATMULL_ROM_DESCRIPTOR,
            MitchellNetravali.B_SPLINE_DESCRIPTOR,
            MitchellNetravali.ROBIDOUX_DESCRIPTOR,
            MitchellNetravali.ROBIDOUX_SHARP_DESCRIPTOR,
            MitchellNetravali.ROBIDOUX_SOFT_DESCRIPTOR);

    private ScalerRegistry() {
    }

    public static List<ScalerDescriptor<?>> all() {
        return ALL;
    }

    public static List<ScalerDescriptor<?>> byCategory(ScalerCategory category) {
        return ALL.stream().filter(d -> d.getCategory() == category).collect(ImmutableList.toImmutableList());
    }

    /**
     * Looks a descriptor up by name, ignoring case.
     */
    public static Optional<ScalerDescriptor<?>> find(String name) {
        return ALL.stream().filter(d -> d.getName().equalsIgnoreCase(name)).findFirst();
    }

    /**
     * @throws IllegalArgumentException if no scaler is called {@code name}
     */
    public static ScalerDescriptor<?> require(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException(String.format("Unknown scaler '%s', expected one of %s",
                name, ALL.stream().map(ScalerDescriptor::getName).collect(Collectors.joining(", ")))));
    }

    /**
     * Finds the descriptor for the class of {@code scaler}.
     *
     * @throws IllegalArgumentException if the class is not registered
     */
    public static ScalerDescriptor<?> forScaler(ScalerInfo scaler) {
        for (ScalerDescriptor<?> descriptor : ALL) {
            if (descriptor.getType() == scaler.getClass()) {
                return descriptor;
            }
        }
        throw new IllegalArgumentException("No registered scaler for " + scaler.getClass().getName());
    }
}
