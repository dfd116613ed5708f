package au.org.ala.scalers;

/**
 * A pixel-art scaler that only works at the discrete scale factors it was written for.
 * <p>
 * Implementations carry no instance members beyond {@link ScalerInfo}. By convention each concrete class also
 * publishes its static side so callers can check a factor before committing to it:
 * <ul>
 *     <li>{@code public static final List<ScaleFactor> SUPPORTED_SCALES}</li>
 *     <li>{@code public static boolean supportsScale(ScaleFactor scale)}</li>
 *     <li>{@code public static List<Dimension> possibleTargets(int sourceWidth, int sourceHeight)}</li>
 * </ul>
 * Constructing one at a factor outside {@code SUPPORTED_SCALES} fails with {@link UnsupportedScaleException}.
 */
public interface PixelScaler extends ScalerInfo {
}
