package au.org.ala.scalers;

/**
 * Thrown when a scaler is asked for a scale or ratio outside the set its type supports.
 */
public class UnsupportedScaleException extends IllegalArgumentException {

    public UnsupportedScaleException(String message) {
        super(message);
    }

    public static UnsupportedScaleException forScale(String scalerName, ScaleFactor scale) {
        return new UnsupportedScaleException(String.format("%s does not support scale %s", scalerName, scale));
    }

    public static UnsupportedScaleException forRatio(String scalerName, int ratioX, int ratioY) {
        return new UnsupportedScaleException(String.format("%s does not support ratio %dx%d", scalerName, ratioX, ratioY));
    }

    public static UnsupportedScaleException forRange(String scalerName, ScaleFactor scale, double min, double max) {
        return new UnsupportedScaleException(String.format("%s supports scales between %s and %s, not %s", scalerName, min, max, scale));
    }
}
