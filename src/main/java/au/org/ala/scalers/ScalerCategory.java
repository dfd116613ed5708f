package au.org.ala.scalers;

public enum ScalerCategory {
    PIXEL_ART,
    DOWNSCALER,
    RESAMPLER
}
