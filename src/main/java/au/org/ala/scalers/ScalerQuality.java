package au.org.ala.scalers;

/**
 * Speed and quality trade-off for the color blending a scaler does internally.
 */
public enum ScalerQuality {
    /** Blend in the stored, gamma encoded color space and compare pixels exactly. */
    FAST,
    /** Blend in linear light and compare pixels perceptually in Oklab. */
    HIGH_QUALITY
}
