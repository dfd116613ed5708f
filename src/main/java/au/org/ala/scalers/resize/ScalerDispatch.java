package au.org.ala.scalers.resize;

import au.org.ala.scalers.ScalerQuality;

import java.awt.image.BufferedImage;

/**
 * Runs one configured scaler over a whole image. Only {@link Scalers} obtains these, through a
 * {@link ScalerDescriptor}; algorithms are never applied directly from outside this package.
 */
interface ScalerDispatch {

    /**
     * @param source a {@link BufferedImage#TYPE_INT_ARGB} image
     * @return a new {@link BufferedImage#TYPE_INT_ARGB} image
     */
    BufferedImage apply(BufferedImage source, ScalerQuality quality);

}
