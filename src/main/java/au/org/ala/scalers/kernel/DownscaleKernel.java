package au.org.ala.scalers.kernel;

import au.org.ala.scalers.color.ColorSpace4F;
import au.org.ala.scalers.color.Encode;

/**
 * Reduces one {@code ratioX x ratioY} block of source pixels to a single output pixel.
 */
public interface DownscaleKernel<W extends ColorSpace4F<W>, K, P, E extends Encode<W, P>> {

    int getRatioX();

    int getRatioY();

    /**
     * @param sourceX left column of the block
     * @param sourceY top row of the block
     */
    P average(NeighborFrame<W, K> frame, int sourceX, int sourceY, E encoder);

}
