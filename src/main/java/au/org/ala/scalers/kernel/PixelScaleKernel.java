package au.org.ala.scalers.kernel;

import au.org.ala.scalers.color.Encode;

/**
 * Expands one source pixel into a {@code scaleX x scaleY} block of the target, usually by comparing key colors of
 * its neighbours.
 */
public interface PixelScaleKernel<W, K, P, E extends Encode<W, P>> {

    /**
     * Rows within this distance of the source row are readable from the frame.
     */
    int NEIGHBOR_ROWS = 2;

    int getScaleX();

    int getScaleY();

    /**
     * Writes the block for source pixel {@code (sourceX, sourceY)}, whose top left corner in {@code target} is
     * {@code (sourceX * scaleX, sourceY * scaleY)}.
     */
    void scale(NeighborFrame<W, K> frame, int sourceX, int sourceY, PixelRaster<P> target, E encoder);

}
