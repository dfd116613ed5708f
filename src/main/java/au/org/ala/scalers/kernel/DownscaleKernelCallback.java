package au.org.ala.scalers.kernel;

import au.org.ala.scalers.color.ColorSpace4F;
import au.org.ala.scalers.color.Encode;

/**
 * Receives the concrete kernel of a {@link au.org.ala.scalers.Downscaler}.
 */
public interface DownscaleKernelCallback<W extends ColorSpace4F<W>, K, P, E extends Encode<W, P>, R> {

    <T extends DownscaleKernel<W, K, P, E>> R invoke(T kernel);

}
