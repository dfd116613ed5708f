package au.org.ala.scalers.kernel;

import au.org.ala.scalers.color.ColorSpace4F;
import au.org.ala.scalers.color.Decode;
import au.org.ala.scalers.color.Encode;
import au.org.ala.scalers.color.Project;

/**
 * Receives the concrete kernel of a {@link au.org.ala.scalers.Resampler}. The method is generic in the kernel type,
 * so implementations are classes rather than lambdas.
 *
 * @param <R> what the callback produces
 */
public interface ResampleKernelCallback<W extends ColorSpace4F<W>, K, P, D extends Decode<P, W>, J extends Project<W, K>, E extends Encode<W, P>, R> {

    <T extends ResampleKernel<W, K, P, D, J, E>> R invoke(T kernel);

}
