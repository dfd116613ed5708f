package au.org.ala.scalers.kernel;

import au.org.ala.scalers.color.ColorSpace4F;

/**
 * Weighted sum of four component colors, normalised by the total weight.
 */
public final class Accum4F<C extends ColorSpace4F<C>> {

    private C prototype;
    private float c1;
    private float c2;
    private float c3;
    private float c4;
    private float weight;

    public void addMul(C color, float w) {
        if (prototype == null) {
            prototype = color;
        }
        c1 += color.getC1() * w;
        c2 += color.getC2() * w;
        c3 += color.getC3() * w;
        c4 += color.getC4() * w;
        weight += w;
    }

    public float getWeight() {
        return weight;
    }

    /**
     * @throws IllegalStateException if nothing with a non-zero total weight was added
     */
    public C result() {
        if (prototype == null || weight == 0f) {
            throw new IllegalStateException("no weighted colors accumulated");
        }
        float inverse = 1f / weight;
        return prototype.withComponents(c1 * inverse, c2 * inverse, c3 * inverse, c4 * inverse);
    }
}
