package au.org.ala.scalers.color;

/**
 * Mixes two working colors half and half.
 *
 * @param <W> working color
 */
@FunctionalInterface
public interface ColorLerp<W> {

    W lerp(W a, W b);

    /**
     * Channel-wise average of packed pixels, rounding halves up.
     */
    static ColorLerp<Argb8888> argb8888() {
        return (a, b) -> Argb8888.of(
                (a.getAlpha() + b.getAlpha() + 1) >> 1,
                (a.getRed() + b.getRed() + 1) >> 1,
                (a.getGreen() + b.getGreen() + 1) >> 1,
                (a.getBlue() + b.getBlue() + 1) >> 1);
    }

    static <C extends ColorSpace4F<C>> ColorLerp<C> componentwise() {
        return (a, b) -> a.withComponents(
                (a.getC1() + b.getC1()) * 0.5f,
                (a.getC2() + b.getC2()) * 0.5f,
                (a.getC3() + b.getC3()) * 0.5f,
                (a.getC4() + b.getC4()) * 0.5f);
    }
}
