package au.org.ala.scalers.color;

/**
 * The decode, project and encode roles shipped with the library.
 */
public final class ColorCodecs {

    private static final float[] SRGB_TO_LINEAR = new float[256];

    static {
        for (int i = 0; i < 256; i++) {
            double c = i / 255.0;
            SRGB_TO_LINEAR[i] = (float) (c <= 0.04045 ? c / 12.92 : Math.pow((c + 0.055) / 1.055, 2.4));
        }
    }

    private ColorCodecs() {
    }

    static float srgbToLinear(int channel) {
        return SRGB_TO_LINEAR[channel];
    }

    static int linearToSrgb(float linear) {
        if (!(linear > 0f)) {
            return 0;
        }
        if (linear >= 1f) {
            return 255;
        }
        double c = linear <= 0.0031308 ? linear * 12.92 : 1.055 * Math.pow(linear, 1 / 2.4) - 0.055;
        return (int) Math.round(c * 255.0);
    }

    static int toByte(float unit) {
        if (!(unit > 0f)) {
            return 0;
        }
        return unit >= 1f ? 255 : Math.round(unit * 255f);
    }

    /**
     * Passes colors through unchanged; decoder, projector and encoder at once.
     */
    public static final class Identity<C> implements Decode<C, C>, Project<C, C>, Encode<C, C> {

        private final Class<C> type;

        public Identity(Class<C> type) {
            this.type = type;
        }

        @Override
        public C decode(C pixel) {
            return pixel;
        }

        @Override
        public C project(C work) {
            return work;
        }

        @Override
        public C encode(C work) {
            return work;
        }

        @Override
        public Class<C> getPixelType() {
            return type;
        }

        @Override
        public Class<C> getWorkType() {
            return type;
        }

        @Override
        public Class<C> getKeyType() {
            return type;
        }
    }

    public static final class Argb8888ToRgbaF implements Decode<Argb8888, RgbaF> {

        @Override
        public RgbaF decode(Argb8888 pixel) {
            return new RgbaF(pixel.getRed() / 255f, pixel.getGreen() / 255f, pixel.getBlue() / 255f, pixel.getAlpha() / 255f);
        }

        @Override
        public Class<Argb8888> getPixelType() {
            return Argb8888.class;
        }

        @Override
        public Class<RgbaF> getWorkType() {
            return RgbaF.class;
        }
    }

    public static final class RgbaFToArgb8888 implements Encode<RgbaF, Argb8888> {

        @Override
        public Argb8888 encode(RgbaF work) {
            return Argb8888.of(toByte(work.getAlpha()), toByte(work.getRed()), toByte(work.getGreen()), toByte(work.getBlue()));
        }

        @Override
        public Class<RgbaF> getWorkType() {
            return RgbaF.class;
        }

        @Override
        public Class<Argb8888> getPixelType() {
            return Argb8888.class;
        }
    }

    /**
     * sRGB transfer curve removed through a lookup table; alpha is linear already.
     */
    public static final class Srgb32ToLinearRgbaF implements Decode<Argb8888, LinearRgbaF> {

        @Override
        public LinearRgbaF decode(Argb8888 pixel) {
            return new LinearRgbaF(srgbToLinear(pixel.getRed()), srgbToLinear(pixel.getGreen()),
                    srgbToLinear(pixel.getBlue()), pixel.getAlpha() / 255f);
        }

        @Override
        public Class<Argb8888> getPixelType() {
            return Argb8888.class;
        }

        @Override
        public Class<LinearRgbaF> getWorkType() {
            return LinearRgbaF.class;
        }
    }

    public static final class LinearRgbaFToSrgb32 implements Encode<LinearRgbaF, Argb8888> {

        @Override
        public Argb8888 encode(LinearRgbaF work) {
            return Argb8888.of(toByte(work.getAlpha()), linearToSrgb(work.getRed()),
                    linearToSrgb(work.getGreen()), linearToSrgb(work.getBlue()));
        }

        @Override
        public Class<LinearRgbaF> getWorkType() {
            return LinearRgbaF.class;
        }

        @Override
        public Class<Argb8888> getPixelType() {
            return Argb8888.class;
        }
    }

    /**
     * Björn Ottosson's linear sRGB to Oklab transform.
     */
    public static final class LinearRgbaFToOklabF implements Project<LinearRgbaF, OklabF> {

        @Override
        public OklabF project(LinearRgbaF work) {
            float r = work.getRed();
            float g = work.getGreen();
            float b = work.getBlue();

            double l = Math.cbrt(0.4122214708 * r + 0.5363325363 * g + 0.0514459929 * b);
            double m = Math.cbrt(0.2119034982 * r + 0.6806995451 * g + 0.1073969566 * b);
            double s = Math.cbrt(0.0883024619 * r + 0.2817188376 * g + 0.6299787005 * b);

            return new OklabF(
                    (float) (0.2104542553 * l + 0.7936177850 * m - 0.0040720468 * s),
                    (float) (1.9779984951 * l - 2.4285922050 * m + 0.4505937099 * s),
                    (float) (0.0259040371 * l + 0.7827717662 * m - 0.8086757660 * s),
                    work.getAlpha());
        }

        @Override
        public Class<LinearRgbaF> getWorkType() {
            return LinearRgbaF.class;
        }

        @Override
        public Class<OklabF> getKeyType() {
            return OklabF.class;
        }
    }
}
