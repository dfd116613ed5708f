package au.org.ala.scalers.color;

/**
 * 32 bit packed ARGB pixel, the layout of {@link java.awt.image.BufferedImage#TYPE_INT_ARGB}.
 */
public final class Argb8888 {

    public static final Argb8888 TRANSPARENT = new Argb8888(0);

    private final int argb;

    private Argb8888(int argb) {
        this.argb = argb;
    }

    public static Argb8888 of(int argb) {
        return argb == 0 ? TRANSPARENT : new Argb8888(argb);
    }

    public static Argb8888 of(int alpha, int red, int green, int blue) {
        return of((clamp(alpha) << 24) | (clamp(red) << 16) | (clamp(green) << 8) | clamp(blue));
    }

    public int getArgb() {
        return argb;
    }

    public int getAlpha() {
        return argb >>> 24;
    }

    public int getRed() {
        return (argb >> 16) & 0xff;
    }

    public int getGreen() {
        return (argb >> 8) & 0xff;
    }

    public int getBlue() {
        return argb & 0xff;
    }

    static int clamp(int channel) {
        return channel < 0 ? 0 : Math.min(channel, 255);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Argb8888 && ((Argb8888) o).argb == argb);
    }

    @Override
    public int hashCode() {
        return argb;
    }

    @Override
    public String toString() {
        return String.format("#%08x", argb);
    }
}
