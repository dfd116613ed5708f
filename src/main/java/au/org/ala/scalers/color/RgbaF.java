package au.org.ala.scalers.color;

/**
 * Gamma encoded RGBA, each component in {@code [0, 1]}.
 */
public final class RgbaF implements ColorSpace4F<RgbaF> {

    private final float red;
    private final float green;
    private final float blue;
    private final float alpha;

    public RgbaF(float red, float green, float blue, float alpha) {
        this.red = red;
        this.green = green;
        this.blue = blue;
        this.alpha = alpha;
    }

    public float getRed() {
        return red;
    }

    public float getGreen() {
        return green;
    }

    public float getBlue() {
        return blue;
    }

    public float getAlpha() {
        return alpha;
    }

    @Override
    public float getC1() {
        return red;
    }

    @Override
    public float getC2() {
        return green;
    }

    @Override
    public float getC3() {
        return blue;
    }

    @Override
    public float getC4() {
        return alpha;
    }

    @Override
    public RgbaF withComponents(float c1, float c2, float c3, float c4) {
        return new RgbaF(c1, c2, c3, c4);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RgbaF)) return false;
        RgbaF that = (RgbaF) o;
        return Float.compare(red, that.red) == 0 && Float.compare(green, that.green) == 0
                && Float.compare(blue, that.blue) == 0 && Float.compare(alpha, that.alpha) == 0;
    }

    @Override
    public int hashCode() {
        int result = Float.hashCode(red);
        result = 31 * result + Float.hashCode(green);
        result = 31 * result + Float.hashCode(blue);
        return 31 * result + Float.hashCode(alpha);
    }

    @Override
    public String toString() {
        return "RgbaF{" + red + ", " + green + ", " + blue + ", " + alpha + '}';
    }
}
