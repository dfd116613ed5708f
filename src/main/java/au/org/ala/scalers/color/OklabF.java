package au.org.ala.scalers.color;

/**
 * Oklab lightness and chroma plus alpha. Only used as a key color, where euclidean distance approximates
 * perceived difference.
 */
public final class OklabF {

    private final float lightness;
    private final float a;
    private final float b;
    private final float alpha;

    public OklabF(float lightness, float a, float b, float alpha) {
        this.lightness = lightness;
        this.a = a;
        this.b = b;
        this.alpha = alpha;
    }

    public float getLightness() {
        return lightness;
    }

    public float getA() {
        return a;
    }

    public float getB() {
        return b;
    }

    public float getAlpha() {
        return alpha;
    }

    /**
     * Euclidean distance over lightness and chroma; alpha is ignored.
     */
    public float distanceTo(OklabF other) {
        float dl = lightness - other.lightness;
        float da = a - other.a;
        float db = b - other.b;
        return (float) Math.sqrt(dl * dl + da * da + db * db);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OklabF)) return false;
        OklabF that = (OklabF) o;
        return Float.compare(lightness, that.lightness) == 0 && Float.compare(a, that.a) == 0
                && Float.compare(b, that.b) == 0 && Float.compare(alpha, that.alpha) == 0;
    }

    @Override
    public int hashCode() {
        int result = Float.hashCode(lightness);
        result = 31 * result + Float.hashCode(a);
        result = 31 * result + Float.hashCode(b);
        return 31 * result + Float.hashCode(alpha);
    }

    @Override
    public String toString() {
        return "OklabF{" + lightness + ", " + a + ", " + b + ", " + alpha + '}';
    }
}
