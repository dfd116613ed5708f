package au.org.ala.scalers.color;

/**
 * A four component float color that kernels can accumulate and blend without knowing its concrete type.
 *
 * @param <C> the implementing type
 */
public interface ColorSpace4F<C extends ColorSpace4F<C>> {

    float getC1();

    float getC2();

    float getC3();

    float getC4();

    /**
     * Creates a color of the same space from raw components.
     */
    C withComponents(float c1, float c2, float c3, float c4);

}
