package au.org.ala.scalers;

/**
 * Minimal capability shared by every scaling algorithm.
 */
public interface ScalerInfo {

    ScaleFactor getScale();

}
