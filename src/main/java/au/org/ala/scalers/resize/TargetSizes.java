package au.org.ala.scalers.resize;

import au.org.ala.scalers.Dimension;

import java.util.List;

/**
 * Lists the output sizes a discrete scaler can produce from a source of the given size.
 */
@FunctionalInterface
public interface TargetSizes {

    List<Dimension> possibleTargets(int sourceWidth, int sourceHeight);

}
