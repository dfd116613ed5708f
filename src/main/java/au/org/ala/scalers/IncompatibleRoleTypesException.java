package au.org.ala.scalers;

/**
 * Thrown when decode, project and encode roles bound together do not agree on the pixel, working or key type.
 */
public class IncompatibleRoleTypesException extends IllegalArgumentException {

    public IncompatibleRoleTypesException(String message) {
        super(message);
    }
}
