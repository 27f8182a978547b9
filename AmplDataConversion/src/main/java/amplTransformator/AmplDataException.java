package amplTransformator;

/**
 * Base class for all errors raised while reading or looking up AMPL data.
 */
public class AmplDataException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AmplDataException(String message) {
        super(message);
    }
}
