package at.sv.astro.sun;

/**
 * Thrown if a sun event expression names an unknown event or has a malformed offset.
 */
public class InvalidSunEventExpression extends RuntimeException {
    public InvalidSunEventExpression(String message) {
        super(message);
    }
}
