package asciimap.core.model.render;

/**
 * Raised by a rendering engine that cannot render the given parameters.
 */
public class RenderException extends Exception {

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
