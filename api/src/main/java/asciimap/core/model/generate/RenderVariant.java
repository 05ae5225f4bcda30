package asciimap.core.model.generate;

/**
 * The two renderer invocations made per request.
 */
public enum RenderVariant {
    PLAIN("plain"),
    COLORIZED("ansi");

    private final String label;

    RenderVariant(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
