package asciimap.core.model.generate;

/**
 * Result of the generate use case.
 */
public sealed interface GenerateOutcome {

    /**
     * Both required variants rendered.
     */
    record Generated(GenerateResult result) implements GenerateOutcome {}

    /**
     * The renderer rejected the parameters. No partial result is kept.
     *
     * @param variant which invocation failed
     * @param message the renderer's message
     */
    record RenderFailed(RenderVariant variant, String message) implements GenerateOutcome {

        /**
         * Client-facing description, e.g. {@code render ansi output failed: ...}.
         */
        public String describe() {
            return "render %s output failed: %s".formatted(variant.label(), message);
        }
    }
}
