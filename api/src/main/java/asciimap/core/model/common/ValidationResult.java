package asciimap.core.model.common;

import java.util.Locale;

import asciimap.core.model.generate.GenerateConfig;

public sealed interface ValidationResult {

    record Valid(GenerateConfig config) implements ValidationResult {}

    record Invalid(String reason) implements ValidationResult {}

    default boolean isValid() {
        return this instanceof Valid;
    }

    default boolean isInvalid() {
        return this instanceof Invalid;
    }

    static ValidationResult valid(GenerateConfig config) {
        return new Valid(config);
    }

    static ValidationResult invalid(String reason) {
        return new Invalid(reason);
    }

    static ValidationResult invalid(String format, Object... args) {
        return new Invalid(String.format(Locale.ROOT, format, args));
    }
}
