package work.stepweave.engine.model;

import java.util.Locale;

/**
 * How the final workflow output is produced and formatted.
 */
public record OutputSpec(Format format, String template) {
    public static final OutputSpec DEFAULT = new OutputSpec(Format.TEXT, null);

    public OutputSpec {
        format = format == null ? Format.TEXT : format;
    }

    public boolean hasTemplate() {
        return template != null && !template.isBlank();
    }

    public enum Format {
        TEXT,
        JSON,
        YAML;

        public static Format from(String value) {
            if (value == null || value.isBlank()) {
                return TEXT;
            }
            try {
                return Format.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Unsupported output format: " + value + " (expected text|json|yaml)");
            }
        }
    }
}
