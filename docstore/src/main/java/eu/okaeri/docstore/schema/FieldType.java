package eu.okaeri.docstore.schema;

import eu.okaeri.docstore.document.DocumentSerializer;
import lombok.NonNull;

import java.time.Instant;

/**
 * Value type of a declared document field. Converts between stored/query values and their
 * textual form, used by cursors and query parameter binding.
 */
public enum FieldType {

    INTEGER {
        @Override
        public Object parse(@NonNull String text) {
            return Long.parseLong(text.trim());
        }

        @Override
        protected String formatValue(@NonNull Object value) {
            if (value instanceof Number) {
                return String.valueOf(((Number) value).longValue());
            }
            return String.valueOf(Long.parseLong(String.valueOf(value)));
        }
    },

    FLOAT {
        @Override
        public Object parse(@NonNull String text) {
            return Double.parseDouble(text.trim());
        }

        @Override
        protected String formatValue(@NonNull Object value) {
            if (value instanceof Number) {
                return String.valueOf(((Number) value).doubleValue());
            }
            return String.valueOf(Double.parseDouble(String.valueOf(value)));
        }
    },

    BOOLEAN {
        @Override
        public Object parse(@NonNull String text) {
            if ("true".equalsIgnoreCase(text)) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(text)) {
                return Boolean.FALSE;
            }
            throw new IllegalArgumentException("invalid boolean: " + text);
        }

        @Override
        protected String formatValue(@NonNull Object value) {
            return String.valueOf(this.parse(String.valueOf(value)));
        }
    },

    TIMESTAMP {
        @Override
        public Object parse(@NonNull String text) {
            return DocumentSerializer.parseInstant(text);
        }

        @Override
        protected String formatValue(@NonNull Object value) {
            Instant instant = (value instanceof Instant) ? (Instant) value : DocumentSerializer.parseInstant(String.valueOf(value));
            return DocumentSerializer.formatInstant(instant);
        }
    },

    IDENTIFIER {
        @Override
        public Object parse(@NonNull String text) {
            if (text.isEmpty()) {
                throw new IllegalArgumentException("identifier cannot be empty");
            }
            return text;
        }

        @Override
        protected String formatValue(@NonNull Object value) {
            return String.valueOf(value);
        }
    },

    STRING {
        @Override
        public Object parse(@NonNull String text) {
            return text;
        }

        @Override
        protected String formatValue(@NonNull Object value) {
            return String.valueOf(value);
        }
    };

    /**
     * @throws IllegalArgumentException if the text is not a valid value of this type
     */
    public abstract Object parse(@NonNull String text);

    protected abstract String formatValue(@NonNull Object value);

    /**
     * Formats a stored or typed value, null stays null.
     *
     * @throws IllegalArgumentException if the value is not of this type
     */
    public String format(Object value) {
        return (value == null) ? null : this.formatValue(value);
    }
}
