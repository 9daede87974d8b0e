package eu.okaeri.docstore.filter.renderer;

import lombok.NonNull;

/**
 * Renders strings as JSON string literals (RFC 8259).
 */
public class JsonStringRenderer implements StringRenderer {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    @Override
    public String render(@NonNull String text) {
        StringBuilder builder = new StringBuilder(text.length() + 2).append('"');
        this.escape(text, builder);
        return builder.append('"').toString();
    }

    protected void escape(@NonNull String value, @NonNull StringBuilder out) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if ((c == '"') || (c == '\\')) {
                out.append('\\').append(c);
            } else if (c == '\n') {
                out.append("\\n");
            } else if (c == '\r') {
                out.append("\\r");
            } else if (c == '\t') {
                out.append("\\t");
            } else if (c < 0x20) {
                out.append("\\u00").append(HEX[c >> 4]).append(HEX[c & 0xF]);
            } else {
                out.append(c);
            }
        }
    }
}
