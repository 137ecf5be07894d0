package jproperties;

import lombok.AllArgsConstructor;
import lombok.Data;
import org.apache.commons.lang3.Validate;

public final class EscapeCodec {

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private EscapeCodec() {
    }

    public static Decoded decode(String raw, int lineNumber) {
        Validate.notNull(raw, "raw");
        int len = raw.length();
        StringBuilder out = new StringBuilder(len);
        int i = 0;
        while (i < len) {
            char ch = raw.charAt(i);
            if (ch != '\\') {
                out.append(ch);
                i++;
                continue;
            }
            if (i + 1 >= len) {
                break;
            }
            char next = raw.charAt(i + 1);
            i += 2;
            switch (next) {
                case 'f':
                    out.append('\f');
                    break;
                case 'n':
                    out.append('\n');
                    break;
                case 'r':
                    out.append('\r');
                    break;
                case 't':
                    out.append('\t');
                    break;
                case 'u':
                    out.append(readUnicode(raw, i, lineNumber));
                    i += 4;
                    break;
                default:
                    out.append(next);
                    break;
            }
        }
        return new Decoded(out.toString(), i);
    }

    public static String encodeKey(String key, boolean escapeUnicode) {
        Validate.notNull(key, "key");
        StringBuilder out = new StringBuilder(key.length() * 2);
        for (int i = 0; i < key.length(); i++) {
            char ch = key.charAt(i);
            switch (ch) {
                case ' ':
                case '=':
                case ':':
                    out.append('\\').append(ch);
                    break;
                case '#':
                case '!':
                    if (i == 0) {
                        out.append('\\');
                    }
                    out.append(ch);
                    break;
                default:
                    appendCommon(out, ch, escapeUnicode);
                    break;
            }
        }
        return out.toString();
    }

    public static String encodeValue(String value, boolean escapeUnicode) {
        Validate.notNull(value, "value");
        StringBuilder out = new StringBuilder(value.length() * 2);
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (i == 0 && (ch == ' ' || ch == '=' || ch == ':')) {
                out.append('\\').append(ch);
            } else {
                appendCommon(out, ch, escapeUnicode);
            }
        }
        return out.toString();
    }

    private static void appendCommon(StringBuilder out, char ch, boolean escapeUnicode) {
        switch (ch) {
            case '\\':
                out.append("\\\\");
                break;
            case '\f':
                out.append("\\f");
                break;
            case '\n':
                out.append("\\n");
                break;
            case '\r':
                out.append("\\r");
                break;
            case '\t':
                out.append("\\t");
                break;
            default:
                if (escapeUnicode && (ch < 0x0020 || ch > 0x007e)) {
                    out.append("\\u")
                            .append(HEX[(ch >> 12) & 0xF])
                            .append(HEX[(ch >> 8) & 0xF])
                            .append(HEX[(ch >> 4) & 0xF])
                            .append(HEX[ch & 0xF]);
                } else {
                    out.append(ch);
                }
                break;
        }
    }

    private static char readUnicode(String raw, int start, int lineNumber) {
        if (start + 4 > raw.length()) {
            throw new PropertiesParseException(ParseErrorKind.MALFORMED_UNICODE_ESCAPE, lineNumber,
                    "expected 4 hex digits after \\u, got \"" + raw.substring(start) + "\"");
        }
        int code = 0;
        for (int i = start; i < start + 4; i++) {
            int digit = hexValue(raw.charAt(i));
            if (digit < 0) {
                throw new PropertiesParseException(ParseErrorKind.MALFORMED_UNICODE_ESCAPE, lineNumber,
                        "invalid hex digit in \\u" + raw.substring(start, start + 4));
            }
            code = (code << 4) | digit;
        }
        return (char) code;
    }

    private static int hexValue(char ch) {
        if (ch >= '0' && ch <= '9') {
            return ch - '0';
        }
        if (ch >= 'a' && ch <= 'f') {
            return ch - 'a' + 10;
        }
        if (ch >= 'A' && ch <= 'F') {
            return ch - 'A' + 10;
        }
        return -1;
    }

    /**
     * Decoded text and the number of raw characters consumed. A dangling backslash at the end is not consumed.
     */
    @Data
    @AllArgsConstructor
    public static final class Decoded {
        private final String value;
        private final int consumed;
    }
}
