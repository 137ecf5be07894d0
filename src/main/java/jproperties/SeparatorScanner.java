package jproperties;

import lombok.AllArgsConstructor;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

public final class SeparatorScanner {

    private SeparatorScanner() {
    }

    public static Split scan(String line) {
        Validate.notNull(line, "line");
        int limit = line.length();
        int keyEnd = 0;
        int valueStart = limit;
        boolean hasSeparator = false;
        boolean precedingBackslash = false;

        while (keyEnd < limit) {
            char ch = line.charAt(keyEnd);
            if (!precedingBackslash) {
                if (ch == '=' || ch == ':') {
                    valueStart = keyEnd + 1;
                    hasSeparator = true;
                    break;
                }
                if (LineAssembler.isWhitespace(ch)) {
                    valueStart = keyEnd + 1;
                    break;
                }
            }
            precedingBackslash = ch == '\\' && !precedingBackslash;
            keyEnd++;
        }

        while (valueStart < limit) {
            char ch = line.charAt(valueStart);
            if (!LineAssembler.isWhitespace(ch)) {
                if (hasSeparator || (ch != '=' && ch != ':')) {
                    break;
                }
                hasSeparator = true;
            }
            valueStart++;
        }

        String rawValue = valueStart < limit ? line.substring(valueStart) : StringUtils.EMPTY;
        return new Split(line.substring(0, keyEnd), rawValue);
    }

    @Data
    @AllArgsConstructor
    public static final class Split {
        private final String rawKey;
        private final String rawValue;
    }
}
