package jproperties;

import lombok.Getter;

/**
 * Fatal error raised while parsing properties text. No partially built store is returned.
 */
@Getter
public class PropertiesParseException extends RuntimeException {

    private final ParseErrorKind kind;
    private final int lineNumber;

    public PropertiesParseException(ParseErrorKind kind, int lineNumber, String detail) {
        super(String.format("%s at line %d: %s", kind, lineNumber, detail));
        this.kind = kind;
        this.lineNumber = lineNumber;
    }
}
