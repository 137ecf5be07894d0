package jproperties;

public enum ParseErrorKind {
    MALFORMED_UNICODE_ESCAPE
}
