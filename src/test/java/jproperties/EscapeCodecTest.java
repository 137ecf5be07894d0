package jproperties;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EscapeCodecTest {

    @Test
    void decodesControlEscapes() {
        assertEquals("\f", EscapeCodec.decode("\\f", 1).getValue());
        assertEquals("\n", EscapeCodec.decode("\\n", 1).getValue());
        assertEquals("\r", EscapeCodec.decode("\\r", 1).getValue());
        assertEquals("\t", EscapeCodec.decode("\\t", 1).getValue());
    }

    @Test
    void dropsBackslashBeforeOrdinaryCharacters() {
        assertEquals("z", EscapeCodec.decode("\\z", 1).getValue());
        assertEquals("'single quotes'", EscapeCodec.decode("\\'single quotes'", 1).getValue());
        assertEquals("\"double quotes\"", EscapeCodec.decode("\\\"double quotes\"", 1).getValue());
        assertEquals("http://example.org/?foo=bar", EscapeCodec.decode("http\\://example.org/?foo\\=bar", 1).getValue());
        assertEquals("a\\b", EscapeCodec.decode("a\\\\b", 1).getValue());
        assertEquals("# !", EscapeCodec.decode("\\#\\ \\!", 1).getValue());
    }

    @Test
    void decodesUnicodeEscapes() {
        assertEquals("A", EscapeCodec.decode("\\u0041", 1).getValue());
        assertEquals("été", EscapeCodec.decode("\\u00E9t\\u00e9", 1).getValue());
        assertEquals("€1", EscapeCodec.decode("\\u20ac1", 1).getValue());
    }

    @Test
    void danglingBackslashIsIgnoredAndNotConsumed() {
        var decoded = EscapeCodec.decode("abc\\", 1);
        assertEquals("abc", decoded.getValue());
        assertEquals(3, decoded.getConsumed());

        var full = EscapeCodec.decode("a\\tb", 1);
        assertEquals(4, full.getConsumed());
    }

    @Test
    void shortUnicodeEscapeFails() {
        var e = assertThrows(PropertiesParseException.class, () -> EscapeCodec.decode("x\\u12", 7));
        assertEquals(ParseErrorKind.MALFORMED_UNICODE_ESCAPE, e.getKind());
        assertEquals(7, e.getLineNumber());
    }

    @Test
    void nonHexUnicodeEscapeFails() {
        var e = assertThrows(PropertiesParseException.class, () -> EscapeCodec.decode("\\uXYZW", 3));
        assertEquals(ParseErrorKind.MALFORMED_UNICODE_ESCAPE, e.getKind());
        assertEquals(3, e.getLineNumber());
    }

    @Test
    void encodesKeySeparatorsEverywhere() {
        assertEquals("key\\:with\\:colons", EscapeCodec.encodeKey("key:with:colons", false));
        assertEquals("key\\=with\\=equals", EscapeCodec.encodeKey("key=with=equals", false));
        assertEquals("key\\ with\\ spaces", EscapeCodec.encodeKey("key with spaces", false));
        assertEquals("key\\twith\\ttabs", EscapeCodec.encodeKey("key\twith\ttabs", false));
        assertEquals("back\\\\slash", EscapeCodec.encodeKey("back\\slash", false));
    }

    @Test
    void encodesLeadingCommentMarkerInKey() {
        assertEquals("\\#hash", EscapeCodec.encodeKey("#hash", false));
        assertEquals("\\!bang#!", EscapeCodec.encodeKey("!bang#!", false));
    }

    @Test
    void encodesOnlyAmbiguousCharactersInValue() {
        assertEquals("http://example.org/?foo=bar", EscapeCodec.encodeValue("http://example.org/?foo=bar", false));
        assertEquals("two words ", EscapeCodec.encodeValue("two words ", false));
        assertEquals("\\ leading", EscapeCodec.encodeValue(" leading", false));
        assertEquals("\\=x", EscapeCodec.encodeValue("=x", false));
        assertEquals("\\:x", EscapeCodec.encodeValue(":x", false));
        assertEquals("\\f\\n\\r\\t", EscapeCodec.encodeValue("\f\n\r\t", false));
        assertEquals("", EscapeCodec.encodeValue("", false));
    }

    @Test
    void escapesNonAsciiOnlyWhenAsked() {
        assertEquals("café", EscapeCodec.encodeValue("café", false));
        assertEquals("caf\\u00E9", EscapeCodec.encodeValue("café", true));
        assertEquals("\\u20AC", EscapeCodec.encodeKey("€", true));
    }

    @Test
    void controlCharactersSurviveEncodeThenDecode() {
        var value = "a\fb\nc\rd\te\\";
        var encoded = EscapeCodec.encodeValue(value, false);
        assertEquals(value, EscapeCodec.decode(encoded, 1).getValue());
    }
}
