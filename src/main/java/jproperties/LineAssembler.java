package jproperties;

import org.apache.commons.lang3.Validate;

import java.io.BufferedReader;
import java.io.Reader;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Joins physical lines into logical lines. Blank and comment lines are skipped, continuations
 * (odd number of trailing backslashes) are merged with the indentation of the next line removed.
 * Single pass: the underlying source is consumed once.
 */
public class LineAssembler implements Iterator<LogicalLine> {

    private final Iterator<String> physicalLines;
    private int lineNumber;
    private LogicalLine next;

    public LineAssembler(Iterator<String> physicalLines) {
        this.physicalLines = Validate.notNull(physicalLines, "physicalLines");
    }

    public static LineAssembler of(Reader reader) {
        Validate.notNull(reader, "reader");
        BufferedReader buffered = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        return new LineAssembler(buffered.lines().iterator());
    }

    public static LineAssembler of(String text) {
        Validate.notNull(text, "text");
        return new LineAssembler(text.lines().iterator());
    }

    @Override
    public boolean hasNext() {
        if (next == null) {
            next = assemble();
        }
        return next != null;
    }

    @Override
    public LogicalLine next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        LogicalLine result = next;
        next = null;
        return result;
    }

    private LogicalLine assemble() {
        while (physicalLines.hasNext()) {
            String line = stripLeading(stripTerminator(physicalLines.next()));
            lineNumber++;
            if (line.isEmpty() || isComment(line)) {
                continue;
            }
            int firstLine = lineNumber;
            StringBuilder content = new StringBuilder();
            while (endsWithContinuation(line)) {
                content.append(line, 0, line.length() - 1);
                if (!physicalLines.hasNext()) {
                    return new LogicalLine(content.toString(), firstLine, lineNumber);
                }
                line = stripLeading(stripTerminator(physicalLines.next()));
                lineNumber++;
            }
            content.append(line);
            return new LogicalLine(content.toString(), firstLine, lineNumber);
        }
        return null;
    }

    static boolean isWhitespace(char ch) {
        return ch == ' ' || ch == '\t' || ch == '\f';
    }

    private static boolean isComment(String line) {
        char first = line.charAt(0);
        return first == '#' || first == '!';
    }

    private static boolean endsWithContinuation(String line) {
        int count = 0;
        for (int i = line.length() - 1; i >= 0 && line.charAt(i) == '\\'; i--) {
            count++;
        }
        return count % 2 == 1;
    }

    private static String stripTerminator(String line) {
        if (line.endsWith("\r\n")) {
            return line.substring(0, line.length() - 2);
        }
        if (line.endsWith("\n") || line.endsWith("\r")) {
            return line.substring(0, line.length() - 1);
        }
        return line;
    }

    private static String stripLeading(String s) {
        int i = 0;
        while (i < s.length() && isWhitespace(s.charAt(i))) {
            i++;
        }
        return s.substring(i);
    }
}
