package jproperties;

import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

public class RecordParser {

    private static final Logger log = LoggerFactory.getLogger(RecordParser.class);

    public OrderedStore parse(Reader reader) throws IOException {
        try {
            return parse(LineAssembler.of(reader));
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    public OrderedStore parse(String text) {
        return parse(LineAssembler.of(text));
    }

    public OrderedStore parse(Iterator<LogicalLine> lines) {
        OrderedStore store = new OrderedStore();
        int count = 0;
        for (KeyValueRecord record : records(lines)) {
            String previous = store.set(record.getKey(), record.getValue());
            if (previous != null) {
                log.debug("Key '{}' redeclared at line {}, keeping first position", record.getKey(), record.getLineNumber());
            }
            count++;
        }
        log.debug("Parsed {} records into {} keys", count, store.size());
        return store;
    }

    public List<KeyValueRecord> records(Iterator<LogicalLine> lines) {
        Validate.notNull(lines, "lines");
        List<KeyValueRecord> records = new ArrayList<>();
        while (lines.hasNext()) {
            LogicalLine line = lines.next();
            if (line.isEmpty()) {
                continue;
            }
            records.add(toRecord(line));
        }
        return records;
    }

    static KeyValueRecord toRecord(LogicalLine line) {
        SeparatorScanner.Split split = SeparatorScanner.scan(line.getContent());
        return KeyValueRecord.builder()
                .key(EscapeCodec.decode(split.getRawKey(), line.getFirstLine()).getValue())
                .value(EscapeCodec.decode(split.getRawValue(), line.getFirstLine()).getValue())
                .lineNumber(line.getFirstLine())
                .build();
    }
}
