package jproperties;

import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class Serializer {

    private static final Logger log = LoggerFactory.getLogger(Serializer.class);

    private final PropertiesFormat format;

    public Serializer() {
        this(PropertiesFormat.DEFAULT);
    }

    public Serializer(PropertiesFormat format) {
        this.format = Validate.notNull(format, "format");
    }

    public List<String> lines(OrderedStore store) {
        Validate.notNull(store, "store");
        List<String> lines = new ArrayList<>(store.size());
        for (Map.Entry<String, String> item : store.items()) {
            lines.add(EscapeCodec.encodeKey(item.getKey(), format.isEscapeUnicode())
                    + format.getSeparator()
                    + EscapeCodec.encodeValue(item.getValue(), format.isEscapeUnicode()));
        }
        return lines;
    }

    public void write(OrderedStore store, Writer writer) throws IOException {
        Validate.notNull(writer, "writer");
        List<String> lines = lines(store);
        for (String line : lines) {
            writer.write(line);
            writer.write(format.getLineSeparator());
        }
        writer.flush();
        log.debug("Wrote {} records", lines.size());
    }

    public String toText(OrderedStore store) {
        StringWriter out = new StringWriter();
        try {
            write(store, out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }
}
