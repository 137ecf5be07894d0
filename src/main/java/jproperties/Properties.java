package jproperties;

import org.apache.commons.lang3.Validate;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An ordered, editable set of Java {@code .properties} entries.
 *
 * <p>{@link #toString()} returns exactly what {@link #save(Writer)} writes. Original comments,
 * separators and whitespace are not kept; keys and values always are.
 */
public class Properties implements Iterable<String> {

    private final OrderedStore store;
    private final PropertiesFormat format;

    public Properties() {
        this(new OrderedStore(), PropertiesFormat.DEFAULT);
    }

    public Properties(Map<String, String> initial) {
        this(new OrderedStore(Validate.notNull(initial, "initial")), PropertiesFormat.DEFAULT);
    }

    private Properties(OrderedStore store, PropertiesFormat format) {
        this.store = store;
        this.format = format;
    }

    public static Properties load(Reader reader) throws IOException {
        return new Properties(new RecordParser().parse(reader), PropertiesFormat.DEFAULT);
    }

    public static Properties load(Path path) throws IOException {
        return load(path, PropertiesFormat.DEFAULT);
    }

    public static Properties load(Path path, PropertiesFormat format) throws IOException {
        Validate.notNull(path, "path");
        Validate.notNull(format, "format");
        try (BufferedReader reader = Files.newBufferedReader(path, format.getCharset())) {
            return new Properties(new RecordParser().parse(reader), format);
        }
    }

    public static Properties parse(String text) {
        return new Properties(new JavaPropertiesMapper().toStore(text), PropertiesFormat.DEFAULT);
    }

    /**
     * Returns a view over the same entries that saves with the given format.
     */
    public Properties withFormat(PropertiesFormat format) {
        return new Properties(store, Validate.notNull(format, "format"));
    }

    public void save(Writer writer) throws IOException {
        new Serializer(format).write(store, writer);
    }

    public void save(Path path) throws IOException {
        Validate.notNull(path, "path");
        try (BufferedWriter writer = Files.newBufferedWriter(path, format.getCharset())) {
            save(writer);
        }
    }

    public PropertiesFormat getFormat() {
        return format;
    }

    public String get(String key) {
        return store.get(key);
    }

    public Optional<String> find(String key) {
        return store.find(key);
    }

    public String getOrDefault(String key, String defaultValue) {
        return store.getOrDefault(key, defaultValue);
    }

    public String set(String key, String value) {
        return store.set(key, value);
    }

    public String delete(String key) {
        return store.delete(key);
    }

    public boolean contains(String key) {
        return store.contains(key);
    }

    public int size() {
        return store.size();
    }

    public boolean isEmpty() {
        return store.isEmpty();
    }

    public void clear() {
        store.clear();
    }

    public void update(Map<String, String> other) {
        store.update(other);
    }

    public void update(Properties other) {
        store.update(Validate.notNull(other, "other").store);
    }

    public List<String> keys() {
        return store.keys();
    }

    public List<Map.Entry<String, String>> items() {
        return store.items();
    }

    public Map<String, String> toMap() {
        return store.toMap();
    }

    @Override
    public Iterator<String> iterator() {
        return store.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Properties)) {
            return false;
        }
        return store.equals(((Properties) o).store);
    }

    @Override
    public int hashCode() {
        return store.hashCode();
    }

    @Override
    public String toString() {
        return new JavaPropertiesMapper(format).toText(store);
    }
}
