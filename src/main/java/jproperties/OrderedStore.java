package jproperties;

import org.apache.commons.lang3.Validate;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Unique keys kept in insertion order. Setting an existing key replaces its value in place.
 * Two stores are equal when they hold the same key/value pairs, whatever the order.
 * Not thread-safe.
 */
public class OrderedStore implements Iterable<String> {

    private final List<Slot> slots = new ArrayList<>();
    private final Map<String, Integer> index = new HashMap<>();
    private int modCount;

    public OrderedStore() {
    }

    public OrderedStore(Map<String, String> initial) {
        update(initial);
    }

    public String get(String key) {
        Integer pos = index.get(key);
        if (pos == null) {
            throw new KeyNotFoundException(key);
        }
        return slots.get(pos).value;
    }

    public Optional<String> find(String key) {
        Integer pos = index.get(key);
        return pos == null ? Optional.empty() : Optional.of(slots.get(pos).value);
    }

    public String getOrDefault(String key, String defaultValue) {
        return find(key).orElse(defaultValue);
    }

    /**
     * Inserts a new key at the end or updates the value of an existing key without moving it.
     *
     * @return the previous value, or {@code null} if the key was new
     */
    public String set(String key, String value) {
        Validate.notNull(key, "key");
        Validate.notNull(value, "value");
        Integer pos = index.get(key);
        if (pos != null) {
            Slot slot = slots.get(pos);
            String previous = slot.value;
            slot.value = value;
            return previous;
        }
        index.put(key, slots.size());
        slots.add(new Slot(key, value));
        modCount++;
        return null;
    }

    public String delete(String key) {
        Integer pos = index.remove(key);
        if (pos == null) {
            throw new KeyNotFoundException(key);
        }
        Slot removed = slots.remove((int) pos);
        for (int i = pos; i < slots.size(); i++) {
            index.put(slots.get(i).key, i);
        }
        modCount++;
        return removed.value;
    }

    public boolean contains(String key) {
        return index.containsKey(key);
    }

    public int size() {
        return slots.size();
    }

    public boolean isEmpty() {
        return slots.isEmpty();
    }

    public void clear() {
        slots.clear();
        index.clear();
        modCount++;
    }

    public void update(Map<String, String> other) {
        Validate.notNull(other, "other");
        for (Map.Entry<String, String> entry : other.entrySet()) {
            set(entry.getKey(), entry.getValue());
        }
    }

    public void update(OrderedStore other) {
        Validate.notNull(other, "other");
        for (Map.Entry<String, String> entry : other.items()) {
            set(entry.getKey(), entry.getValue());
        }
    }

    public List<String> keys() {
        List<String> keys = new ArrayList<>(slots.size());
        for (Slot slot : slots) {
            keys.add(slot.key);
        }
        return Collections.unmodifiableList(keys);
    }

    public List<Map.Entry<String, String>> items() {
        List<Map.Entry<String, String>> items = new ArrayList<>(slots.size());
        for (Slot slot : slots) {
            items.add(new SimpleImmutableEntry<>(slot.key, slot.value));
        }
        return Collections.unmodifiableList(items);
    }

    public Map<String, String> toMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (Slot slot : slots) {
            map.put(slot.key, slot.value);
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public Iterator<String> iterator() {
        return new Iterator<>() {
            private final int expectedModCount = modCount;
            private int cursor;

            @Override
            public boolean hasNext() {
                return cursor < slots.size();
            }

            @Override
            public String next() {
                if (modCount != expectedModCount) {
                    throw new ConcurrentModificationException();
                }
                if (cursor >= slots.size()) {
                    throw new NoSuchElementException();
                }
                return slots.get(cursor++).key;
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OrderedStore)) {
            return false;
        }
        OrderedStore other = (OrderedStore) o;
        if (size() != other.size()) {
            return false;
        }
        for (Slot slot : slots) {
            Integer pos = other.index.get(slot.key);
            if (pos == null || !slot.value.equals(other.slots.get(pos).value)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (Slot slot : slots) {
            h += Objects.hashCode(slot.key) ^ Objects.hashCode(slot.value);
        }
        return h;
    }

    @Override
    public String toString() {
        return toMap().toString();
    }

    private static final class Slot {
        final String key;
        String value;

        Slot(String key, String value) {
            this.key = key;
            this.value = value;
        }
    }
}
