package jproperties;

import lombok.Getter;

import java.util.NoSuchElementException;

@Getter
public class KeyNotFoundException extends NoSuchElementException {

    private final String key;

    public KeyNotFoundException(String key) {
        super("Key not found: " + key);
        this.key = key;
    }
}
