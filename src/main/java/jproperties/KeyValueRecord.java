package jproperties;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Builder
@AllArgsConstructor
@Data
public class KeyValueRecord {
    private final String key;
    private final String value;
    private final int lineNumber;
}
