package jproperties;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class LogicalLine {
    private final String content;
    private final int firstLine;
    private final int lastLine;

    public boolean isEmpty() {
        return content.isEmpty();
    }
}
