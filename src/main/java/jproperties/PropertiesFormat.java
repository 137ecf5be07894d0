package jproperties;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Output and file settings. Parsing accepts every separator and line terminator regardless of these.
 */
@Value
@Builder(toBuilder = true)
public class PropertiesFormat {

    public static final PropertiesFormat DEFAULT = PropertiesFormat.builder().build();

    @NonNull
    @Builder.Default
    String separator = " = ";

    @NonNull
    @Builder.Default
    String lineSeparator = "\n";

    @Builder.Default
    boolean escapeUnicode = false;

    @NonNull
    @Builder.Default
    Charset charset = StandardCharsets.UTF_8;
}
