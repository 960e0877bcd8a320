package org.netpreserve.archivescope.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;

import java.io.IOException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reads sizes like {@code 512MB}, {@code 50 GB} or {@code 1.5G} as a number of bytes
 * (binary multiples). Plain numbers are taken as bytes.
 */
public class ByteSizeDeserializer extends JsonDeserializer<Long> {
    private static final Pattern SIZE_PATTERN =
            Pattern.compile("(?i)\\s*(\\d+(?:\\.\\d+)?)\\s*([KMGT]?)(?:I?B)?\\s*");

    @Override
    public Long deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        if (parser.currentToken().isNumeric()) return parser.getLongValue();
        String text = parser.getText();
        try {
            return parse(text);
        } catch (IllegalArgumentException e) {
            throw InvalidFormatException.from(parser, e.getMessage(), text, Long.class);
        }
    }

    public static long parse(String text) {
        var matcher = SIZE_PATTERN.matcher(text);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid byte size: " + text);
        }
        double value = Double.parseDouble(matcher.group(1));
        long multiplier = switch (matcher.group(2).toUpperCase(Locale.ROOT)) {
            case "K" -> 1024L;
            case "M" -> 1024L * 1024;
            case "G" -> 1024L * 1024 * 1024;
            case "T" -> 1024L * 1024 * 1024 * 1024;
            default -> 1L;
        };
        return (long) (value * multiplier);
    }
}
