package org.netpreserve.archivescope.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reads durations written as {@code 500ms}, {@code 30s}, {@code 15m}, {@code 24h}, {@code 7d}
 * or ISO-8601 ({@code PT1H30M}). Plain numbers are taken as seconds.
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {
    private static final Pattern SIMPLE = Pattern.compile("(?i)\\s*(\\d+)\\s*(ms|s|m|h|d)\\s*");

    @Override
    public Duration deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        if (parser.currentToken().isNumeric()) return Duration.ofSeconds(parser.getLongValue());
        String text = parser.getText();
        try {
            return parse(text);
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw InvalidFormatException.from(parser, "Invalid duration: " + text, text, Duration.class);
        }
    }

    public static Duration parse(String text) {
        var matcher = SIMPLE.matcher(text);
        if (matcher.matches()) {
            long amount = Long.parseLong(matcher.group(1));
            return switch (matcher.group(2).toLowerCase(Locale.ROOT)) {
                case "ms" -> Duration.ofMillis(amount);
                case "s" -> Duration.ofSeconds(amount);
                case "m" -> Duration.ofMinutes(amount);
                case "h" -> Duration.ofHours(amount);
                default -> Duration.ofDays(amount);
            };
        }
        String upper = text.trim().toUpperCase(Locale.ROOT);
        return Duration.parse(upper.startsWith("P") ? upper : "PT" + upper);
    }
}
