package kubi.core.model.common;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Parser for token lifetime strings.
 *
 * <p>Accepts Go-style durations made of one or more number/unit pairs
 * ({@code 4h}, {@code 1h30m}, {@code 2s}, {@code 500ms}, units {@code h m s ms})
 * as well as ISO-8601 durations ({@code PT4H}).
 */
public final class TokenLifetime {

    private static final Pattern SEGMENTS = Pattern.compile("(?:\\d+(?:ms|h|m|s))+");
    private static final Pattern SEGMENT = Pattern.compile("(\\d+)(ms|h|m|s)");

    private TokenLifetime() {}

    /**
     * Parse a lifetime.
     *
     * @param value the lifetime string
     * @return the parsed, strictly positive duration
     * @throws IllegalArgumentException if the value is blank, malformed, not positive or has a sub-second part
     */
    public static Duration parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Token lifetime cannot be blank");
        }
        final var trimmed = value.trim();
        final Duration duration;
        if (trimmed.startsWith("P") || trimmed.startsWith("p")) {
            try {
                duration = Duration.parse(trimmed);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid token lifetime: " + value, e);
            }
        } else {
            duration = parseSegments(trimmed, value);
        }

        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("Token lifetime must be positive: " + value);
        }
        // Token expiry is encoded in whole seconds
        if (duration.getNano() != 0) {
            throw new IllegalArgumentException("Token lifetime must be a whole number of seconds: " + value);
        }
        return duration;
    }

    private static Duration parseSegments(String trimmed, String original) {
        if (!SEGMENTS.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Invalid token lifetime: " + original);
        }
        var total = Duration.ZERO;
        final var matcher = SEGMENT.matcher(trimmed);
        try {
            while (matcher.find()) {
                final long amount = Long.parseLong(matcher.group(1));
                total = total.plus(
                        switch (matcher.group(2)) {
                            case "h" -> Duration.ofHours(amount);
                            case "m" -> Duration.ofMinutes(amount);
                            case "s" -> Duration.ofSeconds(amount);
                            default -> Duration.ofMillis(amount);
                        });
            }
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException("Token lifetime out of range: " + original, e);
        }
        return total;
    }
}
