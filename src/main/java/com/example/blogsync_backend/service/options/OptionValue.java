package com.example.blogsync_backend.service.options;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single option value as delivered by a remote blog API: text, number, boolean or a nested structure.
 * Conversions never throw; a value that does not fit the requested type converts to {@link Optional#empty()}.
 * Construction rejects a {@code raw} value whose type does not match {@code kind}.
 */
public record OptionValue(Kind kind, Object raw) {

    public enum Kind {
        TEXT,
        NUMBER,
        BOOLEAN,
        STRUCTURE
    }

    public OptionValue {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(raw, "raw");
        boolean matches = switch (kind) {
            case TEXT -> raw instanceof String;
            case NUMBER -> raw instanceof Number;
            case BOOLEAN -> raw instanceof Boolean;
            case STRUCTURE -> true;
        };
        if (!matches) {
            throw new IllegalArgumentException("OPTION_KIND_MISMATCH kind=" + kind + " type=" + raw.getClass().getSimpleName());
        }
    }

    public static Optional<OptionValue> of(Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        if (raw instanceof CharSequence text) {
            return Optional.of(new OptionValue(Kind.TEXT, text.toString()));
        }
        if (raw instanceof Number) {
            return Optional.of(new OptionValue(Kind.NUMBER, raw));
        }
        if (raw instanceof Boolean) {
            return Optional.of(new OptionValue(Kind.BOOLEAN, raw));
        }
        if (raw instanceof Map<?, ?> || raw instanceof Collection<?> || raw.getClass().isArray()) {
            return Optional.of(new OptionValue(Kind.STRUCTURE, raw));
        }
        return Optional.of(new OptionValue(Kind.TEXT, raw.toString()));
    }

    /**
     * Integral value of a number or of a string-encoded integer such as {@code "5"}.
     */
    public Optional<Long> asLong() {
        return switch (kind) {
            case NUMBER -> integral((Number) raw);
            case TEXT -> parseIntegral((String) raw);
            default -> Optional.empty();
        };
    }

    /**
     * Non-blank text; numbers are rendered in their plain decimal form.
     */
    public Optional<String> asText() {
        String text = switch (kind) {
            case TEXT -> (String) raw;
            case NUMBER -> plain((Number) raw);
            default -> null;
        };
        return text != null && !text.isBlank() ? Optional.of(text) : Optional.empty();
    }

    private static Optional<Long> integral(Number number) {
        if (number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return Optional.of(number.longValue());
        }
        return parseIntegral(plain(number));
    }

    private static Optional<Long> parseIntegral(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            BigDecimal decimal = new BigDecimal(value.trim());
            return Optional.of(decimal.longValueExact());
        } catch (NumberFormatException | ArithmeticException ignored) {
            return Optional.empty();
        }
    }

    private static String plain(Number number) {
        if (number instanceof Double d && (d.isNaN() || d.isInfinite())) {
            return null;
        }
        if (number instanceof Float f && (f.isNaN() || f.isInfinite())) {
            return null;
        }
        if (number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return number.toString();
        }
        try {
            return new BigDecimal(number.toString()).stripTrailingZeros().toPlainString();
        } catch (NumberFormatException ignored) {
            return number.toString();
        }
    }
}
