package com.pgbranch.capture.catalog;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A column type as the engine formats it ({@code format_type(oid, typmod)}), e.g. {@code numeric(10,2)}.
 *
 * The formatted text is what makes a captured value portable: it is valid in a {@code CAST(... AS type)}
 * on any server instance, while the oid and typmod are only meaningful on the instance that recorded them.
 */
@Getter
@EqualsAndHashCode(of = "formatted")
public final class TypeDescriptor {

    private static final String UNQUOTED_PUNCTUATION = " _.,()[]$";
    private static final Pattern MODIFIER = Pattern.compile("^(.*?)\\(([^)]*)\\)(.*)$");

    private final String formatted;
    private final Long oid;
    private final Integer typmod;

    private TypeDescriptor(String formatted, Long oid, Integer typmod) {
        this.formatted = formatted;
        this.oid = oid;
        this.typmod = typmod;
    }

    public static TypeDescriptor of(String formatted) {
        return of(formatted, null, null);
    }

    /**
     * @throws IllegalArgumentException when the text could not have come from {@code format_type}
     */
    public static TypeDescriptor of(String formatted, Long oid, Integer typmod) {
        if (formatted == null || formatted.isBlank()) {
            throw new IllegalArgumentException("Type descriptor text is empty");
        }
        String trimmed = formatted.trim();
        if (!isFormattedType(trimmed)) {
            throw new IllegalArgumentException("Not a formatted type name: " + formatted);
        }
        return new TypeDescriptor(trimmed, oid, typmod);
    }

    /**
     * Quoted identifiers may hold any character, with {@code ""} as the escaped quote. Outside them only
     * letters, digits and the punctuation of type names and modifiers appear, parentheses balanced.
     */
    static boolean isFormattedType(String text) {
        boolean quoted = false;
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
                        i++;
                    } else {
                        quoted = false;
                    }
                }
                continue;
            }
            if (c == '"') {
                quoted = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (--depth < 0) {
                    return false;
                }
            } else if (!Character.isLetterOrDigit(c) && UNQUOTED_PUNCTUATION.indexOf(c) < 0) {
                return false;
            }
        }
        return !quoted && depth == 0;
    }

    /** Type name without its modifier: {@code numeric(10,2)} gives {@code numeric}. */
    public String baseType() {
        Matcher m = MODIFIER.matcher(formatted);
        if (!m.matches()) {
            return formatted;
        }
        return (m.group(1).trim() + " " + m.group(3).trim()).trim().replace(" []", "[]");
    }

    /** Precision/scale/length modifier, e.g. {@code 10,2}; empty when the type carries none. */
    public Optional<String> modifier() {
        Matcher m = MODIFIER.matcher(formatted);
        return m.matches() ? Optional.of(m.group(2)) : Optional.empty();
    }

    public String castSql(String expression) {
        return "CAST(" + expression + " AS " + formatted + ")";
    }

    @Override
    public String toString() {
        return formatted;
    }
}
