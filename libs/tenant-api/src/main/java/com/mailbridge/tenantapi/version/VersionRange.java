package com.mailbridge.tenantapi.version;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A set of comparators joined by whitespace, all of which must hold, e.g. {@code >=3.11.7 <4}.
 * Supported operators: {@code >=}, {@code >}, {@code <=}, {@code <}, {@code =} (or none).
 */
public final class VersionRange {

    private static final Pattern COMPARATOR = Pattern.compile("^(>=|<=|>|<|=)?(.+)$");

    private final String text;
    private final List<Comparator> comparators;

    private VersionRange(String text, List<Comparator> comparators) {
        this.text = text;
        this.comparators = comparators;
    }

    /**
     * @throws IllegalArgumentException if the range is blank or a comparator is invalid
     */
    public static VersionRange parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("version range must not be blank");
        }
        List<Comparator> comparators = new ArrayList<>();
        for (String token : text.strip().split("\\s+")) {
            Matcher m = COMPARATOR.matcher(token);
            if (!m.matches()) {
                throw new IllegalArgumentException("Invalid comparator '" + token + "' in '" + text + "'");
            }
            String op = m.group(1) == null ? "=" : m.group(1);
            comparators.add(new Comparator(op, ApiVersion.parse(m.group(2))));
        }
        return new VersionRange(text.strip(), List.copyOf(comparators));
    }

    public boolean includes(ApiVersion version) {
        return comparators.stream().allMatch(c -> c.test(version));
    }

    @Override
    public String toString() {
        return text;
    }

    private record Comparator(String op, ApiVersion bound) {

        boolean test(ApiVersion version) {
            int cmp = version.compareTo(bound);
            return switch (op) {
                case ">=" -> cmp >= 0;
                case ">" -> cmp > 0;
                case "<=" -> cmp <= 0;
                case "<" -> cmp < 0;
                default -> cmp == 0;
            };
        }
    }
}
