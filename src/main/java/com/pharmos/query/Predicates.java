package com.pharmos.query;

import java.util.Collection;
import java.util.Locale;
import java.util.Objects;

/**
 * Field-level checks shared by the filter inputs. An unset criterion (null)
 * always matches.
 */
public final class Predicates {

    private Predicates() {
    }

    public static boolean equalsIfSet(Object criterion, Object value) {
        return criterion == null || Objects.equals(criterion, value);
    }

    /**
     * Case-insensitive substring match.
     */
    public static boolean containsIfSet(String criterion, String value) {
        if (criterion == null || criterion.isEmpty()) {
            return true;
        }
        return value != null
            && value.toLowerCase(Locale.ROOT).contains(criterion.toLowerCase(Locale.ROOT));
    }

    public static boolean memberIfSet(String criterion, Collection<String> values) {
        return criterion == null || (values != null && values.contains(criterion));
    }

    /**
     * True when any element contains the criterion, case-insensitively.
     */
    public static boolean anyContainsIfSet(String criterion, Collection<String> values) {
        if (criterion == null || criterion.isEmpty()) {
            return true;
        }
        if (values == null) {
            return false;
        }
        for (String value : values) {
            if (containsIfSet(criterion, value)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Inclusive range check. A null value fails any bound that is set.
     */
    public static <C extends Comparable<? super C>> boolean inRange(C value, C min, C max) {
        if (min == null && max == null) {
            return true;
        }
        if (value == null) {
            return false;
        }
        if (min != null && value.compareTo(min) < 0) {
            return false;
        }
        return max == null || value.compareTo(max) <= 0;
    }

    /**
     * Free-text search: true when any of the given fields contains the term.
     * A blank term matches everything.
     */
    public static boolean matchesText(String term, String... fields) {
        if (term == null || term.isBlank()) {
            return true;
        }
        String needle = term.trim().toLowerCase(Locale.ROOT);
        for (String field : fields) {
            if (field != null && field.toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
