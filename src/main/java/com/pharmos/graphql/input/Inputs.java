package com.pharmos.graphql.input;

import com.pharmos.graphql.GraphQLException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Validation and merge helpers shared by the mutation inputs.
 * Every check throws INVALID_INPUT before any repository call is made.
 */
public final class Inputs {

    // Characters allowed in SMILES notation
    private static final Pattern SMILES_PATTERN = Pattern.compile("^[A-Za-z0-9@+\\-\\[\\]()=#$%/\\\\.:*]+$");

    private Inputs() {
    }

    public static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw GraphQLException.invalidInput(field + " is required");
        }
        return value.trim();
    }

    public static <T> T requirePresent(T value, String field) {
        if (value == null) {
            throw GraphQLException.invalidInput(field + " is required");
        }
        return value;
    }

    public static void requireNonNegative(Number value, String field) {
        if (value != null && value.doubleValue() < 0) {
            throw GraphQLException.invalidInput(field + " must not be negative");
        }
    }

    public static void requireBetween(Number value, double min, double max, String field) {
        if (value != null && (value.doubleValue() < min || value.doubleValue() > max)) {
            throw GraphQLException.invalidInput(field + " must be between " + min + " and " + max);
        }
    }

    /**
     * Reject strings with characters outside the SMILES alphabet or unbalanced
     * branches and brackets. Null passes, callers check presence separately.
     */
    public static void validateSmiles(String smiles) {
        if (smiles == null) {
            return;
        }
        if (!SMILES_PATTERN.matcher(smiles).matches()) {
            throw GraphQLException.invalidInput("smiles contains invalid characters: " + smiles);
        }
        int parens = 0;
        int brackets = 0;
        for (char c : smiles.toCharArray()) {
            if (c == '(') {
                parens++;
            } else if (c == ')') {
                parens--;
            } else if (c == '[') {
                brackets++;
            } else if (c == ']') {
                brackets--;
            }
            if (parens < 0 || brackets < 0) {
                break;
            }
        }
        if (parens != 0 || brackets != 0) {
            throw GraphQLException.invalidInput("smiles has unbalanced branches or brackets: " + smiles);
        }
    }

    /**
     * Apply {@code value} through {@code setter} unless it is null.
     */
    public static <V> void setIfPresent(V value, Consumer<V> setter) {
        if (value != null) {
            setter.accept(value);
        }
    }

    /**
     * Null-safe mutable copy, so entities never share a list with their input.
     */
    public static <V> List<V> copyOf(Collection<V> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }
}
