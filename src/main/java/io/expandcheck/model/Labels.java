package io.expandcheck.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Helpers for argument labels. An absent label is {@code null} and renders as {@code _}.
 */
public final class Labels {

    public static final String UNLABELED = "_";

    private Labels() {
    }

    /**
     * Immutable copy that, unlike {@link List#copyOf}, keeps absent (null) labels.
     */
    public static List<String> copyOf(List<String> labels) {
        if (labels == null) {
            throw new IllegalArgumentException("labels cannot be null");
        }
        return Collections.unmodifiableList(new ArrayList<>(labels));
    }

    /**
     * Position-wise label match; an absent label only matches an absent label.
     */
    public static boolean matches(String expected, String actual) {
        return Objects.equals(expected, actual);
    }

    public static String display(String label) {
        return label == null ? UNLABELED : label;
    }
}
