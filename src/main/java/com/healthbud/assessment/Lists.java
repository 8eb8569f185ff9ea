package com.healthbud.assessment;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

final class Lists {

    private Lists() {
    }

    /**
     * Immutable copy with null entries dropped; null becomes an empty list.
     */
    static <T> List<T> copyOrEmpty(List<T> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return values.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList());
    }
}
