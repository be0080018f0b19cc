package com.team.idletask.analyzer;

import java.util.List;

/**
 * Resolves the legacy/rich dual representation of one dependency rule group.
 * Exactly one side is active; rules read either {@link #rich()} or {@link #legacy()}.
 *
 * @param <T> rich record type
 */
public final class DependencySource<T> {

    private final List<T> rich;
    private final List<String> legacy;

    private DependencySource(List<T> rich, List<String> legacy) {
        this.rich = rich;
        this.legacy = legacy;
    }

    /** Rich data wins as soon as the scanner supplied the list, even an empty one. */
    public static <T> DependencySource<T> richWhenPresent(List<T> rich, List<String> legacy) {
        return rich != null
                ? new DependencySource<>(rich, List.of())
                : new DependencySource<>(null, orEmpty(legacy));
    }

    /** Rich data wins only when it has at least one entry. */
    public static <T> DependencySource<T> richWhenNonEmpty(List<T> rich, List<String> legacy) {
        return rich != null && !rich.isEmpty()
                ? new DependencySource<>(rich, List.of())
                : new DependencySource<>(null, orEmpty(legacy));
    }

    public boolean isRich() {
        return rich != null;
    }

    public List<T> rich() {
        return rich != null ? rich : List.of();
    }

    public List<String> legacy() {
        return legacy;
    }

    private static List<String> orEmpty(List<String> list) {
        return list != null ? list : List.of();
    }
}
