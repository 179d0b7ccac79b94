package com.wiregen.core.model;

import java.util.Comparator;
import java.util.List;

/**
 * Immutable set of source units analysed in one run.
 *
 * <p>Units are kept sorted by path so that every run over the same files produces the same
 * output.
 *
 * @param units source units
 */
public record DeclarationSnapshot(List<SourceUnit> units) {

    public DeclarationSnapshot {
        units = units == null
            ? List.of()
            : units.stream().sorted(Comparator.comparing(SourceUnit::path)).toList();
    }

    public static DeclarationSnapshot of(SourceUnit... units) {
        return new DeclarationSnapshot(List.of(units));
    }

    public boolean isEmpty() {
        return units.isEmpty();
    }
}
