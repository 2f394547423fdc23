package com.markrunner.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Ordered units of one batch. Position fixes identity for dispatch-by-reference,
 * it does not imply execution order.
 */
public record Manifest(String name, List<WorkUnit> units) {

    public Manifest {
        units = List.copyOf(units);
        for (int i = 0; i < units.size(); i++) {
            if (units.get(i).id() != i + 1) {
                throw new IllegalArgumentException(
                        "Manifest " + name + ": unit at position " + (i + 1) + " has ordinal " + units.get(i).id());
            }
        }
    }

    public int size() {
        return units.size();
    }

    public boolean isEmpty() {
        return units.isEmpty();
    }

    public Optional<WorkUnit> unit(int ordinal) {
        if (ordinal < 1 || ordinal > units.size()) return Optional.empty();
        return Optional.of(units.get(ordinal - 1));
    }
}
