package com.mylab.labservice.domain.lineage;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

/**
 * Follows {@code supersedes} pointers from a derived sample back to the root of its lineage.
 */
public final class LineageWalker {

    private LineageWalker() {
        // utility class
    }

    /**
     * Returns the chain from {@code start} (first) to the root (last).
     *
     * @param start  node to start from
     * @param lookup resolves a node by id
     * @throws IllegalStateException if a node is revisited or a pointer dangles
     */
    public static List<DerivedSample> walkBack(DerivedSample start, Function<UUID, Optional<DerivedSample>> lookup) {
        List<DerivedSample> chain = new ArrayList<>();
        Set<UUID> visited = new HashSet<>();
        DerivedSample current = start;
        while (current != null) {
            if (!visited.add(current.id())) {
                throw new IllegalStateException("Lineage cycle detected at derived sample " + current.id());
            }
            chain.add(current);
            UUID previousId = current.supersedesId();
            if (previousId == null) {
                break;
            }
            DerivedSample from = current;
            current = lookup.apply(previousId).orElseThrow(() -> new IllegalStateException(
                    "Derived sample %s points to missing predecessor %s".formatted(from.id(), previousId)));
        }
        return chain;
    }
}
