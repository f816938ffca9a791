package org.laminar.template;

import java.util.List;

/**
 * How many transition cells of a sheet were resolved to a step and which ones were dropped.
 *
 * @param resolved           number of non-empty transition cells that produced an edge
 * @param droppedReferences  "row title -> cell text" for cells that named no known step
 */
public record ReferenceStats(int resolved, List<String> droppedReferences) {

    public ReferenceStats {
        droppedReferences = droppedReferences == null ? List.of() : List.copyOf(droppedReferences);
    }

    public static ReferenceStats empty() {
        return new ReferenceStats(0, List.of());
    }

    public int dropped() {
        return droppedReferences.size();
    }
}
