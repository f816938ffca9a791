package org.laminar.mermaid;

import java.util.List;

/**
 * A rendered flowchart.
 *
 * @param text               the Mermaid document
 * @param emittedEdges       number of edges in the document, also the number of link indexes used
 * @param droppedReferences  "step id -> target" for transitions whose target is not a step of the process
 */
public record MermaidDiagram(String text, int emittedEdges, List<String> droppedReferences) {

    public MermaidDiagram {
        droppedReferences = droppedReferences == null ? List.of() : List.copyOf(droppedReferences);
    }
}
