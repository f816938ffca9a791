package org.laminar.mermaid;

import org.laminar.process.StepIds;
import org.laminar.process.models.Process;
import org.laminar.process.models.Role;
import org.laminar.process.models.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders a process as a Mermaid flowchart.
 * <p>
 * Document layout:
 * <pre>
 * flowchart TD
 *     %% process name
 *     control steps and steps outside any role
 *     subgraph role_id [Role title]
 *         steps of the role
 *     end
 *     description and note nodes
 *     edges
 *     linkStyle lines
 *     classDef noteClass ...
 *     class description and note nodes noteClass;
 * </pre>
 * Mermaid styles edges by their position in the document, so every edge is emitted through a
 * {@link LinkAccumulator} that hands out the index and records the style in the same call.
 */
public class MermaidGenerator {

    private static final Logger log = LoggerFactory.getLogger(MermaidGenerator.class);

    private static final String INDENT = "    ";
    private static final String NOTE_CLASS = "noteClass";

    public static final String NOTE_LINK_STYLE = "stroke:#d3d3d3,stroke-width:2px;";
    public static final String YES_LINK_STYLE = "stroke:#0f0,stroke-width:2px;";
    public static final String NO_LINK_STYLE = "stroke:#f00,stroke-width:2px;";
    public static final String NOTE_CLASS_DEF = "classDef " + NOTE_CLASS + " fill:#fff,stroke:#333,color:#aaaaaa;";

    enum Shape {
        CIRCLE("circle"),
        DOUBLE_CIRCLE("double-circle"),
        DIAMOND("diamond"),
        RECT("rect"),
        BRACES("braces"),
        COMMENT("comment");

        private final String mermaidName;

        Shape(String mermaidName) {
            this.mermaidName = mermaidName;
        }
    }

    public String generate(Process process) {
        return render(process).text();
    }

    /**
     * Renders the process. Transitions to steps that are not part of the process are left out
     * and reported in the result.
     */
    public MermaidDiagram render(Process process) {
        Set<String> bareIds = new HashSet<>();
        process.processSteps().forEach(step -> bareIds.add(step.strippedId()));

        Map<String, List<Step>> roleSteps = new LinkedHashMap<>();
        process.processRoles().forEach(role -> roleSteps.put(role.roleId(), new ArrayList<>()));

        List<String> lines = new ArrayList<>();
        lines.add("flowchart TD");
        if (process.processName() != null && !process.processName().isBlank()) {
            lines.add(INDENT + "%% " + process.processName());
        }

        for (Step step : process.processSteps()) {
            List<Step> lane = step.isSystemStep() || step.stepRole() == null ? null : roleSteps.get(step.stepRole());
            if (lane == null) {
                lines.add(INDENT + stepNode(step));
            } else {
                lane.add(step);
            }
        }

        for (Role role : process.processRoles()) {
            lines.add(INDENT + "subgraph " + role.roleId() + " [" + MermaidLabelHelper.subgraphTitle(role.roleTitle()) + "]");
            for (Step step : roleSteps.get(role.roleId())) {
                lines.add(INDENT + INDENT + stepNode(step));
            }
            lines.add(INDENT + "end");
        }

        List<String> auxNodeIds = new ArrayList<>();
        for (Step step : process.processSteps()) {
            if (!step.hasAnnotations()) {
                continue;
            }
            String descriptionId = descriptionId(step);
            String description = step.stepDescription() == null || step.stepDescription().isEmpty()
                    ? "Notes"
                    : step.stepDescription();
            lines.add(INDENT + node(descriptionId, Shape.BRACES, MermaidLabelHelper.sanitize(description)));
            auxNodeIds.add(descriptionId);
            for (int i = 0; i < step.stepNotes().size(); i++) {
                String noteId = noteId(step, i);
                lines.add(INDENT + node(noteId, Shape.COMMENT, MermaidLabelHelper.sanitize(step.stepNotes().get(i))));
                auxNodeIds.add(noteId);
            }
        }

        LinkAccumulator links = new LinkAccumulator();
        List<String> droppedReferences = new ArrayList<>();
        for (Step step : process.processSteps()) {
            emitLinks(step, bareIds, links, droppedReferences);
        }

        links.edges.forEach(edge -> lines.add(INDENT + edge));
        links.styles.forEach(style -> lines.add(INDENT + style));

        lines.add(INDENT + NOTE_CLASS_DEF);
        if (!auxNodeIds.isEmpty()) {
            lines.add(INDENT + "class " + String.join(",", auxNodeIds) + " " + NOTE_CLASS + ";");
        }

        if (!droppedReferences.isEmpty()) {
            log.warn("Process '{}': {} transitions point to unknown steps and were left out: {}",
                    process.processId(), droppedReferences.size(), droppedReferences);
        }
        log.debug("Rendered process '{}': {} steps, {} edges",
                process.processId(), process.processSteps().size(), links.size());

        return new MermaidDiagram(String.join("\n", lines) + "\n", links.size(), droppedReferences);
    }

    public static void writeToFile(String mermaid, Path outputPath) throws IOException {
        if (outputPath.getParent() != null) {
            Files.createDirectories(outputPath.getParent());
        }
        Files.writeString(outputPath, mermaid, StandardCharsets.UTF_8);
        log.info("Saved Mermaid chart to {}", outputPath);
    }

    /**
     * Order matters: description link, note links, next, yes, no.
     */
    private void emitLinks(Step step, Set<String> bareIds, LinkAccumulator links, List<String> droppedReferences) {
        String sourceId = step.strippedId();

        if (step.hasAnnotations()) {
            String descriptionId = descriptionId(step);
            links.add(sourceId + " -.-o " + descriptionId, NOTE_LINK_STYLE);
            for (int i = 0; i < step.stepNotes().size(); i++) {
                links.add(descriptionId + " -.-o " + noteId(step, i), NOTE_LINK_STYLE);
            }
        }

        String next = target(step, step.nextStep(), bareIds, droppedReferences);
        if (next != null) {
            links.add(sourceId + " --> " + next, null);
        }

        String yes = target(step, step.nextStepYes(), bareIds, droppedReferences);
        if (yes != null) {
            String label = MermaidLabelHelper.conditionLabel(step.yesWhen(), "yes");
            links.add(sourceId + " -->|\"" + label + "\"| " + yes, YES_LINK_STYLE);
        }

        String no = target(step, step.nextStepNo(), bareIds, droppedReferences);
        if (no != null) {
            String label = MermaidLabelHelper.conditionLabel(step.noWhen(), "no");
            links.add(sourceId + " -->|\"" + label + "\"| " + no, NO_LINK_STYLE);
        }
    }

    private static String target(Step step, String reference, Set<String> bareIds, List<String> droppedReferences) {
        if (reference == null || reference.isBlank()) {
            return null;
        }
        String bareTarget = StepIds.strip(reference);
        if (!bareIds.contains(bareTarget)) {
            droppedReferences.add(step.stepId() + " -> " + reference);
            return null;
        }
        return bareTarget;
    }

    private static String stepNode(Step step) {
        String nodeId = step.strippedId();
        if (step.isStart()) {
            return node(nodeId, Shape.CIRCLE, "Start");
        }
        if (step.isEnd()) {
            return node(nodeId, Shape.DOUBLE_CIRCLE, "End");
        }
        if (step.isAbort()) {
            return node(nodeId, Shape.DOUBLE_CIRCLE, "Abort");
        }
        String label = MermaidLabelHelper.stepLabel(step);
        return node(nodeId, step.isCondition() ? Shape.DIAMOND : Shape.RECT, label);
    }

    private static String node(String nodeId, Shape shape, String label) {
        return nodeId + "@{ shape: " + shape.mermaidName + ", label: \"" + label + "\" }";
    }

    private static String descriptionId(Step step) {
        return step.strippedId() + "_desc";
    }

    private static String noteId(Step step, int index) {
        return step.strippedId() + "_note_" + index;
    }

    /**
     * Edges of one render in emission order. The index of an edge is its position in this list,
     * so a style is always recorded against the edge it was added with.
     */
    private static final class LinkAccumulator {

        private final List<String> edges = new ArrayList<>();
        private final List<String> styles = new ArrayList<>();

        private int add(String edge, String style) {
            int index = edges.size();
            edges.add(edge);
            if (style != null) {
                styles.add("linkStyle " + index + " " + style);
            }
            return index;
        }

        private int size() {
            return edges.size();
        }
    }
}
