package org.laminar.mermaid;

import org.junit.jupiter.api.Test;
import org.laminar.process.ProcessJsonHelper;
import org.laminar.process.SystemStep;
import org.laminar.process.models.Process;
import org.laminar.process.models.Role;
import org.laminar.process.models.Step;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MermaidGeneratorTest {

    private final MermaidGenerator generator = new MermaidGenerator();

    private static Process loanReview() {
        return new Process("loan_review", "Loan review",
                List.of(new Role("officer", "Loan Officer"),
                        new Role("risk", "Risk & Compliance"),
                        new Role("idle", "Idle")),
                List.of(
                        Step.system(SystemStep.START).toBuilder().nextStep("step_1").build(),
                        Step.builder()
                                .stepId("step_1")
                                .stepRole("officer")
                                .stepTitle("Collect *documents*")
                                .stepDescription("Customer papers")
                                .stepNotes(List.of("ID card", "Payslips"))
                                .nextStep("CONDITION::2")
                                .build(),
                        Step.builder()
                                .stepId("CONDITION::2")
                                .stepRole("risk")
                                .stepTitle("Risk \"ok\"?")
                                .nextStepYes("step_3")
                                .nextStepNo("SYSTEM::ABORT")
                                .yesWhen("Score above the threshold defined by policy")
                                .build(),
                        Step.builder()
                                .stepId("step_3")
                                .stepRole("officer")
                                .stepTitle("Sign")
                                .manualSystem("CoreBanking")
                                .userCredentials("OFF_01")
                                .nextStep("SYSTEM::END")
                                .build(),
                        Step.system(SystemStep.END),
                        Step.system(SystemStep.ABORT)));
    }

    @Test
    void shouldRenderCompleteDocument() {
        String expected = String.join("\n",
                "flowchart TD",
                "    %% Loan review",
                "    START@{ shape: circle, label: \"Start\" }",
                "    END@{ shape: double-circle, label: \"End\" }",
                "    ABORT@{ shape: double-circle, label: \"Abort\" }",
                "    subgraph officer [Loan Officer]",
                "        step_1@{ shape: rect, label: \"Collect documents\" }",
                "        step_3@{ shape: rect, label: \"Sign<br/>SYSTEM CoreBanking<br/>LOGIN OFF_01\" }",
                "    end",
                "    subgraph risk [Risk and Compliance]",
                "        2@{ shape: diamond, label: \"Risk 'ok'?\" }",
                "    end",
                "    subgraph idle [Idle]",
                "    end",
                "    step_1_desc@{ shape: braces, label: \"Customer papers\" }",
                "    step_1_note_0@{ shape: comment, label: \"ID card\" }",
                "    step_1_note_1@{ shape: comment, label: \"Payslips\" }",
                "    START --> step_1",
                "    step_1 -.-o step_1_desc",
                "    step_1_desc -.-o step_1_note_0",
                "    step_1_desc -.-o step_1_note_1",
                "    step_1 --> 2",
                "    2 -->|\"Score above the threshold defi...\"| step_3",
                "    2 -->|\"no\"| ABORT",
                "    step_3 --> END",
                "    linkStyle 1 stroke:#d3d3d3,stroke-width:2px;",
                "    linkStyle 2 stroke:#d3d3d3,stroke-width:2px;",
                "    linkStyle 3 stroke:#d3d3d3,stroke-width:2px;",
                "    linkStyle 5 stroke:#0f0,stroke-width:2px;",
                "    linkStyle 6 stroke:#f00,stroke-width:2px;",
                "    classDef noteClass fill:#fff,stroke:#333,color:#aaaaaa;",
                "    class step_1_desc,step_1_note_0,step_1_note_1 noteClass;",
                "");

        MermaidDiagram diagram = generator.render(loanReview());

        assertEquals(expected, diagram.text());
        assertEquals(8, diagram.emittedEdges());
        assertTrue(diagram.droppedReferences().isEmpty());
    }

    @Test
    void shouldRenderIdenticalTextTwice() throws Exception {
        Process process;
        try (InputStream is = getClass().getClassLoader().getResourceAsStream("processes/loan_review.json")) {
            assertNotNull(is);
            process = ProcessJsonHelper.parse(new String(is.readAllBytes(), StandardCharsets.UTF_8));
        }

        assertEquals(generator.generate(process), generator.generate(process));
        assertEquals(generator.generate(process), new MermaidGenerator().generate(process));
    }

    @Test
    void shouldDropTransitionsToUnknownSteps() {
        Process process = new Process("p", "P", List.of(), List.of(
                Step.builder().stepId("step_1").stepTitle("One").nextStep("step_9").build(),
                Step.builder().stepId("CONDITION::2").stepTitle("Two?")
                        .nextStepYes("step_1").nextStepNo("missing").build()));

        MermaidDiagram diagram = generator.render(process);

        assertEquals(List.of("step_1 -> step_9", "CONDITION::2 -> missing"), diagram.droppedReferences());
        assertEquals(1, diagram.emittedEdges());
        assertFalse(diagram.text().contains("step_9"));
        assertTrue(diagram.text().contains("    linkStyle 0 stroke:#0f0,stroke-width:2px;\n"));
    }

    @Test
    void shouldResolveTargetsRegardlessOfPrefix() {
        Process process = new Process("p", "P", List.of(), List.of(
                Step.builder().stepId("step_1").stepTitle("One").nextStep("2").build(),
                Step.builder().stepId("CONDITION::2").stepTitle("Two?").nextStepYes("CONDITION::step_1").build()));

        String text = generator.generate(process);

        assertTrue(text.contains("    step_1 --> 2\n"));
        assertTrue(text.contains("    2 -->|\"yes\"| step_1\n"));
    }

    @Test
    void shouldDrawStepsWithUnknownOrMissingRoleOutsideSwimlanes() {
        Process process = new Process("p", "", List.of(new Role("clerk", "Clerk")), List.of(
                Step.builder().stepId("step_1").stepRole("auditor").stepTitle("Audit").build(),
                Step.builder().stepId("step_2").stepTitle("Loose").build(),
                Step.builder().stepId("step_3").stepRole("clerk").stepTitle("File").build()));

        String text = generator.generate(process);

        assertTrue(text.startsWith("flowchart TD\n"
                + "    step_1@{ shape: rect, label: \"Audit\" }\n"
                + "    step_2@{ shape: rect, label: \"Loose\" }\n"
                + "    subgraph clerk [Clerk]\n"
                + "        step_3@{ shape: rect, label: \"File\" }\n"
                + "    end\n"));
        assertFalse(text.contains("class "), "no annotation nodes, no class binding");
        assertTrue(text.endsWith("    classDef noteClass fill:#fff,stroke:#333,color:#aaaaaa;\n"));
    }

    @Test
    void shouldUseNotesLabelWhenStepHasOnlyNotes() {
        Process process = new Process("p", "P", List.of(), List.of(
                Step.builder().stepId("step_1").stepTitle("One").stepNotes(List.of("a & b")).build()));

        String text = generator.generate(process);

        assertTrue(text.contains("    step_1_desc@{ shape: braces, label: \"Notes\" }\n"));
        assertTrue(text.contains("    step_1_note_0@{ shape: comment, label: \"a and b\" }\n"));
    }

    @Test
    void shouldRenderEmptyProcess() {
        String text = generator.generate(new Process("empty", "Empty", List.of(), List.of()));

        assertEquals("flowchart TD\n    %% Empty\n    classDef noteClass fill:#fff,stroke:#333,color:#aaaaaa;\n", text);
    }

    @Test
    void shouldKeepBracketsOutOfSwimlaneTitles() {
        Process process = new Process("p", "", List.of(new Role("ops_eu", "Ops [EU]")), List.of(
                Step.builder().stepId("step_1").stepRole("ops_eu").stepTitle("Ship").build()));

        String text = generator.generate(process);

        assertTrue(text.contains("    subgraph ops_eu [Ops (EU)]\n"));
    }
}
