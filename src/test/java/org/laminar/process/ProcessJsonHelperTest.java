package org.laminar.process;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.ValidationMessage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.laminar.process.models.Process;
import org.laminar.process.models.Step;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ProcessJsonHelperTest {

    private static final String LOAN_REVIEW = "processes/loan_review.json";
    private static final ObjectMapper mapper = new ObjectMapper();

    private JsonNode loadResource(String path) throws Exception {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            assertNotNull(is, "missing test resource " + path);
            return mapper.readTree(is);
        }
    }

    @Test
    void shouldParseRolesAndSteps() throws Exception {
        Process process = ProcessJsonHelper.parse(loadResource(LOAN_REVIEW));

        assertEquals("loan_review", process.processId());
        assertEquals("Loan review", process.processName());
        assertEquals(2, process.processRoles().size());
        assertEquals(List.of("Branch staff"), process.processRoles().get(0).roleNotes());
        assertEquals(6, process.processSteps().size());

        Step decision = process.findStep("2");
        assertNotNull(decision);
        assertTrue(decision.isCondition());
        assertEquals("step_3", decision.nextStepYes());
        assertEquals("SYSTEM::ABORT", decision.nextStepNo());
        assertNull(decision.nextStep());

        Step sign = process.findStep("step_3");
        assertEquals("OFF_01", sign.userCredentials());
        assertEquals("test123", sign.passwordInfo());
        assertEquals("LN-SIGN", sign.programLocation());
    }

    @Test
    void shouldKeepUnknownStepKeysAsAdditionalAttributes() throws Exception {
        Process process = ProcessJsonHelper.parse(loadResource(LOAN_REVIEW));
        Step collect = process.findStep("step_1");

        Map<String, Object> attributes = collect.additionalAttributes();
        assertEquals(List.of("priority", "sla", "reviewers"), List.copyOf(attributes.keySet()));
        assertEquals("high", attributes.get("priority"));
        assertTrue(attributes.get("sla") instanceof Map);
    }

    @Test
    void shouldReproduceUnknownKeysOnSerialization() throws Exception {
        JsonNode original = loadResource(LOAN_REVIEW);
        ObjectNode written = ProcessJsonHelper.toJson(ProcessJsonHelper.parse(original));

        JsonNode originalStep = original.get("process_steps").get(1);
        JsonNode writtenStep = written.get("process_steps").get(1);
        for (String key : List.of("priority", "sla", "reviewers")) {
            assertEquals(originalStep.get(key), writtenStep.get(key), key);
        }
    }

    @Test
    void shouldKeepDecimalPrecisionOfUnknownKeys() throws Exception {
        Process process = ProcessJsonHelper.parse("{\"process_id\":\"p\",\"process_name\":\"P\","
                + "\"process_steps\":[{\"step_id\":\"step_1\",\"step_title\":\"Pay\","
                + "\"amount\":12345678901234567890.123456789,\"limits\":{\"rate\":0.1000000000000000055}}]}");

        String written = ProcessJsonHelper.toJsonString(process);

        assertTrue(written.contains("12345678901234567890.123456789"), written);
        assertTrue(written.contains("0.1000000000000000055"), written);
    }

    @Test
    void shouldWriteRecognizedKeysFirstAndInSchemaOrder() throws Exception {
        ObjectNode written = ProcessJsonHelper.toJson(ProcessJsonHelper.parse(loadResource(LOAN_REVIEW)));
        JsonNode step = written.get("process_steps").get(1);

        Iterator<String> names = step.fieldNames();
        for (String expected : ProcessJsonHelper.RECOGNIZED_STEP_KEYS) {
            assertEquals(expected, names.next());
        }
        assertEquals("priority", names.next());
        assertTrue(step.get("users_name").isNull());
    }

    @Test
    void shouldSurviveFileRoundTrip(@TempDir Path tempDir) throws Exception {
        Process process = ProcessJsonHelper.parse(loadResource(LOAN_REVIEW));
        Path file = tempDir.resolve("out/loan_review_process.json");

        ProcessJsonHelper.writeToFile(process, file);
        Process reloaded = ProcessJsonHelper.loadFromFile(file);

        assertEquals(process, reloaded);
    }

    @Test
    void shouldDefaultMissingListsToEmpty() throws Exception {
        Process process = ProcessJsonHelper.parse("{\"process_id\":\"p\",\"process_name\":\"P\","
                + "\"process_steps\":[{\"step_id\":\"step_1\",\"step_title\":\"Do\"}]}");

        assertTrue(process.processRoles().isEmpty());
        assertTrue(process.processSteps().get(0).stepNotes().isEmpty());
        assertTrue(process.processSteps().get(0).additionalAttributes().isEmpty());
    }

    @Test
    void shouldRejectNonObjectDocument() {
        assertThrows(IllegalArgumentException.class, () -> ProcessJsonHelper.parse(mapper.readTree("[1, 2]")));
    }

    @Test
    void shouldAcceptValidDocument() throws Exception {
        Set<ValidationMessage> errors = ProcessJsonHelper.validate(loadResource(LOAN_REVIEW));
        assertTrue(errors.isEmpty(), errors.toString());
    }

    @Test
    void shouldReportSchemaViolations() throws Exception {
        JsonNode missingSteps = mapper.readTree("{\"process_id\":\"p\",\"process_name\":\"P\",\"process_roles\":[]}");
        assertFalse(ProcessJsonHelper.validate(missingSteps).isEmpty());

        JsonNode wrongType = mapper.readTree("{\"process_id\":\"p\",\"process_name\":\"P\",\"process_roles\":[],"
                + "\"process_steps\":[{\"step_id\":\"s\",\"step_title\":\"T\",\"next_step\":5}]}");
        assertFalse(ProcessJsonHelper.validate(wrongType).isEmpty());
    }
}
