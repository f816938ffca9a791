package org.laminar.process;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.laminar.process.models.Process;
import org.laminar.process.models.Role;
import org.laminar.process.models.Step;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads and writes processes in the process JSON format.
 * <p>
 * Example:
 * {
 * "process_id": "loan_approval",
 * "process_name": "Loan approval",
 * "process_roles": [{"role_id": "officer", "role_title": "Officer", "role_notes": []}],
 * "process_steps": [{"step_id": "SYSTEM::START", "step_title": "Start", "next_step": "step_1"}, ...]
 * }
 */
public class ProcessJsonHelper {

    public static final String SCHEMA_RESOURCE_PATH = "schemas/process.schema.json";

    static final String STEP_ID = "step_id";
    static final String STEP_ROLE = "step_role";
    static final String STEP_TITLE = "step_title";
    static final String STEP_DESCRIPTION = "step_description";
    static final String NEXT_STEP = "next_step";
    static final String NEXT_STEP_YES = "next_step_yes";
    static final String NEXT_STEP_NO = "next_step_no";
    static final String STEP_NOTES = "step_notes";
    static final String MANUAL_SYSTEM = "manual_system";
    static final String USER_CREDENTIALS = "user_role_code_user_id_user_name";
    static final String PASSWORD_INFO = "password_in_test_system";
    static final String USERS_NAME = "users_name";
    static final String PROGRAM_LOCATION = "program_id_t_code_screen_name";
    static final String YES_WHEN = "yes_when";
    static final String NO_WHEN = "no_when";

    /**
     * Step keys with a typed field on {@link Step}, in the order they are written back.
     */
    public static final List<String> RECOGNIZED_STEP_KEYS = List.of(
            STEP_ID, STEP_ROLE, STEP_TITLE, STEP_DESCRIPTION,
            NEXT_STEP, NEXT_STEP_YES, NEXT_STEP_NO, STEP_NOTES,
            MANUAL_SYSTEM, USER_CREDENTIALS, PASSWORD_INFO, USERS_NAME, PROGRAM_LOCATION,
            YES_WHEN, NO_WHEN);

    // decimals stay BigDecimal so unknown numeric attributes are written back digit for digit
    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    private static final JsonSchemaFactory factory =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static volatile JsonSchema processSchema;

    public static Process parse(String json) throws JsonProcessingException {
        return parse(mapper.readTree(json));
    }

    public static Process loadFromFile(Path jsonPath) throws IOException {
        return parse(mapper.readTree(jsonPath.toFile()));
    }

    /**
     * Builds a process from a process JSON document. Missing lists become empty lists,
     * unknown step keys are kept as additional attributes.
     *
     * @param root the process JSON document
     * @return the parsed process
     * @throws IllegalArgumentException if the root is not a JSON object
     */
    public static Process parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Process JSON must be an object");
        }

        List<Role> roles = new ArrayList<>();
        for (JsonNode roleNode : root.path("process_roles")) {
            roles.add(new Role(
                    textOrDefault(roleNode, "role_id", ""),
                    textOrDefault(roleNode, "role_title", ""),
                    textList(roleNode.get("role_notes"))));
        }

        List<Step> steps = new ArrayList<>();
        for (JsonNode stepNode : root.path("process_steps")) {
            steps.add(parseStep(stepNode));
        }

        return new Process(
                textOrDefault(root, "process_id", ""),
                textOrDefault(root, "process_name", ""),
                roles,
                steps);
    }

    private static Step parseStep(JsonNode stepNode) {
        Map<String, Object> additional = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = stepNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!RECOGNIZED_STEP_KEYS.contains(field.getKey())) {
                additional.put(field.getKey(), mapper.convertValue(field.getValue(), Object.class));
            }
        }

        return Step.builder()
                .stepId(textOrDefault(stepNode, STEP_ID, ""))
                .stepRole(textOrNull(stepNode, STEP_ROLE))
                .stepTitle(textOrDefault(stepNode, STEP_TITLE, ""))
                .stepDescription(textOrNull(stepNode, STEP_DESCRIPTION))
                .nextStep(textOrNull(stepNode, NEXT_STEP))
                .nextStepYes(textOrNull(stepNode, NEXT_STEP_YES))
                .nextStepNo(textOrNull(stepNode, NEXT_STEP_NO))
                .stepNotes(textList(stepNode.get(STEP_NOTES)))
                .manualSystem(textOrNull(stepNode, MANUAL_SYSTEM))
                .userCredentials(textOrNull(stepNode, USER_CREDENTIALS))
                .passwordInfo(textOrNull(stepNode, PASSWORD_INFO))
                .usersName(textOrNull(stepNode, USERS_NAME))
                .programLocation(textOrNull(stepNode, PROGRAM_LOCATION))
                .yesWhen(textOrNull(stepNode, YES_WHEN))
                .noWhen(textOrNull(stepNode, NO_WHEN))
                .additionalAttributes(additional)
                .build();
    }

    /**
     * Serializes a process back to the process JSON format. Typed step fields are written first
     * (nulls included), followed by the additional attributes in their original order.
     */
    public static ObjectNode toJson(Process process) {
        ObjectNode root = mapper.createObjectNode();
        root.put("process_id", process.processId());
        root.put("process_name", process.processName());

        ArrayNode rolesNode = root.putArray("process_roles");
        for (Role role : process.processRoles()) {
            ObjectNode roleNode = rolesNode.addObject();
            roleNode.put("role_id", role.roleId());
            roleNode.put("role_title", role.roleTitle());
            ArrayNode notes = roleNode.putArray("role_notes");
            role.roleNotes().forEach(notes::add);
        }

        ArrayNode stepsNode = root.putArray("process_steps");
        for (Step step : process.processSteps()) {
            ObjectNode stepNode = stepsNode.addObject();
            stepNode.put(STEP_ID, step.stepId());
            stepNode.put(STEP_ROLE, step.stepRole());
            stepNode.put(STEP_TITLE, step.stepTitle());
            stepNode.put(STEP_DESCRIPTION, step.stepDescription());
            stepNode.put(NEXT_STEP, step.nextStep());
            stepNode.put(NEXT_STEP_YES, step.nextStepYes());
            stepNode.put(NEXT_STEP_NO, step.nextStepNo());
            ArrayNode notes = stepNode.putArray(STEP_NOTES);
            step.stepNotes().forEach(notes::add);
            stepNode.put(MANUAL_SYSTEM, step.manualSystem());
            stepNode.put(USER_CREDENTIALS, step.userCredentials());
            stepNode.put(PASSWORD_INFO, step.passwordInfo());
            stepNode.put(USERS_NAME, step.usersName());
            stepNode.put(PROGRAM_LOCATION, step.programLocation());
            stepNode.put(YES_WHEN, step.yesWhen());
            stepNode.put(NO_WHEN, step.noWhen());
            for (Map.Entry<String, Object> attribute : step.additionalAttributes().entrySet()) {
                stepNode.set(attribute.getKey(), mapper.valueToTree(attribute.getValue()));
            }
        }
        return root;
    }

    public static String toJsonString(Process process) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(process));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize process: " + process.processId(), e);
        }
    }

    public static void writeToFile(Process process, Path outputPath) throws IOException {
        if (outputPath.getParent() != null) {
            Files.createDirectories(outputPath.getParent());
        }
        Files.writeString(outputPath, toJsonString(process), StandardCharsets.UTF_8);
    }

    /**
     * Validates a document against the process JSON schema.
     *
     * @param document the candidate process JSON document
     * @return the validation messages, empty if the document conforms
     */
    public static Set<ValidationMessage> validate(JsonNode document) {
        return schema().validate(document);
    }

    private static JsonSchema schema() {
        JsonSchema schema = processSchema;
        if (schema == null) {
            synchronized (ProcessJsonHelper.class) {
                schema = processSchema;
                if (schema == null) {
                    schema = loadSchema();
                    processSchema = schema;
                }
            }
        }
        return schema;
    }

    private static JsonSchema loadSchema() {
        try (InputStream schemaStream = ProcessJsonHelper.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE_PATH)) {
            if (schemaStream == null) {
                throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE_PATH);
            }
            return factory.getSchema(mapper.readTree(schemaStream));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load schema: " + SCHEMA_RESOURCE_PATH, e);
        }
    }

    private static String textOrNull(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    private static String textOrDefault(JsonNode node, String key, String defaultValue) {
        String text = textOrNull(node, key);
        return text != null ? text : defaultValue;
    }

    private static List<String> textList(JsonNode arrayNode) {
        List<String> values = new ArrayList<>();
        if (arrayNode == null || arrayNode.isNull()) {
            return values;
        }
        if (!arrayNode.isArray()) {
            values.add(arrayNode.asText());
            return values;
        }
        for (JsonNode item : arrayNode) {
            if (!item.isNull()) {
                values.add(item.asText());
            }
        }
        return values;
    }
}
