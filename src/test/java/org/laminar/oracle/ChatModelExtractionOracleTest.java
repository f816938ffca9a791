package org.laminar.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.laminar.config.LaminarSettings;
import org.mockito.ArgumentCaptor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class ChatModelExtractionOracleTest {

    private static final String PROCESS_JSON = "{\"process_id\":\"approval\",\"process_name\":\"Approval\","
            + "\"process_roles\":[{\"role_id\":\"clerk\",\"role_title\":\"Clerk\",\"role_notes\":[]}],"
            + "\"process_steps\":[{\"step_id\":\"SYSTEM::START\",\"step_title\":\"Start\",\"next_step\":\"step_1\"},"
            + "{\"step_id\":\"step_1\",\"step_role\":\"clerk\",\"step_title\":\"File\",\"next_step\":\"SYSTEM::END\"},"
            + "{\"step_id\":\"SYSTEM::END\",\"step_title\":\"End\"}]}";

    private static final String CSV = "Step;Role;Title\n1;Clerk;File\n";

    private static ChatModel answering(String text) {
        ChatModel model = mock(ChatModel.class);
        when(model.chat(anyList())).thenReturn(ChatResponse.builder().aiMessage(AiMessage.from(text)).build());
        return model;
    }

    @SuppressWarnings("unchecked")
    private static List<ChatMessage> sentMessages(ChatModel model) {
        ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(model).chat(captor.capture());
        return captor.getValue();
    }

    @Test
    void shouldExtractJsonFromFencedBlock() throws OracleException {
        ChatModel model = answering("Here is the process:\n```json\n" + PROCESS_JSON + "\n```\nAnything else?");
        ChatModelExtractionOracle oracle = new ChatModelExtractionOracle(model);

        JsonNode document = oracle.extractProcess(CSV, "Approval", null);

        assertEquals("approval", document.get("process_id").asText());
        assertEquals(3, document.get("process_steps").size());
    }

    @Test
    void shouldSendSystemPromptAndSheetText() throws OracleException {
        ChatModel model = answering(PROCESS_JSON);

        new ChatModelExtractionOracle(model).extractProcess(CSV, "Approval", null);

        List<ChatMessage> messages = sentMessages(model);
        assertEquals(2, messages.size());
        assertTrue(((SystemMessage) messages.get(0)).text().contains("\"process_id\": \"invoice_approval\""));
        String request = ((UserMessage) messages.get(1)).singleText();
        assertTrue(request.contains("Sheet name: Approval"));
        assertTrue(request.contains(CSV));
        assertFalse(request.contains("image of the sheet is attached"));
    }

    @Test
    void shouldAttachSheetImage(@TempDir Path tempDir) throws Exception {
        Path image = tempDir.resolve("Approval.png");
        Files.write(image, new byte[]{(byte) 0x89, 'P', 'N', 'G'});
        ChatModel model = answering(PROCESS_JSON);

        new ChatModelExtractionOracle(model).extractProcess(CSV, "Approval", image);

        UserMessage request = (UserMessage) sentMessages(model).get(1);
        assertEquals(2, request.contents().size());
        ImageContent imageContent = (ImageContent) request.contents().get(1);
        assertEquals("image/png", imageContent.image().mimeType());
    }

    @Test
    void shouldAcceptJsonSurroundedByProse() throws OracleException {
        ChatModel model = answering("The process is " + PROCESS_JSON + " as requested.");

        JsonNode document = new ChatModelExtractionOracle(model).extractProcess(CSV, "Approval", null);

        assertEquals("Approval", document.get("process_name").asText());
    }

    @Test
    void shouldReportInvalidJson() {
        ChatModel model = answering("```json\n{\"process_id\": \n```");

        OracleException e = assertThrows(OracleException.class,
                () -> new ChatModelExtractionOracle(model).extractProcess(CSV, "Approval", null));
        assertEquals(OracleException.Reason.INVALID_JSON, e.getReason());
    }

    @Test
    void shouldReportDocumentsThatAreNotProcesses() {
        ChatModel model = answering("{\"answer\": 42}");

        OracleException e = assertThrows(OracleException.class,
                () -> new ChatModelExtractionOracle(model).extractProcess(CSV, "Approval", null));
        assertEquals(OracleException.Reason.SCHEMA_MISMATCH, e.getReason());
    }

    @Test
    void shouldReportEmptyResponse() {
        ChatModel model = answering("   ");

        OracleException e = assertThrows(OracleException.class,
                () -> new ChatModelExtractionOracle(model).extractProcess(CSV, "Approval", null));
        assertEquals(OracleException.Reason.EMPTY_RESPONSE, e.getReason());
    }

    @Test
    void shouldReportUpstreamFailure() {
        ChatModel model = mock(ChatModel.class);
        when(model.chat(anyList())).thenThrow(new RuntimeException("connection reset"));

        OracleException e = assertThrows(OracleException.class,
                () -> new ChatModelExtractionOracle(model).extractProcess(CSV, "Approval", null));
        assertEquals(OracleException.Reason.UPSTREAM_FAILURE, e.getReason());
        assertTrue(e.getMessage().contains("connection reset"));
    }

    @Test
    void shouldRequireApiKey() {
        LaminarSettings settings = new LaminarSettings();

        OracleException e = assertThrows(OracleException.class, () -> ChatModelExtractionOracle.fromSettings(settings));
        assertEquals(OracleException.Reason.NOT_CONFIGURED, e.getReason());
    }

    @Test
    void shouldPreferFencedBlockOverBraces() {
        assertEquals("{\"a\":1}", ChatModelExtractionOracle.extractJson("{ignored} ```\n{\"a\":1}\n```"));
        assertEquals("{\"b\":2}", ChatModelExtractionOracle.extractJson("text {\"b\":2} text"));
        assertEquals("nothing", ChatModelExtractionOracle.extractJson("  nothing "));
    }
}
