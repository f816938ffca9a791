package org.laminar.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.ValidationMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.Content;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.laminar.config.LaminarSettings;
import org.laminar.process.ProcessJsonHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * {@link ExtractionOracle} backed by a chat model. The sheet is sent as text, optionally with an
 * image of it, and the answer is expected to contain a process JSON document, either bare or in a
 * fenced code block.
 */
public class ChatModelExtractionOracle implements ExtractionOracle {

    private static final Logger log = LoggerFactory.getLogger(ChatModelExtractionOracle.class);

    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json)?\\s*(.*?)```", Pattern.DOTALL);
    private static final int MAX_RETRIES = 2;

    private final ChatModel chatModel;

    public ChatModelExtractionOracle(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    /**
     * Creates an oracle talking to Anthropic with the configured model, token limit, temperature
     * and timeout.
     *
     * @throws OracleException with {@link OracleException.Reason#NOT_CONFIGURED} if there is no API key
     */
    public static ChatModelExtractionOracle fromSettings(LaminarSettings settings) throws OracleException {
        if (!settings.hasApiKey()) {
            throw new OracleException(OracleException.Reason.NOT_CONFIGURED,
                    "Anthropic API key not configured, set LAMINAR_ANTHROPIC_API_KEY");
        }
        ChatModel model = AnthropicChatModel.builder()
                .apiKey(settings.anthropicApiKey)
                .modelName(settings.claudeModel)
                .maxTokens(settings.claudeMaxTokens)
                .temperature(settings.claudeTemperature)
                .timeout(Duration.ofSeconds(settings.timeoutSeconds))
                .maxRetries(MAX_RETRIES)
                .build();
        return new ChatModelExtractionOracle(model);
    }

    @Override
    public JsonNode extractProcess(String csv, String sheetName, Path imagePath) throws OracleException {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(SystemMessage.from(OraclePromptRenderer.renderSystemPrompt()));
        messages.add(userMessage(csv, sheetName, imagePath));

        log.info("Requesting process extraction for sheet '{}'{}", sheetName, imagePath != null ? " with image" : "");

        ChatResponse response;
        try {
            response = chatModel.chat(messages);
        } catch (RuntimeException e) {
            throw new OracleException(OracleException.Reason.UPSTREAM_FAILURE,
                    "Chat model call failed for sheet '" + sheetName + "': " + e.getMessage(), e);
        }

        String text = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
        if (text == null || text.isBlank()) {
            throw new OracleException(OracleException.Reason.EMPTY_RESPONSE,
                    "Chat model returned an empty response for sheet '" + sheetName + "'");
        }

        JsonNode document = parseDocument(text, sheetName);
        Set<ValidationMessage> errors = ProcessJsonHelper.validate(document);
        if (!errors.isEmpty()) {
            throw new OracleException(OracleException.Reason.SCHEMA_MISMATCH,
                    "Response for sheet '" + sheetName + "' is not a process document: "
                            + errors.stream().map(ValidationMessage::getMessage).collect(Collectors.joining("; ")));
        }
        return document;
    }

    /**
     * Returns the content of the first fenced code block, or the text between the first opening and
     * the last closing brace, or the whole text.
     */
    static String extractJson(String text) {
        Matcher matcher = FENCED_BLOCK.matcher(text);
        if (matcher.find()) {
            return matcher.group(1).trim();
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return text.substring(start, end + 1);
        }
        return text.trim();
    }

    private static JsonNode parseDocument(String text, String sheetName) throws OracleException {
        JsonNode document;
        try {
            document = mapper.readTree(extractJson(text));
        } catch (JsonProcessingException e) {
            throw new OracleException(OracleException.Reason.INVALID_JSON,
                    "Response for sheet '" + sheetName + "' is not valid JSON", e);
        }
        if (document == null || !document.isObject()) {
            throw new OracleException(OracleException.Reason.SCHEMA_MISMATCH,
                    "Response for sheet '" + sheetName + "' is not a JSON object");
        }
        return document;
    }

    private static UserMessage userMessage(String csv, String sheetName, Path imagePath) throws OracleException {
        List<Content> contents = new ArrayList<>();
        contents.add(TextContent.from(OraclePromptRenderer.renderRequest(sheetName, csv, imagePath != null)));
        if (imagePath != null) {
            try {
                String base64 = Base64.getEncoder().encodeToString(Files.readAllBytes(imagePath));
                contents.add(ImageContent.from(base64, mimeType(imagePath)));
            } catch (IOException e) {
                throw new OracleException(OracleException.Reason.UPSTREAM_FAILURE,
                        "Failed to read sheet image: " + imagePath, e);
            }
        }
        return UserMessage.from(contents);
    }

    private static String mimeType(Path imagePath) {
        String name = imagePath.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".jpg") || name.endsWith(".jpeg")) {
            return "image/jpeg";
        }
        if (name.endsWith(".gif")) {
            return "image/gif";
        }
        if (name.endsWith(".webp")) {
            return "image/webp";
        }
        return "image/png";
    }
}
