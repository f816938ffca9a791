package org.laminar.oracle;

import freemarker.template.Configuration;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Renders the text sent to the extraction oracle from a FreeMarker template on the classpath.
 */
public class OraclePromptRenderer {

    static final String TEMPLATE_DIR = "/prompts";
    public static final String REQUEST_TEMPLATE = "extraction_request.ftl";
    public static final String SYSTEM_TEMPLATE = "extraction_system.ftl";
    public static final String SAMPLE_PROCESS = "prompts/sample_process.json";

    private static final Configuration PROMPTS = createConfiguration();

    private static Configuration createConfiguration() {
        Configuration configuration = new Configuration(Configuration.VERSION_2_3_32);
        configuration.setClassForTemplateLoading(OraclePromptRenderer.class, TEMPLATE_DIR);
        configuration.setDefaultEncoding(StandardCharsets.UTF_8.name());
        // a prompt with an undefined variable must never reach the model
        configuration.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        configuration.setLogTemplateExceptions(false);
        configuration.setWrapUncheckedExceptions(true);
        return configuration;
    }

    /**
     * Instructions for the model, with the sample process document embedded.
     */
    public static String renderSystemPrompt() {
        return render(SYSTEM_TEMPLATE, Map.of("sampleProcess", loadSampleProcess()));
    }

    /**
     * The request for one sheet: its name, its CSV text and whether an image is attached.
     */
    public static String renderRequest(String sheetName, String csv, boolean withImage) {
        Map<String, Object> model = new HashMap<>();
        model.put("sheetName", sheetName);
        model.put("csv", csv);
        model.put("withImage", withImage);
        return render(REQUEST_TEMPLATE, model);
    }

    static String render(String templateName, Map<String, Object> model) {
        StringWriter prompt = new StringWriter();
        try {
            PROMPTS.getTemplate(templateName).process(model, prompt);
        } catch (TemplateException e) {
            throw new IllegalStateException("Prompt template " + templateName + " could not be rendered", e);
        } catch (IOException e) {
            throw new IllegalStateException("Prompt template " + templateName + " not found in " + TEMPLATE_DIR, e);
        }
        return prompt.toString();
    }

    private static String loadSampleProcess() {
        try (InputStream is = OraclePromptRenderer.class.getClassLoader().getResourceAsStream(SAMPLE_PROCESS)) {
            if (is == null) {
                throw new IllegalStateException("Sample process not found on classpath: " + SAMPLE_PROCESS);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read sample process: " + SAMPLE_PROCESS, e);
        }
    }
}
