package org.laminar;

import org.laminar.config.LaminarSettings;
import org.laminar.config.SettingsHelper;
import org.laminar.excel.PoiTableReader;
import org.laminar.extraction.BatchExtractionResult;
import org.laminar.extraction.ExtractionPolicy;
import org.laminar.extraction.ExtractionResult;
import org.laminar.extraction.OracleExtractionStrategy;
import org.laminar.extraction.ProcessExtractor;
import org.laminar.extraction.SheetOutcome;
import org.laminar.extraction.TemplateExtractionStrategy;
import org.laminar.mermaid.MermaidDiagram;
import org.laminar.mermaid.MermaidGenerator;
import org.laminar.oracle.ChatModelExtractionOracle;
import org.laminar.oracle.OracleException;
import org.laminar.process.ProcessGraphHelper;
import org.laminar.process.ProcessJsonHelper;
import org.laminar.process.models.Process;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/**
 * Converts a workbook into one process JSON and one Mermaid flowchart per sheet.
 * <p>
 * Usage: {@code laminar <workbook.xlsx | process.json> [-o <dir>] [--images <dir>] [--force-ai | --force-template]}
 * <p>
 * A {@code .json} input is read as a process document and only rendered.
 * <p>
 * Exit codes: 0 when every sheet was converted, 1 when a sheet or the input failed, 2 for invalid
 * arguments or configuration.
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final String USAGE = "Usage: laminar <workbook.xlsx | process.json> [-o <dir>] [--images <dir>]"
            + " [--force-ai | --force-template]";

    // ------ Inputs
    private final Path inputPath;
    private final Path outputDir;
    private final Path imageDir;
    private final ExtractionPolicy policy;
    private final LaminarSettings settings;

    // ------ Services
    private final MermaidGenerator mermaidGenerator = new MermaidGenerator();

    public Main(Path inputPath, Path outputDir, Path imageDir, ExtractionPolicy policy, LaminarSettings settings) {
        this.inputPath = inputPath;
        this.outputDir = outputDir;
        this.imageDir = imageDir;
        this.policy = policy;
        this.settings = settings;
    }

    /**
     * @return true if every sheet was converted
     */
    public boolean run() throws IOException {
        if (isJsonFile(inputPath)) {
            Process process = ProcessJsonHelper.loadFromFile(inputPath);
            writeArtifacts(process);
            return true;
        }
        if (!PoiTableReader.isExcelFile(inputPath)) {
            throw new IllegalArgumentException(unsupportedInput(inputPath));
        }

        ProcessExtractor extractor = new ProcessExtractor(
                new PoiTableReader(),
                policy,
                new TemplateExtractionStrategy(),
                createOracleStrategy());

        BatchExtractionResult batch = extractor.extractAll(inputPath);
        for (SheetOutcome outcome : batch.successes()) {
            writeArtifacts(outcome.result().process());
            logOutcome(outcome.result());
        }
        for (SheetOutcome outcome : batch.failures()) {
            log.error("Sheet '{}' not converted: {}", outcome.sheetName(), outcome.error());
        }

        log.info("Converted {} of {} sheets, output saved to {}",
                batch.successes().size(), batch.outcomes().size(), outputDir);
        return batch.isSuccess();
    }

    private OracleExtractionStrategy createOracleStrategy() {
        if (policy == ExtractionPolicy.FORCE_TEMPLATE) {
            return null;
        }
        try {
            return new OracleExtractionStrategy(ChatModelExtractionOracle.fromSettings(settings), imageDir);
        } catch (OracleException e) {
            log.warn("Extraction oracle unavailable ({}): {}", e.getReason(), e.getMessage());
            return null;
        }
    }

    private void writeArtifacts(Process process) throws IOException {
        List<String> duplicates = ProcessGraphHelper.findDuplicateStepIds(process);
        if (!duplicates.isEmpty()) {
            log.warn("Process '{}' has duplicate step ids: {}", process.processId(), duplicates);
        }
        ProcessGraphHelper.findUnknownRoleReferences(process).forEach((stepId, roleId) ->
                log.warn("Step '{}' references unknown role '{}', it is drawn outside the swimlanes", stepId, roleId));

        String baseName = process.processName().isBlank() ? process.processId() : process.processName();
        Path jsonPath = outputDir.resolve(baseName + "_process.json");
        Path mermaidPath = outputDir.resolve(baseName + "_flowchart.mmd");

        ProcessJsonHelper.writeToFile(process, jsonPath);
        MermaidDiagram diagram = mermaidGenerator.render(process);
        MermaidGenerator.writeToFile(diagram.text(), mermaidPath);
        log.info("Generated {} and {}", jsonPath.getFileName(), mermaidPath.getFileName());
    }

    private static void logOutcome(ExtractionResult result) {
        if (result.referenceStats().dropped() > 0) {
            log.warn("Process '{}': {} transitions could not be resolved: {}",
                    result.process().processId(), result.referenceStats().dropped(),
                    result.referenceStats().droppedReferences());
        }
    }

    public static void main(String[] args) {
        LaminarSettings settings;
        try {
            settings = SettingsHelper.loadSettings();
        } catch (IllegalArgumentException | IllegalStateException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            System.exit(EXIT_USAGE);
            return;
        }
        System.exit(execute(args, settings));
    }

    /**
     * Parses the command line and converts the input.
     *
     * @return {@link #EXIT_OK}, {@link #EXIT_FAILED} when a sheet or the input could not be converted,
     * {@link #EXIT_USAGE} for invalid arguments
     */
    static int execute(String[] args, LaminarSettings settings) {
        Main main;
        try {
            main = fromArgs(args, settings);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return EXIT_USAGE;
        }

        try {
            return main.run() ? EXIT_OK : EXIT_FAILED;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Conversion of {} failed: {}", main.inputPath, e.getMessage());
            return EXIT_FAILED;
        }
    }

    /**
     * @throws IllegalArgumentException for unknown options, missing values, conflicting flags,
     *                                  an unsupported input file or an unknown extraction policy
     */
    static Main fromArgs(String[] args, LaminarSettings settings) {
        Path input = null;
        Path output = Paths.get(settings.outputDir);
        Path images = null;
        boolean forceAi = false;
        boolean forceTemplate = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "-o", "--output" -> output = Paths.get(requireValue(args, ++i, "--output"));
                case "--images" -> images = Paths.get(requireValue(args, ++i, "--images"));
                case "--force-ai" -> forceAi = true;
                case "--force-template" -> forceTemplate = true;
                default -> {
                    if (args[i].startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + args[i]);
                    }
                    if (input != null) {
                        throw new IllegalArgumentException("Only one input file is supported, got "
                                + input + " and " + args[i]);
                    }
                    input = Paths.get(args[i]);
                }
            }
        }
        if (input == null) {
            throw new IllegalArgumentException("Missing input file");
        }
        if (!isJsonFile(input) && !PoiTableReader.isExcelFile(input)) {
            throw new IllegalArgumentException(unsupportedInput(input));
        }

        ExtractionPolicy policy = forceAi || forceTemplate
                ? ExtractionPolicy.fromFlags(forceAi, forceTemplate)
                : ExtractionPolicy.parse(settings.extractionPolicy);

        return new Main(input, output, images, policy, settings);
    }

    private static boolean isJsonFile(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json");
    }

    private static String unsupportedInput(Path input) {
        return "Unsupported input file: " + input + " (expected " + PoiTableReader.EXCEL_EXTENSIONS + " or .json)";
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length || args[index].startsWith("-")) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }
}
