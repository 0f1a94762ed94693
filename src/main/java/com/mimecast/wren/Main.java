package com.mimecast.wren;

import com.mimecast.wren.config.OcrConfig;
import com.mimecast.wren.config.WrenConfig;
import com.mimecast.wren.converter.ConverterRegistry;
import com.mimecast.wren.converter.docx.WordConverter;
import com.mimecast.wren.converter.ocr.MistralOcrClient;
import com.mimecast.wren.converter.ocr.OcrDocumentConverter;
import com.mimecast.wren.converter.spreadsheet.SpreadsheetConverter;
import com.mimecast.wren.exception.ConfigurationException;
import com.mimecast.wren.processor.AttachmentOrchestrator;
import com.mimecast.wren.processor.BatchProcessor;
import com.mimecast.wren.processor.BatchReport;
import com.mimecast.wren.processor.MessageOutcome;
import com.mimecast.wren.processor.MessageProcessor;
import com.mimecast.wren.resilience.CircuitBreakerRegistry;
import com.mimecast.wren.resilience.ResilientExecutor;
import com.mimecast.wren.resilience.RetryPolicy;
import com.mimecast.wren.storage.LocalOutputStore;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Main runnable.
 *
 * <p>Processes message files and directories of {@code .eml} files into the output directory.
 */
public class Main {
    private static final Logger log = LogManager.getLogger(Main.class);

    /**
     * Application jar name.
     */
    private static final String NAME = "wren.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME + " [options] <message or directory>...";

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "Email to AI-ready artifact extraction and conversion";

    private final String[] args;
    private int exitCode = 0;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        Main main = new Main(args);
        if (main.getExitCode() != 0) {
            System.exit(main.getExitCode());
        }
    }

    /**
     * Constructs a new Main instance.
     *
     * @param args String array.
     */
    Main(String[] args) {
        this.args = args;

        Optional<CommandLine> opt = parseArgs(options());
        if (opt.isEmpty() || opt.get().hasOption("help") || opt.get().getArgList().isEmpty()) {
            optionsUsage(options());
            exitCode = opt.isPresent() && opt.get().hasOption("help") ? 0 : 2;
            return;
        }

        try {
            exitCode = run(opt.get());
        } catch (ConfigurationException e) {
            log("Configuration error: " + e.getMessage());
            exitCode = 3;
        } catch (IOException e) {
            log("Error: " + e.getMessage());
            exitCode = 1;
        }
    }

    /**
     * Runs batch.
     *
     * @param cmd CommandLine instance.
     * @return Exit code.
     * @throws ConfigurationException Invalid settings.
     * @throws IOException            Unable to read configuration or create output.
     */
    private int run(CommandLine cmd) throws ConfigurationException, IOException {
        WrenConfig config = cmd.hasOption("config") ? new WrenConfig(cmd.getOptionValue("config")) : new WrenConfig();
        if (cmd.hasOption("output")) {
            config.getProcessing().getMap().put("outputDirectory", cmd.getOptionValue("output"));
        }
        if (cmd.hasOption("workers")) {
            try {
                config.getProcessing().getMap().put("maxWorkers", Long.parseLong(cmd.getOptionValue("workers")));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Invalid workers: " + cmd.getOptionValue("workers"), e);
            }
        }

        OcrConfig ocr = config.getOcr();
        if (ocr.isEnabled() && StringUtils.isBlank(ocr.getApiKey())) {
            log.warn("OCR disabled, no API key in configuration or {}", ocr.getApiKeyEnv());
            ocr.getMap().put("enabled", false);
        }
        config.validate();

        List<Path> inputs = inputs(cmd.getArgList());
        if (inputs.isEmpty()) {
            log("No messages found");
            return 2;
        }

        LocalOutputStore store = new LocalOutputStore(Paths.get(config.getProcessing().getOutputDirectory()));
        BatchReport report;
        try (AttachmentOrchestrator orchestrator = new AttachmentOrchestrator(registry(config), config.getProcessing().getAttachmentWorkers());
             BatchProcessor batch = new BatchProcessor(new MessageProcessor(config, store, orchestrator), config.getProcessing().getMaxWorkers())) {
            Runtime.getRuntime().addShutdownHook(new Thread(batch::cancel));
            report = batch.process(inputs);
        }

        for (MessageOutcome outcome : report.getOutcomes()) {
            log(outcome.toString());
        }
        log("Done: " + report + ". Output in " + store.getRoot());
        return report.getFailedCount() > 0 ? 1 : 0;
    }

    /**
     * Builds converter registry in priority order.
     *
     * @param config WrenConfig instance.
     * @return ConverterRegistry instance.
     */
    static ConverterRegistry registry(WrenConfig config) {
        ConverterRegistry registry = new ConverterRegistry()
                .register(new SpreadsheetConverter(config.getSpreadsheet(), config.getOutput().getSpreadsheetDir()))
                .register(new WordConverter(config.getDocx(), config.getOutput().getDocxDir()));

        OcrConfig ocr = config.getOcr();
        if (ocr.isEnabled()) {
            MistralOcrClient client = new MistralOcrClient(ocr);
            CircuitBreakerRegistry breakers = CircuitBreakerRegistry.fromConfig(ocr.getResilience());
            ResilientExecutor executor = new ResilientExecutor(breakers.get(client.getEndpoint()),
                    RetryPolicy.fromConfig(ocr.getResilience()));
            registry.register(new OcrDocumentConverter(ocr, config.getOutput().getOcrDir(), client, executor));
        }
        return registry;
    }

    /**
     * Expands arguments to message files, directories give their {@code .eml} files sorted by name.
     *
     * @param args Arguments.
     * @return List of Path.
     * @throws IOException Unable to list directory.
     */
    static List<Path> inputs(List<String> args) throws IOException {
        List<Path> inputs = new ArrayList<>();
        for (String arg : args) {
            Path path = Paths.get(arg);
            if (Files.isDirectory(path)) {
                try (Stream<Path> files = Files.list(path)) {
                    inputs.addAll(files
                            .filter(Files::isRegularFile)
                            .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".eml"))
                            .sorted()
                            .collect(Collectors.toList()));
                }
            } else if (Files.isRegularFile(path)) {
                inputs.add(path);
            } else {
                log.warn("Input not found: {}", arg);
            }
        }
        return inputs;
    }

    /**
     * CLI options.
     * <i>Listing order will be alphabetical</i>.
     *
     * @return Options instance.
     */
    private Options options() {
        Options options = new Options();
        options.addOption("c", "config", true, "Configuration file (JSON/JSON5)");
        options.addOption("o", "output", true, "Output directory");
        options.addOption("w", "workers", true, "Concurrent messages");
        options.addOption("h", "help", false, "Show usage");
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options Options instance.
     */
    public void optionsUsage(Options options) {
        log(USAGE);
        log(" " + DESCRIPTION);
        log("");

        StringWriter out = new StringWriter();
        try (PrintWriter pw = new PrintWriter(out)) {
            HelpFormatter formatter = new HelpFormatter();
            formatter.printOptions(pw, HelpFormatter.DEFAULT_WIDTH, options, HelpFormatter.DEFAULT_LEFT_PAD,
                    HelpFormatter.DEFAULT_DESC_PAD);
        }
        log(out.toString());
    }

    /**
     * Parser for CLI arguments.
     *
     * @param options Options instance.
     * @return Optional of CommandLine.
     */
    public Optional<CommandLine> parseArgs(Options options) {
        CommandLine cmd = null;

        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (Exception e) {
            log("Options error: " + e.getMessage());
            log("");
        }

        return Optional.ofNullable(cmd);
    }

    public int getExitCode() {
        return exitCode;
    }

    /**
     * Console output wrapper.
     *
     * @param string String.
     */
    public void log(String string) {
        System.out.println(string);
    }
}
