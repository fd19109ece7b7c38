package org.bpmntocacao;

import lombok.extern.slf4j.Slf4j;
import org.bpmntocacao.bpmn.BpmnHelper;
import org.bpmntocacao.bpmn.BpmnValidator;
import org.bpmntocacao.bpmn.models.BpmnDefinitions;
import org.bpmntocacao.cacao.CacaoSpecVersion;
import org.bpmntocacao.cacao.ConversionException;
import org.bpmntocacao.cacao.PlaybookAssembler;
import org.bpmntocacao.cacao.PlaybookValidator;
import org.bpmntocacao.cacao.PlaybookWriter;
import org.bpmntocacao.cacao.models.CacaoPlaybook;
import org.bpmntocacao.config.ConverterConfigHelper;
import org.bpmntocacao.config.models.ConverterConfig;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point: converts each BPMN file given on the command line into a
 * CACAO playbook written to the output directory.
 *
 * <pre>
 * bpmn-to-cacao [--output-dir DIR] [--cacao-spec 1.1|2.0] [--config FILE] [--validate] FILE...
 * </pre>
 */
@Slf4j
public class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILED_DOCUMENTS = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage: bpmn-to-cacao [options] FILE...",
            "  --output-dir DIR     directory for the generated playbooks (default: .)",
            "  --cacao-spec VERSION CACAO spec version, 1.1 or 2.0 (default: 1.1)",
            "  --config FILE        JSON converter configuration",
            "  --validate           validate each BPMN file against the BPMN schema first",
            "  --help               print this help");

    // ------ Settings resolved from defaults, config file and flags
    private final ConverterConfig config;
    private final List<String> inputFiles;
    private final Clock clock;

    Main(ConverterConfig config, List<String> inputFiles, Clock clock) {
        this.config = config;
        this.inputFiles = inputFiles;
        this.clock = clock;
    }

    /**
     * Converts every input file. A failing file is logged and skipped.
     *
     * @return the number of files that could not be converted
     */
    public int run() {
        CacaoSpecVersion specVersion = ConverterConfigHelper.resolveSpecVersion(config);
        PlaybookAssembler assembler = new PlaybookAssembler(
                specVersion, ConverterConfigHelper.metadataOrEmpty(config), clock);
        Path outputDir = Paths.get(config.outputDir);

        int failures = 0;
        for (String inputFile : inputFiles) {
            if (!convertFile(inputFile, assembler, outputDir)) {
                failures++;
            }
        }
        log.info("Converted {} of {} files", inputFiles.size() - failures, inputFiles.size());
        return failures;
    }

    private boolean convertFile(String inputFile, PlaybookAssembler assembler, Path outputDir) {
        log.info("Processing {}", inputFile);
        try {
            if (Boolean.TRUE.equals(config.validateInput)) {
                BpmnValidator.validate(new File(inputFile));
            }
            BpmnDefinitions definitions = BpmnHelper.parseBpmnFile(inputFile);
            CacaoPlaybook playbook = assembler.assemble(definitions);

            String json = PlaybookWriter.toJson(playbook);
            if (Boolean.TRUE.equals(config.validateOutput)) {
                PlaybookValidator.validateOrThrow(json);
            }

            String inputFileName = Paths.get(inputFile).getFileName().toString();
            Path outputPath = PlaybookWriter.writePlaybook(json, outputDir, inputFileName, config.outputSuffix);
            log.info("Wrote output to {}", outputPath);
            return true;
        } catch (ConversionException e) {
            log.error("cacao conversion of {} failed: {}", inputFile, e.getMessage());
        } catch (RuntimeException e) {
            log.error("processing input file {} failed: {}", inputFile, e.getMessage(), e);
        }
        return false;
    }

    /**
     * Parses the arguments, converts the inputs and returns the process exit status.
     */
    public static int execute(String[] args) {
        return execute(args, Clock.systemUTC());
    }

    static int execute(String[] args, Clock clock) {
        Main main;
        try {
            main = fromArgs(args, clock);
        } catch (UsageException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println(USAGE);
            return EXIT_USAGE;
        }
        if (main == null) {
            System.out.println(USAGE);
            return EXIT_OK;
        }
        return main.run() == 0 ? EXIT_OK : EXIT_FAILED_DOCUMENTS;
    }

    /**
     * Builds a Main from command line arguments: defaults, then --config, then the other flags.
     *
     * @return the configured Main, or null when help was requested
     */
    static Main fromArgs(String[] args, Clock clock) throws UsageException {
        ConverterConfig flags = new ConverterConfig();
        String configPath = null;
        List<String> inputFiles = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("-")) {
                inputFiles.add(arg);
                continue;
            }

            String option = arg.replaceFirst("^--?", "");
            String value = null;
            int eq = option.indexOf('=');
            if (eq >= 0) {
                value = option.substring(eq + 1);
                option = option.substring(0, eq);
            }

            switch (option) {
                case "help", "h" -> {
                    return null;
                }
                case "validate" -> flags.validateInput = true;
                case "output-dir", "cacao-spec", "config" -> {
                    if (value == null) {
                        if (i + 1 >= args.length) {
                            throw new UsageException("Missing value for " + arg);
                        }
                        value = args[++i];
                    }
                    switch (option) {
                        case "output-dir" -> flags.outputDir = value;
                        case "cacao-spec" -> flags.cacaoSpecVersion = value;
                        default -> configPath = value;
                    }
                }
                default -> throw new UsageException("Unknown option " + arg);
            }
        }

        ConverterConfig config = ConverterConfigHelper.loadDefaultConfig();
        if (configPath != null) {
            try {
                ConverterConfigHelper.validateConfigFile(configPath);
                config = ConverterConfigHelper.merge(config, ConverterConfigHelper.loadConfigFile(configPath));
            } catch (IllegalArgumentException | IOException e) {
                throw new UsageException("Error reading config " + configPath + ": " + e.getMessage());
            }
        }
        config = ConverterConfigHelper.merge(config, flags);

        try {
            ConverterConfigHelper.resolveSpecVersion(config);
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }

        Path outputDir = Paths.get(config.outputDir);
        if (!Files.exists(outputDir)) {
            throw new UsageException("Error parsing argument " + config.outputDir + ": no such directory");
        }
        if (!Files.isDirectory(outputDir)) {
            throw new UsageException("Error " + config.outputDir + " is not a directory");
        }
        if (inputFiles.isEmpty()) {
            throw new UsageException("No input files were specified");
        }

        return new Main(config, inputFiles, clock);
    }

    static class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }

    public static void main(String[] args) {
        System.exit(execute(args));
    }
}
