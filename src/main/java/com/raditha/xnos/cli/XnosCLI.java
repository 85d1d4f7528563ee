package com.raditha.xnos.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.raditha.xnos.codec.PandocJsonCodec;
import com.raditha.xnos.compat.CompatibilityProfile;
import com.raditha.xnos.config.FilterConfig;
import com.raditha.xnos.config.FilterSettings;
import com.raditha.xnos.model.Document;
import com.raditha.xnos.pipeline.LoggingDiagnosticSink;
import com.raditha.xnos.pipeline.PipelineContext;
import com.raditha.xnos.pipeline.ReferenceFilter;
import com.raditha.xnos.pipeline.VersionResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the cross-reference filter.
 * <p>
 * Usage, as a pandoc filter or standalone:
 * pandoc -t json doc.md | xnos html5 | pandoc -f json -o doc.html
 * <p>
 * Configuration priority: CLI arguments > xnos.yml > defaults
 */
@Command(name = "xnos", mixinStandardHelpOptions = true, version = "xnos v1.0.0",
        description = "Resolves figure, equation and table references in a pandoc JSON document")
@SuppressWarnings("java:S106")
public class XnosCLI implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(XnosCLI.class);

    @Parameters(index = "0", arity = "0..1", paramLabel = "FORMAT",
            description = "Pandoc output format, e.g. html5 or latex (default: html)")
    private String format = "html";

    @Option(names = "--input", description = "Read the document from a file instead of stdin", paramLabel = "<path>")
    private Path input;

    @Option(names = "--output", description = "Write the document to a file instead of stdout", paramLabel = "<path>")
    private Path output;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private Path configFile;

    @Option(names = "--pandoc-version", description = "Version of pandoc that produced the document", paramLabel = "<version>")
    private String pandocVersion;

    @Option(names = "--warning-level", description = "0 silent, 1 critical warnings, 2 verbose", paramLabel = "<n>")
    private Integer warningLevel;

    @Option(names = "--cleveref", description = "Name targets in every reference, not only + and * ones")
    private boolean cleveref = false;

    @Option(names = "--no-fakery", description = "Rely on the cleveref package instead of defining its macros")
    private boolean noFakery = false;

    private Map<String, String> environment = System.getenv();

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        FilterConfig config = FilterSettings.loadConfig(
                FilterSettings.loadConfigMap(configFile), warningLevel, cleveref, noFakery);
        PipelineContext context = new PipelineContext(new LoggingDiagnosticSink(), config.warningLevel());

        PandocJsonCodec codec = new PandocJsonCodec();
        JsonNode root = readInput(codec);

        String version = VersionResolver.resolve(pandocVersion, environment, codec.apiVersionOf(root));
        CompatibilityProfile profile = CompatibilityProfile.forVersion(version);
        Document document = codec.decode(root, profile);
        logger.debug("Decoded {} blocks for pandoc {}", document.getBlocks().size(), version);

        new ReferenceFilter(config, context).apply(document, format, version);

        if (output != null) {
            try (OutputStream out = Files.newOutputStream(output)) {
                codec.write(document, profile, out);
            }
        } else {
            System.out.write(codec.writeAsString(document, profile).getBytes(StandardCharsets.UTF_8));
            System.out.flush();
        }
        return 0;
    }

    private JsonNode readInput(PandocJsonCodec codec) throws IOException {
        if (input == null) {
            return codec.readTree(System.in);
        }
        try (InputStream in = Files.newInputStream(input)) {
            return codec.readTree(in);
        }
    }

    public static void main(String[] args) {
        System.exit(createCommandLine(new XnosCLI()).execute(args));
    }

    /**
     * A command line with the exit-code mapping used by {@link #main(String[])}.
     */
    static CommandLine createCommandLine(XnosCLI app) {
        CommandLine cmd = new CommandLine(app);

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            cmd.getErr().flush();
            return 2; // Invalid command line arguments
        });
        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (warningLevel != null && (warningLevel < 0 || warningLevel > 2)) {
            throw new IllegalArgumentException("Warning level must be 0, 1 or 2, got: " + warningLevel);
        }
        if (configFile != null && !Files.exists(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        if (input != null && !Files.exists(input)) {
            throw new IllegalArgumentException("Input file not found: " + input);
        }
    }

    void setEnvironment(Map<String, String> environment) {
        this.environment = environment;
    }
}
