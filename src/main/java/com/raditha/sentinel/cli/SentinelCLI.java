package com.raditha.sentinel.cli;

import com.raditha.sentinel.config.SentinelConfig;
import com.raditha.sentinel.config.SentinelSettings;
import com.raditha.sentinel.io.JsonModelReader;
import com.raditha.sentinel.model.AnalysisModel;
import com.raditha.sentinel.scanner.EntryPointReport;
import com.raditha.sentinel.scanner.EntryPointScanner;
import com.raditha.sentinel.verifier.SessionReport;
import com.raditha.sentinel.verifier.VerificationException;
import com.raditha.sentinel.verifier.VerificationSession;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line interface for Sentinel.
 * <p>
 * Usage:
 * java -jar sentinel.jar --model analysis.json [options]
 * <p>
 * Exit codes: 0 all invariants hold, 1 an invariant failed, 2 configuration error, 3 I/O error.
 * Configuration priority: CLI arguments > config file > bundled sentinel.yml > defaults
 */
@Command(name = "sentinel", mixinStandardHelpOptions = true, version = "Sentinel v1.0.0",
        description = "Structural invariant verifier and fuzz entry-point scanner")
public class SentinelCLI implements Callable<Integer> {

    static final int EXIT_INVARIANT_FAILED = 1;
    static final int EXIT_CONFIGURATION = 2;
    static final int EXIT_IO = 3;

    @Option(names = "--model", required = true, description = "Analysis model exported as JSON", paramLabel = "<path>")
    private Path modelFile;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private Path configFile;

    @Option(names = "--mode", description = "Run mode: ${COMPLETION-CANDIDATES} (default: all)", paramLabel = "<mode>",
            converter = RunModeConverter.class)
    private RunMode mode = RunMode.ALL;

    @Option(names = "--prefix", description = "Entry point name prefix (default: echidna_)", paramLabel = "<text>")
    private String prefix;

    @Option(names = "--rule", description = "Only verify the named rule (repeatable)", paramLabel = "<name>")
    private List<String> ruleNames = new ArrayList<>();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 when every verified invariant holds)
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        SentinelConfig config = SentinelSettings.loadConfig(configFile, prefix).selectRules(ruleNames);
        AnalysisModel model = new JsonModelReader().read(modelFile);
        PrintWriter out = spec.commandLine().getOut();

        if (mode.scans() && config.entryPointsEnabled()) {
            EntryPointReport report = new EntryPointScanner(config.entryPointPrefix()).scan(model);
            out.print(report.format());
        }

        if (mode.verifies()) {
            SessionReport session = new VerificationSession().run(model, config.invariants());
            out.print(session.getDetailedReport());
            out.flush();
            session.orThrow();
        }
        out.flush();
        return 0;
    }

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    /**
     * Run the CLI with Sentinel's exception to exit code mapping.
     */
    static int execute(String... args) {
        CommandLine cmd = new CommandLine(new SentinelCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof VerificationException verification) {
                commandLine.getErr().println("Invariant check failed [" + verification.getFailure().check() + "]: "
                        + verification.getMessage());
                return EXIT_INVARIANT_FAILED;
            } else if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return EXIT_CONFIGURATION;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return EXIT_IO;
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
            return EXIT_CONFIGURATION;
        });

        return cmd.execute(args);
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (!Files.isRegularFile(modelFile)) {
            throw new IllegalArgumentException("Model file not found: " + modelFile);
        }
        if (configFile != null && !Files.exists(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        if (prefix != null && prefix.isBlank()) {
            throw new IllegalArgumentException("Prefix cannot be blank");
        }
        if (!ruleNames.isEmpty() && !mode.verifies()) {
            throw new IllegalArgumentException("--rule only applies when invariants are verified");
        }
    }

    /**
     * Custom converter for RunMode enum to handle CLI string values.
     */
    public static class RunModeConverter implements ITypeConverter<RunMode> {
        @Override
        public RunMode convert(String value) throws Exception {
            return RunMode.fromString(value);
        }
    }
}
