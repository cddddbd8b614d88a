package work.stepweave.engine.cli;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.stepweave.engine.api.LogLevel;
import work.stepweave.engine.api.RunConfiguration;
import work.stepweave.engine.api.WorkflowRunner;
import work.stepweave.engine.config.ConfigurationLoader;
import work.stepweave.engine.config.EngineConfiguration;
import work.stepweave.engine.shared.DurationParser;

@CommandLine.Command(
    name = "run",
    description = "Execute a workflow and print its output.",
    mixinStandardHelpOptions = true,
    showDefaultValues = true
)
final class RunCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "WORKFLOW", description = "Workflow YAML file.")
    private Path workflow;

    @CommandLine.Option(
        names = {"-i", "--input"},
        paramLabel = "JSON|@FILE|-",
        description = "Input object as inline JSON, @file, or '-' for stdin (default: {}).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String input;

    @CommandLine.Option(names = "--config", description = "Configuration file (YAML or TOML).", defaultValue = CommandLine.Option.NULL_VALUE)
    private Path config;

    @CommandLine.Option(names = "--model", description = "Default model for steps that do not name one.", defaultValue = CommandLine.Option.NULL_VALUE)
    private String model;

    @CommandLine.Option(names = "--max-parallel", description = "Maximum concurrent provider calls.", defaultValue = CommandLine.Option.NULL_VALUE)
    private Integer maxParallel;

    @CommandLine.Option(names = "--timeout", description = "Provider call timeout per step (e.g. 30s, 2m).", defaultValue = CommandLine.Option.NULL_VALUE)
    private String timeoutRaw;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(names = "--json", description = "Print the full run result as JSON instead of the output.")
    private boolean json;

    private final WorkflowRunner runner;
    private final InputStream stdin;

    RunCommand() {
        this(new WorkflowRunner(), System.in);
    }

    RunCommand(WorkflowRunner runner, InputStream stdin) {
        this.runner = runner;
        this.stdin = stdin;
    }

    @Override
    public Integer call() throws Exception {
        var engineConfiguration = resolveConfiguration();
        var level = logLevelRaw != null ? parseLogLevel() : engineConfiguration.logLevel();
        level.applyToRootLogger();

        var result = runner.run(RunConfiguration.builder()
            .workflowFile(workflow)
            .inputPayload(loadInputPayload())
            .engineConfiguration(engineConfiguration)
            .build());

        var out = spec.commandLine().getOut();
        if (json) {
            out.println(result.toPrettyJson());
        } else if (result.output() != null) {
            out.println(result.output());
        }
        if (result.errorMessage() != null) {
            spec.commandLine().getErr().println(spec.commandLine().getColorScheme().errorText(result.errorMessage()));
        }
        out.flush();
        return result.status().exitCode();
    }

    private EngineConfiguration resolveConfiguration() {
        var builder = new ConfigurationLoader().load(config).toBuilder();
        if (model != null && !model.isBlank()) {
            builder.defaultModel(model);
        }
        if (maxParallel != null) {
            if (maxParallel < 1) {
                throw new CommandLine.ParameterException(spec.commandLine(), "--max-parallel must be >= 1");
            }
            builder.maxParallelAiCalls(maxParallel);
        }
        if (timeoutRaw != null) {
            try {
                builder.timeoutPerStep(DurationParser.parse(timeoutRaw).orElseThrow(() ->
                    new IllegalArgumentException("Invalid duration: " + timeoutRaw)));
            } catch (IllegalArgumentException ex) {
                throw new CommandLine.ParameterException(spec.commandLine(), "--timeout: " + ex.getMessage());
            }
        }
        return builder.build();
    }

    private LogLevel parseLogLevel() {
        try {
            return LogLevel.from(logLevelRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private String loadInputPayload() throws IOException {
        if (input == null || input.isBlank()) {
            return "{}";
        }
        if (input.equals("-")) {
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        }
        if (input.startsWith("@")) {
            return Files.readString(Path.of(input.substring(1)));
        }
        return input;
    }
}
