package work.stepweave.engine.cli;

import picocli.CommandLine;

@CommandLine.Command(
    name = "stepweave",
    description = "Run and check declarative generative-text workflows.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = { RunCommand.class, ValidateCommand.class }
)
final class StepweaveCommand implements Runnable {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand (run or validate).");
    }
}
