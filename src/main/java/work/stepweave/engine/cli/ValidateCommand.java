package work.stepweave.engine.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.stepweave.engine.api.WorkflowRunner;

@CommandLine.Command(
    name = "validate",
    description = "Check a workflow's structure and templates without calling the provider.",
    mixinStandardHelpOptions = true
)
final class ValidateCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "WORKFLOW", description = "Workflow YAML file.")
    private Path workflow;

    private final WorkflowRunner runner;

    ValidateCommand() {
        this(new WorkflowRunner());
    }

    ValidateCommand(WorkflowRunner runner) {
        this.runner = runner;
    }

    @Override
    public Integer call() {
        var problems = runner.validate(workflow);
        if (problems.isEmpty()) {
            spec.commandLine().getOut().println("Workflow " + workflow + " is valid");
            return 0;
        }
        var err = spec.commandLine().getErr();
        err.println(spec.commandLine().getColorScheme().errorText("Workflow " + workflow + " has " + problems.size() + " problem(s):"));
        problems.forEach(problem -> err.println("  - " + problem));
        return 1;
    }
}
