package work.stepweave.engine.cli;

import picocli.CommandLine;
import work.stepweave.engine.error.ErrorKind;
import work.stepweave.engine.error.WorkflowException;

/**
 * Prints engine failures as one {@code kind: message} line. Configuration problems are reported as usage
 * errors; everything else exits with the execution failure code.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        var error = WorkflowException.wrap(ex);
        var line = new StringBuilder(error.kind().code()).append(": ");
        if (error.stepId() != null) {
            line.append("step '").append(error.stepId()).append("': ");
        }
        line.append(error.getMessage());
        commandLine.getErr().println(commandLine.getColorScheme().errorText(line.toString()));
        if (Boolean.getBoolean("stepweave.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        var spec = commandLine.getCommandSpec();
        return error.kind() == ErrorKind.CONFIGURATION ? spec.exitCodeOnInvalidInput() : spec.exitCodeOnExecutionException();
    }
}
