package work.lcod.cosmic.cli;

import picocli.CommandLine;
import work.lcod.cosmic.api.CosmicRunner;
import work.lcod.cosmic.api.RunResult;

/**
 * Prints unexpected command failures as a single {@code cosmic-fp: <message>} line and exits with the failure code.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        String message = commandLine.getCommandName() + ": " + describe(ex);
        commandLine.getErr().println(commandLine.getColorScheme().errorText(message));
        if (Boolean.getBoolean(CosmicRunner.DEBUG_PROPERTY)) {
            ex.printStackTrace(commandLine.getErr());
        }
        return RunResult.Status.FAILURE.exitCode();
    }

    // first non-blank message along the cause chain
    static String describe(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            String message = current.getMessage();
            if (message != null && !message.isBlank()) {
                return message;
            }
        }
        return error.getClass().getSimpleName();
    }
}
