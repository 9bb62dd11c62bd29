package work.lcod.mustache.cli;

import picocli.CommandLine;
import work.lcod.mustache.render.RenderException;

/**
 * Prints a one-line error (prefixed with the render error code when there is one) instead of a stack trace.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        if (ex instanceof RenderException render) {
            message = render.code() + ": " + message;
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(message));
        if (Boolean.getBoolean("lcod.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
