package work.lcod.ui.cli;

import picocli.CommandLine;
import work.lcod.ui.compose.LayoutNotFoundException;
import work.lcod.ui.io.ProgramFormatException;

/**
 * Prints one line per failure: the offending pointer for unreadable programs, a hint for unknown layouts,
 * the message otherwise. Stack traces only with {@code -Duic.debug=true}.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "uic.debug";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        commandLine.getErr().println(commandLine.getColorScheme().errorText(describe(ex)));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Throwable ex) {
        var format = findCause(ex, ProgramFormatException.class);
        if (format != null) {
            return "Invalid program at " + format.displayPointer() + ": " + format.detail();
        }
        var missing = findCause(ex, LayoutNotFoundException.class);
        if (missing != null) {
            return "Layout '" + missing.layoutName() + "' not found; pass --layout or configure a layout directory";
        }
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }

    private static <T extends Throwable> T findCause(Throwable ex, Class<T> type) {
        for (var current = ex; current != null; current = current.getCause()) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
        }
        return null;
    }
}
