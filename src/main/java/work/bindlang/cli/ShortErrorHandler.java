package work.bindlang.cli;

import java.io.UncheckedIOException;
import picocli.CommandLine;
import work.bindlang.shared.StructuralViolationException;

/**
 * Prints one line per failure instead of a stack trace. Structural violations (cycles, illegal
 * lifecycle transitions) are tagged and exit with {@link #STRUCTURAL_EXIT_CODE}; I/O failures name
 * the underlying cause. Set {@code -Dbindlang.debug=true} to get the full trace as well.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "bindlang.debug";
    static final int STRUCTURAL_EXIT_CODE = 3;

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
        if (ex instanceof StructuralViolationException) {
            return STRUCTURAL_EXIT_CODE;
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Exception ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        if (ex instanceof StructuralViolationException) {
            return "Structural violation: " + message;
        }
        if (ex instanceof UncheckedIOException io && io.getCause() != null) {
            return message + " (" + io.getCause().getClass().getSimpleName() + ")";
        }
        return message;
    }
}
