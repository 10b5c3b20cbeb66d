package com.mainframe.analyzer.cli.exception;

import java.util.List;

/**
 * Raised when the options of an {@code analyze} or {@code impact} run are unusable. Holds every
 * problem found so they can be printed in one go before the command exits.
 */
public class OptionsValidationException extends RuntimeException {

    /** Process exit status for a rejected command line. */
    public static final int EXIT_CODE = 2;

    private static final long serialVersionUID = 1L;

    private final String command;
    private final List<String> errors;

    public OptionsValidationException(String command, List<String> errors) {
        super(command + ": " + errors.size() + " invalid option(s)" + System.lineSeparator()
                + String.join(System.lineSeparator(), errors));
        this.command = command;
        this.errors = List.copyOf(errors);
    }

    public String getCommand() {
        return command;
    }

    public List<String> getErrors() {
        return errors;
    }
}
