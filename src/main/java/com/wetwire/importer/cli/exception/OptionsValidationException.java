package com.wetwire.importer.cli.exception;

import java.util.List;

/**
 * Collects every invalid option of one command invocation, so the user sees
 * all of them at once.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String commandName;
	private final List<String> errors;

	public OptionsValidationException(String commandName, List<String> errors) {
		super("Invalid options for '" + commandName + "': " + String.join("; ", errors));
		this.commandName = commandName;
		this.errors = List.copyOf(errors);
	}

	public String getCommandName() {
		return commandName;
	}

	public List<String> getErrors() {
		return errors;
	}
}
