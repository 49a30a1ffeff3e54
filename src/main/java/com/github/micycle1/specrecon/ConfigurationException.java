package com.github.micycle1.specrecon;

/**
 * Fatal, non-retryable problem with the inputs of a reconstruction: inconsistent
 * operator dimensions, an unknown CFA pattern, invalid weights or penalties, or
 * a set of enabled regularization terms that no longer matches a previously
 * built solver state.
 */
public class ConfigurationException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public ConfigurationException(String message) {
		super(message);
	}
}
