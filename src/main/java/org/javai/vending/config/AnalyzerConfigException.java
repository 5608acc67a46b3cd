package org.javai.vending.config;

/**
 * Exception thrown when analyzer settings cannot be read or contain invalid values.
 */
public class AnalyzerConfigException extends RuntimeException {

	public AnalyzerConfigException(String message) {
		super(message);
	}

	public AnalyzerConfigException(String message, Throwable cause) {
		super(message, cause);
	}
}
