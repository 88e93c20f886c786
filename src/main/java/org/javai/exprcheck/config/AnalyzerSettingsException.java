package org.javai.exprcheck.config;

/**
 * Exception thrown when analyzer settings cannot be read or hold invalid values.
 */
public class AnalyzerSettingsException extends RuntimeException {

	public AnalyzerSettingsException(String message) {
		super(message);
	}

	public AnalyzerSettingsException(String message, Throwable cause) {
		super(message, cause);
	}
}
