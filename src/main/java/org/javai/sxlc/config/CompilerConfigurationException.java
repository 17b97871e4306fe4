package org.javai.sxlc.config;

import org.javai.sxlc.sxl.SxlCompileException;

/**
 * Exception thrown when compiler settings cannot be read or are invalid.
 */
public class CompilerConfigurationException extends SxlCompileException {

	public CompilerConfigurationException(String message) {
		super(message);
	}

	public CompilerConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
