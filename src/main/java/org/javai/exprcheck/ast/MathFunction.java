package org.javai.exprcheck.ast;

import java.util.Locale;

/**
 * The fixed set of functions an expression may call.
 */
public enum MathFunction {

	SIN,
	COS,
	TAN,
	LN,
	SQRT;

	/**
	 * Name as written in expression text, e.g. {@code sqrt}.
	 */
	public String functionName() {
		return name().toLowerCase(Locale.ROOT);
	}

	public static MathFunction fromName(String name) {
		for (MathFunction function : values()) {
			if (function.functionName().equals(name)) {
				return function;
			}
		}
		throw new IllegalArgumentException("Unknown function: '" + name + "'");
	}

	@Override
	public String toString() {
		return functionName();
	}
}
