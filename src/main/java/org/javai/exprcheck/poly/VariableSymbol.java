package org.javai.exprcheck.poly;

import java.util.Objects;

/**
 * A variable of the expression used as a polynomial indeterminate.
 */
public record VariableSymbol(String name) implements Symbol {

	public VariableSymbol {
		Objects.requireNonNull(name, "name must not be null");
	}

	@Override
	public boolean isSelfDelimiting() {
		return true;
	}

	@Override
	public String toString() {
		return name;
	}
}
