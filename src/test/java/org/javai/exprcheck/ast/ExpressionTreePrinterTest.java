package org.javai.exprcheck.ast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.javai.exprcheck.parse.ExpressionParser;
import org.junit.jupiter.api.Test;

class ExpressionTreePrinterTest {

	@Test
	void printsLeaf() {
		assertThat(ExpressionTreePrinter.print(new Variable("x"))).isEqualTo("Variable: x");
		assertThat(ExpressionTreePrinter.print(NumberLiteral.of(7))).isEqualTo("Number: 7");
	}

	@Test
	void printsBinaryWithLabelledChildren() {
		String dump = ExpressionTreePrinter.print(ExpressionParser.parse("x + 1"));

		assertThat(dump).isEqualTo(String.join("\n",
				"BinaryOp: +",
				"  Left:",
				"    Variable: x",
				"  Right:",
				"    Number: 1"));
	}

	@Test
	void printsNestedUnaryAndCall() {
		Expression tree = UnaryOp.negate(new FunctionCall(MathFunction.SIN, new Variable("y")));

		assertThat(ExpressionTreePrinter.print(tree)).isEqualTo(String.join("\n",
				"UnaryOp: -",
				"  Operand:",
				"    FunctionCall: sin",
				"      Argument:",
				"        Variable: y"));
	}

	@Test
	void honoursCustomIndent() {
		ExpressionTreePrinter printer = new ExpressionTreePrinter(4);
		ExpressionParser.parse("x * y").accept(printer);

		assertThat(printer.toString()).contains("\n    Left:\n        Variable: x");
	}

	@Test
	void rejectsNegativeIndent() {
		assertThatThrownBy(() -> new ExpressionTreePrinter(-1))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
