package org.javai.exprcheck.ast;

/**
 * Dumps an expression as an indented tree, one node per line.
 *
 * <pre>
 * BinaryOp: +
 *   Left:
 *     Variable: x
 *   Right:
 *     Number: 1
 * </pre>
 *
 * Used by diagnostics and visualization front ends; the analysis pipeline
 * itself never reads this output.
 */
public class ExpressionTreePrinter implements ExpressionVisitor<Void> {

	private final StringBuilder output = new StringBuilder();
	private final int indentSize;
	private int indentLevel = 0;

	public ExpressionTreePrinter() {
		this(2);
	}

	public ExpressionTreePrinter(int indentSize) {
		if (indentSize < 0) {
			throw new IllegalArgumentException("indentSize must not be negative");
		}
		this.indentSize = indentSize;
	}

	@Override
	public Void visitNumber(NumberLiteral number) {
		line("Number: " + number.value());
		return null;
	}

	@Override
	public Void visitVariable(Variable variable) {
		line("Variable: " + variable.name());
		return null;
	}

	@Override
	public Void visitBinary(BinaryOp binary) {
		line("BinaryOp: " + binary.operator());
		child("Left:", binary.left());
		child("Right:", binary.right());
		return null;
	}

	@Override
	public Void visitUnary(UnaryOp unary) {
		line("UnaryOp: " + unary.operator());
		child("Operand:", unary.operand());
		return null;
	}

	@Override
	public Void visitCall(FunctionCall call) {
		line("FunctionCall: " + call.function());
		child("Argument:", call.argument());
		return null;
	}

	private void child(String label, Expression node) {
		indentLevel++;
		line(label);
		indentLevel++;
		node.accept(this);
		indentLevel -= 2;
	}

	private void line(String text) {
		if (output.length() > 0) {
			output.append('\n');
		}
		output.append(" ".repeat(indentLevel * indentSize)).append(text);
	}

	/**
	 * Returns the tree dump accumulated so far.
	 */
	@Override
	public String toString() {
		return output.toString();
	}

	/**
	 * Static convenience method to dump a node with two-space indentation.
	 */
	public static String print(Expression node) {
		ExpressionTreePrinter printer = new ExpressionTreePrinter();
		node.accept(printer);
		return printer.toString();
	}
}
