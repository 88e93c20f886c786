package org.javai.exprcheck.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * Utility class for walking expression trees.
 */
public final class ExpressionWalker {

	private ExpressionWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Direct children of a node, left to right.
	 */
	public static List<Expression> children(Expression node) {
		if (node instanceof BinaryOp binary) {
			return List.of(binary.left(), binary.right());
		}
		if (node instanceof UnaryOp unary) {
			return List.of(unary.operand());
		}
		if (node instanceof FunctionCall call) {
			return List.of(call.argument());
		}
		return List.of();
	}

	/**
	 * Visits every node in pre-order (node before its children).
	 */
	public static void walkPreOrder(Expression node, Consumer<Expression> action) {
		if (node == null) {
			return;
		}
		action.accept(node);
		for (Expression child : children(node)) {
			walkPreOrder(child, action);
		}
	}

	/**
	 * All nodes of the tree in pre-order.
	 */
	public static List<Expression> flatten(Expression node) {
		List<Expression> nodes = new ArrayList<>();
		walkPreOrder(node, nodes::add);
		return nodes;
	}

	public static int nodeCount(Expression node) {
		return flatten(node).size();
	}

	/**
	 * Height of the tree; a single leaf has depth 1.
	 */
	public static int depth(Expression node) {
		int deepestChild = 0;
		for (Expression child : children(node)) {
			deepestChild = Math.max(deepestChild, depth(child));
		}
		return deepestChild + 1;
	}

	/**
	 * Names of the variables occurring in the tree, sorted.
	 */
	public static SortedSet<String> variables(Expression node) {
		SortedSet<String> names = new TreeSet<>();
		walkPreOrder(node, n -> {
			if (n instanceof Variable variable) {
				names.add(variable.name());
			}
		});
		return names;
	}
}
