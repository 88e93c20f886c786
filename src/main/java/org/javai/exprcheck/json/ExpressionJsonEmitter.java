package org.javai.exprcheck.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import org.javai.exprcheck.ast.BinaryOp;
import org.javai.exprcheck.ast.CanonicalRenderer;
import org.javai.exprcheck.ast.Expression;
import org.javai.exprcheck.ast.ExpressionVisitor;
import org.javai.exprcheck.ast.FunctionCall;
import org.javai.exprcheck.ast.NumberLiteral;
import org.javai.exprcheck.ast.UnaryOp;
import org.javai.exprcheck.ast.Variable;
import org.javai.exprcheck.equiv.EquivalenceResult;
import org.javai.exprcheck.lex.Token;
import org.javai.exprcheck.poly.AtomicExpression;
import org.javai.exprcheck.poly.Monomial;
import org.javai.exprcheck.poly.Polynomial;
import org.javai.exprcheck.poly.Symbol;

/**
 * Emits tokens, expression trees, polynomials and equivalence verdicts as
 * Jackson trees for front ends that render or store analysis results.
 */
public final class ExpressionJsonEmitter {

	private static final ObjectMapper mapper = new ObjectMapper();

	private ExpressionJsonEmitter() {}

	public static ObjectNode emit(Expression expression) {
		return expression.accept(new TreeBuilder());
	}

	public static ArrayNode emitTokens(List<Token> tokens) {
		ArrayNode array = mapper.createArrayNode();
		for (Token token : tokens) {
			ObjectNode node = array.addObject();
			node.put("type", token.type().name());
			node.put("value", token.value());
			node.put("position", token.position());
		}
		return array;
	}

	public static ObjectNode emitPolynomial(Polynomial polynomial) {
		ObjectNode root = mapper.createObjectNode();
		root.put("text", polynomial.render());
		ArrayNode terms = root.putArray("terms");
		for (Map.Entry<Monomial, BigInteger> term : polynomial.orderedTerms()) {
			ObjectNode t = terms.addObject();
			t.put("coefficient", term.getValue());
			ArrayNode factors = t.putArray("factors");
			term.getKey().powers().forEach((symbol, power) -> {
				ObjectNode f = factors.addObject();
				f.put("symbol", symbol.name());
				f.put("kind", kindOf(symbol));
				f.put("power", power);
			});
		}
		return root;
	}

	public static ObjectNode emitResult(EquivalenceResult result) {
		ObjectNode root = mapper.createObjectNode();
		root.put("equivalent", result.equivalent());
		root.put("method", result.method().wireName());
		root.put("details", result.details());
		return root;
	}

	/**
	 * Serializes a tree produced by this emitter.
	 */
	public static String toJson(JsonNode node, boolean pretty) {
		try {
			return pretty
					? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node)
					: mapper.writeValueAsString(node);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize JSON tree", e);
		}
	}

	private static String kindOf(Symbol symbol) {
		return symbol instanceof AtomicExpression ? "atom" : "variable";
	}

	private static final class TreeBuilder implements ExpressionVisitor<ObjectNode> {

		@Override
		public ObjectNode visitNumber(NumberLiteral number) {
			ObjectNode node = typed("number", number);
			node.put("value", number.value());
			return node;
		}

		@Override
		public ObjectNode visitVariable(Variable variable) {
			ObjectNode node = typed("variable", variable);
			node.put("name", variable.name());
			return node;
		}

		@Override
		public ObjectNode visitBinary(BinaryOp binary) {
			ObjectNode node = typed("binary", binary);
			node.put("operator", String.valueOf(binary.operator().symbol()));
			node.set("left", binary.left().accept(this));
			node.set("right", binary.right().accept(this));
			return node;
		}

		@Override
		public ObjectNode visitUnary(UnaryOp unary) {
			ObjectNode node = typed("unary", unary);
			node.put("operator", String.valueOf(unary.operator().symbol()));
			node.set("operand", unary.operand().accept(this));
			return node;
		}

		@Override
		public ObjectNode visitCall(FunctionCall call) {
			ObjectNode node = typed("call", call);
			node.put("function", call.function().functionName());
			node.set("argument", call.argument().accept(this));
			return node;
		}

		private ObjectNode typed(String type, Expression expression) {
			ObjectNode node = mapper.createObjectNode();
			node.put("type", type);
			node.put("text", CanonicalRenderer.render(expression));
			return node;
		}
	}
}
