package org.javai.exprcheck.parse;

import java.util.List;
import org.javai.exprcheck.ast.BinaryOp;
import org.javai.exprcheck.ast.Expression;
import org.javai.exprcheck.ast.FunctionCall;
import org.javai.exprcheck.ast.MathFunction;
import org.javai.exprcheck.ast.NumberLiteral;
import org.javai.exprcheck.ast.Operator;
import org.javai.exprcheck.ast.UnaryOp;
import org.javai.exprcheck.ast.Variable;
import org.javai.exprcheck.lex.Lexer;
import org.javai.exprcheck.lex.Token;
import org.javai.exprcheck.lex.Token.TokenType;

/**
 * Recursive-descent parser for arithmetic expressions.
 *
 * Precedence from lowest to highest:
 * <ol>
 * <li>addition and subtraction, left-associative; a leading {@code -} becomes {@code 0 - operand}</li>
 * <li>unary minus, whose operand is a whole multiplicative term:
 *     {@code -x^2} is {@code -(x^2)} and {@code -x*y} is {@code -(x*y)}</li>
 * <li>multiplication and division, explicit or implicit, left-associative</li>
 * <li>exponentiation, right-associative: {@code a^b^c} is {@code a^(b^c)}</li>
 * <li>function application to a single primary: {@code sin x+y} is {@code sin(x) + y}</li>
 * <li>number, variable or parenthesized expression</li>
 * </ol>
 *
 * There is no error recovery; the first violation raises a {@link ParseException}.
 */
public class ExpressionParser {

	private final List<Token> tokens;
	private int current = 0;

	public ExpressionParser(List<Token> tokens) {
		if (tokens == null || tokens.isEmpty() || !tokens.get(tokens.size() - 1).isType(TokenType.END)) {
			throw new IllegalArgumentException("Token list must be terminated by an END token");
		}
		this.tokens = tokens;
	}

	/**
	 * Tokenizes and parses expression text.
	 *
	 * @throws org.javai.exprcheck.lex.LexException if the text cannot be tokenized
	 * @throws ParseException if the tokens do not form an expression
	 */
	public static Expression parse(String text) {
		return new ExpressionParser(new Lexer(text).tokenize()).parse();
	}

	/**
	 * Parses the whole token list into a single expression.
	 *
	 * @throws ParseException if syntax errors are encountered or tokens remain after the expression
	 */
	public Expression parse() {
		if (check(TokenType.END)) {
			throw new ParseException("Empty expression", peek().position());
		}

		Expression expression = parseExpression();

		if (!check(TokenType.END)) {
			Token trailing = peek();
			if (trailing.isType(TokenType.RPAREN)) {
				throw new ParseException("Unbalanced parentheses: unexpected ')' at position "
						+ trailing.position(), trailing.position());
			}
			throw new ParseException("Unexpected token " + trailing + " at position " + trailing.position()
					+ " after a complete expression", trailing.position());
		}
		return expression;
	}

	private Expression parseExpression() {
		Expression left;
		if (check(TokenType.MINUS)) {
			Token minus = advance();
			rejectConsecutiveMinus(minus);
			left = BinaryOp.subtract(NumberLiteral.ZERO, parseTerm());
		} else {
			left = parseUnary();
		}

		while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
			Token operator = advance();
			Expression right = parseUnary();
			left = new BinaryOp(left, toOperator(operator), right);
		}

		return left;
	}

	private Expression parseUnary() {
		if (check(TokenType.MINUS)) {
			Token minus = advance();
			rejectConsecutiveMinus(minus);
			return UnaryOp.negate(parseTerm());
		}
		return parseTerm();
	}

	private Expression parseTerm() {
		Expression left = parsePower();

		while (check(TokenType.MULTIPLY) || check(TokenType.IMPLICIT_MULTIPLY) || check(TokenType.DIVIDE)) {
			Token operator = advance();
			Expression right = parsePower();
			left = new BinaryOp(left, toOperator(operator), right);
		}

		return left;
	}

	private Expression parsePower() {
		Expression base = parseFunction();

		if (check(TokenType.POWER)) {
			Token caret = advance();
			if (check(TokenType.MINUS)) {
				throw new ParseException("Negative exponents are not supported: '^' at position "
						+ caret.position() + " is followed by '-'", peek().position());
			}
			// right-associative: a^b^c = a^(b^c)
			Expression exponent = parsePower();
			return BinaryOp.power(base, exponent);
		}

		return base;
	}

	private Expression parseFunction() {
		if (check(TokenType.FUNCTION)) {
			Token function = advance();
			if (check(TokenType.END)) {
				throw new ParseException("Function '" + function.value() + "' at position "
						+ function.position() + " is missing its argument", peek().position());
			}
			if (check(TokenType.FUNCTION)) {
				throw new ParseException("Argument of '" + function.value() + "' at position " + function.position()
						+ " must be a number, variable or parenthesized expression", peek().position());
			}
			Expression argument = parsePrimary();
			return new FunctionCall(MathFunction.fromName(function.value()), argument);
		}

		return parsePrimary();
	}

	private Expression parsePrimary() {
		Token token = peek();

		return switch (token.type()) {
			case NUMBER -> {
				advance();
				yield new NumberLiteral(token.numericValue());
			}
			case VARIABLE -> {
				advance();
				yield new Variable(token.value());
			}
			case LPAREN -> parseParenthesized();
			case PLUS -> throw new ParseException(
					"Unary plus at position " + token.position() + " is not supported", token.position());
			case MINUS -> throw new ParseException(
					"Unexpected '-' at position " + token.position() + ": expected an operand", token.position());
			case RPAREN -> throw new ParseException(
					"Unbalanced parentheses: unexpected ')' at position " + token.position(), token.position());
			case MULTIPLY, IMPLICIT_MULTIPLY, DIVIDE, POWER -> throw new ParseException(
					"Missing operand before '" + token.value() + "' at position " + token.position(), token.position());
			case END -> throw new ParseException(
					"Missing operand: unexpected end of input at position " + token.position(), token.position());
			case FUNCTION -> throw new ParseException(
					"Unexpected function '" + token.value() + "' at position " + token.position(), token.position());
		};
	}

	private Expression parseParenthesized() {
		Token open = advance();

		if (check(TokenType.RPAREN)) {
			throw new ParseException("Empty parentheses at position " + open.position()
					+ ": parentheses must contain an expression", open.position());
		}

		Expression inner = parseExpression();

		if (check(TokenType.END)) {
			throw new ParseException("Unbalanced parentheses: '(' at position " + open.position()
					+ " is never closed", peek().position());
		}
		if (!check(TokenType.RPAREN)) {
			Token unexpected = peek();
			throw new ParseException("Expected ')' to close '(' at position " + open.position()
					+ ", but found " + unexpected + " at position " + unexpected.position(), unexpected.position());
		}

		advance(); // consume ')'
		return inner;
	}

	private void rejectConsecutiveMinus(Token minus) {
		if (check(TokenType.MINUS)) {
			throw new ParseException("Consecutive unary minus at position " + peek().position()
					+ " is not supported (after '-' at position " + minus.position() + ")", peek().position());
		}
	}

	private static Operator toOperator(Token token) {
		return switch (token.type()) {
			case PLUS -> Operator.PLUS;
			case MINUS -> Operator.MINUS;
			case MULTIPLY, IMPLICIT_MULTIPLY -> Operator.MULTIPLY;
			case DIVIDE -> Operator.DIVIDE;
			case POWER -> Operator.POWER;
			default -> throw new IllegalStateException("Not an operator token: " + token);
		};
	}

	private Token peek() {
		return tokens.get(current);
	}

	private Token advance() {
		Token token = tokens.get(current);
		if (!token.isType(TokenType.END)) {
			current++;
		}
		return token;
	}

	private boolean check(TokenType type) {
		return peek().type() == type;
	}
}
