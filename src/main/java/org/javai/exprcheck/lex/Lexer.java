package org.javai.exprcheck.lex;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.javai.exprcheck.lex.Token.TokenType;

/**
 * Tokenizer for single-line arithmetic expressions.
 *
 * The raw scan produces numbers, single-letter variables, the five function names
 * and single-character operators. A second pass then inserts
 * {@link TokenType#IMPLICIT_MULTIPLY} tokens where multiplication is written by
 * adjacency, e.g. {@code 2x}, {@code xy}, {@code 2(x+1)} or {@code (a)(b)}.
 *
 * <pre>
 * List&lt;Token&gt; tokens = new Lexer("2x + 1").tokenize();
 * // NUMBER(2) IMPLICIT_MULTIPLY VARIABLE(x) PLUS NUMBER(1) END
 * </pre>
 */
public class Lexer {

	public static final Set<String> FUNCTIONS = Set.of("sin", "cos", "tan", "ln", "sqrt");

	private static final Set<TokenType> OPERAND_STARTS = EnumSet.of(
			TokenType.VARIABLE, TokenType.FUNCTION, TokenType.LPAREN);

	private static final Set<TokenType> OPERAND_STARTS_OR_NUMBER = EnumSet.of(
			TokenType.VARIABLE, TokenType.FUNCTION, TokenType.LPAREN, TokenType.NUMBER);

	// current kind -> kinds that trigger an implicit multiplication when they follow
	private static final Map<TokenType, Set<TokenType>> IMPLICIT_MULTIPLY_TRIGGERS = Map.of(
			TokenType.NUMBER, OPERAND_STARTS,
			TokenType.VARIABLE, OPERAND_STARTS_OR_NUMBER,
			TokenType.RPAREN, OPERAND_STARTS_OR_NUMBER);

	private final String input;
	private int pos = 0;

	public Lexer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire input string.
	 *
	 * @return list of tokens, always terminated by an END token
	 * @throws LexException on the first character that cannot start a token
	 */
	public List<Token> tokenize() {
		List<Token> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipWhitespace();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}

		tokens.add(new Token(TokenType.END, "", pos));
		return insertImplicitMultiplication(tokens);
	}

	/**
	 * Inserts IMPLICIT_MULTIPLY tokens between adjacent tokens whose kinds imply
	 * multiplication. Works on token kinds only and never looks at the source text.
	 */
	static List<Token> insertImplicitMultiplication(List<Token> tokens) {
		List<Token> result = new ArrayList<>(tokens.size());

		for (int i = 0; i < tokens.size(); i++) {
			Token token = tokens.get(i);
			result.add(token);

			if (i + 1 < tokens.size()) {
				Token next = tokens.get(i + 1);
				Set<TokenType> triggers = IMPLICIT_MULTIPLY_TRIGGERS.get(token.type());
				if (triggers != null && triggers.contains(next.type())) {
					int implicitPos = token.position() + Math.max(token.value().length(), 1);
					result.add(new Token(TokenType.IMPLICIT_MULTIPLY, "*", implicitPos));
				}
			}
		}

		return List.copyOf(result);
	}

	private Token nextToken() {
		int start = pos;
		char c = peek();

		return switch (c) {
			case '+' -> single(TokenType.PLUS, start);
			case '-' -> single(TokenType.MINUS, start);
			case '*' -> single(TokenType.MULTIPLY, start);
			case '/' -> single(TokenType.DIVIDE, start);
			case '^' -> single(TokenType.POWER, start);
			case '(' -> single(TokenType.LPAREN, start);
			case ')' -> single(TokenType.RPAREN, start);
			default -> {
				if (isDigit(c)) {
					yield scanNumber();
				} else if (Character.isLetter(c)) {
					yield scanIdentifier();
				} else {
					throw new LexException("Unexpected character '" + c + "' at position " + pos, pos);
				}
			}
		};
	}

	private Token single(TokenType type, int start) {
		char c = advance();
		return new Token(type, String.valueOf(c), start);
	}

	private Token scanNumber() {
		int start = pos;

		while (!isAtEnd() && isDigit(peek())) {
			advance();
		}

		if (!isAtEnd() && peek() == '.') {
			throw new LexException("Decimal point '.' at position " + pos
					+ " is not supported: only integer literals are allowed", pos);
		}

		return new Token(TokenType.NUMBER, input.substring(start, pos), start);
	}

	private Token scanIdentifier() {
		int start = pos;

		while (!isAtEnd() && Character.isLetter(peek())) {
			advance();
		}

		String value = input.substring(start, pos);
		if (FUNCTIONS.contains(value)) {
			return new Token(TokenType.FUNCTION, value, start);
		}
		if (value.length() == 1) {
			return new Token(TokenType.VARIABLE, value, start);
		}
		throw new LexException("Invalid identifier '" + value + "' at position " + start
				+ ": variables are single letters and functions are one of " + String.join(", ", sortedFunctions()), start);
	}

	private static List<String> sortedFunctions() {
		return FUNCTIONS.stream().sorted().toList();
	}

	private void skipWhitespace() {
		while (!isAtEnd() && Character.isWhitespace(peek())) {
			advance();
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}
}
