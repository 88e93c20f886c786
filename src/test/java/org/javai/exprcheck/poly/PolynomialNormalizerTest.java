package org.javai.exprcheck.poly;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import java.util.Collections;
import org.javai.exprcheck.ast.Expression;
import org.javai.exprcheck.parse.ExpressionParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class PolynomialNormalizerTest {

	private PolynomialNormalizer normalizer;

	@BeforeEach
	void setUp() {
		normalizer = new PolynomialNormalizer();
	}

	private Polynomial normalize(String text) {
		return normalizer.normalize(ExpressionParser.parse(text));
	}

	@Nested
	class Expansion {

		@Test
		void binomialSquareMatchesExpandedForm() {
			assertThat(normalize("(x+1)^2")).isEqualTo(normalize("x^2 + 2x + 1"));
			assertThat(normalize("(x+1)^2").render()).isEqualTo("1 + 2*x + x^2");
		}

		@Test
		void differenceOfSquares() {
			assertThat(normalize("(x+y)*(x-y)")).isEqualTo(normalize("x^2 - y^2"));
		}

		@Test
		void binomialCubeHasFourTerms() {
			Polynomial cube = normalize("(x+y)^3");

			assertThat(cube.size()).isEqualTo(4);
			assertThat(cube).isEqualTo(normalize("x^3 + 3x^2 y + 3x y^2 + y^3"));
		}

		@Test
		void repeatedAdditionCollectsCoefficient() {
			String hundred = String.join(" + ", Collections.nCopies(100, "x"));

			Polynomial sum = normalize(hundred);

			assertThat(sum.size()).isEqualTo(1);
			assertThat(sum.coefficient(Monomial.of(new VariableSymbol("x")))).isEqualTo(BigInteger.valueOf(100));
		}

		@Test
		void leadingMinusAndUnaryMinusNegate() {
			assertThat(normalize("-x")).isEqualTo(Polynomial.variable("x").negate());
			assertThat(normalize("y - -x")).isEqualTo(normalize("x + y"));
			assertThat(normalize("-(x - y)")).isEqualTo(normalize("y - x"));
		}

		@Test
		void zeroLiteralIsZeroPolynomial() {
			assertThat(normalize("0")).isEqualTo(Polynomial.ZERO);
			assertThat(normalize("0 * x")).isEqualTo(Polynomial.ZERO);
			assertThat(normalize("x - x")).isEqualTo(Polynomial.ZERO);
		}

		@Test
		void squareOfLeadingMinusIsPositive() {
			assertThat(normalize("(-x)^2")).isEqualTo(normalize("x^2"));
		}
	}

	@Nested
	class Atoms {

		@Test
		void powerAboveLimitIsSingleAtom() {
			Polynomial quartic = normalize("(x+1)^4");

			assertThat(quartic.size()).isEqualTo(1);
			assertThat(quartic.render()).contains("^4");
			assertThat(quartic).isNotEqualTo(normalize("x^4 + 4x^3 + 6x^2 + 4x + 1"));
		}

		@Test
		void raisedLimitExpandsQuartic() {
			PolynomialNormalizer wide = new PolynomialNormalizer(4);

			Polynomial quartic = wide.normalize(ExpressionParser.parse("(x+1)^4"));

			assertThat(quartic.size()).isEqualTo(5);
			assertThat(quartic).isEqualTo(wide.normalize(ExpressionParser.parse("x^4 + 4x^3 + 6x^2 + 4x + 1")));
		}

		@Test
		void largeExponentStaysAtomic() {
			Polynomial p = normalize("x^10");

			assertThat(p.size()).isEqualTo(1);
			assertThat(p.render()).isEqualTo("x^10");
			assertThat(normalizer.atomTable().size()).isEqualTo(1);
		}

		@ParameterizedTest
		@ValueSource(strings = {"x^y", "(x/y)^2", "sin(x)^2", "2^x"})
		void powerWithNonExpandableBaseOrExponentIsAtom(String text) {
			Polynomial p = normalize(text);

			assertThat(p.size()).isEqualTo(1);
			Monomial only = p.terms().keySet().iterator().next();
			assertThat(only.powers().keySet()).singleElement().isInstanceOf(AtomicExpression.class);
		}

		@Test
		void divisionAndCallsAreAtoms() {
			assertThat(normalize("x/y").terms().keySet().iterator().next().powers().firstKey())
					.isInstanceOf(AtomicExpression.class);
			assertThat(normalize("sin(x) + sin(x)").render()).isEqualTo("2*sin(x)");
		}

		@Test
		void identicalSubtreesShareOneAtom() {
			normalize("sin(x) + 1 + 2*sin(x)");

			assertThat(normalizer.atomTable().size()).isEqualTo(1);
		}

		@Test
		void atomIdentityIsSyntactic() {
			assertThat(normalize("sin(x+y) - sin(y+x)").size()).isEqualTo(2);
			assertThat(normalizer.atomTable().size()).isEqualTo(2);
			assertThat(normalize("sin(x+y)")).isNotEqualTo(normalize("sin(y+x)"));
		}

		@Test
		void atomsFromEarlierCallsAreNotRetained() {
			normalize("sin(x) + cos(x) + x/y");
			normalize("ln(z)");

			assertThat(normalizer.atomTable().atoms())
					.extracting(AtomicExpression::canonical)
					.containsExactly("ln(z)");
			assertThat(normalizer.atomTable().nextId()).isEqualTo(4);
		}

		@Test
		void atomsCompareEqualAcrossCalls() {
			assertThat(normalize("2*sin(x)")).isEqualTo(normalize("sin(x) + sin(x)"));
		}

		@Test
		void atomsMultiplyLikeSymbols() {
			assertThat(normalize("sin(x)*(sin(x) + 1)")).isEqualTo(normalize("sin(x)*sin(x) + sin(x)"));
		}
	}

	@Nested
	class Expandability {

		@ParameterizedTest
		@ValueSource(strings = {"x", "2", "x + y", "2x*y - 3", "-(x + 1)", "x - -y"})
		void expandable(String text) {
			assertThat(PolynomialNormalizer.isExpandable(ExpressionParser.parse(text))).isTrue();
		}

		@ParameterizedTest
		@ValueSource(strings = {"x/2", "x^2", "sin(x)", "x + ln(y)", "2*(x/y)"})
		void notExpandable(String text) {
			Expression expression = ExpressionParser.parse(text);

			assertThat(PolynomialNormalizer.isExpandable(expression)).isFalse();
		}
	}

	@Test
	void rejectsLimitBelowOne() {
		assertThatThrownBy(() -> new PolynomialNormalizer(0))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void rejectsNullExpression() {
		assertThatThrownBy(() -> normalizer.normalize(null))
				.isInstanceOf(NullPointerException.class);
	}
}
