package org.javai.exprcheck.equiv;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.javai.exprcheck.ast.Expression;
import org.javai.exprcheck.parse.ExpressionParser;
import org.javai.exprcheck.poly.PolynomialNormalizer;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class EquivalenceCheckerTest {

	private final EquivalenceChecker checker = EquivalenceChecker.withDefaults();

	private EquivalenceResult check(String first, String second) {
		return checker.checkEquivalenceVerbose(ExpressionParser.parse(first), ExpressionParser.parse(second));
	}

	@Nested
	class Proven {

		@ParameterizedTest(name = "{0} == {1}")
		@CsvSource(delimiter = '|', value = {
				"x + y           | y + x",
				"x * y           | y * x",
				"(x + y) + z     | x + (y + z)",
				"(x * y) * z     | x * (y * z)",
				"x * (y + z)     | x*y + x*z",
				"x + 0           | x",
				"x * 1           | x",
				"x * 0           | 0",
				"x - x           | 0",
				"2x              | 2*x",
				"(x+1)^2         | x^2 + 2x + 1",
				"(x-y)^2         | x^2 - 2xy + y^2",
				"-(x - y)        | y - x",
				"x - -y          | x + y",
				"sin(x) + sin(x) | 2 sin(x)"
		})
		void byPolynomialNormalization(String first, String second) {
			EquivalenceResult result = check(first, second);

			assertThat(result.equivalent()).isTrue();
			assertThat(result.method()).isEqualTo(EquivalenceMethod.POLYNOMIAL);
			assertThat(result.details()).startsWith("Both expressions normalize to");
		}

		@Test
		void functionArgumentsComparedStructurally() {
			EquivalenceResult result = check("sin(x+y)", "sin(y+x)");

			assertThat(result.equivalent()).isTrue();
			assertThat(result.method()).isEqualTo(EquivalenceMethod.STRUCTURAL);
		}

		@Test
		void commutedQuotientsMatchStructurally() {
			EquivalenceResult result = check("1/(x+y) + z", "z + 1/(y+x)");

			assertThat(result.equivalent()).isTrue();
			assertThat(result.method()).isEqualTo(EquivalenceMethod.STRUCTURAL);
		}

		@Test
		void fractionsCombinedByCrossMultiplication() {
			EquivalenceResult result = check("1 - 1/x", "(x-1)/x");

			assertThat(result.equivalent()).isTrue();
			assertThat(result.method()).isEqualTo(EquivalenceMethod.RATIONAL);
			assertThat(result.details()).startsWith("Cross products both normalize to");
		}

		@Test
		void quotientOfEqualTermsIsOne() {
			EquivalenceResult result = check("x/x", "1");

			assertThat(result.equivalent()).isTrue();
			assertThat(result.method()).isEqualTo(EquivalenceMethod.RATIONAL);
		}

		@Test
		void sumOfFractions() {
			assertThat(check("1/x + 1/y", "(x+y)/(x*y)").equivalent()).isTrue();
		}

		@Test
		void higherPowersWithRaisedLimit() {
			EquivalenceChecker wide = EquivalenceChecker.forMethods(new PolynomialNormalizer(4), EquivalenceChecker.DEFAULT_CASCADE);

			assertThat(wide.areEquivalent(ExpressionParser.parse("(x+1)^4"),
					ExpressionParser.parse("x^4 + 4x^3 + 6x^2 + 4x + 1"))).isTrue();
		}
	}

	@Nested
	class NotProven {

		@ParameterizedTest(name = "{0} != {1}")
		@CsvSource(delimiter = '|', value = {
				"x - y     | y - x",
				"x / y     | y / x",
				"x ^ 2     | 2 ^ x",
				"x + 1     | x + 2",
				"sin(x)    | cos(x)",
				"x         | y"
		})
		void differentExpressions(String first, String second) {
			EquivalenceResult result = check(first, second);

			assertThat(result.equivalent()).isFalse();
			assertThat(result.method()).isEqualTo(EquivalenceMethod.RATIONAL);
		}

		@Test
		void powerBeyondLimitIsNotExpanded() {
			assertThat(check("(x+1)^4", "x^4 + 4x^3 + 6x^2 + 4x + 1").equivalent()).isFalse();
		}

		@Test
		void zeroDenominatorNeverProves() {
			EquivalenceResult result = check("x/0", "y/0");

			assertThat(result.equivalent()).isFalse();
			assertThat(result.method()).isEqualTo(EquivalenceMethod.RATIONAL);
			assertThat(result.details()).isEqualTo("Divisor 0 normalizes to zero");
		}

		@Test
		void denominatorCancellingToZeroNeverProves() {
			assertThat(check("x/(y-y)", "2/(y-y)").equivalent()).isFalse();
		}

		@Test
		void nestedZeroDivisorNeverProves() {
			EquivalenceResult result = check("2/(x/0)", "0");

			assertThat(result.equivalent()).isFalse();
			assertThat(result.method()).isEqualTo(EquivalenceMethod.RATIONAL);
			assertThat(result.details()).isEqualTo("Divisor 0 normalizes to zero");
		}

		@Test
		void divisorWithZeroNumeratorNeverProves() {
			EquivalenceResult result = check("1", "1/((x-x)/y)");

			assertThat(result.equivalent()).isFalse();
			assertThat(result.details()).isEqualTo("Divisor (x-x)/y normalizes to zero");
		}

		@Test
		void verdictNamesLastStrategyRun() {
			EquivalenceChecker polynomialOnly = EquivalenceChecker.forMethods(
					new PolynomialNormalizer(), List.of(EquivalenceMethod.POLYNOMIAL));

			EquivalenceResult result = polynomialOnly.checkEquivalenceVerbose(
					ExpressionParser.parse("x"), ExpressionParser.parse("y"));

			assertThat(result.method()).isEqualTo(EquivalenceMethod.POLYNOMIAL);
			assertThat(result.details()).isEqualTo("Normalized forms differ: x vs y");
		}
	}

	@Test
	void equivalenceIsSymmetric() {
		assertThat(check("1 - 1/x", "(x-1)/x").equivalent()).isEqualTo(check("(x-1)/x", "1 - 1/x").equivalent());
		assertThat(check("x - y", "y - x").equivalent()).isEqualTo(check("y - x", "x - y").equivalent());
	}

	@Test
	void everyExpressionEqualsItself() {
		for (String text : List.of("x", "sin(x)^5", "1/(x+y)", "sqrt(x)/ln(y) - 3")) {
			assertThat(check(text, text).equivalent()).as(text).isTrue();
		}
	}

	@Test
	void repeatedChecksDoNotAccumulateAtoms() {
		PolynomialNormalizer normalizer = new PolynomialNormalizer();
		EquivalenceChecker shared = EquivalenceChecker.forMethods(normalizer, EquivalenceChecker.DEFAULT_CASCADE);
		Expression first = ExpressionParser.parse("sin(i)/x");
		Expression second = ExpressionParser.parse("x/i");

		shared.areEquivalent(first, second);
		int afterOneCheck = normalizer.atomTable().size();
		for (int i = 0; i < 1000; i++) {
			shared.areEquivalent(first, second);
		}

		assertThat(normalizer.atomTable().size()).isEqualTo(afterOneCheck);
		assertThat(normalizer.atomTable().nextId()).isGreaterThan(1000);
	}

	@Test
	void missingExpressionIsAnError() {
		EquivalenceResult result = checker.checkEquivalenceVerbose(ExpressionParser.parse("x"), null);

		assertThat(result.equivalent()).isFalse();
		assertThat(result.method()).isEqualTo(EquivalenceMethod.ERROR);
	}

	@Test
	void cascadeFollowsDefaultOrder() {
		assertThat(checker.strategies())
				.extracting(EquivalenceStrategy::method)
				.containsExactly(EquivalenceMethod.POLYNOMIAL, EquivalenceMethod.STRUCTURAL, EquivalenceMethod.RATIONAL);
	}

	@Test
	void rejectsEmptyCascade() {
		assertThatThrownBy(() -> new EquivalenceChecker(List.of()))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void errorIsNotAStrategy() {
		assertThatThrownBy(() -> EquivalenceChecker.forMethods(new PolynomialNormalizer(), List.of(EquivalenceMethod.ERROR)))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
