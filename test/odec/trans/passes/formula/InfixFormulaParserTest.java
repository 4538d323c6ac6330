package odec.trans.passes.formula;

import odec.model.formula.FormulaCall;
import odec.model.formula.FormulaNode;
import odec.model.formula.FormulaNumber;
import odec.model.formula.FormulaOperation;
import odec.model.formula.FormulaSymbol;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;

@RunWith(Parameterized.class)
public class InfixFormulaParserTest {

	private static FormulaNode sym(String name) {
		return new FormulaSymbol(name);
	}

	private static FormulaNode num(String text) {
		return new FormulaNumber(text);
	}

	private static FormulaNode op(String operator, FormulaNode... operands) {
		return new FormulaOperation(operator, Arrays.asList(operands));
	}

	private static FormulaNode call(String function, FormulaNode... arguments) {
		return new FormulaCall(function, Arrays.asList(arguments));
	}

	@Parameters(name = "{0}")
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{"a - b*x_1", op("-", sym("a"), op("*", sym("b"), sym("x_1")))},
				{"a - b - c", op("-", op("-", sym("a"), sym("b")), sym("c"))},
				{"-k*Y_1", op("*", op("-", sym("k")), sym("Y_1"))},
				{"-x^2", op("-", op("^", sym("x"), num("2")))},
				{"2^3^2", op("^", num("2"), op("^", num("3"), num("2")))},
				{"(a + b)/2", op("/", op("+", sym("a"), sym("b")), num("2"))},
				{"1.5e-3*v", op("*", num("1.5e-3"), sym("v"))},
				{".5", num(".5")},
				{"a < 1 && b >= 2 || !c", op("||",
						op("&&", op("<", sym("a"), num("1")), op(">=", sym("b"), num("2"))),
						op("!", sym("c")))},
				{"a != b", op("!=", sym("a"), sym("b"))},
				{"exp(-k*t)", call("exp", op("*", op("-", sym("k")), sym("t")))},
				{"max(a, x_1)", call("max", sym("a"), sym("x_1"))},
				{"rand()", new FormulaCall("rand", Collections.emptyList())},
		});
	}

	private final String formula;
	private final FormulaNode expected;

	public InfixFormulaParserTest(String formula, FormulaNode expected) {
		this.formula = formula;
		this.expected = expected;
	}

	@Test
	public void test() throws FormulaParseException {
		assertEquals(expected, InfixFormulaParser.parse(formula));
	}
}
