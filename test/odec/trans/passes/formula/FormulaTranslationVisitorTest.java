package odec.trans.passes.formula;

import odec.model.matlab.MatlabExpression;
import odec.scope.Scope;
import odec.trans.naming.NamingScheme;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static odec.model.matlab.MatlabBuilder.*;
import static org.junit.Assert.assertEquals;

@RunWith(Parameterized.class)
public class FormulaTranslationVisitorTest {

	@Parameters(name = "{1}")
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{binop("+", id("a"), num("2.5")), "a + 2.5"},
				{binop("-", id("a"), binop("*", id("b"), ref("x", num(1)))), "a - b*x_1"},
				{binop(".*", id("a"), binop("./", id("b"), id("c"))), "a*(b/c)"},
				{binop("./", binop(".*", id("a"), id("b")), id("c")), "a*b/c"},
				{binop(".^", id("a"), num(2)), "a^2"},
				{binop("^", group(binop("+", id("a"), id("b"))), num(2)), "(a + b)^2"},
				{binop("~=", id("a"), id("b")), "a != b"},
				{binop("&", binop("<", id("a"), num(1)), binop(">=", id("b"), num(2))), "a < 1 && b >= 2"},
				{binop("|", id("a"), id("b")), "a || b"},
				{unary("~", id("a")), "!a"},
				{unary("-", ref("x", num(2))), "-x_2"},
				{transpose(id("a")), "a"},
				{ref("exp", unary("-", id("k"))), "exp(-k)"},
				{ref("max", id("a"), ref("x", num(1))), "max(a, x_1)"},
				// operands keep the grouping of the tree
				{binop("^", binop("^", id("a"), num(2)), num(3)), "(a^2)^3"},
				{binop("^", id("a"), binop("^", num(2), num(3))), "a^2^3"},
				{binop("-", id("a"), binop("-", id("b"), id("c"))), "a - (b - c)"},
				{binop("-", binop("-", id("a"), id("b")), id("c")), "a - b - c"},
				{binop("*", binop("+", id("a"), id("b")), id("c")), "(a + b)*c"},
				{binop("==", binop("<", id("a"), id("b")), id("c")), "(a < b) == c"},
				{unary("-", binop("+", id("a"), id("b"))), "-(a + b)"},
				{binop("^", unary("-", id("a")), num(2)), "(-a)^2"},
				{unary("-", binop("^", id("a"), num(2))), "-a^2"},
				// untyped names are calls, even when assigned
				{ref("g", num(3)), "g(3)"},
				// row and column vector forms
				{ref("x", num(1), num(3)), "x_3"},
				{ref("x", num(3), num(1)), "x_3"},
				// subscript through a chain of bindings
				{ref("x", id("i")), "x_2"},
				{ref("x", group(num(1))), "x_1"},
		});
	}

	private final MatlabExpression expression;
	private final String expected;

	public FormulaTranslationVisitorTest(MatlabExpression expression, String expected) {
		this.expression = expression;
		this.expected = expected;
	}

	@Test
	public void test() {
		Scope root = Scope.root();
		root.addAssignment("j", num(2));
		root.addAssignment("i", id("j"));
		root.addAssignment("g", anon(params("z"), binop("*", id("z"), num(2))));
		Scope f = root.declareFunction("f", Arrays.asList("t", "x"), Collections.singletonList("dx"));
		f.setType("x", Scope.VARIABLE_TYPE);
		f.setType("exp", "function");
		assertEquals(expected, FormulaTranslationVisitor.translate(expression, f, new NamingScheme(1)));
	}
}
