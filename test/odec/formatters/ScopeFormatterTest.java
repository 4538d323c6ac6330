package odec.formatters;

import odec.model.matlab.MatlabExpression;
import odec.scope.Scope;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static odec.model.matlab.MatlabBuilder.*;
import static org.junit.Assert.assertEquals;

public class ScopeFormatterTest {

	@Test
	public void scriptWithFunction() {
		Scope root = Scope.root();
		List<MatlabExpression> arguments = Arrays.asList(handle("f"), id("tspan"), id("xinit"));
		root.addAssignment("tspan", rowVector(num(0), num(300)));
		root.addAssignment("xinit", columnVector(num(0), num(0)));
		root.addAssignment("label", str("it's"));
		root.addAssignment("[t, x]", ref("ode45", arguments.toArray(new MatlabExpression[0])));
		root.addCall("ode45", arguments);
		root.setType("xinit", Scope.VARIABLE_TYPE);
		root.setType("f", "function");
		Scope f = root.declareFunction("f", Arrays.asList("t", "x"), Collections.singletonList("dx"));
		f.addAssignment("dx", columnVector(
				binop("-", id("a"), binop("*", id("b"), ref("x", num(1)))),
				group(unary("-", transpose(id("y"))))));

		String expected = "% script\n" +
				"tspan = [0 300];\n" +
				"xinit = [0; 0];\n" +
				"label = 'it''s';\n" +
				"[t, x] = ode45(@f, tspan, xinit);\n" +
				"% calls ode45(@f, tspan, xinit)\n" +
				"% types f: function, xinit: variable\n" +
				"function dx = f(t, x)\n" +
				"    dx = [a - b * x(1); (-y')];\n" +
				"end\n";
		assertEquals(expected, ScopeFormatter.format(root));
	}

	@Test
	public void severalOutputs() {
		Scope root = Scope.root();
		Scope g = root.declareFunction("g", Collections.singletonList("s"), Arrays.asList("p", "q"));
		g.addAssignment("p", anon(params("u", "v"), cell(row(id("u")), row(id("v")))));
		String expected = "% script\n" +
				"function [p, q] = g(s)\n" +
				"    p = @(u, v) {u; v};\n" +
				"end\n";
		assertEquals(expected, ScopeFormatter.format(root));
	}
}
