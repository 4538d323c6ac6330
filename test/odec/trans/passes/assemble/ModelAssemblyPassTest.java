package odec.trans.passes.assemble;

import odec.errors.Issue;
import odec.errors.IssueWithContext;
import odec.errors.TopLevelIssueContext;
import odec.model.bio.ModelEntity;
import odec.model.bio.OdeModel;
import odec.model.bio.Parameter;
import odec.model.bio.Species;
import odec.model.matlab.MatlabExpression;
import odec.scope.Scope;
import odec.trans.TranslationContext;
import odec.trans.naming.NamingScheme;
import odec.trans.passes.formula.NonLiteralSubscriptIssue;
import odec.trans.passes.formula.UnsupportedMatrixShapeIssue;
import odec.trans.passes.resolve.MalformedDerivativeBodyIssue;
import odec.trans.passes.resolve.UnresolvedIdentifierIssue;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static odec.model.matlab.MatlabBuilder.*;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.junit.Assert.*;

public class ModelAssemblyPassTest {

	private Scope root;
	private Scope f;
	private TopLevelIssueContext ctx;

	// tspan = [0 300]; xinit = [0; 0]; a = 0.6; b = 0.348;
	// [t, x] = ode45(@f, tspan, xinit);
	// function dx = f(t, x)
	//     dx = [a - b*x(1); a*x(1)];
	// end
	@Before
	public void setUp() {
		root = Scope.root();
		List<MatlabExpression> arguments = Arrays.asList(handle("f"), id("tspan"), id("xinit"));
		root.addAssignment("tspan", rowVector(num(0), num(300)));
		root.addAssignment("xinit", columnVector(num(0), num(0)));
		root.addAssignment("a", num("0.6"));
		root.addAssignment("b", num("0.348"));
		root.addAssignment("[t, x]", ref("ode45", arguments.toArray(new MatlabExpression[0])));
		root.addCall("ode45", arguments);
		f = root.declareFunction("f", Arrays.asList("t", "x"), Collections.singletonList("dx"));
		f.setType("x", Scope.VARIABLE_TYPE);
		f.setType("dx", Scope.VARIABLE_TYPE);
		f.addAssignment("dx", columnVector(
				binop("-", id("a"), binop("*", id("b"), ref("x", num(1)))),
				binop("*", id("a"), ref("x", num(1)))));
		ctx = new TopLevelIssueContext();
	}

	private OdeModel assemble(boolean useSpecies) {
		TranslationContext translation = new TranslationContext(NamingScheme.forScope(root));
		return ModelAssemblyPass.perform(ctx, translation, root, useSpecies);
	}

	private Issue singleIssue() {
		assertEquals(1, ctx.getIssues().size());
		return ctx.getIssues().get(0);
	}

	private static List<String> ids(List<? extends ModelEntity> entities) {
		List<String> result = new ArrayList<>();
		for (ModelEntity entity : entities) {
			result.add(entity.getId());
		}
		return result;
	}

	@Test
	public void twoStateSystem() {
		OdeModel expected = OdeModel.builder()
				.compartment("comp1", 1)
				.species("x_1", "comp1", 0)
				.species("x_2", "comp1", 0)
				.rateRule("x_1", "a - b*x_1")
				.rateRule("x_2", "a*x_1")
				.parameter("a", 0.6, true)
				.parameter("b", 0.348, true)
				.build();
		assertEquals(expected, assemble(true));
		assertFalse(ctx.hasErrors());
		assertTrue(ctx.getWarnings().isEmpty());
	}

	@Test
	public void statesAsParameters() {
		OdeModel model = assemble(false);
		assertTrue(model.getEntities(Species.class).isEmpty());
		Parameter x1 = (Parameter) model.getEntity("x_1").get();
		assertFalse(x1.isConstant());
		assertEquals(Arrays.asList("x_1", "x_2", "a", "b"), ids(model.getEntities(Parameter.class)));
	}

	@Test
	public void oneStatePerInitialCondition() {
		root.addAssignment("xinit", rowVector(num(4), unary("-", num(3)), num("2.5"), num(0)));
		OdeModel model = assemble(true);
		assertEquals(Arrays.asList("x_1", "x_2", "x_3", "x_4"), ids(model.getEntities(Species.class)));
		assertEquals(-3, ((Species) model.getEntity("x_2").get()).getValue(), 0);
		assertEquals(2, model.getRateRules().size());
	}

	@Test
	public void computedInitialCondition() {
		root.addAssignment("xinit", columnVector(binop("*", num(2), id("a")), num(1)));
		OdeModel model = assemble(true);
		assertEquals(0, ((Species) model.getEntity("x_1").get()).getValue(), 0);
		assertEquals("2*a", model.getInitialAssignment("x_1").get().getFormula());
		assertFalse(model.getInitialAssignment("x_2").isPresent());
	}

	@Test
	public void assignedVariableNamesStates() {
		Scope fresh = Scope.root();
		for (String name : Arrays.asList("tspan", "xinit", "a", "b")) {
			fresh.addAssignment(name, root.getAssignments().get(name));
		}
		List<MatlabExpression> arguments = Arrays.asList(handle("f"), id("tspan"), id("xinit"));
		fresh.addAssignment("[time, sol]", ref("ode45", arguments.toArray(new MatlabExpression[0])));
		fresh.addCall("ode45", arguments);
		Scope g = fresh.declareFunction("f", Arrays.asList("t", "x"), Collections.singletonList("dx"));
		g.setType("x", Scope.VARIABLE_TYPE);
		g.addAssignment("dx", f.getAssignments().get("dx"));
		root = fresh;

		OdeModel model = assemble(true);
		assertEquals("a - b*sol_1", model.getRateRule("sol_1").get().getFormula());
		assertEquals("a*sol_1", model.getRateRule("sol_2").get().getFormula());
	}

	@Test
	public void translationIsRepeatable() {
		assertEquals(assemble(true), assemble(true));
	}

	@Test
	public void anonymousDerivativeTranslationIsRepeatable() {
		// y0 = [1 2]; k = 3; [T, Y] = ode23(@(t, y) [-k*y(1) k*y(1) - y(2)], [0 10], y0);
		Scope fresh = Scope.root();
		MatlabExpression derivative = anon(params("t", "y"), rowVector(
				binop("*", unary("-", id("k")), ref("y", num(1))),
				binop("-", binop("*", id("k"), ref("y", num(1))), ref("y", num(2)))));
		List<MatlabExpression> arguments = Arrays.asList(derivative, rowVector(num(0), num(10)), id("y0"));
		fresh.addAssignment("y0", rowVector(num(1), num(2)));
		fresh.addAssignment("k", num(3));
		fresh.addAssignment("[T, Y]", ref("ode23", arguments.toArray(new MatlabExpression[0])));
		fresh.addCall("ode23", arguments);
		root = fresh;

		OdeModel first = assemble(true);
		OdeModel second = assemble(true);
		assertFalse(ctx.hasErrors());
		assertEquals(first, second);
		assertEquals("-k*Y_1", second.getRateRule("Y_1").get().getFormula());
		assertEquals("k*Y_1 - Y_2", second.getRateRule("Y_2").get().getFormula());
		assertTrue(root.getFunctions().isEmpty());
	}

	@Test
	public void functionBindingShadowsScriptBinding() {
		f.addAssignment("a", num(7));
		OdeModel model = assemble(true);
		assertEquals(7, ((Parameter) model.getEntity("a").get()).getValue(), 0);
		assertEquals(Arrays.asList("a", "b"), ids(model.getEntities(Parameter.class)));
	}

	@Test
	public void parametersFromOtherBindings() {
		root.addAssignment("v", rowVector(num(1), binop("*", num(2), id("a"))));
		root.addAssignment("c", binop("*", id("a"), id("b")));
		root.addAssignment("opts", ref("odeset", str("RelTol"), num("1e-4")));
		root.addAssignment("g", anon(params("s"), binop("*", id("s"), num(2))));
		OdeModel model = assemble(true);

		assertEquals(Arrays.asList("a", "b", "v_1", "v_2", "c"), ids(model.getEntities(Parameter.class)));
		Parameter v1 = (Parameter) model.getEntity("v_1").get();
		assertFalse(v1.isConstant());
		assertEquals(1, v1.getValue(), 0);
		assertEquals("2*a", model.getInitialAssignment("v_2").get().getFormula());
		Parameter c = (Parameter) model.getEntity("c").get();
		assertTrue(c.isConstant());
		assertEquals("a*b", model.getInitialAssignment("c").get().getFormula());
	}

	@Test
	public void structuredAssignmentIsSkippedWithWarning() {
		root.addAssignment("v(2)", num(4));
		OdeModel model = assemble(true);
		assertNotNull(model);
		assertFalse(model.getEntity("v(2)").isPresent());
		assertEquals(1, ctx.getWarnings().size());
		assertThat(ctx.getWarnings().get(0), instanceOf(UnsupportedStructuredLhsIssue.class));
	}

	@Test
	public void matrixParameterIsSkippedWithWarning() {
		root.addAssignment("m", array(row(num(1), num(2)), row(num(3), num(4))));
		OdeModel model = assemble(true);
		assertFalse(ctx.hasErrors());
		assertFalse(model.getEntity("m_1").isPresent());
		assertEquals(1, ctx.getWarnings().size());
		Issue warning = ctx.getWarnings().get(0);
		assertThat(warning, instanceOf(IssueWithContext.class));
		assertThat(((IssueWithContext) warning).getIssue(), instanceOf(UnsupportedMatrixShapeIssue.class));
		assertThat(warning.getMessage(), containsString("while translating the parameter of m"));
	}

	@Test
	public void matrixDerivativeBody() {
		f.addAssignment("dx", array(
				row(ref("x", num(1)), ref("x", num(2))),
				row(ref("x", num(2)), ref("x", num(1)))));
		assertNull(assemble(true));
		assertThat(singleIssue(), instanceOf(UnsupportedMatrixShapeIssue.class));
	}

	@Test
	public void tooManyDerivatives() {
		root.addAssignment("xinit", rowVector(num(0)));
		assemble(true);
		assertThat(singleIssue(), instanceOf(MalformedDerivativeBodyIssue.class));
	}

	@Test
	public void derivativeOutputMustBeVector() {
		f.addAssignment("dx", binop("*", id("a"), ref("x", num(1))));
		assemble(true);
		assertThat(singleIssue(), instanceOf(MalformedDerivativeBodyIssue.class));
	}

	@Test
	public void initialConditionsMustBeVector() {
		root.addAssignment("xinit", num(3));
		assemble(true);
		assertThat(singleIssue(), instanceOf(MalformedInitialConditionIssue.class));
	}

	@Test
	public void cellInitialConditions() {
		root.addAssignment("xinit", cell(row(num(0), num(0))));
		assemble(true);
		assertThat(singleIssue(), instanceOf(MalformedInitialConditionIssue.class));
	}

	@Test
	public void missingInitialConditions() {
		Scope fresh = Scope.root();
		List<MatlabExpression> arguments = Arrays.asList(handle("f"), id("tspan"), id("nowhere"));
		fresh.addAssignment("[t, x]", ref("ode45", arguments.toArray(new MatlabExpression[0])));
		fresh.addCall("ode45", arguments);
		Scope g = fresh.declareFunction("f", Arrays.asList("t", "x"), Collections.singletonList("dx"));
		g.addAssignment("dx", rowVector(num(1)));
		root = fresh;
		assemble(true);
		assertThat(singleIssue(), instanceOf(UnresolvedIdentifierIssue.class));
	}

	@Test
	public void nonLiteralSubscriptInRateRule() {
		f.addAssignment("dx", columnVector(ref("x", id("k")), num(0)));
		assemble(true);
		Issue issue = singleIssue();
		assertThat(issue, instanceOf(IssueWithContext.class));
		assertThat(((IssueWithContext) issue).getIssue(), instanceOf(NonLiteralSubscriptIssue.class));
		assertThat(issue.getMessage(), containsString("while translating the rate rule of x_1"));
	}

	@Test
	public void resolvedSubscriptInRateRule() {
		root.addAssignment("second", num(2));
		f.addAssignment("dx", columnVector(ref("x", id("second")), num(0)));
		OdeModel model = assemble(true);
		assertEquals("x_2", model.getRateRule("x_1").get().getFormula());
		assertEquals("0", model.getRateRule("x_2").get().getFormula());
	}
}
