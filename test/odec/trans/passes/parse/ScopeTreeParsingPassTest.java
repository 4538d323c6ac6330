package odec.trans.passes.parse;

import odec.errors.TopLevelIssueContext;
import odec.scope.Scope;
import odec.trans.IOErrorIssue;
import org.junit.Before;
import org.junit.Test;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;

import static odec.model.matlab.MatlabBuilder.*;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.junit.Assert.*;

public class ScopeTreeParsingPassTest {

	private TopLevelIssueContext ctx;

	@Before
	public void setUp() {
		ctx = new TopLevelIssueContext();
	}

	private ScopeTreeParsingIssue singleIssue() {
		assertEquals(1, ctx.getIssues().size());
		assertThat(ctx.getIssues().get(0), instanceOf(ScopeTreeParsingIssue.class));
		return (ScopeTreeParsingIssue) ctx.getIssues().get(0);
	}

	@Test
	public void twoStateFixture() {
		Scope root = ScopeTreeParsingPass.perform(ctx, Paths.get("examples", "scopes", "two_state.json"));
		assertFalse(ctx.hasErrors());
		assertNull(root.getParent());
		assertEquals(Arrays.asList("tspan", "xinit", "a", "b", "[t, x]"),
				new ArrayList<>(root.getAssignments().keySet()));
		assertEquals(columnVector(num(0), num(0)), root.getAssignments().get("xinit"));
		assertEquals(num("0.348"), root.getAssignments().get("b"));
		assertEquals(Arrays.asList(handle("f"), id("tspan"), id("xinit")), root.getCalls().get("ode45"));
		assertEquals("function", root.inferredType("ode45"));

		Scope f = root.getFunctions().get("f");
		assertSame(root, f.getParent());
		assertEquals(Arrays.asList("t", "x"), f.getParameters());
		assertEquals(Collections.singletonList("dx"), f.getReturns());
		assertEquals(
				columnVector(
						binop("-", id("a"), binop("*", id("b"), ref("x", num(1)))),
						binop("*", id("a"), ref("x", num(1)))),
				f.getAssignments().get("dx"));
	}

	@Test
	public void anonymousFunctionFixture() {
		Scope root = ScopeTreeParsingPass.perform(ctx, Paths.get("examples", "scopes", "anonymous.json"));
		assertFalse(ctx.hasErrors());
		assertTrue(root.getFunctions().isEmpty());
		assertEquals(rowVector(num(1), num(2)), root.getAssignments().get("y0"));
	}

	@Test
	public void numericValuesAndDefaults() {
		Scope root = ScopeTreeParsingPass.perform(ctx, "{\"assignments\": ["
				+ "{\"lhs\": \"a\", \"rhs\": {\"type\": \"number\", \"value\": 2.5}},"
				+ "{\"lhs\": \"b\", \"rhs\": {\"type\": \"transpose\", \"operand\": {\"type\": \"identifier\", \"name\": \"v\"}}},"
				+ "{\"lhs\": \"c\", \"rhs\": {\"type\": \"array\", \"cell\": true, \"rows\": [[{\"type\": \"string\", \"value\": \"s\"}]]}}"
				+ "]}");
		assertFalse(ctx.hasErrors());
		assertEquals(num("2.5"), root.getAssignments().get("a"));
		assertEquals(transpose(id("v")), root.getAssignments().get("b"));
		assertEquals(cell(row(str("s"))), root.getAssignments().get("c"));
		assertTrue(root.getCalls().isEmpty());
	}

	@Test
	public void unknownExpressionType() {
		assertNull(ScopeTreeParsingPass.perform(ctx,
				"{\"assignments\": [{\"lhs\": \"a\", \"rhs\": {\"type\": \"struct\"}}]}"));
		assertEquals("/assignments/0/rhs/type", singleIssue().getPath());
	}

	@Test
	public void functionWithoutName() {
		assertNull(ScopeTreeParsingPass.perform(ctx, "{\"functions\": [{\"parameters\": [\"t\", \"x\"]}]}"));
		assertEquals("/functions/0/name", singleIssue().getPath());
	}

	@Test
	public void nonNumericNumber() {
		assertNull(ScopeTreeParsingPass.perform(ctx,
				"{\"calls\": [{\"name\": \"f\", \"arguments\": [{\"type\": \"number\", \"value\": \"one\"}]}]}"));
		assertEquals("/calls/0/arguments/0/value", singleIssue().getPath());
	}

	@Test
	public void malformedJson() {
		assertNull(ScopeTreeParsingPass.perform(ctx, "{\"assignments\": ["));
		assertEquals("", singleIssue().getPath());
	}

	@Test
	public void missingFile() {
		assertNull(ScopeTreeParsingPass.perform(ctx, Paths.get("examples", "scopes", "does_not_exist.json")));
		assertEquals(1, ctx.getIssues().size());
		assertThat(ctx.getIssues().get(0), instanceOf(IOErrorIssue.class));
	}
}
