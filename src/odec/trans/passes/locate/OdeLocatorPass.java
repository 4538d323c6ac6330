package odec.trans.passes.locate;

import odec.errors.IssueContext;
import odec.model.matlab.MatlabExpression;
import odec.model.matlab.MatlabGroup;
import odec.model.matlab.MatlabIdentifier;
import odec.scope.Scope;
import odec.trans.passes.assemble.MalformedInitialConditionIssue;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class OdeLocatorPass {

	private static final Logger logger = Logger.getLogger("odec.locate");

	public static final String SOLVER_PREFIX = "ode";

	// [t, y] or [t y]
	private static final Pattern OUTPUT_LIST = Pattern.compile(
			"^\\s*\\[\\s*([A-Za-z]\\w*)\\s*(?:,\\s*|\\s+)([A-Za-z]\\w*)\\s*]\\s*$");

	private OdeLocatorPass() {}

	/**
	 * A file holding a single function definition and no script statements is translated
	 * from inside that function.
	 */
	public static Scope workingScope(Scope root) {
		if (root.getAssignments().isEmpty() && root.getFunctions().size() == 1) {
			return root.getFunctions().values().iterator().next();
		}
		return root;
	}

	public static OdeCall perform(IssueContext ctx, Scope root) {
		Scope working = workingScope(root);

		String odeFunction = null;
		List<MatlabExpression> arguments = null;
		for (Map.Entry<String, List<MatlabExpression>> call : working.allCalls().entrySet()) {
			if (!call.getKey().startsWith(SOLVER_PREFIX)) {
				continue;
			}
			if (odeFunction == null) {
				odeFunction = call.getKey();
				arguments = call.getValue();
			} else {
				logger.fine("ignoring additional solver call " + call.getKey());
			}
		}
		if (odeFunction == null) {
			ctx.error(new NoOdeCallFoundIssue());
			return null;
		}

		NameMentionVisitor mentions = new NameMentionVisitor(odeFunction);
		String callSiteLhs = null;
		for (Map.Entry<String, MatlabExpression> assignment : working.allAssignments().entrySet()) {
			if (assignment.getValue().accept(mentions)) {
				callSiteLhs = assignment.getKey();
				break;
			}
		}
		if (callSiteLhs == null) {
			ctx.error(new MalformedOdeCallIssue(odeFunction, "the result is never assigned"));
			return null;
		}
		Matcher outputs = OUTPUT_LIST.matcher(callSiteLhs);
		if (!outputs.matches()) {
			ctx.error(new MalformedOdeCallIssue(odeFunction,
					"the result is assigned to " + callSiteLhs + " instead of a two element output list"));
			return null;
		}
		String assignedVariable = outputs.group(2);

		if (arguments.size() < 3) {
			ctx.error(new MalformedOdeCallIssue(odeFunction,
					"expected at least 3 arguments, found " + arguments.size()));
			return null;
		}

		MatlabExpression timeSpan = MatlabGroup.strip(arguments.get(1));
		String timeSpanVariable = null;
		if (timeSpan instanceof MatlabIdentifier) {
			timeSpanVariable = ((MatlabIdentifier) timeSpan).getName();
		}

		MatlabExpression initialConditions = MatlabGroup.strip(arguments.get(2));
		if (!(initialConditions instanceof MatlabIdentifier)) {
			ctx.error(new MalformedInitialConditionIssue(initialConditions.toString(), null));
			return null;
		}
		String initialConditionVariable = ((MatlabIdentifier) initialConditions).getName();

		return new OdeCall(working, odeFunction, arguments, callSiteLhs, assignedVariable,
				initialConditionVariable, timeSpanVariable);
	}
}
