package odec.trans.passes.resolve;

import odec.errors.IssueContext;
import odec.model.matlab.*;
import odec.scope.Scope;
import odec.trans.TranslationContext;
import odec.trans.passes.locate.OdeCall;

import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Turns the first argument of the solver call into the scope of the derivative function,
 * following variables that hold handles and synthesizing a function for anonymous bodies
 * written as a vector.
 */
public class HandleResolutionPass {

	private static final Logger logger = Logger.getLogger("odec.resolve");

	private HandleResolutionPass() {}

	public static Scope perform(IssueContext ctx, TranslationContext translation, OdeCall call) {
		Scope working = call.getWorkingScope();
		String functionName;
		try {
			functionName = resolveName(translation, call, working, call.getDerivativeFunction(), new HashSet<>());
		} catch (UnresolvedIdentifierIssue | CannotResolveHandleIssue issue) {
			ctx.error(issue);
			return null;
		}

		Scope function = translation.getSynthesizedFunction(functionName);
		if (function == null) {
			function = findFunction(working, functionName);
		}
		if (function == null) {
			ctx.error(new CannotResolveHandleIssue(call.getOdeFunction(), call.getDerivativeFunction(),
					"no function named " + functionName + " is defined"));
			return null;
		}
		if (function.getParameters().size() < 2) {
			ctx.error(new MalformedDerivativeBodyIssue(functionName,
					"expected parameters (t, y), found " + function.getParameters().size() + " parameter(s)"));
			return null;
		}
		if (function.getReturns().isEmpty()) {
			ctx.error(new MalformedDerivativeBodyIssue(functionName, "it has no output variable"));
			return null;
		}
		logger.fine("derivative function is " + functionName);
		return function;
	}

	private static Scope findFunction(Scope working, String name) {
		for (Scope scope : working.allScopes()) {
			Scope function = scope.getFunctions().get(name);
			if (function != null) {
				return function;
			}
		}
		return null;
	}

	private static String resolveName(TranslationContext translation, OdeCall call, Scope working,
									  MatlabExpression argument, Set<String> seen) {
		MatlabExpression stripped = MatlabGroup.strip(argument);
		if (stripped instanceof MatlabFunctionHandle) {
			return ((MatlabFunctionHandle) stripped).getName();
		}
		if (stripped instanceof MatlabAnonymousFunction) {
			return resolveAnonymous(translation, call, working, (MatlabAnonymousFunction) stripped);
		}
		if (stripped instanceof MatlabIdentifier) {
			String variable = ((MatlabIdentifier) stripped).getName();
			if (!seen.add(variable)) {
				throw new CannotResolveHandleIssue(call.getOdeFunction(), argument,
						"variable " + variable + " is defined in terms of itself");
			}
			Map<String, MatlabExpression> assignments = working.allAssignments();
			if (!assignments.containsKey(variable)) {
				throw new UnresolvedIdentifierIssue(variable);
			}
			MatlabExpression value = MatlabGroup.strip(assignments.get(variable));
			if (value instanceof MatlabFunctionHandle || value instanceof MatlabAnonymousFunction
					|| value instanceof MatlabIdentifier) {
				return resolveName(translation, call, working, value, seen);
			}
			throw new CannotResolveHandleIssue(call.getOdeFunction(), argument,
					"variable " + variable + " does not hold a function handle");
		}
		throw new CannotResolveHandleIssue(call.getOdeFunction(), argument,
				"expected a function handle, an anonymous function or a variable holding one");
	}

	private static String resolveAnonymous(TranslationContext translation, OdeCall call, Scope working,
										   MatlabAnonymousFunction function) {
		MatlabExpression body = MatlabGroup.strip(function.getBody());
		if (body instanceof MatlabArrayOrCall) {
			return ((MatlabArrayOrCall) body).getName();
		}
		if (body instanceof MatlabArray && !((MatlabArray) body).isCell()) {
			String name = translation.newAnonymousFunctionName();
			String output = translation.getNaming().rename(name, "out");
			Scope synthesized = translation.declareSynthesizedFunction(working, name, function.getParameters(),
					Collections.singletonList(output));
			synthesized.addAssignment(output, body);
			synthesized.setType(output, Scope.VARIABLE_TYPE);
			for (String parameter : function.getParameters()) {
				synthesized.setType(parameter, Scope.VARIABLE_TYPE);
			}
			logger.fine("synthesized function " + name + " for " + function);
			return name;
		}
		throw new CannotResolveHandleIssue(call.getOdeFunction(), function,
				"the body of an anonymous derivative function must be a call or a vector");
	}
}
