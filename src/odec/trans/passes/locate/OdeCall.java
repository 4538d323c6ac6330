package odec.trans.passes.locate;

import odec.model.matlab.MatlabExpression;
import odec.scope.Scope;

import java.util.List;

/**
 * Everything the locator learned about the solver invocation {@code [t, y] = odeXX(f, tspan, y0)}.
 */
public class OdeCall {

	private final Scope workingScope;
	private final String odeFunction;
	private final List<MatlabExpression> arguments;
	private final String callSiteLhs;
	private final String assignedVariable;
	private final String initialConditionVariable;
	private final String timeSpanVariable;

	public OdeCall(Scope workingScope, String odeFunction, List<MatlabExpression> arguments, String callSiteLhs,
				   String assignedVariable, String initialConditionVariable, String timeSpanVariable) {
		this.workingScope = workingScope;
		this.odeFunction = odeFunction;
		this.arguments = arguments;
		this.callSiteLhs = callSiteLhs;
		this.assignedVariable = assignedVariable;
		this.initialConditionVariable = initialConditionVariable;
		this.timeSpanVariable = timeSpanVariable;
	}

	public Scope getWorkingScope() {
		return workingScope;
	}

	public String getOdeFunction() {
		return odeFunction;
	}

	public List<MatlabExpression> getArguments() {
		return arguments;
	}

	public MatlabExpression getDerivativeFunction() {
		return arguments.get(0);
	}

	/**
	 * @return the assignment target text of the call site, e.g. "[t, x]"
	 */
	public String getCallSiteLhs() {
		return callSiteLhs;
	}

	/**
	 * @return the second output of the call site, naming the solution vector
	 */
	public String getAssignedVariable() {
		return assignedVariable;
	}

	public String getInitialConditionVariable() {
		return initialConditionVariable;
	}

	/**
	 * @return the identifier passed as the time span, or null when it was given inline
	 */
	public String getTimeSpanVariable() {
		return timeSpanVariable;
	}
}
