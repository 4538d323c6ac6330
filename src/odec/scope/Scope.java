package odec.scope;

import odec.model.matlab.MatlabExpression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 *
 * A lexical scope of a MATLAB program: the script itself or one function definition.
 *
 * A scope owns the scopes of the functions declared inside it. The parent link is only
 * used to walk outwards when looking up inferred types; it never implies ownership.
 *
 */
public class Scope {
	public static final String VARIABLE_TYPE = "variable";

	private final String name;
	private final Scope parent;
	private final List<String> parameters;
	private final List<String> returns;
	private final Map<String, MatlabExpression> assignments;
	private final Map<String, List<MatlabExpression>> calls;
	private final Map<String, Scope> functions;
	private final Map<String, String> types;

	public Scope(String name, Scope parent, List<String> parameters, List<String> returns) {
		this.name = name;
		this.parent = parent;
		this.parameters = new ArrayList<>(parameters);
		this.returns = new ArrayList<>(returns);
		this.assignments = new LinkedHashMap<>();
		this.calls = new LinkedHashMap<>();
		this.functions = new LinkedHashMap<>();
		this.types = new HashMap<>();
	}

	public static Scope root() {
		return new Scope(null, null, Collections.emptyList(), Collections.emptyList());
	}

	/**
	 * Creates the scope of a function declared in this scope and registers it under
	 * {@code functionName}, replacing any previous declaration of that name.
	 *
	 * @return the new child scope
	 */
	public Scope declareFunction(String functionName, List<String> functionParameters, List<String> functionReturns) {
		Scope child = new Scope(functionName, this, functionParameters, functionReturns);
		functions.put(functionName, child);
		return child;
	}

	public void addAssignment(String lhs, MatlabExpression rhs) {
		assignments.put(lhs, rhs);
	}

	/**
	 * Records a call site. When the same function is called several times only the first
	 * argument list is kept.
	 */
	public void addCall(String functionName, List<MatlabExpression> arguments) {
		calls.putIfAbsent(functionName, arguments);
	}

	public void setType(String variable, String type) {
		types.put(variable, type);
	}

	public String getName() {
		return name;
	}

	public Scope getParent() {
		return parent;
	}

	public List<String> getParameters() {
		return Collections.unmodifiableList(parameters);
	}

	public List<String> getReturns() {
		return Collections.unmodifiableList(returns);
	}

	public Map<String, MatlabExpression> getAssignments() {
		return Collections.unmodifiableMap(assignments);
	}

	public Map<String, List<MatlabExpression>> getCalls() {
		return Collections.unmodifiableMap(calls);
	}

	public Map<String, Scope> getFunctions() {
		return Collections.unmodifiableMap(functions);
	}

	public Map<String, String> getTypes() {
		return Collections.unmodifiableMap(types);
	}

	/**
	 * Looks up the type inferred for a name, walking outwards through the enclosing scopes.
	 *
	 * @return the type tag, or null if no enclosing scope knows the name
	 */
	public String inferredType(String variable) {
		for (Scope s = this; s != null; s = s.parent) {
			String type = s.types.get(variable);
			if (type != null) {
				return type;
			}
		}
		return null;
	}

	/**
	 * @return assignments of this scope and every nested function scope, in traversal order.
	 * A nested binding replaces an outer binding of the same name.
	 */
	public Map<String, MatlabExpression> allAssignments() {
		Map<String, MatlabExpression> result = new LinkedHashMap<>(assignments);
		for (Scope function : functions.values()) {
			result.putAll(function.allAssignments());
		}
		return result;
	}

	/**
	 * @return call sites of this scope and every nested function scope, in traversal order.
	 * The first call site of a given function name wins.
	 */
	public Map<String, List<MatlabExpression>> allCalls() {
		Map<String, List<MatlabExpression>> result = new LinkedHashMap<>(calls);
		for (Scope function : functions.values()) {
			for (Map.Entry<String, List<MatlabExpression>> call : function.allCalls().entrySet()) {
				result.putIfAbsent(call.getKey(), call.getValue());
			}
		}
		return result;
	}

	/**
	 * @return this scope followed by every nested function scope, depth first
	 */
	public List<Scope> allScopes() {
		List<Scope> result = new ArrayList<>();
		result.add(this);
		for (Scope function : functions.values()) {
			result.addAll(function.allScopes());
		}
		return result;
	}

	@Override
	public String toString() {
		return name == null ? "Scope [ROOT]" : "Scope [" + name + "]";
	}
}
