package odec.trans.passes.assemble;

import odec.errors.Issue;
import odec.errors.IssueContext;
import odec.model.bio.OdeModel;
import odec.model.matlab.*;
import odec.scope.Scope;
import odec.trans.TranslationContext;
import odec.trans.naming.NamingScheme;
import odec.trans.passes.formula.FormulaTranslationVisitor;
import odec.trans.passes.formula.InfixFormulaParser;
import odec.trans.passes.formula.RateRuleRenaming;
import odec.trans.passes.formula.UnsupportedExpressionIssue;
import odec.trans.passes.formula.UnsupportedMatrixShapeIssue;
import odec.trans.passes.formula.VectorFlattening;
import odec.trans.passes.locate.OdeCall;
import odec.trans.passes.locate.OdeLocatorPass;
import odec.trans.passes.resolve.HandleResolutionPass;
import odec.trans.passes.resolve.MalformedDerivativeBodyIssue;
import odec.trans.passes.resolve.UnresolvedIdentifierIssue;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 *
 * Builds the abstract model of the ODE system found in a scope tree:
 *
 * - one compartment;
 * - one state entity per entry of the initial-condition vector;
 * - one rate rule per entry of the derivative function's output vector;
 * - parameters for the remaining bindings of the script and of the derivative function.
 *
 */
public class ModelAssemblyPass {

	private static final Logger logger = Logger.getLogger("odec.assemble");

	public static final String COMPARTMENT_ID = "comp1";
	public static final double COMPARTMENT_SIZE = 1;

	private final IssueContext ctx;
	private final NamingScheme naming;
	private final OdeCall call;
	private final Scope function;
	private final boolean useSpecies;
	private final OdeModel.Builder model;

	private ModelAssemblyPass(IssueContext ctx, NamingScheme naming, OdeCall call, Scope function, boolean useSpecies) {
		this.ctx = ctx;
		this.naming = naming;
		this.call = call;
		this.function = function;
		this.useSpecies = useSpecies;
		this.model = OdeModel.builder();
	}

	/**
	 * @param useSpecies whether state entries become species, as opposed to non-constant parameters
	 * @return the model, or null if an error was reported to ctx
	 */
	public static OdeModel perform(IssueContext ctx, TranslationContext translation, Scope root, boolean useSpecies) {
		logger.info("Locating ODE solver call");
		OdeCall call = OdeLocatorPass.perform(ctx, root);
		if (ctx.hasErrors()) {
			return null;
		}
		logger.info("Resolving derivative function passed to " + call.getOdeFunction());
		Scope function = HandleResolutionPass.perform(ctx, translation, call);
		if (ctx.hasErrors()) {
			return null;
		}

		ModelAssemblyPass pass = new ModelAssemblyPass(ctx, translation.getNaming(), call, function, useSpecies);
		try {
			pass.model.compartment(COMPARTMENT_ID, COMPARTMENT_SIZE);
			logger.info("Creating state variables from " + call.getInitialConditionVariable());
			int states = pass.addStates();
			logger.info("Creating rate rules from " + function.getName());
			pass.addRateRules(states);
			logger.info("Creating parameters");
			pass.addParameters();
		} catch (Issue issue) {
			ctx.error(issue);
			return null;
		}
		return pass.model.build();
	}

	private String translate(MatlabExpression expression, Scope scope, WhileTranslatingEntry.Kind kind, String id) {
		try {
			return FormulaTranslationVisitor.translate(expression, scope, naming);
		} catch (Issue issue) {
			throw issue.withContext(new WhileTranslatingEntry(kind, id));
		}
	}

	/**
	 * @return the value of a numeric literal, optionally signed, or null for anything else
	 */
	static Double numericValue(MatlabExpression expression) {
		MatlabExpression stripped = MatlabGroup.strip(expression);
		double sign = 1;
		if (stripped instanceof MatlabUnary) {
			MatlabUnary unary = (MatlabUnary) stripped;
			if (unary.getOperator().equals("-")) {
				sign = -1;
			} else if (!unary.getOperator().equals("+")) {
				return null;
			}
			stripped = MatlabGroup.strip(unary.getOperand());
		}
		if (!(stripped instanceof MatlabNumber)) {
			return null;
		}
		try {
			return sign * ((MatlabNumber) stripped).getValue();
		} catch (NumberFormatException e) {
			return null;
		}
	}

	private int addStates() {
		Scope working = call.getWorkingScope();
		String variable = call.getInitialConditionVariable();
		MatlabExpression value = working.allAssignments().get(variable);
		if (value == null) {
			throw new UnresolvedIdentifierIssue(variable);
		}
		MatlabExpression stripped = MatlabGroup.strip(value);
		if (!(stripped instanceof MatlabArray) || ((MatlabArray) stripped).isCell()) {
			throw new MalformedInitialConditionIssue(variable, value);
		}
		List<MatlabExpression> entries = VectorFlattening.entries(variable, (MatlabArray) stripped);
		for (int i = 0; i < entries.size(); ++i) {
			String id = naming.rename(call.getAssignedVariable(), i + 1);
			Double literal = numericValue(entries.get(i));
			String formula = null;
			if (literal == null) {
				formula = translate(entries.get(i), working, WhileTranslatingEntry.Kind.INITIAL_VALUE, id);
			}
			double initial = literal == null ? 0 : literal;
			if (useSpecies) {
				model.species(id, COMPARTMENT_ID, initial);
			} else {
				model.parameter(id, initial, false);
			}
			if (formula != null) {
				model.initialAssignment(id, formula);
			}
		}
		return entries.size();
	}

	private void addRateRules(int states) {
		String functionName = function.getName();
		String output = function.getReturns().get(0);
		String dependent = function.getParameters().get(1);
		MatlabExpression value = function.allAssignments().get(output);
		if (value == null) {
			throw new MalformedDerivativeBodyIssue(functionName, "output " + output + " is never assigned");
		}
		MatlabExpression stripped = MatlabGroup.strip(value);
		if (!(stripped instanceof MatlabArray) || ((MatlabArray) stripped).isCell()) {
			throw new MalformedDerivativeBodyIssue(functionName,
					"output " + output + " must be assigned a vector, found " + value);
		}
		List<MatlabExpression> entries = VectorFlattening.entries(output, (MatlabArray) stripped);
		if (entries.size() > states) {
			throw new MalformedDerivativeBodyIssue(functionName, "it defines " + entries.size()
					+ " derivatives for " + states + " state variable(s)");
		}
		for (int i = 0; i < entries.size(); ++i) {
			String id = naming.rename(call.getAssignedVariable(), i + 1);
			String formula = translate(entries.get(i), function, WhileTranslatingEntry.Kind.RATE_RULE, id);
			formula = RateRuleRenaming.perform(formula, dependent, call.getAssignedVariable(), naming);
			if (formula.trim().isEmpty()) {
				throw new MalformedDerivativeBodyIssue(functionName, "entry " + (i + 1) + " of " + output + " is empty");
			}
			model.rateRule(id, formula);
		}
	}

	private Set<String> excludedNames() {
		Set<String> excluded = new HashSet<>(Arrays.asList(
				call.getInitialConditionVariable(),
				function.getReturns().get(0),
				call.getAssignedVariable(),
				call.getCallSiteLhs()));
		if (call.getTimeSpanVariable() != null) {
			excluded.add(call.getTimeSpanVariable());
		}
		return excluded;
	}

	private static boolean isStructured(String lhs) {
		return lhs.contains("[") || lhs.contains("(") || lhs.contains("{");
	}

	private void addParameters() {
		// script bindings keep their position, derivative function bindings win
		Map<String, Scope> owners = new LinkedHashMap<>();
		for (String name : call.getWorkingScope().getAssignments().keySet()) {
			owners.put(name, call.getWorkingScope());
		}
		for (String name : function.getAssignments().keySet()) {
			owners.put(name, function);
		}

		Set<String> excluded = excludedNames();
		for (Map.Entry<String, Scope> binding : owners.entrySet()) {
			String name = binding.getKey();
			if (excluded.contains(name)) {
				continue;
			}
			if (isStructured(name)) {
				UnsupportedStructuredLhsIssue issue = new UnsupportedStructuredLhsIssue(name);
				logger.warning(issue.getMessage());
				ctx.warning(issue);
				continue;
			}
			Scope owner = binding.getValue();
			addParameter(name, owner.getAssignments().get(name), owner);
		}
	}

	private void addParameter(String name, MatlabExpression value, Scope owner) {
		MatlabExpression stripped = MatlabGroup.strip(value);
		Double literal = numericValue(stripped);
		if (literal != null) {
			model.parameter(name, literal, true);
			return;
		}
		if (stripped instanceof MatlabArray && !((MatlabArray) stripped).isCell()) {
			List<MatlabExpression> entries;
			try {
				entries = VectorFlattening.entries(name, (MatlabArray) stripped);
			} catch (UnsupportedMatrixShapeIssue issue) {
				logger.warning("skipping " + name + ": " + issue.getMessage());
				ctx.withContext(new WhileTranslatingEntry(WhileTranslatingEntry.Kind.PARAMETER, name)).warning(issue);
				return;
			}
			for (int i = 0; i < entries.size(); ++i) {
				String id = naming.rename(name, i + 1);
				Double entry = numericValue(entries.get(i));
				if (entry != null) {
					model.parameter(id, entry, false);
					continue;
				}
				model.parameter(id, 0, false);
				String formula = formulaOrNull(entries.get(i), owner, id);
				if (formula != null) {
					model.initialAssignment(id, formula);
				}
			}
			return;
		}
		if (stripped instanceof MatlabFunctionHandle || stripped instanceof MatlabAnonymousFunction) {
			logger.fine("skipping function handle " + name);
			return;
		}
		String formula = formulaOrNull(stripped, owner, name);
		if (formula != null) {
			model.parameter(name, 0, true);
			model.initialAssignment(name, formula);
		}
	}

	private String formulaOrNull(MatlabExpression value, Scope owner, String id) {
		String formula;
		try {
			formula = FormulaTranslationVisitor.translate(value, owner, naming);
		} catch (UnsupportedExpressionIssue issue) {
			logger.fine("skipping " + id + ": " + issue.getMessage());
			return null;
		} catch (Issue issue) {
			throw issue.withContext(new WhileTranslatingEntry(WhileTranslatingEntry.Kind.PARAMETER, id));
		}
		if (!InfixFormulaParser.accepts(formula)) {
			logger.fine("skipping " + id + ": formula " + formula + " is not supported");
			return null;
		}
		return formula;
	}
}
