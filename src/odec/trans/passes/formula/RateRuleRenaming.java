package odec.trans.passes.formula;

import odec.trans.naming.NamingScheme;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites flattened references to the derivative function's state parameter into
 * references to the solution vector named at the solver call site.
 */
public class RateRuleRenaming {

	private RateRuleRenaming() {}

	public static String perform(String formula, String dependentVariable, String assignedVariable,
								 NamingScheme naming) {
		if (dependentVariable.equals(assignedVariable)) {
			return formula;
		}
		Pattern reference = Pattern.compile(
				"(?<![A-Za-z0-9_])" + Pattern.quote(dependentVariable + naming.getSeparator()) + "(\\d+)");
		return reference.matcher(formula)
				.replaceAll(Matcher.quoteReplacement(assignedVariable + naming.getSeparator()) + "$1");
	}
}
