package odec.model.bio;

/**
 * d(variable)/dt = formula
 */
public class RateRule {

	private final String variable;
	private final String formula;

	public RateRule(String variable, String formula) {
		this.variable = variable;
		this.formula = formula;
	}

	public String getVariable() {
		return variable;
	}

	public String getFormula() {
		return formula;
	}

	@Override
	public int hashCode() {
		return 31 * variable.hashCode() + formula.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		RateRule other = (RateRule) obj;
		return variable.equals(other.variable) && formula.equals(other.formula);
	}

	@Override
	public String toString() {
		return "d" + variable + "/dt = " + formula;
	}
}
