package odec.model.bio;

/**
 * symbol = formula, evaluated once before simulation starts.
 */
public class InitialAssignment {

	private final String symbol;
	private final String formula;

	public InitialAssignment(String symbol, String formula) {
		this.symbol = symbol;
		this.formula = formula;
	}

	public String getSymbol() {
		return symbol;
	}

	public String getFormula() {
		return formula;
	}

	@Override
	public int hashCode() {
		return 31 * symbol.hashCode() + formula.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		InitialAssignment other = (InitialAssignment) obj;
		return symbol.equals(other.symbol) && formula.equals(other.formula);
	}

	@Override
	public String toString() {
		return symbol + " := " + formula;
	}
}
