package odec.model.formula;

public abstract class FormulaNodeVisitor<T, E extends Throwable> {
	public abstract T visit(FormulaNumber formulaNumber) throws E;
	public abstract T visit(FormulaSymbol formulaSymbol) throws E;
	public abstract T visit(FormulaOperation formulaOperation) throws E;
	public abstract T visit(FormulaCall formulaCall) throws E;
}
