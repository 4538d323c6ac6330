package odec.model.formula;

/**
 * Parsed form of a flat infix formula, as consumed by the SBML writer.
 */
public abstract class FormulaNode {

	public abstract <T, E extends Throwable> T accept(FormulaNodeVisitor<T, E> v) throws E;
}
