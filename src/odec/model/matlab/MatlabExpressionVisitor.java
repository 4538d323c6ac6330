package odec.model.matlab;

public abstract class MatlabExpressionVisitor<T, E extends Throwable> {
	public abstract T visit(MatlabIdentifier matlabIdentifier) throws E;
	public abstract T visit(MatlabNumber matlabNumber) throws E;
	public abstract T visit(MatlabString matlabString) throws E;
	public abstract T visit(MatlabFunctionHandle matlabFunctionHandle) throws E;
	public abstract T visit(MatlabAnonymousFunction matlabAnonymousFunction) throws E;
	public abstract T visit(MatlabArrayOrCall matlabArrayOrCall) throws E;
	public abstract T visit(MatlabArray matlabArray) throws E;
	public abstract T visit(MatlabBinOp matlabBinOp) throws E;
	public abstract T visit(MatlabUnary matlabUnary) throws E;
	public abstract T visit(MatlabTranspose matlabTranspose) throws E;
	public abstract T visit(MatlabGroup matlabGroup) throws E;
}
