package odec.trans.passes.locate;

import odec.model.matlab.*;

import java.util.List;

/**
 * Tells whether an expression refers to a given name anywhere in its structure, as a plain
 * identifier, a call or element reference, or a function handle.
 */
public class NameMentionVisitor extends MatlabExpressionVisitor<Boolean, RuntimeException> {

	private final String name;

	public NameMentionVisitor(String name) {
		this.name = name;
	}

	private boolean any(List<MatlabExpression> expressions) {
		for (MatlabExpression e : expressions) {
			if (e.accept(this)) {
				return true;
			}
		}
		return false;
	}

	@Override
	public Boolean visit(MatlabIdentifier matlabIdentifier) {
		return matlabIdentifier.getName().equals(name);
	}

	@Override
	public Boolean visit(MatlabNumber matlabNumber) {
		return false;
	}

	@Override
	public Boolean visit(MatlabString matlabString) {
		return false;
	}

	@Override
	public Boolean visit(MatlabFunctionHandle matlabFunctionHandle) {
		return matlabFunctionHandle.getName().equals(name);
	}

	@Override
	public Boolean visit(MatlabAnonymousFunction matlabAnonymousFunction) {
		return matlabAnonymousFunction.getBody().accept(this);
	}

	@Override
	public Boolean visit(MatlabArrayOrCall matlabArrayOrCall) {
		return matlabArrayOrCall.getName().equals(name) || any(matlabArrayOrCall.getArguments());
	}

	@Override
	public Boolean visit(MatlabArray matlabArray) {
		for (List<MatlabExpression> row : matlabArray.getRows()) {
			if (any(row)) {
				return true;
			}
		}
		return false;
	}

	@Override
	public Boolean visit(MatlabBinOp matlabBinOp) {
		return matlabBinOp.getLHS().accept(this) || matlabBinOp.getRHS().accept(this);
	}

	@Override
	public Boolean visit(MatlabUnary matlabUnary) {
		return matlabUnary.getOperand().accept(this);
	}

	@Override
	public Boolean visit(MatlabTranspose matlabTranspose) {
		return matlabTranspose.getOperand().accept(this);
	}

	@Override
	public Boolean visit(MatlabGroup matlabGroup) {
		return matlabGroup.getInner().accept(this);
	}
}
