package odec.formatters;

import odec.model.matlab.*;

import java.io.IOException;
import java.util.List;

/**
 * Renders an expression tree back into MATLAB syntax. Used for diagnostics and for
 * the parse tree dump, never for generated formulas.
 */
public class MatlabExpressionFormattingVisitor extends MatlabExpressionVisitor<Void, IOException> {
	private final IndentingWriter out;

	public MatlabExpressionFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(MatlabIdentifier matlabIdentifier) throws IOException {
		out.write(matlabIdentifier.getName());
		return null;
	}

	@Override
	public Void visit(MatlabNumber matlabNumber) throws IOException {
		out.write(matlabNumber.getText());
		return null;
	}

	@Override
	public Void visit(MatlabString matlabString) throws IOException {
		out.write("'");
		out.write(matlabString.getValue().replace("'", "''"));
		out.write("'");
		return null;
	}

	@Override
	public Void visit(MatlabFunctionHandle matlabFunctionHandle) throws IOException {
		out.write("@");
		out.write(matlabFunctionHandle.getName());
		return null;
	}

	@Override
	public Void visit(MatlabAnonymousFunction matlabAnonymousFunction) throws IOException {
		out.write("@(");
		FormattingTools.writeCommaSeparated(out, matlabAnonymousFunction.getParameters(), out::write);
		out.write(") ");
		matlabAnonymousFunction.getBody().accept(this);
		return null;
	}

	@Override
	public Void visit(MatlabArrayOrCall matlabArrayOrCall) throws IOException {
		out.write(matlabArrayOrCall.getName());
		out.write("(");
		FormattingTools.writeCommaSeparated(out, matlabArrayOrCall.getArguments(), arg -> arg.accept(this));
		out.write(")");
		return null;
	}

	@Override
	public Void visit(MatlabArray matlabArray) throws IOException {
		out.write(matlabArray.isCell() ? "{" : "[");
		FormattingTools.writeSeparated(out, "; ", matlabArray.getRows(), this::writeRow);
		out.write(matlabArray.isCell() ? "}" : "]");
		return null;
	}

	private void writeRow(List<MatlabExpression> row) throws IOException {
		FormattingTools.writeSeparated(out, " ", row, entry -> entry.accept(this));
	}

	@Override
	public Void visit(MatlabBinOp matlabBinOp) throws IOException {
		matlabBinOp.getLHS().accept(this);
		out.write(" ");
		out.write(matlabBinOp.getOperator());
		out.write(" ");
		matlabBinOp.getRHS().accept(this);
		return null;
	}

	@Override
	public Void visit(MatlabUnary matlabUnary) throws IOException {
		out.write(matlabUnary.getOperator());
		matlabUnary.getOperand().accept(this);
		return null;
	}

	@Override
	public Void visit(MatlabTranspose matlabTranspose) throws IOException {
		matlabTranspose.getOperand().accept(this);
		out.write(matlabTranspose.getOperator());
		return null;
	}

	@Override
	public Void visit(MatlabGroup matlabGroup) throws IOException {
		out.write("(");
		matlabGroup.getInner().accept(this);
		out.write(")");
		return null;
	}
}
