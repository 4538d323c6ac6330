package odec.formatters;

import odec.errors.IssueVisitor;
import odec.errors.IssueWithContext;
import odec.trans.IOErrorIssue;
import odec.trans.passes.assemble.MalformedInitialConditionIssue;
import odec.trans.passes.assemble.UnsupportedStructuredLhsIssue;
import odec.trans.passes.emit.ModelBuilderIssue;
import odec.trans.passes.formula.NonLiteralSubscriptIssue;
import odec.trans.passes.formula.UnsupportedExpressionIssue;
import odec.trans.passes.formula.UnsupportedMatrixShapeIssue;
import odec.trans.passes.locate.MalformedOdeCallIssue;
import odec.trans.passes.locate.NoOdeCallFoundIssue;
import odec.trans.passes.parse.ScopeTreeParsingIssue;
import odec.trans.passes.parse.option.OptionParserIssue;
import odec.trans.passes.resolve.CannotResolveHandleIssue;
import odec.trans.passes.resolve.MalformedDerivativeBodyIssue;
import odec.trans.passes.resolve.UnresolvedIdentifierIssue;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionParserIssue.getReason());
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("IO Error: ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}

	@Override
	public Void visit(ScopeTreeParsingIssue scopeTreeParsingIssue) throws IOException {
		out.write("error reading scope tree at ");
		out.write(scopeTreeParsingIssue.getPath().isEmpty() ? "/" : scopeTreeParsingIssue.getPath());
		out.write(": ");
		out.write(scopeTreeParsingIssue.getReason());
		return null;
	}

	@Override
	public Void visit(NoOdeCallFoundIssue noOdeCallFoundIssue) throws IOException {
		out.write("no call to an ODE solver (a function whose name starts with \"ode\") was found");
		return null;
	}

	@Override
	public Void visit(MalformedOdeCallIssue malformedOdeCallIssue) throws IOException {
		out.write("call to ");
		out.write(malformedOdeCallIssue.getOdeFunction());
		out.write(" is not of the form [t, y] = ");
		out.write(malformedOdeCallIssue.getOdeFunction());
		out.write("(f, tspan, y0, ...): ");
		out.write(malformedOdeCallIssue.getReason());
		return null;
	}

	@Override
	public Void visit(UnresolvedIdentifierIssue unresolvedIdentifierIssue) throws IOException {
		out.write("identifier ");
		out.write(unresolvedIdentifierIssue.getIdentifier());
		out.write(" is never assigned");
		return null;
	}

	@Override
	public Void visit(CannotResolveHandleIssue cannotResolveHandleIssue) throws IOException {
		out.write("cannot resolve the derivative function ");
		cannotResolveHandleIssue.getArgument().accept(new MatlabExpressionFormattingVisitor(out));
		out.write(" passed to ");
		out.write(cannotResolveHandleIssue.getOdeFunction());
		out.write(": ");
		out.write(cannotResolveHandleIssue.getReason());
		return null;
	}

	@Override
	public Void visit(MalformedInitialConditionIssue malformedInitialConditionIssue) throws IOException {
		if (malformedInitialConditionIssue.getValue() == null) {
			out.write("initial conditions must be passed through a variable, found ");
			out.write(malformedInitialConditionIssue.getVariable());
			return null;
		}
		out.write("initial conditions ");
		out.write(malformedInitialConditionIssue.getVariable());
		out.write(" must be a row or column vector, found ");
		malformedInitialConditionIssue.getValue().accept(new MatlabExpressionFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(MalformedDerivativeBodyIssue malformedDerivativeBodyIssue) throws IOException {
		out.write("derivative function ");
		out.write(malformedDerivativeBodyIssue.getFunctionName());
		out.write(" is malformed: ");
		out.write(malformedDerivativeBodyIssue.getReason());
		return null;
	}

	@Override
	public Void visit(NonLiteralSubscriptIssue nonLiteralSubscriptIssue) throws IOException {
		out.write("subscript ");
		nonLiteralSubscriptIssue.getSubscript().accept(new MatlabExpressionFormattingVisitor(out));
		out.write(" of ");
		out.write(nonLiteralSubscriptIssue.getVector());
		out.write(" does not resolve to a positive integer literal");
		return null;
	}

	@Override
	public Void visit(UnsupportedMatrixShapeIssue unsupportedMatrixShapeIssue) throws IOException {
		out.write(unsupportedMatrixShapeIssue.getName());
		out.write(" is used as a ");
		out.write(unsupportedMatrixShapeIssue.getShape());
		out.write("; only row and column vectors are supported");
		return null;
	}

	@Override
	public Void visit(UnsupportedExpressionIssue unsupportedExpressionIssue) throws IOException {
		out.write("expression ");
		unsupportedExpressionIssue.getExpression().accept(new MatlabExpressionFormattingVisitor(out));
		out.write(" cannot appear in a formula");
		return null;
	}

	@Override
	public Void visit(UnsupportedStructuredLhsIssue unsupportedStructuredLhsIssue) throws IOException {
		out.write("assignment to ");
		out.write(unsupportedStructuredLhsIssue.getLhs());
		out.write(" is not supported and was skipped");
		return null;
	}

	@Override
	public Void visit(ModelBuilderIssue modelBuilderIssue) throws IOException {
		out.write("model builder failed to ");
		out.write(modelBuilderIssue.getOperation());
		out.write(": ");
		out.write(modelBuilderIssue.getReason());
		return null;
	}
}
