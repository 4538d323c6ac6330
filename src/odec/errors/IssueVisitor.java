package odec.errors;

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

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
	public abstract T visit(ScopeTreeParsingIssue scopeTreeParsingIssue) throws E;
	public abstract T visit(NoOdeCallFoundIssue noOdeCallFoundIssue) throws E;
	public abstract T visit(MalformedOdeCallIssue malformedOdeCallIssue) throws E;
	public abstract T visit(UnresolvedIdentifierIssue unresolvedIdentifierIssue) throws E;
	public abstract T visit(CannotResolveHandleIssue cannotResolveHandleIssue) throws E;
	public abstract T visit(MalformedInitialConditionIssue malformedInitialConditionIssue) throws E;
	public abstract T visit(MalformedDerivativeBodyIssue malformedDerivativeBodyIssue) throws E;
	public abstract T visit(NonLiteralSubscriptIssue nonLiteralSubscriptIssue) throws E;
	public abstract T visit(UnsupportedMatrixShapeIssue unsupportedMatrixShapeIssue) throws E;
	public abstract T visit(UnsupportedExpressionIssue unsupportedExpressionIssue) throws E;
	public abstract T visit(UnsupportedStructuredLhsIssue unsupportedStructuredLhsIssue) throws E;
	public abstract T visit(ModelBuilderIssue modelBuilderIssue) throws E;
}
