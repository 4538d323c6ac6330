package odec.formatters;

import odec.model.matlab.MatlabExpression;
import odec.scope.Scope;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Prints a scope tree in a MATLAB-like layout, for inspecting what the parser produced.
 */
public class ScopeFormatter {

	private final IndentingWriter out;

	public ScopeFormatter(IndentingWriter out) {
		this.out = out;
	}

	public static String format(Scope scope) {
		StringWriter w = new StringWriter();
		try {
			new ScopeFormatter(new IndentingWriter(w)).write(scope);
		} catch (IOException e) {
			throw new RuntimeException("StringWriter should not throw IOException", e);
		}
		return w.toString();
	}

	public void write(Scope scope) throws IOException {
		if (scope.getParent() == null) {
			out.writeLine(scope.getName() == null ? "% script" : "% script " + scope.getName());
			writeBody(scope);
			return;
		}
		out.write("function ");
		if (scope.getReturns().size() == 1) {
			out.write(scope.getReturns().get(0));
			out.write(" = ");
		} else if (!scope.getReturns().isEmpty()) {
			out.write("[");
			FormattingTools.writeCommaSeparated(out, scope.getReturns(), out::write);
			out.write("] = ");
		}
		out.write(scope.getName());
		out.write("(");
		FormattingTools.writeCommaSeparated(out, scope.getParameters(), out::write);
		out.write(")");
		out.newLine();
		try (IndentingWriter.Indent ignored = out.indent()) {
			writeBody(scope);
		}
		out.writeLine("end");
	}

	private void writeBody(Scope scope) throws IOException {
		MatlabExpressionFormattingVisitor expressions = new MatlabExpressionFormattingVisitor(out);
		for (Map.Entry<String, MatlabExpression> assignment : scope.getAssignments().entrySet()) {
			out.write(assignment.getKey());
			out.write(" = ");
			assignment.getValue().accept(expressions);
			out.writeLine(";");
		}
		for (Map.Entry<String, List<MatlabExpression>> call : scope.getCalls().entrySet()) {
			out.write("% calls ");
			out.write(call.getKey());
			out.write("(");
			FormattingTools.writeCommaSeparated(out, call.getValue(), arg -> arg.accept(expressions));
			out.writeLine(")");
		}
		if (!scope.getTypes().isEmpty()) {
			out.write("% types ");
			FormattingTools.writeCommaSeparated(out, new ArrayList<>(new TreeMap<>(scope.getTypes()).entrySet()),
					type -> out.write(type.getKey() + ": " + type.getValue()));
			out.newLine();
		}
		for (Scope function : scope.getFunctions().values()) {
			write(function);
		}
	}
}
