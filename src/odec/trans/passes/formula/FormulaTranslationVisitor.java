package odec.trans.passes.formula;

import odec.model.matlab.*;
import odec.scope.Scope;
import odec.trans.naming.NamingScheme;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders a MATLAB expression as infix formula text, flattening vector element references
 * into the scalar names produced by the {@link NamingScheme}.
 *
 * Translation failures are thrown as issues; callers decide whether they are fatal.
 */
public class FormulaTranslationVisitor extends MatlabExpressionVisitor<String, RuntimeException> {

	private static final Map<String, String> SPACED_OPERATORS = new HashMap<>();
	private static final Map<String, String> TIGHT_OPERATORS = new HashMap<>();
	static {
		for (String op : new String[]{"+", "-", "==", "<", ">", "<=", ">=", "&&", "||"}) {
			SPACED_OPERATORS.put(op, op);
		}
		SPACED_OPERATORS.put("~=", "!=");
		SPACED_OPERATORS.put("!=", "!=");
		SPACED_OPERATORS.put("&", "&&");
		SPACED_OPERATORS.put("|", "||");

		TIGHT_OPERATORS.put("*", "*");
		TIGHT_OPERATORS.put("/", "/");
		TIGHT_OPERATORS.put("^", "^");
		TIGHT_OPERATORS.put(".*", "*");
		TIGHT_OPERATORS.put("./", "/");
		TIGHT_OPERATORS.put(".^", "^");
	}

	// binding strength of the emitted operators, matching InfixFormulaParser
	private static final Map<String, Integer> PRECEDENCE = new HashMap<>();
	private static final int COMPARISON_PRECEDENCE = 3;
	private static final int UNARY_PRECEDENCE = 6;
	private static final int ATOM_PRECEDENCE = Integer.MAX_VALUE;
	static {
		PRECEDENCE.put("||", 1);
		PRECEDENCE.put("&&", 2);
		for (String op : new String[]{"==", "!=", "<", ">", "<=", ">="}) {
			PRECEDENCE.put(op, COMPARISON_PRECEDENCE);
		}
		PRECEDENCE.put("+", 4);
		PRECEDENCE.put("-", 4);
		PRECEDENCE.put("*", 5);
		PRECEDENCE.put("/", 5);
		PRECEDENCE.put("^", 7);
	}

	private final Scope scope;
	private final NamingScheme naming;
	private Map<String, MatlabExpression> assignments;

	public FormulaTranslationVisitor(Scope scope, NamingScheme naming) {
		this.scope = scope;
		this.naming = naming;
	}

	public static String translate(MatlabExpression expression, Scope scope, NamingScheme naming) {
		return expression.accept(new FormulaTranslationVisitor(scope, naming));
	}

	/**
	 * Bindings visible for subscript resolution: those of the scope and its nested functions,
	 * then those of the enclosing scopes. Inner bindings win.
	 */
	private Map<String, MatlabExpression> assignments() {
		if (assignments == null) {
			assignments = new HashMap<>();
			List<Scope> enclosing = new ArrayList<>();
			for (Scope s = scope.getParent(); s != null; s = s.getParent()) {
				enclosing.add(0, s);
			}
			for (Scope s : enclosing) {
				assignments.putAll(s.getAssignments());
			}
			assignments.putAll(scope.allAssignments());
		}
		return assignments;
	}

	@Override
	public String visit(MatlabIdentifier matlabIdentifier) {
		return matlabIdentifier.getName();
	}

	@Override
	public String visit(MatlabNumber matlabNumber) {
		return matlabNumber.getText();
	}

	@Override
	public String visit(MatlabString matlabString) {
		return "\"" + matlabString.getValue() + "\"";
	}

	@Override
	public String visit(MatlabFunctionHandle matlabFunctionHandle) {
		throw new UnsupportedExpressionIssue(matlabFunctionHandle);
	}

	@Override
	public String visit(MatlabAnonymousFunction matlabAnonymousFunction) {
		throw new UnsupportedExpressionIssue(matlabAnonymousFunction);
	}

	@Override
	public String visit(MatlabArrayOrCall matlabArrayOrCall) {
		String name = matlabArrayOrCall.getName();
		if (!isVariable(name)) {
			List<String> arguments = new ArrayList<>();
			for (MatlabExpression argument : matlabArrayOrCall.getArguments()) {
				arguments.add(argument.accept(this));
			}
			return name + "(" + String.join(", ", arguments) + ")";
		}
		return naming.rename(name, elementIndex(name, matlabArrayOrCall.getArguments()));
	}

	/**
	 * Only names typed as variables are vectors; everything else stays a call.
	 */
	private boolean isVariable(String name) {
		return Scope.VARIABLE_TYPE.equals(scope.inferredType(name));
	}

	private int elementIndex(String name, List<MatlabExpression> subscripts) {
		switch (subscripts.size()) {
			case 1:
				return literalIndex(name, subscripts.get(0));
			case 2:
				if (isLiteralOne(subscripts.get(0))) {
					return literalIndex(name, subscripts.get(1));
				}
				if (isLiteralOne(subscripts.get(1))) {
					return literalIndex(name, subscripts.get(0));
				}
				throw new UnsupportedMatrixShapeIssue(name, "two-dimensional matrix");
			default:
				throw new UnsupportedMatrixShapeIssue(name, subscripts.size() + "-dimensional array");
		}
	}

	private static boolean isLiteralOne(MatlabExpression subscript) {
		MatlabExpression stripped = MatlabGroup.strip(subscript);
		if (!(stripped instanceof MatlabNumber)) {
			return false;
		}
		try {
			return ((MatlabNumber) stripped).getValue() == 1;
		} catch (NumberFormatException e) {
			return false;
		}
	}

	private int literalIndex(String name, MatlabExpression subscript) {
		Set<String> seen = new HashSet<>();
		MatlabExpression current = MatlabGroup.strip(subscript);
		while (current instanceof MatlabIdentifier) {
			String variable = ((MatlabIdentifier) current).getName();
			if (!seen.add(variable) || !assignments().containsKey(variable)) {
				throw new NonLiteralSubscriptIssue(name, subscript);
			}
			current = MatlabGroup.strip(assignments().get(variable));
		}
		if (!(current instanceof MatlabNumber)) {
			throw new NonLiteralSubscriptIssue(name, subscript);
		}
		double value;
		try {
			value = ((MatlabNumber) current).getValue();
		} catch (NumberFormatException e) {
			throw new NonLiteralSubscriptIssue(name, subscript);
		}
		if (value < 1 || value != Math.rint(value) || value > Integer.MAX_VALUE) {
			throw new NonLiteralSubscriptIssue(name, subscript);
		}
		return (int) value;
	}

	@Override
	public String visit(MatlabArray matlabArray) {
		throw new UnsupportedExpressionIssue(matlabArray);
	}

	private static String emittedOperator(String op) {
		if (SPACED_OPERATORS.containsKey(op)) {
			return SPACED_OPERATORS.get(op);
		}
		return TIGHT_OPERATORS.get(op);
	}

	private static int precedence(MatlabExpression expression) {
		if (expression instanceof MatlabBinOp) {
			Integer precedence = PRECEDENCE.get(emittedOperator(((MatlabBinOp) expression).getOperator()));
			return precedence == null ? ATOM_PRECEDENCE : precedence;
		}
		if (expression instanceof MatlabUnary) {
			return UNARY_PRECEDENCE;
		}
		if (expression instanceof MatlabTranspose) {
			return precedence(((MatlabTranspose) expression).getOperand());
		}
		return ATOM_PRECEDENCE;
	}

	private String operand(MatlabExpression expression, boolean parenthesize) {
		String text = expression.accept(this);
		return parenthesize ? "(" + text + ")" : text;
	}

	/**
	 * MATLAB operators associate to the left, while the emitted '^' is read right to left and
	 * comparisons do not chain, so operands are parenthesized wherever the tree would not be
	 * read back as it is.
	 */
	@Override
	public String visit(MatlabBinOp matlabBinOp) {
		String op = emittedOperator(matlabBinOp.getOperator());
		if (op == null) {
			throw new UnsupportedExpressionIssue(matlabBinOp);
		}
		int own = PRECEDENCE.get(op);
		boolean nonAssociative = own == COMPARISON_PRECEDENCE;
		int left = precedence(matlabBinOp.getLHS());
		int right = precedence(matlabBinOp.getRHS());
		String lhs = operand(matlabBinOp.getLHS(), left < own || (left == own && (op.equals("^") || nonAssociative)));
		String rhs = operand(matlabBinOp.getRHS(), right < own || (right == own && !op.equals("^")));
		if (SPACED_OPERATORS.containsKey(matlabBinOp.getOperator())) {
			return lhs + " " + op + " " + rhs;
		}
		return lhs + op + rhs;
	}

	@Override
	public String visit(MatlabUnary matlabUnary) {
		String operand = operand(matlabUnary.getOperand(), precedence(matlabUnary.getOperand()) < UNARY_PRECEDENCE);
		switch (matlabUnary.getOperator()) {
			case "-":
			case "+":
				return matlabUnary.getOperator() + operand;
			case "~":
			case "!":
				return "!" + operand;
			default:
				throw new UnsupportedExpressionIssue(matlabUnary);
		}
	}

	@Override
	public String visit(MatlabTranspose matlabTranspose) {
		return matlabTranspose.getOperand().accept(this);
	}

	@Override
	public String visit(MatlabGroup matlabGroup) {
		return "(" + matlabGroup.getInner().accept(this) + ")";
	}
}
