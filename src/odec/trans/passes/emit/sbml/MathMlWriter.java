package odec.trans.passes.emit.sbml;

import odec.model.formula.FormulaCall;
import odec.model.formula.FormulaNode;
import odec.model.formula.FormulaNodeVisitor;
import odec.model.formula.FormulaNumber;
import odec.model.formula.FormulaOperation;
import odec.model.formula.FormulaSymbol;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts a parsed formula into MathML content markup.
 */
public class MathMlWriter extends FormulaNodeVisitor<Element, ModelBuilderException> {

	public static final String MATHML_NS = "http://www.w3.org/1998/Math/MathML";

	private static final Map<String, String> OPERATORS = new HashMap<>();
	private static final Map<String, String> FUNCTIONS = new HashMap<>();
	private static final Map<String, String> CONSTANTS = new HashMap<>();
	static {
		OPERATORS.put("+", "plus");
		OPERATORS.put("-", "minus");
		OPERATORS.put("*", "times");
		OPERATORS.put("/", "divide");
		OPERATORS.put("^", "power");
		OPERATORS.put("==", "eq");
		OPERATORS.put("!=", "neq");
		OPERATORS.put("<", "lt");
		OPERATORS.put(">", "gt");
		OPERATORS.put("<=", "leq");
		OPERATORS.put(">=", "geq");
		OPERATORS.put("&&", "and");
		OPERATORS.put("||", "or");
		OPERATORS.put("!", "not");

		FUNCTIONS.put("log", "ln");
		FUNCTIONS.put("log10", "log");
		FUNCTIONS.put("sqrt", "root");
		FUNCTIONS.put("abs", "abs");
		FUNCTIONS.put("exp", "exp");
		FUNCTIONS.put("floor", "floor");
		FUNCTIONS.put("ceil", "ceiling");
		FUNCTIONS.put("sin", "sin");
		FUNCTIONS.put("cos", "cos");
		FUNCTIONS.put("tan", "tan");
		FUNCTIONS.put("power", "power");

		CONSTANTS.put("pi", "pi");
		CONSTANTS.put("true", "true");
		CONSTANTS.put("false", "false");
	}

	private final Document doc;

	public MathMlWriter(Document doc) {
		this.doc = doc;
	}

	public Element math(FormulaNode formula) throws ModelBuilderException {
		Element math = doc.createElementNS(MATHML_NS, "math");
		math.setAttributeNS("http://www.w3.org/2000/xmlns/", "xmlns", MATHML_NS);
		math.appendChild(formula.accept(this));
		return math;
	}

	private Element element(String name) {
		return doc.createElementNS(MATHML_NS, name);
	}

	private Element text(String name, String content) {
		Element e = element(name);
		e.setTextContent(content);
		return e;
	}

	private Element apply(Element head, List<FormulaNode> arguments) throws ModelBuilderException {
		Element apply = element("apply");
		apply.appendChild(head);
		for (FormulaNode argument : arguments) {
			apply.appendChild(argument.accept(this));
		}
		return apply;
	}

	@Override
	public Element visit(FormulaNumber formulaNumber) {
		return text("cn", formulaNumber.getText());
	}

	@Override
	public Element visit(FormulaSymbol formulaSymbol) {
		String constant = CONSTANTS.get(formulaSymbol.getName());
		if (constant != null) {
			return element(constant);
		}
		return text("ci", formulaSymbol.getName());
	}

	@Override
	public Element visit(FormulaOperation formulaOperation) throws ModelBuilderException {
		String operator = formulaOperation.getOperator();
		List<FormulaNode> operands = formulaOperation.getOperands();
		if (operator.equals("+") && operands.size() == 1) {
			return operands.get(0).accept(this);
		}
		String name = OPERATORS.get(operator);
		if (name == null) {
			throw new ModelBuilderException("unknown operator " + operator);
		}
		return apply(element(name), operands);
	}

	@Override
	public Element visit(FormulaCall formulaCall) throws ModelBuilderException {
		String function = formulaCall.getFunction();
		String builtin = FUNCTIONS.get(function);
		if (builtin != null) {
			return apply(element(builtin), formulaCall.getArguments());
		}
		return apply(text("ci", function), formulaCall.getArguments());
	}
}
