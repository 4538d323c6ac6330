package odec.trans.passes.formula;

import odec.model.formula.FormulaCall;
import odec.model.formula.FormulaNode;
import odec.model.formula.FormulaNumber;
import odec.model.formula.FormulaOperation;
import odec.model.formula.FormulaSymbol;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 *
 * Recursive descent parser for the infix formulas produced by {@link FormulaTranslationVisitor}.
 *
 * Precedence, loosest first:
 *
 * ||
 * &&
 * == != < > <= >=   (non-associative)
 * + -
 * * /
 * unary - + !
 * ^                 (right associative, binds tighter than unary minus on its left)
 *
 */
public class InfixFormulaParser {

	private static final Pattern NUMBER = Pattern.compile("(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");
	private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
	private static final List<String> RELATIONAL = Arrays.asList("==", "!=", "<=", ">=", "<", ">");

	private final String text;
	private int pos;

	private InfixFormulaParser(String text) {
		this.text = text;
		this.pos = 0;
	}

	public static FormulaNode parse(String formula) throws FormulaParseException {
		InfixFormulaParser parser = new InfixFormulaParser(formula);
		parser.skipSpace();
		if (parser.atEnd()) {
			throw new FormulaParseException("empty formula", 0);
		}
		FormulaNode result = parser.parseOr();
		parser.skipSpace();
		if (!parser.atEnd()) {
			throw new FormulaParseException("unexpected '" + formula.charAt(parser.pos) + "'", parser.pos);
		}
		return result;
	}

	public static boolean accepts(String formula) {
		try {
			parse(formula);
			return true;
		} catch (FormulaParseException e) {
			return false;
		}
	}

	private boolean atEnd() {
		return pos >= text.length();
	}

	private void skipSpace() {
		while (!atEnd() && Character.isWhitespace(text.charAt(pos))) {
			pos++;
		}
	}

	private boolean lookingAt(String token) {
		skipSpace();
		return text.startsWith(token, pos);
	}

	private boolean consume(String token) {
		if (lookingAt(token)) {
			pos += token.length();
			return true;
		}
		return false;
	}

	private void expect(String token) throws FormulaParseException {
		if (!consume(token)) {
			throw new FormulaParseException("expected '" + token + "'", pos);
		}
	}

	private static FormulaNode binary(String operator, FormulaNode lhs, FormulaNode rhs) {
		return new FormulaOperation(operator, Arrays.asList(lhs, rhs));
	}

	private FormulaNode parseOr() throws FormulaParseException {
		FormulaNode lhs = parseAnd();
		while (consume("||")) {
			lhs = binary("||", lhs, parseAnd());
		}
		return lhs;
	}

	private FormulaNode parseAnd() throws FormulaParseException {
		FormulaNode lhs = parseRelational();
		while (consume("&&")) {
			lhs = binary("&&", lhs, parseRelational());
		}
		return lhs;
	}

	private FormulaNode parseRelational() throws FormulaParseException {
		FormulaNode lhs = parseAdditive();
		for (String op : RELATIONAL) {
			if (consume(op)) {
				return binary(op, lhs, parseAdditive());
			}
		}
		return lhs;
	}

	private FormulaNode parseAdditive() throws FormulaParseException {
		FormulaNode lhs = parseMultiplicative();
		while (true) {
			if (consume("+")) {
				lhs = binary("+", lhs, parseMultiplicative());
			} else if (consume("-")) {
				lhs = binary("-", lhs, parseMultiplicative());
			} else {
				return lhs;
			}
		}
	}

	private FormulaNode parseMultiplicative() throws FormulaParseException {
		FormulaNode lhs = parseUnary();
		while (true) {
			if (consume("*")) {
				lhs = binary("*", lhs, parseUnary());
			} else if (consume("/")) {
				lhs = binary("/", lhs, parseUnary());
			} else {
				return lhs;
			}
		}
	}

	private FormulaNode parseUnary() throws FormulaParseException {
		if (lookingAt("!=")) {
			throw new FormulaParseException("unexpected '!='", pos);
		}
		for (String op : new String[]{"-", "+", "!"}) {
			if (consume(op)) {
				return new FormulaOperation(op, Collections.singletonList(parseUnary()));
			}
		}
		return parsePower();
	}

	private FormulaNode parsePower() throws FormulaParseException {
		FormulaNode base = parsePrimary();
		if (consume("^")) {
			return binary("^", base, parseUnary());
		}
		return base;
	}

	private FormulaNode parsePrimary() throws FormulaParseException {
		skipSpace();
		if (atEnd()) {
			throw new FormulaParseException("unexpected end of formula", pos);
		}
		if (consume("(")) {
			FormulaNode inner = parseOr();
			expect(")");
			return inner;
		}
		Matcher number = NUMBER.matcher(text).region(pos, text.length());
		if (number.lookingAt()) {
			pos = number.end();
			return new FormulaNumber(number.group());
		}
		Matcher identifier = IDENTIFIER.matcher(text).region(pos, text.length());
		if (identifier.lookingAt()) {
			pos = identifier.end();
			String name = identifier.group();
			if (consume("(")) {
				List<FormulaNode> arguments = new ArrayList<>();
				if (!consume(")")) {
					do {
						arguments.add(parseOr());
					} while (consume(","));
					expect(")");
				}
				return new FormulaCall(name, arguments);
			}
			return new FormulaSymbol(name);
		}
		throw new FormulaParseException("unexpected '" + text.charAt(pos) + "'", pos);
	}
}
