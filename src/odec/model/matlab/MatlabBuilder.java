package odec.model.matlab;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Static factories for building expression trees by hand, mostly from tests.
 */
public class MatlabBuilder {
	private MatlabBuilder() {}

	public static MatlabIdentifier id(String name) {
		return new MatlabIdentifier(name);
	}

	public static MatlabNumber num(String text) {
		return new MatlabNumber(text);
	}

	public static MatlabNumber num(int value) {
		return new MatlabNumber(Integer.toString(value));
	}

	public static MatlabString str(String value) {
		return new MatlabString(value);
	}

	public static MatlabFunctionHandle handle(String name) {
		return new MatlabFunctionHandle(name);
	}

	public static MatlabAnonymousFunction anon(List<String> parameters, MatlabExpression body) {
		return new MatlabAnonymousFunction(parameters, body);
	}

	public static List<String> params(String... names) {
		return Arrays.asList(names);
	}

	public static MatlabArrayOrCall ref(String name, MatlabExpression... arguments) {
		return new MatlabArrayOrCall(name, Arrays.asList(arguments));
	}

	public static List<MatlabExpression> row(MatlabExpression... entries) {
		return Arrays.asList(entries);
	}

	@SafeVarargs
	public static MatlabArray array(List<MatlabExpression>... rows) {
		return new MatlabArray(Arrays.asList(rows), false);
	}

	@SafeVarargs
	public static MatlabArray cell(List<MatlabExpression>... rows) {
		return new MatlabArray(Arrays.asList(rows), true);
	}

	/**
	 * [a b c]
	 */
	public static MatlabArray rowVector(MatlabExpression... entries) {
		return new MatlabArray(Collections.singletonList(Arrays.asList(entries)), false);
	}

	/**
	 * [a; b; c]
	 */
	public static MatlabArray columnVector(MatlabExpression... entries) {
		List<List<MatlabExpression>> rows = new ArrayList<>();
		for (MatlabExpression entry : entries) {
			rows.add(Collections.singletonList(entry));
		}
		return new MatlabArray(rows, false);
	}

	public static MatlabBinOp binop(String operator, MatlabExpression lhs, MatlabExpression rhs) {
		return new MatlabBinOp(operator, lhs, rhs);
	}

	public static MatlabUnary unary(String operator, MatlabExpression operand) {
		return new MatlabUnary(operator, operand);
	}

	public static MatlabTranspose transpose(MatlabExpression operand) {
		return new MatlabTranspose("'", operand);
	}

	public static MatlabGroup group(MatlabExpression inner) {
		return new MatlabGroup(inner);
	}
}
