package odec.trans.passes.parse;

import odec.errors.IssueContext;
import odec.model.matlab.*;
import odec.scope.Scope;
import odec.trans.IOErrorIssue;
import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads the JSON serialization of a scope tree produced by the MATLAB parser.
 */
public class ScopeTreeParsingPass {

	private ScopeTreeParsingPass() {}

	public static Scope perform(IssueContext ctx, Path inputFilePath) {
		String text;
		try {
			text = FileUtils.readFileToString(inputFilePath.toFile(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(e));
			return null;
		}
		return perform(ctx, text);
	}

	public static Scope perform(IssueContext ctx, String json) {
		try {
			JSONObject root;
			try {
				root = new JSONObject(json);
			} catch (JSONException e) {
				throw new ScopeTreeParsingIssue("", e.getMessage());
			}
			return readScope(root, null, "");
		} catch (ScopeTreeParsingIssue issue) {
			ctx.error(issue);
			return null;
		}
	}

	private static JSONObject object(JSONObject obj, String key, String path) {
		try {
			return obj.getJSONObject(key);
		} catch (JSONException e) {
			throw new ScopeTreeParsingIssue(path + "/" + key, e.getMessage());
		}
	}

	private static JSONArray array(JSONObject obj, String key, String path) {
		if (!obj.has(key)) {
			return new JSONArray();
		}
		try {
			return obj.getJSONArray(key);
		} catch (JSONException e) {
			throw new ScopeTreeParsingIssue(path + "/" + key, e.getMessage());
		}
	}

	private static String string(JSONObject obj, String key, String path) {
		try {
			return obj.getString(key);
		} catch (JSONException e) {
			throw new ScopeTreeParsingIssue(path + "/" + key, e.getMessage());
		}
	}

	private static List<String> strings(JSONObject obj, String key, String path) {
		JSONArray values = array(obj, key, path);
		List<String> result = new ArrayList<>();
		for (int i = 0; i < values.length(); ++i) {
			try {
				result.add(values.getString(i));
			} catch (JSONException e) {
				throw new ScopeTreeParsingIssue(path + "/" + key + "/" + i, e.getMessage());
			}
		}
		return result;
	}

	private static JSONObject element(JSONArray array, int index, String path) {
		try {
			return array.getJSONObject(index);
		} catch (JSONException e) {
			throw new ScopeTreeParsingIssue(path + "/" + index, e.getMessage());
		}
	}

	private static Scope readScope(JSONObject obj, Scope parent, String path) {
		List<String> parameters = strings(obj, "parameters", path);
		List<String> returns = strings(obj, "returns", path);
		Scope scope;
		if (parent == null) {
			scope = new Scope(obj.optString("name", null), null, parameters, returns);
		} else {
			scope = parent.declareFunction(string(obj, "name", path), parameters, returns);
		}

		if (obj.has("types")) {
			JSONObject types = object(obj, "types", path);
			for (String variable : types.keySet()) {
				scope.setType(variable, string(types, variable, path + "/types"));
			}
		}

		JSONArray assignments = array(obj, "assignments", path);
		for (int i = 0; i < assignments.length(); ++i) {
			String entryPath = path + "/assignments/" + i;
			JSONObject assignment = element(assignments, i, path + "/assignments");
			scope.addAssignment(
					string(assignment, "lhs", entryPath),
					readExpression(object(assignment, "rhs", entryPath), entryPath + "/rhs"));
		}

		JSONArray calls = array(obj, "calls", path);
		for (int i = 0; i < calls.length(); ++i) {
			String entryPath = path + "/calls/" + i;
			JSONObject call = element(calls, i, path + "/calls");
			scope.addCall(string(call, "name", entryPath), readExpressions(call, "arguments", entryPath));
		}

		JSONArray functions = array(obj, "functions", path);
		for (int i = 0; i < functions.length(); ++i) {
			readScope(element(functions, i, path + "/functions"), scope, path + "/functions/" + i);
		}
		return scope;
	}

	private static List<MatlabExpression> readExpressions(JSONObject obj, String key, String path) {
		JSONArray values = array(obj, key, path);
		List<MatlabExpression> result = new ArrayList<>();
		for (int i = 0; i < values.length(); ++i) {
			result.add(readExpression(element(values, i, path + "/" + key), path + "/" + key + "/" + i));
		}
		return result;
	}

	private static MatlabExpression readExpression(JSONObject obj, String path) {
		String type = string(obj, "type", path);
		switch (type) {
			case "identifier":
				return new MatlabIdentifier(string(obj, "name", path));
			case "number":
				return readNumber(obj, path);
			case "string":
				return new MatlabString(string(obj, "value", path));
			case "function-handle":
				return new MatlabFunctionHandle(string(obj, "name", path));
			case "anonymous-function":
				return new MatlabAnonymousFunction(
						strings(obj, "parameters", path),
						readExpression(object(obj, "body", path), path + "/body"));
			case "array-or-call":
				return new MatlabArrayOrCall(string(obj, "name", path), readExpressions(obj, "arguments", path));
			case "array":
				return readArray(obj, path);
			case "binary":
				return new MatlabBinOp(
						string(obj, "operator", path),
						readExpression(object(obj, "lhs", path), path + "/lhs"),
						readExpression(object(obj, "rhs", path), path + "/rhs"));
			case "unary":
				return new MatlabUnary(
						string(obj, "operator", path),
						readExpression(object(obj, "operand", path), path + "/operand"));
			case "transpose":
				return new MatlabTranspose(
						obj.optString("operator", "'"),
						readExpression(object(obj, "operand", path), path + "/operand"));
			case "group":
				return new MatlabGroup(readExpression(object(obj, "expression", path), path + "/expression"));
			default:
				throw new ScopeTreeParsingIssue(path + "/type", "unknown expression type " + type);
		}
	}

	private static MatlabNumber readNumber(JSONObject obj, String path) {
		if (!obj.has("value")) {
			throw new ScopeTreeParsingIssue(path, "number without a value");
		}
		String text = obj.get("value").toString();
		try {
			Double.parseDouble(text);
		} catch (NumberFormatException e) {
			throw new ScopeTreeParsingIssue(path + "/value", "not a number: " + text);
		}
		return new MatlabNumber(text);
	}

	private static MatlabArray readArray(JSONObject obj, String path) {
		JSONArray rows = array(obj, "rows", path);
		List<List<MatlabExpression>> result = new ArrayList<>();
		for (int i = 0; i < rows.length(); ++i) {
			String rowPath = path + "/rows/" + i;
			JSONArray row;
			try {
				row = rows.getJSONArray(i);
			} catch (JSONException e) {
				throw new ScopeTreeParsingIssue(rowPath, e.getMessage());
			}
			List<MatlabExpression> entries = new ArrayList<>();
			for (int j = 0; j < row.length(); ++j) {
				entries.add(readExpression(element(row, j, rowPath), rowPath + "/" + j));
			}
			result.add(Collections.unmodifiableList(entries));
		}
		return new MatlabArray(result, obj.optBoolean("cell", false));
	}
}
