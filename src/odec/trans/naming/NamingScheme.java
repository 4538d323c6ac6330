package odec.trans.naming;

import odec.scope.Scope;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Builds names for flattened vector entries and synthesized functions.
 *
 * Every generated name joins its parts with a run of underscores that is one longer than
 * the longest run found in any name of the scope tree, so a generated name can never be
 * spelled the same as a name written in the source.
 */
public class NamingScheme {

	private final int separatorCount;
	private final String separator;

	public NamingScheme(int separatorCount) {
		if (separatorCount < 1) {
			throw new IllegalArgumentException("separator needs at least one underscore, got " + separatorCount);
		}
		this.separatorCount = separatorCount;
		this.separator = repeat('_', separatorCount);
	}

	public static NamingScheme forScope(Scope scope) {
		return new NamingScheme(longestUnderscoreRun(scope) + 1);
	}

	public int getSeparatorCount() {
		return separatorCount;
	}

	public String getSeparator() {
		return separator;
	}

	public String rename(String base, String tail) {
		return base + separator + tail;
	}

	public String rename(String base, int index) {
		return rename(base, Integer.toString(index));
	}

	/**
	 * @return the length of the longest sequence of consecutive underscores in any name
	 * declared in the scope or in one of its nested function scopes
	 */
	public static int longestUnderscoreRun(Scope scope) {
		int longest = 0;
		for (Scope s : scope.allScopes()) {
			for (String name : declaredNames(s)) {
				longest = Math.max(longest, longestUnderscoreRun(name));
			}
		}
		return longest;
	}

	static int longestUnderscoreRun(String name) {
		int longest = 0;
		int current = 0;
		for (int i = 0; i < name.length(); ++i) {
			if (name.charAt(i) == '_') {
				current++;
				longest = Math.max(longest, current);
			} else {
				current = 0;
			}
		}
		return longest;
	}

	private static Collection<String> declaredNames(Scope scope) {
		List<String> names = new ArrayList<>(scope.getAssignments().keySet());
		names.addAll(scope.getFunctions().keySet());
		names.addAll(scope.getParameters());
		names.addAll(scope.getReturns());
		names.addAll(scope.getTypes().keySet());
		return names;
	}

	private static String repeat(char c, int count) {
		StringBuilder b = new StringBuilder(count);
		for (int i = 0; i < count; ++i) {
			b.append(c);
		}
		return b.toString();
	}
}
