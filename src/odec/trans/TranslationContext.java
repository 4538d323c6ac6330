package odec.trans;

import odec.scope.Scope;
import odec.trans.naming.NamingScheme;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State owned by a single translation run. A fresh context is created for every run, so
 * repeated or concurrent translations never see each other's synthesized names.
 *
 * Functions synthesized during the run live here rather than in the scope tree being
 * translated. They point at their enclosing scope for lookups, but the enclosing scope does
 * not list them, so the input tree is left untouched.
 */
public class TranslationContext {

	private final NamingScheme naming;
	private final Map<String, Scope> synthesizedFunctions;
	private int anonymousFunctionCounter;

	public TranslationContext(NamingScheme naming) {
		this.naming = naming;
		this.synthesizedFunctions = new LinkedHashMap<>();
		this.anonymousFunctionCounter = 0;
	}

	public NamingScheme getNaming() {
		return naming;
	}

	public String newAnonymousFunctionName() {
		anonymousFunctionCounter++;
		return String.format("anon%03d", anonymousFunctionCounter);
	}

	public Scope declareSynthesizedFunction(Scope enclosing, String name, List<String> parameters,
											List<String> returns) {
		Scope function = new Scope(name, enclosing, parameters, returns);
		synthesizedFunctions.put(name, function);
		return function;
	}

	/**
	 * @return the function synthesized under this name during the run, or null
	 */
	public Scope getSynthesizedFunction(String name) {
		return synthesizedFunctions.get(name);
	}
}
