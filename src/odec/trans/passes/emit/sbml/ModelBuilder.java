package odec.trans.passes.emit.sbml;

/**
 * Sink for a structured biological model. Implementations validate every call and refuse
 * ids that are malformed or already taken.
 */
public interface ModelBuilder {

	void createCompartment(String id, double size) throws ModelBuilderException;

	void createSpecies(String id, String compartmentId, double initialValue) throws ModelBuilderException;

	void createParameter(String id, double value, boolean constant) throws ModelBuilderException;

	void createInitialAssignment(String symbolId, String formula) throws ModelBuilderException;

	void createRateRule(String variableId, String formula) throws ModelBuilderException;

	/**
	 * @return the complete model document
	 */
	String serialize() throws ModelBuilderException;
}
