package odec.model.bio;

import odec.trans.passes.emit.ModelBuilderIssue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 *
 * The translated ODE system: entities in creation order, plus the initial assignments and
 * rate rules attached to them. Instances are built with {@link Builder} and never change
 * afterwards.
 *
 */
public class OdeModel {

	private final Map<String, ModelEntity> entities;
	private final Map<String, InitialAssignment> initialAssignments;
	private final Map<String, RateRule> rateRules;

	private OdeModel(Map<String, ModelEntity> entities, Map<String, InitialAssignment> initialAssignments,
					 Map<String, RateRule> rateRules) {
		this.entities = entities;
		this.initialAssignments = initialAssignments;
		this.rateRules = rateRules;
	}

	public static Builder builder() {
		return new Builder();
	}

	public List<ModelEntity> getEntities() {
		return Collections.unmodifiableList(new ArrayList<>(entities.values()));
	}

	public <T extends ModelEntity> List<T> getEntities(Class<T> kind) {
		List<T> result = new ArrayList<>();
		for (ModelEntity entity : entities.values()) {
			if (kind.isInstance(entity)) {
				result.add(kind.cast(entity));
			}
		}
		return result;
	}

	public Optional<ModelEntity> getEntity(String id) {
		return Optional.ofNullable(entities.get(id));
	}

	public List<InitialAssignment> getInitialAssignments() {
		return Collections.unmodifiableList(new ArrayList<>(initialAssignments.values()));
	}

	public List<RateRule> getRateRules() {
		return Collections.unmodifiableList(new ArrayList<>(rateRules.values()));
	}

	public Optional<InitialAssignment> getInitialAssignment(String symbol) {
		return Optional.ofNullable(initialAssignments.get(symbol));
	}

	public Optional<RateRule> getRateRule(String variable) {
		return Optional.ofNullable(rateRules.get(variable));
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + getEntities().hashCode();
		result = prime * result + getInitialAssignments().hashCode();
		result = prime * result + getRateRules().hashCode();
		return result;
	}

	/**
	 * Two models are equal when they hold equal entities, assignments and rules in the
	 * same order.
	 */
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		OdeModel other = (OdeModel) obj;
		return getEntities().equals(other.getEntities())
				&& getInitialAssignments().equals(other.getInitialAssignments())
				&& getRateRules().equals(other.getRateRules());
	}

	@Override
	public String toString() {
		return "OdeModel [entities=" + entities.values() + ", initialAssignments=" + initialAssignments.values()
				+ ", rateRules=" + rateRules.values() + "]";
	}

	public static class Builder {

		private final Map<String, ModelEntity> entities = new LinkedHashMap<>();
		private final Map<String, InitialAssignment> initialAssignments = new LinkedHashMap<>();
		private final Map<String, RateRule> rateRules = new LinkedHashMap<>();

		private Builder() {}

		private void add(ModelEntity entity, String operation) {
			if (entities.containsKey(entity.getId())) {
				throw new ModelBuilderIssue(operation, "id " + entity.getId() + " is already defined");
			}
			entities.put(entity.getId(), entity);
		}

		public Builder compartment(String id, double size) {
			add(new Compartment(id, size), "create compartment " + id);
			return this;
		}

		public Builder species(String id, String compartment, double value) {
			if (!(entities.get(compartment) instanceof Compartment)) {
				throw new ModelBuilderIssue("create species " + id, "unknown compartment " + compartment);
			}
			add(new Species(id, compartment, value), "create species " + id);
			return this;
		}

		public Builder parameter(String id, double value, boolean constant) {
			add(new Parameter(id, value, constant), "create parameter " + id);
			return this;
		}

		public Builder initialAssignment(String symbol, String formula) {
			String operation = "create initial assignment for " + symbol;
			if (!entities.containsKey(symbol)) {
				throw new ModelBuilderIssue(operation, "unknown symbol " + symbol);
			}
			if (initialAssignments.containsKey(symbol)) {
				throw new ModelBuilderIssue(operation, symbol + " already has an initial assignment");
			}
			initialAssignments.put(symbol, new InitialAssignment(symbol, formula));
			return this;
		}

		public Builder rateRule(String variable, String formula) {
			String operation = "create rate rule for " + variable;
			ModelEntity target = entities.get(variable);
			if (target == null) {
				throw new ModelBuilderIssue(operation, "unknown variable " + variable);
			}
			if (target instanceof Compartment || (target instanceof Parameter && ((Parameter) target).isConstant())) {
				throw new ModelBuilderIssue(operation, variable + " is constant");
			}
			if (rateRules.containsKey(variable)) {
				throw new ModelBuilderIssue(operation, variable + " already has a rate rule");
			}
			rateRules.put(variable, new RateRule(variable, formula));
			return this;
		}

		public boolean isDefined(String id) {
			return entities.containsKey(id);
		}

		public OdeModel build() {
			return new OdeModel(
					new LinkedHashMap<>(entities),
					new LinkedHashMap<>(initialAssignments),
					new LinkedHashMap<>(rateRules));
		}
	}
}
