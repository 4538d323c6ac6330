package odec.trans.passes.emit;

import odec.errors.IssueContext;
import odec.model.bio.Compartment;
import odec.model.bio.InitialAssignment;
import odec.model.bio.ModelEntity;
import odec.model.bio.ModelEntityVisitor;
import odec.model.bio.OdeModel;
import odec.model.bio.Parameter;
import odec.model.bio.RateRule;
import odec.model.bio.Species;
import odec.trans.passes.emit.sbml.ModelBuilder;
import odec.trans.passes.emit.sbml.ModelBuilderException;

import java.util.List;

/**
 * Replays an assembled model into a {@link ModelBuilder}: compartments, species, parameters,
 * initial assignments, then rate rules.
 */
public class SbmlEmitPass {

	private SbmlEmitPass() {}

	private static class EntityCreator extends ModelEntityVisitor<Void, ModelBuilderException> {

		private final ModelBuilder builder;

		EntityCreator(ModelBuilder builder) {
			this.builder = builder;
		}

		@Override
		public Void visit(Compartment compartment) throws ModelBuilderException {
			builder.createCompartment(compartment.getId(), compartment.getSize());
			return null;
		}

		@Override
		public Void visit(Parameter parameter) throws ModelBuilderException {
			builder.createParameter(parameter.getId(), parameter.getValue(), parameter.isConstant());
			return null;
		}

		@Override
		public Void visit(Species species) throws ModelBuilderException {
			builder.createSpecies(species.getId(), species.getCompartment(), species.getValue());
			return null;
		}
	}

	private static void create(List<? extends ModelEntity> entities, EntityCreator creator, String kind) {
		for (ModelEntity entity : entities) {
			try {
				entity.accept(creator);
			} catch (ModelBuilderException e) {
				throw new ModelBuilderIssue("create " + kind + " " + entity.getId(), e);
			}
		}
	}

	/**
	 * @return the serialized document, or null if the builder rejected part of the model
	 */
	public static String perform(IssueContext ctx, OdeModel model, ModelBuilder builder) {
		EntityCreator creator = new EntityCreator(builder);
		try {
			create(model.getEntities(Compartment.class), creator, "compartment");
			create(model.getEntities(Species.class), creator, "species");
			create(model.getEntities(Parameter.class), creator, "parameter");
			for (InitialAssignment assignment : model.getInitialAssignments()) {
				try {
					builder.createInitialAssignment(assignment.getSymbol(), assignment.getFormula());
				} catch (ModelBuilderException e) {
					throw new ModelBuilderIssue("create initial assignment for " + assignment.getSymbol(), e);
				}
			}
			for (RateRule rule : model.getRateRules()) {
				try {
					builder.createRateRule(rule.getVariable(), rule.getFormula());
				} catch (ModelBuilderException e) {
					throw new ModelBuilderIssue("create rate rule for " + rule.getVariable(), e);
				}
			}
			try {
				return builder.serialize();
			} catch (ModelBuilderException e) {
				throw new ModelBuilderIssue("serialize the model", e);
			}
		} catch (ModelBuilderIssue issue) {
			ctx.error(issue);
			return null;
		}
	}
}
