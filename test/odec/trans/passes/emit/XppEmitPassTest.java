package odec.trans.passes.emit;

import odec.model.bio.OdeModel;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.not;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;

public class XppEmitPassTest {

	@Test
	public void twoStateSystem() {
		OdeModel model = OdeModel.builder()
				.compartment("comp1", 1)
				.species("x_1", "comp1", 0)
				.species("x_2", "comp1", 0)
				.rateRule("x_1", "a - b*x_1")
				.rateRule("x_2", "a*x_1")
				.parameter("a", 0.6, true)
				.parameter("b", 0.348, true)
				.build();
		String expected = "#\n" +
				"# This file is generated by odec\n" +
				"#\n" +
				"\n" +
				"# Parameter id = a, constant\n" +
				"par a=0.6\n" +
				"\n" +
				"# Parameter id = b, constant\n" +
				"par b=0.348\n" +
				"\n" +
				"# rateRule : variable = x_1\n" +
				"init x_1=0\n" +
				"dx_1/dt=a - b*x_1\n" +
				"\n" +
				"# rateRule : variable = x_2\n" +
				"init x_2=0\n" +
				"dx_2/dt=a*x_1\n" +
				"\n" +
				"# Species:   id = x_1, defined by rule\n" +
				"\n" +
				"# Species:   id = x_2, defined by rule\n" +
				"\n";
		assertEquals(expected, XppEmitPass.perform(model));
	}

	@Test
	public void parameterStates() {
		OdeModel model = OdeModel.builder()
				.compartment("comp1", 1)
				.parameter("x_1", 1.5, false)
				.parameter("x_2", 0, false)
				.initialAssignment("x_2", "2*k")
				.rateRule("x_1", "-k*x_1")
				.parameter("k", 3, true)
				.build();
		String xpp = XppEmitPass.perform(model);
		assertThat(xpp, containsString("# rateRule : variable = x_1\ninit x_1=1.5\ndx_1/dt=-k*x_1\n"));
		assertThat(xpp, containsString("# Parameter id = x_2, non-constant but no rule supplied\npar x_2=2*k\n"));
		assertThat(xpp, containsString("# Parameter id = k, constant\npar k=3\n"));
		assertThat(xpp, containsString("# Parameter:   id = x_1, defined by rule\n"));
		assertThat(xpp, not(containsString("comp1")));
	}

	@Test
	public void speciesWithoutRuleIsHeldConstant() {
		OdeModel model = OdeModel.builder()
				.compartment("comp1", 1)
				.species("y_1", "comp1", 2)
				.species("y_2", "comp1", 1)
				.rateRule("y_1", "-y_1")
				.build();
		assertThat(XppEmitPass.perform(model), containsString("init y_2=1\ndy_2/dt=0\n"));
	}
}
