package odec;

import odec.trans.OutputFormat;
import org.junit.Test;

import java.nio.file.Paths;

import static org.hamcrest.CoreMatchers.containsString;
import static org.junit.Assert.*;

public class OdecOptionsTest {

	private static String config(String name) {
		return Paths.get("examples", "configs", name).toString();
	}

	private static OdecOptions parse(String... args) throws OdecOptionException {
		OdecOptions opts = new OdecOptions(args);
		opts.parse();
		return opts;
	}

	@Test
	public void defaults() throws OdecOptionException {
		OdecOptions opts = parse("model.json");
		assertEquals("model.json", opts.inputFilePath);
		assertEquals(OutputFormat.SBML, opts.outputFormat);
		assertTrue(opts.useSpecies);
		assertNull(opts.outputFilePath);
	}

	@Test
	public void commandLineSettings() throws OdecOptionException {
		OdecOptions opts = parse("-p", "-f=XPP", "-o=model.ode", "model.json");
		assertFalse(opts.useSpecies);
		assertEquals(OutputFormat.XPP, opts.outputFormat);
		assertEquals("model.ode", opts.outputFilePath);
	}

	@Test
	public void configurationFile() throws OdecOptionException {
		OdecOptions opts = parse("-c=" + config("xpp_parameters.json"), "model.json");
		assertFalse(opts.useSpecies);
		assertEquals(OutputFormat.XPP, opts.outputFormat);
		assertEquals("out.ode", opts.outputFilePath);
	}

	@Test
	public void commandLineOverridesConfiguration() throws OdecOptionException {
		OdecOptions opts = parse("-c=" + config("xpp_parameters.json"), "-f=sbml", "-o=elsewhere.xml", "model.json");
		assertEquals(OutputFormat.SBML, opts.outputFormat);
		assertEquals("elsewhere.xml", opts.outputFilePath);
		assertFalse(opts.useSpecies);
	}

	@Test
	public void unknownFormatInConfiguration() {
		try {
			parse("-c=" + config("unknown_format.json"), "model.json");
			fail("expected the configured format to be rejected");
		} catch (OdecOptionException e) {
			assertThat(e.getMessage(), containsString("cellml"));
		}
	}

	@Test(expected = OdecOptionException.class)
	public void unknownFormatOnCommandLine() throws OdecOptionException {
		parse("-f=matlab", "model.json");
	}

	@Test
	public void malformedConfiguration() {
		try {
			parse("-c=" + config("malformed.json"), "model.json");
			fail("expected a parsing error");
		} catch (OdecOptionException e) {
			assertThat(e.getMessage(), containsString("parsing error"));
		}
	}

	@Test
	public void missingConfiguration() {
		try {
			parse("-c=" + config("absent.json"), "model.json");
			fail("expected a reading error");
		} catch (OdecOptionException e) {
			assertThat(e.getMessage(), containsString("Error reading configuration file"));
		}
	}

	@Test(expected = OdecOptionException.class)
	public void missingInput() throws OdecOptionException {
		parse("-p");
	}

	@Test(expected = OdecOptionException.class)
	public void twoInputs() throws OdecOptionException {
		parse("a.json", "b.json");
	}

	@Test
	public void helpNeedsNoInput() throws OdecOptionException {
		OdecOptions opts = parse("-h");
		assertTrue(opts.help);
		assertNull(opts.inputFilePath);
	}
}
