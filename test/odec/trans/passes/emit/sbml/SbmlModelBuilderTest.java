package odec.trans.passes.emit.sbml;

import org.junit.Before;
import org.junit.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class SbmlModelBuilderTest {

	private SbmlModelBuilder builder;

	@Before
	public void setUp() throws ModelBuilderException {
		builder = new SbmlModelBuilder("two_state");
		builder.createCompartment("comp1", 1);
	}

	private static Document parse(String xml) throws Exception {
		DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
		factory.setNamespaceAware(true);
		return factory.newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
	}

	private static Element single(Document doc, String namespace, String name) {
		NodeList nodes = doc.getElementsByTagNameNS(namespace, name);
		assertEquals(1, nodes.getLength());
		return (Element) nodes.item(0);
	}

	private static List<String> childNames(Element parent) {
		List<String> names = new ArrayList<>();
		NodeList children = parent.getChildNodes();
		for (int i = 0; i < children.getLength(); ++i) {
			if (children.item(i) instanceof Element) {
				names.add(children.item(i).getLocalName());
			}
		}
		return names;
	}

	@Test
	public void documentStructure() throws Exception {
		builder.createSpecies("x_1", "comp1", 0);
		builder.createParameter("a", 0.6, true);
		builder.createParameter("b", 0, true);
		builder.createInitialAssignment("b", "2*a");
		builder.createRateRule("x_1", "a - b*x_1");
		Document doc = parse(builder.serialize());

		Element sbml = doc.getDocumentElement();
		assertEquals(SbmlModelBuilder.SBML_NS, sbml.getNamespaceURI());
		assertEquals("3", sbml.getAttribute("level"));
		assertEquals("1", sbml.getAttribute("version"));
		Element model = single(doc, SbmlModelBuilder.SBML_NS, "model");
		assertEquals("two_state", model.getAttribute("id"));
		List<String> expected = new ArrayList<>();
		expected.add("listOfCompartments");
		expected.add("listOfSpecies");
		expected.add("listOfParameters");
		expected.add("listOfInitialAssignments");
		expected.add("listOfRules");
		assertEquals(expected, childNames(model));

		Element compartment = single(doc, SbmlModelBuilder.SBML_NS, "compartment");
		assertEquals("comp1", compartment.getAttribute("id"));
		assertEquals("1", compartment.getAttribute("size"));
		assertEquals("true", compartment.getAttribute("constant"));
		assertEquals("3", compartment.getAttribute("spatialDimensions"));

		Element species = single(doc, SbmlModelBuilder.SBML_NS, "species");
		assertEquals("comp1", species.getAttribute("compartment"));
		assertEquals("0", species.getAttribute("initialConcentration"));
		assertEquals("false", species.getAttribute("constant"));
		assertEquals("false", species.getAttribute("boundaryCondition"));
		assertEquals("false", species.getAttribute("hasOnlySubstanceUnits"));

		Element rule = single(doc, SbmlModelBuilder.SBML_NS, "rateRule");
		assertEquals("x_1", rule.getAttribute("variable"));
		Element math = (Element) rule.getElementsByTagNameNS(MathMlWriter.MATHML_NS, "math").item(0);
		assertEquals(1, childNames(math).size());
		Element apply = (Element) math.getElementsByTagNameNS(MathMlWriter.MATHML_NS, "apply").item(0);
		assertEquals("minus", childNames(apply).get(0));
		assertEquals(3, math.getElementsByTagNameNS(MathMlWriter.MATHML_NS, "ci").getLength());

		Element assignment = single(doc, SbmlModelBuilder.SBML_NS, "initialAssignment");
		assertEquals("b", assignment.getAttribute("symbol"));
		assertEquals("2", assignment.getElementsByTagNameNS(MathMlWriter.MATHML_NS, "cn").item(0).getTextContent());
	}

	@Test
	public void emptyListsAreLeftOut() throws Exception {
		Document doc = parse(builder.serialize());
		Element model = single(doc, SbmlModelBuilder.SBML_NS, "model");
		List<String> expected = new ArrayList<>();
		expected.add("listOfCompartments");
		assertEquals(expected, childNames(model));
	}

	@Test(expected = ModelBuilderException.class)
	public void duplicateId() throws ModelBuilderException {
		builder.createParameter("comp1", 2, true);
	}

	@Test(expected = ModelBuilderException.class)
	public void unknownCompartment() throws ModelBuilderException {
		builder.createSpecies("x_1", "cytosol", 0);
	}

	@Test(expected = ModelBuilderException.class)
	public void malformedId() throws ModelBuilderException {
		builder.createParameter("v(2)", 1, true);
	}

	@Test(expected = ModelBuilderException.class)
	public void rateRuleForConstant() throws ModelBuilderException {
		builder.createParameter("k", 1, true);
		builder.createRateRule("k", "-k");
	}

	@Test(expected = ModelBuilderException.class)
	public void secondRateRule() throws ModelBuilderException {
		builder.createSpecies("x_1", "comp1", 0);
		builder.createRateRule("x_1", "-x_1");
		builder.createRateRule("x_1", "x_1");
	}

	@Test(expected = ModelBuilderException.class)
	public void initialAssignmentForUnknownSymbol() throws ModelBuilderException {
		builder.createInitialAssignment("k", "1");
	}

	@Test(expected = ModelBuilderException.class)
	public void unparsableFormula() throws ModelBuilderException {
		builder.createSpecies("x_1", "comp1", 0);
		builder.createRateRule("x_1", "x_1 +");
	}

	@Test(expected = ModelBuilderException.class)
	public void malformedModelId() throws ModelBuilderException {
		new SbmlModelBuilder("1model");
	}
}
