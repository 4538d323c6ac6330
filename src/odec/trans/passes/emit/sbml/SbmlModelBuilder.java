package odec.trans.passes.emit.sbml;

import odec.formatters.FormattingTools;
import odec.model.formula.FormulaNode;
import odec.trans.passes.formula.FormulaParseException;
import odec.trans.passes.formula.InfixFormulaParser;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Writes an SBML Level 3 Version 1 core document.
 */
public class SbmlModelBuilder implements ModelBuilder {

	public static final String SBML_NS = "http://www.sbml.org/sbml/level3/version1/core";

	private static final String XMLNS_NS = "http://www.w3.org/2000/xmlns/";
	private static final Pattern SID = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	private final Document doc;
	private final Element model;
	private final Element compartments;
	private final Element species;
	private final Element parameters;
	private final Element initialAssignments;
	private final Element rules;
	private final MathMlWriter mathMl;

	private final Set<String> ids = new HashSet<>();
	private final Set<String> compartmentIds = new HashSet<>();
	private final Set<String> assignedSymbols = new HashSet<>();
	private final Set<String> ruleVariables = new HashSet<>();
	private final Set<String> constantIds = new HashSet<>();

	public SbmlModelBuilder(String modelId) throws ModelBuilderException {
		try {
			DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
			factory.setNamespaceAware(true);
			doc = factory.newDocumentBuilder().newDocument();
		} catch (ParserConfigurationException e) {
			throw new ModelBuilderException("cannot create XML document", e);
		}
		Element sbml = doc.createElementNS(SBML_NS, "sbml");
		sbml.setAttributeNS(XMLNS_NS, "xmlns", SBML_NS);
		sbml.setAttribute("level", "3");
		sbml.setAttribute("version", "1");
		doc.appendChild(sbml);
		model = sbml("model");
		model.setAttribute("id", checkId(modelId));
		sbml.appendChild(model);

		compartments = sbml("listOfCompartments");
		species = sbml("listOfSpecies");
		parameters = sbml("listOfParameters");
		initialAssignments = sbml("listOfInitialAssignments");
		rules = sbml("listOfRules");
		mathMl = new MathMlWriter(doc);
	}

	private Element sbml(String name) {
		return doc.createElementNS(SBML_NS, name);
	}

	private static String checkId(String id) throws ModelBuilderException {
		if (id == null || !SID.matcher(id).matches()) {
			throw new ModelBuilderException("invalid identifier " + id);
		}
		return id;
	}

	private Element entity(String kind, String id) throws ModelBuilderException {
		checkId(id);
		if (!ids.add(id)) {
			throw new ModelBuilderException("duplicate identifier " + id);
		}
		Element e = sbml(kind);
		e.setAttribute("id", id);
		return e;
	}

	private Element math(String formula) throws ModelBuilderException {
		FormulaNode parsed;
		try {
			parsed = InfixFormulaParser.parse(formula);
		} catch (FormulaParseException e) {
			throw new ModelBuilderException("cannot parse formula " + formula + ": " + e.getMessage(), e);
		}
		return mathMl.math(parsed);
	}

	@Override
	public void createCompartment(String id, double size) throws ModelBuilderException {
		Element e = entity("compartment", id);
		e.setAttribute("constant", "true");
		e.setAttribute("size", FormattingTools.formatValue(size));
		e.setAttribute("spatialDimensions", "3");
		compartments.appendChild(e);
		compartmentIds.add(id);
		constantIds.add(id);
	}

	@Override
	public void createSpecies(String id, String compartmentId, double initialValue) throws ModelBuilderException {
		if (!compartmentIds.contains(compartmentId)) {
			throw new ModelBuilderException("unknown compartment " + compartmentId);
		}
		Element e = entity("species", id);
		e.setAttribute("compartment", compartmentId);
		e.setAttribute("constant", "false");
		e.setAttribute("initialConcentration", FormattingTools.formatValue(initialValue));
		e.setAttribute("boundaryCondition", "false");
		e.setAttribute("hasOnlySubstanceUnits", "false");
		species.appendChild(e);
	}

	@Override
	public void createParameter(String id, double value, boolean constant) throws ModelBuilderException {
		Element e = entity("parameter", id);
		e.setAttribute("constant", Boolean.toString(constant));
		e.setAttribute("value", FormattingTools.formatValue(value));
		parameters.appendChild(e);
		if (constant) {
			constantIds.add(id);
		}
	}

	@Override
	public void createInitialAssignment(String symbolId, String formula) throws ModelBuilderException {
		if (!ids.contains(symbolId)) {
			throw new ModelBuilderException("unknown symbol " + symbolId);
		}
		if (!assignedSymbols.add(symbolId)) {
			throw new ModelBuilderException("second initial assignment for " + symbolId);
		}
		Element e = sbml("initialAssignment");
		e.setAttribute("symbol", symbolId);
		e.appendChild(math(formula));
		initialAssignments.appendChild(e);
	}

	@Override
	public void createRateRule(String variableId, String formula) throws ModelBuilderException {
		if (!ids.contains(variableId)) {
			throw new ModelBuilderException("unknown variable " + variableId);
		}
		if (constantIds.contains(variableId)) {
			throw new ModelBuilderException("rate rule for constant " + variableId);
		}
		if (!ruleVariables.add(variableId)) {
			throw new ModelBuilderException("second rate rule for " + variableId);
		}
		Element e = sbml("rateRule");
		e.setAttribute("variable", variableId);
		e.appendChild(math(formula));
		rules.appendChild(e);
	}

	@Override
	public String serialize() throws ModelBuilderException {
		List<Element> lists = Arrays.asList(compartments, species, parameters, initialAssignments, rules);
		for (Element list : lists) {
			if (list.hasChildNodes() && list.getParentNode() == null) {
				model.appendChild(list);
			}
		}
		try {
			TransformerFactory factory = TransformerFactory.newInstance();
			factory.setAttribute("indent-number", 2);
			Transformer transformer = factory.newTransformer();
			transformer.setOutputProperty(OutputKeys.INDENT, "yes");
			transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
			StringWriter out = new StringWriter();
			transformer.transform(new DOMSource(doc), new StreamResult(out));
			return out.toString();
		} catch (TransformerException e) {
			throw new ModelBuilderException("cannot serialize model", e);
		}
	}
}
