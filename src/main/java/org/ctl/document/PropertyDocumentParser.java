package org.ctl.document;

import org.ctl.formula.DomFormulaNode;
import org.ctl.formula.FormulaNode;
import org.ctl.formula.NodeKind;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * PARSER DOM DEI FILE DI PROPRIETÀ MCC
 *
 * Legge un documento {@code <property-set>} e produce la lista ordinata delle voci
 * {@code <property>}, ciascuna con il proprio {@code <id>} e la radice {@code <formula>}.
 *
 * FORMATO ATTESO:
 * <pre>
 * &lt;property-set xmlns="http://mcc.lip6.fr/"&gt;
 *   &lt;property&gt;
 *     &lt;id&gt;Model-CTLCardinality-00&lt;/id&gt;
 *     &lt;formula&gt; ... &lt;/formula&gt;
 *   &lt;/property&gt;
 * &lt;/property-set&gt;
 * </pre>
 *
 * Le voci senza id o senza formula vengono comunque riportate (con campo null): la decisione
 * di scartarle spetta all'estrattore, che ne registra il motivo.
 */
public class PropertyDocumentParser {

    private static final Logger LOGGER = Logger.getLogger(PropertyDocumentParser.class.getName());

    private static final String PROPERTY_TAG = "property";
    private static final String ID_TAG = "id";
    private static final String FORMULA_TAG = "formula";

    /**
     * Analizza un file di proprietà.
     *
     * @param xmlPath percorso del documento
     * @return documento analizzato
     * @throws MalformedDocumentException se il file non è leggibile o non è XML ben formato
     */
    public PropertyDocument parse(Path xmlPath) throws MalformedDocumentException {
        String source = xmlPath.toString();
        try (InputStream in = Files.newInputStream(xmlPath)) {
            return parse(in, source);
        } catch (IOException e) {
            throw new MalformedDocumentException(source, "lettura fallita (" + e.getMessage() + ")", e);
        }
    }

    /**
     * Analizza un documento da stream; lo stream non viene chiuso.
     *
     * @param in contenuto XML
     * @param source nome della sorgente usato nei messaggi
     * @return documento analizzato
     * @throws MalformedDocumentException se il contenuto non è XML ben formato
     */
    public PropertyDocument parse(InputStream in, String source) throws MalformedDocumentException {
        Document doc;
        try {
            DocumentBuilder builder = newDocumentBuilder();
            doc = builder.parse(in);
        } catch (SAXException e) {
            throw new MalformedDocumentException(source, e.getMessage(), e);
        } catch (IOException e) {
            throw new MalformedDocumentException(source, "lettura fallita (" + e.getMessage() + ")", e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("Configurazione parser XML non supportata", e);
        }

        Element root = doc.getDocumentElement();
        if (root == null) {
            throw new MalformedDocumentException(source, "documento vuoto", null);
        }

        List<PropertyEntry> entries = new ArrayList<>();
        NodeList propertyNodes = root.getElementsByTagNameNS(NodeKind.MCC_NAMESPACE, PROPERTY_TAG);
        for (int i = 0; i < propertyNodes.getLength(); i++) {
            Element propertyEl = (Element) propertyNodes.item(i);
            entries.add(parseEntry(propertyEl, entries.size()));
        }

        LOGGER.fine("Documento " + source + ": " + entries.size() + " proprietà trovate");
        return new PropertyDocument(source, entries);
    }

    private PropertyEntry parseEntry(Element propertyEl, int position) {
        Element idEl = child(propertyEl, ID_TAG);
        Element formulaEl = child(propertyEl, FORMULA_TAG);

        String id = null;
        if (idEl != null) {
            String text = idEl.getTextContent();
            if (text != null && !text.isBlank()) {
                id = text.trim();
            }
        }

        FormulaNode formula = formulaEl != null ? DomFormulaNode.fromElement(formulaEl) : null;
        return new PropertyEntry(position, id, formula);
    }

    private DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
        f.setNamespaceAware(true);
        f.setIgnoringComments(true);
        f.setCoalescing(true);
        f.setExpandEntityReferences(false);
        f.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);

        DocumentBuilder builder = f.newDocumentBuilder();
        // Il gestore di default stampa su stderr: gli errori devono arrivare solo come SAXException
        builder.setErrorHandler(new ErrorHandler() {
            @Override
            public void warning(SAXParseException e) {
                LOGGER.fine("Avviso XML: " + e.getMessage());
            }

            @Override
            public void error(SAXParseException e) throws SAXException {
                throw e;
            }

            @Override
            public void fatalError(SAXParseException e) throws SAXException {
                throw e;
            }
        });
        return builder;
    }

    private static Element child(Element parent, String localName) {
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node n = children.item(i);
            if (!(n instanceof Element)) continue;
            Element el = (Element) n;
            if (NodeKind.MCC_NAMESPACE.equals(el.getNamespaceURI()) && localName.equals(el.getLocalName())) {
                return el;
            }
        }
        return null;
    }
}
