package simboard.ingest.parsers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads {@code <entry id="..." value="..."/>} values out of the env_*.xml files CIME keeps in CaseDocs.
 */
public class CaseDocsParser implements MetadataParser {
    private static final Logger log = LoggerFactory.getLogger(CaseDocsParser.class);

    private final Map<String, String> entryIdsByField;

    /**
     * @param entryIdsByField output field name to the id of the entry holding its value, in output order
     */
    public CaseDocsParser(Map<String, String> entryIdsByField) {
        this.entryIdsByField = new LinkedHashMap<>(entryIdsByField);
    }

    public static CaseDocsParser envCase() {
        return new CaseDocsParser(Map.of("group_name", "CASE_GROUP"));
    }

    public static CaseDocsParser envBuild() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("compiler", "COMPILER");
        fields.put("mpilib", "MPILIB");
        return new CaseDocsParser(fields);
    }

    @Override
    public Map<String, String> parse(Path path) throws IOException {
        return parseXml(TextFiles.read(path), path.toString());
    }

    Map<String, String> parseXml(String xml, String source) {
        Map<String, String> result = new LinkedHashMap<>();
        for (String field : entryIdsByField.keySet()) {
            result.put(field, null);
        }

        Document document;
        try {
            document = newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
        } catch (SAXException | IOException e) {
            log.warn("Ignoring malformed XML in {}: {}", source, e.getMessage());
            return result;
        }

        for (Map.Entry<String, String> field : entryIdsByField.entrySet()) {
            result.put(field.getKey(), findEntryValue(document, field.getValue()));
        }
        return result;
    }

    private static String findEntryValue(Document document, String entryId) {
        NodeList entries = document.getElementsByTagName("entry");
        for (int i = 0; i < entries.getLength(); i++) {
            Element entry = (Element) entries.item(i);
            if (!entryId.equals(entry.getAttribute("id"))) {
                continue;
            }
            if (entry.hasAttribute("value")) {
                return entry.getAttribute("value");
            }
            String text = entry.getTextContent();
            if (text != null && !text.isBlank()) {
                return text.strip();
            }
        }
        return null;
    }

    /**
     * Keeps the parser from printing to stderr. Errors reach {@link #parseXml} as exceptions instead.
     */
    private static final ErrorHandler RETHROW_ERRORS = new ErrorHandler() {
        @Override
        public void warning(SAXParseException e) {
            log.debug("XML warning: {}", e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    };

    private static DocumentBuilder newDocumentBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            factory.setNamespaceAware(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(RETHROW_ERRORS);
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser not available", e);
        }
    }
}
