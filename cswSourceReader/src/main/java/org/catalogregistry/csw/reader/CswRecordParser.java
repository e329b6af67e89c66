package org.catalogregistry.csw.reader;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.catalogregistry.harvest.pipeline.ir.RawRecord;

import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * Maps Dublin Core {@code csw:Record} elements to raw records.
 *
 * The payload keeps the fields the registry indexes: identifier, title,
 * abstract, type, creator, modified, subject, references and bbox. Bounding
 * boxes are converted to {@code minx/miny/maxx/maxy} in longitude/latitude order.
 */
@Slf4j
public class CswRecordParser {
    public static final String CSW_NS = "http://www.opengis.net/cat/csw/2.0.2";
    public static final String DC_NS = "http://purl.org/dc/elements/1.1/";
    public static final String DCT_NS = "http://purl.org/dc/terms/";
    public static final String OWS_NS = "http://www.opengis.net/ows";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final DocumentBuilderFactory factory;

    public CswRecordParser() {
        factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        try {
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support disabling DTDs", e);
        }
    }

    /** Parse a {@code GetRecordsResponse}. */
    public SearchResultsPage parseSearchResults(String xml) throws CswParseException {
        var document = parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
        failOnExceptionReport(document);
        var results = firstElement(document.getDocumentElement(), CSW_NS, "SearchResults");
        if (results == null) {
            throw new CswParseException("Response has no csw:SearchResults element");
        }
        var records = new ArrayList<RawRecord>();
        String latestModified = null;
        for (var element : childElements(results)) {
            var record = toRawRecord(element);
            records.add(record);
            latestModified = later(latestModified, text(element, DCT_NS, "modified"));
        }
        return new SearchResultsPage(
            records,
            intAttribute(results, "numberOfRecordsMatched"),
            intAttribute(results, "nextRecord"),
            latestModified
        );
    }

    /** The records of every {@code csw:Insert} of a transaction document. */
    public List<RawRecord> parseTransaction(InputStream in) throws CswParseException {
        var document = parse(in);
        var inserts = document.getElementsByTagNameNS(CSW_NS, "Insert");
        if (inserts.getLength() == 0) {
            throw new CswParseException("Document has no csw:Insert element");
        }
        var records = new ArrayList<RawRecord>();
        for (int i = 0; i < inserts.getLength(); i++) {
            for (var element : childElements((Element) inserts.item(i))) {
                records.add(toRawRecord(element));
            }
        }
        return records;
    }

    /**
     * Records other than {@code csw:Record} are returned without an identifier, so
     * they are reported as malformed rather than silently skipped.
     */
    RawRecord toRawRecord(Element element) throws CswParseException {
        var payload = OBJECT_MAPPER.createObjectNode();
        if (!CSW_NS.equals(element.getNamespaceURI()) || !"Record".equals(element.getLocalName())) {
            log.atWarn().setMessage("Unsupported record element {{}}{}").addArgument(element::getNamespaceURI)
                .addArgument(element::getLocalName).log();
            payload.put("unsupported_element", element.getLocalName());
            return new RawRecord(null, write(payload));
        }
        var identifier = text(element, DC_NS, "identifier");
        putIfPresent(payload, "identifier", identifier);
        putIfPresent(payload, "title", text(element, DC_NS, "title"));
        putIfPresent(payload, "abstract", text(element, DCT_NS, "abstract"));
        putIfPresent(payload, "type", text(element, DC_NS, "type"));
        putIfPresent(payload, "creator", text(element, DC_NS, "creator"));
        putIfPresent(payload, "modified", text(element, DCT_NS, "modified"));

        var subjects = texts(element, DC_NS, "subject");
        if (!subjects.isEmpty()) {
            var array = payload.putArray("subject");
            subjects.forEach(array::add);
        }
        var references = childElements(element, DCT_NS, "references");
        if (!references.isEmpty()) {
            var array = payload.putArray("references");
            for (var reference : references) {
                var entry = array.addObject();
                if (reference.hasAttribute("scheme")) {
                    entry.put("scheme", reference.getAttribute("scheme"));
                }
                entry.put("url", reference.getTextContent().trim());
            }
        }
        var bbox = firstElement(element, OWS_NS, "BoundingBox");
        if (bbox != null) {
            readBoundingBox(identifier, bbox, payload);
        }
        return new RawRecord(identifier, write(payload));
    }

    private static void readBoundingBox(String identifier, Element bbox, ObjectNode payload) {
        var lower = corner(text(bbox, OWS_NS, "LowerCorner"));
        var upper = corner(text(bbox, OWS_NS, "UpperCorner"));
        if (lower == null || upper == null) {
            log.debug("Ignoring unreadable bounding box of record {}", identifier);
            return;
        }
        // EPSG:4326 given as a URN is in latitude/longitude axis order
        var latFirst = isLatitudeFirst(bbox.getAttribute("crs"));
        var box = payload.putObject("bbox");
        box.put("minx", latFirst ? lower[1] : lower[0]);
        box.put("miny", latFirst ? lower[0] : lower[1]);
        box.put("maxx", latFirst ? upper[1] : upper[0]);
        box.put("maxy", latFirst ? upper[0] : upper[1]);
    }

    static boolean isLatitudeFirst(String crs) {
        if (crs == null) {
            return false;
        }
        var normalized = crs.toLowerCase();
        return normalized.startsWith("urn:ogc:def:crs:epsg:") && normalized.endsWith(":4326");
    }

    private static double[] corner(String value) {
        if (value == null) {
            return null;
        }
        var parts = value.trim().split("\\s+");
        if (parts.length != 2) {
            return null;
        }
        try {
            return new double[] {Double.parseDouble(parts[0]), Double.parseDouble(parts[1])};
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private Document parse(InputStream in) throws CswParseException {
        try {
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(in);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("Cannot create XML parser", e);
        } catch (SAXException | IOException e) {
            throw new CswParseException("Unreadable CSW document: " + e.getMessage(), e);
        }
    }

    private static void failOnExceptionReport(Document document) throws CswParseException {
        var root = document.getDocumentElement();
        if ("ExceptionReport".equals(root.getLocalName())) {
            var exceptionText = root.getElementsByTagNameNS("*", "ExceptionText");
            var message = exceptionText.getLength() > 0
                ? exceptionText.item(0).getTextContent().trim()
                : "no exception text";
            throw new CswParseException("Service returned an exception report: " + message);
        }
    }

    private static int intAttribute(Element element, String name) throws CswParseException {
        var value = element.getAttribute(name);
        if (value.isEmpty()) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new CswParseException("Attribute " + name + " is not a number: " + value, e);
        }
    }

    private static String later(String current, String candidate) {
        if (candidate == null) {
            return current;
        }
        return current == null || candidate.compareTo(current) > 0 ? candidate : current;
    }

    private static String write(ObjectNode payload) throws CswParseException {
        try {
            return OBJECT_MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new CswParseException("Cannot serialize record: " + e.getOriginalMessage(), e);
        }
    }

    private static void putIfPresent(ObjectNode payload, String field, String value) {
        if (value != null) {
            payload.put(field, value);
        }
    }

    private static String text(Element parent, String namespace, String localName) {
        var element = firstElement(parent, namespace, localName);
        if (element == null) {
            return null;
        }
        var value = element.getTextContent().trim();
        return value.isEmpty() ? null : value;
    }

    private static List<String> texts(Element parent, String namespace, String localName) {
        var values = new ArrayList<String>();
        for (var element : childElements(parent, namespace, localName)) {
            var value = element.getTextContent().trim();
            if (!value.isEmpty()) {
                values.add(value);
            }
        }
        return values;
    }

    private static Element firstElement(Element parent, String namespace, String localName) {
        NodeList nodes = parent.getElementsByTagNameNS(namespace, localName);
        return nodes.getLength() == 0 ? null : (Element) nodes.item(0);
    }

    private static List<Element> childElements(Element parent, String namespace, String localName) {
        var elements = new ArrayList<Element>();
        for (var child : childElements(parent)) {
            if (namespace.equals(child.getNamespaceURI()) && localName.equals(child.getLocalName())) {
                elements.add(child);
            }
        }
        return elements;
    }

    private static List<Element> childElements(Element parent) {
        var elements = new ArrayList<Element>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                elements.add((Element) child);
            }
        }
        return elements;
    }
}
