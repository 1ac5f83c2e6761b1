package com.questrail.spe.internal.document;

import com.questrail.spe.api.FailureSection;
import com.questrail.spe.api.SpeFormatException;
import com.questrail.spe.io.ByteSource;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * StructuredMetadataParser
 * =============================================================================
 * Parses the XML document that trails the frame data of a modern SPE file and
 * extracts the subtrees the reader understands.
 *
 * <h2>Recognised sections</h2>
 * <ul>
 *   <li>{@code DataFormat}: frame block attributes and region descriptors</li>
 *   <li>{@code MetaFormat}: the per-frame tracking field layout</li>
 *   <li>{@code Calibrations}: wavelength and polynomial mappings, sensor information</li>
 *   <li>{@code GeneralInformation}: opaque descriptive passthrough</li>
 * </ul>
 *
 * <h2>Failure model</h2>
 * <ul>
 *   <li>A document that is not well-formed UTF-8 XML, or whose root is not
 *       {@code SpeFormat}, is a structural error tagged
 *       {@link FailureSection#METADATA_DOCUMENT}.</li>
 *   <li>A missing section is recorded as absent, never as a failure.</li>
 *   <li>Unrecognised sections are skipped and listed in
 *       {@link MetadataDocument#ignoredSections()} so that files from newer
 *       writers stay readable.</li>
 * </ul>
 *
 * Element names are matched by local name; the writer's namespace is not
 * checked.
 */
public final class StructuredMetadataParser
{
    static final String ROOT = "SpeFormat";
    static final String DATA_FORMAT = "DataFormat";
    static final String META_FORMAT = "MetaFormat";
    static final String CALIBRATIONS = "Calibrations";
    static final String GENERAL_INFORMATION = "GeneralInformation";

    /**
     * Reads and parses the document stored from {@code offset} to the end of
     * {@code source}.
     */
    public MetadataDocument parse(ByteSource source, long offset) throws IOException {
        final long length = source.size() - offset;
        if (length <= 0) {
            throw failure("No metadata document at offset " + offset);
        }
        if (length > Integer.MAX_VALUE - 8) {
            throw failure("Metadata document of " + length + " bytes is too large");
        }

        final ByteBuffer buffer = ByteBuffer.allocate((int) length);
        final int read = source.readFully(offset, buffer);
        if (read < length) {
            throw failure("Metadata document truncated: read " + read + " of " + length + " bytes");
        }
        return parse(buffer.array());
    }

    /**
     * Parses an in-memory document.
     */
    public MetadataDocument parse(byte[] document) {
        final Element root = readRoot(document);
        if (!ROOT.equals(localName(root))) {
            throw failure("Unexpected root element <" + localName(root) + ">, expected <" + ROOT + ">");
        }

        Optional<RawFrameFormat> frameFormat = Optional.empty();
        Optional<List<RawTrackField>> trackingLayout = Optional.empty();
        Optional<RawCalibrations> calibrations = Optional.empty();
        Optional<Map<String, String>> generalInfo = Optional.empty();
        final List<String> ignored = new ArrayList<>();

        for (Element section : childElements(root)) {
            switch (localName(section)) {
                case DATA_FORMAT -> frameFormat = frameFormat.or(() -> parseFrameFormat(section));
                case META_FORMAT -> trackingLayout = trackingLayout.or(() -> parseTrackingLayout(section));
                case CALIBRATIONS -> calibrations = calibrations.or(() -> Optional.of(parseCalibrations(section, ignored)));
                case GENERAL_INFORMATION -> generalInfo = generalInfo.or(() -> Optional.of(flatten(section)));
                default -> ignored.add(localName(section));
            }
        }

        return new MetadataDocument(frameFormat, trackingLayout, calibrations, generalInfo, ignored);
    }

    // ========================================================================
    // Sections
    // ========================================================================

    private static Optional<RawFrameFormat> parseFrameFormat(Element dataFormat) {
        for (Element block : childElements(dataFormat)) {
            if (isDataBlock(block, "Frame")) {
                final List<Map<String, String>> regions = new ArrayList<>();
                for (Element region : childElements(block)) {
                    if (isDataBlock(region, "Region")) {
                        regions.add(attributes(region));
                    }
                }
                return Optional.of(new RawFrameFormat(attributes(block), regions));
            }
        }
        return Optional.empty();
    }

    private static Optional<List<RawTrackField>> parseTrackingLayout(Element metaFormat) {
        for (Element block : childElements(metaFormat)) {
            if ("MetaBlock".equals(localName(block))) {
                final List<RawTrackField> fields = new ArrayList<>();
                for (Element field : childElements(block)) {
                    fields.add(new RawTrackField(localName(field), attributes(field)));
                }
                return fields.isEmpty() ? Optional.empty() : Optional.of(fields);
            }
        }
        return Optional.empty();
    }

    private static RawCalibrations parseCalibrations(Element calibrations, List<String> ignored) {
        final List<RawCalibration> mappings = new ArrayList<>();
        Optional<Map<String, String>> sensorInformation = Optional.empty();

        for (Element child : childElements(calibrations)) {
            final String name = localName(child);
            switch (name) {
                case RawCalibration.WAVELENGTH_MAPPING -> {
                    // Values sit in a <Wavelength> child.
                    String values = "";
                    for (Element inner : childElements(child)) {
                        if ("Wavelength".equals(localName(inner))) {
                            values = inner.getTextContent();
                            break;
                        }
                    }
                    mappings.add(new RawCalibration(name, attributes(child), values));
                }
                case RawCalibration.POLYNOMIAL_MAPPING ->
                        mappings.add(new RawCalibration(name, attributes(child), child.getTextContent()));
                case "SensorInformation" -> {
                    if (sensorInformation.isEmpty()) {
                        sensorInformation = Optional.of(attributes(child));
                    }
                }
                case "SensorMapping" -> {
                    // Region geometry comes from the binary ROI table.
                }
                default -> ignored.add(CALIBRATIONS + "/" + name);
            }
        }
        return new RawCalibrations(mappings, sensorInformation);
    }

    /**
     * Flattens an element tree to {@code Child.Grandchild@attribute} and
     * {@code Child.Grandchild} (text) keys. Repeated keys get a {@code [n]} suffix.
     */
    static Map<String, String> flatten(Element section) {
        final Map<String, String> out = new LinkedHashMap<>();
        for (Element child : childElements(section)) {
            flattenInto(child, localName(child), out);
        }
        return out;
    }

    private static void flattenInto(Element element, String path, Map<String, String> out) {
        attributes(element).forEach((name, value) -> put(out, path + "@" + name, value));

        final List<Element> children = childElements(element);
        if (children.isEmpty()) {
            final String text = element.getTextContent().trim();
            if (!text.isEmpty()) {
                put(out, path, text);
            }
            return;
        }
        for (Element child : children) {
            flattenInto(child, path + "." + localName(child), out);
        }
    }

    private static void put(Map<String, String> out, String key, String value) {
        String unique = key;
        for (int n = 1; out.containsKey(unique); n++) {
            unique = key + "[" + n + "]";
        }
        out.put(unique, value);
    }

    // ========================================================================
    // DOM helpers
    // ========================================================================

    private static Element readRoot(byte[] document) {
        try {
            final DocumentBuilder builder = newFactory().newDocumentBuilder();
            builder.setErrorHandler(new RethrowingErrorHandler());
            final InputSource input = new InputSource(new ByteArrayInputStream(document));
            input.setEncoding(StandardCharsets.UTF_8.name());
            final Document parsed = builder.parse(input);
            return parsed.getDocumentElement();
        }
        catch (SAXException e) {
            throw new SpeFormatException(FailureSection.METADATA_DOCUMENT,
                    "Malformed metadata document: " + e.getMessage(), e);
        }
        catch (IOException e) {
            // In-memory input; only a decoding failure can end up here.
            throw new SpeFormatException(FailureSection.METADATA_DOCUMENT,
                    "Unreadable metadata document: " + e.getMessage(), e);
        }
        catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support the required features", e);
        }
    }

    private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
        final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        return factory;
    }

    private static boolean isDataBlock(Element element, String type) {
        return "DataBlock".equals(localName(element)) && type.equals(element.getAttribute("type"));
    }

    private static List<Element> childElements(Element parent) {
        final List<Element> elements = new ArrayList<>();
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                elements.add((Element) node);
            }
        }
        return elements;
    }

    private static Map<String, String> attributes(Element element) {
        final Map<String, String> out = new LinkedHashMap<>();
        final NamedNodeMap attributes = element.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            final Node attribute = attributes.item(i);
            final String name = attribute.getLocalName() != null ? attribute.getLocalName() : attribute.getNodeName();
            if (attribute.getNodeName().startsWith("xmlns")) {
                continue;
            }
            out.put(name, attribute.getNodeValue());
        }
        return out;
    }

    private static String localName(Element element) {
        return element.getLocalName() != null ? element.getLocalName() : element.getNodeName();
    }

    private static SpeFormatException failure(String message) {
        return new SpeFormatException(FailureSection.METADATA_DOCUMENT, message);
    }

    /**
     * Turns recoverable parse errors into failures and keeps the parser from
     * printing to standard error.
     */
    private static final class RethrowingErrorHandler implements ErrorHandler
    {
        @Override
        public void warning(SAXParseException exception) {
            // Warnings do not affect well-formedness.
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}
