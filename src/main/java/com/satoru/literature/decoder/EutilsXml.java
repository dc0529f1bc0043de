package com.satoru.literature.decoder;

import com.satoru.literature.exception.StructuralException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * DOM helpers shared by the E-utilities response parsers.
 * Responses declare remote DTDs; those are never fetched.
 */
public final class EutilsXml {

    private static final DocumentBuilderFactory FACTORY = createFactory();

    private EutilsXml() {
    }

    public static Element parseRoot(byte[] payload, String expectedRoot) {
        if (payload == null || payload.length == 0) {
            throw new StructuralException("Empty response where <" + expectedRoot + "> was expected");
        }
        Document document;
        try {
            DocumentBuilder builder = FACTORY.newDocumentBuilder();
            builder.setEntityResolver((publicId, systemId) -> new InputSource(new StringReader("")));
            builder.setErrorHandler(new DefaultHandler());
            document = builder.parse(new ByteArrayInputStream(payload));
        } catch (SAXException | IOException | ParserConfigurationException e) {
            throw new StructuralException("Unparsable response where <" + expectedRoot + "> was expected", e);
        }

        Element root = document.getDocumentElement();
        if (root == null || !expectedRoot.equals(root.getTagName())) {
            String actual = root == null ? "nothing" : "<" + root.getTagName() + ">";
            String remoteError = root == null ? null : firstDescendantText(root, "ERROR").orElse(null);
            throw new StructuralException("Expected <" + expectedRoot + "> but got " + actual
                + (remoteError != null ? ": " + remoteError : ""));
        }
        return root;
    }

    public static List<Element> children(Element parent, String tagName) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && tagName.equals(((Element) node).getTagName())) {
                result.add((Element) node);
            }
        }
        return result;
    }

    public static Optional<Element> child(Element parent, String tagName) {
        List<Element> matches = children(parent, tagName);
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    public static Optional<Element> firstDescendant(Element parent, String tagName) {
        NodeList nodes = parent.getElementsByTagName(tagName);
        return nodes.getLength() == 0 ? Optional.empty() : Optional.of((Element) nodes.item(0));
    }

    public static List<Element> descendants(Element parent, String tagName) {
        NodeList nodes = parent.getElementsByTagName(tagName);
        List<Element> result = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    /**
     * Whitespace-normalised text content, inline markup flattened; empty when blank.
     */
    public static Optional<String> text(Element element) {
        if (element == null) {
            return Optional.empty();
        }
        String text = element.getTextContent();
        if (text == null) {
            return Optional.empty();
        }
        String normalized = text.replaceAll("\\s+", " ").trim();
        return normalized.isEmpty() ? Optional.empty() : Optional.of(normalized);
    }

    public static Optional<String> childText(Element parent, String tagName) {
        return child(parent, tagName).flatMap(EutilsXml::text);
    }

    public static Optional<String> firstDescendantText(Element parent, String tagName) {
        return firstDescendant(parent, tagName).flatMap(EutilsXml::text);
    }

    private static DocumentBuilderFactory createFactory() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure configuration", e);
        }
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        factory.setNamespaceAware(false);
        factory.setValidating(false);
        return factory;
    }
}
