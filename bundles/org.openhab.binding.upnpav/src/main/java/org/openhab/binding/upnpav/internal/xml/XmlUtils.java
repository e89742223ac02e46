/**
 * Copyright (c) 2010-2024 Contributors to the openHAB project
 *
 * See the NOTICE file(s) distributed with this work for additional
 * information.
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which is available at
 * http://www.eclipse.org/legal/epl-2.0
 *
 * SPDX-License-Identifier: EPL-2.0
 */
package org.openhab.binding.upnpav.internal.xml;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.upnpav.internal.exception.MalformedXmlException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Low-level DOM helpers shared by the DIDL-Lite model and the event decoders.
 * <p>
 * Parsing is namespace aware and refuses DOCTYPE declarations and external entities, since the documents
 * come from devices on the local network.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public final class XmlUtils {

    private static final Logger logger = LoggerFactory.getLogger(XmlUtils.class);

    private static final ErrorHandler STRICT_ERROR_HANDLER = new ErrorHandler() {
        @Override
        public void warning(@Nullable SAXParseException exception) {
            if (exception != null) {
                logger.trace("XML parser warning: {}", exception.getMessage());
            }
        }

        @Override
        public void error(@Nullable SAXParseException exception) throws SAXException {
            if (exception != null) {
                throw exception;
            }
        }

        @Override
        public void fatalError(@Nullable SAXParseException exception) throws SAXException {
            if (exception != null) {
                throw exception;
            }
        }
    };

    private XmlUtils() {
    }

    /**
     * Parses an XML string into a DOM document.
     *
     * @throws MalformedXmlException if the input is empty or not well-formed
     */
    public static Document parse(String xml) throws MalformedXmlException {
        if (xml.isBlank()) {
            throw new MalformedXmlException("Cannot parse an empty XML document");
        }
        try {
            return newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
        } catch (SAXException | IOException e) {
            throw new MalformedXmlException("Error parsing XML: " + e.getMessage(), e);
        }
    }

    /**
     * Creates an empty document for serialization. Makes sure the namespace prefixes are registered.
     */
    public static Document newDocument() {
        XmlNamespaces.initialize();
        return newDocumentBuilder().newDocument();
    }

    private static DocumentBuilder newDocumentBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);

            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(STRICT_ERROR_HANDLER);
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support the required features", e);
        }
    }

    /**
     * Serializes a node without an XML declaration.
     */
    public static String toXmlString(Node node, boolean indent) {
        try {
            TransformerFactory factory = TransformerFactory.newInstance();
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");

            Transformer transformer = factory.newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.INDENT, indent ? "yes" : "no");
            if (indent) {
                transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            }

            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(node), new StreamResult(writer));
            return writer.toString();
        } catch (TransformerException e) {
            throw new IllegalStateException("Error serializing XML: " + e.getMessage(), e);
        }
    }

    public static String toXmlString(Node node) {
        return toXmlString(node, false);
    }

    // ------------------------------------------------------------------------
    // Reading
    // ------------------------------------------------------------------------

    public static @Nullable Element findChild(Element parent, String nsId, String localName) {
        return findChildByUri(parent, XmlNamespaces.uriFor(nsId), localName);
    }

    /**
     * Returns the first direct child element with the given namespace URI and local name.
     */
    public static @Nullable Element findChildByUri(Element parent, String namespaceUri, String localName) {
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node instanceof Element && matches((Element) node, namespaceUri, localName)) {
                return (Element) node;
            }
        }
        return null;
    }

    /**
     * Returns all direct child elements with the given namespace id and local name, in document order.
     */
    public static List<Element> findChildren(Element parent, String nsId, String localName) {
        String namespaceUri = XmlNamespaces.uriFor(nsId);
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node instanceof Element && matches((Element) node, namespaceUri, localName)) {
                result.add((Element) node);
            }
        }
        return result;
    }

    public static List<Element> childElements(Element parent) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node instanceof Element) {
                result.add((Element) node);
            }
        }
        return result;
    }

    /**
     * Returns the text of the first matching child, or null if there is no such child.
     */
    public static @Nullable String findChildText(Element parent, String nsId, String localName) {
        Element child = findChild(parent, nsId, localName);
        return child == null ? null : child.getTextContent();
    }

    /**
     * Returns the text of the first matching child, or null if the child is absent or has no text.
     */
    public static @Nullable String optionalChildText(Element parent, String nsId, String localName) {
        String text = findChildText(parent, nsId, localName);
        return text == null || text.isEmpty() ? null : text;
    }

    public static List<String> findAllChildText(Element parent, String nsId, String localName) {
        List<String> result = new ArrayList<>();
        for (Element child : findChildren(parent, nsId, localName)) {
            result.add(child.getTextContent());
        }
        return result;
    }

    public static @Nullable String optionalAttribute(Element element, String name) {
        return element.hasAttribute(name) ? element.getAttribute(name) : null;
    }

    private static boolean matches(Element element, String namespaceUri, String localName) {
        return namespaceUri.equals(element.getNamespaceURI()) && localName.equals(element.getLocalName());
    }

    // ------------------------------------------------------------------------
    // Writing
    // ------------------------------------------------------------------------

    public static Element createElement(Document document, String nsId, String localName) {
        return document.createElementNS(XmlNamespaces.uriFor(nsId), XmlNamespaces.qualifiedName(nsId, localName));
    }

    /**
     * Appends a namespaced child element holding the filtered text.
     */
    public static Element appendTextElement(Element parent, String nsId, String localName, String text) {
        Element child = createElement(parent.getOwnerDocument(), nsId, localName);
        child.setTextContent(filterIllegalXmlChars(text));
        parent.appendChild(child);
        return child;
    }

    public static void appendTextElements(Element parent, String nsId, String localName, List<String> values) {
        for (String value : values) {
            appendTextElement(parent, nsId, localName, value);
        }
    }

    public static void appendOptionalTextElement(Element parent, String nsId, String localName,
            @Nullable Object value) {
        if (value != null && !value.toString().isEmpty()) {
            appendTextElement(parent, nsId, localName, value.toString());
        }
    }

    public static void setAttribute(Element element, String name, String value) {
        element.setAttribute(name, filterIllegalXmlChars(value));
    }

    // ------------------------------------------------------------------------
    // Character filtering
    // ------------------------------------------------------------------------

    /**
     * Removes every code point that may not appear in an XML 1.0 document, including unpaired surrogates.
     */
    public static String filterIllegalXmlChars(String text) {
        StringBuilder builder = null;
        int length = text.length();
        int i = 0;
        while (i < length) {
            char c = text.charAt(i);
            int codePoint = c;
            int width = 1;
            if (Character.isHighSurrogate(c) && i + 1 < length && Character.isLowSurrogate(text.charAt(i + 1))) {
                codePoint = Character.toCodePoint(c, text.charAt(i + 1));
                width = 2;
            }
            if (isLegalXmlChar(codePoint)) {
                if (builder != null) {
                    builder.appendCodePoint(codePoint);
                }
            } else if (builder == null) {
                builder = new StringBuilder(length);
                builder.append(text, 0, i);
            }
            i += width;
        }
        return builder == null ? text : builder.toString();
    }

    public static boolean isLegalXmlChar(int codePoint) {
        return codePoint == 0x9 || codePoint == 0xA || codePoint == 0xD
                || (codePoint >= 0x20 && codePoint <= 0xD7FF) || (codePoint >= 0xE000 && codePoint <= 0xFFFD)
                || (codePoint >= 0x10000 && codePoint <= 0x10FFFF);
    }
}
