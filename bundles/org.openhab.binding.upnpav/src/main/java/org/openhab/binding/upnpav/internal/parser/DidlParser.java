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
package org.openhab.binding.upnpav.internal.parser;

import static org.openhab.binding.upnpav.internal.UpnpAvBindingConstants.*;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.upnpav.internal.config.DidlConfiguration;
import org.openhab.binding.upnpav.internal.didl.DidlClassResolver;
import org.openhab.binding.upnpav.internal.didl.DidlObject;
import org.openhab.binding.upnpav.internal.exception.DidlMetadataException;
import org.openhab.binding.upnpav.internal.exception.MissingRequiredFieldException;
import org.openhab.binding.upnpav.internal.xml.XmlNamespaces;
import org.openhab.binding.upnpav.internal.xml.XmlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * Converts between DIDL-Lite documents and typed {@link DidlObject}s.
 * <p>
 * {@link #fromDidlString(String)} and {@link #toDidlString(DidlObject...)} are strict and throw on invalid
 * metadata. {@link #parseMetadata(String)} is a lenient shortcut for the handful of fields a player needs to
 * show what is playing.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class DidlParser {

    private static final Logger logger = LoggerFactory.getLogger(DidlParser.class);

    private final DidlConfiguration config;

    public DidlParser() {
        this(DidlConfiguration.defaults());
    }

    public DidlParser(DidlConfiguration config) {
        this.config = config;
    }

    public DidlConfiguration getConfiguration() {
        return config;
    }

    /**
     * Parses a DIDL-Lite document into typed objects, in document order.
     *
     * @throws DidlMetadataException if the document is malformed, an object is invalid, or the envelope holds
     *             something other than items and containers while illegal children are not skipped
     */
    public List<DidlObject> fromDidlString(String xml) throws DidlMetadataException {
        Element root = XmlUtils.parse(xml).getDocumentElement();
        if (!NS_DIDL_LITE.equals(root.getNamespaceURI()) || !ELEMENT_DIDL_LITE.equals(root.getLocalName())) {
            throw new DidlMetadataException("Root element is not DIDL-Lite: " + root.getNodeName());
        }

        List<DidlObject> objects = new ArrayList<>();
        for (Element child : XmlUtils.childElements(root)) {
            if (!isItemOrContainer(child)) {
                if (config.isSkipIllegalChildren()) {
                    logger.debug("Skipping illegal DIDL-Lite child '{}'", child.getNodeName());
                    continue;
                }
                throw new DidlMetadataException("Illegal child of DIDL-Lite element: " + child.getNodeName());
            }
            objects.add(parseObject(child));
        }
        return objects;
    }

    /**
     * Parses a single {@code item} or {@code container} element, dispatching on its {@code upnp:class}.
     */
    public DidlObject parseObject(Element element) throws DidlMetadataException {
        String upnpClass = XmlUtils.optionalChildText(element, XmlNamespaces.UPNP, "class");
        if (upnpClass == null) {
            throw new MissingRequiredFieldException(element.getLocalName(), "upnp:class");
        }
        return DidlClassResolver.resolve(upnpClass).fromElement(element, config.isApplyResourceQuirks());
    }

    /**
     * Wraps the objects in a DIDL-Lite envelope and serializes it.
     */
    public String toDidlString(DidlObject... objects) throws DidlMetadataException {
        Document document = XmlUtils.newDocument();
        Element root = XmlUtils.createElement(document, XmlNamespaces.DIDL, ELEMENT_DIDL_LITE);
        XmlNamespaces.declareDidlNamespaces(root);
        document.appendChild(root);
        for (DidlObject object : objects) {
            root.appendChild(object.toElement(document));
        }
        return XmlUtils.toXmlString(root, config.isPrettyPrint());
    }

    private static boolean isItemOrContainer(Element element) {
        return NS_DIDL_LITE.equals(element.getNamespaceURI())
                && (ELEMENT_ITEM.equals(element.getLocalName()) || ELEMENT_CONTAINER.equals(element.getLocalName()));
    }

    /**
     * Extracts title, artist, album and album art of the first item of a DIDL-Lite document.
     *
     * @return the fields found, or null if the input is empty or not well-formed
     */
    @Nullable
    public static Map<String, String> parseMetadata(String metadata) {
        if (metadata.isBlank()) {
            return null;
        }
        MetadataHandler handler = new MetadataHandler();
        try {
            SAXParserFactory factory = SAXParserFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);

            SAXParser saxParser = factory.newSAXParser();
            saxParser.getXMLReader().setFeature("http://xml.org/sax/features/external-general-entities", false);
            saxParser.parse(new InputSource(new StringReader(metadata)), handler);
            return handler.getValues();
        } catch (IOException | SAXException | ParserConfigurationException e) {
            logger.debug("Error parsing DIDL-Lite metadata: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Collects track info fields (title, artist, album, albumArtUri) of the first object.
     */
    private static class MetadataHandler extends DefaultHandler {
        private final Map<String, String> values = new HashMap<>();
        private final StringBuilder currentValue = new StringBuilder();
        private int depth = 0;
        private int objectDepth = -1;
        private boolean firstObjectDone = false;
        private String creator = "";
        private String artist = "";

        @Override
        public void startElement(@Nullable String uri, @Nullable String localName, @Nullable String qName,
                @Nullable Attributes attributes) {
            depth++;
            currentValue.setLength(0);
            if (objectDepth < 0 && !firstObjectDone && NS_DIDL_LITE.equals(uri)
                    && (ELEMENT_ITEM.equals(localName) || ELEMENT_CONTAINER.equals(localName))) {
                objectDepth = depth;
            }
        }

        @Override
        public void endElement(@Nullable String uri, @Nullable String localName, @Nullable String qName) {
            if (objectDepth > 0 && depth == objectDepth + 1 && uri != null && localName != null) {
                String value = currentValue.toString().trim();
                if (NS_DC.equals(uri) && "title".equals(localName)) {
                    addIfNotEmpty("title", value);
                } else if (NS_DC.equals(uri) && "creator".equals(localName)) {
                    if (creator.isEmpty()) {
                        creator = value;
                    }
                } else if (NS_UPNP.equals(uri) && "artist".equals(localName)) {
                    if (artist.isEmpty()) {
                        artist = value;
                    }
                } else if (NS_UPNP.equals(uri) && "album".equals(localName)) {
                    addIfNotEmpty("album", value);
                } else if (NS_UPNP.equals(uri) && "albumArtURI".equals(localName)) {
                    addIfNotEmpty("albumArtUri", value);
                }
            }
            if (depth == objectDepth) {
                objectDepth = -1;
                firstObjectDone = true;
            }
            depth--;
        }

        @Override
        @SuppressWarnings("null")
        public void characters(char @Nullable [] ch, int start, int length) throws SAXException {
            if (ch != null) {
                currentValue.append(ch, start, length);
            }
        }

        private void addIfNotEmpty(String key, String value) {
            if (!value.isEmpty()) {
                values.putIfAbsent(key, value);
            }
        }

        public Map<String, String> getValues() {
            // dc:creator wins over upnp:artist
            addIfNotEmpty("artist", creator.isEmpty() ? artist : creator);
            return values.isEmpty() ? Collections.emptyMap() : values;
        }
    }
}
