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
package org.openhab.binding.upnpav.internal.event;

import static org.openhab.binding.upnpav.internal.UpnpAvBindingConstants.*;

import java.util.List;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.upnpav.internal.didl.DidlObject;
import org.openhab.binding.upnpav.internal.exception.DidlMetadataException;
import org.openhab.binding.upnpav.internal.exception.MalformedXmlException;
import org.openhab.binding.upnpav.internal.parser.DidlParser;
import org.openhab.binding.upnpav.internal.xml.XmlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

/**
 * Parses the body of a GENA NOTIFY request ({@code e:propertyset}) into {@link UpnpEventVariables}.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class UpnpEventParser {

    private static final Logger logger = LoggerFactory.getLogger(UpnpEventParser.class);

    private static final String ELEMENT_PROPERTYSET = "propertyset";
    private static final String ELEMENT_PROPERTY = "property";
    private static final String ATTR_VAL = "val";
    private static final String ATTR_CHANNEL = "channel";
    private static final String DIDL_PREFIX = "<DIDL-Lite";

    private final DidlParser didlParser;

    public UpnpEventParser() {
        this(new DidlParser());
    }

    public UpnpEventParser(DidlParser didlParser) {
        this.didlParser = didlParser;
    }

    public DecodeResult<UpnpEventVariables> parse(String body) {
        if (body.isBlank()) {
            return failure("Empty event body", null);
        }
        Element root;
        try {
            root = XmlUtils.parse(body).getDocumentElement();
        } catch (MalformedXmlException e) {
            return failure("Malformed event body: " + e.getMessage(), e);
        }
        if (!NS_GENA_EVENT.equals(root.getNamespaceURI()) || !ELEMENT_PROPERTYSET.equals(root.getLocalName())) {
            return failure("Event body is not a propertyset: " + root.getNodeName(), null);
        }

        UpnpEventVariables variables = new UpnpEventVariables();
        for (Element property : XmlUtils.childElements(root)) {
            if (!NS_GENA_EVENT.equals(property.getNamespaceURI())
                    || !ELEMENT_PROPERTY.equals(property.getLocalName())) {
                logger.trace("Ignoring '{}' in propertyset", property.getNodeName());
                continue;
            }
            for (Element variable : XmlUtils.childElements(property)) {
                String name = variable.getLocalName();
                String value = variable.getTextContent();
                variables.put(name, value);
                if (VARIABLE_LAST_CHANGE.equals(name) && !value.isBlank()) {
                    try {
                        expandLastChange(value, variables);
                    } catch (MalformedXmlException e) {
                        return failure("Malformed LastChange in event: " + e.getMessage(), e);
                    }
                }
            }
        }
        return DecodeResult.success(variables);
    }

    private void expandLastChange(String lastChange, UpnpEventVariables variables) throws MalformedXmlException {
        Element event = XmlUtils.parse(lastChange).getDocumentElement();
        // AVTransport and RenderingControl use different namespaces
        Element instance = XmlUtils.findChildByUri(event, NS_AVT_EVENT, INSTANCE_ID);
        if (instance == null) {
            instance = XmlUtils.findChildByUri(event, NS_RCS_EVENT, INSTANCE_ID);
        }
        if (instance == null) {
            logger.debug("LastChange without InstanceID, nothing to expand");
            return;
        }

        List<Element> children = XmlUtils.childElements(instance);
        for (Element child : children) {
            String name = child.getLocalName();
            String value = child.hasAttribute(ATTR_VAL) ? child.getAttribute(ATTR_VAL) : child.getTextContent();
            String channel = XmlUtils.optionalAttribute(child, ATTR_CHANNEL);
            if (channel != null) {
                variables.putChannelValue(name, channel, value);
                continue;
            }
            variables.put(name, value);
            if (value.startsWith(DIDL_PREFIX)) {
                DidlObject object = parseDidl(name, value);
                if (object != null) {
                    variables.putMetadata(name, object);
                }
            }
        }
    }

    private @Nullable DidlObject parseDidl(String name, String value) {
        try {
            List<DidlObject> objects = didlParser.fromDidlString(value);
            return objects.isEmpty() ? null : objects.get(0);
        } catch (DidlMetadataException e) {
            logger.debug("Keeping raw value of {}, metadata could not be parsed: {}", name, e.getMessage());
            return null;
        }
    }

    private static DecodeResult<UpnpEventVariables> failure(String message, @Nullable Exception cause) {
        logger.debug("{}", message);
        return cause == null ? DecodeResult.failure(message) : DecodeResult.failure(message, cause);
    }
}
