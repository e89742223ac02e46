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
package org.openhab.binding.upnpav.internal.didl;

import static org.openhab.binding.upnpav.internal.UpnpAvBindingConstants.ELEMENT_DIDL_LITE;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.openhab.binding.upnpav.internal.config.DidlConfiguration;
import org.openhab.binding.upnpav.internal.exception.DidlMetadataException;
import org.openhab.binding.upnpav.internal.parser.DidlParser;
import org.openhab.binding.upnpav.internal.xml.XmlNamespaces;
import org.openhab.binding.upnpav.internal.xml.XmlUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * An in-memory {@code DIDL-Lite} envelope, used to assemble metadata for SetAVTransportURI and similar actions.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class DidlLite {

    private final List<DidlObject> children = new ArrayList<>();
    private final List<DidlObject> items = new ArrayList<>();

    public static DidlLite fromXml(String xml) throws DidlMetadataException {
        return fromXml(xml, DidlConfiguration.defaults());
    }

    public static DidlLite fromXml(String xml, DidlConfiguration config) throws DidlMetadataException {
        DidlLite didl = new DidlLite();
        for (DidlObject object : new DidlParser(config).fromDidlString(xml)) {
            didl.addItem(object);
        }
        return didl;
    }

    /**
     * Appends an object to the envelope.
     */
    public void addItem(DidlObject object) {
        children.add(object);
        items.add(object);
    }

    /**
     * Appends a plain container. Such containers are written out but not returned by {@link #getItems()}.
     */
    public DidlContainer addContainer(String objectId, String parentId, String title, boolean restricted) {
        DidlContainer container = new DidlContainer();
        container.setObjectId(objectId);
        container.setParentId(parentId);
        container.setTitle(title);
        container.setRestricted(restricted);
        children.add(container);
        return container;
    }

    public List<DidlObject> getItems() {
        return Collections.unmodifiableList(items);
    }

    /**
     * @return the number of children of the envelope, added containers included
     */
    public int size() {
        return children.size();
    }

    public Element toElement(Document document) throws DidlMetadataException {
        Element root = XmlUtils.createElement(document, XmlNamespaces.DIDL, ELEMENT_DIDL_LITE);
        XmlNamespaces.declareDidlNamespaces(root);
        for (DidlObject child : children) {
            root.appendChild(child.toElement(document));
        }
        return root;
    }

    public String toXmlString() throws DidlMetadataException {
        Document document = XmlUtils.newDocument();
        Element root = toElement(document);
        document.appendChild(root);
        return XmlUtils.toXmlString(root);
    }
}
