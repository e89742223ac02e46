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

import static org.openhab.binding.upnpav.internal.UpnpAvBindingConstants.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.upnpav.internal.config.DidlConfiguration;
import org.openhab.binding.upnpav.internal.exception.DidlMetadataException;
import org.openhab.binding.upnpav.internal.exception.MissingRequiredAttributeException;
import org.openhab.binding.upnpav.internal.exception.MissingRequiredFieldException;
import org.openhab.binding.upnpav.internal.xml.XmlNamespaces;
import org.openhab.binding.upnpav.internal.xml.XmlUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Root of the DIDL-Lite object hierarchy ({@code object}).
 * <p>
 * Subclasses add their own fields by overriding {@link #readElement(Element)} and {@link #writeElement(Element)},
 * calling the superclass first. This keeps the element order of the base class ahead of the subclass fields.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public abstract class DidlObject {

    public static final String UPNP_CLASS = "object";

    static final String ATTR_ID = "id";
    static final String ATTR_PARENT_ID = "parentID";
    static final String ATTR_RESTRICTED = "restricted";
    private static final String ATTR_DESC_NAMESPACE = "nameSpace";

    private String objectId = "";
    private String parentId = "";
    private String title = "";
    private boolean restricted = false;
    private @Nullable String creator;
    private @Nullable WriteStatus writeStatus;
    private String upnpClass;
    private List<Resource> resources = new ArrayList<>();
    private @Nullable String desc;
    private String descId = DEFAULT_DESC_ID;
    private String descNamespace = DEFAULT_DESC_NAMESPACE;

    protected DidlObject(String upnpClass) {
        this.upnpClass = upnpClass;
    }

    /**
     * Builds the typed object for an {@code item} or {@code container} element, dispatching on its
     * {@code upnp:class}. Resource quirks are applied as in the default {@link DidlConfiguration}.
     */
    public static DidlObject fromElement(Element element) throws DidlMetadataException {
        return fromElement(element, DidlConfiguration.DEFAULT_APPLY_RESOURCE_QUIRKS);
    }

    public static DidlObject fromElement(Element element, boolean applyQuirks) throws DidlMetadataException {
        String upnpClass = XmlUtils.findChildText(element, XmlNamespaces.UPNP, "class");
        return DidlClassResolver.resolve(upnpClass == null ? "" : upnpClass).fromElement(element, applyQuirks);
    }

    public static DidlObject fromString(String xml) throws DidlMetadataException {
        return fromElement(XmlUtils.parse(xml).getDocumentElement());
    }

    /**
     * The local name of the element this object is written as, {@code item} or {@code container}.
     */
    public abstract String getElementName();

    /**
     * Populates this object from an element.
     */
    protected void readElement(Element element) throws DidlMetadataException {
        String className = getClass().getSimpleName();
        for (String attribute : new String[] { ATTR_ID, ATTR_PARENT_ID, ATTR_RESTRICTED }) {
            if (!element.hasAttribute(attribute)) {
                throw new MissingRequiredAttributeException(className, attribute);
            }
        }
        String upnpClassText = XmlUtils.optionalChildText(element, XmlNamespaces.UPNP, "class");
        if (upnpClassText == null) {
            throw new MissingRequiredFieldException(className, "upnp:class");
        }
        String titleText = XmlUtils.optionalChildText(element, XmlNamespaces.DC, "title");
        if (titleText == null) {
            throw new MissingRequiredFieldException(className, "dc:title");
        }

        objectId = element.getAttribute(ATTR_ID);
        parentId = element.getAttribute(ATTR_PARENT_ID);
        restricted = parseBoolean(element.getAttribute(ATTR_RESTRICTED));
        upnpClass = upnpClassText.trim();
        title = titleText;
        creator = XmlUtils.optionalChildText(element, XmlNamespaces.DC, "creator");

        String writeStatusText = XmlUtils.optionalChildText(element, XmlNamespaces.UPNP, "writeStatus");
        writeStatus = writeStatusText == null ? null : WriteStatus.fromText(writeStatusText);

        resources = new ArrayList<>();
        for (Element res : XmlUtils.findChildren(element, XmlNamespaces.DIDL, ELEMENT_RES)) {
            resources.add(Resource.fromElement(res));
        }

        Element descElement = XmlUtils.findChild(element, XmlNamespaces.DIDL, ELEMENT_DESC);
        if (descElement != null) {
            desc = descElement.getTextContent();
            String id = XmlUtils.optionalAttribute(descElement, ATTR_ID);
            descId = id == null ? DEFAULT_DESC_ID : id;
            String namespace = XmlUtils.optionalAttribute(descElement, ATTR_DESC_NAMESPACE);
            descNamespace = namespace == null ? DEFAULT_DESC_NAMESPACE : namespace;
        }
    }

    /**
     * Writes the attributes and child elements of this object onto an element. The {@code desc} element
     * is appended afterwards by {@link #toElement(Document)}.
     */
    protected void writeElement(Element element) throws DidlMetadataException {
        XmlUtils.setAttribute(element, ATTR_ID, objectId);
        XmlUtils.setAttribute(element, ATTR_PARENT_ID, parentId);
        XmlUtils.setAttribute(element, ATTR_RESTRICTED, Boolean.toString(restricted));

        XmlUtils.appendTextElement(element, XmlNamespaces.DC, "title", title);
        XmlUtils.appendTextElement(element, XmlNamespaces.UPNP, "class", upnpClass);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.DC, "creator", creator);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.UPNP, "writeStatus", writeStatus);
        for (Resource resource : resources) {
            element.appendChild(resource.toElement(element.getOwnerDocument()));
        }
    }

    /**
     * Creates the element for this object in the given document. The element is not attached.
     *
     * @throws MissingRequiredFieldException if the title or another mandatory field is unset
     */
    public Element toElement(Document document) throws DidlMetadataException {
        if (title.isEmpty()) {
            throw new MissingRequiredFieldException(getClass().getSimpleName(), "dc:title");
        }
        Element element = XmlUtils.createElement(document, XmlNamespaces.DIDL, getElementName());
        writeElement(element);

        String descText = desc;
        if (descText != null) {
            Element descElement = XmlUtils.appendTextElement(element, XmlNamespaces.DIDL, ELEMENT_DESC, descText);
            XmlUtils.setAttribute(descElement, ATTR_ID, descId);
            XmlUtils.setAttribute(descElement, ATTR_DESC_NAMESPACE, descNamespace);
        }
        return element;
    }

    /**
     * Creates the element for this object as the root of a new document, with the DIDL-Lite namespaces declared.
     */
    public Element toElement() throws DidlMetadataException {
        Document document = XmlUtils.newDocument();
        Element element = toElement(document);
        XmlNamespaces.declareDidlNamespaces(element);
        document.appendChild(element);
        return element;
    }

    public String toXmlString() throws DidlMetadataException {
        return XmlUtils.toXmlString(toElement());
    }

    static boolean parseBoolean(String text) {
        String value = text.trim();
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }

    protected static @Nullable Integer optionalInteger(Element element, String nsId, String localName)
            throws DidlMetadataException {
        String text = XmlUtils.optionalChildText(element, nsId, localName);
        if (text == null) {
            return null;
        }
        try {
            return Integer.valueOf(text.trim());
        } catch (NumberFormatException e) {
            throw new DidlMetadataException(String.format("Invalid integer '%s' in %s", text, localName), e);
        }
    }

    protected static String requiredText(Element element, String className, String nsId, String localName)
            throws MissingRequiredFieldException {
        String text = XmlUtils.optionalChildText(element, nsId, localName);
        if (text == null) {
            throw new MissingRequiredFieldException(className, XmlNamespaces.qualifiedName(nsId, localName));
        }
        return text;
    }

    protected static long requiredLong(Element element, String className, String nsId, String localName)
            throws DidlMetadataException {
        String text = requiredText(element, className, nsId, localName);
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new DidlMetadataException(String.format("Invalid number '%s' in %s", text, localName), e);
        }
    }

    public String getObjectId() {
        return objectId;
    }

    public void setObjectId(String objectId) {
        this.objectId = objectId;
    }

    public String getParentId() {
        return parentId;
    }

    public void setParentId(String parentId) {
        this.parentId = parentId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public boolean isRestricted() {
        return restricted;
    }

    public void setRestricted(boolean restricted) {
        this.restricted = restricted;
    }

    public @Nullable String getCreator() {
        return creator;
    }

    public void setCreator(@Nullable String creator) {
        this.creator = creator;
    }

    public @Nullable WriteStatus getWriteStatus() {
        return writeStatus;
    }

    public void setWriteStatus(@Nullable WriteStatus writeStatus) {
        this.writeStatus = writeStatus;
    }

    /**
     * @return the class string as found in the metadata, vendor extension included
     */
    public String getUpnpClass() {
        return upnpClass;
    }

    public List<Resource> getResources() {
        return resources;
    }

    public void addResource(Resource resource) {
        if (!resources.contains(resource)) {
            resources.add(resource);
        }
    }

    public @Nullable String getDesc() {
        return desc;
    }

    public void setDesc(@Nullable String desc) {
        this.desc = desc;
    }

    public String getDescId() {
        return descId;
    }

    public void setDescId(String descId) {
        this.descId = descId;
    }

    public String getDescNamespace() {
        return descNamespace;
    }

    public void setDescNamespace(String descNamespace) {
        this.descNamespace = descNamespace;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        DidlObject other = (DidlObject) obj;
        return objectId.equals(other.objectId) && parentId.equals(other.parentId) && title.equals(other.title)
                && restricted == other.restricted && Objects.equals(creator, other.creator)
                && writeStatus == other.writeStatus && upnpClass.equals(other.upnpClass)
                && resources.equals(other.resources) && Objects.equals(desc, other.desc)
                && descId.equals(other.descId) && descNamespace.equals(other.descNamespace);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), objectId, parentId, title, restricted, creator, writeStatus, upnpClass,
                resources, desc);
    }

    @Override
    public String toString() {
        return String.format("%s[id=%s, parentId=%s, title=%s, class=%s]", getClass().getSimpleName(), objectId,
                parentId, title, upnpClass);
    }
}
