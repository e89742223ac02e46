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

import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.upnpav.internal.exception.DidlMetadataException;
import org.openhab.binding.upnpav.internal.exception.MissingRequiredAttributeException;
import org.openhab.binding.upnpav.internal.xml.XmlNamespaces;
import org.openhab.binding.upnpav.internal.xml.XmlUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * A class a container can be searched for, the {@code upnp:searchClass} element.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class SearchClass {

    static final String ATTR_INCLUDE_DERIVED = "includeDerived";
    static final String ATTR_NAME = "name";

    private String className = "";
    private boolean includeDerived;
    private @Nullable String name;

    protected SearchClass() {
    }

    public SearchClass(String className, boolean includeDerived, @Nullable String name) {
        this.className = className;
        this.includeDerived = includeDerived;
        this.name = name;
    }

    public SearchClass(String className, boolean includeDerived) {
        this(className, includeDerived, null);
    }

    static SearchClass fromElement(Element element) throws DidlMetadataException {
        SearchClass searchClass = new SearchClass();
        searchClass.read(element);
        return searchClass;
    }

    protected String getElementName() {
        return "searchClass";
    }

    protected void read(Element element) throws DidlMetadataException {
        if (!element.hasAttribute(ATTR_INCLUDE_DERIVED)) {
            throw new MissingRequiredAttributeException(getClass().getSimpleName(), ATTR_INCLUDE_DERIVED);
        }
        className = element.getTextContent().trim();
        includeDerived = DidlObject.parseBoolean(element.getAttribute(ATTR_INCLUDE_DERIVED));
        name = XmlUtils.optionalAttribute(element, ATTR_NAME);
    }

    Element toElement(Document document) {
        Element element = XmlUtils.createElement(document, XmlNamespaces.UPNP, getElementName());
        XmlUtils.setAttribute(element, ATTR_INCLUDE_DERIVED, Boolean.toString(includeDerived));
        String friendlyName = name;
        if (friendlyName != null && !friendlyName.isEmpty()) {
            XmlUtils.setAttribute(element, ATTR_NAME, friendlyName);
        }
        element.setTextContent(XmlUtils.filterIllegalXmlChars(className));
        return element;
    }

    public String getClassName() {
        return className;
    }

    public boolean isIncludeDerived() {
        return includeDerived;
    }

    public @Nullable String getName() {
        return name;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        SearchClass other = (SearchClass) obj;
        return className.equals(other.className) && includeDerived == other.includeDerived
                && Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), className, includeDerived, name);
    }

    @Override
    public String toString() {
        return String.format("%s[%s, includeDerived=%s]", getClass().getSimpleName(), className, includeDerived);
    }
}
