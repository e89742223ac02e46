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
import org.openhab.binding.upnpav.internal.xml.XmlNamespaces;
import org.openhab.binding.upnpav.internal.xml.XmlUtils;
import org.w3c.dom.Element;

/**
 * A collection of objects sharing a genre ({@code object.container.genre}).
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class Genre extends DidlContainer {

    public static final String UPNP_CLASS = DidlContainer.UPNP_CLASS + ".genre";

    private @Nullable String longDescription;
    private @Nullable String description;

    public Genre() {
        this(UPNP_CLASS);
    }

    protected Genre(String upnpClass) {
        super(upnpClass);
    }

    @Override
    protected void readElement(Element element) throws DidlMetadataException {
        super.readElement(element);
        longDescription = XmlUtils.optionalChildText(element, XmlNamespaces.UPNP, "longDescription");
        description = XmlUtils.optionalChildText(element, XmlNamespaces.DC, "description");
    }

    @Override
    protected void writeElement(Element element) throws DidlMetadataException {
        super.writeElement(element);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.UPNP, "longDescription", longDescription);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.DC, "description", description);
    }

    public @Nullable String getLongDescription() {
        return longDescription;
    }

    public void setLongDescription(@Nullable String longDescription) {
        this.longDescription = longDescription;
    }

    public @Nullable String getDescription() {
        return description;
    }

    public void setDescription(@Nullable String description) {
        this.description = description;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!super.equals(obj)) {
            return false;
        }
        Genre other = (Genre) Objects.requireNonNull(obj);
        return Objects.equals(longDescription, other.longDescription)
                && Objects.equals(description, other.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), longDescription, description);
    }
}
