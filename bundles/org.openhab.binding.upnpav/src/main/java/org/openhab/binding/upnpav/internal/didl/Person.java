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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.upnpav.internal.exception.DidlMetadataException;
import org.openhab.binding.upnpav.internal.xml.XmlNamespaces;
import org.openhab.binding.upnpav.internal.xml.XmlUtils;
import org.w3c.dom.Element;

/**
 * Objects related to a person ({@code object.container.person}). Holds albums, playlists and items only.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class Person extends DidlContainer {

    public static final String UPNP_CLASS = DidlContainer.UPNP_CLASS + ".person";

    private List<String> languages = new ArrayList<>();

    public Person() {
        this(UPNP_CLASS);
    }

    protected Person(String upnpClass) {
        super(upnpClass);
    }

    @Override
    public boolean addItem(DidlObject item) {
        return item instanceof DidlItem && super.addItem(item);
    }

    @Override
    public boolean addContainer(DidlObject container) {
        return (container instanceof Album || container instanceof PlaylistContainer)
                && super.addContainer(container);
    }

    @Override
    protected void readElement(Element element) throws DidlMetadataException {
        super.readElement(element);
        languages = XmlUtils.findAllChildText(element, XmlNamespaces.DC, "language");
    }

    @Override
    protected void writeElement(Element element) throws DidlMetadataException {
        super.writeElement(element);
        XmlUtils.appendTextElements(element, XmlNamespaces.DC, "language", languages);
    }

    public List<String> getLanguages() {
        return languages;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        return super.equals(obj) && languages.equals(((Person) Objects.requireNonNull(obj)).languages);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), languages);
    }
}
