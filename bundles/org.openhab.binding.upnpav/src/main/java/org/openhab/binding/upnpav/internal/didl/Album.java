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
 * An ordered collection of objects ({@code object.container.album}).
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class Album extends DidlContainer {

    public static final String UPNP_CLASS = DidlContainer.UPNP_CLASS + ".album";

    private @Nullable String storageMedium;
    private @Nullable String longDescription;
    private @Nullable String description;
    private @Nullable String date;
    private List<String> publishers = new ArrayList<>();
    private List<String> contributors = new ArrayList<>();
    private List<String> relations = new ArrayList<>();
    private List<String> rights = new ArrayList<>();

    public Album() {
        this(UPNP_CLASS);
    }

    protected Album(String upnpClass) {
        super(upnpClass);
    }

    @Override
    protected void readElement(Element element) throws DidlMetadataException {
        super.readElement(element);
        storageMedium = XmlUtils.optionalChildText(element, XmlNamespaces.UPNP, "storageMedium");
        longDescription = XmlUtils.optionalChildText(element, XmlNamespaces.UPNP, "longDescription");
        description = XmlUtils.optionalChildText(element, XmlNamespaces.DC, "description");
        date = XmlUtils.optionalChildText(element, XmlNamespaces.DC, "date");
        publishers = XmlUtils.findAllChildText(element, XmlNamespaces.DC, "publisher");
        contributors = XmlUtils.findAllChildText(element, XmlNamespaces.DC, "contributor");
        relations = XmlUtils.findAllChildText(element, XmlNamespaces.DC, "relation");
        rights = XmlUtils.findAllChildText(element, XmlNamespaces.DC, "rights");
    }

    @Override
    protected void writeElement(Element element) throws DidlMetadataException {
        super.writeElement(element);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.UPNP, "storageMedium", storageMedium);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.UPNP, "longDescription", longDescription);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.DC, "description", description);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.DC, "date", date);
        XmlUtils.appendTextElements(element, XmlNamespaces.DC, "publisher", publishers);
        XmlUtils.appendTextElements(element, XmlNamespaces.DC, "contributor", contributors);
        XmlUtils.appendTextElements(element, XmlNamespaces.DC, "relation", relations);
        XmlUtils.appendTextElements(element, XmlNamespaces.DC, "rights", rights);
    }

    public @Nullable String getStorageMedium() {
        return storageMedium;
    }

    public void setStorageMedium(@Nullable String storageMedium) {
        this.storageMedium = storageMedium;
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

    public @Nullable String getDate() {
        return date;
    }

    public void setDate(@Nullable String date) {
        this.date = date;
    }

    public List<String> getPublishers() {
        return publishers;
    }

    public List<String> getContributors() {
        return contributors;
    }

    public List<String> getRelations() {
        return relations;
    }

    public List<String> getRights() {
        return rights;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!super.equals(obj)) {
            return false;
        }
        Album other = (Album) Objects.requireNonNull(obj);
        return Objects.equals(storageMedium, other.storageMedium)
                && Objects.equals(longDescription, other.longDescription)
                && Objects.equals(description, other.description) && Objects.equals(date, other.date)
                && publishers.equals(other.publishers) && contributors.equals(other.contributors)
                && relations.equals(other.relations) && rights.equals(other.rights);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), storageMedium, longDescription, description, date, publishers,
                contributors, relations, rights);
    }
}
