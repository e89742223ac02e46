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
 * A playable sequence of resources, such as a playlist file ({@code object.item.playlistItem}).
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class PlaylistItem extends DidlItem {

    public static final String UPNP_CLASS = DidlItem.UPNP_CLASS + ".playlistItem";

    private @Nullable String protection;
    private @Nullable String storageMedium;
    private @Nullable String longDescription;
    private @Nullable String rating;
    private @Nullable String description;
    private @Nullable String date;
    private List<String> authors = new ArrayList<>();
    private List<String> publishers = new ArrayList<>();
    private List<String> contributors = new ArrayList<>();
    private List<String> relations = new ArrayList<>();
    private List<String> languages = new ArrayList<>();
    private List<String> rights = new ArrayList<>();

    public PlaylistItem() {
        super(UPNP_CLASS);
    }

    @Override
    protected void readElement(Element element) throws DidlMetadataException {
        super.readElement(element);
        protection = XmlUtils.optionalChildText(element, XmlNamespaces.UPNP, "protection");
        storageMedium = XmlUtils.optionalChildText(element, XmlNamespaces.UPNP, "storageMedium");
        longDescription = XmlUtils.optionalChildText(element, XmlNamespaces.UPNP, "longDescription");
        rating = XmlUtils.optionalChildText(element, XmlNamespaces.UPNP, "rating");
        description = XmlUtils.optionalChildText(element, XmlNamespaces.DC, "description");
        date = XmlUtils.optionalChildText(element, XmlNamespaces.DC, "date");
        authors = XmlUtils.findAllChildText(element, XmlNamespaces.UPNP, "author");
        publishers = XmlUtils.findAllChildText(element, XmlNamespaces.DC, "publisher");
        contributors = XmlUtils.findAllChildText(element, XmlNamespaces.DC, "contributor");
        relations = XmlUtils.findAllChildText(element, XmlNamespaces.DC, "relation");
        languages = XmlUtils.findAllChildText(element, XmlNamespaces.DC, "language");
        rights = XmlUtils.findAllChildText(element, XmlNamespaces.DC, "rights");
    }

    @Override
    protected void writeElement(Element element) throws DidlMetadataException {
        super.writeElement(element);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.UPNP, "protection", protection);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.UPNP, "storageMedium", storageMedium);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.UPNP, "longDescription", longDescription);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.UPNP, "rating", rating);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.DC, "description", description);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.DC, "date", date);
        XmlUtils.appendTextElements(element, XmlNamespaces.UPNP, "author", authors);
        XmlUtils.appendTextElements(element, XmlNamespaces.DC, "publisher", publishers);
        XmlUtils.appendTextElements(element, XmlNamespaces.DC, "contributor", contributors);
        XmlUtils.appendTextElements(element, XmlNamespaces.DC, "relation", relations);
        XmlUtils.appendTextElements(element, XmlNamespaces.DC, "language", languages);
        XmlUtils.appendTextElements(element, XmlNamespaces.DC, "rights", rights);
    }

    public @Nullable String getProtection() {
        return protection;
    }

    public void setProtection(@Nullable String protection) {
        this.protection = protection;
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

    public @Nullable String getRating() {
        return rating;
    }

    public void setRating(@Nullable String rating) {
        this.rating = rating;
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

    public List<String> getAuthors() {
        return authors;
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

    public List<String> getLanguages() {
        return languages;
    }

    public List<String> getRights() {
        return rights;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!super.equals(obj)) {
            return false;
        }
        PlaylistItem other = (PlaylistItem) Objects.requireNonNull(obj);
        return Objects.equals(protection, other.protection) && Objects.equals(storageMedium, other.storageMedium)
                && Objects.equals(longDescription, other.longDescription) && Objects.equals(rating, other.rating)
                && Objects.equals(description, other.description) && Objects.equals(date, other.date)
                && authors.equals(other.authors) && publishers.equals(other.publishers)
                && contributors.equals(other.contributors) && relations.equals(other.relations)
                && languages.equals(other.languages) && rights.equals(other.rights);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), protection, storageMedium, longDescription, rating, description, date,
                authors, publishers, contributors, relations, languages, rights);
    }
}
