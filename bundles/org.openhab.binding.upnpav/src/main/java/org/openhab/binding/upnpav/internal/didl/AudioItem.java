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
 * A piece of content that is listened to, such as a song or a broadcast ({@code object.item.audioItem}).
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class AudioItem extends DidlItem {

    public static final String UPNP_CLASS = DidlItem.UPNP_CLASS + ".audioItem";

    private List<String> genres = new ArrayList<>();
    private List<String> relations = new ArrayList<>();
    private List<String> rights = new ArrayList<>();
    private List<String> publishers = new ArrayList<>();
    private @Nullable String longDescription;
    private @Nullable String description;
    private @Nullable String language;

    public AudioItem() {
        this(UPNP_CLASS);
    }

    protected AudioItem(String upnpClass) {
        super(upnpClass);
    }

    @Override
    protected void readElement(Element element) throws DidlMetadataException {
        super.readElement(element);
        genres = XmlUtils.findAllChildText(element, XmlNamespaces.UPNP, "genre");
        relations = XmlUtils.findAllChildText(element, XmlNamespaces.DC, "relation");
        rights = XmlUtils.findAllChildText(element, XmlNamespaces.DC, "rights");
        publishers = XmlUtils.findAllChildText(element, XmlNamespaces.DC, "publisher");
        longDescription = XmlUtils.optionalChildText(element, XmlNamespaces.UPNP, "longDescription");
        description = XmlUtils.optionalChildText(element, XmlNamespaces.DC, "description");
        language = XmlUtils.optionalChildText(element, XmlNamespaces.DC, "language");
    }

    @Override
    protected void writeElement(Element element) throws DidlMetadataException {
        super.writeElement(element);
        XmlUtils.appendTextElements(element, XmlNamespaces.UPNP, "genre", genres);
        XmlUtils.appendTextElements(element, XmlNamespaces.DC, "relation", relations);
        XmlUtils.appendTextElements(element, XmlNamespaces.DC, "rights", rights);
        XmlUtils.appendTextElements(element, XmlNamespaces.DC, "publisher", publishers);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.UPNP, "longDescription", longDescription);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.DC, "description", description);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.DC, "language", language);
    }

    public List<String> getGenres() {
        return genres;
    }

    public List<String> getRelations() {
        return relations;
    }

    public List<String> getRights() {
        return rights;
    }

    public List<String> getPublishers() {
        return publishers;
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

    public @Nullable String getLanguage() {
        return language;
    }

    public void setLanguage(@Nullable String language) {
        this.language = language;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!super.equals(obj)) {
            return false;
        }
        AudioItem other = (AudioItem) Objects.requireNonNull(obj);
        return genres.equals(other.genres) && relations.equals(other.relations) && rights.equals(other.rights)
                && publishers.equals(other.publishers) && Objects.equals(longDescription, other.longDescription)
                && Objects.equals(description, other.description) && Objects.equals(language, other.language);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), genres, relations, rights, publishers, longDescription, description,
                language);
    }
}
