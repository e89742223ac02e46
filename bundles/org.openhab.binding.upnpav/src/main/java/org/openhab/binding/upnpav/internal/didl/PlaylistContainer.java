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
 * A playlist, such as a Sonos saved queue ({@code object.container.playlistContainer}).
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class PlaylistContainer extends DidlContainer {

    public static final String UPNP_CLASS = DidlContainer.UPNP_CLASS + ".playlistContainer";

    private List<String> artists = new ArrayList<>();
    private List<String> genres = new ArrayList<>();
    private List<String> producers = new ArrayList<>();
    private List<String> contributors = new ArrayList<>();
    private List<String> languages = new ArrayList<>();
    private List<String> rights = new ArrayList<>();
    private @Nullable String longDescription;
    private @Nullable String storageMedium;
    private @Nullable String description;
    private @Nullable String date;

    public PlaylistContainer() {
        super(UPNP_CLASS);
    }

    @Override
    protected void readElement(Element element) throws DidlMetadataException {
        super.readElement(element);
        artists = XmlUtils.findAllChildText(element, XmlNamespaces.UPNP, "artist");
        genres = XmlUtils.findAllChildText(element, XmlNamespaces.UPNP, "genre");
        producers = XmlUtils.findAllChildText(element, XmlNamespaces.UPNP, "producer");
        contributors = XmlUtils.findAllChildText(element, XmlNamespaces.DC, "contributor");
        languages = XmlUtils.findAllChildText(element, XmlNamespaces.DC, "language");
        rights = XmlUtils.findAllChildText(element, XmlNamespaces.DC, "rights");
        longDescription = XmlUtils.optionalChildText(element, XmlNamespaces.UPNP, "longDescription");
        storageMedium = XmlUtils.optionalChildText(element, XmlNamespaces.UPNP, "storageMedium");
        description = XmlUtils.optionalChildText(element, XmlNamespaces.DC, "description");
        date = XmlUtils.optionalChildText(element, XmlNamespaces.DC, "date");
    }

    @Override
    protected void writeElement(Element element) throws DidlMetadataException {
        super.writeElement(element);
        XmlUtils.appendTextElements(element, XmlNamespaces.UPNP, "artist", artists);
        XmlUtils.appendTextElements(element, XmlNamespaces.UPNP, "genre", genres);
        XmlUtils.appendTextElements(element, XmlNamespaces.UPNP, "producer", producers);
        XmlUtils.appendTextElements(element, XmlNamespaces.DC, "contributor", contributors);
        XmlUtils.appendTextElements(element, XmlNamespaces.DC, "language", languages);
        XmlUtils.appendTextElements(element, XmlNamespaces.DC, "rights", rights);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.UPNP, "longDescription", longDescription);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.UPNP, "storageMedium", storageMedium);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.DC, "description", description);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.DC, "date", date);
    }

    public List<String> getArtists() {
        return artists;
    }

    public List<String> getGenres() {
        return genres;
    }

    public List<String> getProducers() {
        return producers;
    }

    public List<String> getContributors() {
        return contributors;
    }

    public List<String> getLanguages() {
        return languages;
    }

    public List<String> getRights() {
        return rights;
    }

    public @Nullable String getLongDescription() {
        return longDescription;
    }

    public void setLongDescription(@Nullable String longDescription) {
        this.longDescription = longDescription;
    }

    public @Nullable String getStorageMedium() {
        return storageMedium;
    }

    public void setStorageMedium(@Nullable String storageMedium) {
        this.storageMedium = storageMedium;
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

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!super.equals(obj)) {
            return false;
        }
        PlaylistContainer other = (PlaylistContainer) Objects.requireNonNull(obj);
        return artists.equals(other.artists) && genres.equals(other.genres) && producers.equals(other.producers)
                && contributors.equals(other.contributors) && languages.equals(other.languages)
                && rights.equals(other.rights) && Objects.equals(longDescription, other.longDescription)
                && Objects.equals(storageMedium, other.storageMedium)
                && Objects.equals(description, other.description) && Objects.equals(date, other.date);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), artists, genres, producers, contributors, languages, rights,
                longDescription, storageMedium, description, date);
    }
}
