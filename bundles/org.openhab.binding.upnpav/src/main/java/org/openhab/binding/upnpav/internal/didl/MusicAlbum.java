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
 * An album of music tracks ({@code object.container.album.musicAlbum}).
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class MusicAlbum extends Album {

    public static final String UPNP_CLASS = Album.UPNP_CLASS + ".musicAlbum";

    private List<String> artists = new ArrayList<>();
    private List<String> genres = new ArrayList<>();
    private List<String> producers = new ArrayList<>();
    private @Nullable String albumArtUri;
    private @Nullable String toc;

    public MusicAlbum() {
        super(UPNP_CLASS);
    }

    @Override
    protected void readElement(Element element) throws DidlMetadataException {
        super.readElement(element);
        artists = XmlUtils.findAllChildText(element, XmlNamespaces.UPNP, "artist");
        genres = XmlUtils.findAllChildText(element, XmlNamespaces.UPNP, "genre");
        producers = XmlUtils.findAllChildText(element, XmlNamespaces.UPNP, "producer");
        albumArtUri = XmlUtils.optionalChildText(element, XmlNamespaces.UPNP, "albumArtURI");
        toc = XmlUtils.optionalChildText(element, XmlNamespaces.UPNP, "toc");
    }

    @Override
    protected void writeElement(Element element) throws DidlMetadataException {
        super.writeElement(element);
        XmlUtils.appendTextElements(element, XmlNamespaces.UPNP, "artist", artists);
        XmlUtils.appendTextElements(element, XmlNamespaces.UPNP, "genre", genres);
        XmlUtils.appendTextElements(element, XmlNamespaces.UPNP, "producer", producers);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.UPNP, "albumArtURI", albumArtUri);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.UPNP, "toc", toc);
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

    public @Nullable String getAlbumArtUri() {
        return albumArtUri;
    }

    public void setAlbumArtUri(@Nullable String albumArtUri) {
        this.albumArtUri = albumArtUri;
    }

    public @Nullable String getToc() {
        return toc;
    }

    public void setToc(@Nullable String toc) {
        this.toc = toc;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!super.equals(obj)) {
            return false;
        }
        MusicAlbum other = (MusicAlbum) Objects.requireNonNull(obj);
        return artists.equals(other.artists) && genres.equals(other.genres) && producers.equals(other.producers)
                && Objects.equals(albumArtUri, other.albumArtUri) && Objects.equals(toc, other.toc);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), artists, genres, producers, albumArtUri, toc);
    }
}
