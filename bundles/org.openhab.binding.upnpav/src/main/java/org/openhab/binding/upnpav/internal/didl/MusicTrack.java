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
 * A discrete piece of audio, usually a song ({@code object.item.audioItem.musicTrack}).
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class MusicTrack extends AudioItem {

    public static final String UPNP_CLASS = AudioItem.UPNP_CLASS + ".musicTrack";

    private static final String ATTR_ROLE = "role";
    private static final String ROLE_ALBUM_ARTIST = "AlbumArtist";

    private List<String> artists = new ArrayList<>();
    private List<String> albums = new ArrayList<>();
    private List<String> playlists = new ArrayList<>();
    private List<String> contributors = new ArrayList<>();
    private @Nullable Integer originalTrackNumber;
    private @Nullable String storageMedium;
    private @Nullable String date;
    private @Nullable String albumArtUri;

    public MusicTrack() {
        super(UPNP_CLASS);
    }

    @Override
    protected void readElement(Element element) throws DidlMetadataException {
        super.readElement(element);
        artists = XmlUtils.findAllChildText(element, XmlNamespaces.UPNP, "artist");
        albums = XmlUtils.findAllChildText(element, XmlNamespaces.UPNP, "album");
        playlists = XmlUtils.findAllChildText(element, XmlNamespaces.UPNP, "playlist");
        contributors = XmlUtils.findAllChildText(element, XmlNamespaces.DC, "contributor");
        originalTrackNumber = optionalInteger(element, XmlNamespaces.UPNP, "originalTrackNumber");
        storageMedium = XmlUtils.optionalChildText(element, XmlNamespaces.UPNP, "storageMedium");
        date = XmlUtils.optionalChildText(element, XmlNamespaces.DC, "date");
        albumArtUri = XmlUtils.optionalChildText(element, XmlNamespaces.UPNP, "albumArtURI");
    }

    @Override
    protected void writeElement(Element element) throws DidlMetadataException {
        super.writeElement(element);
        for (String artist : artists) {
            Element artistElement = XmlUtils.appendTextElement(element, XmlNamespaces.UPNP, "artist", artist);
            XmlUtils.setAttribute(artistElement, ATTR_ROLE, ROLE_ALBUM_ARTIST);
        }
        XmlUtils.appendTextElements(element, XmlNamespaces.UPNP, "album", albums);
        XmlUtils.appendTextElements(element, XmlNamespaces.UPNP, "playlist", playlists);
        XmlUtils.appendTextElements(element, XmlNamespaces.DC, "contributor", contributors);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.UPNP, "originalTrackNumber", originalTrackNumber);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.UPNP, "storageMedium", storageMedium);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.DC, "date", date);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.UPNP, "albumArtURI", albumArtUri);
    }

    public List<String> getArtists() {
        return artists;
    }

    public List<String> getAlbums() {
        return albums;
    }

    public List<String> getPlaylists() {
        return playlists;
    }

    public List<String> getContributors() {
        return contributors;
    }

    public @Nullable Integer getOriginalTrackNumber() {
        return originalTrackNumber;
    }

    public void setOriginalTrackNumber(@Nullable Integer originalTrackNumber) {
        this.originalTrackNumber = originalTrackNumber;
    }

    public @Nullable String getStorageMedium() {
        return storageMedium;
    }

    public void setStorageMedium(@Nullable String storageMedium) {
        this.storageMedium = storageMedium;
    }

    public @Nullable String getDate() {
        return date;
    }

    public void setDate(@Nullable String date) {
        this.date = date;
    }

    public @Nullable String getAlbumArtUri() {
        return albumArtUri;
    }

    public void setAlbumArtUri(@Nullable String albumArtUri) {
        this.albumArtUri = albumArtUri;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!super.equals(obj)) {
            return false;
        }
        MusicTrack other = (MusicTrack) Objects.requireNonNull(obj);
        return artists.equals(other.artists) && albums.equals(other.albums) && playlists.equals(other.playlists)
                && contributors.equals(other.contributors)
                && Objects.equals(originalTrackNumber, other.originalTrackNumber)
                && Objects.equals(storageMedium, other.storageMedium) && Objects.equals(date, other.date)
                && Objects.equals(albumArtUri, other.albumArtUri);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), artists, albums, playlists, contributors, originalTrackNumber,
                storageMedium, date, albumArtUri);
    }
}
