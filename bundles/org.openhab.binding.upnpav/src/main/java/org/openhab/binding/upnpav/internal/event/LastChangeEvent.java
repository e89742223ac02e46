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
package org.openhab.binding.upnpav.internal.event;

import java.util.LinkedHashMap;
import java.util.Map;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

/**
 * The transport and track state carried by an AVTransport {@code LastChange} event.
 * <p>
 * Fields missing from the event are null. Numeric accessors also return null when the device sent something
 * that is not a number; the text it sent stays available through {@link #getRawValue(String)}.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public final class LastChangeEvent {

    public static final String TRANSPORT_STATE = "transportState";
    public static final String TRANSPORT_STATUS = "transportStatus";
    public static final String CURRENT_PLAY_MODE = "currentPlayMode";
    public static final String CURRENT_CROSSFADE_MODE = "currentCrossfadeMode";
    public static final String NUMBER_OF_TRACKS = "numberOfTracks";
    public static final String CURRENT_TRACK = "currentTrack";
    public static final String CURRENT_SECTION = "currentSection";
    public static final String CURRENT_TRACK_URI = "currentTrackURI";
    public static final String CURRENT_TRACK_DURATION = "currentTrackDuration";
    public static final String AV_TRANSPORT_URI = "avTransportURI";
    public static final String TITLE = "title";
    public static final String CREATOR = "creator";
    public static final String ALBUM = "album";
    public static final String ORIGINAL_TRACK_NUMBER = "originalTrackNumber";
    public static final String ALBUM_ARTIST = "albumArtist";
    public static final String ALBUM_ART_URI = "albumArtURI";
    public static final String RADIO_SHOW_MD = "radioShowMd";
    public static final String NEXT_TRACK_URI = "nextTrackURI";
    public static final String NEXT_TITLE = "nextTitle";
    public static final String NEXT_CREATOR = "nextCreator";
    public static final String NEXT_ALBUM = "nextAlbum";
    public static final String NEXT_ORIGINAL_TRACK_NUMBER = "nextOriginalTrackNumber";
    public static final String NEXT_ALBUM_ARTIST = "nextAlbumArtist";
    public static final String NEXT_ALBUM_ART_URI = "nextAlbumArtURI";
    public static final String ENQUEUED_TRANSPORT_URI = "enqueuedTransportURI";
    public static final String TRANSPORT_TITLE = "transportTitle";

    private final Map<String, String> content;

    public LastChangeEvent(Map<String, String> content) {
        this.content = Map.copyOf(content);
    }

    /**
     * Decodes a {@code LastChange} document.
     *
     * @return the event, or null if the document could not be decoded
     */
    public static @Nullable LastChangeEvent fromXml(String xml) {
        return LastChangeDecoder.decode(xml).getValue().orElse(null);
    }

    public @Nullable String getRawValue(String key) {
        return content.get(key);
    }

    public Map<String, String> asMap() {
        return new LinkedHashMap<>(content);
    }

    private @Nullable Integer getInteger(String key) {
        String value = content.get(key);
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public @Nullable String getTransportState() {
        return content.get(TRANSPORT_STATE);
    }

    public @Nullable String getTransportStatus() {
        return content.get(TRANSPORT_STATUS);
    }

    public @Nullable String getCurrentPlayMode() {
        return content.get(CURRENT_PLAY_MODE);
    }

    public @Nullable String getCurrentCrossfadeMode() {
        return content.get(CURRENT_CROSSFADE_MODE);
    }

    public @Nullable Integer getNumberOfTracks() {
        return getInteger(NUMBER_OF_TRACKS);
    }

    public @Nullable Integer getCurrentTrack() {
        return getInteger(CURRENT_TRACK);
    }

    public @Nullable Integer getCurrentSection() {
        return getInteger(CURRENT_SECTION);
    }

    public @Nullable String getCurrentTrackUri() {
        return content.get(CURRENT_TRACK_URI);
    }

    public @Nullable String getCurrentTrackDuration() {
        return content.get(CURRENT_TRACK_DURATION);
    }

    public @Nullable String getAvTransportUri() {
        return content.get(AV_TRANSPORT_URI);
    }

    public @Nullable String getTitle() {
        return content.get(TITLE);
    }

    public @Nullable String getCreator() {
        return content.get(CREATOR);
    }

    public @Nullable String getAlbum() {
        return content.get(ALBUM);
    }

    public @Nullable Integer getOriginalTrackNumber() {
        return getInteger(ORIGINAL_TRACK_NUMBER);
    }

    public @Nullable String getAlbumArtist() {
        return content.get(ALBUM_ARTIST);
    }

    public @Nullable String getAlbumArtUri() {
        return content.get(ALBUM_ART_URI);
    }

    public @Nullable String getRadioShowMd() {
        return content.get(RADIO_SHOW_MD);
    }

    public @Nullable String getNextTrackUri() {
        return content.get(NEXT_TRACK_URI);
    }

    public @Nullable String getNextTitle() {
        return content.get(NEXT_TITLE);
    }

    public @Nullable String getNextCreator() {
        return content.get(NEXT_CREATOR);
    }

    public @Nullable String getNextAlbum() {
        return content.get(NEXT_ALBUM);
    }

    public @Nullable Integer getNextOriginalTrackNumber() {
        return getInteger(NEXT_ORIGINAL_TRACK_NUMBER);
    }

    public @Nullable String getNextAlbumArtist() {
        return content.get(NEXT_ALBUM_ARTIST);
    }

    public @Nullable String getNextAlbumArtUri() {
        return content.get(NEXT_ALBUM_ART_URI);
    }

    public @Nullable String getEnqueuedTransportUri() {
        return content.get(ENQUEUED_TRANSPORT_URI);
    }

    public @Nullable String getTransportTitle() {
        return content.get(TRANSPORT_TITLE);
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        return obj instanceof LastChangeEvent && content.equals(((LastChangeEvent) obj).content);
    }

    @Override
    public int hashCode() {
        return content.hashCode();
    }

    @Override
    public String toString() {
        return "LastChangeEvent" + content;
    }
}
