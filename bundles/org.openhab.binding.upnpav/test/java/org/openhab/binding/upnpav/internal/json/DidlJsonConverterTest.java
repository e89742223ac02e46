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
package org.openhab.binding.upnpav.internal.json;

import static org.junit.jupiter.api.Assertions.*;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.junit.jupiter.api.Test;
import org.openhab.binding.upnpav.internal.didl.DidlContainer;
import org.openhab.binding.upnpav.internal.didl.DidlObject;
import org.openhab.binding.upnpav.internal.didl.MusicAlbum;
import org.openhab.binding.upnpav.internal.didl.MusicTrack;
import org.openhab.binding.upnpav.internal.didl.Resource;
import org.openhab.binding.upnpav.internal.exception.DidlMetadataException;
import org.openhab.binding.upnpav.internal.exception.UnknownDidlClassException;

import com.google.gson.JsonObject;

/**
 * Tests for {@link DidlJsonConverter}
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class DidlJsonConverterTest {

    private final DidlJsonConverter converter = new DidlJsonConverter();

    @Test
    public void testTrackToJson() {
        JsonObject json = converter.toJsonObject(track("Q:0/1"));

        assertEquals(MusicTrack.UPNP_CLASS, json.get("upnpClass").getAsString());
        assertEquals("Song Q:0/1", json.get("title").getAsString());
        assertEquals(5, json.get("originalTrackNumber").getAsInt());
        assertEquals("The Album", json.getAsJsonArray("albums").get(0).getAsString());
        assertFalse(json.has("writeStatus"));
    }

    @Test
    public void testTrackFromJson() throws Exception {
        MusicTrack track = track("Q:0/1");
        DidlObject parsed = converter.fromJson(converter.toJson(track));

        assertTrue(parsed instanceof MusicTrack);
        assertEquals(track, parsed);
    }

    @Test
    public void testContainerCarriesChildCount() throws Exception {
        MusicAlbum album = new MusicAlbum();
        album.setObjectId("A:ALBUM/Help!");
        album.setTitle("Help!");
        album.addItem(track("1"));
        album.addItem(track("2"));

        JsonObject json = converter.toJsonObject(album);
        assertEquals(2, json.get("childCount").getAsInt());
        assertFalse(json.has("heldItems"));

        DidlContainer parsed = (DidlContainer) converter.fromJsonObject(json);
        assertEquals(2, parsed.getChildCount());
        assertTrue(parsed.getItems().isEmpty());
    }

    @Test
    public void testVendorClassSelectsKnownType() throws Exception {
        DidlObject parsed = converter.fromJson(
                "{\"upnpClass\":\"object.item.audioItem.musicTrack.#editorial\",\"title\":\"T\",\"objectId\":\"1\"}");
        assertTrue(parsed instanceof MusicTrack);
        assertEquals("object.item.audioItem.musicTrack.#editorial", parsed.getUpnpClass());
    }

    @Test
    public void testInvalidJson() {
        assertThrows(DidlMetadataException.class, () -> converter.fromJson("{\"title\":\"no class\"}"));
        assertThrows(UnknownDidlClassException.class, () -> converter.fromJson("{\"upnpClass\":\"object.foo\"}"));
        assertThrows(DidlMetadataException.class, () -> converter.fromJson("{"));
        assertThrows(DidlMetadataException.class, () -> converter.fromJson("[1, 2]"));
    }

    private static MusicTrack track(String id) {
        MusicTrack track = new MusicTrack();
        track.setObjectId(id);
        track.setParentId("Q:0");
        track.setTitle("Song " + id);
        track.getAlbums().add("The Album");
        track.setOriginalTrackNumber(5);
        track.addResource(new Resource("x-file-cifs://nas/" + id + ".flac", "x-file-cifs:*:audio/flac:*"));
        return track;
    }
}
