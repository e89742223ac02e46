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

import static org.junit.jupiter.api.Assertions.*;
import static org.openhab.binding.upnpav.internal.UpnpAvBindingConstants.*;

import java.util.ArrayList;
import java.util.List;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.junit.jupiter.api.Test;
import org.openhab.binding.upnpav.internal.exception.MissingRequiredAttributeException;
import org.openhab.binding.upnpav.internal.exception.MissingRequiredFieldException;
import org.openhab.binding.upnpav.internal.xml.XmlNamespaces;
import org.openhab.binding.upnpav.internal.xml.XmlUtils;
import org.w3c.dom.Element;

/**
 * Tests reading and writing the common DIDL-Lite object fields
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class DidlObjectTest {

    private static final String NAMESPACES = " xmlns=\"urn:schemas-upnp-org:metadata-1-0/DIDL-Lite/\""
            + " xmlns:dc=\"http://purl.org/dc/elements/1.1/\""
            + " xmlns:upnp=\"urn:schemas-upnp-org:metadata-1-0/upnp/\""
            + " xmlns:r=\"urn:schemas-rinconnetworks-com:metadata-1-0/\"";

    @Test
    public void testReadMusicTrack() throws Exception {
        String xml = "<item" + NAMESPACES + " id=\"Q:0/1\" parentID=\"Q:0\" restricted=\"1\">"
                + "<dc:title>Yesterday</dc:title>"
                + "<upnp:class>object.item.audioItem.musicTrack</upnp:class>"
                + "<dc:creator>The Beatles</dc:creator>" //
                + "<upnp:writeStatus>SOMETHING_ELSE</upnp:writeStatus>"
                + "<res protocolInfo=\"x-file-cifs:*:audio/mpeg:*\" duration=\"0:02:05\">x-file-cifs://nas/y.mp3</res>"
                + "<upnp:album>Help!</upnp:album>" //
                + "<upnp:originalTrackNumber>13</upnp:originalTrackNumber>"
                + "<desc id=\"cdudn\" nameSpace=\"urn:schemas-rinconnetworks-com:metadata-1-0/\">"
                + "RINCON_AssociatedZPUDN</desc>"
                + "</item>";

        MusicTrack track = (MusicTrack) DidlObject.fromString(xml);

        assertEquals("Q:0/1", track.getObjectId());
        assertEquals("Q:0", track.getParentId());
        assertTrue(track.isRestricted());
        assertEquals("Yesterday", track.getTitle());
        assertEquals("The Beatles", track.getCreator());
        assertEquals(WriteStatus.UNKNOWN, track.getWriteStatus());
        assertEquals(List.of("Help!"), track.getAlbums());
        assertEquals(13, track.getOriginalTrackNumber());
        assertEquals("x-file-cifs://nas/y.mp3", track.getUri());
        assertEquals("0:02:05", track.getResources().get(0).getDuration());
        assertEquals("RINCON_AssociatedZPUDN", track.getDesc());
        assertEquals("", track.getRefId());
    }

    @Test
    public void testSpotifyResourceWithoutProtocolInfoIsRepaired() throws Exception {
        String xml = "<item" + NAMESPACES + " id=\"1\" parentID=\"0\" restricted=\"true\">"
                + "<dc:title>Spotify track</dc:title>"
                + "<upnp:class>object.item.audioItem.musicTrack</upnp:class>"
                + "<res>x-sonos-spotify:spotify%3atrack%3a1</res></item>";

        DidlObject object = DidlObject.fromString(xml);

        assertEquals(QUIRK_SPOTIFY_PROTOCOL_INFO, object.getResources().get(0).getProtocolInfo());
        assertEquals("x-sonos-spotify:spotify%3atrack%3a1", object.getResources().get(0).getValue());
    }

    @Test
    public void testRepairLeavesSourceElementUntouched() throws Exception {
        String xml = "<item" + NAMESPACES + " id=\"1\" parentID=\"0\" restricted=\"true\">"
                + "<dc:title>Radio</dc:title><upnp:class>object.item</upnp:class>"
                + "<res>x-rincon-mp3radio://host/stream</res></item>";
        Element element = XmlUtils.parse(xml).getDocumentElement();

        DidlObject object = DidlObject.fromElement(element);

        assertEquals(QUIRK_DUMMY_PROTOCOL_INFO, object.getResources().get(0).getProtocolInfo());
        Element res = XmlUtils.findChild(element, XmlNamespaces.DIDL, ELEMENT_RES);
        assertNotNull(res);
        assertFalse(res.hasAttribute("protocolInfo"));
    }

    @Test
    public void testStrictParseRejectsResourceWithoutProtocolInfo() throws Exception {
        String xml = "<item" + NAMESPACES + " id=\"1\" parentID=\"0\" restricted=\"true\">"
                + "<dc:title>Radio</dc:title><upnp:class>object.item</upnp:class>"
                + "<res>x-rincon-mp3radio://host/stream</res></item>";
        Element element = XmlUtils.parse(xml).getDocumentElement();

        MissingRequiredAttributeException e = assertThrows(MissingRequiredAttributeException.class,
                () -> DidlObject.fromElement(element, false));
        assertEquals("protocolInfo", e.getFieldName());
    }

    @Test
    public void testMissingAttributeIsRejected() {
        String xml = "<item" + NAMESPACES + " id=\"1\" restricted=\"true\"><dc:title>T</dc:title>"
                + "<upnp:class>object.item</upnp:class></item>";
        MissingRequiredAttributeException e = assertThrows(MissingRequiredAttributeException.class,
                () -> DidlObject.fromString(xml));
        assertEquals("parentID", e.getFieldName());
        assertEquals("DidlItem", e.getClassName());
    }

    @Test
    public void testMissingTitleIsRejected() {
        String xml = "<item" + NAMESPACES + " id=\"1\" parentID=\"0\" restricted=\"true\"><dc:title></dc:title>"
                + "<upnp:class>object.item</upnp:class></item>";
        MissingRequiredFieldException e = assertThrows(MissingRequiredFieldException.class,
                () -> DidlObject.fromString(xml));
        assertEquals("dc:title", e.getFieldName());
    }

    @Test
    public void testWriteWithoutTitleFails() {
        DidlItem item = new DidlItem();
        item.setObjectId("1");
        assertThrows(MissingRequiredFieldException.class, item::toXmlString);
    }

    @Test
    public void testElementOrder() throws Exception {
        MusicTrack track = new MusicTrack();
        track.setObjectId("-1");
        track.setParentId("-1");
        track.setTitle("Song");
        track.setCreator("Artist");
        track.addResource(new Resource("x-sonos-http:song.mp4", "sonos.com-http:*:audio/mp4:*"));
        track.getArtists().add("Artist");
        track.getAlbums().add("Album");
        track.setDesc("SA_RINCON2311_X_#Svc2311-0-Token");

        Element element = track.toElement();
        List<String> names = new ArrayList<>();
        for (Element child : XmlUtils.childElements(element)) {
            names.add(child.getLocalName());
        }
        assertEquals(List.of("title", "class", "creator", "res", "artist", "album", "desc"), names);

        Element artist = XmlUtils.findChild(element, XmlNamespaces.UPNP, "artist");
        assertNotNull(artist);
        assertEquals("AlbumArtist", artist.getAttribute("role"));

        Element desc = XmlUtils.findChild(element, XmlNamespaces.DIDL, ELEMENT_DESC);
        assertNotNull(desc);
        assertEquals(DEFAULT_DESC_ID, desc.getAttribute("id"));
        assertEquals(DEFAULT_DESC_NAMESPACE, desc.getAttribute("nameSpace"));
        assertEquals("false", element.getAttribute("restricted"));
        assertFalse(element.hasAttribute("refID"));
    }

    @Test
    public void testRefIdWrittenWhenSet() throws Exception {
        DidlItem item = new DidlItem();
        item.setObjectId("2");
        item.setParentId("0");
        item.setTitle("Reference");
        item.setRefId("1");

        Element element = item.toElement();
        assertEquals("1", element.getAttribute("refID"));
        assertEquals("1", ((DidlItem) DidlObject.fromString(item.toXmlString())).getRefId());
    }

    @Test
    public void testDuplicateResourceIsIgnored() {
        DidlItem item = new DidlItem();
        item.addResource(new Resource("http://host/a.mp3", "http-get:*:audio/mpeg:*"));
        item.addResource(new Resource("http://host/a.mp3", "http-get:*:audio/mpeg:*"));
        assertEquals(1, item.getResources().size());
    }

    @Test
    public void testIllegalCharactersAreFilteredOnWrite() throws Exception {
        DidlItem item = new DidlItem();
        item.setObjectId("1");
        item.setParentId("0");
        item.setTitle("Bad\u0001Title");

        assertEquals("BadTitle", DidlObject.fromString(item.toXmlString()).getTitle());
    }

    @Test
    public void testWriteStatusValues() {
        assertEquals(WriteStatus.WRITABLE, WriteStatus.fromText("WRITABLE"));
        assertEquals(WriteStatus.NOT_WRITABLE, WriteStatus.fromText(" NOT_WRITABLE "));
        assertEquals(WriteStatus.UNKNOWN, WriteStatus.fromText("writable"));
    }
}
