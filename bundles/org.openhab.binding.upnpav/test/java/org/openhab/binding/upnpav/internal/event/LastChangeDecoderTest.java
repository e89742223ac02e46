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

import static org.junit.jupiter.api.Assertions.*;
import static org.openhab.binding.upnpav.internal.event.EventFixtures.*;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.junit.jupiter.api.Test;
import org.openhab.binding.upnpav.internal.exception.MalformedXmlException;

/**
 * Tests for {@link LastChangeDecoder} and {@link LastChangeEvent}
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class LastChangeDecoderTest {

    @Test
    public void testDecodeTransportState() {
        DecodeResult<LastChangeEvent> result = LastChangeDecoder.decode(avTransportLastChange());
        assertTrue(result.isSuccess(), result.getErrorMessage());
        LastChangeEvent event = result.getValue().orElseThrow();

        assertEquals("PLAYING", event.getTransportState());
        assertEquals("SHUFFLE_NOREPEAT", event.getCurrentPlayMode());
        assertEquals("0", event.getCurrentCrossfadeMode());
        assertEquals(12, event.getNumberOfTracks());
        assertEquals(3, event.getCurrentTrack());
        assertEquals(0, event.getCurrentSection());
        assertEquals("x-file-cifs://nas/3.flac", event.getCurrentTrackUri());
        assertEquals("0:04:00", event.getCurrentTrackDuration());
        assertEquals("x-rincon-queue:RINCON_000E58000000001400#0", event.getAvTransportUri());
        assertEquals("x-file-cifs://nas/4.flac", event.getNextTrackUri());
        assertEquals("file:///jffs/settings/savedqueues.rsq#7", event.getEnqueuedTransportUri());
        assertNull(event.getTransportStatus());
    }

    @Test
    public void testDecodeTrackMetadata() {
        LastChangeEvent event = LastChangeDecoder.decode(avTransportLastChange()).getValue().orElseThrow();

        assertEquals("Come Together", event.getTitle());
        assertEquals("The Beatles", event.getCreator());
        assertEquals("Abbey Road", event.getAlbum());
        assertEquals(1, event.getOriginalTrackNumber());
        assertEquals("The Beatles", event.getAlbumArtist());
        assertEquals("/getaa?u=x-file-cifs%3a%2f%2fnas%2f3.flac&v=1", event.getAlbumArtUri());
        assertNull(event.getRadioShowMd());

        assertEquals("Something", event.getNextTitle());
        assertEquals("The Beatles", event.getNextCreator());
        assertEquals("Abbey Road", event.getNextAlbum());
        assertEquals(2, event.getNextOriginalTrackNumber());
        assertNull(event.getNextAlbumArtist());
        assertNull(event.getNextAlbumArtUri());

        assertEquals("Beatles Favourites", event.getTransportTitle());
    }

    @Test
    public void testNotImplementedMetadataIsAbsent() {
        DecodeResult<LastChangeEvent> result = LastChangeDecoder
                .decode(avTransportLastChange("12", "NOT_IMPLEMENTED"));
        LastChangeEvent event = result.getValue().orElseThrow();
        assertNull(event.getTitle());
        assertNull(event.getAlbum());
        assertEquals("Something", event.getNextTitle());

        assertNull(LastChangeDecoder.decode(avTransportLastChange("12", "")).getValue().orElseThrow().getTitle());
    }

    @Test
    public void testNonNumericValueKeepsRawText() {
        LastChangeEvent event = LastChangeDecoder.decode(avTransportLastChange("NOT_IMPLEMENTED", CURRENT_TRACK_DIDL))
                .getValue().orElseThrow();
        assertNull(event.getNumberOfTracks());
        assertEquals("NOT_IMPLEMENTED", event.getRawValue(LastChangeEvent.NUMBER_OF_TRACKS));
        assertEquals("NOT_IMPLEMENTED", event.asMap().get(LastChangeEvent.NUMBER_OF_TRACKS));
    }

    @Test
    public void testEmptyPayload() {
        DecodeResult<LastChangeEvent> result = LastChangeDecoder.decode(" ");
        assertFalse(result.isSuccess());
        assertFalse(result.getError().isPresent());
    }

    @Test
    public void testMalformedPayload() {
        DecodeResult<LastChangeEvent> result = LastChangeDecoder.decode("<Event><InstanceID val=\"0\">");
        assertFalse(result.isSuccess());
        assertTrue(result.getError().orElseThrow() instanceof MalformedXmlException);
        assertTrue(result.getErrorMessage().startsWith("Malformed LastChange XML"));
    }

    @Test
    public void testMalformedEmbeddedMetadata() {
        DecodeResult<LastChangeEvent> result = LastChangeDecoder
                .decode(avTransportLastChange("12", "<DIDL-Lite><item>"));
        assertFalse(result.isSuccess());
        assertTrue(result.getErrorMessage().startsWith("Malformed metadata"));
    }

    @Test
    public void testMissingInstanceId() {
        String xml = "<Event xmlns=\"urn:schemas-upnp-org:metadata-1-0/AVT/\">"
                + "<TransportState val=\"PLAYING\"/></Event>";
        DecodeResult<LastChangeEvent> result = LastChangeDecoder.decode(xml);
        assertFalse(result.isSuccess());
        assertEquals("LastChange event has no AVTransport InstanceID", result.getErrorMessage());
        assertNull(LastChangeEvent.fromXml(xml));
    }

    @Test
    public void testRenderingControlEventIsNotAnAvTransportEvent() {
        DecodeResult<LastChangeEvent> result = LastChangeDecoder.decode(renderingControlLastChange());
        assertFalse(result.isSuccess());
        assertNull(LastChangeEvent.fromXml(renderingControlLastChange()));
    }

    @Test
    public void testEventEquality() {
        LastChangeEvent first = LastChangeEvent.fromXml(avTransportLastChange());
        LastChangeEvent second = LastChangeEvent.fromXml(avTransportLastChange());
        assertNotNull(first);
        assertEquals(first, second);
        assertNotEquals(first, LastChangeEvent.fromXml(avTransportLastChange("13", CURRENT_TRACK_DIDL)));
    }
}
