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
package org.openhab.binding.upnpav.internal.quirks;

import static org.junit.jupiter.api.Assertions.*;
import static org.openhab.binding.upnpav.internal.UpnpAvBindingConstants.*;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.junit.jupiter.api.Test;
import org.openhab.binding.upnpav.internal.xml.XmlUtils;
import org.w3c.dom.Element;

/**
 * Tests for {@link DidlQuirks}
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class DidlQuirksTest {

    private static final String NS = " xmlns=\"urn:schemas-upnp-org:metadata-1-0/DIDL-Lite/\"";

    @Test
    public void testMissingProtocolInfoGetsPlaceholder() throws Exception {
        Element res = XmlUtils.parse("<res" + NS + ">http://host/track.mp3</res>").getDocumentElement();
        assertTrue(DidlQuirks.applyResourceQuirks(res));
        assertEquals(QUIRK_DUMMY_PROTOCOL_INFO, res.getAttribute("protocolInfo"));
    }

    @Test
    public void testSpotifyResourceGetsSpotifyProtocolInfo() throws Exception {
        Element res = XmlUtils.parse("<res" + NS + ">x-sonos-spotify:spotify%3atrack%3a1?sid=9</res>")
                .getDocumentElement();
        assertTrue(DidlQuirks.applyResourceQuirks(res));
        assertEquals(QUIRK_SPOTIFY_PROTOCOL_INFO, res.getAttribute("protocolInfo"));
    }

    @Test
    public void testExistingProtocolInfoIsKept() throws Exception {
        Element res = XmlUtils.parse("<res" + NS + " protocolInfo=\"\">x-sonos-spotify:abc</res>")
                .getDocumentElement();
        assertFalse(DidlQuirks.applyResourceQuirks(res));
        assertEquals("", res.getAttribute("protocolInfo"));
    }

    @Test
    public void testObjectQuirksCountRepairs() throws Exception {
        Element item = XmlUtils.parse("<item" + NS + ">" //
                + "<res>http://host/a.mp3</res>" //
                + "<res protocolInfo=\"http-get:*:audio/mpeg:*\">http://host/b.mp3</res>" //
                + "<res>x-sonos-spotify:c</res>" //
                + "</item>").getDocumentElement();
        assertEquals(2, DidlQuirks.applyObjectQuirks(item));
        assertEquals(0, DidlQuirks.applyObjectQuirks(item));
    }
}
