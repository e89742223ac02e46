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

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.junit.jupiter.api.Test;
import org.openhab.binding.upnpav.internal.config.DidlConfiguration;
import org.openhab.binding.upnpav.internal.exception.DidlMetadataException;

/**
 * Tests for {@link DidlLite}
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class DidlLiteTest {

    @Test
    public void testBuildAndReadEnvelope() throws Exception {
        DidlLite didl = new DidlLite();
        AudioBroadcast station = new AudioBroadcast();
        station.setObjectId("F00092020s12345");
        station.setParentId("F00082064y1%3apopular");
        station.setTitle("Radio One");
        station.setRadioStationId("s12345");
        didl.addItem(station);
        DidlContainer container = didl.addContainer("SQ:1", "SQ:", "My Playlist", true);

        assertEquals("SQ:1", container.getObjectId());
        assertEquals(1, didl.getItems().size());
        assertEquals(2, didl.size());

        String xml = didl.toXmlString();
        assertTrue(xml.startsWith("<DIDL-Lite"));

        DidlLite parsed = DidlLite.fromXml(xml);
        assertEquals(2, parsed.getItems().size());
        assertEquals(station, parsed.getItems().get(0));
        assertEquals("My Playlist", parsed.getItems().get(1).getTitle());
    }

    @Test
    public void testEmptyEnvelope() throws Exception {
        DidlLite parsed = DidlLite.fromXml(new DidlLite().toXmlString());
        assertEquals(0, parsed.size());
    }

    @Test
    public void testIllegalChildHonoursConfiguration() throws Exception {
        String xml = "<DIDL-Lite xmlns=\"urn:schemas-upnp-org:metadata-1-0/DIDL-Lite/\""
                + " xmlns:dc=\"http://purl.org/dc/elements/1.1/\""
                + " xmlns:upnp=\"urn:schemas-upnp-org:metadata-1-0/upnp/\">" //
                + "<bogus/>" //
                + "<item id=\"1\" parentID=\"0\" restricted=\"true\"><dc:title>T</dc:title>"
                + "<upnp:class>object.item</upnp:class></item></DIDL-Lite>";

        assertThrows(DidlMetadataException.class, () -> DidlLite.fromXml(xml));
        DidlLite lenient = DidlLite.fromXml(xml, DidlConfiguration.defaults().withSkipIllegalChildren(true));
        assertEquals(1, lenient.size());
    }
}
