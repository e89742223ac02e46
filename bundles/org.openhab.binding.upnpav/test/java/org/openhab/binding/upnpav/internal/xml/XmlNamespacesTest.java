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
package org.openhab.binding.upnpav.internal.xml;

import static org.junit.jupiter.api.Assertions.*;
import static org.openhab.binding.upnpav.internal.UpnpAvBindingConstants.*;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link XmlNamespaces}
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class XmlNamespacesTest {

    @Test
    public void testKnownIdsResolveToUris() {
        assertEquals(NS_DIDL_LITE, XmlNamespaces.uriFor(XmlNamespaces.DIDL));
        assertEquals(NS_DC, XmlNamespaces.uriFor(XmlNamespaces.DC));
        assertEquals(NS_UPNP, XmlNamespaces.uriFor(XmlNamespaces.UPNP));
        assertEquals(NS_RINCON, XmlNamespaces.uriFor(XmlNamespaces.RINCON));
        assertEquals(NS_MS, XmlNamespaces.uriFor(XmlNamespaces.MS));
        assertEquals(NS_DLNA, XmlNamespaces.uriFor(XmlNamespaces.DLNA));
    }

    @Test
    public void testUnknownIdIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> XmlNamespaces.uriFor("foo"));
    }

    @Test
    public void testClarkNotation() {
        assertEquals("{urn:schemas-upnp-org:metadata-1-0/upnp/}class", XmlNamespaces.nsTag("upnp", "class"));
        assertEquals("{http://purl.org/dc/elements/1.1/}title", XmlNamespaces.nsTag("dc", "title"));
    }

    @Test
    public void testQualifiedNames() {
        assertEquals("dc:title", XmlNamespaces.qualifiedName(XmlNamespaces.DC, "title"));
        assertEquals("r:streamContent", XmlNamespaces.qualifiedName(XmlNamespaces.RINCON, "streamContent"));
        assertEquals("item", XmlNamespaces.qualifiedName(XmlNamespaces.DIDL, "item"));
    }

    @Test
    public void testInitializeIsIdempotent() {
        XmlNamespaces.initialize();
        XmlNamespaces.initialize();
        assertEquals(NS_UPNP, XmlNamespaces.registeredUri("upnp"));
        assertEquals("upnp", XmlNamespaces.prefixFor(NS_UPNP));
    }

    @Test
    public void testRegisterConflictingPrefix() {
        XmlNamespaces.initialize();
        // same binding again is accepted
        XmlNamespaces.register("dc", NS_DC);
        assertThrows(IllegalArgumentException.class, () -> XmlNamespaces.register("dc", NS_UPNP));
        assertEquals(NS_DC, XmlNamespaces.registeredUri("dc"));
    }

    @Test
    public void testRegisterNewPrefix() {
        XmlNamespaces.register("xtest", "urn:example:xtest");
        assertEquals("urn:example:xtest", XmlNamespaces.registeredUri("xtest"));
        assertEquals("xtest", XmlNamespaces.prefixFor("urn:example:xtest"));
    }
}
