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

import java.util.List;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.junit.jupiter.api.Test;
import org.openhab.binding.upnpav.internal.exception.UnknownDidlClassException;

/**
 * Tests for {@link DidlClassResolver} and the {@link DidlClass} table
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class DidlClassResolverTest {

    @Test
    public void testStripVendorExtension() {
        assertEquals("object.item.audioItem.musicTrack",
                DidlClassResolver.stripVendorExtension("object.item.audioItem.musicTrack.#editorial"));
        assertEquals("object.container.playlistContainer",
                DidlClassResolver.stripVendorExtension("object.container.playlistContainer.#PlaylistView.x"));
        assertEquals("object.item", DidlClassResolver.stripVendorExtension("object.item"));
    }

    @Test
    public void testCandidatesAreMostSpecificFirst() {
        assertEquals(List.of("object.item.audioItem.musicTrack", "object.item.audioItem", "object.item", "object"),
                DidlClassResolver.candidateClassNames("object.item.audioItem.musicTrack"));
    }

    @Test
    public void testExactClasses() throws Exception {
        for (DidlClass didlClass : DidlClass.values()) {
            assertSame(didlClass, DidlClassResolver.resolve(didlClass.getUpnpClass()));
        }
    }

    @Test
    public void testVendorExtendedClass() throws Exception {
        assertSame(DidlClass.MUSIC_TRACK, DidlClassResolver.resolve("object.item.audioItem.musicTrack.#editorial"));
        assertSame(DidlClass.AUDIO_BROADCAST,
                DidlClassResolver.resolve("object.item.audioItem.audioBroadcast.#station"));
    }

    @Test
    public void testUnknownSubclassFallsBackToAncestor() throws Exception {
        assertSame(DidlClass.MUSIC_TRACK, DidlClassResolver.resolve("object.item.audioItem.musicTrack.recentShow"));
        assertSame(DidlClass.CONTAINER, DidlClassResolver.resolve("object.container.favorites"));
    }

    @Test
    public void testUnknownClass() {
        UnknownDidlClassException e = assertThrows(UnknownDidlClassException.class,
                () -> DidlClassResolver.resolve("object.nonsense"));
        assertEquals("object.nonsense", e.getUpnpClass());
        assertThrows(UnknownDidlClassException.class, () -> DidlClassResolver.resolve(""));
    }

    @Test
    public void testLookupNames() {
        assertEquals("MusicTrack", DidlClass.MUSIC_TRACK.getLookupName());
        assertEquals("Container", DidlClass.CONTAINER.getLookupName());
        assertEquals(MusicArtist.class, DidlClass.MUSIC_ARTIST.getType());
        assertTrue(DidlClass.STORAGE_FOLDER.newInstance() instanceof StorageFolder);
    }
}
