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
import static org.junit.jupiter.params.provider.Arguments.arguments;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.openhab.binding.upnpav.internal.xml.XmlUtils;
import org.w3c.dom.Element;

/**
 * Pins the order in which each DIDL-Lite type writes its child elements: the common fields, then the
 * fields of each type from the base class down, then {@code desc}.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class DidlElementOrderTest {

    private static final List<String> COMMON = List.of("title", "class", "creator", "writeStatus", "res", "res");

    static Stream<Arguments> typeFields() {
        return Stream.of(
                arguments(DidlClass.ITEM, List.of()),
                arguments(DidlClass.AUDIO_ITEM,
                        List.of("genre", "genre", "relation", "relation", "rights", "rights", "publisher", "publisher",
                                "longDescription", "description", "language")),
                arguments(DidlClass.MUSIC_TRACK,
                        List.of("genre", "genre", "relation", "relation", "rights", "rights", "publisher", "publisher",
                                "longDescription", "description", "language", "artist", "artist", "album", "album",
                                "playlist", "playlist", "contributor", "contributor", "originalTrackNumber",
                                "storageMedium", "date", "albumArtURI")),
                arguments(DidlClass.AUDIO_BROADCAST,
                        List.of("genre", "genre", "relation", "relation", "rights", "rights", "publisher", "publisher",
                                "longDescription", "description", "language", "region", "radioCallSign",
                                "radioStationID", "radioBand", "channelNr")),
                arguments(DidlClass.AUDIO_BOOK,
                        List.of("genre", "genre", "relation", "relation", "rights", "rights", "publisher", "publisher",
                                "longDescription", "description", "language", "producer", "producer", "contributor",
                                "contributor", "date", "storageMedium")),
                arguments(DidlClass.IMAGE_ITEM,
                        List.of("longDescription", "storageMedium", "rating", "description", "date", "rights",
                                "rights")),
                arguments(DidlClass.PLAYLIST_ITEM,
                        List.of("protection", "storageMedium", "longDescription", "rating", "description", "date",
                                "author", "author", "publisher", "publisher", "contributor", "contributor", "relation",
                                "relation", "language", "language", "rights", "rights")),
                arguments(DidlClass.CONTAINER,
                        List.of("searchClass", "searchClass", "createClass", "createClass")),
                arguments(DidlClass.ALBUM,
                        List.of("searchClass", "searchClass", "createClass", "createClass", "storageMedium",
                                "longDescription", "description", "date", "publisher", "publisher", "contributor",
                                "contributor", "relation", "relation", "rights", "rights")),
                arguments(DidlClass.MUSIC_ALBUM,
                        List.of("searchClass", "searchClass", "createClass", "createClass", "storageMedium",
                                "longDescription", "description", "date", "publisher", "publisher", "contributor",
                                "contributor", "relation", "relation", "rights", "rights", "artist", "artist", "genre",
                                "genre", "producer", "producer", "albumArtURI", "toc")),
                arguments(DidlClass.GENRE,
                        List.of("searchClass", "searchClass", "createClass", "createClass", "longDescription",
                                "description")),
                arguments(DidlClass.MUSIC_GENRE,
                        List.of("searchClass", "searchClass", "createClass", "createClass", "longDescription",
                                "description")),
                arguments(DidlClass.PLAYLIST_CONTAINER,
                        List.of("searchClass", "searchClass", "createClass", "createClass", "artist", "artist",
                                "genre", "genre", "producer", "producer", "contributor", "contributor", "language",
                                "language", "rights", "rights", "longDescription", "storageMedium", "description",
                                "date")),
                arguments(DidlClass.PERSON,
                        List.of("searchClass", "searchClass", "createClass", "createClass", "language", "language")),
                arguments(DidlClass.MUSIC_ARTIST,
                        List.of("searchClass", "searchClass", "createClass", "createClass", "language", "language",
                                "genre", "genre", "artistDiscographyURI")),
                arguments(DidlClass.STORAGE_SYSTEM,
                        List.of("searchClass", "searchClass", "createClass", "createClass", "storageTotal",
                                "storageUsed", "storageFree", "storageMaxPartition", "storageMedium")),
                arguments(DidlClass.STORAGE_VOLUME,
                        List.of("searchClass", "searchClass", "createClass", "createClass", "storageTotal",
                                "storageUsed", "storageFree", "storageMedium")),
                arguments(DidlClass.STORAGE_FOLDER,
                        List.of("searchClass", "searchClass", "createClass", "createClass", "storageUsed")));
    }

    @ParameterizedTest
    @MethodSource("typeFields")
    public void testElementOrder(DidlClass didlClass, List<String> typeFields) throws Exception {
        Element element = DidlFixtures.populateAll(didlClass.newInstance()).toElement();

        List<String> expected = new ArrayList<>(COMMON);
        expected.addAll(typeFields);
        expected.add("desc");
        assertEquals(expected, childNames(element));
    }

    @Test
    public void testEveryTypeIsPinned() {
        Set<DidlClass> pinned = EnumSet.noneOf(DidlClass.class);
        typeFields().forEach(arguments -> pinned.add((DidlClass) arguments.get()[0]));
        assertEquals(EnumSet.allOf(DidlClass.class), pinned);
    }

    private static List<String> childNames(Element element) {
        List<String> names = new ArrayList<>();
        for (Element child : XmlUtils.childElements(element)) {
            names.add(child.getLocalName());
        }
        return names;
    }
}
