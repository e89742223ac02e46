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

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.upnpav.internal.exception.DidlMetadataException;
import org.openhab.binding.upnpav.internal.quirks.DidlQuirks;
import org.w3c.dom.Element;

/**
 * The concrete DIDL-Lite types known to the parser, keyed by the capitalized trailing segment of their
 * {@code upnp:class}.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public enum DidlClass {
    ITEM(DidlItem.UPNP_CLASS, DidlItem.class, DidlItem::new),
    AUDIO_ITEM(AudioItem.UPNP_CLASS, AudioItem.class, AudioItem::new),
    MUSIC_TRACK(MusicTrack.UPNP_CLASS, MusicTrack.class, MusicTrack::new),
    AUDIO_BROADCAST(AudioBroadcast.UPNP_CLASS, AudioBroadcast.class, AudioBroadcast::new),
    AUDIO_BOOK(AudioBook.UPNP_CLASS, AudioBook.class, AudioBook::new),
    IMAGE_ITEM(ImageItem.UPNP_CLASS, ImageItem.class, ImageItem::new),
    PLAYLIST_ITEM(PlaylistItem.UPNP_CLASS, PlaylistItem.class, PlaylistItem::new),
    CONTAINER(DidlContainer.UPNP_CLASS, DidlContainer.class, DidlContainer::new),
    ALBUM(Album.UPNP_CLASS, Album.class, Album::new),
    MUSIC_ALBUM(MusicAlbum.UPNP_CLASS, MusicAlbum.class, MusicAlbum::new),
    GENRE(Genre.UPNP_CLASS, Genre.class, Genre::new),
    MUSIC_GENRE(MusicGenre.UPNP_CLASS, MusicGenre.class, MusicGenre::new),
    PLAYLIST_CONTAINER(PlaylistContainer.UPNP_CLASS, PlaylistContainer.class, PlaylistContainer::new),
    PERSON(Person.UPNP_CLASS, Person.class, Person::new),
    MUSIC_ARTIST(MusicArtist.UPNP_CLASS, MusicArtist.class, MusicArtist::new),
    STORAGE_SYSTEM(StorageSystem.UPNP_CLASS, StorageSystem.class, StorageSystem::new),
    STORAGE_VOLUME(StorageVolume.UPNP_CLASS, StorageVolume.class, StorageVolume::new),
    STORAGE_FOLDER(StorageFolder.UPNP_CLASS, StorageFolder.class, StorageFolder::new);

    private static final Map<String, DidlClass> BY_LOOKUP_NAME = new HashMap<>();
    static {
        for (DidlClass didlClass : values()) {
            BY_LOOKUP_NAME.put(didlClass.lookupName, didlClass);
        }
    }

    private final String upnpClass;
    private final String lookupName;
    private final Class<? extends DidlObject> type;
    private final Supplier<? extends DidlObject> factory;

    DidlClass(String upnpClass, Class<? extends DidlObject> type, Supplier<? extends DidlObject> factory) {
        this.upnpClass = upnpClass;
        this.lookupName = lookupName(upnpClass);
        this.type = type;
        this.factory = factory;
    }

    /**
     * Capitalizes the last dotted segment of a class string: {@code object.item.audioItem} gives
     * {@code AudioItem}.
     */
    static String lookupName(String upnpClass) {
        String segment = upnpClass.substring(upnpClass.lastIndexOf('.') + 1);
        return segment.isEmpty() ? segment : Character.toUpperCase(segment.charAt(0)) + segment.substring(1);
    }

    static @Nullable DidlClass forLookupName(String lookupName) {
        return BY_LOOKUP_NAME.get(lookupName);
    }

    public String getUpnpClass() {
        return upnpClass;
    }

    public String getLookupName() {
        return lookupName;
    }

    public Class<? extends DidlObject> getType() {
        return type;
    }

    public DidlObject newInstance() {
        return factory.get();
    }

    /**
     * Creates an instance of this type and populates it from the element.
     *
     * @param applyQuirks whether to repair known vendor deviations before validation; repairs are made on a
     *            copy, the given element is left untouched
     */
    public DidlObject fromElement(Element element, boolean applyQuirks) throws DidlMetadataException {
        Element source = element;
        if (applyQuirks) {
            source = (Element) element.cloneNode(true);
            DidlQuirks.applyObjectQuirks(source);
        }
        DidlObject object = newInstance();
        object.readElement(source);
        return object;
    }
}
