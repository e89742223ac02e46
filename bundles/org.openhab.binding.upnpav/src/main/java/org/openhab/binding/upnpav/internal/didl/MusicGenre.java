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

import org.eclipse.jdt.annotation.NonNullByDefault;

/**
 * A style of music ({@code object.container.genre.musicGenre}). Holds audio items, music artists, music
 * albums and other music genres only.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class MusicGenre extends Genre {

    public static final String UPNP_CLASS = Genre.UPNP_CLASS + ".musicGenre";

    public MusicGenre() {
        super(UPNP_CLASS);
    }

    @Override
    public boolean addItem(DidlObject item) {
        return item instanceof AudioItem && super.addItem(item);
    }

    @Override
    public boolean addContainer(DidlObject container) {
        return (container instanceof MusicArtist || container instanceof MusicAlbum
                || container instanceof MusicGenre) && super.addContainer(container);
    }
}
