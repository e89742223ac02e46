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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.upnpav.internal.exception.DidlMetadataException;
import org.openhab.binding.upnpav.internal.xml.XmlNamespaces;
import org.openhab.binding.upnpav.internal.xml.XmlUtils;
import org.w3c.dom.Element;

/**
 * A musician or band ({@code object.container.person.musicArtist}).
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class MusicArtist extends Person {

    public static final String UPNP_CLASS = Person.UPNP_CLASS + ".musicArtist";

    private List<String> genres = new ArrayList<>();
    private @Nullable String artistDiscographyUri;

    public MusicArtist() {
        super(UPNP_CLASS);
    }

    @Override
    protected void readElement(Element element) throws DidlMetadataException {
        super.readElement(element);
        genres = XmlUtils.findAllChildText(element, XmlNamespaces.UPNP, "genre");
        artistDiscographyUri = XmlUtils.optionalChildText(element, XmlNamespaces.UPNP, "artistDiscographyURI");
    }

    @Override
    protected void writeElement(Element element) throws DidlMetadataException {
        super.writeElement(element);
        XmlUtils.appendTextElements(element, XmlNamespaces.UPNP, "genre", genres);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.UPNP, "artistDiscographyURI",
                artistDiscographyUri);
    }

    public List<String> getGenres() {
        return genres;
    }

    public @Nullable String getArtistDiscographyUri() {
        return artistDiscographyUri;
    }

    public void setArtistDiscographyUri(@Nullable String artistDiscographyUri) {
        this.artistDiscographyUri = artistDiscographyUri;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!super.equals(obj)) {
            return false;
        }
        MusicArtist other = (MusicArtist) Objects.requireNonNull(obj);
        return genres.equals(other.genres) && Objects.equals(artistDiscographyUri, other.artistDiscographyUri);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), genres, artistDiscographyUri);
    }
}
