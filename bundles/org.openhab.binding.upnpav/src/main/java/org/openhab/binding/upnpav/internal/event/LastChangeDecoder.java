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

import static org.openhab.binding.upnpav.internal.UpnpAvBindingConstants.*;
import static org.openhab.binding.upnpav.internal.event.LastChangeEvent.*;

import java.util.HashMap;
import java.util.Map;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.upnpav.internal.exception.MalformedXmlException;
import org.openhab.binding.upnpav.internal.xml.XmlNamespaces;
import org.openhab.binding.upnpav.internal.xml.XmlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

/**
 * Decodes the AVTransport {@code LastChange} document into a {@link LastChangeEvent}.
 * <p>
 * The document looks like:
 *
 * <pre>
 * &lt;Event xmlns="urn:schemas-upnp-org:metadata-1-0/AVT/" xmlns:r="urn:schemas-rinconnetworks-com:metadata-1-0/"&gt;
 *   &lt;InstanceID val="0"&gt;
 *     &lt;TransportState val="PLAYING"/&gt;
 *     &lt;CurrentTrackMetaData val="&amp;lt;DIDL-Lite ...&amp;gt;"/&gt;
 *     &lt;r:NextTrackURI val="x-sonos-http:..."/&gt;
 *   &lt;/InstanceID&gt;
 * &lt;/Event&gt;
 * </pre>
 *
 * Values come from the {@code val} attribute. The three metadata variables hold an escaped DIDL-Lite
 * document whose first item supplies the track fields.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public final class LastChangeDecoder {

    private static final Logger logger = LoggerFactory.getLogger(LastChangeDecoder.class);

    private static final String ATTR_VAL = "val";
    private static final String NOT_IMPLEMENTED = "NOT_IMPLEMENTED";

    private LastChangeDecoder() {
    }

    public static DecodeResult<LastChangeEvent> decode(String xml) {
        if (xml.isBlank()) {
            return failure("Empty LastChange payload", null);
        }

        Element root;
        try {
            root = XmlUtils.parse(xml).getDocumentElement();
        } catch (MalformedXmlException e) {
            return failure("Malformed LastChange XML: " + e.getMessage(), e);
        }

        Element instance = XmlUtils.findChildByUri(root, NS_AVT_EVENT, INSTANCE_ID);
        if (instance == null) {
            return failure("LastChange event has no AVTransport InstanceID", null);
        }

        Map<String, String> content = new HashMap<>();
        putVal(content, instance, NS_AVT_EVENT, "TransportState", TRANSPORT_STATE);
        putVal(content, instance, NS_AVT_EVENT, "TransportStatus", TRANSPORT_STATUS);
        putVal(content, instance, NS_AVT_EVENT, "CurrentPlayMode", CURRENT_PLAY_MODE);
        putVal(content, instance, NS_AVT_EVENT, "CurrentCrossfadeMode", CURRENT_CROSSFADE_MODE);
        putVal(content, instance, NS_AVT_EVENT, "NumberOfTracks", NUMBER_OF_TRACKS);
        putVal(content, instance, NS_AVT_EVENT, "CurrentTrack", CURRENT_TRACK);
        putVal(content, instance, NS_AVT_EVENT, "CurrentSection", CURRENT_SECTION);
        putVal(content, instance, NS_AVT_EVENT, "CurrentTrackURI", CURRENT_TRACK_URI);
        putVal(content, instance, NS_AVT_EVENT, "CurrentTrackDuration", CURRENT_TRACK_DURATION);
        putVal(content, instance, NS_AVT_EVENT, "AVTransportURI", AV_TRANSPORT_URI);
        putVal(content, instance, NS_RINCON, "NextTrackURI", NEXT_TRACK_URI);
        putVal(content, instance, NS_RINCON, "EnqueuedTransportURI", ENQUEUED_TRANSPORT_URI);

        try {
            Element current = embeddedItem(instance, NS_AVT_EVENT, "CurrentTrackMetaData");
            if (current != null) {
                putText(content, current, XmlNamespaces.DC, "title", TITLE);
                putText(content, current, XmlNamespaces.DC, "creator", CREATOR);
                putText(content, current, XmlNamespaces.UPNP, "album", ALBUM);
                putText(content, current, XmlNamespaces.UPNP, "originalTrackNumber", ORIGINAL_TRACK_NUMBER);
                putText(content, current, XmlNamespaces.RINCON, "albumArtist", ALBUM_ARTIST);
                putText(content, current, XmlNamespaces.UPNP, "albumArtURI", ALBUM_ART_URI);
                putText(content, current, XmlNamespaces.RINCON, "radioShowMd", RADIO_SHOW_MD);
            }

            Element next = embeddedItem(instance, NS_RINCON, "NextTrackMetaData");
            if (next != null) {
                putText(content, next, XmlNamespaces.DC, "title", NEXT_TITLE);
                putText(content, next, XmlNamespaces.DC, "creator", NEXT_CREATOR);
                putText(content, next, XmlNamespaces.UPNP, "album", NEXT_ALBUM);
                putText(content, next, XmlNamespaces.UPNP, "originalTrackNumber", NEXT_ORIGINAL_TRACK_NUMBER);
                putText(content, next, XmlNamespaces.RINCON, "albumArtist", NEXT_ALBUM_ARTIST);
                putText(content, next, XmlNamespaces.UPNP, "albumArtURI", NEXT_ALBUM_ART_URI);
            }

            Element enqueued = embeddedItem(instance, NS_RINCON, "EnqueuedTransportURIMetaData");
            if (enqueued != null) {
                putText(content, enqueued, XmlNamespaces.DC, "title", TRANSPORT_TITLE);
            }
        } catch (MalformedXmlException e) {
            return failure("Malformed metadata in LastChange event: " + e.getMessage(), e);
        }

        return DecodeResult.success(new LastChangeEvent(content));
    }

    private static DecodeResult<LastChangeEvent> failure(String message, @Nullable Exception cause) {
        logger.debug("{}", message);
        return cause == null ? DecodeResult.failure(message) : DecodeResult.failure(message, cause);
    }

    private static @Nullable String val(Element instance, String namespaceUri, String name) {
        Element element = XmlUtils.findChildByUri(instance, namespaceUri, name);
        return element == null ? null : XmlUtils.optionalAttribute(element, ATTR_VAL);
    }

    private static void putVal(Map<String, String> content, Element instance, String namespaceUri, String name,
            String key) {
        String value = val(instance, namespaceUri, name);
        if (value != null) {
            content.put(key, value);
        }
    }

    private static void putText(Map<String, String> content, Element item, String nsId, String name, String key) {
        String text = XmlUtils.findChildText(item, nsId, name);
        if (text != null) {
            content.put(key, text);
        }
    }

    /**
     * Returns the first item of the DIDL-Lite document held by a metadata variable, or null when the variable
     * is absent, empty or holds no item.
     */
    private static @Nullable Element embeddedItem(Element instance, String namespaceUri, String name)
            throws MalformedXmlException {
        String metadata = val(instance, namespaceUri, name);
        if (metadata == null || metadata.isBlank() || NOT_IMPLEMENTED.equals(metadata.trim())) {
            return null;
        }
        Element didl = XmlUtils.parse(metadata).getDocumentElement();
        return XmlUtils.findChildByUri(didl, NS_DIDL_LITE, ELEMENT_ITEM);
    }
}
