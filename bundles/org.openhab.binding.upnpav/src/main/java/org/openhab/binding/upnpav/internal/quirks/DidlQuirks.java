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

import static org.openhab.binding.upnpav.internal.UpnpAvBindingConstants.*;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.openhab.binding.upnpav.internal.xml.XmlNamespaces;
import org.openhab.binding.upnpav.internal.xml.XmlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

/**
 * Repairs known deviations in vendor metadata before it is validated.
 * <p>
 * Some players (Spotify on Sonos among them) send {@code res} elements without the mandatory
 * {@code protocolInfo} attribute. A placeholder is added so the rest of the object can still be parsed.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public final class DidlQuirks {

    private static final Logger logger = LoggerFactory.getLogger(DidlQuirks.class);

    private static final String ATTR_PROTOCOL_INFO = "protocolInfo";

    private DidlQuirks() {
    }

    /**
     * @return whether a repair was made
     */
    public static boolean applyResourceQuirks(Element resource) {
        if (resource.hasAttribute(ATTR_PROTOCOL_INFO)) {
            return false;
        }
        String uri = resource.getTextContent().trim();
        String protocolInfo = uri.startsWith(QUIRK_SPOTIFY_URI_PREFIX) ? QUIRK_SPOTIFY_PROTOCOL_INFO
                : QUIRK_DUMMY_PROTOCOL_INFO;
        resource.setAttribute(ATTR_PROTOCOL_INFO, protocolInfo);
        logger.debug("Resource '{}' has no protocolInfo, set to '{}'", uri, protocolInfo);
        return true;
    }

    /**
     * Applies the resource repairs to every {@code res} child of an item or container.
     *
     * @return the number of repaired resources
     */
    public static int applyObjectQuirks(Element object) {
        int applied = 0;
        for (Element resource : XmlUtils.findChildren(object, XmlNamespaces.DIDL, ELEMENT_RES)) {
            if (applyResourceQuirks(resource)) {
                applied++;
            }
        }
        return applied;
    }
}
