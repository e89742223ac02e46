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
package org.openhab.binding.upnpav.internal;

import org.eclipse.jdt.annotation.NonNullByDefault;

/**
 * The {@link UpnpAvBindingConstants} class defines common constants used across the binding.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class UpnpAvBindingConstants {

    // Metadata namespaces
    public static final String NS_DIDL_LITE = "urn:schemas-upnp-org:metadata-1-0/DIDL-Lite/";
    public static final String NS_DC = "http://purl.org/dc/elements/1.1/";
    public static final String NS_UPNP = "urn:schemas-upnp-org:metadata-1-0/upnp/";
    public static final String NS_RINCON = "urn:schemas-rinconnetworks-com:metadata-1-0/";
    public static final String NS_MS = "http://www.sonos.com/Services/1.1";
    public static final String NS_DLNA = "urn:schemas-dlna-org:metadata-1-0";

    // Eventing namespaces
    public static final String NS_AVT_EVENT = "urn:schemas-upnp-org:metadata-1-0/AVT/";
    public static final String NS_RCS_EVENT = "urn:schemas-upnp-org:metadata-1-0/RCS/";
    public static final String NS_GENA_EVENT = "urn:schemas-upnp-org:event-1-0";
    public static final String NS_XMLNS = "http://www.w3.org/2000/xmlns/";

    // Services
    public static final String SERVICE_AVTRANSPORT = "urn:schemas-upnp-org:service:AVTransport:1";
    public static final String SERVICE_RENDERING_CONTROL = "urn:schemas-upnp-org:service:RenderingControl:1";

    // Evented variables
    public static final String VARIABLE_LAST_CHANGE = "LastChange";
    public static final String INSTANCE_ID = "InstanceID";

    // DIDL-Lite elements
    public static final String ELEMENT_DIDL_LITE = "DIDL-Lite";
    public static final String ELEMENT_ITEM = "item";
    public static final String ELEMENT_CONTAINER = "container";
    public static final String ELEMENT_RES = "res";
    public static final String ELEMENT_DESC = "desc";

    // Sonos desc defaults
    public static final String DEFAULT_DESC_ID = "cdudn";
    public static final String DEFAULT_DESC_NAMESPACE = NS_RINCON;

    // Resource quirks
    public static final String QUIRK_DUMMY_PROTOCOL_INFO = "DUMMY_ADDED_BY_QUIRK";
    public static final String QUIRK_SPOTIFY_URI_PREFIX = "x-sonos-spotify";
    public static final String QUIRK_SPOTIFY_PROTOCOL_INFO = "sonos.com-spotify:*:audio/x-spotify.*";

    // Configuration parameters
    public static final String CONFIG_APPLY_RESOURCE_QUIRKS = "applyResourceQuirks";
    public static final String CONFIG_SKIP_ILLEGAL_CHILDREN = "skipIllegalChildren";
    public static final String CONFIG_PRETTY_PRINT = "prettyPrint";
}
