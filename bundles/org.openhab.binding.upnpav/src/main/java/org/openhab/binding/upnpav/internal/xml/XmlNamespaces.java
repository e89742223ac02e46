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

import static org.openhab.binding.upnpav.internal.UpnpAvBindingConstants.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

/**
 * Registry of the XML namespaces used by DIDL-Lite metadata.
 * <p>
 * Namespaces are addressed by a short id ({@code ""} for the DIDL-Lite default namespace, {@code dc},
 * {@code upnp}, {@code r}, {@code ms}, {@code dlna}). The same ids are registered as preferred prefixes
 * so serialized documents carry readable prefixes. Registration is process-wide, happens once on first
 * use and is safe to trigger from several threads.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public final class XmlNamespaces {

    private static final Logger logger = LoggerFactory.getLogger(XmlNamespaces.class);

    public static final String DIDL = "";
    public static final String DC = "dc";
    public static final String UPNP = "upnp";
    public static final String RINCON = "r";
    public static final String MS = "ms";
    public static final String DLNA = "dlna";

    private static final Map<String, String> NAMESPACES;
    static {
        Map<String, String> namespaces = new LinkedHashMap<>();
        namespaces.put(DIDL, NS_DIDL_LITE);
        namespaces.put(DC, NS_DC);
        namespaces.put(UPNP, NS_UPNP);
        namespaces.put(RINCON, NS_RINCON);
        namespaces.put(MS, NS_MS);
        namespaces.put(DLNA, NS_DLNA);
        NAMESPACES = Map.copyOf(namespaces);
    }

    private static final ConcurrentMap<String, String> prefixToUri = new ConcurrentHashMap<>();
    private static final ConcurrentMap<String, String> uriToPrefix = new ConcurrentHashMap<>();
    private static volatile boolean initialized = false;

    private XmlNamespaces() {
    }

    /**
     * Registers every known namespace against its preferred prefix. Calling this more than once is a no-op.
     */
    public static void initialize() {
        if (initialized) {
            return;
        }
        synchronized (XmlNamespaces.class) {
            if (!initialized) {
                NAMESPACES.forEach(XmlNamespaces::register);
                initialized = true;
                logger.debug("Registered {} DIDL-Lite namespace prefixes", NAMESPACES.size());
            }
        }
    }

    /**
     * Binds a prefix to a namespace URI.
     *
     * @throws IllegalArgumentException if the prefix is already bound to another URI
     */
    public static void register(String prefix, String uri) {
        String existing = prefixToUri.putIfAbsent(prefix, uri);
        if (existing != null && !existing.equals(uri)) {
            throw new IllegalArgumentException(String.format(
                    "Prefix '%s' is already bound to '%s', cannot bind it to '%s'", prefix, existing, uri));
        }
        uriToPrefix.putIfAbsent(uri, prefix);
    }

    public static @Nullable String registeredUri(String prefix) {
        return prefixToUri.get(prefix);
    }

    public static @Nullable String prefixFor(String uri) {
        initialize();
        return uriToPrefix.get(uri);
    }

    /**
     * @throws IllegalArgumentException for an id outside the fixed registry
     */
    public static String uriFor(String nsId) {
        String uri = NAMESPACES.get(nsId);
        if (uri == null) {
            throw new IllegalArgumentException("Unknown namespace id: '" + nsId + "'");
        }
        return uri;
    }

    /**
     * Returns the Clark notation {@code {uri}tag} of a namespaced tag.
     */
    public static String nsTag(String nsId, String tag) {
        return "{" + uriFor(nsId) + "}" + tag;
    }

    /**
     * Returns {@code prefix:localName}, or the bare local name for the default namespace.
     */
    public static String qualifiedName(String nsId, String localName) {
        String prefix = prefixFor(uriFor(nsId));
        return prefix == null || prefix.isEmpty() ? localName : prefix + ":" + localName;
    }

    /**
     * Writes the namespace declarations of a DIDL-Lite envelope onto the given element.
     */
    public static void declareDidlNamespaces(Element element) {
        initialize();
        element.setAttributeNS(NS_XMLNS, "xmlns", NS_DIDL_LITE);
        for (String nsId : new String[] { DC, UPNP, RINCON, DLNA }) {
            element.setAttributeNS(NS_XMLNS, "xmlns:" + nsId, uriFor(nsId));
        }
    }
}
