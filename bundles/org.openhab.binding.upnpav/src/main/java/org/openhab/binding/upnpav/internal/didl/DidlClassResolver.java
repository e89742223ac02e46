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

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.openhab.binding.upnpav.internal.exception.UnknownDidlClassException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a {@code upnp:class} string to the most specific known {@link DidlClass}.
 * <p>
 * Vendor extensions such as {@code object.item.audioItem.musicTrack.#editorial} are cut at the first segment
 * starting with {@code #}. Unknown subclasses fall back to their nearest known ancestor.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public final class DidlClassResolver {

    private static final Logger logger = LoggerFactory.getLogger(DidlClassResolver.class);

    private DidlClassResolver() {
    }

    public static String stripVendorExtension(String upnpClass) {
        String[] segments = upnpClass.trim().split("\\.", -1);
        StringBuilder builder = new StringBuilder();
        for (String segment : segments) {
            if (segment.startsWith("#")) {
                break;
            }
            if (builder.length() > 0) {
                builder.append('.');
            }
            builder.append(segment);
        }
        return builder.toString();
    }

    /**
     * Lists the stripped class followed by each ancestor path, most specific first.
     */
    public static List<String> candidateClassNames(String upnpClass) {
        List<String> candidates = new ArrayList<>();
        String candidate = stripVendorExtension(upnpClass);
        while (!candidate.isEmpty()) {
            candidates.add(candidate);
            int lastDot = candidate.lastIndexOf('.');
            candidate = lastDot < 0 ? "" : candidate.substring(0, lastDot);
        }
        return candidates;
    }

    /**
     * @throws UnknownDidlClassException when no candidate names a known type
     */
    public static DidlClass resolve(String upnpClass) throws UnknownDidlClassException {
        for (String candidate : candidateClassNames(upnpClass)) {
            DidlClass didlClass = DidlClass.forLookupName(DidlClass.lookupName(candidate));
            if (didlClass != null) {
                if (!candidate.equals(upnpClass)) {
                    logger.trace("Resolved UPnP class '{}' as {}", upnpClass, didlClass.getUpnpClass());
                }
                return didlClass;
            }
        }
        throw new UnknownDidlClassException(upnpClass);
    }
}
