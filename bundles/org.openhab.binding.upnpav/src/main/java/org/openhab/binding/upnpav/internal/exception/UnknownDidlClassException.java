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
package org.openhab.binding.upnpav.internal.exception;

import org.eclipse.jdt.annotation.NonNullByDefault;

/**
 * Thrown when no segment of a dotted {@code upnp:class} maps to a known DIDL type.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class UnknownDidlClassException extends DidlMetadataException {

    private static final long serialVersionUID = 1L;

    private final String upnpClass;

    public UnknownDidlClassException(String upnpClass) {
        super("Unknown UPnP class: " + upnpClass);
        this.upnpClass = upnpClass;
    }

    public String getUpnpClass() {
        return upnpClass;
    }
}
