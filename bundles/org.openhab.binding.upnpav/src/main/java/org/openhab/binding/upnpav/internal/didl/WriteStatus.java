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
 * Values of {@code upnp:writeStatus}.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public enum WriteStatus {
    NOT_WRITABLE,
    WRITABLE,
    PROTECTED,
    UNKNOWN,
    MIXED;

    /**
     * Maps element text to a status. Text outside the vocabulary becomes {@link #UNKNOWN}.
     */
    public static WriteStatus fromText(String text) {
        for (WriteStatus status : values()) {
            if (status.name().equals(text.trim())) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
