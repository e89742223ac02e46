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
 * Base exception for DIDL-Lite metadata that cannot be read or written.
 * This exception is thrown when:
 * <ul>
 * <li>A schema-mandatory attribute or child element is missing</li>
 * <li>A {@code upnp:class} cannot be mapped to a known type</li>
 * <li>The XML handed in is not well-formed</li>
 * <li>A field holds a value that cannot be converted to its type</li>
 * </ul>
 *
 * These failures are never retried; the caller has to supply conformant input.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class DidlMetadataException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new exception with the specified detail message.
     *
     * @param message the detail message describing the metadata problem
     */
    public DidlMetadataException(String message) {
        super(message);
    }

    /**
     * Constructs a new exception with the specified detail message and cause.
     *
     * @param message the detail message describing the metadata problem
     * @param cause the underlying cause of the exception
     */
    public DidlMetadataException(String message, Throwable cause) {
        super(message, cause);
    }
}
