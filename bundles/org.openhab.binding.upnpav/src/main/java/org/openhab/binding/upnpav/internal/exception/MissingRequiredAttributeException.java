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
 * Thrown when a mandatory XML attribute (e.g. {@code protocolInfo} on {@code res}) is missing.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class MissingRequiredAttributeException extends MissingRequiredFieldException {

    private static final long serialVersionUID = 1L;

    public MissingRequiredAttributeException(String className, String attributeName) {
        super(className, attributeName, "attribute");
    }
}
