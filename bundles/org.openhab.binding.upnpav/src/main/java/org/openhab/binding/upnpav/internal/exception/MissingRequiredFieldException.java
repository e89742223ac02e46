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
 * Thrown when a DIDL-Lite object is parsed or serialized without one of its mandatory fields.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class MissingRequiredFieldException extends DidlMetadataException {

    private static final long serialVersionUID = 1L;

    private final String className;
    private final String fieldName;

    /**
     * @param className the DIDL type that was being read or written
     * @param fieldName the qualified name of the missing element or attribute
     */
    public MissingRequiredFieldException(String className, String fieldName) {
        this(className, fieldName, "field");
    }

    protected MissingRequiredFieldException(String className, String fieldName, String kind) {
        super(String.format("Could not handle %s: required %s '%s' is missing", className, kind, fieldName));
        this.className = className;
        this.fieldName = fieldName;
    }

    public String getClassName() {
        return className;
    }

    public String getFieldName() {
        return fieldName;
    }
}
