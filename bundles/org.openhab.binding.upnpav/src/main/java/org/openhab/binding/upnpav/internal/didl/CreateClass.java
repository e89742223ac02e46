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
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.upnpav.internal.exception.DidlMetadataException;
import org.w3c.dom.Element;

/**
 * A class of objects that may be created inside a container, the {@code upnp:createClass} element.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class CreateClass extends SearchClass {

    protected CreateClass() {
    }

    public CreateClass(String className, boolean includeDerived, @Nullable String name) {
        super(className, includeDerived, name);
    }

    public CreateClass(String className, boolean includeDerived) {
        super(className, includeDerived);
    }

    static CreateClass fromElement(Element element) throws DidlMetadataException {
        CreateClass createClass = new CreateClass();
        createClass.read(element);
        return createClass;
    }

    @Override
    protected String getElementName() {
        return "createClass";
    }
}
