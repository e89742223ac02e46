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

import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.upnpav.internal.exception.DidlMetadataException;
import org.openhab.binding.upnpav.internal.xml.XmlNamespaces;
import org.w3c.dom.Element;

/**
 * A folder on a storage medium ({@code object.container.storageFolder}).
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class StorageFolder extends DidlContainer {

    public static final String UPNP_CLASS = DidlContainer.UPNP_CLASS + ".storageFolder";

    private @Nullable Long storageUsed;

    public StorageFolder() {
        super(UPNP_CLASS);
    }

    @Override
    protected void readElement(Element element) throws DidlMetadataException {
        super.readElement(element);
        storageUsed = requiredLong(element, getClass().getSimpleName(), XmlNamespaces.UPNP, "storageUsed");
    }

    @Override
    protected void writeElement(Element element) throws DidlMetadataException {
        super.writeElement(element);
        StorageSystem.appendRequired(element, getClass().getSimpleName(), "storageUsed", storageUsed);
    }

    public @Nullable Long getStorageUsed() {
        return storageUsed;
    }

    public void setStorageUsed(@Nullable Long storageUsed) {
        this.storageUsed = storageUsed;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        return super.equals(obj)
                && Objects.equals(storageUsed, ((StorageFolder) Objects.requireNonNull(obj)).storageUsed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), storageUsed);
    }
}
