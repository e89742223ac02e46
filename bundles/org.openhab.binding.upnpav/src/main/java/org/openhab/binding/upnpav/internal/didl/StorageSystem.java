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
import org.openhab.binding.upnpav.internal.exception.MissingRequiredFieldException;
import org.openhab.binding.upnpav.internal.xml.XmlNamespaces;
import org.openhab.binding.upnpav.internal.xml.XmlUtils;
import org.w3c.dom.Element;

/**
 * A potentially heterogeneous collection of storage media ({@code object.container.storageSystem}).
 * All capacity fields are mandatory.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class StorageSystem extends DidlContainer {

    public static final String UPNP_CLASS = DidlContainer.UPNP_CLASS + ".storageSystem";

    private @Nullable Long storageTotal;
    private @Nullable Long storageUsed;
    private @Nullable Long storageFree;
    private @Nullable Long storageMaxPartition;
    private @Nullable String storageMedium;

    public StorageSystem() {
        super(UPNP_CLASS);
    }

    @Override
    protected void readElement(Element element) throws DidlMetadataException {
        super.readElement(element);
        String className = getClass().getSimpleName();
        storageTotal = requiredLong(element, className, XmlNamespaces.UPNP, "storageTotal");
        storageUsed = requiredLong(element, className, XmlNamespaces.UPNP, "storageUsed");
        storageFree = requiredLong(element, className, XmlNamespaces.UPNP, "storageFree");
        storageMaxPartition = requiredLong(element, className, XmlNamespaces.UPNP, "storageMaxPartition");
        storageMedium = requiredText(element, className, XmlNamespaces.UPNP, "storageMedium");
    }

    @Override
    protected void writeElement(Element element) throws DidlMetadataException {
        super.writeElement(element);
        String className = getClass().getSimpleName();
        appendRequired(element, className, "storageTotal", storageTotal);
        appendRequired(element, className, "storageUsed", storageUsed);
        appendRequired(element, className, "storageFree", storageFree);
        appendRequired(element, className, "storageMaxPartition", storageMaxPartition);
        appendRequired(element, className, "storageMedium", storageMedium);
    }

    static void appendRequired(Element element, String className, String localName, @Nullable Object value)
            throws MissingRequiredFieldException {
        if (value == null || value.toString().isEmpty()) {
            throw new MissingRequiredFieldException(className, "upnp:" + localName);
        }
        XmlUtils.appendTextElement(element, XmlNamespaces.UPNP, localName, value.toString());
    }

    public @Nullable Long getStorageTotal() {
        return storageTotal;
    }

    public void setStorageTotal(@Nullable Long storageTotal) {
        this.storageTotal = storageTotal;
    }

    public @Nullable Long getStorageUsed() {
        return storageUsed;
    }

    public void setStorageUsed(@Nullable Long storageUsed) {
        this.storageUsed = storageUsed;
    }

    public @Nullable Long getStorageFree() {
        return storageFree;
    }

    public void setStorageFree(@Nullable Long storageFree) {
        this.storageFree = storageFree;
    }

    public @Nullable Long getStorageMaxPartition() {
        return storageMaxPartition;
    }

    public void setStorageMaxPartition(@Nullable Long storageMaxPartition) {
        this.storageMaxPartition = storageMaxPartition;
    }

    public @Nullable String getStorageMedium() {
        return storageMedium;
    }

    public void setStorageMedium(@Nullable String storageMedium) {
        this.storageMedium = storageMedium;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!super.equals(obj)) {
            return false;
        }
        StorageSystem other = (StorageSystem) Objects.requireNonNull(obj);
        return Objects.equals(storageTotal, other.storageTotal) && Objects.equals(storageUsed, other.storageUsed)
                && Objects.equals(storageFree, other.storageFree)
                && Objects.equals(storageMaxPartition, other.storageMaxPartition)
                && Objects.equals(storageMedium, other.storageMedium);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), storageTotal, storageUsed, storageFree, storageMaxPartition,
                storageMedium);
    }
}
