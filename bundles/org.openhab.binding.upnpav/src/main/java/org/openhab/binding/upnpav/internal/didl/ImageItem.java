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
import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.upnpav.internal.exception.DidlMetadataException;
import org.openhab.binding.upnpav.internal.xml.XmlNamespaces;
import org.openhab.binding.upnpav.internal.xml.XmlUtils;
import org.w3c.dom.Element;

/**
 * A still image ({@code object.item.imageItem}).
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class ImageItem extends DidlItem {

    public static final String UPNP_CLASS = DidlItem.UPNP_CLASS + ".imageItem";

    private @Nullable String longDescription;
    private @Nullable String storageMedium;
    private @Nullable String rating;
    private @Nullable String description;
    private @Nullable String date;
    private List<String> rights = new ArrayList<>();

    public ImageItem() {
        super(UPNP_CLASS);
    }

    @Override
    protected void readElement(Element element) throws DidlMetadataException {
        super.readElement(element);
        longDescription = XmlUtils.optionalChildText(element, XmlNamespaces.UPNP, "longDescription");
        storageMedium = XmlUtils.optionalChildText(element, XmlNamespaces.UPNP, "storageMedium");
        rating = XmlUtils.optionalChildText(element, XmlNamespaces.UPNP, "rating");
        description = XmlUtils.optionalChildText(element, XmlNamespaces.DC, "description");
        date = XmlUtils.optionalChildText(element, XmlNamespaces.DC, "date");
        rights = XmlUtils.findAllChildText(element, XmlNamespaces.DC, "rights");
    }

    @Override
    protected void writeElement(Element element) throws DidlMetadataException {
        super.writeElement(element);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.UPNP, "longDescription", longDescription);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.UPNP, "storageMedium", storageMedium);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.UPNP, "rating", rating);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.DC, "description", description);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.DC, "date", date);
        XmlUtils.appendTextElements(element, XmlNamespaces.DC, "rights", rights);
    }

    public @Nullable String getLongDescription() {
        return longDescription;
    }

    public void setLongDescription(@Nullable String longDescription) {
        this.longDescription = longDescription;
    }

    public @Nullable String getStorageMedium() {
        return storageMedium;
    }

    public void setStorageMedium(@Nullable String storageMedium) {
        this.storageMedium = storageMedium;
    }

    public @Nullable String getRating() {
        return rating;
    }

    public void setRating(@Nullable String rating) {
        this.rating = rating;
    }

    public @Nullable String getDescription() {
        return description;
    }

    public void setDescription(@Nullable String description) {
        this.description = description;
    }

    public @Nullable String getDate() {
        return date;
    }

    public void setDate(@Nullable String date) {
        this.date = date;
    }

    public List<String> getRights() {
        return rights;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!super.equals(obj)) {
            return false;
        }
        ImageItem other = (ImageItem) Objects.requireNonNull(obj);
        return Objects.equals(longDescription, other.longDescription)
                && Objects.equals(storageMedium, other.storageMedium) && Objects.equals(rating, other.rating)
                && Objects.equals(description, other.description) && Objects.equals(date, other.date)
                && rights.equals(other.rights);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), longDescription, storageMedium, rating, description, date, rights);
    }
}
