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
 * Audio content of a book ({@code object.item.audioItem.audioBook}).
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class AudioBook extends AudioItem {

    public static final String UPNP_CLASS = AudioItem.UPNP_CLASS + ".audioBook";

    private List<String> producers = new ArrayList<>();
    private List<String> contributors = new ArrayList<>();
    private @Nullable String date;
    private @Nullable String storageMedium;

    public AudioBook() {
        super(UPNP_CLASS);
    }

    @Override
    protected void readElement(Element element) throws DidlMetadataException {
        super.readElement(element);
        producers = XmlUtils.findAllChildText(element, XmlNamespaces.UPNP, "producer");
        contributors = XmlUtils.findAllChildText(element, XmlNamespaces.DC, "contributor");
        date = XmlUtils.optionalChildText(element, XmlNamespaces.DC, "date");
        storageMedium = XmlUtils.optionalChildText(element, XmlNamespaces.UPNP, "storageMedium");
    }

    @Override
    protected void writeElement(Element element) throws DidlMetadataException {
        super.writeElement(element);
        XmlUtils.appendTextElements(element, XmlNamespaces.UPNP, "producer", producers);
        XmlUtils.appendTextElements(element, XmlNamespaces.DC, "contributor", contributors);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.DC, "date", date);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.UPNP, "storageMedium", storageMedium);
    }

    public List<String> getProducers() {
        return producers;
    }

    public List<String> getContributors() {
        return contributors;
    }

    public @Nullable String getDate() {
        return date;
    }

    public void setDate(@Nullable String date) {
        this.date = date;
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
        AudioBook other = (AudioBook) Objects.requireNonNull(obj);
        return producers.equals(other.producers) && contributors.equals(other.contributors)
                && Objects.equals(date, other.date) && Objects.equals(storageMedium, other.storageMedium);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), producers, contributors, date, storageMedium);
    }
}
