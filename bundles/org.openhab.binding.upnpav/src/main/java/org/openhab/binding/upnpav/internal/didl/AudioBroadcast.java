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
import org.openhab.binding.upnpav.internal.xml.XmlUtils;
import org.w3c.dom.Element;

/**
 * A continuous radio stream ({@code object.item.audioItem.audioBroadcast}).
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class AudioBroadcast extends AudioItem {

    public static final String UPNP_CLASS = AudioItem.UPNP_CLASS + ".audioBroadcast";

    private @Nullable String region;
    private @Nullable String radioCallSign;
    private @Nullable String radioStationId;
    private @Nullable String radioBand;
    private @Nullable Integer channelNr;

    public AudioBroadcast() {
        super(UPNP_CLASS);
    }

    @Override
    protected void readElement(Element element) throws DidlMetadataException {
        super.readElement(element);
        region = XmlUtils.optionalChildText(element, XmlNamespaces.UPNP, "region");
        radioCallSign = XmlUtils.optionalChildText(element, XmlNamespaces.UPNP, "radioCallSign");
        radioStationId = XmlUtils.optionalChildText(element, XmlNamespaces.UPNP, "radioStationID");
        radioBand = XmlUtils.optionalChildText(element, XmlNamespaces.UPNP, "radioBand");
        channelNr = optionalInteger(element, XmlNamespaces.UPNP, "channelNr");
    }

    @Override
    protected void writeElement(Element element) throws DidlMetadataException {
        super.writeElement(element);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.UPNP, "region", region);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.UPNP, "radioCallSign", radioCallSign);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.UPNP, "radioStationID", radioStationId);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.UPNP, "radioBand", radioBand);
        XmlUtils.appendOptionalTextElement(element, XmlNamespaces.UPNP, "channelNr", channelNr);
    }

    public @Nullable String getRegion() {
        return region;
    }

    public void setRegion(@Nullable String region) {
        this.region = region;
    }

    public @Nullable String getRadioCallSign() {
        return radioCallSign;
    }

    public void setRadioCallSign(@Nullable String radioCallSign) {
        this.radioCallSign = radioCallSign;
    }

    public @Nullable String getRadioStationId() {
        return radioStationId;
    }

    public void setRadioStationId(@Nullable String radioStationId) {
        this.radioStationId = radioStationId;
    }

    public @Nullable String getRadioBand() {
        return radioBand;
    }

    public void setRadioBand(@Nullable String radioBand) {
        this.radioBand = radioBand;
    }

    public @Nullable Integer getChannelNr() {
        return channelNr;
    }

    public void setChannelNr(@Nullable Integer channelNr) {
        this.channelNr = channelNr;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!super.equals(obj)) {
            return false;
        }
        AudioBroadcast other = (AudioBroadcast) Objects.requireNonNull(obj);
        return Objects.equals(region, other.region) && Objects.equals(radioCallSign, other.radioCallSign)
                && Objects.equals(radioStationId, other.radioStationId) && Objects.equals(radioBand, other.radioBand)
                && Objects.equals(channelNr, other.channelNr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), region, radioCallSign, radioStationId, radioBand, channelNr);
    }
}
