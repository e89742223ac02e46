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

import static org.openhab.binding.upnpav.internal.UpnpAvBindingConstants.ELEMENT_RES;

import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.upnpav.internal.exception.DidlMetadataException;
import org.openhab.binding.upnpav.internal.exception.MissingRequiredAttributeException;
import org.openhab.binding.upnpav.internal.xml.XmlNamespaces;
import org.openhab.binding.upnpav.internal.xml.XmlUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * A playable resource of a DIDL-Lite object, the {@code res} element.
 * <p>
 * The element text is the resource URI, the attributes describe the protocol and media properties.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class Resource {

    private static final String ATTR_PROTOCOL_INFO = "protocolInfo";
    private static final String ATTR_IMPORT_URI = "importUri";
    private static final String ATTR_SIZE = "size";
    private static final String ATTR_DURATION = "duration";
    private static final String ATTR_BITRATE = "bitrate";
    private static final String ATTR_SAMPLE_FREQUENCY = "sampleFrequency";
    private static final String ATTR_BITS_PER_SAMPLE = "bitsPerSample";
    private static final String ATTR_NR_AUDIO_CHANNELS = "nrAudioChannels";
    private static final String ATTR_RESOLUTION = "resolution";
    private static final String ATTR_COLOR_DEPTH = "colorDepth";
    private static final String ATTR_PROTECTION = "protection";

    private String value = "";
    private String protocolInfo = "";
    private @Nullable String importUri;
    private @Nullable Long size;
    private @Nullable String duration;
    private @Nullable Integer bitrate;
    private @Nullable Integer sampleFrequency;
    private @Nullable Integer bitsPerSample;
    private @Nullable Integer nrAudioChannels;
    private @Nullable String resolution;
    private @Nullable Integer colorDepth;
    private @Nullable String protection;

    public Resource() {
    }

    public Resource(String value, String protocolInfo) {
        this.value = value;
        this.protocolInfo = protocolInfo;
    }

    /**
     * Builds a resource from a {@code res} element.
     *
     * @throws MissingRequiredAttributeException if {@code protocolInfo} is absent
     * @throws DidlMetadataException if a numeric attribute does not hold a number
     */
    public static Resource fromElement(Element element) throws DidlMetadataException {
        if (!element.hasAttribute(ATTR_PROTOCOL_INFO)) {
            throw new MissingRequiredAttributeException(Resource.class.getSimpleName(), ATTR_PROTOCOL_INFO);
        }
        Resource resource = new Resource(element.getTextContent(), element.getAttribute(ATTR_PROTOCOL_INFO));
        resource.importUri = XmlUtils.optionalAttribute(element, ATTR_IMPORT_URI);
        resource.size = parseLong(element, ATTR_SIZE);
        resource.duration = XmlUtils.optionalAttribute(element, ATTR_DURATION);
        resource.bitrate = parseInteger(element, ATTR_BITRATE);
        resource.sampleFrequency = parseInteger(element, ATTR_SAMPLE_FREQUENCY);
        resource.bitsPerSample = parseInteger(element, ATTR_BITS_PER_SAMPLE);
        resource.nrAudioChannels = parseInteger(element, ATTR_NR_AUDIO_CHANNELS);
        resource.resolution = XmlUtils.optionalAttribute(element, ATTR_RESOLUTION);
        resource.colorDepth = parseInteger(element, ATTR_COLOR_DEPTH);
        resource.protection = XmlUtils.optionalAttribute(element, ATTR_PROTECTION);
        return resource;
    }

    /**
     * Builds a resource from a standalone {@code res} document.
     */
    public static Resource fromString(String xml) throws DidlMetadataException {
        return fromElement(XmlUtils.parse(xml).getDocumentElement());
    }

    public Element toElement(Document document) throws DidlMetadataException {
        if (protocolInfo.isEmpty()) {
            throw new MissingRequiredAttributeException(Resource.class.getSimpleName(), ATTR_PROTOCOL_INFO);
        }
        Element element = XmlUtils.createElement(document, XmlNamespaces.DIDL, ELEMENT_RES);
        XmlUtils.setAttribute(element, ATTR_PROTOCOL_INFO, protocolInfo);
        setOptionalAttribute(element, ATTR_IMPORT_URI, importUri);
        setOptionalAttribute(element, ATTR_SIZE, size);
        setOptionalAttribute(element, ATTR_DURATION, duration);
        setOptionalAttribute(element, ATTR_BITRATE, bitrate);
        setOptionalAttribute(element, ATTR_SAMPLE_FREQUENCY, sampleFrequency);
        setOptionalAttribute(element, ATTR_BITS_PER_SAMPLE, bitsPerSample);
        setOptionalAttribute(element, ATTR_NR_AUDIO_CHANNELS, nrAudioChannels);
        setOptionalAttribute(element, ATTR_RESOLUTION, resolution);
        setOptionalAttribute(element, ATTR_COLOR_DEPTH, colorDepth);
        setOptionalAttribute(element, ATTR_PROTECTION, protection);
        element.setTextContent(XmlUtils.filterIllegalXmlChars(value));
        return element;
    }

    public String toXmlString() throws DidlMetadataException {
        Document document = XmlUtils.newDocument();
        Element element = toElement(document);
        document.appendChild(element);
        return XmlUtils.toXmlString(element);
    }

    private static void setOptionalAttribute(Element element, String name, @Nullable Object value) {
        if (value != null && !value.toString().isEmpty()) {
            XmlUtils.setAttribute(element, name, value.toString());
        }
    }

    private static @Nullable Integer parseInteger(Element element, String name) throws DidlMetadataException {
        String text = XmlUtils.optionalAttribute(element, name);
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(text.trim());
        } catch (NumberFormatException e) {
            throw new DidlMetadataException(String.format("Invalid value '%s' for res attribute '%s'", text, name),
                    e);
        }
    }

    private static @Nullable Long parseLong(Element element, String name) throws DidlMetadataException {
        String text = XmlUtils.optionalAttribute(element, name);
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return Long.valueOf(text.trim());
        } catch (NumberFormatException e) {
            throw new DidlMetadataException(String.format("Invalid value '%s' for res attribute '%s'", text, name),
                    e);
        }
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public String getProtocolInfo() {
        return protocolInfo;
    }

    public void setProtocolInfo(String protocolInfo) {
        this.protocolInfo = protocolInfo;
    }

    public @Nullable String getImportUri() {
        return importUri;
    }

    public void setImportUri(@Nullable String importUri) {
        this.importUri = importUri;
    }

    public @Nullable Long getSize() {
        return size;
    }

    public void setSize(@Nullable Long size) {
        this.size = size;
    }

    /**
     * @return the playback duration as {@code H:MM:SS[.F]}
     */
    public @Nullable String getDuration() {
        return duration;
    }

    public void setDuration(@Nullable String duration) {
        this.duration = duration;
    }

    public @Nullable Integer getBitrate() {
        return bitrate;
    }

    public void setBitrate(@Nullable Integer bitrate) {
        this.bitrate = bitrate;
    }

    public @Nullable Integer getSampleFrequency() {
        return sampleFrequency;
    }

    public void setSampleFrequency(@Nullable Integer sampleFrequency) {
        this.sampleFrequency = sampleFrequency;
    }

    public @Nullable Integer getBitsPerSample() {
        return bitsPerSample;
    }

    public void setBitsPerSample(@Nullable Integer bitsPerSample) {
        this.bitsPerSample = bitsPerSample;
    }

    public @Nullable Integer getNrAudioChannels() {
        return nrAudioChannels;
    }

    public void setNrAudioChannels(@Nullable Integer nrAudioChannels) {
        this.nrAudioChannels = nrAudioChannels;
    }

    /**
     * @return the resolution as {@code X*Y}
     */
    public @Nullable String getResolution() {
        return resolution;
    }

    public void setResolution(@Nullable String resolution) {
        this.resolution = resolution;
    }

    public @Nullable Integer getColorDepth() {
        return colorDepth;
    }

    public void setColorDepth(@Nullable Integer colorDepth) {
        this.colorDepth = colorDepth;
    }

    public @Nullable String getProtection() {
        return protection;
    }

    public void setProtection(@Nullable String protection) {
        this.protection = protection;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Resource)) {
            return false;
        }
        Resource other = (Resource) obj;
        return value.equals(other.value) && protocolInfo.equals(other.protocolInfo)
                && Objects.equals(importUri, other.importUri) && Objects.equals(size, other.size)
                && Objects.equals(duration, other.duration) && Objects.equals(bitrate, other.bitrate)
                && Objects.equals(sampleFrequency, other.sampleFrequency)
                && Objects.equals(bitsPerSample, other.bitsPerSample)
                && Objects.equals(nrAudioChannels, other.nrAudioChannels)
                && Objects.equals(resolution, other.resolution) && Objects.equals(colorDepth, other.colorDepth)
                && Objects.equals(protection, other.protection);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, protocolInfo, importUri, size, duration, bitrate, sampleFrequency, bitsPerSample,
                nrAudioChannels, resolution, colorDepth, protection);
    }

    @Override
    public String toString() {
        return String.format("Resource[value=%s, protocolInfo=%s]", value, protocolInfo);
    }
}
