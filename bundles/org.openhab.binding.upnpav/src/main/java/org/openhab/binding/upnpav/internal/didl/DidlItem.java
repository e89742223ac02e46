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

import static org.openhab.binding.upnpav.internal.UpnpAvBindingConstants.ELEMENT_ITEM;

import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.upnpav.internal.exception.DidlMetadataException;
import org.openhab.binding.upnpav.internal.xml.XmlUtils;
import org.w3c.dom.Element;

/**
 * An atomic content object ({@code object.item}).
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class DidlItem extends DidlObject {

    public static final String UPNP_CLASS = DidlObject.UPNP_CLASS + ".item";

    private static final String ATTR_REF_ID = "refID";

    private String refId = "";

    public DidlItem() {
        this(UPNP_CLASS);
    }

    protected DidlItem(String upnpClass) {
        super(upnpClass);
    }

    @Override
    public String getElementName() {
        return ELEMENT_ITEM;
    }

    @Override
    protected void readElement(Element element) throws DidlMetadataException {
        super.readElement(element);
        String ref = XmlUtils.optionalAttribute(element, ATTR_REF_ID);
        refId = ref == null ? "" : ref;
    }

    @Override
    protected void writeElement(Element element) throws DidlMetadataException {
        super.writeElement(element);
        if (!refId.isEmpty()) {
            XmlUtils.setAttribute(element, ATTR_REF_ID, refId);
        }
    }

    /**
     * @return the value of the first resource, or an empty string if there is none
     */
    public String getUri() {
        return getResources().isEmpty() ? "" : getResources().get(0).getValue();
    }

    public String getRefId() {
        return refId;
    }

    public void setRefId(String refId) {
        this.refId = refId;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        return super.equals(obj) && refId.equals(((DidlItem) Objects.requireNonNull(obj)).refId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), refId);
    }
}
