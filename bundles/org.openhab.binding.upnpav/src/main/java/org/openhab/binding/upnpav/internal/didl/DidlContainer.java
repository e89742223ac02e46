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

import static org.openhab.binding.upnpav.internal.UpnpAvBindingConstants.ELEMENT_CONTAINER;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.upnpav.internal.exception.DidlMetadataException;
import org.openhab.binding.upnpav.internal.xml.XmlNamespaces;
import org.openhab.binding.upnpav.internal.xml.XmlUtils;
import org.w3c.dom.Element;

/**
 * An object that groups other objects ({@code object.container}).
 * <p>
 * Children added through {@link #addItem(DidlObject)} and {@link #addContainer(DidlObject)} are held in memory
 * only. They are never written to XML, but while any are held they define {@link #getChildCount()}.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class DidlContainer extends DidlObject {

    public static final String UPNP_CLASS = DidlObject.UPNP_CLASS + ".container";

    private static final String ATTR_CHILD_COUNT = "childCount";
    private static final String ATTR_SEARCHABLE = "searchable";

    private int childCount;
    private boolean searchable = true;
    private List<SearchClass> searchClasses = new ArrayList<>();
    private List<CreateClass> createClasses = new ArrayList<>();

    private final transient List<DidlObject> heldItems = new ArrayList<>();
    private final transient List<DidlObject> heldContainers = new ArrayList<>();

    public DidlContainer() {
        this(UPNP_CLASS);
    }

    protected DidlContainer(String upnpClass) {
        super(upnpClass);
    }

    @Override
    public String getElementName() {
        return ELEMENT_CONTAINER;
    }

    @Override
    protected void readElement(Element element) throws DidlMetadataException {
        super.readElement(element);
        String count = XmlUtils.optionalAttribute(element, ATTR_CHILD_COUNT);
        try {
            childCount = count == null || count.isBlank() ? 0 : Integer.parseInt(count.trim());
        } catch (NumberFormatException e) {
            throw new DidlMetadataException(String.format("Invalid childCount '%s'", count), e);
        }
        String searchableText = XmlUtils.optionalAttribute(element, ATTR_SEARCHABLE);
        searchable = searchableText != null && parseBoolean(searchableText);

        searchClasses = new ArrayList<>();
        for (Element child : XmlUtils.findChildren(element, XmlNamespaces.UPNP, "searchClass")) {
            searchClasses.add(SearchClass.fromElement(child));
        }
        createClasses = new ArrayList<>();
        for (Element child : XmlUtils.findChildren(element, XmlNamespaces.UPNP, "createClass")) {
            createClasses.add(CreateClass.fromElement(child));
        }
    }

    @Override
    protected void writeElement(Element element) throws DidlMetadataException {
        super.writeElement(element);
        XmlUtils.setAttribute(element, ATTR_CHILD_COUNT, Integer.toString(getChildCount()));
        XmlUtils.setAttribute(element, ATTR_SEARCHABLE, Boolean.toString(searchable));
        for (SearchClass searchClass : searchClasses) {
            element.appendChild(searchClass.toElement(element.getOwnerDocument()));
        }
        for (CreateClass createClass : createClasses) {
            element.appendChild(createClass.toElement(element.getOwnerDocument()));
        }
    }

    /**
     * Holds an item as a child of this container and points its parent id at this container.
     *
     * @return whether the item is accepted; a duplicate is accepted but not added twice
     */
    public boolean addItem(DidlObject item) {
        return hold(heldItems, item);
    }

    /**
     * Holds a container as a child of this container and points its parent id at this container.
     *
     * @return whether the container is accepted; a duplicate is accepted but not added twice
     */
    public boolean addContainer(DidlObject container) {
        return hold(heldContainers, container);
    }

    private boolean hold(List<DidlObject> children, DidlObject child) {
        // same instance only, equal but distinct children are each counted
        if (children.stream().noneMatch(held -> held == child)) {
            children.add(child);
            child.setParentId(getObjectId());
        }
        return true;
    }

    public List<DidlObject> getItems() {
        return Collections.unmodifiableList(heldItems);
    }

    public List<DidlObject> getContainers() {
        return Collections.unmodifiableList(heldContainers);
    }

    /**
     * @return the number of held children if any are held, otherwise the explicit counter
     */
    public int getChildCount() {
        int held = heldItems.size() + heldContainers.size();
        return held > 0 ? held : childCount;
    }

    public void setChildCount(int childCount) {
        this.childCount = childCount;
    }

    public boolean isSearchable() {
        return searchable;
    }

    public void setSearchable(boolean searchable) {
        this.searchable = searchable;
    }

    public List<SearchClass> getSearchClasses() {
        return searchClasses;
    }

    public List<CreateClass> getCreateClasses() {
        return createClasses;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!super.equals(obj)) {
            return false;
        }
        DidlContainer other = (DidlContainer) Objects.requireNonNull(obj);
        return getChildCount() == other.getChildCount() && searchable == other.searchable
                && searchClasses.equals(other.searchClasses) && createClasses.equals(other.createClasses);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), getChildCount(), searchable, searchClasses, createClasses);
    }
}
