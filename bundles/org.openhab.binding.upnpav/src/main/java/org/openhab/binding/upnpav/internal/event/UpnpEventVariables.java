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
package org.openhab.binding.upnpav.internal.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.upnpav.internal.didl.DidlObject;

/**
 * The evented state variables of one GENA NOTIFY message.
 * <p>
 * Variables nested in a {@code LastChange} document are flattened next to the top-level ones. Variables
 * reported per channel (Volume, Mute, ...) are available through {@link #getChannelValues(String)}, and
 * DIDL-Lite values that could be parsed are also available as typed objects.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class UpnpEventVariables {

    private final Map<String, String> values = new LinkedHashMap<>();
    private final Map<String, Map<String, String>> channelValues = new LinkedHashMap<>();
    private final Map<String, DidlObject> metadata = new LinkedHashMap<>();

    void put(String name, String value) {
        values.put(name, value);
    }

    void putChannelValue(String name, String channel, String value) {
        channelValues.computeIfAbsent(name, k -> new LinkedHashMap<>()).put(channel, value);
    }

    void putMetadata(String name, DidlObject object) {
        metadata.put(name, object);
    }

    public Set<String> getVariableNames() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public Map<String, String> getValues() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * @return the raw value of a variable, or null if it was not evented or only per channel
     */
    public @Nullable String getValue(String name) {
        return values.get(name);
    }

    /**
     * @return the values of a per channel variable keyed by channel, empty if there are none
     */
    public Map<String, String> getChannelValues(String name) {
        Map<String, String> channels = channelValues.get(name);
        return channels == null ? Collections.emptyMap() : Collections.unmodifiableMap(channels);
    }

    public @Nullable DidlObject getMetadata(String name) {
        return metadata.get(name);
    }

    public boolean isEmpty() {
        return values.isEmpty() && channelValues.isEmpty();
    }

    @Override
    public String toString() {
        return "UpnpEventVariables[values=" + values.keySet() + ", channelValues=" + channelValues.keySet() + "]";
    }
}
