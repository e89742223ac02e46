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
package org.openhab.binding.upnpav.internal.json;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.openhab.binding.upnpav.internal.didl.DidlClassResolver;
import org.openhab.binding.upnpav.internal.didl.DidlContainer;
import org.openhab.binding.upnpav.internal.didl.DidlObject;
import org.openhab.binding.upnpav.internal.exception.DidlMetadataException;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Converts DIDL-Lite objects to and from JSON. The {@code upnpClass} member selects the concrete type when
 * reading.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class DidlJsonConverter {

    private static final String MEMBER_UPNP_CLASS = "upnpClass";
    private static final String MEMBER_CHILD_COUNT = "childCount";

    private final Gson gson = new Gson();

    public JsonObject toJsonObject(DidlObject object) {
        JsonObject json = gson.toJsonTree(object).getAsJsonObject();
        if (object instanceof DidlContainer) {
            // held children are not serialized, their number is
            json.addProperty(MEMBER_CHILD_COUNT, ((DidlContainer) object).getChildCount());
        }
        return json;
    }

    public String toJson(DidlObject object) {
        return gson.toJson(toJsonObject(object));
    }

    public DidlObject fromJsonObject(JsonObject json) throws DidlMetadataException {
        JsonElement upnpClass = json.get(MEMBER_UPNP_CLASS);
        if (upnpClass == null || !upnpClass.isJsonPrimitive()) {
            throw new DidlMetadataException("JSON object has no " + MEMBER_UPNP_CLASS + " member");
        }
        Class<? extends DidlObject> type = DidlClassResolver.resolve(upnpClass.getAsString()).getType();
        try {
            DidlObject object = gson.fromJson(json, type);
            if (object == null) {
                throw new DidlMetadataException("JSON object could not be converted to " + type.getSimpleName());
            }
            return object;
        } catch (JsonParseException e) {
            throw new DidlMetadataException("Invalid JSON for " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * @throws DidlMetadataException if the JSON is malformed or names an unknown class
     */
    public DidlObject fromJson(String json) throws DidlMetadataException {
        try {
            JsonElement element = JsonParser.parseString(json);
            if (!element.isJsonObject()) {
                throw new DidlMetadataException("Expected a JSON object");
            }
            return fromJsonObject(element.getAsJsonObject());
        } catch (JsonParseException e) {
            throw new DidlMetadataException("Invalid JSON: " + e.getMessage(), e);
        }
    }
}
