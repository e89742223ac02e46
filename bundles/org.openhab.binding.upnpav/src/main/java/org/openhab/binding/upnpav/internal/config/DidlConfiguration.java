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
package org.openhab.binding.upnpav.internal.config;

import static org.openhab.binding.upnpav.internal.UpnpAvBindingConstants.*;

import java.util.Map;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

/**
 * Parser and serializer options for DIDL-Lite metadata.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class DidlConfiguration {

    public static final boolean DEFAULT_APPLY_RESOURCE_QUIRKS = true;
    public static final boolean DEFAULT_SKIP_ILLEGAL_CHILDREN = false;
    public static final boolean DEFAULT_PRETTY_PRINT = false;

    /**
     * Repair resources without protocolInfo before validating them.
     */
    private boolean applyResourceQuirks = DEFAULT_APPLY_RESOURCE_QUIRKS;

    /**
     * Skip envelope children other than item and container instead of failing.
     */
    private boolean skipIllegalChildren = DEFAULT_SKIP_ILLEGAL_CHILDREN;

    private boolean prettyPrint = DEFAULT_PRETTY_PRINT;

    public static DidlConfiguration defaults() {
        return new DidlConfiguration();
    }

    /**
     * Creates a configuration from key/value pairs. Values may be {@link Boolean}s or strings; unknown keys and
     * values of other types are ignored.
     *
     * @param config the configuration properties
     * @return A new configuration instance
     */
    public static DidlConfiguration fromConfiguration(Map<String, Object> config) {
        DidlConfiguration didlConfig = new DidlConfiguration();

        Boolean quirks = toBoolean(config.get(CONFIG_APPLY_RESOURCE_QUIRKS));
        if (quirks != null) {
            didlConfig.applyResourceQuirks = quirks;
        }

        Boolean skip = toBoolean(config.get(CONFIG_SKIP_ILLEGAL_CHILDREN));
        if (skip != null) {
            didlConfig.skipIllegalChildren = skip;
        }

        Boolean pretty = toBoolean(config.get(CONFIG_PRETTY_PRINT));
        if (pretty != null) {
            didlConfig.prettyPrint = pretty;
        }

        return didlConfig;
    }

    private static @Nullable Boolean toBoolean(@Nullable Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.valueOf(((String) value).trim());
        }
        return null;
    }

    public DidlConfiguration withApplyResourceQuirks(boolean applyResourceQuirks) {
        DidlConfiguration copy = copy();
        copy.applyResourceQuirks = applyResourceQuirks;
        return copy;
    }

    public DidlConfiguration withSkipIllegalChildren(boolean skipIllegalChildren) {
        DidlConfiguration copy = copy();
        copy.skipIllegalChildren = skipIllegalChildren;
        return copy;
    }

    public DidlConfiguration withPrettyPrint(boolean prettyPrint) {
        DidlConfiguration copy = copy();
        copy.prettyPrint = prettyPrint;
        return copy;
    }

    private DidlConfiguration copy() {
        DidlConfiguration copy = new DidlConfiguration();
        copy.applyResourceQuirks = applyResourceQuirks;
        copy.skipIllegalChildren = skipIllegalChildren;
        copy.prettyPrint = prettyPrint;
        return copy;
    }

    // ---- Getters ----

    public boolean isApplyResourceQuirks() {
        return applyResourceQuirks;
    }

    public boolean isSkipIllegalChildren() {
        return skipIllegalChildren;
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    @Override
    public String toString() {
        return String.format("DidlConfiguration [applyResourceQuirks=%s, skipIllegalChildren=%s, prettyPrint=%s]",
                applyResourceQuirks, skipIllegalChildren, prettyPrint);
    }
}
