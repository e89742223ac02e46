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

import static org.openhab.binding.upnpav.internal.UpnpAvBindingConstants.*;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans evented state variables out to registered listeners.
 * <p>
 * Every variable goes to the {@link UpnpAvEventListener}s. An AVTransport {@code LastChange} variable is also
 * decoded and, when that succeeds, handed to the {@link LastChangeListener}s. A failing listener is logged and
 * does not keep the others from being notified.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class UpnpEventDispatcher implements UpnpAvEventListener {

    private final Logger logger = LoggerFactory.getLogger(UpnpEventDispatcher.class);

    private final List<UpnpAvEventListener> eventListeners = new CopyOnWriteArrayList<>();
    private final List<LastChangeListener> lastChangeListeners = new CopyOnWriteArrayList<>();
    private final UpnpEventParser eventParser;

    public UpnpEventDispatcher() {
        this(new UpnpEventParser());
    }

    public UpnpEventDispatcher(UpnpEventParser eventParser) {
        this.eventParser = eventParser;
    }

    public void addEventListener(UpnpAvEventListener listener) {
        if (!eventListeners.contains(listener)) {
            eventListeners.add(listener);
        }
    }

    public void removeEventListener(UpnpAvEventListener listener) {
        eventListeners.remove(listener);
    }

    public void addLastChangeListener(LastChangeListener listener) {
        if (!lastChangeListeners.contains(listener)) {
            lastChangeListeners.add(listener);
        }
    }

    public void removeLastChangeListener(LastChangeListener listener) {
        lastChangeListeners.remove(listener);
    }

    /**
     * Parses a NOTIFY body and dispatches each of its variables, including the ones nested in a
     * {@code LastChange} document.
     *
     * @return false if the body could not be parsed
     */
    public boolean dispatch(String service, String notifyBody) {
        DecodeResult<UpnpEventVariables> result = eventParser.parse(notifyBody);
        UpnpEventVariables variables = result.getValue().orElse(null);
        if (variables == null) {
            logger.debug("Dropping {} event: {}", service, result.getErrorMessage());
            return false;
        }
        for (Map.Entry<String, String> entry : variables.getValues().entrySet()) {
            onEventReceived(service, entry.getKey(), entry.getValue());
        }
        return true;
    }

    @Override
    public void onEventReceived(String service, String variable, String value) {
        logger.trace("Event from {}: {} = {}", service, variable, value);
        for (UpnpAvEventListener listener : eventListeners) {
            try {
                listener.onEventReceived(service, variable, value);
            } catch (RuntimeException e) {
                logger.warn("Event listener failed on {} {}: {}", service, variable, e.getMessage(), e);
            }
        }
        if (isAvTransport(service) && VARIABLE_LAST_CHANGE.equals(variable) && !lastChangeListeners.isEmpty()) {
            DecodeResult<LastChangeEvent> decoded = LastChangeDecoder.decode(value);
            LastChangeEvent event = decoded.getValue().orElse(null);
            if (event == null) {
                logger.debug("Ignoring undecodable LastChange from {}: {}", service, decoded.getErrorMessage());
                return;
            }
            for (LastChangeListener listener : lastChangeListeners) {
                try {
                    listener.onLastChange(event);
                } catch (RuntimeException e) {
                    logger.warn("LastChange listener failed: {}", e.getMessage(), e);
                }
            }
        }
    }

    private static boolean isAvTransport(String service) {
        return SERVICE_AVTRANSPORT.equals(service) || service.contains("AVTransport");
    }
}
