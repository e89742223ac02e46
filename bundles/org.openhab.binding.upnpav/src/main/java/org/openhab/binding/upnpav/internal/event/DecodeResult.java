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

import java.util.Optional;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

/**
 * Outcome of decoding an event payload: either a value or the reason decoding failed.
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class DecodeResult<T> {

    private final @Nullable T value;
    private final @Nullable String errorMessage;
    private final @Nullable Exception error;

    private DecodeResult(@Nullable T value, @Nullable String errorMessage, @Nullable Exception error) {
        this.value = value;
        this.errorMessage = errorMessage;
        this.error = error;
    }

    public static <T> DecodeResult<T> success(T value) {
        return new DecodeResult<>(value, null, null);
    }

    public static <T> DecodeResult<T> failure(String message) {
        return new DecodeResult<>(null, message, null);
    }

    public static <T> DecodeResult<T> failure(String message, Exception cause) {
        return new DecodeResult<>(null, message, cause);
    }

    public boolean isSuccess() {
        return value != null;
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    public Optional<Exception> getError() {
        return Optional.ofNullable(error);
    }

    public String getErrorMessage() {
        String message = errorMessage;
        if (message != null) {
            return message;
        }
        Exception cause = error;
        if (cause != null) {
            String causeMessage = cause.getMessage();
            return causeMessage != null ? causeMessage : cause.getClass().getSimpleName();
        }
        return "Unknown error";
    }

    @Override
    public String toString() {
        return isSuccess() ? "DecodeResult[success]" : "DecodeResult[failure: " + getErrorMessage() + "]";
    }
}
