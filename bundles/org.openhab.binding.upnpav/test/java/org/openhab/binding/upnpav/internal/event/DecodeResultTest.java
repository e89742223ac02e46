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

import static org.junit.jupiter.api.Assertions.*;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link DecodeResult}
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class DecodeResultTest {

    @Test
    public void testSuccess() {
        DecodeResult<String> result = DecodeResult.success("PLAYING");
        assertTrue(result.isSuccess());
        assertEquals("PLAYING", result.getValue().orElseThrow());
        assertFalse(result.getError().isPresent());
        assertEquals("DecodeResult[success]", result.toString());
    }

    @Test
    public void testFailureWithMessage() {
        DecodeResult<String> result = DecodeResult.failure("Empty LastChange payload");
        assertFalse(result.isSuccess());
        assertFalse(result.getValue().isPresent());
        assertEquals("Empty LastChange payload", result.getErrorMessage());
        assertEquals("DecodeResult[failure: Empty LastChange payload]", result.toString());
    }

    @Test
    public void testFailureWithCause() {
        IllegalArgumentException cause = new IllegalArgumentException("bad");
        DecodeResult<String> result = DecodeResult.failure("Could not decode", cause);
        assertSame(cause, result.getError().orElseThrow());
        assertEquals("Could not decode", result.getErrorMessage());
    }
}
