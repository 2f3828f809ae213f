/*******************************************************************************
 * Copyright (c) 2023 Contributors to the Eclipse Foundation
 *
 * See the NOTICE file(s) distributed with this work for additional
 * information regarding copyright ownership.
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which is available at
 * http://www.eclipse.org/legal/epl-2.0
 *
 * SPDX-License-Identifier: EPL-2.0
 *******************************************************************************/

package org.eclipse.lorabroker.packet;

import java.util.Arrays;
import java.util.Objects;

import com.google.common.io.BaseEncoding;

/**
 * A globally unique 64 bit identifier (EUI-64) of an application or a device.
 */
public final class Eui64 {

    /**
     * The number of bytes of an identifier.
     */
    public static final int SIZE = 8;

    private final byte[] bytes;

    private Eui64(final byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Creates an identifier from its raw bytes.
     *
     * @param bytes The bytes (copied).
     * @return The identifier.
     * @throws NullPointerException if bytes is {@code null}.
     * @throws IllegalArgumentException if bytes does not contain exactly {@value #SIZE} bytes.
     */
    public static Eui64 of(final byte[] bytes) {
        Objects.requireNonNull(bytes);
        if (bytes.length != SIZE) {
            throw new IllegalArgumentException("EUI-64 must consist of " + SIZE + " bytes");
        }
        return new Eui64(bytes.clone());
    }

    /**
     * Creates an identifier from its hex representation.
     *
     * @param hex The hex string, e.g. {@code 70B3D57ED0000001}.
     * @return The identifier.
     * @throws NullPointerException if hex is {@code null}.
     * @throws IllegalArgumentException if hex is not a valid 8 byte hex string.
     */
    public static Eui64 fromString(final String hex) {
        Objects.requireNonNull(hex);
        return of(BaseEncoding.base16().decode(hex.toUpperCase()));
    }

    /**
     * Gets the raw bytes of this identifier.
     *
     * @return A copy of the bytes.
     */
    public byte[] getBytes() {
        return bytes.clone();
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Eui64)) {
            return false;
        }
        return Arrays.equals(bytes, ((Eui64) obj).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return BaseEncoding.base16().encode(bytes);
    }
}
