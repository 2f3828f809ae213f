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
 * A LoRaWAN device address.
 * <p>
 * The address is not unique: several devices may share it. It only narrows the set of
 * candidates that need to be checked when authenticating a packet and must never be
 * taken as proof of a device's identity.
 */
public final class DevAddr {

    /**
     * The number of bytes of an address.
     */
    public static final int SIZE = 4;

    private final byte[] bytes;

    private DevAddr(final byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Creates an address from its raw bytes.
     *
     * @param bytes The bytes (copied).
     * @return The address.
     * @throws NullPointerException if bytes is {@code null}.
     * @throws IllegalArgumentException if bytes does not contain exactly {@value #SIZE} bytes.
     */
    public static DevAddr of(final byte[] bytes) {
        Objects.requireNonNull(bytes);
        if (bytes.length != SIZE) {
            throw new IllegalArgumentException("device address must consist of " + SIZE + " bytes");
        }
        return new DevAddr(bytes.clone());
    }

    /**
     * Creates an address from its hex representation.
     *
     * @param hex The hex string, e.g. {@code 26011BDA}.
     * @return The address.
     * @throws NullPointerException if hex is {@code null}.
     * @throws IllegalArgumentException if hex is not a valid 4 byte hex string.
     */
    public static DevAddr fromString(final String hex) {
        Objects.requireNonNull(hex);
        return of(BaseEncoding.base16().decode(hex.toUpperCase()));
    }

    /**
     * Gets the raw bytes of this address.
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
        if (!(obj instanceof DevAddr)) {
            return false;
        }
        return Arrays.equals(bytes, ((DevAddr) obj).bytes);
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
