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

/**
 * A 128 bit AES key, e.g. a device's network session key.
 * <p>
 * The string representation of a key never contains the key material.
 */
public final class Aes128Key {

    /**
     * The number of bytes of a key.
     */
    public static final int SIZE = 16;

    private final byte[] bytes;

    private Aes128Key(final byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Creates a key from its raw bytes.
     *
     * @param bytes The bytes (copied).
     * @return The key.
     * @throws NullPointerException if bytes is {@code null}.
     * @throws IllegalArgumentException if bytes does not contain exactly {@value #SIZE} bytes.
     */
    public static Aes128Key of(final byte[] bytes) {
        Objects.requireNonNull(bytes);
        if (bytes.length != SIZE) {
            throw new IllegalArgumentException("AES-128 key must consist of " + SIZE + " bytes");
        }
        return new Aes128Key(bytes.clone());
    }

    /**
     * Gets the key material.
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
        if (!(obj instanceof Aes128Key)) {
            return false;
        }
        return Arrays.equals(bytes, ((Aes128Key) obj).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "Aes128Key[****]";
    }
}
