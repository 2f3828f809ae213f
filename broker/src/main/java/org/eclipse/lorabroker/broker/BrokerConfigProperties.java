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

package org.eclipse.lorabroker.broker;

import java.util.Objects;

import org.eclipse.lorabroker.packet.UplinkPacketCodec;

/**
 * Properties for configuring the broker.
 */
public class BrokerConfigProperties {

    /**
     * The largest size that can be expressed by a length field of the wire format.
     */
    public static final int MAX_FIELD_SIZE = 0xFFFF;

    private int maxPayloadSize = UplinkPacketCodec.DEFAULT_MAX_PAYLOAD_SIZE;
    private int maxMetadataSize = UplinkPacketCodec.DEFAULT_MAX_METADATA_SIZE;

    /**
     * Creates properties using default values.
     */
    public BrokerConfigProperties() {
        super();
    }

    /**
     * Creates properties using existing options.
     *
     * @param options The options to copy.
     * @throws NullPointerException if options is {@code null}.
     * @throws IllegalArgumentException if any of the options has an invalid value.
     */
    public BrokerConfigProperties(final BrokerOptions options) {
        super();
        Objects.requireNonNull(options);
        setMaxPayloadSize(options.maxPayloadSize());
        setMaxMetadataSize(options.maxMetadataSize());
    }

    /**
     * Gets the maximum number of bytes of an uplink packet's application payload.
     * <p>
     * The default value of this property is {@value UplinkPacketCodec#DEFAULT_MAX_PAYLOAD_SIZE}.
     *
     * @return The number of bytes.
     */
    public final int getMaxPayloadSize() {
        return maxPayloadSize;
    }

    /**
     * Sets the maximum number of bytes of an uplink packet's application payload.
     * <p>
     * The default value of this property is {@value UplinkPacketCodec#DEFAULT_MAX_PAYLOAD_SIZE}.
     *
     * @param size The number of bytes.
     * @throws IllegalArgumentException if size is not within [1, {@value #MAX_FIELD_SIZE}].
     */
    public final void setMaxPayloadSize(final int size) {
        this.maxPayloadSize = checkFieldSize(size, "max payload size");
    }

    /**
     * Gets the maximum number of bytes of an uplink packet's serialized metadata.
     * <p>
     * The default value of this property is {@value UplinkPacketCodec#DEFAULT_MAX_METADATA_SIZE}.
     *
     * @return The number of bytes.
     */
    public final int getMaxMetadataSize() {
        return maxMetadataSize;
    }

    /**
     * Sets the maximum number of bytes of an uplink packet's serialized metadata.
     * <p>
     * The default value of this property is {@value UplinkPacketCodec#DEFAULT_MAX_METADATA_SIZE}.
     *
     * @param size The number of bytes.
     * @throws IllegalArgumentException if size is not within [1, {@value #MAX_FIELD_SIZE}].
     */
    public final void setMaxMetadataSize(final int size) {
        this.maxMetadataSize = checkFieldSize(size, "max metadata size");
    }

    private static int checkFieldSize(final int size, final String name) {
        if (size <= 0 || size > MAX_FIELD_SIZE) {
            throw new IllegalArgumentException(String.format("%s must be within [1, %d]", name, MAX_FIELD_SIZE));
        }
        return size;
    }
}
