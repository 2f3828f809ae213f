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

import com.google.common.base.MoreObjects;

import io.vertx.core.buffer.Buffer;

/**
 * An uplink packet as received from a gateway-facing router.
 * <p>
 * The packet is addressed by its (non-unique) device address only.
 * Its sender's identity is unknown until the MIC has been verified
 * with one of the registered devices' network session keys.
 */
public final class UplinkPacket {

    /**
     * The largest frame counter value.
     */
    public static final long MAX_FRAME_COUNTER = 0xFFFFFFFFL;
    /**
     * The largest number of payload bytes that fit into a frame.
     */
    public static final int MAX_PAYLOAD_LENGTH = 0xFFFF;

    private final DevAddr devAddr;
    private final long frameCounter;
    private final Buffer payload;
    private final byte[] mic;
    private final Metadata metadata;

    /**
     * Creates a packet.
     *
     * @param devAddr The address of the device that the packet claims to originate from.
     * @param frameCounter The frame counter.
     * @param payload The (encrypted) payload.
     * @param mic The message integrity code.
     * @param metadata The gateway's meta information.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws IllegalArgumentException if the frame counter is not an unsigned 32 bit integer,
     *                                  if the payload exceeds {@value #MAX_PAYLOAD_LENGTH} bytes or
     *                                  if the MIC does not consist of {@value MicCalculator#MIC_SIZE} bytes.
     */
    public UplinkPacket(
            final DevAddr devAddr,
            final long frameCounter,
            final Buffer payload,
            final byte[] mic,
            final Metadata metadata) {

        this.devAddr = Objects.requireNonNull(devAddr);
        this.payload = Objects.requireNonNull(payload).copy();
        this.metadata = Objects.requireNonNull(metadata);
        Objects.requireNonNull(mic);

        if (frameCounter < 0 || frameCounter > MAX_FRAME_COUNTER) {
            throw new IllegalArgumentException("frame counter must be an unsigned 32 bit integer");
        }
        if (payload.length() > MAX_PAYLOAD_LENGTH) {
            throw new IllegalArgumentException("payload must not exceed " + MAX_PAYLOAD_LENGTH + " bytes");
        }
        if (mic.length != MicCalculator.MIC_SIZE) {
            throw new IllegalArgumentException("MIC must consist of " + MicCalculator.MIC_SIZE + " bytes");
        }
        this.frameCounter = frameCounter;
        this.mic = mic.clone();
    }

    /**
     * Creates a packet carrying a MIC computed with a network session key.
     *
     * @param devAddr The device address.
     * @param frameCounter The frame counter.
     * @param payload The (encrypted) payload.
     * @param metadata The gateway's meta information.
     * @param key The device's network session key.
     * @return The packet.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws IllegalArgumentException if the frame counter or payload are out of range.
     */
    public static UplinkPacket create(
            final DevAddr devAddr,
            final long frameCounter,
            final Buffer payload,
            final Metadata metadata,
            final Aes128Key key) {

        Objects.requireNonNull(payload);
        final byte[] mic = MicCalculator.computeUplinkMic(key, devAddr, frameCounter, payload);
        return new UplinkPacket(devAddr, frameCounter, payload, mic, metadata);
    }

    /**
     * @return The device address.
     */
    public DevAddr getDevAddr() {
        return devAddr;
    }

    /**
     * @return The frame counter.
     */
    public long getFrameCounter() {
        return frameCounter;
    }

    /**
     * @return A copy of the payload.
     */
    public Buffer getPayload() {
        return payload.copy();
    }

    /**
     * @return A copy of the message integrity code.
     */
    public byte[] getMic() {
        return mic.clone();
    }

    /**
     * @return The meta information.
     */
    public Metadata getMetadata() {
        return metadata;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof UplinkPacket)) {
            return false;
        }
        final UplinkPacket other = (UplinkPacket) obj;
        return frameCounter == other.frameCounter
                && devAddr.equals(other.devAddr)
                && payload.equals(other.payload)
                && Arrays.equals(mic, other.mic)
                && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(devAddr, frameCounter, payload, Arrays.hashCode(mic), metadata);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("devAddr", devAddr)
                .add("frameCounter", frameCounter)
                .add("payloadLength", payload.length())
                .toString();
    }
}
