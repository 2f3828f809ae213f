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

import java.util.Objects;

import org.eclipse.lorabroker.util.BrokerException;
import org.eclipse.lorabroker.util.StructuralException;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;

/**
 * Encodes and decodes the binary frame representation of uplink packets.
 * <p>
 * A frame consists of (all integers big endian):
 * <pre>
 * version (1) | type (1) | DevAddr (4) | FCnt (4) | payload length N (2) | payload (N)
 *   | metadata length M (2) | metadata JSON (M) | MIC (4)
 * </pre>
 * Instances are immutable and may be shared by multiple threads.
 */
public final class UplinkPacketCodec {

    /**
     * The version of the frame format.
     */
    public static final byte VERSION = 0x01;
    /**
     * The type tag of uplink packets.
     */
    public static final byte TYPE_UPLINK = 0x01;
    /**
     * The default maximum number of payload bytes.
     */
    public static final int DEFAULT_MAX_PAYLOAD_SIZE = 242;
    /**
     * The default maximum number of metadata bytes.
     */
    public static final int DEFAULT_MAX_METADATA_SIZE = 2048;
    /**
     * The size of a frame with empty payload and empty metadata.
     */
    public static final int MIN_FRAME_SIZE = 1 + 1 + DevAddr.SIZE + 4 + 2 + 2 + MicCalculator.MIC_SIZE;

    private static final int OFFSET_VERSION = 0;
    private static final int OFFSET_TYPE = 1;
    private static final int OFFSET_DEV_ADDR = 2;
    private static final int OFFSET_FRAME_COUNTER = OFFSET_DEV_ADDR + DevAddr.SIZE;
    private static final int OFFSET_PAYLOAD_LENGTH = OFFSET_FRAME_COUNTER + 4;

    private final int maxPayloadSize;
    private final int maxMetadataSize;

    /**
     * Creates a codec using the default size limits.
     */
    public UplinkPacketCodec() {
        this(DEFAULT_MAX_PAYLOAD_SIZE, DEFAULT_MAX_METADATA_SIZE);
    }

    /**
     * Creates a codec for size limits.
     *
     * @param maxPayloadSize The maximum number of payload bytes accepted when decoding.
     * @param maxMetadataSize The maximum number of metadata bytes accepted when decoding.
     * @throws IllegalArgumentException if any of the limits is not positive or exceeds
     *                                  {@value UplinkPacket#MAX_PAYLOAD_LENGTH}.
     */
    public UplinkPacketCodec(final int maxPayloadSize, final int maxMetadataSize) {
        if (maxPayloadSize <= 0 || maxPayloadSize > UplinkPacket.MAX_PAYLOAD_LENGTH) {
            throw new IllegalArgumentException("max payload size must be > 0 and <= " + UplinkPacket.MAX_PAYLOAD_LENGTH);
        }
        if (maxMetadataSize <= 0 || maxMetadataSize > UplinkPacket.MAX_PAYLOAD_LENGTH) {
            throw new IllegalArgumentException("max metadata size must be > 0 and <= " + UplinkPacket.MAX_PAYLOAD_LENGTH);
        }
        this.maxPayloadSize = maxPayloadSize;
        this.maxMetadataSize = maxMetadataSize;
    }

    /**
     * Decodes a frame.
     *
     * @param frame The frame to decode.
     * @return The packet.
     * @throws NullPointerException if frame is {@code null}.
     * @throws StructuralException if the frame is too short, has an unsupported version or
     *                             type, contains length fields that are inconsistent with
     *                             the frame's size, exceeds a size limit or contains malformed
     *                             metadata.
     */
    public UplinkPacket decode(final Buffer frame) {

        Objects.requireNonNull(frame);

        if (frame.length() < MIN_FRAME_SIZE) {
            throw structuralError("CODEC_FRAME_TOO_SHORT");
        }
        if (frame.getByte(OFFSET_VERSION) != VERSION) {
            throw structuralError("CODEC_UNSUPPORTED_VERSION");
        }
        if (frame.getByte(OFFSET_TYPE) != TYPE_UPLINK) {
            throw structuralError("CODEC_UNSUPPORTED_TYPE");
        }

        final DevAddr devAddr = DevAddr.of(frame.getBytes(OFFSET_DEV_ADDR, OFFSET_DEV_ADDR + DevAddr.SIZE));
        final long frameCounter = frame.getUnsignedInt(OFFSET_FRAME_COUNTER);

        final int payloadLength = frame.getUnsignedShort(OFFSET_PAYLOAD_LENGTH);
        final int payloadOffset = OFFSET_PAYLOAD_LENGTH + 2;
        // metadata length field and MIC must follow the payload
        if (payloadOffset + payloadLength + 2 + MicCalculator.MIC_SIZE > frame.length()) {
            throw structuralError("CODEC_LENGTH_MISMATCH");
        }
        if (payloadLength > maxPayloadSize) {
            throw structuralError("CODEC_PAYLOAD_TOO_LARGE");
        }
        final Buffer payload = frame.getBuffer(payloadOffset, payloadOffset + payloadLength);

        final int metadataLengthOffset = payloadOffset + payloadLength;
        final int metadataLength = frame.getUnsignedShort(metadataLengthOffset);
        final int metadataOffset = metadataLengthOffset + 2;
        if (metadataOffset + metadataLength + MicCalculator.MIC_SIZE != frame.length()) {
            throw structuralError("CODEC_LENGTH_MISMATCH");
        }
        if (metadataLength > maxMetadataSize) {
            throw structuralError("CODEC_METADATA_TOO_LARGE");
        }
        final Metadata metadata = decodeMetadata(frame.getBuffer(metadataOffset, metadataOffset + metadataLength));

        final int micOffset = metadataOffset + metadataLength;
        final byte[] mic = frame.getBytes(micOffset, micOffset + MicCalculator.MIC_SIZE);

        return new UplinkPacket(devAddr, frameCounter, payload, mic, metadata);
    }

    /**
     * Encodes a packet into a frame.
     * <p>
     * The metadata is written in its serialized form, i.e. metadata that has been
     * decoded from a frame is written unaltered.
     *
     * @param packet The packet to encode.
     * @return The frame.
     * @throws NullPointerException if packet is {@code null}.
     * @throws IllegalArgumentException if the serialized metadata exceeds
     *                                  {@value UplinkPacket#MAX_PAYLOAD_LENGTH} bytes.
     */
    public Buffer encode(final UplinkPacket packet) {

        Objects.requireNonNull(packet);

        final Buffer payload = packet.getPayload();
        final Buffer metadata = packet.getMetadata().toBuffer();
        if (metadata.length() > UplinkPacket.MAX_PAYLOAD_LENGTH) {
            throw new IllegalArgumentException(String.format(
                    "metadata of %d bytes exceeds length field", metadata.length()));
        }

        return Buffer.buffer(MIN_FRAME_SIZE + payload.length() + metadata.length())
                .appendByte(VERSION)
                .appendByte(TYPE_UPLINK)
                .appendBytes(packet.getDevAddr().getBytes())
                .appendUnsignedInt(packet.getFrameCounter())
                .appendUnsignedShort(payload.length())
                .appendBuffer(payload)
                .appendUnsignedShort(metadata.length())
                .appendBuffer(metadata)
                .appendBytes(packet.getMic());
    }

    private static Metadata decodeMetadata(final Buffer json) {
        if (json.length() > 0 && json.getByte(0) != '{') {
            throw structuralError("CODEC_MALFORMED_METADATA");
        }
        try {
            return Metadata.fromBuffer(json);
        } catch (final DecodeException e) {
            throw new StructuralException(BrokerException.getLocalizedMessage("CODEC_MALFORMED_METADATA"), e);
        }
    }

    private static StructuralException structuralError(final String messageKey) {
        return new StructuralException(BrokerException.getLocalizedMessage(messageKey));
    }
}
