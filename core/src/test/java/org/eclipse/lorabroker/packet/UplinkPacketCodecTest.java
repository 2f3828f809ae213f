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

import static org.junit.jupiter.api.Assertions.assertThrows;

import static com.google.common.truth.Truth.assertThat;

import org.eclipse.lorabroker.util.ErrorKind;
import org.eclipse.lorabroker.util.StructuralException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonObject;

/**
 * Verifies behavior of {@link UplinkPacketCodec}.
 *
 */
public class UplinkPacketCodecTest {

    private static final DevAddr DEV_ADDR = DevAddr.of(new byte[] { 2, 3, 2, 3 });
    private static final Aes128Key KEY = Aes128Key.of(new byte[] { 1, 1, 2, 2, 3, 3, 4, 4, 5, 5, 6, 6, 7, 7, 8, 8 });

    private UplinkPacketCodec codec;

    /**
     * Sets up the fixture.
     */
    @BeforeEach
    public void setUp() {
        codec = new UplinkPacketCodec();
    }

    private static Metadata newMetadata() {
        return new Metadata()
                .withGatewayId("b827ebfffe8b01dd")
                .withTime("2023-05-04T10:15:30.123456Z")
                .withTimestamp(3512348611L)
                .withChannel(2)
                .withRfChain(0)
                .withCrcStatus(1)
                .withFrequency(868.5)
                .withModulation("LORA")
                .withDataRate("SF7BW125")
                .withCodingRate("4/5")
                .withRssi(-35)
                .withSnr(5.1)
                .withPayloadSize(16)
                .withLocation(new Location(52.52, 13.405, 34));
    }

    private static UplinkPacket newPacket(final String payload) {
        return UplinkPacket.create(DEV_ADDR, 5, Buffer.buffer(payload), newMetadata(), KEY);
    }

    /**
     * Verifies that a decoded frame contains the same fields as the packet it has been encoded from.
     */
    @Test
    public void testDecodeRestoresEncodedPacket() {

        final UplinkPacket packet = newPacket("Payload");
        final UplinkPacket decoded = codec.decode(codec.encode(packet));

        assertThat(decoded.getDevAddr()).isEqualTo(DEV_ADDR);
        assertThat(decoded.getFrameCounter()).isEqualTo(5L);
        assertThat(decoded.getPayload()).isEqualTo(Buffer.buffer("Payload"));
        assertThat(decoded.getMic()).isEqualTo(packet.getMic());
        assertThat(decoded.getMetadata()).isEqualTo(packet.getMetadata());
        assertThat(decoded).isEqualTo(packet);
    }

    /**
     * Verifies that the encoded frame has the documented layout.
     */
    @Test
    public void testEncodeProducesDocumentedLayout() {

        final UplinkPacket packet = new UplinkPacket(
                DEV_ADDR,
                0x01020304L,
                Buffer.buffer(new byte[] { (byte) 0xAA, (byte) 0xBB }),
                new byte[] { 9, 8, 7, 6 },
                new Metadata());

        final Buffer frame = codec.encode(packet);

        assertThat(frame.getBytes()).isEqualTo(new byte[] {
                0x01, 0x01,
                2, 3, 2, 3,
                1, 2, 3, 4,
                0, 2, (byte) 0xAA, (byte) 0xBB,
                0, 2, '{', '}',
                9, 8, 7, 6 });
    }

    /**
     * Verifies that a frame counter using all 32 bits is decoded as an unsigned value.
     */
    @Test
    public void testDecodeSupportsUnsignedFrameCounter() {

        final UplinkPacket packet = UplinkPacket.create(DEV_ADDR, 0xFFFFFFFEL, Buffer.buffer(), new Metadata(), KEY);
        assertThat(codec.decode(codec.encode(packet)).getFrameCounter()).isEqualTo(0xFFFFFFFEL);
    }

    /**
     * Verifies that a frame without metadata bytes is decoded into empty metadata.
     */
    @Test
    public void testDecodeAcceptsEmptyMetadata() {

        final Buffer frame = Buffer.buffer()
                .appendByte(UplinkPacketCodec.VERSION)
                .appendByte(UplinkPacketCodec.TYPE_UPLINK)
                .appendBytes(DEV_ADDR.getBytes())
                .appendUnsignedInt(1)
                .appendUnsignedShort(0)
                .appendUnsignedShort(0)
                .appendBytes(new byte[4]);

        assertThat(frame.length()).isEqualTo(UplinkPacketCodec.MIN_FRAME_SIZE);
        final UplinkPacket packet = codec.decode(frame);
        assertThat(packet.getPayload().length()).isEqualTo(0);
        assertThat(packet.getMetadata()).isEqualTo(new Metadata());
    }

    private static Buffer newFrame(final Buffer metadata) {
        return Buffer.buffer()
                .appendByte(UplinkPacketCodec.VERSION)
                .appendByte(UplinkPacketCodec.TYPE_UPLINK)
                .appendBytes(DEV_ADDR.getBytes())
                .appendUnsignedInt(1)
                .appendUnsignedShort(0)
                .appendUnsignedShort(metadata.length())
                .appendBuffer(metadata)
                .appendBytes(new byte[4]);
    }

    /**
     * Verifies that metadata properties without a dedicated accessor survive decoding.
     */
    @Test
    public void testDecodeRetainsUnknownMetadataProperties() {

        final Buffer metadata = new JsonObject()
                .put("rssi", -80)
                .put("brd", 3)
                .put("custom", new JsonObject().put("foo", "bar"))
                .toBuffer();
        final Buffer frame = newFrame(metadata);

        final Metadata decoded = codec.decode(frame).getMetadata();
        assertThat(decoded.getRssi()).isEqualTo(-80);
        assertThat(decoded.toJson().getInteger("brd")).isEqualTo(3);
        assertThat(decoded.toJson().getJsonObject("custom").getString("foo")).isEqualTo("bar");

        final Buffer reencodedFrame = codec.encode(codec.decode(frame));
        final int metadataLength = reencodedFrame.getUnsignedShort(12);
        final JsonObject reencoded = new JsonObject(reencodedFrame.getBuffer(14, 14 + metadataLength));
        assertThat(reencoded).isEqualTo(new JsonObject(metadata));
    }

    /**
     * Verifies that metadata values which do not match the type of a well known property
     * are neither converted nor rejected and that the metadata bytes are written unaltered.
     */
    @Test
    public void testDecodePreservesNonCanonicalMetadataValues() {

        final Buffer metadata = Buffer.buffer("{ \"rssi\": -57.5, \"lsnr\": 7, \"chan\": \"3\", \"stat\": 1 }");
        final Buffer frame = newFrame(metadata);

        final Metadata decoded = codec.decode(frame).getMetadata();
        assertThat(decoded.toBuffer()).isEqualTo(metadata);
        assertThat(decoded.toJson().getValue("rssi")).isEqualTo(-57.5);
        assertThat(decoded.toJson().getValue("lsnr")).isEqualTo(7);
        assertThat(decoded.toJson().getValue("chan")).isEqualTo("3");
        assertThat(decoded.getRssi()).isEqualTo(-57);
        assertThat(decoded.getSnr()).isEqualTo(7.0);
        assertThat(decoded.getChannel()).isNull();

        assertThat(codec.encode(codec.decode(frame))).isEqualTo(frame);
    }

    /**
     * Verifies that location properties other than the coordinates survive decoding.
     */
    @Test
    public void testDecodeRetainsUnknownLocationProperties() {

        final Buffer metadata = Buffer.buffer("{\"location\":{\"lati\":1.0,\"long\":2.0,\"accuracy\":5}}");

        final Metadata decoded = codec.decode(newFrame(metadata)).getMetadata();
        final Location location = decoded.getLocation();
        assertThat(location.getLatitude()).isEqualTo(1.0);
        assertThat(location.getLongitude()).isEqualTo(2.0);
        assertThat(location.getAltitude()).isNull();
        assertThat(location.toJson().getInteger("accuracy")).isEqualTo(5);
        assertThat(decoded.toBuffer()).isEqualTo(metadata);
    }

    /**
     * Verifies that changing decoded metadata does not affect the packet it has been decoded with.
     */
    @Test
    public void testDecodedMetadataIsImmutable() {

        final UplinkPacket packet = codec.decode(newFrame(Buffer.buffer("{\"rssi\":-80}")));

        final Metadata changed = packet.getMetadata().withRssi(-20);
        packet.getMetadata().toJson().put("rssi", -10);

        assertThat(changed.getRssi()).isEqualTo(-20);
        assertThat(packet.getMetadata().getRssi()).isEqualTo(-80);
        assertThat(packet.getMetadata().toBuffer()).isEqualTo(Buffer.buffer("{\"rssi\":-80}"));
    }

    /**
     * Verifies that a packet is not encoded if its metadata cannot be represented in a frame.
     */
    @Test
    public void testEncodeFailsForMetadataExceedingLengthField() {

        final Metadata metadata = new Metadata().withProperty("blob", "x".repeat(UplinkPacket.MAX_PAYLOAD_LENGTH));
        final UplinkPacket packet = UplinkPacket.create(DEV_ADDR, 1, Buffer.buffer(), metadata, KEY);

        assertThrows(IllegalArgumentException.class, () -> codec.encode(packet));
    }

    /**
     * Verifies that frames shorter than the minimum frame size are rejected.
     */
    @Test
    public void testDecodeFailsForShortFrame() {

        final StructuralException e = assertThrows(
                StructuralException.class,
                () -> codec.decode(Buffer.buffer(new byte[] { 1, 2, 3 })));
        assertThat(e.getKind()).isEqualTo(ErrorKind.STRUCTURAL);
    }

    /**
     * Verifies that frames with an unknown version are rejected.
     */
    @Test
    public void testDecodeFailsForUnsupportedVersion() {

        final Buffer frame = codec.encode(newPacket("Payload"));
        frame.setByte(0, (byte) 0x02);
        assertThrows(StructuralException.class, () -> codec.decode(frame));
    }

    /**
     * Verifies that frames with an unknown packet type are rejected.
     */
    @Test
    public void testDecodeFailsForUnsupportedType() {

        final Buffer frame = codec.encode(newPacket("Payload"));
        frame.setByte(1, (byte) 0x07);
        assertThrows(StructuralException.class, () -> codec.decode(frame));
    }

    /**
     * Verifies that frames whose payload length exceeds the remaining bytes are rejected.
     */
    @Test
    public void testDecodeFailsForPayloadLengthExceedingFrame() {

        final Buffer frame = codec.encode(newPacket("Payload"));
        frame.setUnsignedShort(10, 0x0FFF);
        assertThrows(StructuralException.class, () -> codec.decode(frame));
    }

    /**
     * Verifies that frames with bytes following the MIC are rejected.
     */
    @Test
    public void testDecodeFailsForTrailingBytes() {

        final Buffer frame = codec.encode(newPacket("Payload")).appendByte((byte) 0x00);
        assertThrows(StructuralException.class, () -> codec.decode(frame));
    }

    /**
     * Verifies that frames which lack part of the MIC are rejected.
     */
    @Test
    public void testDecodeFailsForTruncatedMic() {

        final Buffer frame = codec.encode(newPacket("Payload"));
        assertThrows(StructuralException.class, () -> codec.decode(frame.getBuffer(0, frame.length() - 1)));
    }

    /**
     * Verifies that payloads exceeding the configured limit are rejected.
     */
    @Test
    public void testDecodeFailsForOversizePayload() {

        final UplinkPacketCodec strictCodec = new UplinkPacketCodec(4, UplinkPacketCodec.DEFAULT_MAX_METADATA_SIZE);
        final Buffer frame = codec.encode(newPacket("Payload"));
        assertThrows(StructuralException.class, () -> strictCodec.decode(frame));
    }

    /**
     * Verifies that metadata exceeding the configured limit is rejected.
     */
    @Test
    public void testDecodeFailsForOversizeMetadata() {

        final UplinkPacketCodec strictCodec = new UplinkPacketCodec(UplinkPacketCodec.DEFAULT_MAX_PAYLOAD_SIZE, 10);
        final Buffer frame = codec.encode(newPacket("Payload"));
        assertThrows(StructuralException.class, () -> strictCodec.decode(frame));
    }

    /**
     * Verifies that metadata which is not a JSON object is rejected.
     */
    @Test
    public void testDecodeFailsForMalformedMetadata() {

        final Buffer metadata = Buffer.buffer("[1,2]");
        final Buffer frame = Buffer.buffer()
                .appendByte(UplinkPacketCodec.VERSION)
                .appendByte(UplinkPacketCodec.TYPE_UPLINK)
                .appendBytes(DEV_ADDR.getBytes())
                .appendUnsignedInt(1)
                .appendUnsignedShort(0)
                .appendUnsignedShort(metadata.length())
                .appendBuffer(metadata)
                .appendBytes(new byte[4]);

        assertThrows(StructuralException.class, () -> codec.decode(frame));

        final Buffer truncatedJson = Buffer.buffer("{\"rssi\":");
        final Buffer otherFrame = Buffer.buffer()
                .appendByte(UplinkPacketCodec.VERSION)
                .appendByte(UplinkPacketCodec.TYPE_UPLINK)
                .appendBytes(DEV_ADDR.getBytes())
                .appendUnsignedInt(1)
                .appendUnsignedShort(0)
                .appendUnsignedShort(truncatedJson.length())
                .appendBuffer(truncatedJson)
                .appendBytes(new byte[4]);

        assertThrows(StructuralException.class, () -> codec.decode(otherFrame));
    }

    /**
     * Verifies that the codec cannot be created with invalid limits.
     */
    @Test
    public void testConstructorRejectsInvalidLimits() {
        assertThrows(IllegalArgumentException.class, () -> new UplinkPacketCodec(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new UplinkPacketCodec(10, 0x10000));
    }
}
