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

import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Objects;

import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.macs.CMac;
import org.bouncycastle.crypto.params.KeyParameter;

import io.vertx.core.buffer.Buffer;

/**
 * Computes and verifies the message integrity code (MIC) of uplink packets.
 * <p>
 * The MIC consists of the first {@value #MIC_SIZE} bytes of the AES-CMAC of
 * {@code B0 | msg}, keyed with the device's network session key, where
 * <ul>
 * <li><em>msg</em> is the device address, the frame counter (4 bytes, big endian)
 * and the payload, and</li>
 * <li><em>B0</em> is the block {@code 0x49 | 0x00 * 4 | dir | DevAddr (LE) | FCnt (LE) | 0x00 | len(msg)}
 * with {@code dir} being {@code 0x00} for uplink.</li>
 * </ul>
 */
public final class MicCalculator {

    /**
     * The number of bytes of a MIC.
     */
    public static final int MIC_SIZE = 4;

    private static final byte BLOCK_B0_TAG = 0x49;
    private static final byte DIRECTION_UPLINK = 0x00;
    private static final int BLOCK_SIZE = 16;

    private MicCalculator() {
        // prevent instantiation
    }

    /**
     * Creates the canonical byte representation of the fields protected by the MIC.
     *
     * @param devAddr The device address.
     * @param frameCounter The frame counter.
     * @param payload The payload.
     * @return The bytes.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    static Buffer canonicalMessage(final DevAddr devAddr, final long frameCounter, final Buffer payload) {
        return Buffer.buffer(DevAddr.SIZE + 4 + payload.length())
                .appendBytes(devAddr.getBytes())
                .appendUnsignedInt(frameCounter)
                .appendBuffer(payload);
    }

    /**
     * Computes the MIC for uplink packet fields.
     *
     * @param key The network session key to use.
     * @param devAddr The device address.
     * @param frameCounter The frame counter.
     * @param payload The payload.
     * @return The MIC.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public static byte[] computeUplinkMic(
            final Aes128Key key,
            final DevAddr devAddr,
            final long frameCounter,
            final Buffer payload) {

        Objects.requireNonNull(key);
        Objects.requireNonNull(devAddr);
        Objects.requireNonNull(payload);

        final byte[] msg = canonicalMessage(devAddr, frameCounter, payload).getBytes();
        final byte[] addr = devAddr.getBytes();

        final byte[] b0 = new byte[BLOCK_SIZE];
        b0[0] = BLOCK_B0_TAG;
        b0[5] = DIRECTION_UPLINK;
        for (int i = 0; i < DevAddr.SIZE; i++) {
            b0[6 + i] = addr[DevAddr.SIZE - 1 - i];
        }
        b0[10] = (byte) frameCounter;
        b0[11] = (byte) (frameCounter >>> 8);
        b0[12] = (byte) (frameCounter >>> 16);
        b0[13] = (byte) (frameCounter >>> 24);
        b0[15] = (byte) msg.length;

        final CMac cmac = new CMac(new AESEngine());
        cmac.init(new KeyParameter(key.getBytes()));
        cmac.update(b0, 0, b0.length);
        cmac.update(msg, 0, msg.length);
        final byte[] mac = new byte[cmac.getMacSize()];
        cmac.doFinal(mac, 0);
        return Arrays.copyOf(mac, MIC_SIZE);
    }

    /**
     * Checks if a packet's MIC has been created with a given key.
     *
     * @param packet The packet to verify.
     * @param key The network session key to verify the MIC with.
     * @return {@code true} if the MIC recomputed with the key equals the packet's MIC.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public static boolean verify(final UplinkPacket packet, final Aes128Key key) {
        Objects.requireNonNull(packet);
        Objects.requireNonNull(key);
        final byte[] expected = computeUplinkMic(key, packet.getDevAddr(), packet.getFrameCounter(), packet.getPayload());
        return MessageDigest.isEqual(expected, packet.getMic());
    }
}
