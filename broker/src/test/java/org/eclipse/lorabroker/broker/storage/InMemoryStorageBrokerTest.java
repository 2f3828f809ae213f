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

package org.eclipse.lorabroker.broker.storage;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import static com.google.common.truth.Truth.assertThat;

import org.eclipse.lorabroker.broker.AckNacker;
import org.eclipse.lorabroker.broker.Adapter;
import org.eclipse.lorabroker.broker.DeviceRegistration;
import org.eclipse.lorabroker.broker.LoraBroker;
import org.eclipse.lorabroker.broker.Recipient;
import org.eclipse.lorabroker.packet.Aes128Key;
import org.eclipse.lorabroker.packet.ApplicationPacket;
import org.eclipse.lorabroker.packet.DevAddr;
import org.eclipse.lorabroker.packet.Eui64;
import org.eclipse.lorabroker.packet.Metadata;
import org.eclipse.lorabroker.packet.UplinkPacket;
import org.eclipse.lorabroker.packet.UplinkPacketCodec;
import org.eclipse.lorabroker.util.BehaviouralException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;

import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;

/**
 * Verifies behavior of a {@link LoraBroker} that keeps its registrations in an {@link InMemoryStorage}.
 *
 */
@ExtendWith(VertxExtension.class)
public class InMemoryStorageBrokerTest {

    private static final DevAddr DEV_ADDR = DevAddr.fromString("02030203");
    private static final Eui64 APP_EUI = Eui64.fromString("70b3d57ed0000001");
    private static final Aes128Key KEY_A = Aes128Key.of(
            new byte[] { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16 });
    private static final Aes128Key KEY_B = Aes128Key.of(
            new byte[] { 1, 1, 2, 2, 3, 3, 4, 4, 5, 5, 6, 6, 7, 7, 8, 8 });

    private LoraBroker broker;
    private AckNacker ackNacker;
    private Adapter adapter;

    /**
     * Sets up the fixture.
     */
    @BeforeEach
    public void setUp() {

        broker = new LoraBroker(new InMemoryStorage());
        ackNacker = mock(AckNacker.class);
        when(ackNacker.ack(any())).thenReturn(Future.succeededFuture());
        when(ackNacker.nack(any())).thenReturn(Future.succeededFuture());

        final Recipient recipient = mock(Recipient.class);
        when(recipient.getAddress()).thenReturn("handler-b");
        adapter = mock(Adapter.class);
        when(adapter.getRecipient(any())).thenReturn(Future.succeededFuture(recipient));
        when(adapter.send(any(), any())).thenReturn(Future.succeededFuture());
    }

    /**
     * Verifies that a packet from one of two devices sharing an address is forwarded
     * with the identifiers of the device that has sent it.
     *
     * @param ctx The vert.x test context.
     */
    @Test
    public void testUplinkOfRegisteredDeviceIsForwarded(final VertxTestContext ctx) {

        final Eui64 devEuiA = Eui64.fromString("0000000000000001");
        final Eui64 devEuiB = Eui64.fromString("0000000000000002");
        final Buffer frame = new UplinkPacketCodec().encode(
                UplinkPacket.create(DEV_ADDR, 5, Buffer.buffer("Payload"), new Metadata().withRssi(-80), KEY_B));

        broker.register(new DeviceRegistration(DEV_ADDR, Buffer.buffer("handler-a"), APP_EUI, devEuiA, KEY_A),
                ackNacker)
            .compose(ok -> broker.register(
                    new DeviceRegistration(DEV_ADDR, Buffer.buffer("handler-b"), APP_EUI, devEuiB, KEY_B),
                    ackNacker))
            .compose(ok -> broker.handleUp(frame, ackNacker, adapter))
            .onComplete(ctx.succeeding(ok -> {
                ctx.verify(() -> {
                    verify(adapter).getRecipient(Buffer.buffer("handler-b"));
                    final ArgumentCaptor<ApplicationPacket> packet = ArgumentCaptor.forClass(ApplicationPacket.class);
                    verify(adapter).send(packet.capture(), any());
                    assertThat(packet.getValue().getAppEui()).isEqualTo(APP_EUI);
                    assertThat(packet.getValue().getDevEui()).isEqualTo(devEuiB);
                    assertThat(packet.getValue().getMetadata().getRssi()).isEqualTo(-80);
                    verify(ackNacker, times(3)).ack(null);
                    verify(ackNacker, never()).nack(any());
                });
                ctx.completeNow();
            }));
    }

    /**
     * Verifies that a packet from an address that no device has been registered for is rejected.
     *
     * @param ctx The vert.x test context.
     */
    @Test
    public void testUplinkOfUnknownDeviceIsRejected(final VertxTestContext ctx) {

        final Buffer frame = new UplinkPacketCodec().encode(
                UplinkPacket.create(DEV_ADDR, 5, Buffer.buffer("Payload"), new Metadata(), KEY_A));

        broker.handleUp(frame, ackNacker, adapter)
            .onComplete(ctx.failing(t -> {
                ctx.verify(() -> {
                    assertThat(t).isInstanceOf(BehaviouralException.class);
                    verify(ackNacker).nack(t);
                    verify(adapter, never()).send(any(), any());
                });
                ctx.completeNow();
            }));
    }
}
