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

import org.eclipse.lorabroker.packet.ApplicationPacket;
import org.eclipse.lorabroker.packet.UplinkPacket;

/**
 * Converts authenticated uplink packets into application packets.
 */
public final class PacketTranslator {

    private PacketTranslator() {
        // prevent instantiation
    }

    /**
     * Creates the application packet for an uplink packet.
     * <p>
     * The payload and metadata are taken over unchanged, the device address is
     * replaced by the identifiers of the device that has been verified to have sent
     * the packet.
     *
     * @param packet The uplink packet.
     * @param device The device that authenticates the packet.
     * @return The application packet.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public static ApplicationPacket translate(final UplinkPacket packet, final DeviceEntry device) {
        Objects.requireNonNull(packet);
        Objects.requireNonNull(device);
        return new ApplicationPacket(device.getAppEui(), device.getDevEui(), packet.getPayload(), packet.getMetadata());
    }
}
