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

import org.eclipse.lorabroker.packet.Aes128Key;
import org.eclipse.lorabroker.packet.DevAddr;
import org.eclipse.lorabroker.packet.Eui64;

import com.google.common.base.MoreObjects;

import io.vertx.core.buffer.Buffer;

/**
 * A request to register a device for an address.
 */
public final class DeviceRegistration implements Registration {

    private final DevAddr devAddr;
    private final DeviceEntry entry;

    /**
     * Creates a new registration.
     *
     * @param devAddr The address that the device uses.
     * @param recipient The raw descriptor of the recipient to forward the device's packets to.
     * @param appEui The identifier of the application that the device belongs to.
     * @param devEui The identifier of the device.
     * @param nwkSKey The device's network session key.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public DeviceRegistration(
            final DevAddr devAddr,
            final Buffer recipient,
            final Eui64 appEui,
            final Eui64 devEui,
            final Aes128Key nwkSKey) {
        this.devAddr = Objects.requireNonNull(devAddr);
        this.entry = new DeviceEntry(recipient, appEui, devEui, nwkSKey);
    }

    /**
     * @return The device address.
     */
    public DevAddr getDevAddr() {
        return devAddr;
    }

    @Override
    public Buffer getRecipient() {
        return entry.getRecipient();
    }

    /**
     * @return The application identifier.
     */
    public Eui64 getAppEui() {
        return entry.getAppEui();
    }

    /**
     * @return The device identifier.
     */
    public Eui64 getDevEui() {
        return entry.getDevEui();
    }

    /**
     * @return The network session key.
     */
    public Aes128Key getNwkSKey() {
        return entry.getNwkSKey();
    }

    /**
     * Gets the directory entry to store for this registration.
     *
     * @return The entry.
     */
    public DeviceEntry toDeviceEntry() {
        return entry;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("devAddr", devAddr)
                .add("appEui", entry.getAppEui())
                .add("devEui", entry.getDevEui())
                .toString();
    }
}
