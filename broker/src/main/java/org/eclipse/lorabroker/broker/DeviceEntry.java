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
import org.eclipse.lorabroker.packet.Eui64;

import com.google.common.base.MoreObjects;

import io.vertx.core.buffer.Buffer;

/**
 * A device as registered in a {@link Storage}.
 * <p>
 * Instances are immutable.
 */
public final class DeviceEntry {

    private final Buffer recipient;
    private final Eui64 appEui;
    private final Eui64 devEui;
    private final Aes128Key nwkSKey;

    /**
     * Creates a new entry.
     *
     * @param recipient The raw descriptor of the recipient to forward the device's packets to.
     * @param appEui The identifier of the application that the device belongs to.
     * @param devEui The identifier of the device.
     * @param nwkSKey The device's network session key.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public DeviceEntry(final Buffer recipient, final Eui64 appEui, final Eui64 devEui, final Aes128Key nwkSKey) {
        this.recipient = Objects.requireNonNull(recipient).copy();
        this.appEui = Objects.requireNonNull(appEui);
        this.devEui = Objects.requireNonNull(devEui);
        this.nwkSKey = Objects.requireNonNull(nwkSKey);
    }

    /**
     * @return A copy of the raw recipient descriptor.
     */
    public Buffer getRecipient() {
        return recipient.copy();
    }

    /**
     * @return The application identifier.
     */
    public Eui64 getAppEui() {
        return appEui;
    }

    /**
     * @return The device identifier.
     */
    public Eui64 getDevEui() {
        return devEui;
    }

    /**
     * @return The network session key.
     */
    public Aes128Key getNwkSKey() {
        return nwkSKey;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof DeviceEntry)) {
            return false;
        }
        final DeviceEntry other = (DeviceEntry) obj;
        return recipient.equals(other.recipient)
                && appEui.equals(other.appEui)
                && devEui.equals(other.devEui)
                && nwkSKey.equals(other.nwkSKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(recipient, appEui, devEui, nwkSKey);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("appEui", appEui)
                .add("devEui", devEui)
                .toString();
    }
}
