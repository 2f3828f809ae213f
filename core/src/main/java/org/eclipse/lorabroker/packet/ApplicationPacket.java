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

import com.google.common.base.MoreObjects;

import io.vertx.core.buffer.Buffer;

/**
 * An uplink packet addressed to the application that an authenticated device belongs to.
 */
public final class ApplicationPacket {

    private final Eui64 appEui;
    private final Eui64 devEui;
    private final Buffer payload;
    private final Metadata metadata;

    /**
     * Creates a packet.
     *
     * @param appEui The identifier of the application.
     * @param devEui The identifier of the device that sent the packet.
     * @param payload The payload.
     * @param metadata The gateway's meta information.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public ApplicationPacket(final Eui64 appEui, final Eui64 devEui, final Buffer payload, final Metadata metadata) {
        this.appEui = Objects.requireNonNull(appEui);
        this.devEui = Objects.requireNonNull(devEui);
        this.payload = Objects.requireNonNull(payload).copy();
        this.metadata = Objects.requireNonNull(metadata);
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
     * @return A copy of the payload.
     */
    public Buffer getPayload() {
        return payload.copy();
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
        if (!(obj instanceof ApplicationPacket)) {
            return false;
        }
        final ApplicationPacket other = (ApplicationPacket) obj;
        return appEui.equals(other.appEui)
                && devEui.equals(other.devEui)
                && payload.equals(other.payload)
                && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(appEui, devEui, payload, metadata);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("appEui", appEui)
                .add("devEui", devEui)
                .add("payloadLength", payload.length())
                .toString();
    }
}
