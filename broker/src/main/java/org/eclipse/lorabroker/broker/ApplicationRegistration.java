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

import org.eclipse.lorabroker.packet.Eui64;

import com.google.common.base.MoreObjects;

import io.vertx.core.buffer.Buffer;

/**
 * A request to register an application's handler.
 */
public final class ApplicationRegistration implements Registration {

    private final Eui64 appEui;
    private final Buffer recipient;

    /**
     * Creates a new registration.
     *
     * @param appEui The identifier of the application.
     * @param recipient The raw descriptor of the application's handler.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public ApplicationRegistration(final Eui64 appEui, final Buffer recipient) {
        this.appEui = Objects.requireNonNull(appEui);
        this.recipient = Objects.requireNonNull(recipient).copy();
    }

    /**
     * @return The application identifier.
     */
    public Eui64 getAppEui() {
        return appEui;
    }

    @Override
    public Buffer getRecipient() {
        return recipient.copy();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("appEui", appEui)
                .toString();
    }
}
