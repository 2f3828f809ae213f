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

import io.opentracing.SpanContext;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;

/**
 * A broker that authenticates uplink packets from devices and forwards them to the
 * handlers of the applications that the devices belong to.
 * <p>
 * Every operation reports its outcome exactly once to the {@link AckNacker} passed in.
 */
public interface Broker {

    /**
     * Registers a device or an application.
     *
     * @param registration The registration.
     * @param ackNacker The callback to report the outcome to.
     * @return A future indicating the outcome of the operation.
     *         <p>
     *         The future will be succeeded once the registration has been stored and
     *         acknowledged. Otherwise the future will be failed with the error that
     *         has been reported to the ackNacker, usually a
     *         {@link org.eclipse.lorabroker.util.BrokerException}.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    default Future<Void> register(final Registration registration, final AckNacker ackNacker) {
        return register(registration, ackNacker, null);
    }

    /**
     * Registers a device or an application.
     *
     * @param registration The registration.
     * @param ackNacker The callback to report the outcome to.
     * @param context The currently active OpenTracing span context or {@code null} if no span is currently active.
     * @return A future indicating the outcome of the operation.
     *         <p>
     *         The future will be succeeded once the registration has been stored and
     *         acknowledged. Otherwise the future will be failed with the error that
     *         has been reported to the ackNacker, usually a
     *         {@link org.eclipse.lorabroker.util.BrokerException}.
     * @throws NullPointerException if registration or ackNacker are {@code null}.
     */
    Future<Void> register(Registration registration, AckNacker ackNacker, SpanContext context);

    /**
     * Handles an uplink frame received from a router.
     *
     * @param data The raw frame.
     * @param ackNacker The callback to report the outcome to.
     * @param adapter The adapter to resolve the recipient with and to send the application packet by.
     * @return A future indicating the outcome of the operation.
     *         <p>
     *         The future will be succeeded once the packet has been delivered and acknowledged.
     *         Otherwise the future will be failed with the error that has been reported to the
     *         ackNacker.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    default Future<Void> handleUp(final Buffer data, final AckNacker ackNacker, final Adapter adapter) {
        return handleUp(data, ackNacker, adapter, null);
    }

    /**
     * Handles an uplink frame received from a router.
     *
     * @param data The raw frame.
     * @param ackNacker The callback to report the outcome to.
     * @param adapter The adapter to resolve the recipient with and to send the application packet by.
     * @param context The currently active OpenTracing span context or {@code null} if no span is currently active.
     * @return A future indicating the outcome of the operation.
     *         <p>
     *         The future will be succeeded once the packet has been delivered and acknowledged.
     *         Otherwise the future will be failed with the error that has been reported to the
     *         ackNacker.
     * @throws NullPointerException if data, ackNacker or adapter are {@code null}.
     */
    Future<Void> handleUp(Buffer data, AckNacker ackNacker, Adapter adapter, SpanContext context);
}
