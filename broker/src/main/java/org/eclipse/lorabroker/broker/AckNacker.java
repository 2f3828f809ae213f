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

import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;

/**
 * Reports the outcome of processing an inbound packet or registration
 * back to the party that submitted it.
 * <p>
 * For each invocation of a {@link Broker} operation exactly one of the
 * methods is invoked exactly once.
 */
public interface AckNacker {

    /**
     * Acknowledges successful processing.
     *
     * @param response The response to return to the submitter or {@code null} if there is none.
     * @return A future indicating the outcome of delivering the acknowledgment.
     */
    Future<Void> ack(Buffer response);

    /**
     * Reports unsuccessful processing.
     *
     * @param error The error that processing has failed with. If the error is a
     *              {@link org.eclipse.lorabroker.util.BrokerException}, its kind
     *              classifies the failure.
     * @return A future indicating the outcome of delivering the negative acknowledgment.
     * @throws NullPointerException if error is {@code null}.
     */
    Future<Void> nack(Throwable error);
}
