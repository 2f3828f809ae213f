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

import java.util.List;

import org.eclipse.lorabroker.packet.ApplicationPacket;

import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;

/**
 * A network adapter that resolves recipients and delivers application packets to them.
 */
public interface Adapter {

    /**
     * Resolves a raw recipient descriptor.
     *
     * @param rawRecipient The descriptor as stored along with a device.
     * @return A future indicating the outcome of the operation.
     *         <p>
     *         The future will be succeeded with the recipient if the descriptor could be resolved.
     *         Otherwise the future will be failed with an exception indicating the cause,
     *         usually a {@link org.eclipse.lorabroker.util.StructuralException}.
     * @throws NullPointerException if rawRecipient is {@code null}.
     */
    Future<Recipient> getRecipient(Buffer rawRecipient);

    /**
     * Delivers a packet to recipients.
     *
     * @param packet The packet to deliver.
     * @param recipients The recipients to deliver the packet to.
     * @return A future indicating the outcome of the operation.
     *         <p>
     *         The future will be succeeded if the packet has been delivered.
     *         Otherwise the future will be failed with an exception indicating the cause,
     *         usually an {@link org.eclipse.lorabroker.util.OperationalException}.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    Future<Void> send(ApplicationPacket packet, List<Recipient> recipients);
}
