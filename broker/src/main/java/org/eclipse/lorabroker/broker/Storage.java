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

import org.eclipse.lorabroker.packet.DevAddr;

import io.vertx.core.Future;

/**
 * A directory of registered devices and applications.
 * <p>
 * Implementations are responsible for their own concurrency control.
 */
public interface Storage {

    /**
     * Gets all devices registered for an address.
     *
     * @param devAddr The address.
     * @return A future indicating the outcome of the operation.
     *         <p>
     *         The future will be succeeded with the devices in the order that they should
     *         be checked in. Otherwise the future will be failed with an exception indicating
     *         the cause, usually a {@link org.eclipse.lorabroker.util.BehaviouralException}
     *         if no device is registered for the address.
     * @throws NullPointerException if devAddr is {@code null}.
     */
    Future<List<DeviceEntry>> lookupDevices(DevAddr devAddr);

    /**
     * Stores a device registration.
     *
     * @param registration The registration.
     * @return A future indicating the outcome of the operation.
     * @throws NullPointerException if registration is {@code null}.
     */
    Future<Void> storeDevice(DeviceRegistration registration);

    /**
     * Stores an application registration.
     *
     * @param registration The registration.
     * @return A future indicating the outcome of the operation.
     * @throws NullPointerException if registration is {@code null}.
     */
    Future<Void> storeApplication(ApplicationRegistration registration);
}
