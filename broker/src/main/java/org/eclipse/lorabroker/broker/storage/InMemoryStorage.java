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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import org.eclipse.lorabroker.broker.ApplicationRegistration;
import org.eclipse.lorabroker.broker.DeviceEntry;
import org.eclipse.lorabroker.broker.DeviceRegistration;
import org.eclipse.lorabroker.broker.Storage;
import org.eclipse.lorabroker.packet.DevAddr;
import org.eclipse.lorabroker.packet.Eui64;
import org.eclipse.lorabroker.util.BehaviouralException;
import org.eclipse.lorabroker.util.BrokerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Future;

/**
 * A storage that keeps all registrations in memory.
 * <p>
 * A device is identified by its application and device identifiers. Registering
 * a device that is already known replaces the existing entry, also if the device
 * has been assigned a different address in the meantime.
 * <p>
 * This class is thread safe.
 */
public final class InMemoryStorage implements Storage {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryStorage.class);

    private final Map<DevAddr, List<DeviceEntry>> devices = new ConcurrentHashMap<>();
    private final Map<String, DevAddr> addresses = new ConcurrentHashMap<>();
    private final Map<Eui64, ApplicationRegistration> applications = new ConcurrentHashMap<>();

    @Override
    public Future<List<DeviceEntry>> lookupDevices(final DevAddr devAddr) {
        Objects.requireNonNull(devAddr);

        final List<DeviceEntry> entries = devices.get(devAddr);
        if (entries == null) {
            return Future.failedFuture(new BehaviouralException(
                    BrokerException.getLocalizedMessage("STORAGE_DEVICE_NOT_FOUND")));
        }
        return Future.succeededFuture(entries);
    }

    @Override
    public Future<Void> storeDevice(final DeviceRegistration registration) {
        Objects.requireNonNull(registration);

        final String key = getDeviceKey(registration.getAppEui(), registration.getDevEui());
        final DeviceEntry entry = registration.toDeviceEntry();

        synchronized (this) {
            final DevAddr previousAddr = addresses.put(key, registration.getDevAddr());
            if (previousAddr != null && !previousAddr.equals(registration.getDevAddr())) {
                LOG.debug("moving device [appEui: {}, devEui: {}] from address [{}] to [{}]",
                        registration.getAppEui(), registration.getDevEui(), previousAddr, registration.getDevAddr());
                devices.computeIfPresent(previousAddr, (addr, list) -> {
                    final List<DeviceEntry> remaining = without(list, entry);
                    return remaining.isEmpty() ? null : remaining;
                });
            }
            devices.compute(registration.getDevAddr(), (addr, list) -> {
                final List<DeviceEntry> updated = list == null ? new ArrayList<>(1) : without(list, entry);
                updated.add(entry);
                return List.copyOf(updated);
            });
        }
        return Future.succeededFuture();
    }

    @Override
    public Future<Void> storeApplication(final ApplicationRegistration registration) {
        Objects.requireNonNull(registration);
        applications.put(registration.getAppEui(), registration);
        return Future.succeededFuture();
    }

    /**
     * Gets the registration of an application.
     *
     * @param appEui The application identifier.
     * @return A future indicating the outcome of the operation.
     *         <p>
     *         The future will be succeeded with the registration or failed with a
     *         {@link BehaviouralException} if no application with the identifier has been registered.
     * @throws NullPointerException if appEui is {@code null}.
     */
    public Future<ApplicationRegistration> lookupApplication(final Eui64 appEui) {
        Objects.requireNonNull(appEui);

        final ApplicationRegistration registration = applications.get(appEui);
        if (registration == null) {
            return Future.failedFuture(new BehaviouralException(
                    BrokerException.getLocalizedMessage("STORAGE_APPLICATION_NOT_FOUND")));
        }
        return Future.succeededFuture(registration);
    }

    // drops all entries of the same device, whatever their recipient and key
    private static List<DeviceEntry> without(final List<DeviceEntry> entries, final DeviceEntry device) {
        final List<DeviceEntry> result = new ArrayList<>(entries.size() + 1);
        for (final DeviceEntry existing : entries) {
            if (!(existing.getAppEui().equals(device.getAppEui())
                    && existing.getDevEui().equals(device.getDevEui()))) {
                result.add(existing);
            }
        }
        return result;
    }

    private static String getDeviceKey(final Eui64 appEui, final Eui64 devEui) {
        return appEui + ":" + devEui;
    }
}
