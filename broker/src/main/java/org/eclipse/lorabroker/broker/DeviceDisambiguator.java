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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.eclipse.lorabroker.packet.MicCalculator;
import org.eclipse.lorabroker.packet.UplinkPacket;
import org.eclipse.lorabroker.util.BehaviouralException;
import org.eclipse.lorabroker.util.BrokerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Determines which of the devices sharing an address has sent a packet.
 * <p>
 * Each candidate's network session key is used to recompute the packet's MIC.
 * None of the candidates is trusted before its key has reproduced the MIC.
 */
public final class DeviceDisambiguator {

    private static final Logger LOG = LoggerFactory.getLogger(DeviceDisambiguator.class);

    private DeviceDisambiguator() {
        // prevent instantiation
    }

    /**
     * Finds the single device that authenticates a packet.
     *
     * @param packet The packet.
     * @param candidates The devices registered for the packet's address, in lookup order.
     * @return The device whose network session key reproduces the packet's MIC.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws BehaviouralException if none of the candidates authenticates the packet.
     * @throws AmbiguousDeviceException if more than one candidate authenticates the packet.
     */
    public static DeviceEntry disambiguate(final UplinkPacket packet, final List<DeviceEntry> candidates) {

        Objects.requireNonNull(packet);
        Objects.requireNonNull(candidates);

        final List<DeviceEntry> matches = new ArrayList<>(1);
        for (final DeviceEntry candidate : candidates) {
            if (MicCalculator.verify(packet, candidate.getNwkSKey())) {
                matches.add(candidate);
            }
        }

        switch (matches.size()) {
        case 0:
            LOG.debug("none of {} candidates for address [{}] authenticates packet",
                    candidates.size(), packet.getDevAddr());
            throw new BehaviouralException(BrokerException.getLocalizedMessage("BROKER_UNKNOWN_DEVICE"));
        case 1:
            return matches.get(0);
        default:
            LOG.error("{} devices registered for address [{}] authenticate the same packet, check key provisioning: {}",
                    matches.size(), packet.getDevAddr(), matches);
            throw new AmbiguousDeviceException(String.format(
                    "%d devices registered for address [%s] authenticate the same packet",
                    matches.size(), packet.getDevAddr()));
        }
    }
}
