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

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.ConfigMapping.NamingStrategy;
import io.smallrye.config.WithDefault;

/**
 * Options for configuring the broker.
 *
 */
@ConfigMapping(prefix = "lorabroker.broker", namingStrategy = NamingStrategy.VERBATIM)
public interface BrokerOptions {

    /**
     * Gets the maximum number of bytes of an uplink packet's application payload.
     *
     * @return The number of bytes.
     */
    @WithDefault("242")
    int maxPayloadSize();

    /**
     * Gets the maximum number of bytes of an uplink packet's serialized metadata.
     *
     * @return The number of bytes.
     */
    @WithDefault("2048")
    int maxMetadataSize();
}
