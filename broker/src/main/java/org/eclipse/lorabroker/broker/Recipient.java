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

/**
 * A target that application packets can be delivered to, e.g. a handler endpoint.
 * <p>
 * Recipients are created by an {@link Adapter} from the raw recipient
 * descriptors stored along with devices.
 */
public interface Recipient {

    /**
     * Gets the address that packets are delivered to.
     *
     * @return The address.
     */
    String getAddress();
}
