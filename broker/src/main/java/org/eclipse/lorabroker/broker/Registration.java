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

import io.vertx.core.buffer.Buffer;

/**
 * A request to bind an identity to a recipient.
 * <p>
 * The broker supports {@link DeviceRegistration}s and {@link ApplicationRegistration}s.
 * Any other type of registration is rejected.
 */
public interface Registration {

    /**
     * Gets the raw descriptor of the recipient that packets should be forwarded to.
     *
     * @return The descriptor.
     */
    Buffer getRecipient();
}
