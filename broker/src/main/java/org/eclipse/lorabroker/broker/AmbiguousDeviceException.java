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
 * Indicates that more than one registered device authenticates the same packet.
 * <p>
 * Given soundly provisioned session keys this cannot happen. The condition is
 * therefore not classified by an {@link org.eclipse.lorabroker.util.ErrorKind}.
 */
public class AmbiguousDeviceException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception for a detail message.
     *
     * @param msg The detail message.
     */
    public AmbiguousDeviceException(final String msg) {
        super(msg);
    }
}
