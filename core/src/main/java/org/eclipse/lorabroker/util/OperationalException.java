/*******************************************************************************
 * Copyright (c) 2016, 2023 Contributors to the Eclipse Foundation
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

package org.eclipse.lorabroker.util;

/**
 * Indicates a delivery or other operational failure downstream of the broker.
 *
 * @see ErrorKind#OPERATIONAL
 */
public class OperationalException extends BrokerException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception for a detail message.
     *
     * @param msg The detail message.
     */
    public OperationalException(final String msg) {
        this(msg, null);
    }

    /**
     * Creates a new exception for a root cause.
     *
     * @param cause The root cause.
     */
    public OperationalException(final Throwable cause) {
        this(null, cause);
    }

    /**
     * Creates a new exception for a detail message and a root cause.
     *
     * @param msg The detail message.
     * @param cause The root cause.
     */
    public OperationalException(final String msg, final Throwable cause) {
        super(ErrorKind.OPERATIONAL, msg, cause);
    }
}
