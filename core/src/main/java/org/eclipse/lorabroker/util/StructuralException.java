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
 * Indicates that input to a broker operation is malformed or semantically invalid.
 *
 * @see ErrorKind#STRUCTURAL
 */
public class StructuralException extends BrokerException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception for a detail message.
     *
     * @param msg The detail message.
     */
    public StructuralException(final String msg) {
        this(msg, null);
    }

    /**
     * Creates a new exception for a root cause.
     *
     * @param cause The root cause.
     */
    public StructuralException(final Throwable cause) {
        this(null, cause);
    }

    /**
     * Creates a new exception for a detail message and a root cause.
     *
     * @param msg The detail message.
     * @param cause The root cause.
     */
    public StructuralException(final String msg, final Throwable cause) {
        super(ErrorKind.STRUCTURAL, msg, cause);
    }
}
