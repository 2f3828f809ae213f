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

package org.eclipse.lorabroker.util;

/**
 * The classification of an unsuccessful outcome of a broker operation.
 * <p>
 * Callers use the kind to decide whether to drop, retry or escalate.
 */
public enum ErrorKind {

    /**
     * The input itself is malformed or semantically invalid.
     * <p>
     * Resending the same input unmodified will fail again.
     */
    STRUCTURAL(false),
    /**
     * The input is well formed but does not correspond to any known or
     * authenticated entity.
     * <p>
     * Retrying only makes sense once the directory state has changed, e.g. after
     * a registration.
     */
    BEHAVIOURAL(true),
    /**
     * A downstream delivery or other operational problem.
     * <p>
     * Retrying, typically with back-off, is at the caller's discretion.
     */
    OPERATIONAL(true);

    private final boolean retryable;

    ErrorKind(final boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Checks if resubmitting the same input may eventually succeed.
     *
     * @return {@code true} if a retry may succeed.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
