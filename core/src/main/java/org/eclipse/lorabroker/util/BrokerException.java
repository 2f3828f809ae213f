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

import java.util.Locale;
import java.util.MissingResourceException;
import java.util.Objects;
import java.util.Optional;
import java.util.ResourceBundle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Indicates an unsuccessful outcome of a broker operation or of an invocation of
 * one of the broker's collaborators.
 *
 */
public abstract class BrokerException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(BrokerException.class);

    private static final ResourceBundle resourceBundle;
    private static final String BUNDLE_NAME = BrokerException.class.getName() + "_messages";
    static {
        resourceBundle = ResourceBundle.getBundle(BUNDLE_NAME, Locale.getDefault());
    }

    private final ErrorKind kind;

    /**
     * Creates a new exception for a kind, a detail message and a root cause.
     *
     * @param kind The classification of the erroneous outcome.
     * @param msg The detail message or {@code null} if the default message should be used.
     * @param cause The root cause or {@code null} if unknown.
     * @throws NullPointerException if kind is {@code null}.
     */
    protected BrokerException(final ErrorKind kind, final String msg, final Throwable cause) {
        super(providedOrDefaultMessage(Objects.requireNonNull(kind), msg), cause);
        this.kind = kind;
    }

    /**
     * Gets the classification of the erroneous outcome.
     *
     * @return The kind.
     */
    public final ErrorKind getKind() {
        return kind;
    }

    private static String providedOrDefaultMessage(final ErrorKind kind, final String msg) {

        if (msg != null) {
            return msg;
        } else {
            return "Error Kind: " + kind;
        }
    }

    /**
     * Extracts the error kind from an exception.
     *
     * @param t The exception to extract the kind from.
     * @return The kind or an empty Optional if the exception is {@code null} or
     *         not of type {@link BrokerException}.
     */
    public static Optional<ErrorKind> extractKind(final Throwable t) {
        if (t instanceof BrokerException) {
            return Optional.of(((BrokerException) t).getKind());
        }
        return Optional.empty();
    }

    /**
     * Gets the localized error message with the given key.
     *
     * @param key The error message key.
     * @return The error message or the given key if no message was found.
     */
    public static String getLocalizedMessage(final String key) {
        try {
            return resourceBundle.getString(key);
        } catch (final MissingResourceException e) {
            LOG.debug("resource not found: {}", key);
            return key;
        }
    }
}
