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

package org.eclipse.lorabroker.tracing;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.eclipse.lorabroker.packet.DevAddr;
import org.eclipse.lorabroker.packet.Eui64;
import org.eclipse.lorabroker.util.BrokerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.opentracing.References;
import io.opentracing.Span;
import io.opentracing.SpanContext;
import io.opentracing.Tracer;
import io.opentracing.log.Fields;
import io.opentracing.tag.IntTag;
import io.opentracing.tag.StringTag;
import io.opentracing.tag.Tags;

/**
 * A helper class providing utility methods for interacting with the
 * OpenTracing API.
 *
 */
public final class TracingHelper {

    /**
     * An OpenTracing tag containing the (non-unique) address that a packet has been sent from.
     */
    public static final StringTag TAG_DEV_ADDR = new StringTag("dev_addr");
    /**
     * An OpenTracing tag containing the identifier of an application.
     */
    public static final StringTag TAG_APP_EUI = new StringTag("app_eui");
    /**
     * An OpenTracing tag containing the identifier of a device.
     */
    public static final StringTag TAG_DEV_EUI = new StringTag("dev_eui");
    /**
     * An OpenTracing tag indicating the number of devices registered for an address.
     */
    public static final IntTag TAG_CANDIDATES = new IntTag("candidates");
    /**
     * An OpenTracing tag indicating the kind of error that an operation has failed with.
     */
    public static final StringTag TAG_ERROR_KIND = new StringTag("error_kind");
    /**
     * The name of the field to use for logging the cause of an error.
     */
    public static final String ERROR_CAUSE_OBJECT = "error.cause.object";

    private static final Logger LOG = LoggerFactory.getLogger(TracingHelper.class);

    private TracingHelper() {
        // prevent instantiation
    }

    /**
     * Sets the tags identifying an authenticated device.
     *
     * @param span The span to set the tags on.
     * @param appEui The application that the device belongs to or {@code null} if unknown.
     * @param devEui The device identifier or {@code null} if unknown.
     */
    public static void setDeviceTags(final Span span, final Eui64 appEui, final Eui64 devEui) {
        if (span != null) {
            if (appEui != null) {
                TAG_APP_EUI.set(span, appEui.toString());
            }
            if (devEui != null) {
                TAG_DEV_EUI.set(span, devEui.toString());
            }
        }
    }

    /**
     * Sets the tag containing a device address.
     *
     * @param span The span to set the tag on.
     * @param devAddr The address or {@code null} if unknown.
     */
    public static void setDevAddrTag(final Span span, final DevAddr devAddr) {
        if (span != null && devAddr != null) {
            TAG_DEV_ADDR.set(span, devAddr.toString());
        }
    }

    /**
     * Creates a set of items to log for a message and an error.
     *
     * @param message The message.
     * @param error The error.
     * @return The items to log.
     */
    public static Map<String, Object> getErrorLogItems(final String message, final Throwable error) {
        final Map<String, Object> items = new HashMap<>(4);
        items.put(Fields.EVENT, Tags.ERROR.getKey());
        Optional.ofNullable(message)
                .ifPresent(ok -> items.put(Fields.MESSAGE, message));
        if (error != null) {
            // stack traces of broker exceptions do not add information to a trace
            items.put(Fields.ERROR_OBJECT, error instanceof BrokerException ? error.toString() : error);
            if (error.getCause() != null) {
                items.put(ERROR_CAUSE_OBJECT, error.getCause());
            }
        }
        return items;
    }

    /**
     * Marks an <em>OpenTracing</em> span as erroneous and logs a message.
     * <p>
     * This method does <em>not</em> finish the span.
     *
     * @param span The span to mark.
     * @param message The message to log on the span.
     * @throws NullPointerException if message is {@code null}.
     */
    public static void logError(final Span span, final String message) {
        Objects.requireNonNull(message);
        logError(span, message, null);
    }

    /**
     * Marks an <em>OpenTracing</em> span as erroneous and logs an exception.
     * <p>
     * The error's kind is set as a tag if the error is a {@link BrokerException}.
     * If the error represents an unexpected error (e.g. a {@code NullPointerException}), a <em>WARN</em>
     * log entry will be created on the {@link Logger} of this class.
     * <p>
     * This method does <em>not</em> finish the span.
     *
     * @param span The span to mark.
     * @param error The exception that has occurred.
     * @throws NullPointerException if error is {@code null}.
     */
    public static void logError(final Span span, final Throwable error) {
        Objects.requireNonNull(error);
        logError(span, null, error);
    }

    /**
     * Marks an <em>OpenTracing</em> span as erroneous, logs a message and an error.
     * <p>
     * This method does <em>not</em> finish the span.
     *
     * @param span The span to mark.
     * @param message The message to log on the span.
     * @param error The error to log on the span.
     * @throws NullPointerException if both message and error are {@code null}.
     */
    public static void logError(final Span span, final String message, final Throwable error) {
        if (message == null && error == null) {
            throw new NullPointerException("Either message or error must not be null");
        }
        logUnexpectedError(error);
        if (span != null) {
            Tags.ERROR.set(span, Boolean.TRUE);
            BrokerException.extractKind(error).ifPresent(kind -> TAG_ERROR_KIND.set(span, kind.name()));
            span.log(getErrorLogItems(message, error));
        }
    }

    private static void logUnexpectedError(final Throwable error) {
        if (error instanceof NullPointerException
                || error instanceof IllegalArgumentException) {
            LOG.warn("An unexpected error occurred!", error);
        }
    }

    /**
     * Creates a span builder that is initialized with the given operation name and a child-of reference to the given
     * span context (if set).
     * <p>
     * The builder is configured to ignore the active span and to set the span kind to server.
     *
     * @param tracer The Tracer to use.
     * @param spanContext The span context that shall be the parent of the Span being built (may be null).
     * @param operationName The operation name to set for the span.
     * @param component The component to set for the span.
     * @return The span builder.
     * @throws NullPointerException if tracer or operationName is {@code null}.
     */
    public static Tracer.SpanBuilder buildServerChildSpan(final Tracer tracer, final SpanContext spanContext,
            final String operationName, final String component) {
        Objects.requireNonNull(tracer);
        Objects.requireNonNull(operationName);
        return tracer.buildSpan(operationName)
                .addReference(References.CHILD_OF, spanContext)
                .ignoreActiveSpan()
                .withTag(Tags.COMPONENT.getKey(), component)
                .withTag(Tags.SPAN_KIND.getKey(), Tags.SPAN_KIND_SERVER);
    }
}
