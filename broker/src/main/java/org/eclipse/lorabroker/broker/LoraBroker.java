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

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

import org.eclipse.lorabroker.packet.ApplicationPacket;
import org.eclipse.lorabroker.packet.DevAddr;
import org.eclipse.lorabroker.packet.UplinkPacketCodec;
import org.eclipse.lorabroker.tracing.TracingHelper;
import org.eclipse.lorabroker.util.BehaviouralException;
import org.eclipse.lorabroker.util.BrokerException;
import org.eclipse.lorabroker.util.StructuralException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.opentracing.Span;
import io.opentracing.SpanContext;
import io.opentracing.Tracer;
import io.opentracing.noop.NoopTracerFactory;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;

/**
 * A broker that keeps its registrations in a {@link Storage}.
 * <p>
 * Uplink frames are decoded, matched against the devices registered for the frame's
 * address by means of the frame's MIC, translated into application packets and handed
 * to an {@link Adapter} for delivery.
 */
public class LoraBroker implements Broker {

    /**
     * The name of the component set on the spans created by this broker.
     */
    public static final String COMPONENT = "lora-broker";
    /**
     * The operation name of the span created for a registration.
     */
    public static final String SPAN_NAME_REGISTER = "register";
    /**
     * The operation name of the span created for an uplink frame.
     */
    public static final String SPAN_NAME_HANDLE_UP = "handle uplink";

    private static final Logger LOG = LoggerFactory.getLogger(LoraBroker.class);

    private final Storage storage;
    private final UplinkPacketCodec codec;
    private Tracer tracer = NoopTracerFactory.create();

    /**
     * Creates a new broker using default configuration properties.
     *
     * @param storage The storage to keep registrations in.
     * @throws NullPointerException if storage is {@code null}.
     */
    public LoraBroker(final Storage storage) {
        this(storage, new BrokerConfigProperties());
    }

    /**
     * Creates a new broker.
     *
     * @param storage The storage to keep registrations in.
     * @param config The configuration properties.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public LoraBroker(final Storage storage, final BrokerConfigProperties config) {
        this.storage = Objects.requireNonNull(storage);
        Objects.requireNonNull(config);
        this.codec = new UplinkPacketCodec(config.getMaxPayloadSize(), config.getMaxMetadataSize());
    }

    /**
     * Sets the OpenTracing {@code Tracer} to use for tracing the processing
     * of requests.
     * <p>
     * If not set explicitly, the {@code NoopTracer} from OpenTracing will
     * be used.
     *
     * @param opentracingTracer The tracer.
     * @throws NullPointerException if tracer is {@code null}.
     */
    public final void setTracer(final Tracer opentracingTracer) {
        this.tracer = Objects.requireNonNull(opentracingTracer);
        LOG.info("using OpenTracing Tracer implementation [{}]", opentracingTracer.getClass().getName());
    }

    @Override
    public final Future<Void> register(
            final Registration registration,
            final AckNacker ackNacker,
            final SpanContext context) {

        Objects.requireNonNull(registration);
        Objects.requireNonNull(ackNacker);

        final Span span = TracingHelper.buildServerChildSpan(tracer, context, SPAN_NAME_REGISTER, COMPONENT)
                .start();

        final Future<Void> result;
        if (registration instanceof DeviceRegistration) {
            final DeviceRegistration device = (DeviceRegistration) registration;
            TracingHelper.setDevAddrTag(span, device.getDevAddr());
            TracingHelper.setDeviceTags(span, device.getAppEui(), device.getDevEui());
            LOG.info("registering device {}", device);
            result = invoke(() -> storage.storeDevice(device));
        } else if (registration instanceof ApplicationRegistration) {
            final ApplicationRegistration application = (ApplicationRegistration) registration;
            TracingHelper.setDeviceTags(span, application.getAppEui(), null);
            LOG.info("registering application {}", application);
            result = invoke(() -> storage.storeApplication(application));
        } else {
            LOG.debug("rejecting registration of unsupported type [{}]", registration.getClass().getName());
            result = Future.failedFuture(new StructuralException(
                    BrokerException.getLocalizedMessage("BROKER_UNSUPPORTED_REGISTRATION")));
        }
        return complete(result, ackNacker, span);
    }

    @Override
    public final Future<Void> handleUp(
            final Buffer data,
            final AckNacker ackNacker,
            final Adapter adapter,
            final SpanContext context) {

        Objects.requireNonNull(data);
        Objects.requireNonNull(ackNacker);
        Objects.requireNonNull(adapter);

        final Span span = TracingHelper.buildServerChildSpan(tracer, context, SPAN_NAME_HANDLE_UP, COMPONENT)
                .start();

        final Future<Void> result = Future.succeededFuture(data)
                .map(codec::decode)
                .compose(packet -> {
                    TracingHelper.setDevAddrTag(span, packet.getDevAddr());
                    return lookupCandidates(packet.getDevAddr(), span)
                            .map(candidates -> DeviceDisambiguator.disambiguate(packet, candidates))
                            .compose(device -> {
                                TracingHelper.setDeviceTags(span, device.getAppEui(), device.getDevEui());
                                final ApplicationPacket appPacket = PacketTranslator.translate(packet, device);
                                return invoke(() -> adapter.getRecipient(device.getRecipient()))
                                        .compose(recipient -> {
                                            LOG.debug("forwarding packet of device [appEui: {}, devEui: {}] to [{}]",
                                                    device.getAppEui(), device.getDevEui(), recipient.getAddress());
                                            return invoke(() -> adapter.send(appPacket, List.of(recipient)));
                                        });
                            });
                });
        return complete(result, ackNacker, span);
    }

    private Future<List<DeviceEntry>> lookupCandidates(final DevAddr devAddr, final Span span) {

        return invoke(() -> storage.lookupDevices(devAddr))
                .recover(t -> {
                    LOG.debug("failed to look up devices for address [{}]", devAddr, t);
                    if (t instanceof BehaviouralException) {
                        return Future.failedFuture(t);
                    }
                    return Future.failedFuture(new BehaviouralException(
                            BrokerException.getLocalizedMessage("BROKER_UNKNOWN_DEVICE"), t));
                })
                .compose(candidates -> {
                    if (candidates == null || candidates.isEmpty()) {
                        LOG.debug("no devices registered for address [{}]", devAddr);
                        return Future.failedFuture(new BehaviouralException(
                                BrokerException.getLocalizedMessage("BROKER_UNKNOWN_DEVICE")));
                    }
                    TracingHelper.TAG_CANDIDATES.set(span, candidates.size());
                    LOG.debug("found {} candidate(s) for address [{}]", candidates.size(), devAddr);
                    return Future.succeededFuture(candidates);
                });
    }

    /**
     * Reports the outcome of an operation to an ackNacker.
     * <p>
     * Exactly one of ack or nack is invoked.
     */
    private Future<Void> complete(final Future<Void> outcome, final AckNacker ackNacker, final Span span) {

        return outcome
                .compose(
                        ok -> invoke(() -> ackNacker.ack(null))
                            .onFailure(t -> {
                                LOG.debug("failed to deliver acknowledgment", t);
                                TracingHelper.logError(span, "failed to deliver acknowledgment", t);
                            }),
                        error -> {
                            LOG.debug("failed to process request: {}", error.getMessage());
                            TracingHelper.logError(span, error);
                            return invoke(() -> ackNacker.nack(error))
                                    .transform(ar -> {
                                        if (ar.failed()) {
                                            LOG.warn("failed to deliver negative acknowledgment", ar.cause());
                                        }
                                        return Future.<Void>failedFuture(error);
                                    });
                        })
                .onComplete(r -> span.finish());
    }

    /**
     * Invokes a collaborator.
     *
     * @param operation The invocation.
     * @return The collaborator's result or a failed future if the collaborator
     *         has thrown an exception or has not returned a result.
     */
    private static <T> Future<T> invoke(final Supplier<Future<T>> operation) {
        try {
            final Future<T> result = operation.get();
            if (result == null) {
                return Future.failedFuture(new IllegalStateException("collaborator did not return a result"));
            }
            return result;
        } catch (final RuntimeException e) {
            return Future.failedFuture(e);
        }
    }
}
