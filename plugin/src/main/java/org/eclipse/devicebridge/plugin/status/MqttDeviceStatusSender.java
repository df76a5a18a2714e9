/*******************************************************************************
 * Copyright (c) 2026 Contributors to the Eclipse Foundation
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

package org.eclipse.devicebridge.plugin.status;

import java.net.HttpURLConnection;
import java.util.Objects;

import org.eclipse.devicebridge.client.ServerErrorException;
import org.eclipse.devicebridge.devicestatus.DeviceStatus;
import org.eclipse.devicebridge.tracing.TracingHelper;
import org.eclipse.devicebridge.util.Lifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.handler.codec.mqtt.MqttQoS;
import io.opentracing.References;
import io.opentracing.Span;
import io.opentracing.SpanContext;
import io.opentracing.Tracer;
import io.opentracing.tag.Tags;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.mqtt.MqttClient;

/**
 * A sender that publishes device status messages to the host platform's MQTT broker.
 * <p>
 * The status of a device is published to topic <em>${prefix}${device-id}</em> at QoS 1 with the
 * status' wire value as payload. The connection to the broker is established on demand and
 * callers that request a connection while an attempt is in progress share the outcome of that attempt.
 */
public final class MqttDeviceStatusSender implements DeviceStatusSender, Lifecycle {

    private static final Logger LOG = LoggerFactory.getLogger(MqttDeviceStatusSender.class);

    private final MqttClient client;
    private final MqttStatusSenderConfig config;
    private final Tracer tracer;

    private Future<Void> connectionAttempt;

    /**
     * Creates a new sender.
     *
     * @param client The MQTT client to use for publishing messages.
     * @param config The broker connection properties.
     * @param tracer The tracer to use for tracking the publishing of messages.
     * @throws NullPointerException if any of the parameters are {@code null}.
     */
    public MqttDeviceStatusSender(
            final MqttClient client,
            final MqttStatusSenderConfig config,
            final Tracer tracer) {

        this.client = Objects.requireNonNull(client);
        this.config = Objects.requireNonNull(config);
        this.tracer = Objects.requireNonNull(tracer);
        client.closeHandler(v -> LOG.info("lost connection to MQTT broker [host: {}, port: {}]",
                config.getHost(), config.getPort()));
    }

    /**
     * Creates a new sender using a client that is configured according to the given properties.
     *
     * @param vertx The vert.x instance to run on.
     * @param config The broker connection properties.
     * @param tracer The tracer to use for tracking the publishing of messages.
     * @return The sender.
     * @throws NullPointerException if any of the parameters are {@code null}.
     */
    public static MqttDeviceStatusSender create(
            final Vertx vertx,
            final MqttStatusSenderConfig config,
            final Tracer tracer) {

        Objects.requireNonNull(vertx);
        Objects.requireNonNull(config);
        return new MqttDeviceStatusSender(MqttClient.create(vertx, config.getClientOptions()), config, tracer);
    }

    /**
     * {@inheritDoc}
     * <p>
     * Tries to connect to the broker. The returned future is succeeded even if the broker
     * cannot be reached because the connection is re-attempted when a status is sent.
     */
    @Override
    public Future<Void> start() {
        return connect()
                .recover(t -> {
                    LOG.warn("MQTT broker not available (yet), will retry on demand [host: {}, port: {}]",
                            config.getHost(), config.getPort());
                    return Future.succeededFuture();
                });
    }

    @Override
    public Future<Void> stop() {
        synchronized (this) {
            connectionAttempt = null;
        }
        if (client.isConnected()) {
            LOG.info("disconnecting from MQTT broker");
            return client.disconnect();
        }
        return Future.succeededFuture();
    }

    /**
     * Gets a connection to the broker.
     *
     * @return A future indicating the outcome of the connection attempt.
     */
    synchronized Future<Void> connect() {
        if (client.isConnected()) {
            return Future.succeededFuture();
        }
        if (connectionAttempt != null && !connectionAttempt.isComplete()) {
            LOG.trace("connection attempt already in progress");
            return connectionAttempt;
        }
        LOG.debug("connecting to MQTT broker [host: {}, port: {}, client-id: {}]",
                config.getHost(), config.getPort(), config.getClientId());
        connectionAttempt = client.connect(config.getPort(), config.getHost())
                .onSuccess(ack -> LOG.info("connected to MQTT broker [host: {}, port: {}]",
                        config.getHost(), config.getPort()))
                .<Void>mapEmpty()
                .recover(t -> {
                    LOG.debug("failed to connect to MQTT broker [host: {}, port: {}]: {}",
                            config.getHost(), config.getPort(), t.getMessage());
                    return Future.failedFuture(new ServerErrorException(
                            HttpURLConnection.HTTP_UNAVAILABLE,
                            "host platform broker unavailable",
                            t));
                });
        return connectionAttempt;
    }

    @Override
    public Future<Void> sendStatus(final String deviceId, final DeviceStatus status, final SpanContext context) {

        Objects.requireNonNull(deviceId);
        Objects.requireNonNull(status);

        final String topic = config.getStatusTopic(deviceId);
        final Span span = tracer.buildSpan("publish device status")
                .addReference(References.CHILD_OF, context)
                .ignoreActiveSpan()
                .withTag(Tags.COMPONENT.getKey(), getClass().getSimpleName())
                .withTag(Tags.SPAN_KIND.getKey(), Tags.SPAN_KIND_PRODUCER)
                .withTag(Tags.MESSAGE_BUS_DESTINATION.getKey(), topic)
                .start();
        TracingHelper.TAG_DEVICE_ID.set(span, deviceId);

        return connect()
                .compose(ok -> client.publish(
                        topic,
                        Buffer.buffer(status.getWireValue()),
                        MqttQoS.AT_LEAST_ONCE,
                        false,
                        false))
                .recover(t -> {
                    if (t instanceof ServerErrorException) {
                        return Future.failedFuture(t);
                    }
                    return Future.failedFuture(new ServerErrorException(
                            HttpURLConnection.HTTP_UNAVAILABLE,
                            "failed to publish device status",
                            t));
                })
                .onSuccess(packetId -> LOG.debug("published device status [device-id: {}, status: {}, topic: {}]",
                        deviceId, status, topic))
                .onFailure(t -> {
                    LOG.info("failed to publish device status [device-id: {}, status: {}]: {}",
                            deviceId, status, t.getMessage());
                    TracingHelper.logError(span, t);
                })
                .<Void>mapEmpty()
                .onComplete(r -> span.finish());
    }
}
