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

import java.util.Objects;

import org.eclipse.devicebridge.util.Strings;

import com.google.common.base.MoreObjects;

import io.vertx.mqtt.MqttClientOptions;

/**
 * Configuration properties for the connection to the host platform's MQTT broker.
 *
 */
public class MqttStatusSenderConfig {

    /**
     * The default host of the broker.
     */
    public static final String DEFAULT_HOST = "localhost";
    /**
     * The default port of the broker.
     */
    public static final int DEFAULT_PORT = 1883;
    /**
     * The default client identifier.
     */
    public static final String DEFAULT_CLIENT_ID = "device-bridge-plugin";
    /**
     * The default prefix of status topics.
     */
    public static final String DEFAULT_STATUS_TOPIC_PREFIX = "devices/status/";

    private String host = DEFAULT_HOST;
    private int port = DEFAULT_PORT;
    private String username;
    private String password;
    private String clientId = DEFAULT_CLIENT_ID;
    private String statusTopicPrefix = DEFAULT_STATUS_TOPIC_PREFIX;

    /**
     * Creates properties using default values.
     */
    public MqttStatusSenderConfig() {
        super();
    }

    /**
     * Creates properties using existing options.
     *
     * @param options The options to copy.
     * @throws NullPointerException if options is {@code null}.
     */
    public MqttStatusSenderConfig(final MqttStatusSenderOptions options) {
        super();
        Objects.requireNonNull(options);
        setHost(options.mqttHost());
        setPort(options.mqttPort());
        options.mqttUsername().ifPresent(this::setUsername);
        options.mqttPassword().ifPresent(this::setPassword);
        setClientId(options.clientId());
        setStatusTopicPrefix(options.statusTopicPrefix());
    }

    public final String getHost() {
        return host;
    }

    /**
     * Sets the host name or IP address of the broker.
     *
     * @param host The host.
     * @throws NullPointerException if host is {@code null}.
     */
    public final void setHost(final String host) {
        this.host = Objects.requireNonNull(host);
    }

    public final int getPort() {
        return port;
    }

    /**
     * Sets the port of the broker.
     *
     * @param port The port.
     * @throws IllegalArgumentException if port is not in the range 1 - 65535.
     */
    public final void setPort(final int port) {
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("invalid port number");
        }
        this.port = port;
    }

    public final String getUsername() {
        return username;
    }

    public final void setUsername(final String username) {
        this.username = username;
    }

    public final String getPassword() {
        return password;
    }

    public final void setPassword(final String password) {
        this.password = password;
    }

    public final String getClientId() {
        return clientId;
    }

    /**
     * Sets the client identifier to use for connecting to the broker.
     *
     * @param clientId The identifier.
     * @throws NullPointerException if client ID is {@code null}.
     */
    public final void setClientId(final String clientId) {
        this.clientId = Objects.requireNonNull(clientId);
    }

    public final String getStatusTopicPrefix() {
        return statusTopicPrefix;
    }

    /**
     * Sets the prefix of the topics that status messages are published to.
     *
     * @param prefix The prefix.
     * @throws NullPointerException if prefix is {@code null}.
     */
    public final void setStatusTopicPrefix(final String prefix) {
        this.statusTopicPrefix = Objects.requireNonNull(prefix);
    }

    /**
     * Gets the topic to publish a device's status to.
     *
     * @param deviceId The identifier that the host platform uses for the device.
     * @return The topic.
     * @throws NullPointerException if device ID is {@code null}.
     */
    public final String getStatusTopic(final String deviceId) {
        Objects.requireNonNull(deviceId);
        return statusTopicPrefix + deviceId;
    }

    /**
     * Creates options for a vert.x MQTT client based on these properties.
     *
     * @return The options.
     */
    public MqttClientOptions getClientOptions() {
        final MqttClientOptions options = new MqttClientOptions()
                .setClientId(clientId)
                .setAutoKeepAlive(true)
                .setCleanSession(true);
        if (!Strings.isNullOrEmpty(username)) {
            options.setUsername(username);
            options.setPassword(password);
        }
        return options;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("host", host)
                .add("port", port)
                .add("username", username)
                .add("clientId", clientId)
                .add("statusTopicPrefix", statusTopicPrefix)
                .toString();
    }
}
