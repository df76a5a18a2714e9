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

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Options for configuring the connection to the host platform's MQTT broker.
 *
 */
@ConfigMapping(prefix = "plugin.platform", namingStrategy = ConfigMapping.NamingStrategy.KEBAB_CASE)
public interface MqttStatusSenderOptions {

    /**
     * Gets the host name or IP address of the broker.
     *
     * @return The host.
     */
    @WithDefault(MqttStatusSenderConfig.DEFAULT_HOST)
    String mqttHost();

    /**
     * Gets the port of the broker.
     *
     * @return The port.
     */
    @WithDefault("" + MqttStatusSenderConfig.DEFAULT_PORT)
    int mqttPort();

    /**
     * Gets the name to authenticate to the broker with.
     *
     * @return The user name.
     */
    Optional<String> mqttUsername();

    /**
     * Gets the password to authenticate to the broker with.
     *
     * @return The password.
     */
    Optional<String> mqttPassword();

    /**
     * Gets the client identifier to use for connecting to the broker.
     *
     * @return The identifier.
     */
    @WithDefault(MqttStatusSenderConfig.DEFAULT_CLIENT_ID)
    String clientId();

    /**
     * Gets the prefix of the topics that status messages are published to.
     * <p>
     * The device identifier is appended to the prefix.
     *
     * @return The prefix.
     */
    @WithDefault(MqttStatusSenderConfig.DEFAULT_STATUS_TOPIC_PREFIX)
    String statusTopicPrefix();
}
