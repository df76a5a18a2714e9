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

package org.eclipse.devicebridge.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Options for configuring the plugin's HTTP server that the host platform invokes callbacks on.
 *
 */
@ConfigMapping(prefix = "plugin.server", namingStrategy = ConfigMapping.NamingStrategy.KEBAB_CASE)
public interface ServerOptions {

    /**
     * Gets the host name or literal IP address of the network interface that this server is configured to
     * be bound to.
     *
     * @return The host name.
     */
    @WithDefault(ServerConfig.DEFAULT_BIND_ADDRESS)
    String bindAddress();

    /**
     * Gets the port this server is configured to listen on.
     *
     * @return The port number.
     */
    @WithDefault("" + ServerConfig.DEFAULT_PORT)
    int port();
}
