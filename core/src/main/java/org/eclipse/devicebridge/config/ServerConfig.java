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

import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * Configuration properties for the plugin's HTTP server.
 *
 */
public class ServerConfig {

    /**
     * The default address to bind to.
     */
    public static final String DEFAULT_BIND_ADDRESS = "0.0.0.0";
    /**
     * The default port to listen on.
     */
    public static final int DEFAULT_PORT = 8080;

    private String bindAddress = DEFAULT_BIND_ADDRESS;
    private int port = DEFAULT_PORT;

    /**
     * Creates properties using default values.
     */
    public ServerConfig() {
        super();
    }

    /**
     * Creates properties using existing options.
     *
     * @param options The options to copy.
     * @throws NullPointerException if options is {@code null}.
     */
    public ServerConfig(final ServerOptions options) {
        super();
        Objects.requireNonNull(options);
        setBindAddress(options.bindAddress());
        setPort(options.port());
    }

    /**
     * Gets the host name or literal IP address of the network interface that this server is bound to.
     *
     * @return The address.
     */
    public final String getBindAddress() {
        return bindAddress;
    }

    /**
     * Sets the host name or literal IP address of the network interface that this server should bind to.
     *
     * @param address The address.
     * @throws NullPointerException if address is {@code null}.
     */
    public final void setBindAddress(final String address) {
        this.bindAddress = Objects.requireNonNull(address);
    }

    /**
     * Gets the port this server listens on.
     * <p>
     * A value of 0 means that an arbitrary unused port is chosen during startup.
     *
     * @return The port number.
     */
    public final int getPort() {
        return port;
    }

    /**
     * Sets the port this server should listen on.
     *
     * @param port The port number.
     * @throws IllegalArgumentException if port is not in the range 0 - 65535.
     */
    public final void setPort(final int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("invalid port number");
        }
        this.port = port;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("bindAddress", bindAddress)
                .add("port", port)
                .toString();
    }
}
