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

package org.eclipse.devicebridge.client.remote;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Options for configuring the client used for invoking the remote platform's HTTP API.
 *
 */
@ConfigMapping(prefix = "plugin.remote", namingStrategy = ConfigMapping.NamingStrategy.KEBAB_CASE)
public interface RemotePlatformClientOptions {

    /**
     * Gets the maximum time to wait for a response to a request.
     *
     * @return The timeout in milliseconds.
     */
    @WithDefault("" + RemotePlatformClientConfig.DEFAULT_REQUEST_TIMEOUT)
    long requestTimeout();

    /**
     * Gets the maximum time to wait for a connection to the remote platform to be established.
     *
     * @return The timeout in milliseconds.
     */
    @WithDefault("" + RemotePlatformClientConfig.DEFAULT_CONNECT_TIMEOUT)
    int connectTimeout();
}
