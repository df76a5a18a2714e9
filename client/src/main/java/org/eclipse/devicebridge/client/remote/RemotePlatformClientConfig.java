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

import java.util.Objects;

import com.google.common.base.MoreObjects;

import io.vertx.ext.web.client.WebClientOptions;

/**
 * Configuration properties for the client used for invoking the remote platform's HTTP API.
 *
 */
public class RemotePlatformClientConfig {

    /**
     * The default number of milliseconds to wait for a response.
     */
    public static final long DEFAULT_REQUEST_TIMEOUT = 10_000L;
    /**
     * The default number of milliseconds to wait for a connection to be established.
     */
    public static final int DEFAULT_CONNECT_TIMEOUT = 5_000;

    private long requestTimeout = DEFAULT_REQUEST_TIMEOUT;
    private int connectTimeout = DEFAULT_CONNECT_TIMEOUT;

    /**
     * Creates properties using default values.
     */
    public RemotePlatformClientConfig() {
        super();
    }

    /**
     * Creates properties using existing options.
     *
     * @param options The options to copy.
     * @throws NullPointerException if options is {@code null}.
     */
    public RemotePlatformClientConfig(final RemotePlatformClientOptions options) {
        super();
        Objects.requireNonNull(options);
        setRequestTimeout(options.requestTimeout());
        setConnectTimeout(options.connectTimeout());
    }

    /**
     * Gets the maximum time to wait for a response to a request.
     * <p>
     * The default value of this property is {@value #DEFAULT_REQUEST_TIMEOUT}.
     *
     * @return The timeout in milliseconds.
     */
    public final long getRequestTimeout() {
        return requestTimeout;
    }

    /**
     * Sets the maximum time to wait for a response to a request.
     *
     * @param timeout The timeout in milliseconds.
     * @throws IllegalArgumentException if timeout is not &gt; 0.
     */
    public final void setRequestTimeout(final long timeout) {
        if (timeout <= 0) {
            throw new IllegalArgumentException("request timeout must be > 0");
        }
        this.requestTimeout = timeout;
    }

    /**
     * Gets the maximum time to wait for a connection to be established.
     * <p>
     * The default value of this property is {@value #DEFAULT_CONNECT_TIMEOUT}.
     *
     * @return The timeout in milliseconds.
     */
    public final int getConnectTimeout() {
        return connectTimeout;
    }

    /**
     * Sets the maximum time to wait for a connection to be established.
     *
     * @param timeout The timeout in milliseconds.
     * @throws IllegalArgumentException if timeout is not &gt; 0.
     */
    public final void setConnectTimeout(final int timeout) {
        if (timeout <= 0) {
            throw new IllegalArgumentException("connect timeout must be > 0");
        }
        this.connectTimeout = timeout;
    }

    /**
     * Creates options for a vert.x web client based on these properties.
     *
     * @return The options.
     */
    public WebClientOptions getWebClientOptions() {
        return new WebClientOptions()
                .setConnectTimeout(connectTimeout)
                .setUserAgentEnabled(false);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("requestTimeout", requestTimeout)
                .add("connectTimeout", connectTimeout)
                .toString();
    }
}
