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

package org.eclipse.devicebridge.plugin.app;

import java.net.HttpURLConnection;
import java.util.List;
import java.util.Objects;

import org.eclipse.devicebridge.config.ServerConfig;
import org.eclipse.devicebridge.plugin.PluginResponses;
import org.eclipse.devicebridge.plugin.http.HttpEndpoint;
import org.eclipse.devicebridge.plugin.http.HttpUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.ext.web.Router;

/**
 * A verticle that exposes HTTP endpoints to the host platform.
 *
 */
public final class PluginHttpServer extends AbstractVerticle {

    private static final Logger LOG = LoggerFactory.getLogger(PluginHttpServer.class);

    private final ServerConfig config;
    private final List<HttpEndpoint> endpoints;

    private HttpServer server;

    /**
     * Creates a new server.
     *
     * @param config The server configuration.
     * @param endpoints The endpoints to expose.
     * @throws NullPointerException if any of the parameters are {@code null}.
     */
    public PluginHttpServer(final ServerConfig config, final List<HttpEndpoint> endpoints) {
        this.config = Objects.requireNonNull(config);
        this.endpoints = List.copyOf(Objects.requireNonNull(endpoints));
    }

    /**
     * Creates the router for handling requests.
     * <p>
     * Requests for unknown resources are answered with a <em>404</em> error envelope.
     *
     * @return The router.
     */
    Router createRouter() {
        final Router router = Router.router(vertx);
        for (final HttpEndpoint endpoint : endpoints) {
            endpoint.addRoutes(router);
        }
        router.errorHandler(HttpURLConnection.HTTP_NOT_FOUND, ctx -> HttpUtils.endWithEnvelope(
                ctx.response(),
                HttpURLConnection.HTTP_NOT_FOUND,
                PluginResponses.error(HttpURLConnection.HTTP_NOT_FOUND, "Resource not found")));
        return router;
    }

    @Override
    public void start(final Promise<Void> startPromise) {

        final HttpServerOptions options = new HttpServerOptions()
                .setHost(config.getBindAddress())
                .setPort(config.getPort());

        vertx.createHttpServer(options)
            .requestHandler(createRouter())
            .listen()
            .onSuccess(httpServer -> {
                this.server = httpServer;
                LOG.info("server listens on [{}:{}]", config.getBindAddress(), httpServer.actualPort());
            })
            .onFailure(t -> LOG.error("cannot bind to port [{}:{}]", config.getBindAddress(), config.getPort(), t))
            .<Void>mapEmpty()
            .onComplete(startPromise);
    }

    @Override
    public void stop(final Promise<Void> stopPromise) {
        if (server == null) {
            stopPromise.complete();
            return;
        }
        LOG.info("stopping server");
        server.close().onComplete(stopPromise);
    }

    /**
     * Gets the port that the server is listening on.
     *
     * @return The port or -1 if the server is not running.
     */
    public int getActualPort() {
        return server == null ? -1 : server.actualPort();
    }
}
