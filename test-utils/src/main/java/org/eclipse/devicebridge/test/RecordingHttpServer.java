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

package org.eclipse.devicebridge.test;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import io.vertx.core.Future;
import io.vertx.core.MultiMap;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;

/**
 * An HTTP server listening on an arbitrary local port which records all requests it receives
 * and answers them with a canned response.
 * <p>
 * Tests use this server for standing in for the remote device platform.
 */
public final class RecordingHttpServer {

    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private final Vertx vertx;

    private volatile int responseStatus = 200;
    private volatile String responseBody = "{}";
    private volatile boolean respond = true;
    private HttpServer server;

    /**
     * A request received by the server.
     */
    public static final class RecordedRequest {

        private final String method;
        private final String path;
        private final MultiMap headers;
        private final Buffer body;

        RecordedRequest(final RoutingContext ctx) {
            this.method = ctx.request().method().name();
            this.path = ctx.request().path();
            this.headers = MultiMap.caseInsensitiveMultiMap().addAll(ctx.request().headers());
            this.body = ctx.body().buffer();
        }

        public String getMethod() {
            return method;
        }

        public String getPath() {
            return path;
        }

        /**
         * Gets the value of a request header.
         *
         * @param name The (case insensitive) name of the header.
         * @return The value or {@code null} if the request did not contain the header.
         */
        public String getHeader(final String name) {
            return headers.get(name);
        }

        /**
         * Gets the request body.
         *
         * @return The body or {@code null} if the request had no body.
         */
        public Buffer getBody() {
            return body;
        }
    }

    /**
     * Creates a new server.
     *
     * @param vertx The vert.x instance to run on.
     * @throws NullPointerException if vertx is {@code null}.
     */
    public RecordingHttpServer(final Vertx vertx) {
        this.vertx = Objects.requireNonNull(vertx);
    }

    /**
     * Starts the server on an arbitrary unused port of the loopback interface.
     *
     * @return A future indicating the outcome.
     */
    public Future<RecordingHttpServer> start() {
        final Router router = Router.router(vertx);
        router.route().handler(BodyHandler.create());
        router.route().handler(ctx -> {
            requests.add(new RecordedRequest(ctx));
            if (respond) {
                ctx.response()
                    .setStatusCode(responseStatus)
                    .putHeader("content-type", "application/json")
                    .end(responseBody);
            }
        });
        return vertx.createHttpServer(new HttpServerOptions().setHost("127.0.0.1").setPort(0))
                .requestHandler(router)
                .listen()
                .map(s -> {
                    this.server = s;
                    return this;
                });
    }

    /**
     * Stops the server.
     *
     * @return A future indicating the outcome.
     */
    public Future<Void> stop() {
        if (server == null) {
            return Future.succeededFuture();
        }
        return server.close();
    }

    /**
     * Gets the base URL that the server can be reached at.
     *
     * @return The URL, e.g. {@code http://127.0.0.1:38723}.
     * @throws IllegalStateException if the server has not been started.
     */
    public String getBaseUrl() {
        if (server == null) {
            throw new IllegalStateException("server not started");
        }
        return "http://127.0.0.1:" + server.actualPort();
    }

    /**
     * Sets the response to send for all subsequent requests.
     *
     * @param status The HTTP status code.
     * @param body The response body.
     * @return This server for command chaining.
     */
    public RecordingHttpServer respondWith(final int status, final String body) {
        this.responseStatus = status;
        this.responseBody = Objects.requireNonNull(body);
        this.respond = true;
        return this;
    }

    /**
     * Lets the server record subsequent requests without ever responding to them.
     *
     * @return This server for command chaining.
     */
    public RecordingHttpServer neverRespond() {
        this.respond = false;
        return this;
    }

    /**
     * Gets the requests received so far.
     *
     * @return The requests in the order of reception.
     */
    public List<RecordedRequest> getRequests() {
        return List.copyOf(requests);
    }
}
