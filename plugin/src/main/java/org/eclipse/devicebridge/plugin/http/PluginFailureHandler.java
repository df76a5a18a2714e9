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

package org.eclipse.devicebridge.plugin.http;

import java.net.HttpURLConnection;
import java.util.Optional;

import org.eclipse.devicebridge.client.ClientErrorException;
import org.eclipse.devicebridge.client.ServiceInvocationException;
import org.eclipse.devicebridge.plugin.PluginResponses;
import org.eclipse.devicebridge.plugin.ResponseEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.handler.codec.http.HttpResponseStatus;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.HttpException;

/**
 * A handler for failures that have caused an HTTP request from the host platform to fail.
 * <p>
 * This handler can be registered on a {@code io.vertx.ext.web.Route} using its
 * <em>failureHandler</em> method. The handler maps the route's <em>failure</em> to an error
 * envelope. If the failure is a {@code ServiceInvocationException} then the HTTP status code
 * and the envelope's code are set to the exception's <em>errorCode</em>. Otherwise the status
 * code is set to the one from the routing context, if it is an error status code, or otherwise
 * it is set to 500.
 */
public class PluginFailureHandler implements Handler<RoutingContext> {

    private static final Logger LOG = LoggerFactory.getLogger(PluginFailureHandler.class);

    /**
     * Handles routing failures.
     * <p>
     * This method simply delegates to the next handler if the response is already
     * ended or the context is not failed.
     *
     * @param ctx The failing routing context.
     */
    @Override
    public void handle(final RoutingContext ctx) {

        if (!ctx.failed()) {
            LOG.debug("skipping processing of non-failed route");
            ctx.next();
            return;
        }
        if (ctx.response().ended()) {
            LOG.debug("skipping processing of failed route, response already ended");
            return;
        }

        final Throwable failure = ctx.failure();
        final ResponseEnvelope<Void> envelope;
        if (failure instanceof ServiceInvocationException) {
            envelope = PluginResponses.error(failure);
        } else if (failure instanceof HttpException ex) {
            envelope = PluginResponses.error(
                    ex.getStatusCode(),
                    Optional.ofNullable(ex.getPayload())
                        .orElseGet(() -> HttpResponseStatus.valueOf(ex.getStatusCode()).reasonPhrase()));
        } else if (ctx.statusCode() >= 400 && ctx.statusCode() < 600) {
            envelope = PluginResponses.error(
                    ctx.statusCode(),
                    HttpResponseStatus.valueOf(ctx.statusCode()).reasonPhrase());
        } else if (failure != null) {
            envelope = PluginResponses.error(failure);
        } else {
            envelope = PluginResponses.error(HttpURLConnection.HTTP_INTERNAL_ERROR, "Internal server error");
        }
        logError(ctx, envelope.getCode());
        HttpUtils.endWithEnvelope(ctx.response(), envelope.getCode(), envelope);
    }

    private static void logError(final RoutingContext ctx, final int status) {
        if (ctx.failure() instanceof ClientErrorException || ctx.failure() == null) {
            LOG.debug("handling failed route for request [method: {}, URI: {}, status: {}]: {}",
                    ctx.request().method(), HttpUtils.getAbsoluteURI(ctx.request()), status,
                    Optional.ofNullable(ctx.failure()).map(Throwable::getMessage).orElse(null));
        } else if (status >= HttpURLConnection.HTTP_INTERNAL_ERROR && !(ctx.failure() instanceof ServiceInvocationException)) {
            LOG.warn("unexpected error processing request [method: {}, URI: {}]",
                    ctx.request().method(), HttpUtils.getAbsoluteURI(ctx.request()), ctx.failure());
        } else {
            LOG.debug("handling failed route for request [method: {}, URI: {}, status: {}]",
                    ctx.request().method(), HttpUtils.getAbsoluteURI(ctx.request()), status, ctx.failure());
        }
    }
}
