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

import java.util.Objects;

import org.eclipse.devicebridge.plugin.ResponseEnvelope;
import org.eclipse.devicebridge.util.Constants;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;

/**
 * A collection of utility methods for processing HTTP requests.
 *
 */
public final class HttpUtils {

    private HttpUtils() {
        // prevent instantiation
    }

    /**
     * Writes a response envelope to an HTTP response and ends the response.
     * <p>
     * The response's status code is set to the given value, the <em>content-type</em> header
     * is set to {@value Constants#CONTENT_TYPE_APPLICATION_JSON_UTF8}. If the response has already
     * been ended or closed, this method does nothing.
     *
     * @param response The HTTP response.
     * @param statusCode The HTTP status code.
     * @param envelope The envelope to write.
     * @throws NullPointerException if response or envelope are {@code null}.
     */
    public static void endWithEnvelope(
            final HttpServerResponse response,
            final int statusCode,
            final ResponseEnvelope<?> envelope) {

        Objects.requireNonNull(response);
        Objects.requireNonNull(envelope);

        if (response.ended() || response.closed()) {
            return;
        }
        final Buffer body = envelope.toJson().toBuffer();
        response.setStatusCode(statusCode);
        response.putHeader(HttpHeaders.CONTENT_TYPE, Constants.CONTENT_TYPE_APPLICATION_JSON_UTF8);
        response.putHeader(HttpHeaders.CONTENT_LENGTH, String.valueOf(body.length()));
        response.end(body);
    }

    /**
     * Gets the absolute URI of the given request.
     * <p>
     * In contrast to {@link HttpServerRequest#absoluteURI()} this method
     * won't return {@code null} if the URI is invalid (at least not if {@link HttpServerRequest#host()} is set).
     *
     * @param req The request to get the absolute URI from.
     * @return The absolute URI.
     * @throws NullPointerException if req is {@code null}.
     */
    public static String getAbsoluteURI(final HttpServerRequest req) {
        Objects.requireNonNull(req);
        final String uri = req.uri();
        if (uri.startsWith("http://") || uri.startsWith("https://")) {
            return uri;
        }
        final String host = req.host();
        if (host == null) {
            return req.absoluteURI();
        }
        return req.scheme() + "://" + host + uri;
    }
}
