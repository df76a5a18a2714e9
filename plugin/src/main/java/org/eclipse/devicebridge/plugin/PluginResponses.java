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

package org.eclipse.devicebridge.plugin;

import java.net.HttpURLConnection;
import java.util.Objects;
import java.util.Optional;

import org.eclipse.devicebridge.client.ServiceInvocationException;

/**
 * Utility methods for creating the responses sent to the host platform.
 *
 */
public final class PluginResponses {

    /**
     * The code indicating a successful outcome.
     */
    public static final int CODE_SUCCESS = HttpURLConnection.HTTP_OK;
    /**
     * The message indicating a successful outcome.
     */
    public static final String MESSAGE_SUCCESS = "success";

    private static final String MESSAGE_INTERNAL_ERROR = "Internal server error";

    private PluginResponses() {
        // prevent instantiation
    }

    /**
     * Creates a success envelope without data.
     *
     * @param <T> The type of data.
     * @return The envelope.
     */
    public static <T> ResponseEnvelope<T> success() {
        return new ResponseEnvelope<>(CODE_SUCCESS, MESSAGE_SUCCESS, null, false);
    }

    /**
     * Creates a success envelope for data.
     *
     * @param <T> The type of data.
     * @param data The data to include (may be {@code null}).
     * @return The envelope.
     */
    public static <T> ResponseEnvelope<T> success(final T data) {
        return new ResponseEnvelope<>(CODE_SUCCESS, MESSAGE_SUCCESS, data, true);
    }

    /**
     * Creates an error envelope for a failure.
     * <p>
     * A {@link ServiceInvocationException} is mapped to its error code and the message that
     * may be disclosed to the host platform. Any other error is mapped to a
     * <em>500: Internal server error</em>.
     *
     * @param <T> The type of data.
     * @param error The failure.
     * @return The envelope.
     * @throws NullPointerException if error is {@code null}.
     */
    public static <T> ResponseEnvelope<T> error(final Throwable error) {
        Objects.requireNonNull(error);
        if (error instanceof ServiceInvocationException e) {
            final String message = Optional.ofNullable(ServiceInvocationException.getErrorMessageForExternalClient(e))
                    .orElse(MESSAGE_INTERNAL_ERROR);
            return new ResponseEnvelope<>(e.getErrorCode(), message, null, false);
        }
        return new ResponseEnvelope<>(HttpURLConnection.HTTP_INTERNAL_ERROR, MESSAGE_INTERNAL_ERROR, null, false);
    }

    /**
     * Creates an error envelope for a status code.
     *
     * @param <T> The type of data.
     * @param statusCode The status code.
     * @param message The message.
     * @return The envelope.
     * @throws NullPointerException if message is {@code null}.
     */
    public static <T> ResponseEnvelope<T> error(final int statusCode, final String message) {
        return new ResponseEnvelope<>(statusCode, message, null, false);
    }
}
