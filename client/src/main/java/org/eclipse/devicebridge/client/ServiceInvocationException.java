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

package org.eclipse.devicebridge.client;

import java.net.HttpURLConnection;
import java.util.Optional;

/**
 * Indicates an unexpected outcome of a callback invocation or of a request to the remote platform.
 * <p>
 * The outcome is represented by an HTTP style error code which is propagated to the host platform
 * as the <em>code</em> of the response envelope.
 */
public abstract class ServiceInvocationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int errorCode;

    /**
     * Creates a new exception for an error code.
     *
     * @param errorCode The code representing the erroneous outcome.
     * @throws IllegalArgumentException if the code is not &ge; 400 and &lt; 600.
     */
    protected ServiceInvocationException(final int errorCode) {
        this(errorCode, null, null);
    }

    /**
     * Creates a new exception for an error code and a detail message.
     *
     * @param errorCode The code representing the erroneous outcome.
     * @param msg The detail message.
     * @throws IllegalArgumentException if the code is not &ge; 400 and &lt; 600.
     */
    protected ServiceInvocationException(final int errorCode, final String msg) {
        this(errorCode, msg, null);
    }

    /**
     * Creates a new exception for an error code, a detail message and a root cause.
     *
     * @param errorCode The code representing the erroneous outcome.
     * @param msg The detail message.
     * @param cause The root cause.
     * @throws IllegalArgumentException if the code is not &ge; 400 and &lt; 600.
     */
    protected ServiceInvocationException(final int errorCode, final String msg, final Throwable cause) {
        super(providedOrDefaultMessage(errorCode, msg), cause);
        if (errorCode < 400 || errorCode >= 600) {
            throw new IllegalArgumentException(String.format("illegal error code [%d], must be >= 400 and < 600", errorCode));
        } else {
            this.errorCode = errorCode;
        }
    }

    /**
     * Gets the code representing the erroneous outcome.
     *
     * @return The code.
     */
    public final int getErrorCode() {
        return errorCode;
    }

    private static String providedOrDefaultMessage(final int errorCode, final String msg) {

        if (msg != null) {
            return msg;
        } else {
            return "Error Code: " + errorCode;
        }
    }

    /**
     * Gets the error message suitable to be propagated to the host platform.
     * <p>
     * Client errors and errors reported by the remote platform carry their detail message.
     * Other server errors are reported using a generic message unless they carry an explicit
     * client facing message.
     *
     * @param t The exception to extract the message from, may be {@code null}.
     * @return The message or {@code null} if not set.
     */
    public static String getErrorMessageForExternalClient(final Throwable t) {
        if (t instanceof RemotePlatformException) {
            return t.getMessage();
        }
        if (t instanceof ServerErrorException serverError) {
            final String clientFacingMessage = serverError.getClientFacingMessage();
            if (clientFacingMessage != null) {
                return clientFacingMessage;
            }
            switch (serverError.getErrorCode()) {
            case HttpURLConnection.HTTP_INTERNAL_ERROR:
                return "Internal server error";
            case HttpURLConnection.HTTP_UNAVAILABLE:
                return "Temporarily unavailable";
            default:
                // fall through
            }
        }
        return Optional.ofNullable(t).map(Throwable::getMessage).orElse(null);
    }
}
