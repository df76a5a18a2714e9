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

/**
 * Indicates a server error that occurred during a callback invocation or while
 * interacting with the remote platform.
 *
 */
public class ServerErrorException extends ServiceInvocationException {

    private static final long serialVersionUID = 1L;

    private String clientFacingMessage;

    /**
     * Creates a new exception for a server error code.
     *
     * @param errorCode The code representing the error that occurred.
     * @throws IllegalArgumentException if the code is not &ge; 500 and &lt; 600.
     */
    public ServerErrorException(final int errorCode) {
        this(errorCode, null, null);
    }

    /**
     * Creates a new exception for a server error code and a detail message.
     *
     * @param errorCode The code representing the error that occurred.
     * @param msg The detail message.
     * @throws IllegalArgumentException if the code is not &ge; 500 and &lt; 600.
     */
    public ServerErrorException(final int errorCode, final String msg) {
        this(errorCode, msg, null);
    }

    /**
     * Creates a new exception for a server error code and a root cause.
     *
     * @param errorCode The code representing the error that occurred.
     * @param cause The root cause.
     * @throws IllegalArgumentException if the code is not &ge; 500 and &lt; 600.
     */
    public ServerErrorException(final int errorCode, final Throwable cause) {
        this(errorCode, null, cause);
    }

    /**
     * Creates a new exception for a server error code, a detail message and a root cause.
     *
     * @param errorCode The code representing the error that occurred.
     * @param msg The detail message.
     * @param cause The root cause.
     * @throws IllegalArgumentException if the code is not &ge; 500 and &lt; 600.
     */
    public ServerErrorException(final int errorCode, final String msg, final Throwable cause) {
        super(errorCode, msg, cause);
        if (errorCode < 500 || errorCode >= 600) {
            throw new IllegalArgumentException("server error code must be >= 500 and < 600");
        }
    }

    /**
     * Sets the error message to be used when reporting this error to the host platform.
     *
     * @param clientFacingMessage The message or {@code null} to use the generic message
     *                            for the error code.
     */
    public final void setClientFacingMessage(final String clientFacingMessage) {
        this.clientFacingMessage = clientFacingMessage;
    }

    /**
     * Gets the error message to be used when reporting this error to the host platform.
     *
     * @return The message or {@code null} if not set.
     */
    public final String getClientFacingMessage() {
        return clientFacingMessage;
    }
}
