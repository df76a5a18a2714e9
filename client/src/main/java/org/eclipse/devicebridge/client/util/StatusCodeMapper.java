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

package org.eclipse.devicebridge.client.util;

import org.eclipse.devicebridge.client.RemotePlatformException;

/**
 * Utility class for interpreting HTTP status codes and the codes reported by the remote platform.
 *
 */
public abstract class StatusCodeMapper {

    /**
     * The code that the remote platform uses for indicating a successful outcome.
     */
    public static final int REMOTE_CODE_SUCCESS = 0;

    private StatusCodeMapper() {
    }

    /**
     * Checks if a given status code represents a successful invocation.
     *
     * @param statusCode The code to check.
     * @return {@code true} if the code is not {@code null} and 200 =&lt; code &lt; 300.
     */
    public static final boolean isSuccessful(final Integer statusCode) {
        return statusCode != null && statusCode >= 200 && statusCode < 300;
    }

    /**
     * Checks if a code reported by the remote platform in a response body represents success.
     *
     * @param remoteCode The code to check.
     * @return {@code true} if the code is {@value #REMOTE_CODE_SUCCESS}.
     */
    public static final boolean isRemoteSuccess(final int remoteCode) {
        return remoteCode == REMOTE_CODE_SUCCESS;
    }

    /**
     * Creates an exception for a logical failure reported by the remote platform.
     *
     * @param remoteCode The non-zero code contained in the remote platform's response.
     * @param remoteMessage The message contained in the remote platform's response.
     * @return The exception.
     * @throws IllegalArgumentException if the code represents success.
     */
    public static final RemotePlatformException fromRemote(final int remoteCode, final String remoteMessage) {
        if (isRemoteSuccess(remoteCode)) {
            throw new IllegalArgumentException("remote code does not represent an error");
        }
        return new RemotePlatformException(remoteCode, remoteMessage);
    }
}
