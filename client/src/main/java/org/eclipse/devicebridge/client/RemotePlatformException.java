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

/**
 * Indicates that the remote platform has reported a logical failure by means of a non-zero
 * <em>code</em> in its response.
 * <p>
 * The remote platform's code and message are preserved. The message of this exception
 * contains the remote message.
 */
public class RemotePlatformException extends ServerErrorException {

    private static final long serialVersionUID = 1L;

    private final int remoteCode;
    private final String remoteMessage;

    /**
     * Creates a new exception for a code and message reported by the remote platform.
     *
     * @param remoteCode The (non-zero) code reported by the remote platform.
     * @param remoteMessage The message reported by the remote platform (may be {@code null}).
     */
    public RemotePlatformException(final int remoteCode, final String remoteMessage) {
        super(HttpURLConnection.HTTP_BAD_GATEWAY,
                String.format("remote platform error [code: %d]: %s", remoteCode, remoteMessage));
        this.remoteCode = remoteCode;
        this.remoteMessage = remoteMessage;
    }

    /**
     * Gets the code reported by the remote platform.
     *
     * @return The code.
     */
    public final int getRemoteCode() {
        return remoteCode;
    }

    /**
     * Gets the message reported by the remote platform.
     *
     * @return The message or {@code null} if the remote platform did not provide one.
     */
    public final String getRemoteMessage() {
        return remoteMessage;
    }
}
