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

import java.util.Optional;

/**
 * The types of notifications that the host platform sends to the plugin.
 *
 */
public enum NotificationType {

    /**
     * The configuration of the service has changed.
     */
    SERVICE_CONFIG_CHANGED("1"),
    /**
     * The configuration of a device has changed.
     */
    DEVICE_CONFIG_CHANGED("2");

    private final String code;

    NotificationType(final String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Gets the notification type for a code.
     *
     * @param code The code as used by the host platform.
     * @return The notification type or an empty optional if the code is {@code null} or unknown.
     */
    public static Optional<NotificationType> from(final String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (final NotificationType type : values()) {
            if (type.code.equals(code)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
