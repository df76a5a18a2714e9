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

package org.eclipse.devicebridge.devicestatus;

import java.util.Objects;

/**
 * The connection status of a device as reported to the host platform.
 *
 */
public enum DeviceStatus {

    /**
     * The device is connected.
     */
    ONLINE("1"),
    /**
     * The device is not connected.
     */
    OFFLINE("0");

    private final String wireValue;

    DeviceStatus(final String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * Gets the value representing this status in messages sent to the host platform.
     *
     * @return The value.
     */
    public String getWireValue() {
        return wireValue;
    }

    /**
     * Gets the status for a wire value.
     *
     * @param wireValue The value.
     * @return The status.
     * @throws NullPointerException if value is {@code null}.
     * @throws IllegalArgumentException if the value does not represent a known status.
     */
    public static DeviceStatus fromWireValue(final String wireValue) {
        Objects.requireNonNull(wireValue);
        for (final DeviceStatus status : values()) {
            if (status.wireValue.equals(wireValue)) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown device status: " + wireValue);
    }
}
