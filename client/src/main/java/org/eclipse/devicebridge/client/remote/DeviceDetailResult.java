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

package org.eclipse.devicebridge.client.remote;

import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * The details of a device that has been bound on the remote platform.
 *
 */
public final class DeviceDetailResult {

    private final String deviceName;
    private final String deviceNumber;
    private final String deviceDescription;

    /**
     * Creates a new result.
     *
     * @param deviceName The device's name.
     * @param deviceNumber The number that the remote platform identifies the device by.
     * @param deviceDescription The device's description.
     * @throws NullPointerException if any of the parameters are {@code null}.
     */
    public DeviceDetailResult(final String deviceName, final String deviceNumber, final String deviceDescription) {
        this.deviceName = Objects.requireNonNull(deviceName);
        this.deviceNumber = Objects.requireNonNull(deviceNumber);
        this.deviceDescription = Objects.requireNonNull(deviceDescription);
    }

    public String getDeviceName() {
        return deviceName;
    }

    public String getDeviceNumber() {
        return deviceNumber;
    }

    public String getDeviceDescription() {
        return deviceDescription;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("deviceName", deviceName)
                .add("deviceNumber", deviceNumber)
                .toString();
    }
}
