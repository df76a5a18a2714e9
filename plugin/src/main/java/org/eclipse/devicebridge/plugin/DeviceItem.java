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

import java.util.Objects;

import org.eclipse.devicebridge.client.remote.DeviceDetailResult;
import org.eclipse.devicebridge.client.remote.RemoteDevice;
import org.eclipse.devicebridge.util.Constants;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A device as reported to the host platform.
 *
 */
public final class DeviceItem {

    private final String deviceName;
    private final String deviceNumber;
    private final String description;

    /**
     * Creates a new device item.
     *
     * @param deviceName The device's name.
     * @param deviceNumber The number that the remote platform identifies the device by.
     * @param description The device's description.
     * @throws NullPointerException if any of the parameters are {@code null}.
     */
    public DeviceItem(final String deviceName, final String deviceNumber, final String description) {
        this.deviceName = Objects.requireNonNull(deviceName);
        this.deviceNumber = Objects.requireNonNull(deviceNumber);
        this.description = Objects.requireNonNull(description);
    }

    /**
     * Creates a device item for a device listed by the remote platform.
     *
     * @param device The device.
     * @return The device item.
     * @throws NullPointerException if device is {@code null}.
     */
    public static DeviceItem from(final RemoteDevice device) {
        Objects.requireNonNull(device);
        return new DeviceItem(device.getDeviceName(), device.getDeviceNumber(), device.getDescription());
    }

    /**
     * Creates a device item for a device bound on the remote platform.
     *
     * @param detail The device details.
     * @return The device item.
     * @throws NullPointerException if detail is {@code null}.
     */
    public static DeviceItem from(final DeviceDetailResult detail) {
        Objects.requireNonNull(detail);
        return new DeviceItem(detail.getDeviceName(), detail.getDeviceNumber(), detail.getDeviceDescription());
    }

    @JsonProperty(Constants.FIELD_DEVICE_NAME)
    public String getDeviceName() {
        return deviceName;
    }

    @JsonProperty(Constants.FIELD_DEVICE_NUMBER)
    public String getDeviceNumber() {
        return deviceNumber;
    }

    @JsonProperty(Constants.FIELD_DESCRIPTION)
    public String getDescription() {
        return description;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final DeviceItem other = (DeviceItem) obj;
        return deviceName.equals(other.deviceName)
                && deviceNumber.equals(other.deviceNumber)
                && description.equals(other.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceName, deviceNumber, description);
    }
}
