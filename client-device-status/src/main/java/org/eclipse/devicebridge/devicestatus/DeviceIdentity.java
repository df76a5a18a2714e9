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

import com.google.common.base.MoreObjects;

/**
 * The identity of a device on the remote platform.
 * <p>
 * The device number is the key that host platform and remote platform identifiers are joined on.
 */
public final class DeviceIdentity {

    private final String deviceName;
    private final String deviceNumber;
    private final String description;

    /**
     * Creates a new identity.
     *
     * @param deviceName The device's name.
     * @param deviceNumber The number that the remote platform identifies the device by.
     * @param description The device's description.
     * @throws NullPointerException if any of the parameters are {@code null}.
     * @throws IllegalArgumentException if the device number is empty.
     */
    public DeviceIdentity(final String deviceName, final String deviceNumber, final String description) {
        this.deviceName = Objects.requireNonNull(deviceName);
        this.deviceNumber = Objects.requireNonNull(deviceNumber);
        this.description = Objects.requireNonNull(description);
        if (deviceNumber.isEmpty()) {
            throw new IllegalArgumentException("device number must not be empty");
        }
    }

    public String getDeviceName() {
        return deviceName;
    }

    public String getDeviceNumber() {
        return deviceNumber;
    }

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
        final DeviceIdentity other = (DeviceIdentity) obj;
        return deviceName.equals(other.deviceName)
                && deviceNumber.equals(other.deviceNumber)
                && description.equals(other.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceName, deviceNumber, description);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("deviceName", deviceName)
                .add("deviceNumber", deviceNumber)
                .toString();
    }
}
