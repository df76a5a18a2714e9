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

import java.time.Instant;
import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * An immutable snapshot of the information cached for a device number.
 *
 */
public final class DeviceStatusEntry {

    private final String deviceNumber;
    private final String deviceId;
    private final DeviceIdentity identity;
    private final DeviceStatus status;
    private final Instant lastUpdate;

    private DeviceStatusEntry(
            final String deviceNumber,
            final String deviceId,
            final DeviceIdentity identity,
            final DeviceStatus status,
            final Instant lastUpdate) {
        this.deviceNumber = Objects.requireNonNull(deviceNumber);
        this.deviceId = deviceId;
        this.identity = identity;
        this.status = status;
        this.lastUpdate = Objects.requireNonNull(lastUpdate);
    }

    /**
     * Creates an entry that contains a device's identity.
     *
     * @param deviceId The identifier that the host platform uses for the device.
     * @param identity The device's identity on the remote platform.
     * @param lastUpdate The point in time of the update.
     * @return The entry.
     * @throws NullPointerException if any of the parameters are {@code null}.
     */
    static DeviceStatusEntry forIdentity(final String deviceId, final DeviceIdentity identity, final Instant lastUpdate) {
        Objects.requireNonNull(deviceId);
        Objects.requireNonNull(identity);
        return new DeviceStatusEntry(identity.getDeviceNumber(), deviceId, identity, null, lastUpdate);
    }

    /**
     * Creates an entry that only contains a device's status.
     *
     * @param deviceNumber The number that the remote platform identifies the device by.
     * @param status The status.
     * @param lastUpdate The point in time of the update.
     * @return The entry.
     * @throws NullPointerException if any of the parameters are {@code null}.
     */
    static DeviceStatusEntry forStatus(final String deviceNumber, final DeviceStatus status, final Instant lastUpdate) {
        Objects.requireNonNull(status);
        return new DeviceStatusEntry(deviceNumber, null, null, status, lastUpdate);
    }

    DeviceStatusEntry withIdentity(final String newDeviceId, final DeviceIdentity newIdentity, final Instant updateTime) {
        Objects.requireNonNull(newDeviceId);
        Objects.requireNonNull(newIdentity);
        return new DeviceStatusEntry(deviceNumber, newDeviceId, newIdentity, status, updateTime);
    }

    DeviceStatusEntry withStatus(final DeviceStatus newStatus, final Instant updateTime) {
        Objects.requireNonNull(newStatus);
        return new DeviceStatusEntry(deviceNumber, deviceId, identity, newStatus, updateTime);
    }

    public String getDeviceNumber() {
        return deviceNumber;
    }

    /**
     * Gets the identifier that the host platform uses for the device.
     *
     * @return The identifier or {@code null} if unknown.
     */
    public String getDeviceId() {
        return deviceId;
    }

    /**
     * Gets the device's identity.
     *
     * @return The identity or {@code null} if unknown.
     */
    public DeviceIdentity getIdentity() {
        return identity;
    }

    /**
     * Gets the last known status of the device.
     *
     * @return The status or {@code null} if unknown.
     */
    public DeviceStatus getStatus() {
        return status;
    }

    public Instant getLastUpdate() {
        return lastUpdate;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("deviceNumber", deviceNumber)
                .add("deviceId", deviceId)
                .add("status", status)
                .add("lastUpdate", lastUpdate)
                .toString();
    }
}
