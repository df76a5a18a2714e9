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

import io.vertx.core.Future;

/**
 * A repository for the identities and last known connection status of devices.
 * <p>
 * Entries are keyed by device number. Devices can additionally be looked up by the identifier
 * that the host platform uses for them, if the identity has been registered using
 * {@link #putDevice(String, DeviceIdentity)}.
 * <p>
 * The plugin itself only reads and clears entries. Registering identities using
 * {@link #putDevice(String, DeviceIdentity)} and recording status changes using
 * {@link #setStatus(String, DeviceStatus)} is left to the component that integrates the plugin
 * with the host platform. Until an identity has been registered, {@link #getByID(String)} fails
 * with a 404. A disconnect of such a device then removes nothing from the cache and only reports
 * the device as offline.
 * <p>
 * Implementations must be safe for concurrent use. Updates of the same device number are
 * applied one after the other while updates of different device numbers may proceed in parallel.
 */
public interface DeviceStatusCache {

    /**
     * Gets the identity of a device.
     *
     * @param deviceId The identifier that the host platform uses for the device.
     * @return A future indicating the outcome of the operation.
     *         <p>
     *         The future will be failed with a {@link org.eclipse.devicebridge.client.ClientErrorException}
     *         with status 404 if no identity is registered for the identifier.
     * @throws NullPointerException if device ID is {@code null}.
     */
    Future<DeviceIdentity> getByID(String deviceId);

    /**
     * Removes all information cached for a device number.
     * <p>
     * Clearing an unknown device number succeeds.
     *
     * @param deviceNumber The number that the remote platform identifies the device by.
     * @return A future indicating the outcome of the operation.
     * @throws NullPointerException if device number is {@code null}.
     */
    Future<Void> clearByNumber(String deviceNumber);

    /**
     * Sets the last known status of a device.
     * <p>
     * An entry is created if none exists for the device number yet.
     *
     * @param deviceNumber The number that the remote platform identifies the device by.
     * @param status The status.
     * @return A future indicating the outcome of the operation.
     * @throws NullPointerException if any of the parameters are {@code null}.
     */
    Future<Void> setStatus(String deviceNumber, DeviceStatus status);

    /**
     * Gets the last known status of a device.
     *
     * @param deviceNumber The number that the remote platform identifies the device by.
     * @return A future indicating the outcome of the operation.
     *         <p>
     *         The future will be succeeded with {@code null} if no status is known for the device number.
     * @throws NullPointerException if device number is {@code null}.
     */
    Future<DeviceStatus> getStatus(String deviceNumber);

    /**
     * Registers the identity of a device.
     * <p>
     * Any identity registered before for the same device number is replaced while a previously
     * set status is kept.
     *
     * @param deviceId The identifier that the host platform uses for the device.
     * @param identity The device's identity on the remote platform.
     * @return A future indicating the outcome of the operation.
     * @throws NullPointerException if any of the parameters are {@code null}.
     */
    Future<Void> putDevice(String deviceId, DeviceIdentity identity);

    /**
     * Gets a snapshot of the information cached for a device number.
     *
     * @param deviceNumber The number that the remote platform identifies the device by.
     * @return A future indicating the outcome of the operation.
     *         <p>
     *         The future will be succeeded with {@code null} if nothing is cached for the device number.
     * @throws NullPointerException if device number is {@code null}.
     */
    Future<DeviceStatusEntry> getEntry(String deviceNumber);
}
