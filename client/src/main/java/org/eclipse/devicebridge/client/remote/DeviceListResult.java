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

import java.util.List;
import java.util.Objects;

/**
 * A page of devices as returned by the remote platform.
 *
 */
public final class DeviceListResult {

    private final List<RemoteDevice> devices;
    private final int total;

    /**
     * Creates a new result.
     *
     * @param devices The devices contained in the page.
     * @param total The overall number of devices.
     * @throws NullPointerException if devices is {@code null}.
     */
    public DeviceListResult(final List<RemoteDevice> devices, final int total) {
        this.devices = List.copyOf(Objects.requireNonNull(devices));
        this.total = total;
    }

    /**
     * Gets the devices contained in the page.
     *
     * @return An unmodifiable list of devices in the order returned by the remote platform.
     */
    public List<RemoteDevice> getDevices() {
        return devices;
    }

    /**
     * Gets the overall number of devices.
     *
     * @return The number as reported by the remote platform.
     */
    public int getTotal() {
        return total;
    }
}
