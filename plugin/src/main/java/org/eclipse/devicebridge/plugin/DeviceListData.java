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

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import org.eclipse.devicebridge.client.remote.DeviceListResult;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A page of devices as reported to the host platform.
 *
 */
public final class DeviceListData {

    private final List<DeviceItem> list;
    private final int total;

    /**
     * Creates a new page.
     *
     * @param list The devices contained in the page.
     * @param total The overall number of devices.
     * @throws NullPointerException if list is {@code null}.
     */
    public DeviceListData(final List<DeviceItem> list, final int total) {
        this.list = List.copyOf(Objects.requireNonNull(list));
        this.total = total;
    }

    /**
     * Creates a page for a result returned by the remote platform.
     * <p>
     * The devices are mapped one to one, keeping their order.
     *
     * @param result The result.
     * @return The page.
     * @throws NullPointerException if result is {@code null}.
     */
    public static DeviceListData from(final DeviceListResult result) {
        Objects.requireNonNull(result);
        return new DeviceListData(
                result.getDevices().stream().map(DeviceItem::from).collect(Collectors.toList()),
                result.getTotal());
    }

    @JsonProperty("list")
    public List<DeviceItem> getList() {
        return list;
    }

    @JsonProperty("total")
    public int getTotal() {
        return total;
    }
}
