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

package org.eclipse.devicebridge.plugin.status;

import org.eclipse.devicebridge.devicestatus.DeviceStatus;

import io.opentracing.SpanContext;
import io.vertx.core.Future;

/**
 * A client for reporting the connection status of devices to the host platform.
 *
 */
public interface DeviceStatusSender {

    /**
     * Reports the connection status of a device.
     *
     * @param deviceId The identifier that the host platform uses for the device.
     * @param status The status to report.
     * @param context The currently active OpenTracing span context or {@code null} if no span is active.
     * @return A future indicating the outcome of the operation.
     *         <p>
     *         The future will be failed with a {@link org.eclipse.devicebridge.client.ServerErrorException}
     *         if the status could not be delivered.
     * @throws NullPointerException if device ID or status are {@code null}.
     */
    Future<Void> sendStatus(String deviceId, DeviceStatus status, SpanContext context);
}
