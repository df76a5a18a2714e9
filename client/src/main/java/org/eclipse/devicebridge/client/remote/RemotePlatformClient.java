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

import org.eclipse.devicebridge.client.voucher.Voucher;

import io.opentracing.SpanContext;
import io.vertx.core.Future;

/**
 * A client for invoking the HTTP API of the remote device platform.
 * <p>
 * All operations fail with
 * <ul>
 * <li>a {@link org.eclipse.devicebridge.client.ServerErrorException} with status 503 if the
 * remote platform cannot be reached or does not respond in time,</li>
 * <li>a {@link org.eclipse.devicebridge.client.ServerErrorException} with status 502 if the
 * remote platform responds with a non-2xx status or a malformed body,</li>
 * <li>a {@link org.eclipse.devicebridge.client.RemotePlatformException} if the response body
 * contains a non-zero code.</li>
 * </ul>
 */
public interface RemotePlatformClient {

    /**
     * Retrieves a page of the devices that a voucher grants access to.
     *
     * @param voucher The voucher containing the remote platform's base URL and secret.
     * @param request The request to forward.
     * @param context The currently active OpenTracing span context or {@code null} if no span is active.
     * @return A future indicating the outcome of the operation.
     * @throws NullPointerException if voucher or request are {@code null}.
     */
    Future<DeviceListResult> listDevices(Voucher voucher, DeviceListRequest request, SpanContext context);

    /**
     * Binds a device to the voucher's agent and retrieves its details.
     *
     * @param voucher The voucher containing the remote platform's base URL, the secret, the agent ID
     *                and the external API key.
     * @param deviceCode The code identifying the device on the remote platform.
     * @param context The currently active OpenTracing span context or {@code null} if no span is active.
     * @return A future indicating the outcome of the operation.
     * @throws NullPointerException if voucher or device code are {@code null}.
     */
    Future<DeviceDetailResult> getDeviceDetail(Voucher voucher, String deviceCode, SpanContext context);
}
