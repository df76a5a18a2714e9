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

import io.opentracing.SpanContext;
import io.vertx.core.Future;

/**
 * The callbacks that the host platform invokes on a device plugin.
 * <p>
 * All operations return a future that is either succeeded with the envelope to send to the
 * host platform or failed with a {@link org.eclipse.devicebridge.client.ServiceInvocationException}
 * indicating the reason for the failure.
 */
public interface DevicePluginHandler {

    /**
     * Gets the description of a form to be rendered by the host platform.
     *
     * @param protocolType The type of protocol that the form is requested for.
     * @param deviceType The type of device that the form is requested for.
     * @param formType The type of form, one of {@code CFG}, {@code VCR} or {@code SVCR}.
     * @param context The OpenTracing context of the invocation or {@code null}.
     * @return A future succeeded with an envelope containing the form description as JSON object or array.
     *         The description is {@code null} if no form exists for the requested type.
     *         The future is failed with a client error if the form type is not supported.
     */
    Future<ResponseEnvelope<Object>> getFormConfig(
            String protocolType,
            String deviceType,
            String formType,
            SpanContext context);

    /**
     * Handles the disconnection of a device from the host platform.
     * <p>
     * Removes any information cached for the device and reports the device as offline.
     *
     * @param deviceId The identifier that the host platform uses for the device.
     * @param context The OpenTracing context of the invocation or {@code null}.
     * @return A future indicating the outcome of the operation.
     *         The future is failed with a client error if the device ID is empty.
     */
    Future<ResponseEnvelope<Void>> deviceDisconnect(String deviceId, SpanContext context);

    /**
     * Handles a notification sent by the host platform.
     *
     * @param messageType The type of notification.
     * @param message The JSON document describing the event.
     * @param context The OpenTracing context of the invocation or {@code null}.
     * @return A future indicating the outcome of the operation.
     *         The future is failed with a client error if the message is not a JSON object.
     */
    Future<ResponseEnvelope<Void>> notification(String messageType, String message, SpanContext context);

    /**
     * Gets a page of the devices that a voucher grants access to.
     *
     * @param voucher The voucher as provided by the host platform.
     * @param serviceIdentifier The identifier of the service that the devices belong to.
     * @param page The number of the page to retrieve.
     * @param pageSize The maximum number of devices per page.
     * @param context The OpenTracing context of the invocation or {@code null}.
     * @return A future indicating the outcome of the operation.
     */
    Future<ResponseEnvelope<DeviceListData>> getDeviceList(
            String voucher,
            String serviceIdentifier,
            int page,
            int pageSize,
            SpanContext context);

    /**
     * Binds a device on the remote platform and gets its details.
     *
     * @param deviceCode The code identifying the device on the remote platform.
     * @param voucher The voucher as provided by the host platform.
     * @param context The OpenTracing context of the invocation or {@code null}.
     * @return A future indicating the outcome of the operation.
     */
    Future<ResponseEnvelope<DeviceItem>> getDeviceInfo(String deviceCode, String voucher, SpanContext context);
}
