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

import java.net.HttpURLConnection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

import org.eclipse.devicebridge.client.ClientErrorException;
import org.eclipse.devicebridge.client.remote.DeviceListRequest;
import org.eclipse.devicebridge.client.remote.RemotePlatformClient;
import org.eclipse.devicebridge.client.voucher.Voucher;
import org.eclipse.devicebridge.client.voucher.VoucherCodec;
import org.eclipse.devicebridge.devicestatus.DeviceStatus;
import org.eclipse.devicebridge.devicestatus.DeviceStatusCache;
import org.eclipse.devicebridge.plugin.status.DeviceStatusSender;
import org.eclipse.devicebridge.tracing.TracingHelper;
import org.eclipse.devicebridge.util.Constants;
import org.eclipse.devicebridge.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.opentracing.Span;
import io.opentracing.SpanContext;
import io.opentracing.Tracer;
import io.opentracing.log.Fields;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * A device plugin handler that bridges the host platform's callbacks to a remote device platform.
 *
 */
public final class RemotePlatformPluginHandler implements DevicePluginHandler {

    static final String SPAN_GET_FORM_CONFIG = "get form config";
    static final String SPAN_DEVICE_DISCONNECT = "device disconnect";
    static final String SPAN_NOTIFICATION = "notification";
    static final String SPAN_GET_DEVICE_LIST = "get device list";
    static final String SPAN_GET_DEVICE_INFO = "get device info";

    private static final Logger LOG = LoggerFactory.getLogger(RemotePlatformPluginHandler.class);

    private final Vertx vertx;
    private final RemotePlatformClient remotePlatformClient;
    private final DeviceStatusCache statusCache;
    private final DeviceStatusSender statusSender;
    private final FormConfig formConfig;
    private final Tracer tracer;

    /**
     * Creates a new handler.
     *
     * @param vertx The vert.x instance to use for reading form documents.
     * @param remotePlatformClient The client for invoking the remote platform.
     * @param statusCache The cache of device identities and status.
     * @param statusSender The sender for reporting device status to the host platform.
     * @param formConfig The form document configuration.
     * @param tracer The tracer to use for tracking the processing of callbacks.
     * @throws NullPointerException if any of the parameters are {@code null}.
     */
    public RemotePlatformPluginHandler(
            final Vertx vertx,
            final RemotePlatformClient remotePlatformClient,
            final DeviceStatusCache statusCache,
            final DeviceStatusSender statusSender,
            final FormConfig formConfig,
            final Tracer tracer) {

        this.vertx = Objects.requireNonNull(vertx);
        this.remotePlatformClient = Objects.requireNonNull(remotePlatformClient);
        this.statusCache = Objects.requireNonNull(statusCache);
        this.statusSender = Objects.requireNonNull(statusSender);
        this.formConfig = Objects.requireNonNull(formConfig);
        this.tracer = Objects.requireNonNull(tracer);
    }

    /**
     * Runs an operation in the scope of a span.
     * <p>
     * Exceptions thrown by the operation fail the returned future. Failures are logged on the span
     * and the span is finished once the operation has completed.
     */
    private <T> Future<T> runTraced(final Span span, final String operationName, final Supplier<Future<T>> operation) {

        Future<T> result;
        try {
            result = operation.get();
        } catch (final RuntimeException e) {
            result = Future.failedFuture(e);
        }
        return result
                .onFailure(t -> {
                    if (t instanceof ClientErrorException) {
                        LOG.debug("rejecting {} request: {}", operationName, t.getMessage());
                    } else {
                        LOG.info("failed to process {} request: {}", operationName, t.getMessage());
                    }
                    TracingHelper.logError(span, t);
                })
                .onComplete(r -> span.finish());
    }

    private Span newSpan(final String operationName, final SpanContext context) {
        return TracingHelper.buildServerChildSpan(tracer, context, operationName, getClass().getSimpleName())
                .start();
    }

    @Override
    public Future<ResponseEnvelope<Object>> getFormConfig(
            final String protocolType,
            final String deviceType,
            final String formType,
            final SpanContext context) {

        final Span span = newSpan(SPAN_GET_FORM_CONFIG, context);
        TracingHelper.TAG_FORM_TYPE.set(span, formType);

        return runTraced(span, SPAN_GET_FORM_CONFIG, () -> {
            LOG.debug("getting form config [protocol type: {}, device type: {}, form type: {}]",
                    protocolType, deviceType, formType);
            final FormType type = FormType.from(formType)
                    .orElseThrow(() -> new ClientErrorException(
                            HttpURLConnection.HTTP_BAD_REQUEST,
                            "unsupported form type"));
            switch (type) {
            case SVCR:
                return loadFormDocument(formConfig.getServiceVoucherPath(), span)
                        .map(PluginResponses::success);
            default:
                return Future.succeededFuture(PluginResponses.<Object>success(null));
            }
        });
    }

    private Future<Object> loadFormDocument(final String path, final Span span) {

        return vertx.fileSystem().readFile(path)
                .map(this::decodeFormDocument)
                .recover(t -> {
                    LOG.warn("cannot load form document [path: {}]: {}", path, t.getMessage());
                    span.log(Map.of(
                            Fields.EVENT, "cannot load form document",
                            Fields.MESSAGE, String.valueOf(t.getMessage())));
                    return Future.succeededFuture();
                });
    }

    private Object decodeFormDocument(final Buffer document) {
        final String json = document.toString().trim();
        if (json.startsWith("[")) {
            return new JsonArray(json);
        }
        return new JsonObject(json);
    }

    @Override
    public Future<ResponseEnvelope<Void>> deviceDisconnect(final String deviceId, final SpanContext context) {

        final Span span = newSpan(SPAN_DEVICE_DISCONNECT, context);
        TracingHelper.TAG_DEVICE_ID.set(span, deviceId);

        return runTraced(span, SPAN_DEVICE_DISCONNECT, () -> {
            if (Strings.isNullOrEmpty(deviceId)) {
                throw new ClientErrorException(HttpURLConnection.HTTP_BAD_REQUEST, "device ID must not be empty");
            }
            LOG.debug("handling disconnection of device [device-id: {}]", deviceId);

            final Future<Void> cacheCleanup = statusCache.getByID(deviceId)
                    .compose(identity -> statusCache.clearByNumber(identity.getDeviceNumber()))
                    .recover(t -> {
                        LOG.debug("no cached information removed for device [device-id: {}]: {}",
                                deviceId, t.getMessage());
                        return Future.succeededFuture();
                    });

            return cacheCleanup
                    .compose(ok -> statusSender.sendStatus(deviceId, DeviceStatus.OFFLINE, span.context()))
                    .map(ok -> {
                        LOG.debug("reported device as offline [device-id: {}]", deviceId);
                        return PluginResponses.<Void>success();
                    });
        });
    }

    @Override
    public Future<ResponseEnvelope<Void>> notification(
            final String messageType,
            final String message,
            final SpanContext context) {

        final Span span = newSpan(SPAN_NOTIFICATION, context);
        TracingHelper.TAG_MESSAGE_TYPE.set(span, messageType);

        return runTraced(span, SPAN_NOTIFICATION, () -> {
            final JsonObject event = decodeNotificationMessage(message);
            final Optional<NotificationType> type = NotificationType.from(messageType);
            if (type.isEmpty()) {
                LOG.warn("ignoring notification of unknown type [message type: {}]", messageType);
                return Future.succeededFuture(PluginResponses.<Void>success());
            }
            switch (type.get()) {
            case SERVICE_CONFIG_CHANGED:
                LOG.info("service configuration has changed [message: {}]", event.encode());
                return Future.succeededFuture(PluginResponses.<Void>success());
            case DEVICE_CONFIG_CHANGED:
            default:
                LOG.info("device configuration has changed [message: {}]", event.encode());
                return Optional.ofNullable(event.getValue(Constants.FIELD_DEVICE_NUMBER))
                        .map(Object::toString)
                        .filter(number -> !number.isEmpty())
                        .map(number -> {
                            LOG.debug("invalidating cached device information [device number: {}]", number);
                            return statusCache.clearByNumber(number);
                        })
                        .orElseGet(Future::succeededFuture)
                        .map(ok -> PluginResponses.<Void>success());
            }
        });
    }

    private static JsonObject decodeNotificationMessage(final String message) {
        if (Strings.isNullOrEmpty(message)) {
            throw new ClientErrorException(HttpURLConnection.HTTP_BAD_REQUEST, "notification message must not be empty");
        }
        try {
            return new JsonObject(message);
        } catch (final DecodeException | ClassCastException e) {
            throw new ClientErrorException(
                    HttpURLConnection.HTTP_BAD_REQUEST,
                    "notification message is not a JSON object: " + e.getMessage(),
                    e);
        }
    }

    @Override
    public Future<ResponseEnvelope<DeviceListData>> getDeviceList(
            final String voucher,
            final String serviceIdentifier,
            final int page,
            final int pageSize,
            final SpanContext context) {

        final Span span = newSpan(SPAN_GET_DEVICE_LIST, context);
        TracingHelper.TAG_SERVICE_IDENTIFIER.set(span, serviceIdentifier);

        return runTraced(span, SPAN_GET_DEVICE_LIST, () -> {
            final Voucher decodedVoucher = VoucherCodec.decode(voucher).requireRemoteAccess();
            final DeviceListRequest request = new DeviceListRequest(
                    voucher,
                    Optional.ofNullable(serviceIdentifier).orElse(""),
                    page,
                    pageSize);
            LOG.debug("getting device list [service identifier: {}, page: {}, page size: {}]",
                    serviceIdentifier, page, pageSize);
            return remotePlatformClient.listDevices(decodedVoucher, request, span.context())
                    .map(result -> PluginResponses.success(DeviceListData.from(result)));
        });
    }

    @Override
    public Future<ResponseEnvelope<DeviceItem>> getDeviceInfo(
            final String deviceCode,
            final String voucher,
            final SpanContext context) {

        final Span span = newSpan(SPAN_GET_DEVICE_INFO, context);
        TracingHelper.TAG_DEVICE_CODE.set(span, deviceCode);

        return runTraced(span, SPAN_GET_DEVICE_INFO, () -> {
            final Map<String, String> parameters = new LinkedHashMap<>();
            parameters.put("device_code", deviceCode);
            parameters.put("voucher", voucher);
            final List<String> missing = Strings.namesOfEmptyValues(parameters);
            if (!missing.isEmpty()) {
                throw new ClientErrorException(
                        HttpURLConnection.HTTP_BAD_REQUEST,
                        String.format("missing required parameters %s", missing));
            }
            final Voucher decodedVoucher = VoucherCodec.decode(voucher).requireDeviceBinding();
            LOG.debug("getting device info [device code: {}]", deviceCode);
            return remotePlatformClient.getDeviceDetail(decodedVoucher, deviceCode, span.context())
                    .map(detail -> PluginResponses.success(DeviceItem.from(detail)));
        });
    }
}
