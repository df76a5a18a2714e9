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

import java.net.HttpURLConnection;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import org.eclipse.devicebridge.client.ClientErrorException;
import org.eclipse.devicebridge.client.ServerErrorException;
import org.eclipse.devicebridge.client.ServiceInvocationException;
import org.eclipse.devicebridge.client.util.StatusCodeMapper;
import org.eclipse.devicebridge.client.voucher.Voucher;
import org.eclipse.devicebridge.tracing.TracingHelper;
import org.eclipse.devicebridge.util.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.opentracing.References;
import io.opentracing.Span;
import io.opentracing.SpanContext;
import io.opentracing.Tracer;
import io.opentracing.log.Fields;
import io.opentracing.tag.Tags;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;

/**
 * A client for the remote platform's HTTP API that is based on a vert.x {@link WebClient}.
 * <p>
 * The remote platform wraps all results in an envelope of the form
 * <pre>
 * {
 *   "code": 0,
 *   "msg": "ok",
 *   "data": { ... }
 * }
 * </pre>
 * A code other than 0 indicates that the remote platform has rejected the request.
 */
public final class VertxBasedRemotePlatformClient implements RemotePlatformClient {

    static final String PATH_DEVICE_LIST = "/device/list";
    static final String PATH_DEVICE_BIND = "/device/bind";

    static final String FIELD_CODE = "code";
    static final String FIELD_MSG = "msg";
    static final String FIELD_DATA = "data";
    static final String FIELD_LIST = "list";
    static final String FIELD_TOTAL = "total";
    static final String FIELD_DEVICE_DESCRIPTION = "device_description";
    static final String FIELD_SECRET = "secret";
    static final String FIELD_AGENT_ID = "agent_id";
    static final String FIELD_EXTERNAL_API_KEY = "external_api_key";
    static final String FIELD_DEVICE_CODE = "device_code";

    private static final Logger LOG = LoggerFactory.getLogger(VertxBasedRemotePlatformClient.class);

    private final WebClient client;
    private final RemotePlatformClientConfig config;
    private final Tracer tracer;

    /**
     * Creates a new client.
     *
     * @param webClient The vert.x client to use for sending requests.
     * @param config The client configuration.
     * @param tracer The tracer to use for tracking requests.
     * @throws NullPointerException if any of the parameters are {@code null}.
     */
    public VertxBasedRemotePlatformClient(
            final WebClient webClient,
            final RemotePlatformClientConfig config,
            final Tracer tracer) {

        this.client = Objects.requireNonNull(webClient);
        this.config = Objects.requireNonNull(config);
        this.tracer = Objects.requireNonNull(tracer);
    }

    /**
     * Creates a new client using a web client that is configured according to the given properties.
     *
     * @param vertx The vert.x instance to run on.
     * @param config The client configuration.
     * @param tracer The tracer to use for tracking requests.
     * @return The client.
     * @throws NullPointerException if any of the parameters are {@code null}.
     */
    public static VertxBasedRemotePlatformClient create(
            final Vertx vertx,
            final RemotePlatformClientConfig config,
            final Tracer tracer) {

        Objects.requireNonNull(vertx);
        Objects.requireNonNull(config);
        return new VertxBasedRemotePlatformClient(
                WebClient.create(vertx, config.getWebClientOptions()),
                config,
                tracer);
    }

    @Override
    public Future<DeviceListResult> listDevices(
            final Voucher voucher,
            final DeviceListRequest request,
            final SpanContext context) {

        Objects.requireNonNull(voucher);
        Objects.requireNonNull(request);

        final Span span = newChildSpan("list remote devices", context);
        TracingHelper.TAG_SERVICE_IDENTIFIER.set(span, request.getServiceIdentifier());

        final String url = getRequestUrl(voucher.getRemoteBaseUrl(), PATH_DEVICE_LIST);
        final Future<HttpResponse<Buffer>> response = newRequest(url, span)
                .compose(httpRequest -> httpRequest
                        .putHeader(Constants.HEADER_X_TOKEN, voucher.getSecret())
                        .sendJsonObject(request.toJson()));

        LOG.debug("retrieving devices from remote platform [service identifier: {}, page: {}, page size: {}]",
                request.getServiceIdentifier(), request.getPage(), request.getPageSize());
        return processResponse(url, response, this::extractDeviceList, span)
                .onSuccess(result -> {
                    LOG.debug("retrieved {} of {} devices from remote platform [service identifier: {}]",
                            result.getDevices().size(), result.getTotal(), request.getServiceIdentifier());
                    span.log(Map.of("total", result.getTotal()));
                })
                .onComplete(r -> span.finish());
    }

    @Override
    public Future<DeviceDetailResult> getDeviceDetail(
            final Voucher voucher,
            final String deviceCode,
            final SpanContext context) {

        Objects.requireNonNull(voucher);
        Objects.requireNonNull(deviceCode);

        final Span span = newChildSpan("bind remote device", context);
        TracingHelper.TAG_DEVICE_CODE.set(span, deviceCode);

        final JsonObject body = new JsonObject()
                .put(FIELD_SECRET, voucher.getSecret())
                .put(FIELD_AGENT_ID, voucher.getAgentId())
                .put(FIELD_EXTERNAL_API_KEY, voucher.getExternalApiKey())
                .put(FIELD_DEVICE_CODE, deviceCode);

        final String url = getRequestUrl(voucher.getRemoteBaseUrl(), PATH_DEVICE_BIND);
        final Future<HttpResponse<Buffer>> response = newRequest(url, span)
                .compose(httpRequest -> httpRequest.sendJsonObject(body));

        LOG.debug("binding device on remote platform [device code: {}]", deviceCode);
        return processResponse(url, response, this::extractDeviceDetail, span)
                .onSuccess(result -> LOG.debug("bound device on remote platform [device code: {}, device number: {}]",
                        deviceCode, result.getDeviceNumber()))
                .onComplete(r -> span.finish());
    }

    private Span newChildSpan(final String operationName, final SpanContext context) {
        return tracer.buildSpan(operationName)
                .addReference(References.CHILD_OF, context)
                .ignoreActiveSpan()
                .withTag(Tags.COMPONENT.getKey(), getClass().getSimpleName())
                .withTag(Tags.SPAN_KIND.getKey(), Tags.SPAN_KIND_CLIENT)
                .start();
    }

    private Future<HttpRequest<Buffer>> newRequest(final String url, final Span span) {

        Tags.HTTP_URL.set(span, url);
        Tags.HTTP_METHOD.set(span, "POST");
        try {
            final HttpRequest<Buffer> request = client.postAbs(url)
                    .putHeader(HttpHeaders.CONTENT_TYPE.toString(), Constants.CONTENT_TYPE_APPLICATION_JSON)
                    .timeout(config.getRequestTimeout());
            return Future.succeededFuture(request);
        } catch (final RuntimeException e) {
            // the URL is taken from the voucher
            LOG.debug("cannot create request for remote platform [URL: {}]: {}", url, e.getMessage());
            return Future.failedFuture(new ClientErrorException(
                    HttpURLConnection.HTTP_BAD_REQUEST,
                    "voucher contains invalid remote platform URL",
                    e));
        }
    }

    private static String getRequestUrl(final String baseUrl, final String path) {
        if (baseUrl.endsWith("/")) {
            return baseUrl.substring(0, baseUrl.length() - 1) + path;
        }
        return baseUrl + path;
    }

    private <T> Future<T> processResponse(
            final String url,
            final Future<HttpResponse<Buffer>> response,
            final Function<JsonObject, T> dataExtractor,
            final Span span) {

        return response
                .recover(t -> {
                    if (t instanceof ServiceInvocationException) {
                        return Future.failedFuture(t);
                    }
                    LOG.debug("failed to send request to remote platform [URL: {}]", url, t);
                    return Future.failedFuture(new ServerErrorException(
                            HttpURLConnection.HTTP_UNAVAILABLE,
                            "remote platform is unavailable",
                            t));
                })
                .map(httpResponse -> {
                    Tags.HTTP_STATUS.set(span, httpResponse.statusCode());
                    if (!StatusCodeMapper.isSuccessful(httpResponse.statusCode())) {
                        throw new ServerErrorException(
                                HttpURLConnection.HTTP_BAD_GATEWAY,
                                String.format("remote platform responded with status %d", httpResponse.statusCode()));
                    }
                    final JsonObject envelope = parseEnvelope(httpResponse.body());
                    final int code = getRemoteCode(envelope);
                    if (!StatusCodeMapper.isRemoteSuccess(code)) {
                        throw StatusCodeMapper.fromRemote(code, getString(envelope, FIELD_MSG));
                    }
                    try {
                        return dataExtractor.apply(envelope);
                    } catch (final ServiceInvocationException e) {
                        throw e;
                    } catch (final RuntimeException e) {
                        throw malformedResponse(e);
                    }
                })
                .onFailure(t -> {
                    TracingHelper.logError(span, Map.of(
                            Fields.MESSAGE, "failed to invoke remote platform",
                            Fields.ERROR_KIND, "Exception",
                            Fields.ERROR_OBJECT, t));
                    LOG.info("failed to invoke remote platform [URL: {}]: {}",
                            url, t.getMessage());
                });
    }

    private static JsonObject parseEnvelope(final Buffer body) {
        if (body == null || body.length() == 0) {
            throw malformedResponse(null);
        }
        try {
            final JsonObject envelope = body.toJsonObject();
            if (envelope == null) {
                throw malformedResponse(null);
            }
            return envelope;
        } catch (final ServiceInvocationException e) {
            throw e;
        } catch (final RuntimeException e) {
            throw malformedResponse(e);
        }
    }

    /**
     * Gets the code from a response envelope.
     *
     * @return The code or 0 if the envelope contains no code.
     * @throws ServerErrorException if the code is not a number.
     */
    private static int getRemoteCode(final JsonObject envelope) {
        final Object code = envelope.getValue(FIELD_CODE);
        if (code == null) {
            return 0;
        } else if (code instanceof Number) {
            return ((Number) code).intValue();
        }
        throw malformedResponse(null);
    }

    private static ServerErrorException malformedResponse(final Throwable cause) {
        return new ServerErrorException(
                HttpURLConnection.HTTP_BAD_GATEWAY,
                "remote platform returned malformed response",
                cause);
    }

    private DeviceListResult extractDeviceList(final JsonObject envelope) {

        final JsonObject data = getData(envelope);
        final JsonArray list = Optional.ofNullable(data.getJsonArray(FIELD_LIST)).orElseGet(JsonArray::new);
        final List<RemoteDevice> devices = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            final JsonObject item = list.getJsonObject(i);
            if (item == null) {
                throw malformedResponse(null);
            }
            devices.add(new RemoteDevice(
                    getString(item, Constants.FIELD_DEVICE_NAME),
                    getString(item, Constants.FIELD_DEVICE_NUMBER),
                    getString(item, Constants.FIELD_DESCRIPTION)));
        }
        final Object total = data.getValue(FIELD_TOTAL);
        if (total == null) {
            return new DeviceListResult(devices, 0);
        } else if (total instanceof Number) {
            return new DeviceListResult(devices, ((Number) total).intValue());
        }
        throw malformedResponse(null);
    }

    private DeviceDetailResult extractDeviceDetail(final JsonObject envelope) {

        final JsonObject data = getData(envelope);
        return new DeviceDetailResult(
                getString(data, Constants.FIELD_DEVICE_NAME),
                getString(data, Constants.FIELD_DEVICE_NUMBER),
                getString(data, FIELD_DEVICE_DESCRIPTION));
    }

    /**
     * Gets the data from a response envelope.
     *
     * @return The data or an empty object if the envelope contains no data.
     * @throws ServerErrorException if the data is not a JSON object.
     */
    private static JsonObject getData(final JsonObject envelope) {
        final Object data = envelope.getValue(FIELD_DATA);
        if (data == null) {
            return new JsonObject();
        } else if (data instanceof JsonObject) {
            return (JsonObject) data;
        }
        throw malformedResponse(null);
    }

    private static String getString(final JsonObject obj, final String key) {
        return Optional.ofNullable(obj.getValue(key))
                .map(Object::toString)
                .orElse("");
    }
}
