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

package org.eclipse.devicebridge.plugin.http;

import java.net.HttpURLConnection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import org.eclipse.devicebridge.client.ClientErrorException;
import org.eclipse.devicebridge.plugin.DevicePluginHandler;
import org.eclipse.devicebridge.plugin.ResponseEnvelope;
import org.eclipse.devicebridge.util.Constants;
import org.eclipse.devicebridge.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Future;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.MIMEHeader;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;

/**
 * An HTTP endpoint exposing the callbacks of a {@link DevicePluginHandler} to the host platform.
 *
 */
public class PluginHttpEndpoint implements HttpEndpoint {

    /**
     * The path of the form configuration resource.
     */
    public static final String PATH_FORM_CONFIG = "/api/v1/form/config";
    /**
     * The path of the device disconnection resource.
     */
    public static final String PATH_DEVICE_DISCONNECT = "/api/v1/device/disconnect";
    /**
     * The path of the notification resource.
     */
    public static final String PATH_NOTIFY_EVENT = "/api/v1/notify/event";
    /**
     * The path of the device list resource.
     */
    public static final String PATH_DEVICE_LIST = "/api/v1/plugin/device/list";
    /**
     * The path of the device information resource.
     */
    public static final String PATH_DEVICE_INFO = "/api/v1/plugin/device/info";

    static final String PARAM_PROTOCOL_TYPE = "protocol_type";
    static final String PARAM_DEVICE_TYPE = "device_type";
    static final String PARAM_FORM_TYPE = "form_type";
    static final String PARAM_VOUCHER = "voucher";
    static final String PARAM_SERVICE_IDENTIFIER = "service_identifier";
    static final String PARAM_PAGE = "page";
    static final String PARAM_PAGE_SIZE = "page_size";
    static final String PARAM_DEVICE_CODE = "device_code";
    static final String PARAM_KEY = "key";
    static final String FIELD_MESSAGE_TYPE = "message_type";
    static final String FIELD_MESSAGE = "message";

    private static final Logger LOG = LoggerFactory.getLogger(PluginHttpEndpoint.class);
    private static final String KEY_REQUEST_BODY = "KEY_REQUEST_BODY";
    private static final long MAX_BODY_SIZE = 64 * 1024;

    private static final Function<String, Integer> CONVERTER_INT = s -> {
        try {
            return Integer.parseInt(s);
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("value is not an integer");
        }
    };

    private final DevicePluginHandler handler;

    /**
     * Creates a new endpoint.
     *
     * @param handler The handler to delegate the callbacks to.
     * @throws NullPointerException if handler is {@code null}.
     */
    public PluginHttpEndpoint(final DevicePluginHandler handler) {
        this.handler = Objects.requireNonNull(handler);
    }

    @Override
    public void addRoutes(final Router router) {

        final PluginFailureHandler failureHandler = new PluginFailureHandler();
        final BodyHandler bodyHandler = BodyHandler.create(false).setBodyLimit(MAX_BODY_SIZE);

        router.route(HttpMethod.GET, PATH_FORM_CONFIG)
            .handler(this::getFormConfig)
            .failureHandler(failureHandler);

        router.route(HttpMethod.POST, PATH_DEVICE_DISCONNECT)
            .handler(bodyHandler)
            .handler(this::extractRequiredJsonPayload)
            .handler(this::deviceDisconnect)
            .failureHandler(failureHandler);

        router.route(HttpMethod.POST, PATH_NOTIFY_EVENT)
            .handler(bodyHandler)
            .handler(this::extractRequiredJsonPayload)
            .handler(this::notification)
            .failureHandler(failureHandler);

        router.route(HttpMethod.GET, PATH_DEVICE_LIST)
            .handler(this::getDeviceList)
            .failureHandler(failureHandler);

        router.route(HttpMethod.GET, PATH_DEVICE_INFO)
            .handler(this::getDeviceInfo)
            .failureHandler(failureHandler);
    }

    /**
     * Checks the Content-Type of the request and extracts the JSON object contained in the body.
     * <p>
     * A request without Content-Type header is accepted. The object is put to the routing
     * context using key {@value #KEY_REQUEST_BODY}.
     *
     * @param ctx The routing context to retrieve the JSON request body from.
     */
    private void extractRequiredJsonPayload(final RoutingContext ctx) {

        final MIMEHeader contentType = ctx.parsedHeaders().contentType();
        if (contentType != null && !Constants.CONTENT_TYPE_APPLICATION_JSON.equalsIgnoreCase(contentType.value())) {
            ctx.fail(new ClientErrorException(
                    HttpURLConnection.HTTP_BAD_REQUEST,
                    String.format("Unsupported Content-Type [%s]", contentType.value())));
            return;
        }
        if (ctx.body().length() <= 0) {
            ctx.fail(new ClientErrorException(HttpURLConnection.HTTP_BAD_REQUEST, "Empty body"));
            return;
        }
        try {
            final JsonObject payload = ctx.body().asJsonObject();
            if (payload == null) {
                ctx.fail(new ClientErrorException(HttpURLConnection.HTTP_BAD_REQUEST, "Null body"));
            } else {
                ctx.put(KEY_REQUEST_BODY, payload);
                ctx.next();
            }
        } catch (final DecodeException | ClassCastException e) {
            ctx.fail(new ClientErrorException(HttpURLConnection.HTTP_BAD_REQUEST, "Invalid JSON", e));
        }
    }

    private static String getOptionalString(final JsonObject obj, final String key) {
        return Optional.ofNullable(obj.getValue(key))
                .map(value -> value instanceof JsonObject ? ((JsonObject) value).encode() : value.toString())
                .orElse(null);
    }

    /**
     * Gets the value of a required integer request parameter.
     *
     * @param ctx The routing context to get the parameter from.
     * @param paramName The name of the parameter.
     * @return A future indicating the outcome of the operation.
     *         The future will be failed with a {@link ClientErrorException} with status 400
     *         if the parameter's value is not an integer.
     */
    private static Future<Integer> getIntRequestParameter(
            final RoutingContext ctx,
            final String paramName) {

        final String value = ctx.request().getParam(paramName);
        try {
            return Future.succeededFuture(CONVERTER_INT.apply(value));
        } catch (final IllegalArgumentException e) {
            return Future.failedFuture(new ClientErrorException(
                    HttpURLConnection.HTTP_BAD_REQUEST,
                    String.format("request parameter [name: %s, value: %s] failed validation: %s",
                            paramName, value, e.getMessage()),
                    e));
        }
    }

    /**
     * Checks that the request contains all of the given parameters.
     *
     * @param ctx The routing context to get the parameters from.
     * @param paramNames The names of the parameters.
     * @return A succeeded future if all parameters are set. Otherwise a future failed with a
     *         {@link ClientErrorException} with status 400 that names the missing parameters.
     */
    private static Future<Void> checkRequiredRequestParameters(
            final RoutingContext ctx,
            final String... paramNames) {

        final Map<String, String> params = new LinkedHashMap<>();
        for (final String name : paramNames) {
            params.put(name, ctx.request().getParam(name));
        }
        final List<String> missing = Strings.namesOfEmptyValues(params);
        if (missing.isEmpty()) {
            return Future.succeededFuture();
        }
        return Future.failedFuture(new ClientErrorException(
                HttpURLConnection.HTTP_BAD_REQUEST,
                String.format("missing required parameters %s", missing)));
    }

    private static <T> void respond(final RoutingContext ctx, final Future<ResponseEnvelope<T>> result) {
        result.onSuccess(envelope -> HttpUtils.endWithEnvelope(ctx.response(), HttpURLConnection.HTTP_OK, envelope))
            .onFailure(ctx::fail);
    }

    private void getFormConfig(final RoutingContext ctx) {

        respond(ctx, handler.getFormConfig(
                ctx.request().getParam(PARAM_PROTOCOL_TYPE),
                ctx.request().getParam(PARAM_DEVICE_TYPE),
                ctx.request().getParam(PARAM_FORM_TYPE),
                null));
    }

    private void deviceDisconnect(final RoutingContext ctx) {

        final JsonObject body = ctx.get(KEY_REQUEST_BODY);
        respond(ctx, handler.deviceDisconnect(getOptionalString(body, Constants.FIELD_DEVICE_ID), null));
    }

    private void notification(final RoutingContext ctx) {

        final JsonObject body = ctx.get(KEY_REQUEST_BODY);
        respond(ctx, handler.notification(
                getOptionalString(body, FIELD_MESSAGE_TYPE),
                getOptionalString(body, FIELD_MESSAGE),
                null));
    }

    private void getDeviceList(final RoutingContext ctx) {

        respond(ctx, checkRequiredRequestParameters(ctx, PARAM_PAGE, PARAM_PAGE_SIZE)
                .compose(ok -> getIntRequestParameter(ctx, PARAM_PAGE))
                .compose(page -> getIntRequestParameter(ctx, PARAM_PAGE_SIZE)
                        .compose(pageSize -> handler.getDeviceList(
                                ctx.request().getParam(PARAM_VOUCHER),
                                ctx.request().getParam(PARAM_SERVICE_IDENTIFIER),
                                page,
                                pageSize,
                                null))));
    }

    private void getDeviceInfo(final RoutingContext ctx) {

        final String deviceCode = Optional.ofNullable(ctx.request().getParam(PARAM_DEVICE_CODE))
                .orElseGet(() -> ctx.request().getParam(PARAM_KEY));
        LOG.trace("received device info request [device code: {}]", deviceCode);
        respond(ctx, handler.getDeviceInfo(deviceCode, ctx.request().getParam(PARAM_VOUCHER), null));
    }
}
