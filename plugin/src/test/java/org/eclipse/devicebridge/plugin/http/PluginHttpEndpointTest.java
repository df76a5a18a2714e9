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

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import static com.google.common.truth.Truth.assertThat;

import java.net.HttpURLConnection;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.eclipse.devicebridge.client.ClientErrorException;
import org.eclipse.devicebridge.client.RemotePlatformException;
import org.eclipse.devicebridge.config.ServerConfig;
import org.eclipse.devicebridge.plugin.DeviceItem;
import org.eclipse.devicebridge.plugin.DeviceListData;
import org.eclipse.devicebridge.plugin.DevicePluginHandler;
import org.eclipse.devicebridge.plugin.PluginResponses;
import org.eclipse.devicebridge.plugin.app.PluginHttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.junit5.Timeout;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;

/**
 * Tests verifying the HTTP binding of the host platform's callbacks.
 *
 */
@ExtendWith(VertxExtension.class)
@Timeout(value = 5, timeUnit = TimeUnit.SECONDS)
public class PluginHttpEndpointTest {

    private DevicePluginHandler handler;
    private PluginHttpServer server;
    private WebClient client;

    /**
     * Starts the server with a mocked handler.
     *
     * @param vertx The vert.x instance to use.
     * @param ctx The vert.x test context.
     */
    @BeforeEach
    public void startServer(final Vertx vertx, final VertxTestContext ctx) {
        handler = mock(DevicePluginHandler.class);
        final ServerConfig config = new ServerConfig();
        config.setBindAddress("127.0.0.1");
        config.setPort(0);
        server = new PluginHttpServer(config, List.of(new PluginHttpEndpoint(handler)));
        vertx.deployVerticle(server)
            .onComplete(ctx.succeeding(id -> {
                client = WebClient.create(vertx, new WebClientOptions()
                        .setDefaultHost("127.0.0.1")
                        .setDefaultPort(server.getActualPort()));
                ctx.completeNow();
            }));
    }

    /**
     * Closes the client.
     */
    @AfterEach
    public void closeClient() {
        if (client != null) {
            client.close();
        }
    }

    /**
     * Verifies that the form configuration is returned in the envelope.
     *
     * @param ctx The vert.x test context.
     */
    @Test
    public void testGetFormConfig(final VertxTestContext ctx) {

        final JsonArray fields = new JsonArray().add(new JsonObject().put("dataKey", "ServerURL"));
        when(handler.getFormConfig(anyString(), anyString(), anyString(), any()))
            .thenReturn(Future.succeededFuture(PluginResponses.<Object>success(fields)));

        client.get(PluginHttpEndpoint.PATH_FORM_CONFIG)
            .addQueryParam("protocol_type", "MQTT")
            .addQueryParam("device_type", "1")
            .addQueryParam("form_type", "SVCR")
            .send()
            .onComplete(ctx.succeeding(response -> {
                ctx.verify(() -> {
                    assertThat(response.statusCode()).isEqualTo(200);
                    assertThat(response.getHeader("content-type")).contains("application/json");
                    final JsonObject body = response.bodyAsJsonObject();
                    assertThat(body.getInteger("code")).isEqualTo(200);
                    assertThat(body.getString("message")).isEqualTo("success");
                    assertThat(body.getJsonArray("data")).isEqualTo(fields);
                    verify(handler).getFormConfig(eq("MQTT"), eq("1"), eq("SVCR"), any());
                });
                ctx.completeNow();
            }));
    }

    /**
     * Verifies that a failed callback is answered with an error envelope.
     *
     * @param ctx The vert.x test context.
     */
    @Test
    public void testGetFormConfigFailure(final VertxTestContext ctx) {

        when(handler.getFormConfig(any(), any(), any(), any()))
            .thenReturn(Future.failedFuture(new ClientErrorException(
                    HttpURLConnection.HTTP_BAD_REQUEST, "unsupported form type")));

        client.get(PluginHttpEndpoint.PATH_FORM_CONFIG)
            .addQueryParam("form_type", "XYZ")
            .send()
            .onComplete(ctx.succeeding(response -> {
                ctx.verify(() -> {
                    assertThat(response.statusCode()).isEqualTo(400);
                    assertThat(response.bodyAsJsonObject()).isEqualTo(new JsonObject()
                            .put("code", 400)
                            .put("message", "unsupported form type"));
                });
                ctx.completeNow();
            }));
    }

    /**
     * Verifies that the device ID is taken from the disconnection request's body.
     *
     * @param ctx The vert.x test context.
     */
    @Test
    public void testDeviceDisconnect(final VertxTestContext ctx) {

        when(handler.deviceDisconnect(anyString(), any()))
            .thenReturn(Future.succeededFuture(PluginResponses.success()));

        client.post(PluginHttpEndpoint.PATH_DEVICE_DISCONNECT)
            .sendJsonObject(new JsonObject().put("device_id", "device-1"))
            .onComplete(ctx.succeeding(response -> {
                ctx.verify(() -> {
                    assertThat(response.statusCode()).isEqualTo(200);
                    assertThat(response.bodyAsJsonObject()).isEqualTo(new JsonObject()
                            .put("code", 200)
                            .put("message", "success"));
                    verify(handler).deviceDisconnect(eq("device-1"), any());
                });
                ctx.completeNow();
            }));
    }

    /**
     * Verifies that a disconnection request with a malformed body is rejected.
     *
     * @param ctx The vert.x test context.
     */
    @Test
    public void testDeviceDisconnectFailsForMalformedBody(final VertxTestContext ctx) {

        client.post(PluginHttpEndpoint.PATH_DEVICE_DISCONNECT)
            .putHeader("content-type", "application/json")
            .sendBuffer(Buffer.buffer("{\"device_id\": "))
            .onComplete(ctx.succeeding(response -> {
                ctx.verify(() -> {
                    assertThat(response.statusCode()).isEqualTo(400);
                    assertThat(response.bodyAsJsonObject().getInteger("code")).isEqualTo(400);
                    verifyNoInteractions(handler);
                });
                ctx.completeNow();
            }));
    }

    /**
     * Verifies that a disconnection request with a non JSON content type is rejected.
     *
     * @param ctx The vert.x test context.
     */
    @Test
    public void testDeviceDisconnectFailsForUnsupportedContentType(final VertxTestContext ctx) {

        client.post(PluginHttpEndpoint.PATH_DEVICE_DISCONNECT)
            .putHeader("content-type", "text/plain")
            .sendBuffer(Buffer.buffer("device-1"))
            .onComplete(ctx.succeeding(response -> {
                ctx.verify(() -> {
                    assertThat(response.statusCode()).isEqualTo(400);
                    assertThat(response.bodyAsJsonObject().getString("message")).contains("Content-Type");
                    verifyNoInteractions(handler);
                });
                ctx.completeNow();
            }));
    }

    /**
     * Verifies that a notification message given as JSON object is passed on as string.
     *
     * @param ctx The vert.x test context.
     */
    @Test
    public void testNotificationAcceptsObjectMessage(final VertxTestContext ctx) {

        when(handler.notification(anyString(), anyString(), any()))
            .thenReturn(Future.succeededFuture(PluginResponses.success()));

        final JsonObject message = new JsonObject().put("device_number", "SN-1");
        client.post(PluginHttpEndpoint.PATH_NOTIFY_EVENT)
            .sendJsonObject(new JsonObject()
                    .put("message_type", "2")
                    .put("message", message))
            .onComplete(ctx.succeeding(response -> {
                ctx.verify(() -> {
                    assertThat(response.statusCode()).isEqualTo(200);
                    verify(handler).notification(eq("2"), eq(message.encode()), any());
                });
                ctx.completeNow();
            }));
    }

    /**
     * Verifies that the device list is requested using the query parameters as given.
     *
     * @param ctx The vert.x test context.
     */
    @Test
    public void testGetDeviceListForwardsQueryParameters(final VertxTestContext ctx) {

        final DeviceListData data = new DeviceListData(List.of(new DeviceItem("Sensor", "SN-1", "desc")), 1);
        when(handler.getDeviceList(anyString(), anyString(), anyInt(), anyInt(), any()))
            .thenReturn(Future.succeededFuture(PluginResponses.success(data)));

        client.get(PluginHttpEndpoint.PATH_DEVICE_LIST)
            .addQueryParam("voucher", "{\"ServerURL\":\"https://remote.example.com\",\"Secret\":\"s\"}")
            .addQueryParam("service_identifier", "service-1")
            .addQueryParam("page", "3")
            .addQueryParam("page_size", "25")
            .send()
            .onComplete(ctx.succeeding(response -> {
                ctx.verify(() -> {
                    assertThat(response.statusCode()).isEqualTo(200);
                    final JsonObject body = response.bodyAsJsonObject().getJsonObject("data");
                    assertThat(body.getInteger("total")).isEqualTo(1);
                    assertThat(body.getJsonArray("list").getJsonObject(0).getString("device_name"))
                        .isEqualTo("Sensor");
                    verify(handler).getDeviceList(
                            eq("{\"ServerURL\":\"https://remote.example.com\",\"Secret\":\"s\"}"),
                            eq("service-1"),
                            eq(3),
                            eq(25),
                            any());
                });
                ctx.completeNow();
            }));
    }

    /**
     * Verifies that a device list request lacking paging parameters is rejected with an error
     * naming the missing parameters.
     *
     * @param ctx The vert.x test context.
     */
    @Test
    public void testGetDeviceListFailsForMissingPagingParameters(final VertxTestContext ctx) {

        client.get(PluginHttpEndpoint.PATH_DEVICE_LIST)
            .addQueryParam("voucher", "{}")
            .send()
            .onComplete(ctx.succeeding(response -> {
                ctx.verify(() -> {
                    assertThat(response.statusCode()).isEqualTo(400);
                    final JsonObject body = response.bodyAsJsonObject();
                    assertThat(body.getInteger("code")).isEqualTo(400);
                    assertThat(body.getString("message")).isEqualTo("missing required parameters [page, page_size]");
                    verifyNoInteractions(handler);
                });
                ctx.completeNow();
            }));
    }

    /**
     * Verifies that a device list request lacking the page size is rejected with an error
     * naming the page size.
     *
     * @param ctx The vert.x test context.
     */
    @Test
    public void testGetDeviceListFailsForMissingPageSize(final VertxTestContext ctx) {

        client.get(PluginHttpEndpoint.PATH_DEVICE_LIST)
            .addQueryParam("voucher", "{}")
            .addQueryParam("page", "1")
            .send()
            .onComplete(ctx.succeeding(response -> {
                ctx.verify(() -> {
                    assertThat(response.statusCode()).isEqualTo(400);
                    assertThat(response.bodyAsJsonObject().getString("message"))
                        .isEqualTo("missing required parameters [page_size]");
                    verifyNoInteractions(handler);
                });
                ctx.completeNow();
            }));
    }

    /**
     * Verifies that a device list request with a non-integer page number is rejected.
     *
     * @param ctx The vert.x test context.
     */
    @Test
    public void testGetDeviceListFailsForNonIntegerPage(final VertxTestContext ctx) {

        client.get(PluginHttpEndpoint.PATH_DEVICE_LIST)
            .addQueryParam("voucher", "{}")
            .addQueryParam("page", "first")
            .addQueryParam("page_size", "10")
            .send()
            .onComplete(ctx.succeeding(response -> {
                ctx.verify(() -> {
                    assertThat(response.statusCode()).isEqualTo(400);
                    assertThat(response.bodyAsJsonObject().getString("message")).contains("[name: page, value: first]");
                    verifyNoInteractions(handler);
                });
                ctx.completeNow();
            }));
    }

    /**
     * Verifies that the device code may be given using the <em>key</em> parameter and
     * that an error reported by the remote platform is passed on.
     *
     * @param ctx The vert.x test context.
     */
    @Test
    public void testGetDeviceInfoAcceptsKeyParameter(final VertxTestContext ctx) {

        when(handler.getDeviceInfo(anyString(), isNull(), any()))
            .thenReturn(Future.failedFuture(new RemotePlatformException(5, "device not found")));

        client.get(PluginHttpEndpoint.PATH_DEVICE_INFO)
            .addQueryParam("key", "CODE-1")
            .send()
            .onComplete(ctx.succeeding(response -> {
                ctx.verify(() -> {
                    assertThat(response.statusCode()).isEqualTo(HttpURLConnection.HTTP_BAD_GATEWAY);
                    assertThat(response.bodyAsJsonObject().getString("message")).contains("device not found");
                    verify(handler).getDeviceInfo(eq("CODE-1"), isNull(), any());
                });
                ctx.completeNow();
            }));
    }

    /**
     * Verifies that requests for unknown resources are answered with an error envelope.
     *
     * @param ctx The vert.x test context.
     */
    @Test
    public void testUnknownResource(final VertxTestContext ctx) {

        client.get("/api/v1/unknown")
            .send()
            .onComplete(ctx.succeeding(response -> {
                ctx.verify(() -> {
                    assertThat(response.statusCode()).isEqualTo(404);
                    assertThat(response.bodyAsJsonObject().getInteger("code")).isEqualTo(404);
                });
                ctx.completeNow();
            }));
    }
}
