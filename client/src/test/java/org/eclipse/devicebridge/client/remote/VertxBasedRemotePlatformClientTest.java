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

import static com.google.common.truth.Truth.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

import java.net.HttpURLConnection;
import java.util.concurrent.TimeUnit;

import org.eclipse.devicebridge.client.RemotePlatformException;
import org.eclipse.devicebridge.client.ServerErrorException;
import org.eclipse.devicebridge.client.ServiceInvocationException;
import org.eclipse.devicebridge.client.voucher.Voucher;
import org.eclipse.devicebridge.test.RecordingHttpServer;
import org.eclipse.devicebridge.test.RecordingHttpServer.RecordedRequest;
import org.eclipse.devicebridge.test.TracingMockSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import io.opentracing.Span;
import io.opentracing.tag.Tags;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.Timeout;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;

/**
 * Tests verifying behavior of {@link VertxBasedRemotePlatformClient} against an HTTP server
 * standing in for the remote platform.
 *
 */
@ExtendWith(VertxExtension.class)
@Timeout(value = 5, timeUnit = TimeUnit.SECONDS)
class VertxBasedRemotePlatformClientTest {

    private static final String RAW_VOUCHER = "{\"ServerURL\":\"ignored\"}";

    private RecordingHttpServer remotePlatform;
    private RemotePlatformClientConfig config;
    private VertxBasedRemotePlatformClient client;
    private Span span;

    /**
     * Starts the remote platform stand-in and creates the client under test.
     *
     * @param vertx The vert.x instance to run on.
     * @param ctx The vert.x test context.
     */
    @BeforeEach
    void setUp(final Vertx vertx, final VertxTestContext ctx) {
        config = new RemotePlatformClientConfig();
        config.setRequestTimeout(500);
        span = TracingMockSupport.mockSpan();
        client = VertxBasedRemotePlatformClient.create(vertx, config, TracingMockSupport.mockTracer(span));
        remotePlatform = new RecordingHttpServer(vertx);
        remotePlatform.start().onComplete(ctx.succeedingThenComplete());
    }

    /**
     * Stops the remote platform stand-in.
     *
     * @param ctx The vert.x test context.
     */
    @AfterEach
    void stopServer(final VertxTestContext ctx) {
        remotePlatform.stop().onComplete(ctx.succeedingThenComplete());
    }

    private static Voucher listVoucher(final String remoteBaseUrl, final String secret) {
        return new Voucher(remoteBaseUrl, secret, null, null, null, null);
    }

    private Voucher bindingVoucher() {
        return new Voucher(remotePlatform.getBaseUrl(), "the-secret", null, "agent-1", "api-key-1", null);
    }

    /**
     * Verifies that the device list request carries the secret in the x-token header and
     * forwards exactly the voucher, service identifier and paging parameters.
     *
     * @param ctx The vert.x test context.
     */
    @Test
    void testListDevicesSendsExpectedRequest(final VertxTestContext ctx) {

        remotePlatform.respondWith(200, new JsonObject()
                .put("code", 0)
                .put("msg", "ok")
                .put("data", new JsonObject()
                        .put("total", 7)
                        .put("list", new JsonArray()
                                .add(new JsonObject()
                                        .put("device_name", "sensor 1")
                                        .put("device_number", "SN-1")
                                        .put("description", "first")
                                        .put("firmware", "1.0"))
                                .add(new JsonObject()
                                        .put("device_name", "sensor 2")
                                        .put("device_number", "SN-2"))))
                .encode());
        final DeviceListRequest request = new DeviceListRequest(RAW_VOUCHER, "svc-1", 2, 10);

        client.listDevices(listVoucher(remotePlatform.getBaseUrl() + "/", "the-secret"), request, null)
            .onComplete(ctx.succeeding(result -> {
                ctx.verify(() -> {
                    assertThat(result.getTotal()).isEqualTo(7);
                    assertThat(result.getDevices()).containsExactly(
                            new RemoteDevice("sensor 1", "SN-1", "first"),
                            new RemoteDevice("sensor 2", "SN-2", ""))
                        .inOrder();

                    assertThat(remotePlatform.getRequests()).hasSize(1);
                    final RecordedRequest sent = remotePlatform.getRequests().get(0);
                    assertThat(sent.getMethod()).isEqualTo("POST");
                    assertThat(sent.getPath()).isEqualTo("/device/list");
                    assertThat(sent.getHeader("x-token")).isEqualTo("the-secret");
                    assertThat(sent.getHeader("content-type")).startsWith("application/json");
                    assertThat(sent.getBody().toJsonObject()).isEqualTo(new JsonObject()
                            .put("voucher", RAW_VOUCHER)
                            .put("service_identifier", "svc-1")
                            .put("page", 2)
                            .put("page_size", 10));
                });
                ctx.completeNow();
            }));
    }

    /**
     * Verifies that the bind request contains the voucher's credentials and the device code
     * but no x-token header.
     *
     * @param ctx The vert.x test context.
     */
    @Test
    void testGetDeviceDetailSendsExpectedRequest(final VertxTestContext ctx) {

        remotePlatform.respondWith(200, new JsonObject()
                .put("code", 0)
                .put("msg", "ok")
                .put("data", new JsonObject()
                        .put("device_name", "gateway")
                        .put("device_number", "GW-9")
                        .put("device_description", "roof top"))
                .encode());

        client.getDeviceDetail(bindingVoucher(), "CODE-9", null)
            .onComplete(ctx.succeeding(result -> {
                ctx.verify(() -> {
                    assertThat(result.getDeviceName()).isEqualTo("gateway");
                    assertThat(result.getDeviceNumber()).isEqualTo("GW-9");
                    assertThat(result.getDeviceDescription()).isEqualTo("roof top");

                    final RecordedRequest sent = remotePlatform.getRequests().get(0);
                    assertThat(sent.getPath()).isEqualTo("/device/bind");
                    assertThat(sent.getHeader("x-token")).isNull();
                    assertThat(sent.getBody().toJsonObject()).isEqualTo(new JsonObject()
                            .put("secret", "the-secret")
                            .put("agent_id", "agent-1")
                            .put("external_api_key", "api-key-1")
                            .put("device_code", "CODE-9"));
                });
                ctx.completeNow();
            }));
    }

    /**
     * Verifies that a non-zero code in the response body fails the request with an error
     * that carries the remote platform's message.
     *
     * @param ctx The vert.x test context.
     */
    @Test
    void testGetDeviceDetailFailsForRemoteLogicError(final VertxTestContext ctx) {

        remotePlatform.respondWith(200, new JsonObject().put("code", 5).put("msg", "not found").encode());

        client.getDeviceDetail(bindingVoucher(), "CODE-9", null)
            .onComplete(ctx.failing(t -> {
                ctx.verify(() -> {
                    assertThat(t).isInstanceOf(RemotePlatformException.class);
                    final RemotePlatformException e = (RemotePlatformException) t;
                    assertThat(e.getRemoteCode()).isEqualTo(5);
                    assertThat(e.getMessage()).contains("not found");
                    assertThat(e.getErrorCode()).isEqualTo(HttpURLConnection.HTTP_BAD_GATEWAY);
                    verify(span).setTag(eq(Tags.ERROR.getKey()), eq(Boolean.TRUE));
                });
                ctx.completeNow();
            }));
    }

    /**
     * Verifies that a non-zero code fails the device list request as well.
     *
     * @param ctx The vert.x test context.
     */
    @Test
    void testListDevicesFailsForRemoteLogicError(final VertxTestContext ctx) {

        remotePlatform.respondWith(200, "{\"code\": 401, \"msg\": \"invalid token\"}");

        client.listDevices(listVoucher(remotePlatform.getBaseUrl(), "wrong"), new DeviceListRequest("{}", "svc", 1, 10), null)
            .onComplete(ctx.failing(t -> {
                ctx.verify(() -> {
                    assertThat(t).isInstanceOf(RemotePlatformException.class);
                    assertThat(t.getMessage()).contains("invalid token");
                });
                ctx.completeNow();
            }));
    }

    /**
     * Verifies that a non-2xx status code fails the request with a 502.
     *
     * @param ctx The vert.x test context.
     */
    @Test
    void testRequestFailsForErrorStatus(final VertxTestContext ctx) {

        remotePlatform.respondWith(500, "{\"code\": 0}");

        client.getDeviceDetail(bindingVoucher(), "CODE-9", null)
            .onComplete(ctx.failing(t -> {
                ctx.verify(() -> {
                    assertThat(t).isInstanceOf(ServerErrorException.class);
                    assertThat(t).isNotInstanceOf(RemotePlatformException.class);
                    assertThat(((ServiceInvocationException) t).getErrorCode())
                        .isEqualTo(HttpURLConnection.HTTP_BAD_GATEWAY);
                });
                ctx.completeNow();
            }));
    }

    /**
     * Verifies that a body which is not a well formed envelope fails the request with a 502.
     *
     * @param ctx The vert.x test context.
     */
    @Test
    void testRequestFailsForMalformedBody(final VertxTestContext ctx) {

        remotePlatform.respondWith(200, "[\"not\", \"an\", \"object\"]");

        client.listDevices(listVoucher(remotePlatform.getBaseUrl(), "secret"), new DeviceListRequest("{}", "svc", 1, 10), null)
            .onComplete(ctx.failing(t -> {
                ctx.verify(() -> {
                    assertThat(((ServiceInvocationException) t).getErrorCode())
                        .isEqualTo(HttpURLConnection.HTTP_BAD_GATEWAY);
                });
                ctx.completeNow();
            }));
    }

    /**
     * Verifies that a successful envelope without data yields a device detail with empty properties.
     *
     * @param ctx The vert.x test context.
     */
    @Test
    void testGetDeviceDetailSucceedsForMissingData(final VertxTestContext ctx) {

        remotePlatform.respondWith(200, "{\"code\": 0, \"msg\": \"ok\"}");

        client.getDeviceDetail(bindingVoucher(), "CODE-9", null)
            .onComplete(ctx.succeeding(detail -> {
                ctx.verify(() -> {
                    assertThat(detail.getDeviceName()).isEmpty();
                    assertThat(detail.getDeviceNumber()).isEmpty();
                    assertThat(detail.getDeviceDescription()).isEmpty();
                });
                ctx.completeNow();
            }));
    }

    /**
     * Verifies that envelopes lacking the code or the data are treated as an empty device list.
     *
     * @param body The response body.
     * @param ctx The vert.x test context.
     */
    @ParameterizedTest
    @ValueSource(strings = {
            "{\"code\": 0, \"msg\": \"ok\", \"data\": null}",
            "{\"code\": 0, \"msg\": \"ok\"}",
            "{\"msg\": \"ok\", \"data\": {\"total\": 0, \"list\": []}}",
            "{\"data\": {}}" })
    void testListDevicesSucceedsWithEmptyListForEnvelopeWithoutData(
            final String body,
            final VertxTestContext ctx) {

        remotePlatform.respondWith(200, body);

        client.listDevices(listVoucher(remotePlatform.getBaseUrl(), "secret"), new DeviceListRequest("{}", "svc", 1, 10), null)
            .onComplete(ctx.succeeding(result -> {
                ctx.verify(() -> {
                    assertThat(result.getTotal()).isEqualTo(0);
                    assertThat(result.getDevices()).isEmpty();
                });
                ctx.completeNow();
            }));
    }

    /**
     * Verifies that an envelope containing a code or data of the wrong type fails the request
     * with a 502.
     *
     * @param body The response body.
     * @param ctx The vert.x test context.
     */
    @ParameterizedTest
    @ValueSource(strings = {
            "{\"code\": \"zero\", \"msg\": \"ok\"}",
            "{\"code\": 0, \"msg\": \"ok\", \"data\": [1, 2]}",
            "{\"code\": 0, \"msg\": \"ok\", \"data\": {\"total\": \"many\"}}" })
    void testListDevicesFailsForWronglyTypedEnvelopeFields(final String body, final VertxTestContext ctx) {

        remotePlatform.respondWith(200, body);

        client.listDevices(listVoucher(remotePlatform.getBaseUrl(), "secret"), new DeviceListRequest("{}", "svc", 1, 10), null)
            .onComplete(ctx.failing(t -> {
                ctx.verify(() -> {
                    assertThat(t).isInstanceOf(ServerErrorException.class);
                    assertThat(((ServiceInvocationException) t).getErrorCode())
                        .isEqualTo(HttpURLConnection.HTTP_BAD_GATEWAY);
                });
                ctx.completeNow();
            }));
    }

    /**
     * Verifies that the request fails with a 503 if the remote platform does not respond in time.
     *
     * @param ctx The vert.x test context.
     */
    @Test
    void testRequestFailsWhenRemotePlatformDoesNotRespond(final VertxTestContext ctx) {

        remotePlatform.neverRespond();

        client.getDeviceDetail(bindingVoucher(), "CODE-9", null)
            .onComplete(ctx.failing(t -> {
                ctx.verify(() -> {
                    assertThat(t).isInstanceOf(ServerErrorException.class);
                    assertThat(((ServiceInvocationException) t).getErrorCode())
                        .isEqualTo(HttpURLConnection.HTTP_UNAVAILABLE);
                });
                ctx.completeNow();
            }));
    }

    /**
     * Verifies that the request fails with a 503 if the remote platform cannot be reached.
     *
     * @param ctx The vert.x test context.
     */
    @Test
    void testRequestFailsWhenRemotePlatformIsUnreachable(final VertxTestContext ctx) {

        final Voucher voucher = listVoucher("http://127.0.0.1:1", "secret");

        client.listDevices(voucher, new DeviceListRequest("{}", "svc", 1, 10), null)
            .onComplete(ctx.failing(t -> {
                ctx.verify(() -> {
                    assertThat(((ServiceInvocationException) t).getErrorCode())
                        .isEqualTo(HttpURLConnection.HTTP_UNAVAILABLE);
                    assertThat(remotePlatform.getRequests()).isEmpty();
                });
                ctx.completeNow();
            }));
    }
}
