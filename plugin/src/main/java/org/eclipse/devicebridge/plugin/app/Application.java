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

package org.eclipse.devicebridge.plugin.app;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.eclipse.devicebridge.client.remote.RemotePlatformClientConfig;
import org.eclipse.devicebridge.client.remote.RemotePlatformClientOptions;
import org.eclipse.devicebridge.client.remote.VertxBasedRemotePlatformClient;
import org.eclipse.devicebridge.config.ServerConfig;
import org.eclipse.devicebridge.config.ServerOptions;
import org.eclipse.devicebridge.devicestatus.CaffeineBasedDeviceStatusCache;
import org.eclipse.devicebridge.devicestatus.DeviceStatusCacheConfig;
import org.eclipse.devicebridge.devicestatus.DeviceStatusCacheOptions;
import org.eclipse.devicebridge.plugin.FormConfig;
import org.eclipse.devicebridge.plugin.FormConfigOptions;
import org.eclipse.devicebridge.plugin.RemotePlatformPluginHandler;
import org.eclipse.devicebridge.plugin.http.PluginHttpEndpoint;
import org.eclipse.devicebridge.plugin.status.MqttDeviceStatusSender;
import org.eclipse.devicebridge.plugin.status.MqttStatusSenderConfig;
import org.eclipse.devicebridge.plugin.status.MqttStatusSenderOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.opentracing.Tracer;
import io.opentracing.noop.NoopTracerFactory;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.source.yaml.YamlConfigSource;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

/**
 * The device plugin application.
 * <p>
 * Reads its configuration from a YAML file, wires up the components and deploys the
 * HTTP server that the host platform invokes the callbacks on.
 */
public final class Application {

    /**
     * The name of the configuration file that is used if no file is given on the command line.
     */
    public static final String DEFAULT_CONFIG_FILE = "config.yaml";

    private static final Logger LOG = LoggerFactory.getLogger(Application.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final ServerConfig serverConfig;
    private final RemotePlatformClientConfig remotePlatformClientConfig;
    private final MqttStatusSenderConfig statusSenderConfig;
    private final FormConfig formConfig;
    private final DeviceStatusCacheConfig cacheConfig;
    private final Tracer tracer;

    private Vertx vertx;
    private MqttDeviceStatusSender statusSender;
    private PluginHttpServer httpServer;

    /**
     * Creates a new application.
     *
     * @param config The configuration to read the options from.
     * @throws NullPointerException if config is {@code null}.
     */
    public Application(final SmallRyeConfig config) {
        Objects.requireNonNull(config);
        this.serverConfig = new ServerConfig(config.getConfigMapping(ServerOptions.class));
        this.remotePlatformClientConfig = new RemotePlatformClientConfig(
                config.getConfigMapping(RemotePlatformClientOptions.class));
        this.statusSenderConfig = new MqttStatusSenderConfig(config.getConfigMapping(MqttStatusSenderOptions.class));
        this.formConfig = new FormConfig(config.getConfigMapping(FormConfigOptions.class));
        this.cacheConfig = new DeviceStatusCacheConfig(config.getConfigMapping(DeviceStatusCacheOptions.class));
        this.tracer = NoopTracerFactory.create();
    }

    /**
     * Loads the configuration.
     * <p>
     * Properties are read from system properties, environment variables and the given YAML file.
     * A file that does not exist is ignored so that the default values are used.
     *
     * @param configFile The path to the YAML file.
     * @return The configuration.
     * @throws NullPointerException if config file is {@code null}.
     * @throws UncheckedIOException if the file exists but cannot be read.
     */
    public static SmallRyeConfig loadConfig(final Path configFile) {
        Objects.requireNonNull(configFile);

        final SmallRyeConfigBuilder builder = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .withValidateUnknown(false)
                .withMapping(ServerOptions.class)
                .withMapping(RemotePlatformClientOptions.class)
                .withMapping(MqttStatusSenderOptions.class)
                .withMapping(FormConfigOptions.class)
                .withMapping(DeviceStatusCacheOptions.class);

        if (Files.isRegularFile(configFile)) {
            try {
                builder.withSources(new YamlConfigSource(configFile.toUri().toURL()));
                LOG.info("using configuration file [{}]", configFile.toAbsolutePath());
            } catch (final IOException e) {
                throw new UncheckedIOException("cannot read configuration file " + configFile, e);
            }
        } else {
            LOG.info("configuration file [{}] not found, using default configuration", configFile.toAbsolutePath());
        }
        return builder.build();
    }

    ServerConfig getServerConfig() {
        return serverConfig;
    }

    MqttStatusSenderConfig getStatusSenderConfig() {
        return statusSenderConfig;
    }

    RemotePlatformClientConfig getRemotePlatformClientConfig() {
        return remotePlatformClientConfig;
    }

    FormConfig getFormConfig() {
        return formConfig;
    }

    DeviceStatusCacheConfig getCacheConfig() {
        return cacheConfig;
    }

    /**
     * Starts the application on a new vert.x instance.
     *
     * @return A future indicating the outcome of the startup.
     */
    public Future<PluginHttpServer> start() {
        return start(Vertx.vertx());
    }

    /**
     * Starts the application.
     *
     * @param vertxInstance The vert.x instance to run on.
     * @return A future indicating the outcome of the startup. The future will be succeeded with the
     *         deployed HTTP server.
     * @throws NullPointerException if vertx is {@code null}.
     */
    public Future<PluginHttpServer> start(final Vertx vertxInstance) {
        this.vertx = Objects.requireNonNull(vertxInstance);

        LOG.info("starting device plugin [server: {}, remote platform client: {}, host platform broker: {}]",
                serverConfig, remotePlatformClientConfig, statusSenderConfig);

        statusSender = MqttDeviceStatusSender.create(vertx, statusSenderConfig, tracer);
        final RemotePlatformPluginHandler handler = new RemotePlatformPluginHandler(
                vertx,
                VertxBasedRemotePlatformClient.create(vertx, remotePlatformClientConfig, tracer),
                new CaffeineBasedDeviceStatusCache(cacheConfig),
                statusSender,
                formConfig,
                tracer);
        httpServer = new PluginHttpServer(serverConfig, List.of(new PluginHttpEndpoint(handler)));

        return statusSender.start()
                .compose(ok -> vertx.deployVerticle(httpServer))
                .map(deploymentId -> {
                    LOG.info("device plugin started");
                    return httpServer;
                });
    }

    /**
     * Stops the application.
     * <p>
     * Disconnects from the host platform's broker and closes the vert.x instance.
     *
     * @return A future indicating the outcome.
     */
    public Future<Void> stop() {
        if (vertx == null) {
            return Future.succeededFuture();
        }
        LOG.info("stopping device plugin");
        final Future<Void> senderStopped = statusSender == null ? Future.succeededFuture() : statusSender.stop();
        return senderStopped
                .recover(t -> {
                    LOG.info("error disconnecting from host platform broker: {}", t.getMessage());
                    return Future.succeededFuture();
                })
                .compose(ok -> vertx.close());
    }

    /**
     * Starts the device plugin.
     *
     * @param args The command line arguments. The first argument, if given, is the path
     *             to the YAML configuration file.
     */
    public static void main(final String[] args) {

        final Path configFile = Path.of(args.length > 0 ? args[0] : DEFAULT_CONFIG_FILE);
        final Application application = new Application(loadConfig(configFile));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                application.stop()
                    .toCompletionStage()
                    .toCompletableFuture()
                    .get(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (final ExecutionException | TimeoutException e) {
                LOG.warn("error shutting down device plugin", e);
            }
        }, "shutdown"));

        application.start()
            .onFailure(t -> {
                LOG.error("failed to start device plugin", t);
                application.stop().onComplete(r -> System.exit(1));
            });
    }
}
