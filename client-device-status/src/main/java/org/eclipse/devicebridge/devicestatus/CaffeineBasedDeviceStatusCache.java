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

package org.eclipse.devicebridge.devicestatus;

import java.net.HttpURLConnection;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.eclipse.devicebridge.client.ClientErrorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import io.vertx.core.Future;

/**
 * A device status cache that keeps all information in memory using a Caffeine cache.
 * <p>
 * Each mutation is performed atomically by means of the cache's {@code compute} operation on
 * the device number. A second map indexes device numbers by the identifiers that the host
 * platform uses for the devices.
 */
public final class CaffeineBasedDeviceStatusCache implements DeviceStatusCache {

    private static final Logger LOG = LoggerFactory.getLogger(CaffeineBasedDeviceStatusCache.class);

    private final ConcurrentMap<String, String> deviceNumbersById = new ConcurrentHashMap<>();
    private final Cache<String, DeviceStatusEntry> entries;

    private Clock clock = Clock.systemUTC();

    /**
     * Creates a new cache.
     *
     * @param config The cache configuration.
     * @throws NullPointerException if config is {@code null}.
     */
    public CaffeineBasedDeviceStatusCache(final DeviceStatusCacheConfig config) {
        Objects.requireNonNull(config);
        final Caffeine<Object, Object> builder = Caffeine.newBuilder();
        if (config.isBounded()) {
            builder.maximumSize(config.getMaxSize());
        }
        this.entries = builder
                .<String, DeviceStatusEntry>evictionListener((deviceNumber, entry, cause) -> {
                    LOG.debug("evicted device status entry [device number: {}, cause: {}]", deviceNumber, cause);
                    removeIndex(entry);
                })
                .build();
    }

    /**
     * Creates a new unbounded cache.
     */
    public CaffeineBasedDeviceStatusCache() {
        this(new DeviceStatusCacheConfig());
    }

    /**
     * Sets a clock to use for determining the time of updates.
     * <p>
     * The default value of this property is {@link Clock#systemUTC()}.
     *
     * @param clock The clock to use.
     * @throws NullPointerException if clock is {@code null}.
     */
    void setClock(final Clock clock) {
        this.clock = Objects.requireNonNull(clock);
    }

    private Instant now() {
        return Instant.now(clock);
    }

    private void removeIndex(final DeviceStatusEntry entry) {
        if (entry != null && entry.getDeviceId() != null) {
            deviceNumbersById.remove(entry.getDeviceId(), entry.getDeviceNumber());
        }
    }

    @Override
    public Future<DeviceIdentity> getByID(final String deviceId) {
        Objects.requireNonNull(deviceId);

        final DeviceIdentity identity = Optional.ofNullable(deviceNumbersById.get(deviceId))
                .map(entries::getIfPresent)
                .filter(entry -> deviceId.equals(entry.getDeviceId()))
                .map(DeviceStatusEntry::getIdentity)
                .orElse(null);
        if (identity == null) {
            LOG.debug("no identity registered for device [device-id: {}]", deviceId);
            return Future.failedFuture(new ClientErrorException(
                    HttpURLConnection.HTTP_NOT_FOUND,
                    "no identity registered for device"));
        }
        return Future.succeededFuture(identity);
    }

    @Override
    public Future<Void> clearByNumber(final String deviceNumber) {
        Objects.requireNonNull(deviceNumber);

        entries.asMap().compute(deviceNumber, (key, existing) -> {
            if (existing == null) {
                LOG.trace("nothing to clear for device [device number: {}]", deviceNumber);
            } else {
                LOG.debug("clearing cached device information [device number: {}, device-id: {}]",
                        deviceNumber, existing.getDeviceId());
                removeIndex(existing);
            }
            return null;
        });
        return Future.succeededFuture();
    }

    @Override
    public Future<Void> setStatus(final String deviceNumber, final DeviceStatus status) {
        Objects.requireNonNull(deviceNumber);
        Objects.requireNonNull(status);

        entries.asMap().compute(deviceNumber, (key, existing) -> {
            final Instant updateTime = now();
            return existing == null
                    ? DeviceStatusEntry.forStatus(deviceNumber, status, updateTime)
                    : existing.withStatus(status, updateTime);
        });
        LOG.debug("set device status [device number: {}, status: {}]", deviceNumber, status);
        return Future.succeededFuture();
    }

    @Override
    public Future<DeviceStatus> getStatus(final String deviceNumber) {
        Objects.requireNonNull(deviceNumber);

        return Future.succeededFuture(Optional.ofNullable(entries.getIfPresent(deviceNumber))
                .map(DeviceStatusEntry::getStatus)
                .orElse(null));
    }

    @Override
    public Future<Void> putDevice(final String deviceId, final DeviceIdentity identity) {
        Objects.requireNonNull(deviceId);
        Objects.requireNonNull(identity);

        final String deviceNumber = identity.getDeviceNumber();
        entries.asMap().compute(deviceNumber, (key, existing) -> {
            final Instant updateTime = now();
            if (existing == null) {
                deviceNumbersById.put(deviceId, deviceNumber);
                return DeviceStatusEntry.forIdentity(deviceId, identity, updateTime);
            }
            if (existing.getDeviceId() != null && !existing.getDeviceId().equals(deviceId)) {
                removeIndex(existing);
            }
            deviceNumbersById.put(deviceId, deviceNumber);
            return existing.withIdentity(deviceId, identity, updateTime);
        });
        LOG.debug("registered device identity [device-id: {}, device number: {}]", deviceId, deviceNumber);
        return Future.succeededFuture();
    }

    @Override
    public Future<DeviceStatusEntry> getEntry(final String deviceNumber) {
        Objects.requireNonNull(deviceNumber);
        return Future.succeededFuture(entries.getIfPresent(deviceNumber));
    }
}
