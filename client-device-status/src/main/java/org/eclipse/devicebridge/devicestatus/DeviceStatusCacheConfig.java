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

import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * Configuration properties for the local device status cache.
 *
 */
public class DeviceStatusCacheConfig {

    /**
     * The value indicating that the number of entries is not limited.
     */
    public static final long UNBOUNDED = -1;

    private long maxSize = UNBOUNDED;

    /**
     * Creates properties using default values.
     */
    public DeviceStatusCacheConfig() {
        super();
    }

    /**
     * Creates properties using existing options.
     *
     * @param options The options to copy.
     * @throws NullPointerException if options is {@code null}.
     */
    public DeviceStatusCacheConfig(final DeviceStatusCacheOptions options) {
        super();
        Objects.requireNonNull(options);
        setMaxSize(options.maxSize());
    }

    /**
     * Gets the maximum number of device numbers to keep information for.
     * <p>
     * The default value of this property is {@value #UNBOUNDED}.
     *
     * @return The number of entries or a negative value if the cache is unbounded.
     */
    public final long getMaxSize() {
        return maxSize;
    }

    /**
     * Sets the maximum number of device numbers to keep information for.
     *
     * @param maxSize The number of entries or a negative value if the cache should be unbounded.
     * @throws IllegalArgumentException if max size is 0.
     */
    public final void setMaxSize(final long maxSize) {
        if (maxSize == 0) {
            throw new IllegalArgumentException("max size must not be 0");
        }
        this.maxSize = maxSize;
    }

    /**
     * Checks if the number of entries is limited.
     *
     * @return {@code true} if max size is &gt; 0.
     */
    public final boolean isBounded() {
        return maxSize > 0;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("maxSize", maxSize)
                .toString();
    }
}
