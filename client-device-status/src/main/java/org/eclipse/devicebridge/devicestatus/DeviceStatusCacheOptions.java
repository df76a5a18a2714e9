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

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Options for configuring the local device status cache.
 *
 */
@ConfigMapping(prefix = "plugin.cache", namingStrategy = ConfigMapping.NamingStrategy.KEBAB_CASE)
public interface DeviceStatusCacheOptions {

    /**
     * Gets the maximum number of device numbers to keep information for.
     *
     * @return The number of entries or a negative value if the cache is unbounded.
     */
    @WithDefault("" + DeviceStatusCacheConfig.UNBOUNDED)
    long maxSize();
}
