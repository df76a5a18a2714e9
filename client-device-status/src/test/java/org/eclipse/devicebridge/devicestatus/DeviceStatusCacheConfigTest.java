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

import static com.google.common.truth.Truth.assertThat;

import org.eclipse.devicebridge.test.ConfigMappingSupport;
import org.junit.jupiter.api.Test;

/**
 * Tests verifying binding of configuration properties to {@link DeviceStatusCacheConfig}.
 *
 */
class DeviceStatusCacheConfigTest {

    @Test
    void testMaxSizeIsPickedUp() {
        final var config = new DeviceStatusCacheConfig(
                ConfigMappingSupport.getConfigMapping(DeviceStatusCacheOptions.class, "/cache-options.yaml"));

        assertThat(config.getMaxSize()).isEqualTo(5000L);
        assertThat(config.isBounded()).isTrue();
    }

    @Test
    void testCacheIsUnboundedByDefault() {
        assertThat(new DeviceStatusCacheConfig().isBounded()).isFalse();
    }
}
