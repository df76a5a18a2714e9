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

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Options for configuring the form documents that the plugin provides to the host platform.
 *
 */
@ConfigMapping(prefix = "plugin.form", namingStrategy = ConfigMapping.NamingStrategy.KEBAB_CASE)
public interface FormConfigOptions {

    /**
     * Gets the path to the service voucher form document.
     * <p>
     * Relative paths that cannot be found on the file system are resolved against the class path.
     *
     * @return The path.
     */
    @WithDefault(FormConfig.DEFAULT_SERVICE_VOUCHER_PATH)
    String serviceVoucherPath();
}
