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

import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * Configuration properties for the form documents that the plugin provides to the host platform.
 *
 */
public class FormConfig {

    /**
     * The default path to the service voucher form document.
     */
    public static final String DEFAULT_SERVICE_VOUCHER_PATH = "form_json/form_service_voucher.json";

    private String serviceVoucherPath = DEFAULT_SERVICE_VOUCHER_PATH;

    /**
     * Creates properties using default values.
     */
    public FormConfig() {
        super();
    }

    /**
     * Creates properties using existing options.
     *
     * @param options The options to copy.
     * @throws NullPointerException if options is {@code null}.
     */
    public FormConfig(final FormConfigOptions options) {
        super();
        Objects.requireNonNull(options);
        setServiceVoucherPath(options.serviceVoucherPath());
    }

    /**
     * Gets the path to the service voucher form document.
     * <p>
     * The default value of this property is {@value #DEFAULT_SERVICE_VOUCHER_PATH}.
     *
     * @return The path.
     */
    public final String getServiceVoucherPath() {
        return serviceVoucherPath;
    }

    /**
     * Sets the path to the service voucher form document.
     *
     * @param path The path.
     * @throws NullPointerException if path is {@code null}.
     */
    public final void setServiceVoucherPath(final String path) {
        this.serviceVoucherPath = Objects.requireNonNull(path);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("serviceVoucherPath", serviceVoucherPath)
                .toString();
    }
}
