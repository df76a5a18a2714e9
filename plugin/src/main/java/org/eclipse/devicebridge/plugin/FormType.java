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

import java.util.Optional;

/**
 * The types of forms that the host platform may request from the plugin.
 *
 */
public enum FormType {

    /**
     * The device configuration form.
     */
    CFG,
    /**
     * The device voucher form.
     */
    VCR,
    /**
     * The service voucher form.
     */
    SVCR;

    /**
     * Gets the form type for a name.
     *
     * @param name The name as used by the host platform.
     * @return The form type or an empty optional if the name is {@code null} or unknown.
     */
    public static Optional<FormType> from(final String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (final FormType type : values()) {
            if (type.name().equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
