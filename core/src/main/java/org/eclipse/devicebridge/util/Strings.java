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

package org.eclipse.devicebridge.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A helper class for working with {@link String}s.
 */
public final class Strings {

    private Strings() {
    }

    /**
     * Check if the provided value for null and emptiness.
     * <p>
     * The method checks if the provided value is {@code null} or its string representation (by calling
     * {@link Object#toString()} is {@code null} or empty.
     * </p>
     *
     * @param value the value to check
     * @return {@code true} if the value is {@code null} or the string representation is empty.
     */
    public static boolean isNullOrEmpty(final Object value) {
        if (value == null) {
            return true;
        }

        final String s = value.toString();

        return s == null || s.isEmpty();
    }

    /**
     * Gets the names of all entries that have a {@code null} or empty value.
     *
     * @param namedValues The values to check, keyed by name. Iteration order is preserved.
     * @return The names of the missing values, never {@code null}.
     */
    public static List<String> namesOfEmptyValues(final Map<String, ?> namedValues) {
        final List<String> result = new ArrayList<>();
        namedValues.forEach((name, value) -> {
            if (isNullOrEmpty(value)) {
                result.add(name);
            }
        });
        return result;
    }
}
