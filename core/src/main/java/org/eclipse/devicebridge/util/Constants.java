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

/**
 * Constants used throughout the device bridge.
 */
public final class Constants {

    /**
     * The MIME type representing a JSON document.
     */
    public static final String CONTENT_TYPE_APPLICATION_JSON = "application/json";
    /**
     * The MIME type representing a UTF-8 encoded JSON document.
     */
    public static final String CONTENT_TYPE_APPLICATION_JSON_UTF8 = "application/json; charset=utf-8";

    /**
     * The name of the header carrying the remote platform's secret.
     */
    public static final String HEADER_X_TOKEN = "x-token";

    /**
     * The name of the field carrying a device's host side identifier.
     */
    public static final String FIELD_DEVICE_ID = "device_id";
    /**
     * The name of the field carrying a device's stable external identifier.
     */
    public static final String FIELD_DEVICE_NUMBER = "device_number";
    /**
     * The name of the field carrying a device's display name.
     */
    public static final String FIELD_DEVICE_NAME = "device_name";
    /**
     * The name of the field carrying a device's description.
     */
    public static final String FIELD_DESCRIPTION = "description";

    private Constants() {
        // prevent instantiation
    }
}
