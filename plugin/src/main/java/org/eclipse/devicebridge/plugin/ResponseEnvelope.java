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

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * The envelope that all responses to the host platform are wrapped in.
 *
 * @param <T> The type of data contained in the envelope.
 */
public final class ResponseEnvelope<T> {

    /**
     * The name of the JSON property containing the code.
     */
    public static final String FIELD_CODE = "code";
    /**
     * The name of the JSON property containing the message.
     */
    public static final String FIELD_MESSAGE = "message";
    /**
     * The name of the JSON property containing the data.
     */
    public static final String FIELD_DATA = "data";

    private final int code;
    private final String message;
    private final T data;
    private final boolean includesData;

    ResponseEnvelope(final int code, final String message, final T data, final boolean includesData) {
        this.code = code;
        this.message = Objects.requireNonNull(message);
        this.data = data;
        this.includesData = includesData;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Gets the data contained in this envelope.
     *
     * @return The data or {@code null} if the envelope contains no data.
     */
    public T getData() {
        return data;
    }

    /**
     * Checks if this envelope has a data property.
     * <p>
     * An envelope may have a data property with a {@code null} value.
     *
     * @return {@code true} if the JSON representation contains a data property.
     */
    public boolean includesData() {
        return includesData;
    }

    /**
     * Gets the JSON representation of this envelope.
     * <p>
     * Data that is neither a JSON object nor a JSON array is serialized using Jackson.
     *
     * @return The JSON object.
     */
    public JsonObject toJson() {
        final JsonObject json = new JsonObject()
                .put(FIELD_CODE, code)
                .put(FIELD_MESSAGE, message);
        if (includesData) {
            if (data == null || data instanceof JsonObject || data instanceof JsonArray) {
                json.put(FIELD_DATA, data);
            } else {
                json.put(FIELD_DATA, JsonObject.mapFrom(data));
            }
        }
        return json;
    }

    @Override
    public String toString() {
        return toJson().encode();
    }
}
