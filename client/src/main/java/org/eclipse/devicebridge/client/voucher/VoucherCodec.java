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

package org.eclipse.devicebridge.client.voucher;

import java.net.HttpURLConnection;
import java.util.Objects;

import org.eclipse.devicebridge.client.ClientErrorException;
import org.eclipse.devicebridge.util.Strings;

import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;

/**
 * Decodes and encodes the JSON documents representing {@link Voucher}s.
 * <p>
 * Decoding only verifies that the document is a well formed JSON object. Properties that are
 * required by a particular flow need to be checked by the caller using e.g.
 * {@link Voucher#requireRemoteAccess()}.
 */
public final class VoucherCodec {

    private VoucherCodec() {
        // prevent instantiation
    }

    /**
     * Decodes a voucher from its JSON representation.
     *
     * @param rawVoucher The JSON document.
     * @return The voucher.
     * @throws ClientErrorException with status 400 if the voucher is {@code null}, empty or not a
     *                              well formed JSON object.
     */
    public static Voucher decode(final String rawVoucher) {

        if (Strings.isNullOrEmpty(rawVoucher)) {
            throw new ClientErrorException(HttpURLConnection.HTTP_BAD_REQUEST, "voucher must not be empty");
        }
        try {
            final Voucher voucher = Json.decodeValue(rawVoucher, Voucher.class);
            if (voucher == null) {
                throw new ClientErrorException(HttpURLConnection.HTTP_BAD_REQUEST, "malformed voucher");
            }
            return voucher;
        } catch (final DecodeException e) {
            throw new ClientErrorException(HttpURLConnection.HTTP_BAD_REQUEST, "malformed voucher", e);
        }
    }

    /**
     * Encodes a voucher to its JSON representation.
     * <p>
     * Empty properties are omitted.
     *
     * @param voucher The voucher.
     * @return The JSON document.
     * @throws NullPointerException if voucher is {@code null}.
     */
    public static String encode(final Voucher voucher) {
        Objects.requireNonNull(voucher);
        return Json.encode(voucher);
    }
}
