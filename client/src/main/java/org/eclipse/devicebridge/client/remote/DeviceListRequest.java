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

package org.eclipse.devicebridge.client.remote;

import java.util.Objects;

import com.google.common.base.MoreObjects;

import io.vertx.core.json.JsonObject;

/**
 * A request for a page of the devices that a voucher grants access to.
 * <p>
 * The properties are forwarded to the remote platform as is. In particular, the page
 * number and size are not checked for sensible values.
 */
public final class DeviceListRequest {

    /**
     * The name of the JSON property containing the raw voucher.
     */
    public static final String FIELD_VOUCHER = "voucher";
    /**
     * The name of the JSON property containing the service identifier.
     */
    public static final String FIELD_SERVICE_IDENTIFIER = "service_identifier";
    /**
     * The name of the JSON property containing the page number.
     */
    public static final String FIELD_PAGE = "page";
    /**
     * The name of the JSON property containing the page size.
     */
    public static final String FIELD_PAGE_SIZE = "page_size";

    private final String voucher;
    private final String serviceIdentifier;
    private final int page;
    private final int pageSize;

    /**
     * Creates a new request.
     *
     * @param voucher The voucher as received from the host platform.
     * @param serviceIdentifier The identifier of the service that the devices belong to.
     * @param page The number of the page to retrieve.
     * @param pageSize The maximum number of devices per page.
     * @throws NullPointerException if voucher or service identifier are {@code null}.
     */
    public DeviceListRequest(
            final String voucher,
            final String serviceIdentifier,
            final int page,
            final int pageSize) {
        this.voucher = Objects.requireNonNull(voucher);
        this.serviceIdentifier = Objects.requireNonNull(serviceIdentifier);
        this.page = page;
        this.pageSize = pageSize;
    }

    public String getVoucher() {
        return voucher;
    }

    public String getServiceIdentifier() {
        return serviceIdentifier;
    }

    public int getPage() {
        return page;
    }

    public int getPageSize() {
        return pageSize;
    }

    /**
     * Gets the JSON representation of this request as expected by the remote platform.
     *
     * @return A new JSON object containing exactly the voucher, service identifier, page and page size.
     */
    public JsonObject toJson() {
        return new JsonObject()
                .put(FIELD_VOUCHER, voucher)
                .put(FIELD_SERVICE_IDENTIFIER, serviceIdentifier)
                .put(FIELD_PAGE, page)
                .put(FIELD_PAGE_SIZE, pageSize);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("serviceIdentifier", serviceIdentifier)
                .add("page", page)
                .add("pageSize", pageSize)
                .toString();
    }
}
