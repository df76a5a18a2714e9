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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.eclipse.devicebridge.client.ClientErrorException;
import org.eclipse.devicebridge.util.Strings;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The per tenant credentials that scope every request to the remote platform.
 * <p>
 * A voucher is decoded from the opaque JSON document that the host platform includes in its
 * callback requests. Absent properties are represented by empty strings. Instances are immutable.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class Voucher {

    /**
     * The name of the JSON property containing the remote platform's base URL.
     */
    public static final String FIELD_SERVER_URL = "ServerURL";
    /**
     * The name of the JSON property containing the secret to authenticate to the remote platform with.
     */
    public static final String FIELD_SECRET = "Secret";
    /**
     * The name of the JSON property containing the type of authentication.
     */
    public static final String FIELD_AUTH_TYPE = "AuthType";
    /**
     * The name of the JSON property containing the identifier of the agent that devices get bound to.
     */
    public static final String FIELD_AGENT_ID = "AgentId";
    /**
     * The name of the JSON property containing the API key that the remote platform uses for
     * invoking the host platform's API.
     */
    public static final String FIELD_EXTERNAL_API_KEY = "ThingsPanelApiKey";
    /**
     * The name of the JSON property containing the base URL of the host platform's API.
     */
    public static final String FIELD_HOST_API_URL = "ThingsPanelApiURL";

    private final String remoteBaseUrl;
    private final String secret;
    private final String authType;
    private final String agentId;
    private final String externalApiKey;
    private final String hostApiUrl;

    /**
     * Creates a new voucher.
     *
     * @param remoteBaseUrl The base URL of the remote platform's API.
     * @param secret The secret to authenticate to the remote platform with.
     * @param authType The type of authentication.
     * @param agentId The identifier of the agent that devices get bound to.
     * @param externalApiKey The API key that the remote platform uses for invoking the host platform's API.
     * @param hostApiUrl The base URL of the host platform's API.
     */
    @JsonCreator
    public Voucher(
            @JsonProperty(FIELD_SERVER_URL) final String remoteBaseUrl,
            @JsonProperty(FIELD_SECRET) final String secret,
            @JsonProperty(FIELD_AUTH_TYPE) final String authType,
            @JsonProperty(FIELD_AGENT_ID) final String agentId,
            @JsonProperty(FIELD_EXTERNAL_API_KEY) final String externalApiKey,
            @JsonProperty(FIELD_HOST_API_URL) final String hostApiUrl) {

        this.remoteBaseUrl = emptyIfNull(remoteBaseUrl);
        this.secret = emptyIfNull(secret);
        this.authType = emptyIfNull(authType);
        this.agentId = emptyIfNull(agentId);
        this.externalApiKey = emptyIfNull(externalApiKey);
        this.hostApiUrl = emptyIfNull(hostApiUrl);
    }

    private static String emptyIfNull(final String value) {
        return Optional.ofNullable(value).orElse("");
    }

    @JsonProperty(FIELD_SERVER_URL)
    public String getRemoteBaseUrl() {
        return remoteBaseUrl;
    }

    @JsonProperty(FIELD_SECRET)
    public String getSecret() {
        return secret;
    }

    @JsonProperty(FIELD_AUTH_TYPE)
    public String getAuthType() {
        return authType;
    }

    @JsonProperty(FIELD_AGENT_ID)
    public String getAgentId() {
        return agentId;
    }

    @JsonProperty(FIELD_EXTERNAL_API_KEY)
    public String getExternalApiKey() {
        return externalApiKey;
    }

    @JsonProperty(FIELD_HOST_API_URL)
    public String getHostApiUrl() {
        return hostApiUrl;
    }

    /**
     * Verifies that this voucher contains the properties required for invoking the remote platform.
     *
     * @return This voucher.
     * @throws ClientErrorException with status 400 if the base URL or the secret is empty.
     */
    public Voucher requireRemoteAccess() {
        final Map<String, String> required = new LinkedHashMap<>();
        required.put(FIELD_SERVER_URL, remoteBaseUrl);
        required.put(FIELD_SECRET, secret);
        return check(required);
    }

    /**
     * Verifies that this voucher contains the properties required for binding a device
     * on the remote platform.
     *
     * @return This voucher.
     * @throws ClientErrorException with status 400 if the base URL, the secret, the agent ID
     *         or the external API key is empty.
     */
    public Voucher requireDeviceBinding() {
        final Map<String, String> required = new LinkedHashMap<>();
        required.put(FIELD_SERVER_URL, remoteBaseUrl);
        required.put(FIELD_SECRET, secret);
        required.put(FIELD_AGENT_ID, agentId);
        required.put(FIELD_EXTERNAL_API_KEY, externalApiKey);
        return check(required);
    }

    private Voucher check(final Map<String, String> requiredProperties) {
        final List<String> missing = Strings.namesOfEmptyValues(requiredProperties);
        if (missing.isEmpty()) {
            return this;
        }
        throw new ClientErrorException(
                HttpURLConnection.HTTP_BAD_REQUEST,
                String.format("voucher is missing required properties %s", missing));
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final Voucher other = (Voucher) obj;
        return remoteBaseUrl.equals(other.remoteBaseUrl)
                && secret.equals(other.secret)
                && authType.equals(other.authType)
                && agentId.equals(other.agentId)
                && externalApiKey.equals(other.externalApiKey)
                && hostApiUrl.equals(other.hostApiUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(remoteBaseUrl, secret, authType, agentId, externalApiKey, hostApiUrl);
    }

    /**
     * {@inheritDoc}
     * <p>
     * The secret and the external API key are not included.
     */
    @Override
    public String toString() {
        return new StringBuilder("Voucher{")
                .append("remoteBaseUrl='").append(remoteBaseUrl).append('\'')
                .append(", authType='").append(authType).append('\'')
                .append(", agentId='").append(agentId).append('\'')
                .append(", hostApiUrl='").append(hostApiUrl).append("'}")
                .toString();
    }
}
