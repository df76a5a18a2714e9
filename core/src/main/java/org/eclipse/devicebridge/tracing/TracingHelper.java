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

package org.eclipse.devicebridge.tracing;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.opentracing.References;
import io.opentracing.Span;
import io.opentracing.SpanContext;
import io.opentracing.Tracer;
import io.opentracing.log.Fields;
import io.opentracing.tag.StringTag;
import io.opentracing.tag.Tags;

/**
 * A helper class providing utility methods for interacting with the
 * OpenTracing API.
 *
 */
public final class TracingHelper {

    /**
     * An OpenTracing tag that contains the host side identifier of a device.
     */
    public static final StringTag TAG_DEVICE_ID = new StringTag("device_id");
    /**
     * An OpenTracing tag that contains the remote platform's identifier of a device.
     */
    public static final StringTag TAG_DEVICE_CODE = new StringTag("device_code");
    /**
     * An OpenTracing tag that contains the type of form requested by the host.
     */
    public static final StringTag TAG_FORM_TYPE = new StringTag("form_type");
    /**
     * An OpenTracing tag that contains the type of notification sent by the host.
     */
    public static final StringTag TAG_MESSAGE_TYPE = new StringTag("message_type");
    /**
     * An OpenTracing tag that contains the service identifier a device list is filtered by.
     */
    public static final StringTag TAG_SERVICE_IDENTIFIER = new StringTag("service_identifier");
    /**
     * The name of the field to use for logging the cause of an error.
     */
    public static final String ERROR_CAUSE_OBJECT = "error.cause.object";

    private static final Logger LOG = LoggerFactory.getLogger(TracingHelper.class);

    private TracingHelper() {
        // prevent instantiation
    }

    /**
     * Creates a set of items to log for a message and an error.
     *
     * @param message The message.
     * @param error The error.
     * @return The items to log.
     */
    public static Map<String, Object> getErrorLogItems(final String message, final Throwable error) {
        final Map<String, Object> items = new HashMap<>(4);
        items.put(Fields.EVENT, Tags.ERROR.getKey());
        Optional.ofNullable(message)
                .ifPresent(ok -> items.put(Fields.MESSAGE, message));
        if (error != null) {
            items.put(Fields.ERROR_OBJECT, getErrorObjectFieldValue(error));
            if (error.getCause() != null) {
                items.put(ERROR_CAUSE_OBJECT, error.getCause());
            }
        }
        return items;
    }

    private static Object getErrorObjectFieldValue(final Throwable error) {
        if (error.getClass().getName().startsWith("org.eclipse.devicebridge.")) {
            // stack traces of our own exceptions do not add information to the trace
            return error.toString();
        }
        return error;
    }

    /**
     * Marks an <em>OpenTracing</em> span as erroneous and logs an exception.
     * <p>
     * This method does <em>not</em> finish the span.
     * <p>
     * If the given error represents an unexpected error (e.g. a {@code NullPointerException}), a <em>WARN</em>
     * log entry will be created on the {@link Logger} of this class.
     *
     * @param span The span to mark.
     * @param error The exception that has occurred.
     * @throws NullPointerException if error is {@code null}.
     */
    public static void logError(final Span span, final Throwable error) {
        Objects.requireNonNull(error);
        logError(span, null, error);
    }

    /**
     * Marks an <em>OpenTracing</em> span as erroneous, logs a message and an error.
     * <p>
     * This method does <em>not</em> finish the span.
     *
     * @param span The span to mark.
     * @param message The message to log on the span.
     * @param error The error to log on the span.
     * @throws NullPointerException if both message and error are {@code null}.
     */
    public static void logError(final Span span, final String message, final Throwable error) {
        if (message == null && error == null) {
            throw new NullPointerException("Either message or error must not be null");
        }
        logUnexpectedError(error, span);
        if (span != null) {
            logError(span, getErrorLogItems(message, error));
        }
    }

    private static void logUnexpectedError(final Throwable error, final Span span) {
        if (error instanceof NullPointerException
                || error instanceof IllegalArgumentException
                || error instanceof IllegalStateException) {
            Optional.ofNullable(span).ifPresentOrElse(
                    s -> LOG.warn("An unexpected error occurred! [logged on trace {}, span {}]",
                            s.context().toTraceId(), s.context().toSpanId(), error),
                    () -> LOG.warn("An unexpected error occurred!", error));
        }
    }

    /**
     * Marks an <em>OpenTracing</em> span as erroneous and logs several items.
     * <p>
     * This method does <em>not</em> finish the span.
     *
     * @param span The span to mark.
     * @param items The items to log on the span. An {@code event} item with value
     *              {@code error} is added if not present already.
     */
    public static void logError(final Span span, final Map<String, ?> items) {
        if (span != null) {
            Tags.ERROR.set(span, Boolean.TRUE);
            if (items != null && !items.isEmpty()) {
                final Object event = items.get(Fields.EVENT);
                if (event == null || !Tags.ERROR.getKey().equals(event)) {
                    final HashMap<String, Object> itemsWithErrorEvent = new HashMap<>(items.size() + 1);
                    itemsWithErrorEvent.putAll(items);
                    itemsWithErrorEvent.put(Fields.EVENT, Tags.ERROR.getKey());
                    span.log(itemsWithErrorEvent);
                } else {
                    span.log(items);
                }
            } else {
                span.log(Tags.ERROR.getKey());
            }
        }
    }

    /**
     * Creates a span builder that is initialized with the given operation name and a child-of reference
     * to the given span context (if set).
     * <p>
     * The builder is configured to ignore the active span and to set the kind tag to <em>server</em>.
     *
     * @param tracer The Tracer to use.
     * @param spanContext The span context that shall be the parent of the Span being built (may be {@code null}).
     * @param operationName The operation name to set for the span.
     * @param component The component to set for the span.
     * @return The span builder.
     * @throws NullPointerException if tracer or operationName is {@code null}.
     */
    public static Tracer.SpanBuilder buildServerChildSpan(
            final Tracer tracer,
            final SpanContext spanContext,
            final String operationName,
            final String component) {

        Objects.requireNonNull(tracer);
        Objects.requireNonNull(operationName);
        return tracer.buildSpan(operationName)
                .addReference(References.CHILD_OF, spanContext)
                .ignoreActiveSpan()
                .withTag(Tags.COMPONENT.getKey(), component)
                .withTag(Tags.SPAN_KIND.getKey(), Tags.SPAN_KIND_SERVER);
    }
}
