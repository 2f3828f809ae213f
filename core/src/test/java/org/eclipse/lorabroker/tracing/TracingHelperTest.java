/*******************************************************************************
 * Copyright (c) 2023 Contributors to the Eclipse Foundation
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

package org.eclipse.lorabroker.tracing;

import static com.google.common.truth.Truth.assertThat;

import org.eclipse.lorabroker.packet.DevAddr;
import org.eclipse.lorabroker.packet.Eui64;
import org.eclipse.lorabroker.util.BehaviouralException;
import org.junit.jupiter.api.Test;

import io.opentracing.log.Fields;
import io.opentracing.mock.MockSpan;
import io.opentracing.mock.MockTracer;
import io.opentracing.tag.Tags;

/**
 * Verifies behavior of {@link TracingHelper}.
 *
 */
public class TracingHelperTest {

    private final MockTracer tracer = new MockTracer();

    /**
     * Verifies that logging a broker exception marks the span as erroneous and tags the error kind.
     */
    @Test
    public void testLogErrorTagsErrorKind() {

        final MockSpan span = (MockSpan) TracingHelper.buildServerChildSpan(tracer, null, "op", "test").start();
        TracingHelper.logError(span, new BehaviouralException("unknown device"));
        span.finish();

        assertThat(span.tags()).containsEntry(Tags.ERROR.getKey(), Boolean.TRUE);
        assertThat(span.tags()).containsEntry(TracingHelper.TAG_ERROR_KIND.getKey(), "BEHAVIOURAL");
        assertThat(span.tags()).containsEntry(Tags.SPAN_KIND.getKey(), Tags.SPAN_KIND_SERVER);
        assertThat(span.logEntries()).hasSize(1);
        assertThat(span.logEntries().get(0).fields()).containsKey(Fields.ERROR_OBJECT);
    }

    /**
     * Verifies that the identifying tags are set.
     */
    @Test
    public void testSetTags() {

        final MockSpan span = tracer.buildSpan("op").start();
        TracingHelper.setDevAddrTag(span, DevAddr.fromString("01020304"));
        TracingHelper.setDeviceTags(span, Eui64.fromString("0102030405060708"), null);
        span.finish();

        assertThat(span.tags()).containsEntry(TracingHelper.TAG_DEV_ADDR.getKey(), "01020304");
        assertThat(span.tags()).containsEntry(TracingHelper.TAG_APP_EUI.getKey(), "0102030405060708");
        assertThat(span.tags()).doesNotContainKey(TracingHelper.TAG_DEV_EUI.getKey());
    }

    /**
     * Verifies that child spans reference their parent.
     */
    @Test
    public void testBuildServerChildSpanReferencesParent() {

        final MockSpan parent = tracer.buildSpan("parent").start();
        final MockSpan child = (MockSpan) TracingHelper.buildServerChildSpan(tracer, parent.context(), "child", "test")
                .start();
        child.finish();
        parent.finish();

        assertThat(child.parentId()).isEqualTo(parent.context().spanId());
    }
}
