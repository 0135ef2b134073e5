// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.log;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Renders snapshot entries into a nested JSON object with the same layout as {@link YamlSnapshotObserver},
 * e.g. {@code {"secret":{"supersecret":{"widgets":5}}}}.
 */
public final class JsonSnapshotObserver extends AbstractTreeSnapshotRenderer {

    private static final ObjectMapper COMPACT_MAPPER = new ObjectMapper();
    private static final ObjectMapper PRETTY_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Create an observer rendering compact single line JSON.
     */
    public JsonSnapshotObserver() {
        this(false);
    }

    /**
     * @param pretty whether to indent the rendered JSON
     */
    public JsonSnapshotObserver(boolean pretty) {
        super(pretty ? PRETTY_MAPPER : COMPACT_MAPPER);
    }

    @NonNull
    @Override
    protected String emptyDocument() {
        return "{}";
    }
}
