// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.log;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator.Feature;
import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Renders snapshot entries into a nested YAML document, e.g.
 * <pre>
 * secret:
 *   supersecret:
 *     widgets: 5
 * </pre>
 * Keys that are not valid plain YAML scalars, such as labels containing {@code :} or line breaks, are quoted.
 */
public final class YamlSnapshotObserver extends AbstractTreeSnapshotRenderer {

    private static final ObjectMapper YAML_MAPPER =
            new ObjectMapper(new YAMLFactory().disable(Feature.WRITE_DOC_START_MARKER));

    public YamlSnapshotObserver() {
        super(YAML_MAPPER);
    }

    @NonNull
    @Override
    protected String emptyDocument() {
        return "";
    }
}
