// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.log;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.hiero.metrics.runtime.SnapshotObserver;

/**
 * Observer that accumulates observed entries into a text document.
 * A new renderer is used for each exported snapshot.
 */
public interface SnapshotRenderer extends SnapshotObserver {

    /**
     * @return text rendered from all entries observed so far
     */
    @NonNull
    String render();
}
