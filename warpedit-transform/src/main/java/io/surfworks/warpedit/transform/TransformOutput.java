package io.surfworks.warpedit.transform;

import io.surfworks.warpedit.core.select.SubGraphView;

/**
 * What a transformation returns.
 *
 * @param view   the transformed subgraph, boundaries ordered like the source view's
 * @param result the mapping between source and transformed elements
 */
public record TransformOutput(SubGraphView view, TransformResult result) {
}
