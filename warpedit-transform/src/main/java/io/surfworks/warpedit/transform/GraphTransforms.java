package io.surfworks.warpedit.transform;

import io.surfworks.warpedit.core.graph.Graph;
import io.surfworks.warpedit.core.graph.Operation;
import io.surfworks.warpedit.core.graph.Tensor;
import io.surfworks.warpedit.core.select.ControlOutputs;
import io.surfworks.warpedit.core.select.GraphWalks;
import io.surfworks.warpedit.core.select.SubGraphView;
import io.surfworks.warpedit.transform.config.TransformConfig;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Ready-made transformations: copying a subgraph, copying it with some inputs
 * substituted, recomputing targets from replaced tensors, and rewiring in place.
 *
 * <p>Each call uses a fresh {@link Transformer}.
 */
public final class GraphTransforms {

    private static final Logger LOG = Logger.getLogger(GraphTransforms.class.getName());

    private GraphTransforms() {}

    /**
     * Copies a subgraph within its own graph, at the root scope.
     */
    public static TransformOutput copy(SubGraphView view) {
        return copy(view, null, "", "", false);
    }

    /**
     * Copies a subgraph.
     *
     * @param view          the source subgraph
     * @param dstGraph      the destination graph, or null for the view's own graph
     * @param dstScope      the destination scope
     * @param srcScope      the source scope
     * @param reuseDstScope reuse {@code dstScope} instead of making it unique
     * @throws InvalidDestinationException if there is no usable destination graph
     */
    public static TransformOutput copy(SubGraphView view,
                                       Graph dstGraph,
                                       String dstScope,
                                       String srcScope,
                                       boolean reuseDstScope) {
        Graph dst = dstGraph != null ? dstGraph : view.graph();
        return new Transformer().transform(view, dst, dstScope, srcScope, reuseDstScope);
    }

    /**
     * Copies a subgraph, substituting some of its inputs.
     *
     * <p>Only boundary inputs of the view are substituted: a replacement keyed by any
     * other tensor has no effect. Inputs without a replacement are handled by the
     * hidden-input policy (kept within one graph, placeholders across graphs).
     *
     * @param replacements original tensor to replacement tensor
     * @throws InvalidDestinationException if there is no usable destination graph
     */
    public static TransformOutput copyWithInputReplacements(SubGraphView view,
                                                            Map<Tensor, Tensor> replacements,
                                                            Graph dstGraph,
                                                            String dstScope,
                                                            String srcScope,
                                                            boolean reuseDstScope) {
        Graph dst = dstGraph != null ? dstGraph : view.graph();
        TransformHandlers handlers = TransformHandlers.defaults()
                .withExternalInputHandler(replacementHandler(replacements));
        return new Transformer(handlers).transform(view, dst, dstScope, srcScope, reuseDstScope);
    }

    public static TransformOutput copyWithInputReplacements(SubGraphView view, Map<Tensor, Tensor> replacements) {
        return copyWithInputReplacements(view, replacements, null, "", "", false);
    }

    /**
     * Recomputes a target from replaced tensors.
     *
     * @see #graphReplace(List, Map, String, String, boolean)
     */
    public static Tensor graphReplace(Tensor target, Map<Tensor, Tensor> replacements) {
        return graphReplace(List.of(target), replacements, "", "", false).get(0);
    }

    public static List<Tensor> graphReplace(List<Tensor> targets, Map<Tensor, Tensor> replacements) {
        return graphReplace(targets, replacements, "", "", false);
    }

    /**
     * Copies the part of a graph between replaced tensors and targets so that the
     * targets are computed from the replacements.
     *
     * <p>The operations lying on a path (data or control) from a replaced tensor to a
     * target are copied within the targets' graph, with each replaced tensor swapped
     * for its replacement. Targets that do not depend on any replaced tensor are
     * returned unchanged.
     *
     * @param targets      the tensors to recompute, all from one graph
     * @param replacements original tensor to replacement tensor
     * @return the recomputed targets, in order
     * @throws IllegalArgumentException      if there are no targets or they span several graphs
     * @throws DisconnectedRewriteException if no target depends on a replaced tensor
     */
    public static List<Tensor> graphReplace(List<Tensor> targets,
                                            Map<Tensor, Tensor> replacements,
                                            String dstScope,
                                            String srcScope,
                                            boolean reuseDstScope) {
        Graph graph = uniqueGraph(targets);
        ControlOutputs controlOutputs = new ControlOutputs(graph);
        List<Operation> ops = GraphWalks.walksIntersectionOps(replacements.keySet(), targets, controlOutputs);
        if (ops.isEmpty()) {
            throw new DisconnectedRewriteException("Targets and replacements are not connected");
        }
        LOG.fine(() -> "Rewriting " + ops.size() + " ops to recompute " + targets.size() + " targets");

        TransformOutput out = copyWithInputReplacements(
                SubGraphView.of(ops), replacements, null, dstScope, srcScope, reuseDstScope);
        return out.result().transformedAll(targets, t -> t);
    }

    /**
     * Rewires a subgraph in place, substituting some of its inputs.
     *
     * <p>No operation is copied. For every member whose inputs change, all consumers
     * of the old input tensors (members or not) are rewired to the new ones.
     *
     * @param view          the subgraph to edit
     * @param replacements  original boundary input to replacement tensor
     * @param detachOutputs also detach every member from its consumers
     */
    public static TransformOutput transformInPlace(SubGraphView view,
                                                   Map<Tensor, Tensor> replacements,
                                                   boolean detachOutputs) {
        return transformInPlace(view, replacements, detachOutputs, TransformConfig.defaults());
    }

    /**
     * Rewires a subgraph in place with tuned policies. Detached outputs are replaced by
     * placeholders named with the configured prefix.
     */
    public static TransformOutput transformInPlace(SubGraphView view,
                                                   Map<Tensor, Tensor> replacements,
                                                   boolean detachOutputs,
                                                   TransformConfig config) {
        String prefix = config.placeholderPrefix();
        TransformHandlers handlers = TransformHandlers.fromConfig(config)
                .withOpHandler((ctx, op) -> DefaultHandlers.transformOpInPlace(ctx, op, detachOutputs, prefix))
                .withExternalInputHandler(replacementHandler(replacements));
        return new Transformer(handlers).transform(view, view.graph(), "", "", true);
    }

    static TransformHandlers.TensorHandler replacementHandler(Map<Tensor, Tensor> replacements) {
        return (ctx, t) -> {
            Tensor replacement = replacements.get(t);
            if (replacement != null) {
                return replacement;
            }
            return ctx.handlers().hiddenInputHandler().transform(ctx, t);
        };
    }

    private static Graph uniqueGraph(Collection<Tensor> tensors) {
        if (tensors.isEmpty()) {
            throw new IllegalArgumentException("Expected at least one target tensor");
        }
        Graph graph = null;
        for (Tensor t : tensors) {
            if (graph == null) {
                graph = t.graph();
            } else if (t.graph() != graph) {
                throw new IllegalArgumentException(t.name() + " does not belong to " + graph);
            }
        }
        return graph;
    }
}
