package io.surfworks.warpedit.transform;

import io.surfworks.warpedit.core.graph.Graph;
import io.surfworks.warpedit.core.graph.Operation;
import io.surfworks.warpedit.core.graph.Tensor;
import io.surfworks.warpedit.core.select.SubGraphView;
import io.surfworks.warpedit.core.util.Scopes;
import io.surfworks.warpedit.transform.config.TransformConfig;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Transforms a subgraph into another one.
 *
 * <p>With the default {@link TransformHandlers handlers} a transformer copies the
 * operations of a view into a destination graph, under a destination scope, and
 * stands placeholders in for the view's inputs. Other behaviors (input
 * substitution, in-place rewiring) come from swapping handlers.
 *
 * <p>A call walks the view in two passes:
 * <ol>
 *   <li>from each boundary output back through member producers, translating
 *       every element it meets once</li>
 *   <li>then every member without outputs not reached by the first pass</li>
 * </ol>
 * and returns the transformed view plus a {@link TransformResult} mapping.
 *
 * <pre>{@code
 * Transformer copier = new Transformer();
 * TransformOutput out = copier.transform(view, graph, "copy", "", false);
 * Tensor copied = out.result().transformed(logits).orElseThrow();
 * }</pre>
 *
 * <p>A transformer is not reentrant: it cannot be called again, from a handler or
 * another thread, while a call is running. Use one instance per concurrent caller.
 */
public class Transformer {

    private static final Logger LOG = Logger.getLogger(Transformer.class.getName());

    private final TransformHandlers handlers;
    private final TransformConfig config;

    private TransformContext context;

    /**
     * Creates a copying transformer.
     */
    public Transformer() {
        this(TransformConfig.defaults());
    }

    public Transformer(TransformConfig config) {
        this(TransformHandlers.fromConfig(config), config);
    }

    public Transformer(TransformHandlers handlers) {
        this(handlers, TransformConfig.defaults());
    }

    public Transformer(TransformHandlers handlers, TransformConfig config) {
        this.handlers = Objects.requireNonNull(handlers, "handlers cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    public TransformHandlers handlers() {
        return handlers;
    }

    public TransformConfig config() {
        return config;
    }

    /**
     * Transforms a view relative to the root scope, reusing the destination scope as
     * configured.
     *
     * @see #transform(SubGraphView, Graph, String, String, boolean)
     */
    public TransformOutput transform(SubGraphView view, Graph dstGraph, String dstScope) {
        return transform(view, dstGraph, dstScope, "", config.reuseDstScope());
    }

    /**
     * Executes the transformation.
     *
     * @param view          the source subgraph
     * @param dstGraph      the destination graph
     * @param dstScope      the scope new names are placed under
     * @param srcScope      the scope source names are taken relative to; with
     *                      {@code "a/"} and {@code "b/"}, {@code a/x/y} becomes {@code b/x/y}
     * @param reuseDstScope use {@code dstScope} even if the destination graph already
     *                      uses it, instead of a fresh {@code dstScope_N}
     * @return the transformed view and the element mapping
     * @throws InvalidDestinationException if {@code dstGraph} is null or finalized
     * @throws ScopeMismatchException      if a translated name is not under {@code srcScope};
     *                                     the destination may then hold partial results
     * @throws IllegalStateException       if this transformer is already running
     */
    public TransformOutput transform(SubGraphView view,
                                     Graph dstGraph,
                                     String dstScope,
                                     String srcScope,
                                     boolean reuseDstScope) {
        Objects.requireNonNull(view, "view cannot be null");
        if (dstGraph == null) {
            throw new InvalidDestinationException("Expected a destination graph, got null");
        }
        if (dstGraph.isFinalized()) {
            throw new InvalidDestinationException("Destination " + dstGraph + " is finalized");
        }
        if (context != null) {
            throw new IllegalStateException("Transformer is already running a transformation");
        }

        String src = Scopes.finalizeScope(srcScope);
        String dst = Scopes.finalizeScope(dstScope);
        if (!dst.isEmpty() && !reuseDstScope) {
            dst = Scopes.finalizeScope(dstGraph.uniqueName(Scopes.withoutTrailingSeparator(dst)));
        }

        context = new TransformContext(this, handlers, view, dstGraph, dst, src);
        try {
            LOG.fine(() -> String.format("Transforming %s from %s [%s] into %s [%s]",
                    view, view.graph(), src, dstGraph, context.destinationScope()));

            for (Tensor output : view.outputs()) {
                transformTensor(context, output);
            }

            // Members producing nothing are not reached from the outputs
            for (Operation op : view.ops()) {
                if (!context.isTransformed(op) && op.outputs().isEmpty()) {
                    transformOp(context, op);
                }
            }

            SubGraphView transformedView = transformView(context, view);
            TransformResult result = new TransformResult(context);

            LOG.fine(() -> String.format("Transformed %d ops and %d tensors",
                    context.transformedOps.size(), context.transformedTensors.size()));
            return new TransformOutput(transformedView, result);
        } finally {
            context = null;
        }
    }

    /**
     * Returns true while a transformation is running.
     */
    public boolean isRunning() {
        return context != null;
    }

    // ==================== Traversal ====================

    Tensor transformTensor(TransformContext ctx, Tensor t) {
        Tensor cached = ctx.transformedTensors.get(t);
        if (cached != null) {
            return cached;
        }

        Tensor t_;
        Operation op = t.op();
        if (!ctx.isMember(op)) {
            if (ctx.isBoundaryInput(t)) {
                t_ = handlers.externalInputHandler().transform(ctx, t);
            } else {
                t_ = handlers.hiddenInputHandler().transform(ctx, t);
            }
            Objects.requireNonNull(t_, () -> "Input handler returned null for " + t.name());
        } else {
            Operation op_ = transformOp(ctx, op);
            t_ = op_.output(t.valueIndex());
        }

        if (t != t_) {
            handlers.collectionHandler().assign(ctx, t, t_);
        }

        ctx.transformedTensors.put(t, t_);
        return t_;
    }

    Operation transformOp(TransformContext ctx, Operation op) {
        Operation cached = ctx.transformedOps.get(op);
        if (cached != null) {
            return cached;
        }
        if (ctx.isInProgress(op)) {
            throw new IllegalStateException("Data dependency cycle through " + op.name());
        }

        // Translate member producers bottom-up first, so the handler's own input
        // lookups are table hits and the call stack stays shallow on long chains.
        for (Operation pending : memberProducersInOrder(ctx, op)) {
            if (!ctx.isTransformed(pending)) {
                translate(ctx, pending);
            }
        }
        return ctx.transformedOps.get(op);
    }

    private Operation translate(TransformContext ctx, Operation op) {
        Operation op_;
        ctx.begin(op);
        try {
            op_ = handlers.opHandler().transform(ctx, op);
        } finally {
            ctx.end(op);
        }
        Objects.requireNonNull(op_, () -> "Operation handler returned null for " + op.name());

        Graph dst = ctx.destinationGraph();
        if (op_ != op) {
            List<Operation> inputOps = new ArrayList<>(op_.inputs().size());
            for (Tensor input : op_.inputs()) {
                inputOps.add(input.op());
            }
            for (Operation control : dst.controlDependencies().controlInputsFor(inputOps)) {
                dst.addControlInput(op_, control);
            }
            dst.devices().apply(op_);
        }
        dst.controlDependencies().recordOpSeen(op_);

        if (op_ != op) {
            handlers.collectionHandler().assign(ctx, op, op_);
        }

        ctx.transformedOps.put(op, op_);

        for (Operation consumer : ctx.takeDeferredConsumers(op)) {
            Operation consumer_ = ctx.transformedOps.get(consumer);
            if (consumer_ != null && consumer_ != op_) {
                dst.addControlInput(consumer_, op_);
            }
        }

        if (LOG.isLoggable(Level.FINER)) {
            LOG.finer(op.name() + " => " + op_.name());
        }
        return op_;
    }

    /**
     * Returns {@code op} and the untranslated member operations it depends on through
     * data edges, producers before consumers.
     */
    private static List<Operation> memberProducersInOrder(TransformContext ctx, Operation op) {
        List<Operation> order = new ArrayList<>();
        Set<Operation> expanded = identitySet();
        Set<Operation> scheduled = identitySet();
        Deque<Operation> stack = new ArrayDeque<>();
        stack.push(op);

        while (!stack.isEmpty()) {
            Operation current = stack.peek();
            if (expanded.add(current)) {
                for (Tensor input : current.inputs()) {
                    Operation producer = input.op();
                    if (!ctx.isMember(producer) || ctx.isTransformed(producer) || scheduled.contains(producer)) {
                        continue;
                    }
                    if (ctx.isInProgress(producer) || expanded.contains(producer)) {
                        throw new IllegalStateException("Data dependency cycle through " + producer.name());
                    }
                    stack.push(producer);
                }
            } else {
                stack.pop();
                if (scheduled.add(current)) {
                    order.add(current);
                }
            }
        }
        return order;
    }

    /**
     * Builds the view over the translated operations, ordering its boundary like the
     * source view. Source boundary tensors without a counterpart on the new boundary
     * are left out.
     */
    private static SubGraphView transformView(TransformContext ctx, SubGraphView view) {
        SubGraphView view_ = SubGraphView.of(new ArrayList<>(ctx.transformedOps.values()));

        List<Integer> inputMap = new ArrayList<>();
        for (Tensor input : view.inputs()) {
            Tensor input_ = ctx.transformedTensors.get(input);
            if (input_ != null && view_.isInput(input_)) {
                inputMap.add(view_.inputIndex(input_));
            }
        }

        List<Integer> outputMap = new ArrayList<>();
        for (Tensor output : view.outputs()) {
            Tensor output_ = ctx.transformedTensors.get(output);
            if (output_ != null && view_.isOutput(output_)) {
                outputMap.add(view_.outputIndex(output_));
            }
        }

        return view_.remap(inputMap, outputMap);
    }

    private static Set<Operation> identitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }
}
