package io.surfworks.warpedit.transform;

import io.surfworks.warpedit.core.edit.Detach;
import io.surfworks.warpedit.core.edit.Placeholders;
import io.surfworks.warpedit.core.edit.Reroute;
import io.surfworks.warpedit.core.graph.Graph;
import io.surfworks.warpedit.core.graph.GraphElement;
import io.surfworks.warpedit.core.graph.NodeDef;
import io.surfworks.warpedit.core.graph.Operation;
import io.surfworks.warpedit.core.graph.Tensor;
import io.surfworks.warpedit.core.graph.TensorType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Stock handler policies used by {@link TransformHandlers#defaults()}, plus the
 * in-place operation handler.
 */
public final class DefaultHandlers {

    private DefaultHandlers() {}

    /**
     * Replaces a tensor by a new placeholder of the same type, created in the
     * destination graph under the destination scope.
     */
    public static Tensor replaceWithPlaceholder(TransformContext ctx, Tensor t) {
        return replaceWithPlaceholder(ctx, t, Placeholders.DEFAULT_PREFIX);
    }

    public static Tensor replaceWithPlaceholder(TransformContext ctx, Tensor t, String prefix) {
        return Placeholders.fromTensor(ctx.destinationGraph(), t, ctx.destinationScope(), prefix);
    }

    /**
     * Keeps a tensor as is when source and destination graphs are the same,
     * otherwise replaces it by a placeholder.
     */
    public static Tensor keepIfPossible(TransformContext ctx, Tensor t) {
        return keepIfPossible(ctx, t, Placeholders.DEFAULT_PREFIX);
    }

    public static Tensor keepIfPossible(TransformContext ctx, Tensor t, String prefix) {
        if (ctx.isSameGraph()) {
            return t;
        }
        return replaceWithPlaceholder(ctx, t, prefix);
    }

    /**
     * Adds a transformed element to the collections of its original.
     *
     * <p>Collection names under the source scope are renamed like operations; names
     * outside it are kept.
     */
    public static void assignRenamedCollections(TransformContext ctx, GraphElement original, GraphElement transformed) {
        Graph dst = ctx.destinationGraph();
        for (String name : original.graph().collectionsContaining(original)) {
            String newName = name.startsWith(ctx.sourceScope()) ? ctx.newName(name) : name;
            dst.addToCollection(newName, transformed);
        }
    }

    /**
     * Translates an operation reference only when it is a member of the subgraph.
     *
     * @param keepIfPossible keep references to non-members when source and
     *                       destination graphs are the same
     * @return the translated operation, the operation itself, or empty to drop the reference
     */
    public static Optional<Operation> transformOpIfInside(TransformContext ctx, Operation op, boolean keepIfPossible) {
        if (ctx.isMember(op)) {
            return Optional.of(ctx.transformOp(op));
        }
        if (keepIfPossible && ctx.isSameGraph()) {
            return Optional.of(op);
        }
        return Optional.empty();
    }

    /**
     * Copies an operation into the destination graph.
     *
     * <p>Control inputs, the original-op link and data inputs are translated first
     * (in that order), then a renamed clone of the node definition is created with
     * the translated references.
     *
     * @param copyShape whether the static output shapes are carried over
     */
    public static Operation copyOp(TransformContext ctx, Operation op, boolean copyShape) {
        TransformHandlers handlers = ctx.handlers();

        List<Operation> controlInputs = new ArrayList<>();
        for (Operation ci : op.controlInputs()) {
            // A control edge closing a cycle is linked once its source has been translated
            if (ctx.isMember(ci) && !ctx.isTransformed(ci) && ctx.dependsOnInProgress(ci)) {
                ctx.deferControlInput(ci);
                continue;
            }
            handlers.controlInputHandler().transform(ctx, ci).ifPresent(controlInputs::add);
        }

        Operation originalOp = op.originalOp()
                .filter(orig -> ctx.isTransformed(orig) || !ctx.dependsOnInProgress(orig))
                .flatMap(orig -> handlers.originalOpHandler().transform(ctx, orig))
                .orElse(null);

        List<Tensor> inputs = new ArrayList<>(op.inputs().size());
        for (Tensor t : op.inputs()) {
            inputs.add(ctx.transformTensor(t));
        }

        Graph dst = ctx.destinationGraph();
        String name = dst.uniqueName(ctx.newName(op.name()));
        NodeDef nodeDef = op.nodeDef().withName(name);

        List<TensorType> outputTypes = new ArrayList<>(op.outputs().size());
        for (Tensor t : op.outputs()) {
            outputTypes.add(copyShape ? t.type() : TensorType.unknownShape(t.dtype()));
        }

        return dst.createOperation(nodeDef, inputs, outputTypes, controlInputs, originalOp);
    }

    /**
     * Transforms an operation in place: no copy is made.
     *
     * <p>The operation's inputs are translated; where one changed, every consumer of
     * the old input is rewired to the new one. Optionally the operation's outputs are
     * then detached from their consumers (replaced by placeholders), leaving it ready
     * to be wired to new consumers.
     *
     * @param detachOutputs whether to detach the operation from its consumers
     * @return the operation itself
     */
    public static Operation transformOpInPlace(TransformContext ctx, Operation op, boolean detachOutputs) {
        return transformOpInPlace(ctx, op, detachOutputs, Placeholders.DEFAULT_PREFIX);
    }

    /**
     * Transforms an operation in place, naming detach placeholders with the given prefix.
     */
    public static Operation transformOpInPlace(TransformContext ctx, Operation op, boolean detachOutputs,
                                               String prefix) {
        List<Tensor> oldInputs = List.copyOf(op.inputs());
        List<Tensor> newInputs = new ArrayList<>(oldInputs.size());
        boolean changed = false;
        for (Tensor t : oldInputs) {
            Tensor t_ = ctx.transformTensor(t);
            newInputs.add(t_);
            changed |= t_ != t;
        }
        if (changed) {
            Reroute.rerouteTensors(newInputs, oldInputs);
        }
        if (detachOutputs) {
            Detach.outputs(op, prefix);
        }
        return op;
    }
}
