package io.surfworks.warpedit.transform;

import io.surfworks.warpedit.core.graph.GraphElement;
import io.surfworks.warpedit.core.graph.Operation;
import io.surfworks.warpedit.core.graph.Tensor;
import io.surfworks.warpedit.transform.config.TransformConfig;

import java.util.Objects;
import java.util.Optional;

/**
 * The policies a {@link Transformer} consults while walking a subgraph.
 *
 * <p>Each handler covers one situation:
 * <ul>
 *   <li>{@code opHandler}: produce the counterpart of a member operation (default: copy it)</li>
 *   <li>{@code controlInputHandler}: translate a control input (default: translate members,
 *       keep others when editing within one graph, drop them otherwise)</li>
 *   <li>{@code originalOpHandler}: translate an original-op link (same default)</li>
 *   <li>{@code externalInputHandler}: translate a boundary input (default: placeholder)</li>
 *   <li>{@code hiddenInputHandler}: translate an input that is neither member-produced nor
 *       a boundary input (default: keep it within one graph, placeholder otherwise)</li>
 *   <li>{@code collectionHandler}: carry collection membership over to a new element
 *       (default: same collections, renamed into the destination scope)</li>
 * </ul>
 *
 * <p>Handlers are immutable; derive variants with the {@code with*} methods:
 * <pre>{@code
 * TransformHandlers handlers = TransformHandlers.defaults()
 *     .withExternalInputHandler((ctx, t) -> t == old ? replacement : DefaultHandlers.keepIfPossible(ctx, t));
 * }</pre>
 */
public record TransformHandlers(
        OpHandler opHandler,
        OptionalOpHandler controlInputHandler,
        OptionalOpHandler originalOpHandler,
        TensorHandler externalInputHandler,
        TensorHandler hiddenInputHandler,
        CollectionHandler collectionHandler
) {

    /**
     * Produces the counterpart of an operation.
     */
    @FunctionalInterface
    public interface OpHandler {
        Operation transform(TransformContext ctx, Operation op);
    }

    /**
     * Produces the counterpart of an operation reference that may be dropped.
     */
    @FunctionalInterface
    public interface OptionalOpHandler {
        Optional<Operation> transform(TransformContext ctx, Operation op);
    }

    /**
     * Produces the counterpart of a tensor.
     */
    @FunctionalInterface
    public interface TensorHandler {
        Tensor transform(TransformContext ctx, Tensor t);
    }

    /**
     * Records a transformed element in the collections of its original.
     */
    @FunctionalInterface
    public interface CollectionHandler {
        void assign(TransformContext ctx, GraphElement original, GraphElement transformed);
    }

    public TransformHandlers {
        Objects.requireNonNull(opHandler, "opHandler cannot be null");
        Objects.requireNonNull(controlInputHandler, "controlInputHandler cannot be null");
        Objects.requireNonNull(originalOpHandler, "originalOpHandler cannot be null");
        Objects.requireNonNull(externalInputHandler, "externalInputHandler cannot be null");
        Objects.requireNonNull(hiddenInputHandler, "hiddenInputHandler cannot be null");
        Objects.requireNonNull(collectionHandler, "collectionHandler cannot be null");
    }

    /**
     * Returns the copy policies.
     */
    public static TransformHandlers defaults() {
        return fromConfig(TransformConfig.defaults());
    }

    /**
     * Returns the copy policies tuned by a configuration.
     */
    public static TransformHandlers fromConfig(TransformConfig config) {
        boolean copyShape = config.copyShape();
        boolean keepControl = config.keepControlInputsIfPossible();
        boolean keepOriginal = config.keepOriginalOpIfPossible();
        String prefix = config.placeholderPrefix();
        return new TransformHandlers(
                (ctx, op) -> DefaultHandlers.copyOp(ctx, op, copyShape),
                (ctx, op) -> DefaultHandlers.transformOpIfInside(ctx, op, keepControl),
                (ctx, op) -> DefaultHandlers.transformOpIfInside(ctx, op, keepOriginal),
                (ctx, t) -> DefaultHandlers.replaceWithPlaceholder(ctx, t, prefix),
                (ctx, t) -> DefaultHandlers.keepIfPossible(ctx, t, prefix),
                DefaultHandlers::assignRenamedCollections
        );
    }

    public TransformHandlers withOpHandler(OpHandler handler) {
        return new TransformHandlers(handler, controlInputHandler, originalOpHandler,
                externalInputHandler, hiddenInputHandler, collectionHandler);
    }

    public TransformHandlers withControlInputHandler(OptionalOpHandler handler) {
        return new TransformHandlers(opHandler, handler, originalOpHandler,
                externalInputHandler, hiddenInputHandler, collectionHandler);
    }

    public TransformHandlers withOriginalOpHandler(OptionalOpHandler handler) {
        return new TransformHandlers(opHandler, controlInputHandler, handler,
                externalInputHandler, hiddenInputHandler, collectionHandler);
    }

    public TransformHandlers withExternalInputHandler(TensorHandler handler) {
        return new TransformHandlers(opHandler, controlInputHandler, originalOpHandler,
                handler, hiddenInputHandler, collectionHandler);
    }

    public TransformHandlers withHiddenInputHandler(TensorHandler handler) {
        return new TransformHandlers(opHandler, controlInputHandler, originalOpHandler,
                externalInputHandler, handler, collectionHandler);
    }

    public TransformHandlers withCollectionHandler(CollectionHandler handler) {
        return new TransformHandlers(opHandler, controlInputHandler, originalOpHandler,
                externalInputHandler, hiddenInputHandler, handler);
    }
}
