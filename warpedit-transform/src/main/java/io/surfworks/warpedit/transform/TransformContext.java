package io.surfworks.warpedit.transform;

import io.surfworks.warpedit.core.graph.Graph;
import io.surfworks.warpedit.core.graph.Operation;
import io.surfworks.warpedit.core.graph.Tensor;
import io.surfworks.warpedit.core.select.SubGraphView;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * State of one {@link Transformer} call, handed to every handler.
 *
 * <p>A context lives exactly as long as the call that created it. It holds the
 * source view and graphs, the normalized scopes, and the two translation tables
 * (operation to operation, tensor to tensor). Entries are only ever added, and
 * each element is translated at most once.
 *
 * <p>Handlers use {@link #transformOp} and {@link #transformTensor} to translate the
 * elements they depend on; both go through the tables.
 */
public final class TransformContext {

    private final Transformer transformer;
    private final TransformHandlers handlers;
    private final SubGraphView subgraph;
    private final Set<Tensor> boundaryInputs;
    private final Graph sourceGraph;
    private final String sourceScope;
    private final Graph destinationGraph;
    private final String destinationScope;

    final Map<Operation, Operation> transformedOps = new LinkedHashMap<>();
    final Map<Tensor, Tensor> transformedTensors = new LinkedHashMap<>();

    private final Deque<Operation> inProgress = new ArrayDeque<>();
    private final Set<Operation> inProgressSet = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Map<Operation, List<Operation>> deferredControlInputs = new IdentityHashMap<>();

    TransformContext(Transformer transformer,
                     TransformHandlers handlers,
                     SubGraphView subgraph,
                     Graph destinationGraph,
                     String destinationScope,
                     String sourceScope) {
        this.transformer = transformer;
        this.handlers = handlers;
        this.subgraph = subgraph;
        this.boundaryInputs = Collections.newSetFromMap(new IdentityHashMap<>());
        this.boundaryInputs.addAll(subgraph.inputs());
        this.sourceGraph = subgraph.graph();
        this.sourceScope = sourceScope;
        this.destinationGraph = destinationGraph;
        this.destinationScope = destinationScope;
    }

    public Transformer transformer() {
        return transformer;
    }

    public TransformHandlers handlers() {
        return handlers;
    }

    /**
     * Returns the view being transformed.
     */
    public SubGraphView subgraph() {
        return subgraph;
    }

    /**
     * Returns the graph of the source view, null for an empty view.
     */
    public Graph sourceGraph() {
        return sourceGraph;
    }

    public String sourceScope() {
        return sourceScope;
    }

    public Graph destinationGraph() {
        return destinationGraph;
    }

    public String destinationScope() {
        return destinationScope;
    }

    /**
     * Returns true when the transformation writes into the graph it reads from.
     */
    public boolean isSameGraph() {
        return sourceGraph == destinationGraph;
    }

    public boolean isMember(Operation op) {
        return subgraph.contains(op);
    }

    public boolean isBoundaryInput(Tensor t) {
        return boundaryInputs.contains(t);
    }

    // ==================== Translation ====================

    /**
     * Translates an operation, reusing an earlier translation if there is one.
     */
    public Operation transformOp(Operation op) {
        return transformer.transformOp(this, op);
    }

    /**
     * Translates a tensor, reusing an earlier translation if there is one.
     */
    public Tensor transformTensor(Tensor t) {
        return transformer.transformTensor(this, t);
    }

    /**
     * Computes the destination name of a source name.
     *
     * @throws ScopeMismatchException if the name is not under the source scope
     */
    public String newName(String name) {
        if (!name.startsWith(sourceScope)) {
            throw new ScopeMismatchException(name, sourceScope);
        }
        return destinationScope + name.substring(sourceScope.length());
    }

    public Optional<Operation> transformedOp(Operation op) {
        return Optional.ofNullable(transformedOps.get(op));
    }

    public Optional<Tensor> transformedTensor(Tensor t) {
        return Optional.ofNullable(transformedTensors.get(t));
    }

    public boolean isTransformed(Operation op) {
        return transformedOps.containsKey(op);
    }

    // ==================== Progress tracking ====================

    /**
     * Returns true while the operation handler for {@code op} is running.
     */
    public boolean isInProgress(Operation op) {
        return inProgressSet.contains(op);
    }

    /**
     * Returns true if translating {@code op} would first need the translation of an
     * operation whose handler is still running: {@code op} itself, or one of the
     * untranslated members it reads from through data edges.
     *
     * <p>Control-edge references to such an operation must be deferred with
     * {@link #deferControlInput} rather than translated.
     */
    public boolean dependsOnInProgress(Operation op) {
        if (inProgressSet.isEmpty()) {
            return false;
        }
        Set<Operation> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Operation> pending = new ArrayDeque<>();
        pending.push(op);
        visited.add(op);
        while (!pending.isEmpty()) {
            Operation current = pending.pop();
            if (inProgressSet.contains(current)) {
                return true;
            }
            for (Tensor input : current.inputs()) {
                Operation producer = input.op();
                if (isMember(producer) && !isTransformed(producer) && visited.add(producer)) {
                    pending.push(producer);
                }
            }
        }
        return false;
    }

    /**
     * Asks for {@code controlInput} to become a control input of the translation of the
     * operation currently being translated, as soon as both translations exist.
     *
     * @throws IllegalStateException if no operation is being translated
     */
    public void deferControlInput(Operation controlInput) {
        Operation consumer = inProgress.peek();
        if (consumer == null) {
            throw new IllegalStateException("No operation is being transformed");
        }
        deferredControlInputs.computeIfAbsent(controlInput, k -> new ArrayList<>()).add(consumer);
    }

    void begin(Operation op) {
        inProgress.push(op);
        inProgressSet.add(op);
    }

    void end(Operation op) {
        inProgress.pop();
        inProgressSet.remove(op);
    }

    List<Operation> takeDeferredConsumers(Operation controlInput) {
        List<Operation> consumers = deferredControlInputs.remove(controlInput);
        return consumers == null ? List.of() : consumers;
    }
}
