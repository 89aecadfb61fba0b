package io.surfworks.warpedit.transform;

import io.surfworks.warpedit.core.graph.Graph;
import io.surfworks.warpedit.core.graph.GraphElement;
import io.surfworks.warpedit.core.graph.Operation;
import io.surfworks.warpedit.core.graph.Tensor;
import io.surfworks.warpedit.core.util.ElementTrees;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Mapping between the elements of a source view and their translations, as left
 * by a finished transformation.
 *
 * <p>Lookups work both ways (original to transformed and back), by reference or by
 * name. Name lookups scan the mapping and return the first match, so they are only
 * meaningful when names are unique. A lookup that finds nothing never throws: single
 * lookups return an empty {@link Optional}, the others call a caller-supplied
 * fallback.
 */
public final class TransformResult {

    private final Graph sourceGraph;
    private final String sourceScope;
    private final Graph destinationGraph;
    private final String destinationScope;
    private final Map<Operation, Operation> transformedOps;
    private final Map<Tensor, Tensor> transformedTensors;

    TransformResult(TransformContext ctx) {
        this.sourceGraph = ctx.sourceGraph();
        this.sourceScope = ctx.sourceScope();
        this.destinationGraph = ctx.destinationGraph();
        this.destinationScope = ctx.destinationScope();
        this.transformedOps = Collections.unmodifiableMap(ctx.transformedOps);
        this.transformedTensors = Collections.unmodifiableMap(ctx.transformedTensors);
    }

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
     * Returns true when the transformation wrote into its source graph without a scope offset.
     */
    public boolean isInPlace() {
        return sourceGraph == destinationGraph && destinationScope.isEmpty();
    }

    /**
     * Returns the operation mapping, original to transformed, in translation order.
     */
    public Map<Operation, Operation> opMapping() {
        return transformedOps;
    }

    /**
     * Returns the tensor mapping, original to transformed, in translation order.
     */
    public Map<Tensor, Tensor> tensorMapping() {
        return transformedTensors;
    }

    // ==================== Forward lookup ====================

    /**
     * Returns the translation of an operation or tensor.
     */
    public <T extends GraphElement> Optional<T> transformed(T original) {
        return Optional.ofNullable(forward(original));
    }

    /**
     * Returns the translation of an operation or tensor, or {@code missing.apply(original)}
     * when it was not translated.
     */
    public <T extends GraphElement> T transformed(T original, UnaryOperator<T> missing) {
        T found = forward(original);
        return found != null ? found : missing.apply(original);
    }

    /**
     * Translates each element of a collection, in order.
     */
    public <T extends GraphElement> List<T> transformedAll(Collection<T> originals, UnaryOperator<T> missing) {
        List<T> result = new ArrayList<>(originals.size());
        for (T original : originals) {
            result.add(transformed(original, missing));
        }
        return result;
    }

    /**
     * Translates every element of a nested structure, keeping its shape.
     * Untranslated elements become null.
     *
     * @see ElementTrees#map
     */
    public Object transformedTree(Object tree) {
        return transformedTree(tree, e -> null);
    }

    public Object transformedTree(Object tree, UnaryOperator<GraphElement> missing) {
        return ElementTrees.map(tree, e -> transformed(e, missing));
    }

    public Optional<Operation> transformedOp(String originalName) {
        for (Map.Entry<Operation, Operation> entry : transformedOps.entrySet()) {
            if (entry.getKey().name().equals(originalName)) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    public Optional<Tensor> transformedTensor(String originalName) {
        for (Map.Entry<Tensor, Tensor> entry : transformedTensors.entrySet()) {
            if (entry.getKey().name().equals(originalName)) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    // ==================== Backward lookup ====================

    /**
     * Returns the element an operation or tensor was translated from.
     */
    public <T extends GraphElement> Optional<T> original(T transformed) {
        return Optional.ofNullable(backward(transformed));
    }

    public <T extends GraphElement> T original(T transformed, UnaryOperator<T> missing) {
        T found = backward(transformed);
        return found != null ? found : missing.apply(transformed);
    }

    public <T extends GraphElement> List<T> originalAll(Collection<T> transformed, UnaryOperator<T> missing) {
        List<T> result = new ArrayList<>(transformed.size());
        for (T element : transformed) {
            result.add(original(element, missing));
        }
        return result;
    }

    public Object originalTree(Object tree) {
        return originalTree(tree, e -> null);
    }

    public Object originalTree(Object tree, UnaryOperator<GraphElement> missing) {
        return ElementTrees.map(tree, e -> original(e, missing));
    }

    public Optional<Operation> originalOp(String transformedName) {
        for (Map.Entry<Operation, Operation> entry : transformedOps.entrySet()) {
            if (entry.getValue().name().equals(transformedName)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    public Optional<Tensor> originalTensor(String transformedName) {
        for (Map.Entry<Tensor, Tensor> entry : transformedTensors.entrySet()) {
            if (entry.getValue().name().equals(transformedName)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    @SuppressWarnings("unchecked")
    private <T extends GraphElement> T forward(T original) {
        if (original instanceof Operation op) {
            return (T) transformedOps.get(op);
        }
        if (original instanceof Tensor t) {
            return (T) transformedTensors.get(t);
        }
        throw new IllegalArgumentException("Unsupported graph element: " + original);
    }

    @SuppressWarnings("unchecked")
    private <T extends GraphElement> T backward(T transformed) {
        Map<? extends GraphElement, ? extends GraphElement> map;
        if (transformed instanceof Operation) {
            map = transformedOps;
        } else if (transformed instanceof Tensor) {
            map = transformedTensors;
        } else {
            throw new IllegalArgumentException("Unsupported graph element: " + transformed);
        }
        for (Map.Entry<? extends GraphElement, ? extends GraphElement> entry : map.entrySet()) {
            if (entry.getValue() == transformed) {
                return (T) entry.getKey();
            }
        }
        return null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Transform result:\n");
        if (sourceGraph == destinationGraph) {
            sb.append("  Within ").append(destinationGraph);
            if (destinationScope.isEmpty()) {
                sb.append(" IN-PLACE");
            }
            sb.append("\n");
        } else {
            sb.append("  ").append(sourceGraph).append(" => ").append(destinationGraph).append("\n");
        }
        if (!sourceScope.isEmpty()) {
            sb.append("  Relative to source scope: ").append(sourceScope).append("\n");
        }
        if (!destinationScope.isEmpty()) {
            sb.append("  Destination scope: ").append(destinationScope).append("\n");
        }
        sb.append("Operations mapping:\n");
        for (Map.Entry<Operation, Operation> entry : transformedOps.entrySet()) {
            sb.append("  ").append(entry.getKey().name()).append(" => ").append(entry.getValue().name()).append("\n");
        }
        return sb.toString();
    }
}
