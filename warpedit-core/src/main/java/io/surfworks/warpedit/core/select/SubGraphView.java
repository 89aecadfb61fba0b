package io.surfworks.warpedit.core.select;

import io.surfworks.warpedit.core.graph.Graph;
import io.surfworks.warpedit.core.graph.GraphElement;
import io.surfworks.warpedit.core.graph.Operation;
import io.surfworks.warpedit.core.graph.Tensor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A selection of operations of one graph, with ordered boundary tensors.
 *
 * <p>A view does not own anything: the same operation can belong to any number of
 * views. Its boundary is:
 * <ul>
 *   <li><b>inputs</b>: tensors consumed by member operations but produced outside</li>
 *   <li><b>outputs</b>: tensors produced by members that are visible from outside</li>
 * </ul>
 *
 * <p>When built with {@link #of(Collection)}, inputs are the distinct external data
 * inputs of the members in member order, and outputs are every member output except
 * those consumed exclusively by members. Unconsumed outputs count as outputs.
 *
 * <p>Views are immutable. {@link #remap} derives a view with re-ordered boundaries.
 */
public final class SubGraphView {

    private static final SubGraphView EMPTY = new SubGraphView(null, List.of(), List.of(), List.of());

    private final Graph graph;
    private final List<Operation> ops;
    private final Set<Operation> opSet;
    private final List<Tensor> inputs;
    private final List<Tensor> outputs;

    private SubGraphView(Graph graph, List<Operation> ops, List<Tensor> inputs, List<Tensor> outputs) {
        this.graph = graph;
        this.ops = List.copyOf(ops);
        this.opSet = identitySet(ops);
        this.inputs = List.copyOf(inputs);
        this.outputs = List.copyOf(outputs);
    }

    public static SubGraphView empty() {
        return EMPTY;
    }

    /**
     * Builds a view over the given operations, inferring its boundary.
     *
     * @param ops the member operations (duplicates are ignored)
     * @throws IllegalArgumentException if the operations belong to different graphs
     */
    public static SubGraphView of(Collection<Operation> ops) {
        List<Operation> members = distinct(ops);
        if (members.isEmpty()) {
            return EMPTY;
        }
        Graph graph = uniqueGraph(members);
        Set<Operation> memberSet = identitySet(members);

        List<Tensor> inputs = new ArrayList<>();
        Set<Tensor> seenInputs = identitySet(List.of());
        for (Operation op : members) {
            for (Tensor t : op.inputs()) {
                if (!memberSet.contains(t.op()) && seenInputs.add(t)) {
                    inputs.add(t);
                }
            }
        }

        List<Tensor> outputs = new ArrayList<>();
        for (Operation op : members) {
            for (Tensor t : op.outputs()) {
                if (!consumedOnlyBy(t, memberSet)) {
                    outputs.add(t);
                }
            }
        }
        return new SubGraphView(graph, members, inputs, outputs);
    }

    /**
     * Builds a view with an explicit boundary.
     *
     * @throws IllegalArgumentException if any element belongs to another graph
     */
    public static SubGraphView of(Collection<Operation> ops, List<Tensor> inputs, List<Tensor> outputs) {
        List<Operation> members = distinct(ops);
        List<GraphElement> all = new ArrayList<>(members);
        all.addAll(inputs);
        all.addAll(outputs);
        if (all.isEmpty()) {
            return EMPTY;
        }
        return new SubGraphView(uniqueGraph(all), members, inputs, outputs);
    }

    /**
     * Returns the owning graph, or null for an empty view.
     */
    public Graph graph() {
        return graph;
    }

    public List<Operation> ops() {
        return ops;
    }

    public List<Tensor> inputs() {
        return inputs;
    }

    public List<Tensor> outputs() {
        return outputs;
    }

    public boolean contains(Operation op) {
        return opSet.contains(op);
    }

    public boolean isEmpty() {
        return ops.isEmpty() && inputs.isEmpty() && outputs.isEmpty();
    }

    /**
     * Returns the position of a tensor among the boundary inputs.
     *
     * @throws IllegalArgumentException if the tensor is not an input of this view
     */
    public int inputIndex(Tensor t) {
        int idx = indexOfIdentity(inputs, t);
        if (idx < 0) {
            throw new IllegalArgumentException(t.name() + " is not an input of " + this);
        }
        return idx;
    }

    /**
     * Returns the position of a tensor among the boundary outputs.
     *
     * @throws IllegalArgumentException if the tensor is not an output of this view
     */
    public int outputIndex(Tensor t) {
        int idx = indexOfIdentity(outputs, t);
        if (idx < 0) {
            throw new IllegalArgumentException(t.name() + " is not an output of " + this);
        }
        return idx;
    }

    public boolean isInput(Tensor t) {
        return indexOfIdentity(inputs, t) >= 0;
    }

    public boolean isOutput(Tensor t) {
        return indexOfIdentity(outputs, t) >= 0;
    }

    /**
     * Derives a view whose boundary lists are picked from this one by position.
     *
     * <p>{@code inputMap.get(i)} is the index, in this view, of the i-th input of the
     * new view. Indices may repeat or be omitted.
     *
     * @throws IndexOutOfBoundsException if an index is out of range
     */
    public SubGraphView remap(List<Integer> inputMap, List<Integer> outputMap) {
        return new SubGraphView(graph, ops, pick(inputs, inputMap), pick(outputs, outputMap));
    }

    public SubGraphView remapInputs(List<Integer> inputMap) {
        return new SubGraphView(graph, ops, pick(inputs, inputMap), outputs);
    }

    public SubGraphView remapOutputs(List<Integer> outputMap) {
        return new SubGraphView(graph, ops, inputs, pick(outputs, outputMap));
    }

    /**
     * Returns the operations outside the view consuming its outputs.
     */
    public List<Operation> consumers() {
        Set<Operation> result = new LinkedHashSet<>();
        for (Tensor t : outputs) {
            for (Operation consumer : t.consumers()) {
                if (!opSet.contains(consumer)) {
                    result.add(consumer);
                }
            }
        }
        return List.copyOf(result);
    }

    private static boolean consumedOnlyBy(Tensor t, Set<Operation> members) {
        List<Operation> consumers = t.consumers();
        if (consumers.isEmpty()) {
            return false;
        }
        for (Operation consumer : consumers) {
            if (!members.contains(consumer)) {
                return false;
            }
        }
        return true;
    }

    private static List<Tensor> pick(List<Tensor> source, List<Integer> indices) {
        List<Tensor> result = new ArrayList<>(indices.size());
        for (int idx : indices) {
            result.add(source.get(idx));
        }
        return result;
    }

    private static int indexOfIdentity(List<Tensor> list, Tensor t) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) == t) {
                return i;
            }
        }
        return -1;
    }

    private static List<Operation> distinct(Collection<Operation> ops) {
        Set<Operation> seen = identitySet(List.of());
        List<Operation> result = new ArrayList<>(ops.size());
        for (Operation op : ops) {
            if (seen.add(op)) {
                result.add(op);
            }
        }
        return result;
    }

    private static Graph uniqueGraph(Collection<? extends GraphElement> elements) {
        Graph graph = null;
        for (GraphElement element : elements) {
            if (graph == null) {
                graph = element.graph();
            } else if (element.graph() != graph) {
                throw new IllegalArgumentException(
                        element.name() + " belongs to " + element.graph() + ", expected " + graph);
            }
        }
        return graph;
    }

    static <T> Set<T> identitySet(Collection<T> initial) {
        Set<T> set = Collections.newSetFromMap(new IdentityHashMap<>());
        set.addAll(initial);
        return set;
    }

    @Override
    public String toString() {
        return String.format("SubGraphView[ops=%d, inputs=%d, outputs=%d]",
                ops.size(), inputs.size(), outputs.size());
    }
}
