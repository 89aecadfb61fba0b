package io.surfworks.warpedit.core.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A dataflow graph: a set of uniquely named operations and the tensors they produce.
 *
 * <p>Besides storage, a graph provides:
 * <ul>
 *   <li>a name registry ({@link #uniqueName(String)}) handing out unused names</li>
 *   <li>named collections grouping operations and tensors</li>
 *   <li>ambient {@link ControlDependencyStack control dependencies} and
 *       {@link DeviceStack device placement} applied to new operations</li>
 * </ul>
 *
 * <p>Graphs are not thread-safe. Every structural change goes through this class.
 */
public final class Graph {

    private static final AtomicLong NEXT_ID = new AtomicLong();

    private final long id;
    private final String label;
    private final Map<String, Operation> opsByName = new LinkedHashMap<>();
    private final Map<String, Integer> namesInUse = new HashMap<>();
    private final Map<String, List<GraphElement>> collections = new LinkedHashMap<>();
    private final ControlDependencyStack controlDependencies = new ControlDependencyStack();
    private final DeviceStack devices = new DeviceStack();
    private boolean finalized;

    public Graph() {
        this("graph");
    }

    public Graph(String label) {
        this.id = NEXT_ID.incrementAndGet();
        this.label = Objects.requireNonNull(label, "label cannot be null");
    }

    /**
     * Returns a process-unique id, used to tell graphs apart in diagnostics.
     */
    public long id() {
        return id;
    }

    public String label() {
        return label;
    }

    // ==================== Lookup ====================

    /**
     * Returns all operations in creation order.
     */
    public List<Operation> operations() {
        return List.copyOf(opsByName.values());
    }

    public int operationCount() {
        return opsByName.size();
    }

    public Optional<Operation> operation(String name) {
        return Optional.ofNullable(opsByName.get(name));
    }

    /**
     * Looks up a tensor by its {@code op:slot} name.
     */
    public Optional<Tensor> tensor(String name) {
        int colon = name.lastIndexOf(':');
        if (colon <= 0 || colon == name.length() - 1) {
            return Optional.empty();
        }
        int slot;
        try {
            slot = Integer.parseInt(name.substring(colon + 1));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        Operation op = opsByName.get(name.substring(0, colon));
        if (op == null || slot < 0 || slot >= op.outputs().size()) {
            return Optional.empty();
        }
        return Optional.of(op.output(slot));
    }

    public boolean contains(GraphElement element) {
        return element.graph() == this;
    }

    // ==================== Names ====================

    /**
     * Returns a name not yet used in this graph and marks it as used.
     *
     * @see #uniqueName(String, boolean)
     */
    public String uniqueName(String name) {
        return uniqueName(name, true);
    }

    /**
     * Returns a name not yet used in this graph.
     *
     * <p>The first request for a name returns it unchanged. Later requests return
     * {@code name_1}, {@code name_2}, ... skipping any already taken. Names are
     * compared case-insensitively.
     *
     * @param name       the requested name
     * @param markAsUsed whether to reserve the returned name
     * @return the unique name
     */
    public String uniqueName(String name, boolean markAsUsed) {
        String key = name.toLowerCase(Locale.ROOT);
        int i = namesInUse.getOrDefault(key, 0);
        if (markAsUsed) {
            namesInUse.put(key, i + 1);
        }
        if (i == 0) {
            return name;
        }
        String baseKey = key;
        while (namesInUse.containsKey(key)) {
            key = baseKey + "_" + i;
            i++;
        }
        if (markAsUsed) {
            namesInUse.put(key, 1);
        }
        return name + "_" + (i - 1);
    }

    // ==================== Mutation ====================

    /**
     * Starts building a user operation.
     *
     * @param opType the operation type
     * @param name   the requested name, made unique on build
     */
    public OperationBuilder opBuilder(String opType, String name) {
        return new OperationBuilder(this, opType, name);
    }

    /**
     * Creates an operation exactly as described.
     *
     * <p>No ambient context is applied and the name is not altered.
     *
     * @param nodeDef       static definition; its name must not be taken
     * @param inputs        data inputs, all owned by this graph
     * @param outputTypes   types of the produced tensors
     * @param controlInputs control inputs, all owned by this graph
     * @param originalOp    provenance link, may be null
     * @return the new operation
     * @throws IllegalStateException    if the graph is finalized
     * @throws IllegalArgumentException if the name is taken or an input belongs to another graph
     */
    public Operation createOperation(NodeDef nodeDef,
                                     List<Tensor> inputs,
                                     List<TensorType> outputTypes,
                                     List<Operation> controlInputs,
                                     Operation originalOp) {
        checkNotFinalized();
        if (opsByName.containsKey(nodeDef.name())) {
            throw new IllegalArgumentException("Duplicate operation name: " + nodeDef.name());
        }
        for (Tensor t : inputs) {
            checkOwned(t);
        }
        for (Operation ci : controlInputs) {
            checkOwned(ci);
        }

        Operation op = new Operation(this, nodeDef, inputs, outputTypes, controlInputs, originalOp);
        opsByName.put(op.name(), op);
        namesInUse.putIfAbsent(op.name().toLowerCase(Locale.ROOT), 1);
        return op;
    }

    /**
     * Makes every input slot reading {@code from} read {@code to} instead.
     *
     * @return the number of input slots rewired
     * @throws IllegalArgumentException if the tensors live in different graphs or have different dtypes
     */
    public int rerouteConsumers(Tensor from, Tensor to) {
        checkNotFinalized();
        checkOwned(from);
        checkOwned(to);
        if (from == to) {
            return 0;
        }
        if (from.dtype() != to.dtype()) {
            throw new IllegalArgumentException("Cannot reroute " + from.name() + " (" + from.dtype()
                    + ") to " + to.name() + " (" + to.dtype() + ")");
        }
        int rewired = 0;
        for (Operation consumer : from.consumers()) {
            for (int i = 0; i < consumer.inputs().size(); i++) {
                if (consumer.input(i) == from) {
                    consumer.replaceInput(i, to);
                    rewired++;
                }
            }
        }
        return rewired;
    }

    public boolean addControlInput(Operation op, Operation controlInput) {
        checkNotFinalized();
        checkOwned(op);
        checkOwned(controlInput);
        return op.addControlInput(controlInput);
    }

    public boolean removeControlInput(Operation op, Operation controlInput) {
        checkNotFinalized();
        checkOwned(op);
        return op.removeControlInput(controlInput);
    }

    public void setDevice(Operation op, String device) {
        checkNotFinalized();
        checkOwned(op);
        op.setDevice(device);
    }

    // ==================== Collections ====================

    /**
     * Adds an element to a named collection, creating the collection if needed.
     * Adding an element twice has no effect.
     */
    public void addToCollection(String name, GraphElement element) {
        checkOwned(element);
        List<GraphElement> members = collections.computeIfAbsent(name, k -> new ArrayList<>());
        if (!containsIdentity(members, element)) {
            members.add(element);
        }
    }

    /**
     * Returns the members of a collection, empty if it does not exist.
     */
    public List<GraphElement> collection(String name) {
        List<GraphElement> members = collections.get(name);
        return members == null ? List.of() : Collections.unmodifiableList(members);
    }

    public List<String> collectionNames() {
        return List.copyOf(collections.keySet());
    }

    /**
     * Returns the names of every collection the element belongs to.
     */
    public List<String> collectionsContaining(GraphElement element) {
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, List<GraphElement>> entry : collections.entrySet()) {
            if (containsIdentity(entry.getValue(), element)) {
                names.add(entry.getKey());
            }
        }
        return names;
    }

    // ==================== Ambient context ====================

    public ControlDependencyStack controlDependencies() {
        return controlDependencies;
    }

    public DeviceStack devices() {
        return devices;
    }

    // ==================== Lifecycle ====================

    /**
     * Makes the graph read-only. Later structural changes fail.
     */
    public void finalizeGraph() {
        finalized = true;
    }

    public boolean isFinalized() {
        return finalized;
    }

    private void checkNotFinalized() {
        if (finalized) {
            throw new IllegalStateException("Graph " + this + " is finalized and cannot be modified");
        }
    }

    private void checkOwned(GraphElement element) {
        if (element.graph() != this) {
            throw new IllegalArgumentException(element.name() + " does not belong to " + this);
        }
    }

    private static boolean containsIdentity(List<GraphElement> members, GraphElement element) {
        for (GraphElement member : members) {
            if (member == element) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "Graph[" + label + "#" + id + ", ops=" + opsByName.size() + "]";
    }
}
