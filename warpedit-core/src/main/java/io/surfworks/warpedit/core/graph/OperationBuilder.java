package io.surfworks.warpedit.core.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fluent builder for user-created operations.
 *
 * <p>Unlike {@link Graph#createOperation}, the builder makes the requested name
 * unique and applies the graph's ambient control dependencies and device placement.
 *
 * <pre>{@code
 * Operation add = graph.opBuilder("Add", "layer/add")
 *     .input(x)
 *     .input(y)
 *     .output(TensorType.of(ScalarType.F32, 4, 8))
 *     .build();
 * }</pre>
 */
public final class OperationBuilder {

    private final Graph graph;
    private final String opType;
    private final String name;
    private final List<Tensor> inputs = new ArrayList<>();
    private final List<TensorType> outputTypes = new ArrayList<>();
    private final List<Operation> controlInputs = new ArrayList<>();
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private String device = "";
    private Operation originalOp;

    OperationBuilder(Graph graph, String opType, String name) {
        this.graph = graph;
        this.opType = opType;
        this.name = name;
    }

    public OperationBuilder input(Tensor tensor) {
        inputs.add(tensor);
        return this;
    }

    public OperationBuilder inputs(List<Tensor> tensors) {
        inputs.addAll(tensors);
        return this;
    }

    public OperationBuilder output(TensorType type) {
        outputTypes.add(type);
        return this;
    }

    public OperationBuilder controlInput(Operation op) {
        controlInputs.add(op);
        return this;
    }

    public OperationBuilder attribute(String key, Object value) {
        attributes.put(key, value);
        return this;
    }

    public OperationBuilder device(String device) {
        this.device = device;
        return this;
    }

    public OperationBuilder originalOp(Operation op) {
        this.originalOp = op;
        return this;
    }

    /**
     * Creates the operation in the graph.
     *
     * @return the new operation
     */
    public Operation build() {
        String uniqueName = graph.uniqueName(name);
        NodeDef def = new NodeDef(uniqueName, opType, attributes, device);

        List<Operation> inputOps = new ArrayList<>(inputs.size());
        for (Tensor t : inputs) {
            inputOps.add(t.op());
        }
        List<Operation> controls = new ArrayList<>(controlInputs);
        controls.addAll(graph.controlDependencies().controlInputsFor(inputOps));

        Operation op = graph.createOperation(def, inputs, outputTypes, controls, originalOp);
        graph.controlDependencies().recordOpSeen(op);
        graph.devices().apply(op);
        return op;
    }
}
