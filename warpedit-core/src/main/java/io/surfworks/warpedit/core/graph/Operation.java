package io.surfworks.warpedit.core.graph;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A node of a dataflow graph.
 *
 * <p>An operation has an ordered list of data inputs, an ordered list of outputs
 * (the tensors it produces), a list of control inputs (operations that must run
 * first but provide no value) and an optional link to the operation it was
 * derived from. The link is weak: it records provenance and never keeps the
 * original alive.
 *
 * <p>Operations are created through their {@link Graph} and compared by identity.
 */
public final class Operation implements GraphElement {

    private final Graph graph;
    private final NodeDef nodeDef;
    private final List<Tensor> inputs;
    private final List<Tensor> outputs;
    private final List<Operation> controlInputs;
    private final WeakReference<Operation> originalOp;
    private String device;

    Operation(Graph graph,
              NodeDef nodeDef,
              List<Tensor> inputs,
              List<TensorType> outputTypes,
              List<Operation> controlInputs,
              Operation originalOp) {
        this.graph = graph;
        this.nodeDef = nodeDef;
        this.inputs = new ArrayList<>(inputs);
        this.controlInputs = new ArrayList<>();
        for (Operation ci : controlInputs) {
            if (!this.controlInputs.contains(ci)) {
                this.controlInputs.add(ci);
            }
        }
        this.originalOp = originalOp == null ? null : new WeakReference<>(originalOp);
        this.device = nodeDef.device();

        List<Tensor> outs = new ArrayList<>(outputTypes.size());
        for (int i = 0; i < outputTypes.size(); i++) {
            outs.add(new Tensor(this, i, outputTypes.get(i)));
        }
        this.outputs = Collections.unmodifiableList(outs);

        for (Tensor input : this.inputs) {
            input.addConsumer(this);
        }
    }

    @Override
    public String name() {
        return nodeDef.name();
    }

    @Override
    public Graph graph() {
        return graph;
    }

    public String type() {
        return nodeDef.opType();
    }

    /**
     * Returns the static definition this operation was created from.
     */
    public NodeDef nodeDef() {
        return nodeDef;
    }

    public List<Tensor> inputs() {
        return Collections.unmodifiableList(inputs);
    }

    public Tensor input(int index) {
        return inputs.get(index);
    }

    public List<Tensor> outputs() {
        return outputs;
    }

    public Tensor output(int index) {
        return outputs.get(index);
    }

    public List<Operation> controlInputs() {
        return Collections.unmodifiableList(controlInputs);
    }

    /**
     * Returns the operation this one was derived from, if it is still reachable.
     */
    public Optional<Operation> originalOp() {
        return originalOp == null ? Optional.empty() : Optional.ofNullable(originalOp.get());
    }

    public String device() {
        return device;
    }

    void setDevice(String device) {
        this.device = device == null ? "" : device;
    }

    void replaceInput(int index, Tensor newInput) {
        Tensor old = inputs.get(index);
        if (old == newInput) {
            return;
        }
        old.removeConsumer(this);
        inputs.set(index, newInput);
        newInput.addConsumer(this);
    }

    boolean addControlInput(Operation op) {
        if (controlInputs.contains(op)) {
            return false;
        }
        controlInputs.add(op);
        return true;
    }

    boolean removeControlInput(Operation op) {
        return controlInputs.remove(op);
    }

    @Override
    public String toString() {
        return "Operation[" + name() + ", type=" + type()
                + ", inputs=" + inputs.size() + ", outputs=" + outputs.size() + "]";
    }
}
