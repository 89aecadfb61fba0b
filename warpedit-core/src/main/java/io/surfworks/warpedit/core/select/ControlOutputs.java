package io.surfworks.warpedit.core.select;

import io.surfworks.warpedit.core.graph.Graph;
import io.surfworks.warpedit.core.graph.Operation;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reverse index of control edges: for each operation, the operations that list it
 * as a control input.
 *
 * <p>Operations only store their control inputs, so walking control edges forward
 * needs this index. It is a snapshot: rebuild it with {@link #update()} after
 * editing control edges.
 */
public final class ControlOutputs {

    private final Graph graph;
    private Map<Operation, List<Operation>> outputs;

    public ControlOutputs(Graph graph) {
        this.graph = graph;
        update();
    }

    public Graph graph() {
        return graph;
    }

    /**
     * Rebuilds the index from the current graph.
     */
    public ControlOutputs update() {
        Map<Operation, List<Operation>> index = new IdentityHashMap<>();
        for (Operation op : graph.operations()) {
            for (Operation controlInput : op.controlInputs()) {
                index.computeIfAbsent(controlInput, k -> new ArrayList<>()).add(op);
            }
        }
        this.outputs = index;
        return this;
    }

    /**
     * Returns the operations depending on {@code op} through a control edge.
     */
    public List<Operation> get(Operation op) {
        List<Operation> result = outputs.get(op);
        return result == null ? List.of() : List.copyOf(result);
    }
}
