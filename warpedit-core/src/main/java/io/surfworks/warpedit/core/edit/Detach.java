package io.surfworks.warpedit.core.edit;

import io.surfworks.warpedit.core.graph.Graph;
import io.surfworks.warpedit.core.graph.Operation;
import io.surfworks.warpedit.core.graph.Tensor;

import java.util.ArrayList;
import java.util.List;

/**
 * Disconnects operations from their surroundings.
 */
public final class Detach {

    private Detach() {}

    /**
     * Detaches an operation from its consumers.
     *
     * <p>Each consumed output is replaced, for all its consumers, by a fresh
     * placeholder of the same type created next to the operation. Unconsumed
     * outputs are left alone.
     *
     * @param op the operation to detach
     * @return the created placeholders, in output slot order
     */
    public static List<Tensor> outputs(Operation op) {
        return outputs(op, Placeholders.DEFAULT_PREFIX);
    }

    /**
     * Detaches an operation from its consumers, naming the placeholders with the given prefix.
     */
    public static List<Tensor> outputs(Operation op, String prefix) {
        Graph graph = op.graph();
        List<Tensor> placeholders = new ArrayList<>();
        for (Tensor t : op.outputs()) {
            if (!t.hasConsumers()) {
                continue;
            }
            Tensor placeholder = Placeholders.fromTensor(graph, t, null, prefix);
            graph.rerouteConsumers(t, placeholder);
            placeholders.add(placeholder);
        }
        return placeholders;
    }
}
