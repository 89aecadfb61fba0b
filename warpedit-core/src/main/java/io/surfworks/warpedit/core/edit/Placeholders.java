package io.surfworks.warpedit.core.edit;

import io.surfworks.warpedit.core.graph.Graph;
import io.surfworks.warpedit.core.graph.Operation;
import io.surfworks.warpedit.core.graph.Tensor;
import io.surfworks.warpedit.core.graph.TensorType;
import io.surfworks.warpedit.core.util.Scopes;

/**
 * Creates placeholder operations: inputless sources standing in for values
 * supplied from outside a graph.
 */
public final class Placeholders {

    /** Op type of placeholder operations */
    public static final String OP_TYPE = "Placeholder";

    /** Default name prefix of placeholders derived from a tensor */
    public static final String DEFAULT_PREFIX = "geph";

    private Placeholders() {}

    /**
     * Creates a placeholder.
     *
     * @param graph the graph to create it in
     * @param name  the requested name, made unique
     * @param type  dtype and shape of the produced tensor
     * @return the placeholder's output tensor
     */
    public static Tensor create(Graph graph, String name, TensorType type) {
        Operation op = graph.opBuilder(OP_TYPE, name)
                .attribute("dtype", type.dtype())
                .attribute("shape", type.shape())
                .output(type)
                .build();
        return op.output(0);
    }

    /**
     * Creates a placeholder matching a tensor's dtype and shape.
     *
     * @see #fromTensor(Graph, Tensor, String, String)
     */
    public static Tensor fromTensor(Graph graph, Tensor t, String scope) {
        return fromTensor(graph, t, scope, DEFAULT_PREFIX);
    }

    /**
     * Creates a placeholder matching a tensor's dtype and shape.
     *
     * <p>The placeholder is named {@code scope + prefix + "__" + producer + "_" + slot},
     * where {@code producer} is the base name of the tensor's producer. When the
     * producer is itself such a placeholder, its base name is reused without
     * stacking prefixes.
     *
     * @param graph  the graph to create the placeholder in
     * @param t      the tensor to imitate
     * @param scope  the scope to create it under, or null for the producer's scope
     * @param prefix the name prefix
     * @return the placeholder's output tensor
     */
    public static Tensor fromTensor(Graph graph, Tensor t, String scope, String prefix) {
        return create(graph, placeholderName(t, scope, prefix), t.type());
    }

    static String placeholderName(Tensor t, String scope, String prefix) {
        String opName = t.op().name();
        String finalScope = scope == null ? Scopes.dirname(opName) : Scopes.finalizeScope(scope);
        String base = Scopes.basename(opName);
        if (base.startsWith(prefix + "__")) {
            return finalScope + base;
        }
        return finalScope + prefix + "__" + base + "_" + t.valueIndex();
    }
}
