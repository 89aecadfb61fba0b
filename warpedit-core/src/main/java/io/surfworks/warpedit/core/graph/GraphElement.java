package io.surfworks.warpedit.core.graph;

/**
 * Common view over the two kinds of things a graph owns: operations and the
 * tensors they produce.
 *
 * <p>Elements are compared by reference identity. Two elements with the same
 * name in different graphs are unrelated.
 */
public sealed interface GraphElement permits Operation, Tensor {

    /**
     * Returns the element name ({@code scope/op} for operations,
     * {@code scope/op:slot} for tensors).
     */
    String name();

    /**
     * Returns the graph that owns this element.
     */
    Graph graph();
}
