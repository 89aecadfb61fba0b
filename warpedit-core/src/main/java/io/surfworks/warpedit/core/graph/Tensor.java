package io.surfworks.warpedit.core.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * A value flowing along a data edge, identified by its producing operation and
 * output slot.
 *
 * <p>A tensor has exactly one producer and any number of consumers. Its dtype is
 * fixed at creation; its static shape may be refined with {@link #setShape(Shape)}.
 */
public final class Tensor implements GraphElement {

    private final Operation op;
    private final int valueIndex;
    private final ScalarType dtype;
    private Shape shape;

    // One entry per consuming input slot, so an op reading this tensor twice appears twice
    private final List<Operation> consumerSlots = new ArrayList<>();

    Tensor(Operation op, int valueIndex, TensorType type) {
        this.op = op;
        this.valueIndex = valueIndex;
        this.dtype = type.dtype();
        this.shape = type.shape();
    }

    /**
     * Returns the operation producing this tensor.
     */
    public Operation op() {
        return op;
    }

    /**
     * Returns the output slot of the producer.
     */
    public int valueIndex() {
        return valueIndex;
    }

    @Override
    public String name() {
        return op.name() + ":" + valueIndex;
    }

    @Override
    public Graph graph() {
        return op.graph();
    }

    public ScalarType dtype() {
        return dtype;
    }

    public Shape shape() {
        return shape;
    }

    public TensorType type() {
        return new TensorType(dtype, shape);
    }

    /**
     * Refines the static shape of this tensor.
     *
     * @param newShape the shape to merge in
     * @throws IllegalArgumentException if the shape is not compatible with the current one
     */
    public void setShape(Shape newShape) {
        this.shape = shape.mergeWith(newShape);
    }

    /**
     * Returns the distinct operations consuming this tensor, in the order they
     * started consuming it.
     */
    public List<Operation> consumers() {
        return List.copyOf(new LinkedHashSet<>(consumerSlots));
    }

    public boolean hasConsumers() {
        return !consumerSlots.isEmpty();
    }

    void addConsumer(Operation consumer) {
        consumerSlots.add(consumer);
    }

    void removeConsumer(Operation consumer) {
        consumerSlots.remove(consumer);
    }

    List<Operation> consumerSlots() {
        return Collections.unmodifiableList(consumerSlots);
    }

    @Override
    public String toString() {
        return "Tensor[" + name() + ", " + dtype.name().toLowerCase() + shape + "]";
    }
}
