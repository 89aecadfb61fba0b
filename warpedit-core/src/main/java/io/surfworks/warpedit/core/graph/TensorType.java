package io.surfworks.warpedit.core.graph;

import java.util.Objects;

/**
 * Declared type of an operation output: element type plus static shape.
 *
 * @param dtype the element type
 * @param shape the static shape (may be partially known)
 */
public record TensorType(ScalarType dtype, Shape shape) {

    public TensorType {
        Objects.requireNonNull(dtype, "dtype cannot be null");
        Objects.requireNonNull(shape, "shape cannot be null");
    }

    public static TensorType of(ScalarType dtype, int... dims) {
        return new TensorType(dtype, Shape.of(dims));
    }

    public static TensorType unknownShape(ScalarType dtype) {
        return new TensorType(dtype, Shape.unknown());
    }

    @Override
    public String toString() {
        return dtype.name().toLowerCase() + shape;
    }
}
