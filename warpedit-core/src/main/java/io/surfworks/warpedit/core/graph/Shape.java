package io.surfworks.warpedit.core.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Static tensor shape, possibly partially known.
 *
 * <p>A shape either has an unknown rank ({@link #unknown()}) or a list of
 * dimensions where {@value #UNKNOWN_DIM} marks a dimension whose size is not
 * known statically.
 *
 * @param dims the dimensions, or null when the rank is unknown
 */
public record Shape(List<Integer> dims) {

    /** Marker for a dimension of unknown size */
    public static final int UNKNOWN_DIM = -1;

    private static final Shape UNKNOWN = new Shape(null);
    private static final Shape SCALAR = new Shape(List.of());

    public Shape {
        if (dims != null) {
            for (Integer d : dims) {
                if (d == null || d < UNKNOWN_DIM) {
                    throw new IllegalArgumentException("Invalid dimension in shape: " + dims);
                }
            }
            dims = Collections.unmodifiableList(new ArrayList<>(dims));
        }
    }

    public static Shape unknown() {
        return UNKNOWN;
    }

    public static Shape scalar() {
        return SCALAR;
    }

    public static Shape of(int... dims) {
        List<Integer> list = new ArrayList<>(dims.length);
        for (int d : dims) {
            list.add(d);
        }
        return new Shape(list);
    }

    public boolean hasKnownRank() {
        return dims != null;
    }

    /**
     * Returns the rank, or -1 when unknown.
     */
    public int rank() {
        return dims == null ? -1 : dims.size();
    }

    public boolean isFullyDefined() {
        return dims != null && !dims.contains(UNKNOWN_DIM);
    }

    /**
     * Returns true if both shapes could describe the same runtime value.
     */
    public boolean isCompatibleWith(Shape other) {
        if (!hasKnownRank() || !other.hasKnownRank()) {
            return true;
        }
        if (rank() != other.rank()) {
            return false;
        }
        for (int i = 0; i < dims.size(); i++) {
            int a = dims.get(i);
            int b = other.dims.get(i);
            if (a != UNKNOWN_DIM && b != UNKNOWN_DIM && a != b) {
                return false;
            }
        }
        return true;
    }

    /**
     * Combines the information of two compatible shapes, keeping every known dimension.
     *
     * @throws IllegalArgumentException if the shapes are not compatible
     */
    public Shape mergeWith(Shape other) {
        if (!isCompatibleWith(other)) {
            throw new IllegalArgumentException("Shapes " + this + " and " + other + " are not compatible");
        }
        if (!hasKnownRank()) {
            return other;
        }
        if (!other.hasKnownRank()) {
            return this;
        }
        List<Integer> merged = new ArrayList<>(dims.size());
        for (int i = 0; i < dims.size(); i++) {
            int a = dims.get(i);
            merged.add(a != UNKNOWN_DIM ? a : other.dims.get(i));
        }
        return new Shape(merged);
    }

    @Override
    public String toString() {
        if (dims == null) {
            return "<unknown>";
        }
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < dims.size(); i++) {
            if (i > 0) sb.append(", ");
            int d = dims.get(i);
            sb.append(d == UNKNOWN_DIM ? "?" : String.valueOf(d));
        }
        return sb.append(")").toString();
    }
}
