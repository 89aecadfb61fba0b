package io.surfworks.warpedit.core.graph;

/**
 * Element types carried by tensors.
 */
public enum ScalarType {
    F16(2, false, true),
    BF16(2, false, true),
    F32(4, false, true),
    F64(8, false, true),
    I8(1, true, false),
    I16(2, true, false),
    I32(4, true, false),
    I64(8, true, false),
    BOOL(1, false, false);

    private final int byteSize;
    private final boolean isInteger;
    private final boolean isFloating;

    ScalarType(int byteSize, boolean isInteger, boolean isFloating) {
        this.byteSize = byteSize;
        this.isInteger = isInteger;
        this.isFloating = isFloating;
    }

    public int byteSize() {
        return byteSize;
    }

    public boolean isInteger() {
        return isInteger;
    }

    public boolean isFloating() {
        return isFloating;
    }
}
