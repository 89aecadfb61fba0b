package io.surfworks.warpedit.core.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Ambient device placement of a graph.
 *
 * <p>Frames hold placement functions. When an operation is created they are
 * applied from the innermost frame outwards, stopping at a reset frame. A frame
 * pushed with a plain device string only fills in operations that have no device
 * yet, so the innermost placement wins.
 */
public final class DeviceStack {

    private final List<Function<Operation, String>> frames = new ArrayList<>();

    DeviceStack() {
    }

    /**
     * Places new operations without a device on the given device.
     */
    public Scope push(String device) {
        Objects.requireNonNull(device, "device cannot be null");
        return push(op -> op.device().isEmpty() ? device : op.device());
    }

    /**
     * Places new operations with an arbitrary placement function.
     */
    public Scope push(Function<Operation, String> placement) {
        Objects.requireNonNull(placement, "placement cannot be null");
        frames.add(placement);
        return new Scope(frames.size());
    }

    /**
     * Opens a frame under which no outer placement applies.
     */
    public Scope pushReset() {
        frames.add(null);
        return new Scope(frames.size());
    }

    public int depth() {
        return frames.size();
    }

    /**
     * Applies the open placement frames to an operation.
     */
    public void apply(Operation op) {
        for (int i = frames.size() - 1; i >= 0; i--) {
            Function<Operation, String> placement = frames.get(i);
            if (placement == null) {
                break;
            }
            op.setDevice(placement.apply(op));
        }
    }

    /**
     * An open frame of the stack.
     */
    public final class Scope implements AutoCloseable {
        private final int depth;
        private boolean closed;

        private Scope(int depth) {
            this.depth = depth;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            if (frames.size() != depth) {
                throw new IllegalStateException("Device frames must be closed in reverse order");
            }
            closed = true;
            frames.remove(frames.size() - 1);
        }
    }
}
