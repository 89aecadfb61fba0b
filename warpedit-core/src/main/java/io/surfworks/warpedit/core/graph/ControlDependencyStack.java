package io.surfworks.warpedit.core.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Ambient control dependencies of a graph.
 *
 * <p>Each pushed frame lists operations that every operation created while the
 * frame is open must depend on. A frame also remembers the operations created
 * inside it: a new operation that already consumes one of those does not need
 * the frame's control inputs, since it depends on them transitively.
 *
 * <pre>{@code
 * try (var scope = graph.controlDependencies().push(List.of(init))) {
 *     Operation step = graph.opBuilder("Step", "step").input(x).output(type).build();
 *     // step has init as a control input
 * }
 * }</pre>
 *
 * <p>A frame pushed with {@link #pushClear()} hides every outer frame until it is closed.
 */
public final class ControlDependencyStack {

    private final List<Frame> frames = new ArrayList<>();

    ControlDependencyStack() {
    }

    /**
     * Opens a frame adding the given control inputs to newly created operations.
     *
     * @param controlInputs operations new operations must depend on
     * @return the frame; close it to pop
     */
    public Scope push(Collection<Operation> controlInputs) {
        Frame frame = new Frame(List.copyOf(controlInputs), false);
        frames.add(frame);
        return new Scope(frame);
    }

    /**
     * Opens a frame under which no outer control dependency applies.
     */
    public Scope pushClear() {
        Frame frame = new Frame(List.of(), true);
        frames.add(frame);
        return new Scope(frame);
    }

    public int depth() {
        return frames.size();
    }

    /**
     * Returns the ambient control inputs an operation with the given data-input
     * producers must receive.
     *
     * @param inputOps producers of the new operation's data inputs
     * @return control inputs to add, without duplicates
     */
    public List<Operation> controlInputsFor(Collection<Operation> inputOps) {
        List<Operation> result = new ArrayList<>();
        for (Frame frame : activeFrames()) {
            boolean dominated = false;
            for (Operation op : inputOps) {
                if (frame.seen.contains(op)) {
                    dominated = true;
                    break;
                }
            }
            if (dominated) {
                continue;
            }
            for (Operation control : frame.controlInputs) {
                if (!inputOps.contains(control) && !result.contains(control)) {
                    result.add(control);
                }
            }
        }
        return result;
    }

    /**
     * Records that an operation was created while the current frames are open.
     */
    public void recordOpSeen(Operation op) {
        for (Frame frame : frames) {
            frame.seen.add(op);
        }
    }

    private List<Frame> activeFrames() {
        for (int i = frames.size() - 1; i >= 0; i--) {
            if (frames.get(i).clears) {
                return frames.subList(i + 1, frames.size());
            }
        }
        return frames;
    }

    private void pop(Frame frame) {
        if (frames.isEmpty() || frames.get(frames.size() - 1) != frame) {
            throw new IllegalStateException("Control dependency frames must be closed in reverse order");
        }
        frames.remove(frames.size() - 1);
    }

    private static final class Frame {
        private final List<Operation> controlInputs;
        private final boolean clears;
        private final Set<Operation> seen = Collections.newSetFromMap(new IdentityHashMap<>());

        Frame(List<Operation> controlInputs, boolean clears) {
            this.controlInputs = controlInputs;
            this.clears = clears;
        }
    }

    /**
     * An open frame of the stack.
     */
    public final class Scope implements AutoCloseable {
        private final Frame frame;
        private boolean closed;

        private Scope(Frame frame) {
            this.frame = frame;
        }

        @Override
        public void close() {
            if (!closed) {
                pop(frame);
                closed = true;
            }
        }
    }
}
