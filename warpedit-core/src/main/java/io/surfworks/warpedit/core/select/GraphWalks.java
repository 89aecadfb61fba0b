package io.surfworks.warpedit.core.select;

import io.surfworks.warpedit.core.graph.Operation;
import io.surfworks.warpedit.core.graph.Tensor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reachability walks over data and control edges.
 *
 * <p>Forward walks start at the consumers of seed tensors and follow outputs to their
 * consumers (and, when a {@link ControlOutputs} index is given, control edges to
 * their dependents). Backward walks start at the producers of seed tensors and
 * follow inputs to their producers (and optionally control inputs).
 *
 * <p>Results are ordered by discovery, seeds first.
 */
public final class GraphWalks {

    private GraphWalks() {}

    /**
     * Returns the operations reachable downstream of the seed tensors.
     *
     * @param seeds          tensors whose consumers start the walk
     * @param inclusive      whether the seed consumers are part of the result
     * @param controlOutputs control edge index to follow, or null for data edges only
     */
    public static List<Operation> forwardWalkOps(Collection<Tensor> seeds,
                                                 boolean inclusive,
                                                 ControlOutputs controlOutputs) {
        Set<Operation> seedOps = new LinkedHashSet<>();
        for (Tensor t : seeds) {
            seedOps.addAll(t.consumers());
        }
        Set<Operation> result = new LinkedHashSet<>(seedOps);
        List<Operation> wave = new ArrayList<>(seedOps);
        while (!wave.isEmpty()) {
            List<Operation> next = new ArrayList<>();
            for (Operation op : wave) {
                for (Tensor out : op.outputs()) {
                    for (Operation consumer : out.consumers()) {
                        if (result.add(consumer)) {
                            next.add(consumer);
                        }
                    }
                }
                if (controlOutputs != null) {
                    for (Operation dependent : controlOutputs.get(op)) {
                        if (result.add(dependent)) {
                            next.add(dependent);
                        }
                    }
                }
            }
            wave = next;
        }
        if (!inclusive) {
            result.removeAll(seedOps);
        }
        return List.copyOf(result);
    }

    /**
     * Returns the operations reachable upstream of the seed tensors.
     *
     * @param seeds               tensors whose producers start the walk
     * @param inclusive           whether the seed producers are part of the result
     * @param followControlInputs whether control inputs are followed
     */
    public static List<Operation> backwardWalkOps(Collection<Tensor> seeds,
                                                  boolean inclusive,
                                                  boolean followControlInputs) {
        Set<Operation> seedOps = new LinkedHashSet<>();
        for (Tensor t : seeds) {
            seedOps.add(t.op());
        }
        Set<Operation> result = new LinkedHashSet<>(seedOps);
        List<Operation> wave = new ArrayList<>(seedOps);
        while (!wave.isEmpty()) {
            List<Operation> next = new ArrayList<>();
            for (Operation op : wave) {
                for (Tensor in : op.inputs()) {
                    if (result.add(in.op())) {
                        next.add(in.op());
                    }
                }
                if (followControlInputs) {
                    for (Operation controlInput : op.controlInputs()) {
                        if (result.add(controlInput)) {
                            next.add(controlInput);
                        }
                    }
                }
            }
            wave = next;
        }
        if (!inclusive) {
            result.removeAll(seedOps);
        }
        return List.copyOf(result);
    }

    /**
     * Returns the operations lying on some path from the seeds to the targets,
     * following data edges and control edges in both directions.
     *
     * @param seeds          tensors where paths start (their consumers are included)
     * @param targets        tensors where paths end (their producers are included)
     * @param controlOutputs control edge index of the graph
     * @return the operations on a path, in forward discovery order
     */
    public static List<Operation> walksIntersectionOps(Collection<Tensor> seeds,
                                                       Collection<Tensor> targets,
                                                       ControlOutputs controlOutputs) {
        List<Operation> forward = forwardWalkOps(seeds, true, controlOutputs);
        Set<Operation> backward = SubGraphView.identitySet(backwardWalkOps(targets, true, true));
        List<Operation> result = new ArrayList<>();
        for (Operation op : forward) {
            if (backward.contains(op)) {
                result.add(op);
            }
        }
        return result;
    }
}
