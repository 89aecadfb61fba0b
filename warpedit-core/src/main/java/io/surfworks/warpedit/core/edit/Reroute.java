package io.surfworks.warpedit.core.edit;

import io.surfworks.warpedit.core.graph.Tensor;

import java.util.List;

/**
 * Rewires consumers from one set of tensors to another.
 */
public final class Reroute {

    private Reroute() {}

    /**
     * Makes every consumer of {@code oldTs.get(i)} read {@code newTs.get(i)} instead.
     *
     * <p>Pairs where both sides are the same tensor are left alone.
     *
     * @param newTs the tensors consumers should read
     * @param oldTs the tensors consumers currently read
     * @return the number of input slots rewired
     * @throws IllegalArgumentException if the lists differ in size
     */
    public static int rerouteTensors(List<Tensor> newTs, List<Tensor> oldTs) {
        if (newTs.size() != oldTs.size()) {
            throw new IllegalArgumentException(
                    "Cannot reroute " + oldTs.size() + " tensors to " + newTs.size() + " tensors");
        }
        int rewired = 0;
        for (int i = 0; i < newTs.size(); i++) {
            Tensor newT = newTs.get(i);
            Tensor oldT = oldTs.get(i);
            if (newT == oldT) {
                continue;
            }
            rewired += oldT.graph().rerouteConsumers(oldT, newT);
        }
        return rewired;
    }
}
