package io.surfworks.warpedit.core.util;

import io.surfworks.warpedit.core.graph.GraphElement;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Structure-preserving maps over nested containers of graph elements.
 *
 * <p>Given a tree made of {@link List}s, {@link Set}s, {@link Map}s (mapped by value),
 * {@link Optional}s and leaves, {@link #map} returns a tree of the same shape in
 * which every {@link GraphElement} leaf has been replaced by the function result.
 * Other leaves are returned as is.
 *
 * <pre>{@code
 * Map<String, List<Tensor>> grouped = ...;
 * Object copied = ElementTrees.map(grouped, e -> result.transformed(e).orElse(null));
 * }</pre>
 */
public final class ElementTrees {

    private ElementTrees() {}

    /**
     * Maps every graph element leaf of a tree.
     *
     * @param tree the tree to map, may be null
     * @param fn   the leaf function; its result may be null
     * @return a like-shaped tree
     */
    public static Object map(Object tree, Function<? super GraphElement, ?> fn) {
        if (tree == null) {
            return null;
        }
        if (tree instanceof GraphElement element) {
            return fn.apply(element);
        }
        if (tree instanceof Set<?> set) {
            Set<Object> result = new LinkedHashSet<>();
            for (Object child : set) {
                result.add(map(child, fn));
            }
            return result;
        }
        if (tree instanceof Collection<?> collection) {
            List<Object> result = new ArrayList<>(collection.size());
            for (Object child : collection) {
                result.add(map(child, fn));
            }
            return result;
        }
        if (tree instanceof Map<?, ?> mapTree) {
            Map<Object, Object> result = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : mapTree.entrySet()) {
                result.put(entry.getKey(), map(entry.getValue(), fn));
            }
            return result;
        }
        if (tree instanceof Optional<?> optional) {
            return optional.map(child -> map(child, fn));
        }
        return tree;
    }

    /**
     * Collects every graph element leaf of a tree, depth first.
     */
    public static List<GraphElement> flatten(Object tree) {
        List<GraphElement> result = new ArrayList<>();
        collect(tree, result);
        return result;
    }

    private static void collect(Object tree, List<GraphElement> out) {
        if (tree instanceof GraphElement element) {
            out.add(element);
        } else if (tree instanceof Collection<?> collection) {
            for (Object child : collection) {
                collect(child, out);
            }
        } else if (tree instanceof Map<?, ?> mapTree) {
            for (Object child : mapTree.values()) {
                collect(child, out);
            }
        } else if (tree instanceof Optional<?> optional) {
            optional.ifPresent(child -> collect(child, out));
        }
    }
}
