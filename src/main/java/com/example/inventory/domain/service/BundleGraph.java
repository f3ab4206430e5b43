package com.example.inventory.domain.service;

import com.example.inventory.domain.exception.BundleCycleDetectedException;
import com.example.inventory.domain.exception.InvalidBundleDefinitionException;
import com.example.inventory.domain.exception.UnknownProductException;
import com.example.inventory.domain.model.BundleComponent;
import com.example.inventory.domain.model.Product;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.LongFunction;

/**
 * Directed graph from a bundle to its components, built fresh from the catalog for one resolution pass.
 * <p>
 * {@link #build} loads every product reachable from the root, then verifies the graph is acyclic with a
 * depth-first traversal that keeps the current path on a stack. A graph that was built successfully is
 * therefore always acyclic and fully defined, and {@link #availability} can evaluate it post-order.
 */
public final class BundleGraph {

    private enum Mark { VISITING, DONE }

    private final long rootId;
    private final Map<Long, Product> products;
    private final Map<Long, List<BundleComponent>> components;

    private BundleGraph(long rootId, Map<Long, Product> products, Map<Long, List<BundleComponent>> components) {
        this.rootId = rootId;
        this.products = products;
        this.components = components;
    }

    /**
     * Builds the graph reachable from {@code rootId}. Each product and each component list is looked up once.
     *
     * @param rootId          the product to resolve, bundle or not
     * @param productLookup   catalog product lookup
     * @param componentLookup catalog component lookup for bundles
     * @throws UnknownProductException          if the root is not in the catalog
     * @throws InvalidBundleDefinitionException if a bundle has no components, a line with a non-positive id or
     *                                          quantity, or references a missing product
     * @throws BundleCycleDetectedException     if a bundle transitively contains itself
     */
    public static BundleGraph build(long rootId,
                                    LongFunction<Optional<Product>> productLookup,
                                    LongFunction<List<BundleComponent>> componentLookup) {
        Product root = productLookup.apply(rootId)
                .orElseThrow(() -> new UnknownProductException(rootId));

        Map<Long, Product> products = new LinkedHashMap<>();
        Map<Long, List<BundleComponent>> components = new HashMap<>();
        products.put(rootId, root);

        Deque<Product> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Product bundle = pending.pop();
            if (!bundle.isBundle()) {
                continue;
            }
            List<BundleComponent> lines = componentLookup.apply(bundle.getProductId());
            if (lines == null || lines.isEmpty()) {
                throw InvalidBundleDefinitionException.noComponents(bundle.getProductId());
            }
            components.put(bundle.getProductId(), List.copyOf(lines));

            for (BundleComponent line : lines) {
                long componentId = line.componentProductId();
                if (componentId <= 0) {
                    throw InvalidBundleDefinitionException.invalidComponentId(bundle.getProductId(), componentId);
                }
                if (line.quantityPerBundle() <= 0) {
                    throw InvalidBundleDefinitionException.nonPositiveQuantity(
                            bundle.getProductId(), componentId, line.quantityPerBundle());
                }
                if (products.containsKey(componentId)) {
                    continue;
                }
                Product component = productLookup.apply(componentId)
                        .orElseThrow(() -> InvalidBundleDefinitionException.missingComponent(
                                bundle.getProductId(), componentId));
                products.put(componentId, component);
                pending.push(component);
            }
        }

        BundleGraph graph = new BundleGraph(rootId, products, components);
        graph.verifyAcyclic();
        return graph;
    }

    private void verifyAcyclic() {
        Map<Long, Mark> marks = new HashMap<>();
        visit(rootId, marks, new ArrayList<>());
    }

    private void visit(long productId, Map<Long, Mark> marks, List<Long> path) {
        Mark mark = marks.get(productId);
        if (mark == Mark.DONE) {
            return;
        }
        if (mark == Mark.VISITING) {
            List<Long> cycle = new ArrayList<>(path.subList(path.indexOf(productId), path.size()));
            cycle.add(productId);
            throw new BundleCycleDetectedException(rootId, cycle);
        }

        marks.put(productId, Mark.VISITING);
        path.add(productId);
        for (BundleComponent line : components.getOrDefault(productId, List.of())) {
            visit(line.componentProductId(), marks, path);
        }
        path.remove(path.size() - 1);
        marks.put(productId, Mark.DONE);
    }

    /**
     * Stocked (non-bundle) products the availability depends on, in ascending id order.
     */
    public List<Long> leafProductIds() {
        TreeSet<Long> leaves = new TreeSet<>();
        for (Product product : products.values()) {
            if (!product.isBundle()) {
                leaves.add(product.getProductId());
            }
        }
        return List.copyOf(leaves);
    }

    /**
     * Evaluates the availability of the root.
     * <p>
     * A leaf contributes {@code max(0, quantity)}; a bundle is the minimum over its components of
     * {@code floor(componentAvailability / quantityPerBundle)}. Shared components are evaluated once.
     *
     * @param leafQuantities current quantity per leaf product, read from one snapshot; absent keys count as zero
     */
    public long availability(Map<Long, Long> leafQuantities) {
        return evaluate(rootId, leafQuantities, new HashMap<>());
    }

    private long evaluate(long productId, Map<Long, Long> leafQuantities, Map<Long, Long> memo) {
        Long known = memo.get(productId);
        if (known != null) {
            return known;
        }

        long result;
        if (!products.get(productId).isBundle()) {
            result = Math.max(0L, leafQuantities.getOrDefault(productId, 0L));
        } else {
            result = Long.MAX_VALUE;
            for (BundleComponent line : components.get(productId)) {
                long available = evaluate(line.componentProductId(), leafQuantities, memo);
                result = Math.min(result, available / line.quantityPerBundle());
            }
        }
        memo.put(productId, result);
        return result;
    }

    public long getRootId() {
        return rootId;
    }

    public Product getRoot() {
        return products.get(rootId);
    }

    /**
     * Products reachable from the root, keyed by id.
     */
    public Map<Long, Product> getProducts() {
        return Collections.unmodifiableMap(products);
    }

    public List<BundleComponent> componentsOf(long bundleId) {
        return components.getOrDefault(bundleId, List.of());
    }
}
