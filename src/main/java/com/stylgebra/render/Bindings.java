package com.stylgebra.render;

import com.stylgebra.node.Node;
import org.eclipse.collections.api.block.HashingStrategy;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.block.factory.HashingStrategies;
import org.eclipse.collections.impl.map.strategy.mutable.UnifiedMapWithHashingStrategy;

/**
 * Values that variables and lookups take on during one render pass, keyed by node identity.
 * Equal-looking nodes at different places in a tree are bound separately; the same node
 * instance reached twice is rebound each time it is rendered.
 */
public final class Bindings {
    private static final HashingStrategy<Object> IDENTITY = HashingStrategies.identityStrategy();

    private final MutableMap<Node, Object> values = new UnifiedMapWithHashingStrategy<>(IDENTITY);

    public void bind(Node node, Object value) {
        values.put(node, value);
    }

    public boolean isBound(Node node) {
        return values.containsKey(node);
    }

    public Object get(Node node) {
        return values.get(node);
    }
}
