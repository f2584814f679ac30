package com.lintsentinel.core.catalog;

import com.lintsentinel.core.model.RuleId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, ordered collection of every rule the linter can activate.
 *
 * <p>
 * The catalog is passed explicitly to the resolver rather than read from
 * global state, so resolution stays a pure function and tests can supply
 * synthetic catalogs.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleCatalog {

    private final List<RuleDescriptor> descriptors;
    private final Map<RuleId, RuleDescriptor> byId;

    private RuleCatalog(List<RuleDescriptor> descriptors) {
        Map<RuleId, RuleDescriptor> index = new LinkedHashMap<>();
        for (int i = 0; i < descriptors.size(); i++) {
            RuleDescriptor descriptor = Objects.requireNonNull(descriptors.get(i),
                    "Rule descriptor at index " + i + " is null");
            RuleId id = descriptor.getId();
            if (index.putIfAbsent(id, descriptor) != null) {
                throw new IllegalArgumentException("Duplicate rule in catalog: " + id);
            }
        }
        this.descriptors = Collections.unmodifiableList(new ArrayList<>(descriptors));
        this.byId = Collections.unmodifiableMap(index);
    }

    /**
     * Create a catalog from the given descriptors, keeping their order.
     *
     * @param descriptors rule descriptors; must not be {@code null}
     * @return the catalog
     * @throws IllegalArgumentException if two descriptors share a
     *                                  {@link RuleId}
     */
    public static RuleCatalog of(List<? extends RuleDescriptor> descriptors) {
        Objects.requireNonNull(descriptors, "Descriptor list must not be null");
        return new RuleCatalog(new ArrayList<>(descriptors));
    }

    public static RuleCatalog of(RuleDescriptor... descriptors) {
        return of(List.of(descriptors));
    }

    /**
     * @return unmodifiable list of descriptors in catalog order
     */
    public List<RuleDescriptor> getDescriptors() {
        return descriptors;
    }

    public Optional<RuleDescriptor> find(RuleId id) {
        return Optional.ofNullable(byId.get(id));
    }

    public boolean contains(RuleId id) {
        return byId.containsKey(id);
    }

    public int size() {
        return descriptors.size();
    }

    @Override
    public String toString() {
        return "RuleCatalog{rules=" + byId.keySet() + '}';
    }
}
