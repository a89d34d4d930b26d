package com.myorg.fanout.engine.hydrate;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

//Danh bạ hydrator theo actionType (post, tick, dataset...).
public class HydratorRegistry {
    private final Map<String, VariantHydrator> hydrators = new ConcurrentHashMap<>();

    public HydratorRegistry(List<VariantHydrator> hydrators) {
        hydrators.forEach(this::register);
    }

    public void register(VariantHydrator hydrator) {
        VariantHydrator prev = hydrators.putIfAbsent(hydrator.actionType(), hydrator);
        if (prev != null && prev != hydrator) {
            throw new IllegalStateException("Duplicate hydrator for actionType=" + hydrator.actionType()
                    + ": " + prev.getClass().getName() + " and " + hydrator.getClass().getName());
        }
    }

    public VariantHydrator get(String actionType) {
        return actionType == null ? null : hydrators.get(actionType);
    }
}
