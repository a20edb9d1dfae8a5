package de.mirkosertic.jsonschema;

import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Tracks the types currently being expanded on the recursion path.
 *
 * <p>A type is active only between {@link #enter(String)} and {@link #exit(String)}. Whenever a
 * reference handle is given out for an active type, the type is marked as referenced so the walker
 * registers its definition even if it would otherwise be inlined.</p>
 *
 * <p>Unnamed containers (arrays, collections, maps) have no type key, so their sample instances are
 * tracked by identity instead.</p>
 */
final class CycleDetector {

    private final Set<String> active = new HashSet<>();
    private final Set<String> referenced = new HashSet<>();
    private final Set<Object> activeSamples = Collections.newSetFromMap(new IdentityHashMap<>());

    boolean isActive(final String typeName) {
        return active.contains(typeName);
    }

    void enter(final String typeName) {
        active.add(typeName);
    }

    void markReferenced(final String typeName) {
        referenced.add(typeName);
    }

    /**
     * @return whether a reference handle was given out while the type was active
     */
    boolean exit(final String typeName) {
        active.remove(typeName);
        return referenced.remove(typeName);
    }

    boolean isActiveSample(final Object sample) {
        return activeSamples.contains(sample);
    }

    void enterSample(final Object sample) {
        activeSamples.add(sample);
    }

    void exitSample(final Object sample) {
        activeSamples.remove(sample);
    }
}
