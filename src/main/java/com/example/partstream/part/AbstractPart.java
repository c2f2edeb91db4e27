package com.example.partstream.part;

import java.util.List;

/**
 * Shared name/laziness handling. Failed evaluations are not memoized: the next call
 * invokes the producer again.
 */
public abstract class AbstractPart implements Part {

    private final String name;
    private final boolean lazy;
    private final List<String> dependsOn;

    private final Object lock = new Object();
    private boolean evaluated;
    private Object memo;

    protected AbstractPart(String name, boolean lazy, List<String> dependsOn) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("part name must not be blank");
        }
        this.name = name;
        this.lazy = lazy;
        this.dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isLazy() {
        return lazy;
    }

    @Override
    public List<String> dependsOn() {
        return dependsOn;
    }

    @Override
    public final Object evaluate(PartContext context) throws Exception {
        if (!lazy) {
            return compute(context);
        }
        synchronized (lock) {
            if (!evaluated) {
                memo = compute(context);
                evaluated = true;
            }
            return memo;
        }
    }

    protected abstract Object compute(PartContext context) throws Exception;

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(name=" + name + ", lazy=" + lazy + ")";
    }
}
