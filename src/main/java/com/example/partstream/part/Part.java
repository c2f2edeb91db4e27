package com.example.partstream.part;

import java.util.List;

/**
 * One named, independently evaluable unit of a progressive response.
 * <p>
 * A part never catches its producer's failures; isolating them is the evaluator's job.
 */
public interface Part {

    String name();

    PartKind kind();

    /** Lazy parts call their producer at most once per instance and memoize the value. */
    boolean isLazy();

    /** Informational only, surfaced in the manifest. Ordering is not enforced. */
    List<String> dependsOn();

    Object evaluate(PartContext context) throws Exception;
}
