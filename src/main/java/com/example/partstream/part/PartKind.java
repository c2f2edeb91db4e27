package com.example.partstream.part;

public enum PartKind {
    /** Literal value, never lazy. */
    STATIC,
    /** Value computed by a producer. */
    FUNCTION,
    /** Producer fronted by the shared {@link PartCache}. */
    CACHED
}
