package com.example.partstream.part;

import java.util.List;

public final class StaticPart extends AbstractPart {

    private final Object value;

    public StaticPart(String name, Object value) {
        this(name, value, List.of());
    }

    public StaticPart(String name, Object value, List<String> dependsOn) {
        super(name, false, dependsOn);
        this.value = value;
    }

    @Override
    public PartKind kind() {
        return PartKind.STATIC;
    }

    @Override
    protected Object compute(PartContext context) {
        return value;
    }
}
