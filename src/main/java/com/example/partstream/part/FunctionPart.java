package com.example.partstream.part;

import java.util.List;
import java.util.Objects;

public final class FunctionPart extends AbstractPart {

    private final PartProducer producer;

    public FunctionPart(String name, PartProducer producer, boolean lazy) {
        this(name, producer, lazy, List.of());
    }

    public FunctionPart(String name, PartProducer producer, boolean lazy, List<String> dependsOn) {
        super(name, lazy, dependsOn);
        this.producer = Objects.requireNonNull(producer, "producer");
    }

    @Override
    public PartKind kind() {
        return PartKind.FUNCTION;
    }

    @Override
    protected Object compute(PartContext context) throws Exception {
        return producer.produce(context);
    }
}
