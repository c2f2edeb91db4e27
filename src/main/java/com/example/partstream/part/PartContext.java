package com.example.partstream.part;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Caller context handed opaquely to every part producer.
 * <p>
 * {@code carry} holds the values the caller wants sealed into the next cursor (for example
 * a user id or filter state); {@code cursorContext} holds what the incoming cursor carried,
 * minus its position. Both are read-only.
 */
public final class PartContext {

    private static final PartContext ANONYMOUS = new PartContext(null, Map.of(), Map.of(), Map.of());

    private final String principal;
    private final Map<String, Object> attributes;
    private final Map<String, Object> carry;
    private final Map<String, Object> cursorContext;

    private PartContext(String principal,
                        Map<String, Object> attributes,
                        Map<String, Object> carry,
                        Map<String, Object> cursorContext) {
        this.principal = principal;
        this.attributes = readOnly(attributes);
        this.carry = readOnly(carry);
        this.cursorContext = readOnly(cursorContext);
    }

    public static PartContext anonymous() {
        return ANONYMOUS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> principal() {
        return Optional.ofNullable(principal);
    }

    public Map<String, Object> attributes() {
        return attributes;
    }

    public Object attribute(String name) {
        return attributes.get(name);
    }

    public <T> T attribute(String name, Class<T> type) {
        Object v = attributes.get(name);
        return type.isInstance(v) ? type.cast(v) : null;
    }

    public Map<String, Object> carry() {
        return carry;
    }

    public Map<String, Object> cursorContext() {
        return cursorContext;
    }

    public PartContext withCursorContext(Map<String, Object> cursorContext) {
        return new PartContext(principal, attributes, carry, cursorContext);
    }

    @Override
    public String toString() {
        return "PartContext{principal=" + principal + ", attributes=" + attributes.keySet()
                + ", carry=" + carry.keySet() + "}";
    }

    private static Map<String, Object> readOnly(Map<String, Object> in) {
        if (in == null || in.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(in));
    }

    public static final class Builder {
        private String principal;
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private final Map<String, Object> carry = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder principal(String principal) {
            this.principal = principal;
            return this;
        }

        public Builder attribute(String name, Object value) {
            this.attributes.put(name, value);
            return this;
        }

        /** Value sealed into every cursor issued for this request. */
        public Builder carry(String name, Object value) {
            this.carry.put(name, value);
            return this;
        }

        public PartContext build() {
            return new PartContext(principal, attributes, carry, Map.of());
        }
    }
}
