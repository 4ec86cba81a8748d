package com.jcollect.query;

import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.util.Map;
import java.util.Set;

/**
 * Immutable set of custom operators extending the built-in vocabulary. Names are stored with a
 * leading {@code $}; a name may be registered with or without it.
 */
public final class ValidatorMap {
    private static final ValidatorMap EMPTY = new ValidatorMap(Maps.immutable.empty());

    private final ImmutableMap<String, Validator> validators;

    private ValidatorMap(ImmutableMap<String, Validator> validators) {
        this.validators = validators;
    }

    public static ValidatorMap empty() {
        return EMPTY;
    }

    public static ValidatorMap of(Map<String, ? extends Validator> validators) {
        ValidatorMap result = EMPTY;
        for (Map.Entry<String, ? extends Validator> entry : validators.entrySet()) {
            result = result.with(entry.getKey(), entry.getValue());
        }
        return result;
    }

    /**
     * Returns a copy with {@code validator} registered under {@code name}.
     *
     * @throws IllegalArgumentException if the name is blank or collides with a built-in operator
     */
    public ValidatorMap with(String name, Validator validator) {
        if (name == null || name.isBlank() || name.equals("$")) {
            throw new IllegalArgumentException("Validator name must not be blank");
        }
        if (validator == null) {
            throw new IllegalArgumentException("Validator " + name + " must not be null");
        }
        String symbol = name.startsWith("$") ? name : "$" + name;
        if (Operator.isReserved(symbol)) {
            throw new IllegalArgumentException("Validator " + symbol + " collides with a built-in operator");
        }
        return new ValidatorMap(validators.newWithKeyValue(symbol, validator));
    }

    public Validator get(String symbol) {
        return validators.get(symbol);
    }

    public Set<String> names() {
        return validators.castToMap().keySet();
    }

    public boolean isEmpty() {
        return validators.isEmpty();
    }

    public int size() {
        return validators.size();
    }

    @Override
    public String toString() {
        return "ValidatorMap" + names();
    }
}
