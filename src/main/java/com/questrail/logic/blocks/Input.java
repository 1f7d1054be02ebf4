package com.questrail.logic.blocks;

import com.questrail.logic.api.EventData;
import com.questrail.logic.block.BlockConfig;
import com.questrail.logic.block.InitFromValue;
import com.questrail.logic.block.PersistentState;
import com.questrail.logic.block.SBlock;
import com.questrail.logic.event.HandlerTable;
import com.questrail.logic.kernel.Circuit;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Entry point for external values.
 *
 * <p>
 * The {@code put} event sets the output to the payload {@code value} after
 * validation and returns {@code true}; a rejected value is logged and
 * {@code put} returns {@code false}. Validation steps, each optional:
 * membership in an allowed set, a check predicate, and a schema function that
 * may also convert the value.
 * </p>
 */
public final class Input extends SBlock implements InitFromValue, PersistentState {

    static final HandlerTable<Input> HANDLERS = HandlerTable.builder(Input.class)
            .on("put", (in, data) -> in.accept(data.get(EventData.VALUE)))
            .build();

    private final Validation validation;

    public Input(Circuit circuit, String name, BlockConfig config, Validation validation) {
        super(circuit, name, config);
        this.validation = validation == null ? Validation.NONE : validation;
        if (config().hasInitDefault()) {
            this.validation.validate(config().initDefault());
        }
    }

    public Input(Circuit circuit, String name, BlockConfig config) {
        this(circuit, name, config, null);
    }

    @Override
    protected HandlerTable<Input> eventHandlers() {
        return HANDLERS;
    }

    private boolean accept(Object value) {
        Object validated;
        try {
            validated = validation.validate(value);
        } catch (IllegalArgumentException e) {
            logWarning("{}", e.getMessage());
            return false;
        }
        setOutput(validated);
        return true;
    }

    @Override
    public void initFromValue(Object value) {
        put(value);
    }

    @Override
    public Object captureState() {
        return output();
    }

    @Override
    public void restoreState(Object state) {
        put(state);
    }

    /**
     * Value validation rules.
     */
    public record Validation(Set<Object> allowed, Predicate<Object> check, Function<Object, Object> schema) {

        public static final Validation NONE = new Validation(null, null, null);

        public Validation {
            allowed = allowed == null ? null : Collections.unmodifiableSet(new HashSet<>(allowed));
        }

        public static Validation allowed(Collection<?> values) {
            return new Validation(new HashSet<>(Objects.requireNonNull(values, "values")), null, null);
        }

        public static Validation check(Predicate<Object> check) {
            return new Validation(null, Objects.requireNonNull(check, "check"), null);
        }

        public static Validation schema(Function<Object, Object> schema) {
            return new Validation(null, null, Objects.requireNonNull(schema, "schema"));
        }

        /**
         * @return the accepted, possibly converted value
         * @throws IllegalArgumentException when the value is rejected
         */
        public Object validate(Object value) {
            if (allowed != null && !allowed.contains(value)) {
                throw new IllegalArgumentException("Validation error: " + value + " is not among allowed values");
            }
            if (check != null && !check.test(value)) {
                throw new IllegalArgumentException("Validation function rejected value " + value);
            }
            if (schema != null) {
                try {
                    return schema.apply(value);
                } catch (RuntimeException e) {
                    throw new IllegalArgumentException(
                            "Validation schema rejected value " + value + " with error: " + e.getMessage(), e);
                }
            }
            return value;
        }
    }
}
