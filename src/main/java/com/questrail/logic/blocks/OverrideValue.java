package com.questrail.logic.blocks;

import com.questrail.logic.block.BlockConfig;
import com.questrail.logic.block.CBlock;
import com.questrail.logic.block.InputExpectation;
import com.questrail.logic.kernel.Circuit;

import java.util.Map;
import java.util.Objects;

/**
 * Passes the {@code input} value unless {@code override} differs from the
 * null value; then outputs the override value.
 */
public final class OverrideValue extends CBlock {

    private final Object nullValue;

    public OverrideValue(Circuit circuit, String name, BlockConfig config, Object nullValue) {
        super(circuit, name, config);
        this.nullValue = nullValue;
    }

    public OverrideValue(Circuit circuit, String name) {
        this(circuit, name, null, null);
    }

    @Override
    protected Object calcOutput() {
        Object override = in().get("override");
        return Objects.equals(override, nullValue) ? in().get("input") : override;
    }

    @Override
    public void start() {
        super.start();
        checkSignature(Map.of("input", InputExpectation.single(), "override", InputExpectation.single()));
    }
}
