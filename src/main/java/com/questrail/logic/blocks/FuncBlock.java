package com.questrail.logic.blocks;

import com.questrail.logic.block.BlockConfig;
import com.questrail.logic.block.CBlock;
import com.questrail.logic.block.InputExpectation;
import com.questrail.logic.block.InputValues;
import com.questrail.logic.kernel.Circuit;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * A combinational block computing its output with a plain function of the
 * input values.
 *
 * <pre>
 *   new FuncBlock(circuit, "sum", null, in -&gt; (int) in.get("a") + (int) in.get("b"))
 *       .expecting("a", InputExpectation.single())
 *       .expecting("b", InputExpectation.single())
 *       .connect(Connections.of().input("a", "x").input("b", "y"));
 * </pre>
 */
public class FuncBlock extends CBlock {

    private final Function<InputValues, Object> func;
    private final Map<String, InputExpectation> signature = new LinkedHashMap<>();

    public FuncBlock(Circuit circuit, String name, BlockConfig config, Function<InputValues, Object> func) {
        super(circuit, name, config);
        this.func = Objects.requireNonNull(func, "func");
    }

    /**
     * Declares an expected input, checked when the block starts. Without any
     * declaration the inputs are not checked.
     */
    public FuncBlock expecting(String input, InputExpectation expectation) {
        signature.put(Objects.requireNonNull(input, "input"), Objects.requireNonNull(expectation, "expectation"));
        return this;
    }

    @Override
    protected Object calcOutput() {
        return func.apply(in());
    }

    @Override
    public void start() {
        super.start();
        if (!signature.isEmpty()) {
            checkSignature(signature);
        }
    }
}
