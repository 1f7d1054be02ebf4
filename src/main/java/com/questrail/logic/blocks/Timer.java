package com.questrail.logic.blocks;

import com.questrail.logic.block.BlockConfig;
import com.questrail.logic.fsm.Fsm;
import com.questrail.logic.fsm.FsmDefinition;
import com.questrail.logic.fsm.FsmOptions;
import com.questrail.logic.kernel.Circuit;
import com.questrail.logic.time.TimePeriods;

/**
 * On/off timer with output {@code true} in state {@code on}.
 *
 * <p>Events {@code start}, {@code stop} and {@code toggle}. Durations
 * {@code tOn} and {@code tOff} limit the time spent in each state; both are
 * infinite by default. A non-restartable timer ignores {@code start} while on
 * and {@code stop} while off, leaving the running timer untouched.</p>
 */
public final class Timer extends Fsm {

    public static final FsmDefinition<Timer> DEFINITION = FsmDefinition.builder(Timer.class)
            .states("off", "on")
            .timer("on", TimePeriods.INFINITE, "stop")
            .timer("off", TimePeriods.INFINITE, "start")
            .transition("start", (String) null, "on")
            .transition("stop", (String) null, "off")
            .transition("toggle", "on", "off")
            .transition("toggle", "off", "on")
            .guard("start", (t, data) -> t.restartable || !"on".equals(t.state()))
            .guard("stop", (t, data) -> t.restartable || !"off".equals(t.state()))
            .build();

    private final boolean restartable;

    public Timer(Circuit circuit, String name, BlockConfig config, Object tOn, Object tOff, boolean restartable) {
        super(circuit, name, config, DEFINITION, FsmOptions.<Timer>builder()
                .withDuration("on", tOn)
                .withDuration("off", tOff)
                .build());
        this.restartable = restartable;
    }

    public Timer(Circuit circuit, String name, Object tOn, Object tOff) {
        this(circuit, name, null, tOn, tOff, true);
    }

    @Override
    protected Object calcOutput() {
        return "on".equals(state());
    }
}
