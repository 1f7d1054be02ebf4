package com.questrail.logic.blocks;

import com.questrail.logic.api.EventData;
import com.questrail.logic.block.BlockConfig;
import com.questrail.logic.block.SBlock;
import com.questrail.logic.event.Event;
import com.questrail.logic.event.HandlerTable;
import com.questrail.logic.kernel.Circuit;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Calls a function with the payload {@code value} of each {@code put} event.
 *
 * <p>
 * On success the {@code onSuccess} events are sent with {@code value} set to the
 * result; on failure the error is logged and the {@code onError} events are
 * sent with {@code error} set to the exception. The optional stop data is
 * processed as a final {@code put} when the block stops.
 * </p>
 */
public final class OutputFunc extends SBlock {

    static final HandlerTable<OutputFunc> HANDLERS = HandlerTable.builder(OutputFunc.class)
            .on("put", OutputFunc::call)
            .build();

    /**
     * Outcome of one function call.
     */
    public record Result(boolean success, Object value) {
    }

    private final Function<Object, Object> func;
    private final List<Event> onSuccess;
    private final List<Event> onError;
    private final EventData stopData;

    public OutputFunc(Circuit circuit, String name, BlockConfig config, Function<Object, Object> func,
                      List<Event> onSuccess, List<Event> onError, EventData stopData) {
        super(circuit, name, config);
        this.func = Objects.requireNonNull(func, "func");
        this.onSuccess = List.copyOf(onSuccess == null ? List.of() : onSuccess);
        this.onError = List.copyOf(onError == null ? List.of() : onError);
        this.stopData = stopData;
        this.onSuccess.forEach(circuit::registerEvent);
        this.onError.forEach(circuit::registerEvent);
    }

    public OutputFunc(Circuit circuit, String name, Function<Object, Object> func) {
        this(circuit, name, null, func, null, null, null);
    }

    @Override
    protected HandlerTable<OutputFunc> eventHandlers() {
        return HANDLERS;
    }

    private Result call(EventData data) {
        Object arg = data.get(EventData.VALUE);
        Object result;
        try {
            result = func.apply(arg);
        } catch (RuntimeException e) {
            logError("output function failed; arg: {}; error: {}", arg, e.toString());
            for (Event event : onError) {
                event.send(this, EventData.of(EventData.TRIGGER, "error", "error", e));
            }
            return new Result(false, e);
        }
        logDebug("output function returned: {}", result);
        for (Event event : onSuccess) {
            event.send(this, EventData.of(EventData.TRIGGER, "success", EventData.VALUE, result));
        }
        return new Result(true, result);
    }

    @Override
    protected void initRegular() {
        setOutput(false);
    }

    @Override
    public void stop() {
        if (stopData != null) {
            call(stopData);
        }
        super.stop();
    }
}
