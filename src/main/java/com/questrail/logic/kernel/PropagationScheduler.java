package com.questrail.logic.kernel;

import com.questrail.logic.api.BlockEvaluationException;
import com.questrail.logic.api.CircuitFailureException;
import com.questrail.logic.api.CircuitInstabilityException;
import com.questrail.logic.block.Block;
import com.questrail.logic.block.CBlock;
import com.questrail.logic.block.SBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * PropagationScheduler
 * =============================================================================
 * Zero-delay propagation of output changes through the combinational blocks.
 *
 * <h2>Algorithm</h2>
 * <p>
 * The scheduler keeps a pending set of combinational blocks to evaluate. Output
 * changes of sequential blocks arrive through the circuit's change queue and add
 * their readers to the pending set. One step picks a pending block, evaluates it
 * and, if its output changed, adds its readers.
 * </p>
 *
 * <p>
 * The circuit may contain feedback loops, so there is no topological order.
 * The pick prefers a block none of whose upstream blocks is still pending;
 * failing that, the block with the fewest pending upstream blocks. Ties go to
 * the block that became pending first.
 * </p>
 *
 * <h2>Instability</h2>
 * A settling burst (from the first change after an idle period until the
 * pending set is empty) may evaluate at most
 * {@code maxEvaluationsPerBlock * blockCount} blocks. Exceeding it means an
 * oscillating loop and raises {@link CircuitInstabilityException}.
 *
 * <h2>Threading</h2>
 * Simulation thread only.
 */
public final class PropagationScheduler {

    private static final Logger log = LoggerFactory.getLogger(PropagationScheduler.class);

    private final Circuit circuit;
    private final Set<CBlock> pending = new LinkedHashSet<>();

    PropagationScheduler(Circuit circuit) {
        this.circuit = circuit;
    }

    /**
     * Marks every combinational block for evaluation. Used once when the
     * simulation enters steady state.
     */
    public void scheduleAll() {
        pending.addAll(circuit.blocks(CBlock.class));
    }

    public boolean isIdle() {
        return pending.isEmpty() && !circuit.hasPendingChanges();
    }

    int pendingCount() {
        return pending.size();
    }

    /**
     * Evaluates blocks until nothing is pending or the circuit is aborted.
     *
     * @return the number of evaluations performed
     * @throws CircuitInstabilityException when the evaluation limit is exceeded
     * @throws CircuitFailureException     when a block evaluation fails
     */
    public int settle() {
        int limit = circuit.maxEvaluationsPerBlock() * circuit.blockCount();
        int count = 0;
        while (!circuit.isAborted()) {
            SBlock changed;
            while ((changed = circuit.pollChanged()) != null) {
                pending.addAll(changed.oconnections());
            }
            if (pending.isEmpty()) {
                break;
            }
            count++;
            if (count > limit) {
                throw new CircuitInstabilityException(
                        "Circuit instability detected (too many block evaluations)");
            }
            CBlock blk = selectNext();
            pending.remove(blk);
            boolean outputChanged;
            try {
                outputChanged = blk.evalBlock();
            } catch (CircuitFailureException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new BlockEvaluationException(blk.name(),
                        blk + ": output evaluation error: " + e, e);
            }
            if (outputChanged) {
                pending.addAll(blk.oconnections());
            }
        }
        if (count > 0) {
            log.trace("{} block(s) evaluated, pausing", count);
        }
        return count;
    }

    /**
     * Picks the pending block with the fewest pending upstream blocks.
     */
    CBlock selectNext() {
        Iterator<CBlock> it = pending.iterator();
        CBlock best = it.next();
        if (!it.hasNext()) {
            return best;
        }
        int bestDeps = Integer.MAX_VALUE;
        for (CBlock blk : pending) {
            int deps = 0;
            for (Block upstream : blk.iconnections()) {
                if (upstream instanceof CBlock c && pending.contains(c)) {
                    deps++;
                }
            }
            if (deps == 0) {
                return blk;
            }
            if (deps < bestDeps) {
                bestDeps = deps;
                best = blk;
            }
        }
        return best;
    }

    /**
     * Runs the steady-state loop: settle, then wait for posted work, until the
     * circuit is aborted.
     *
     * @throws InterruptedException when the simulation thread is interrupted
     */
    public void runUntilAborted() throws InterruptedException {
        while (!circuit.isAborted()) {
            settle();
            if (circuit.isAborted()) {
                return;
            }
            Runnable action = circuit.takePosted();
            circuit.runAction(action);
        }
    }
}
