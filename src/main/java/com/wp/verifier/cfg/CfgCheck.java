package com.wp.verifier.cfg;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.TreeSet;

/**
 * Structural sanity checks run on every graph the builder produces.
 */
public final class CfgCheck {

    private CfgCheck() {
    }

    /**
     * Verifies that every edge connects existing blocks, that every block is reachable from the
     * entry, that exactly the exit blocks lack outgoing edges, and that loop bookkeeping agrees
     * with the block kinds.
     *
     * @throws CfgConstructionException describing the first violation found
     */
    public static void check(ControlFlowGraph cfg) throws CfgConstructionException {
        int size = cfg.size();
        verify(size > 0, cfg, "graph has no blocks");
        verify(cfg.getEntry() >= 0 && cfg.getEntry() < size, cfg, "entry %d out of range", cfg.getEntry());
        verify(!cfg.hasNormalExit() || cfg.getBlock(cfg.getNormalExit()).getKind() == BlockKind.NORMAL_EXIT,
                cfg, "block %d is not a normal exit", cfg.getNormalExit());
        verify(!cfg.hasAbortExit() || cfg.getBlock(cfg.getAbortExit()).getKind() == BlockKind.ABORT_EXIT,
                cfg, "block %d is not an abort exit", cfg.getAbortExit());

        for (Edge edge : cfg.getEdges()) {
            verify(edge.getSource() >= 0 && edge.getSource() < size
                    && edge.getTarget() >= 0 && edge.getTarget() < size, cfg, "dangling edge %s", edge);
            if (edge.getKind() == EdgeKind.LOOP_BACK) {
                verify(cfg.getBlock(edge.getTarget()).isLoopHeader(), cfg,
                        "back edge %s does not target a loop header", edge);
            }
        }

        for (BasicBlock block : cfg.getBlocks()) {
            verify(block.getId() == cfg.getBlocks().indexOf(block), cfg, "block %d stored out of order", block.getId());
            if (block.getKind().isExit()) {
                verify(block.getOutgoing().isEmpty(), cfg, "exit block %d has outgoing edges", block.getId());
            } else {
                verify(!block.getOutgoing().isEmpty(), cfg, "block %d has no outgoing edge", block.getId());
            }
            verify(block.isLoopHeader() == (block.getInvariant() != null), cfg,
                    "block %d: invariant slot does not match its kind", block.getId());
            if (block.isLoopHeader()) {
                verify(cfg.getLoop(block.getId()) != null, cfg, "loop header %d is not in the loop table", block.getId());
            }
        }

        Set<Integer> visited = new TreeSet<>();
        Deque<Integer> waiting = new ArrayDeque<>();
        waiting.add(cfg.getEntry());
        while (!waiting.isEmpty()) {
            int id = waiting.poll();
            if (visited.add(id)) {
                for (Edge edge : cfg.getBlock(id).getOutgoing()) {
                    waiting.add(edge.getTarget());
                }
            }
        }
        verify(visited.size() == size, cfg, "%d of %d blocks unreachable from entry", size - visited.size(), size);
    }

    private static void verify(boolean condition, ControlFlowGraph cfg, String format, Object... args)
            throws CfgConstructionException {
        if (!condition) {
            throw new CfgConstructionException("malformed CFG for '" + cfg.getFunctionName() + "': "
                    + String.format(format, args), null);
        }
    }
}
