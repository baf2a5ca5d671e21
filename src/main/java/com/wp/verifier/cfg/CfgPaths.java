package com.wp.verifier.cfg;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Enumerates the simple paths between cut points of a graph. Cut points are the entry, the loop
 * headers and the exit blocks; a path starts at one, ends at the next one it reaches and never
 * passes through a third. Every such path is one case the verification conditions must cover.
 */
public final class CfgPaths {

    private CfgPaths() {
    }

    public static boolean isCutPoint(ControlFlowGraph cfg, int block) {
        BasicBlock b = cfg.getBlock(block);
        return block == cfg.getEntry() || b.isLoopHeader() || b.getKind().isExit();
    }

    /**
     * @return paths as lists of block ids, ordered by start block and then by edge order
     */
    public static List<List<Integer>> simplePaths(ControlFlowGraph cfg) {
        List<List<Integer>> paths = new ArrayList<>();
        for (BasicBlock block : cfg.getBlocks()) {
            if (isCutPoint(cfg, block.getId()) && !block.getKind().isExit()) {
                List<Integer> current = new ArrayList<>();
                current.add(block.getId());
                extend(cfg, current, new HashSet<>(current), paths);
            }
        }
        return paths;
    }

    private static void extend(ControlFlowGraph cfg, List<Integer> current, Set<Integer> onPath,
                               List<List<Integer>> paths) {
        int last = current.get(current.size() - 1);
        for (Edge edge : cfg.getBlock(last).getOutgoing()) {
            int next = edge.getTarget();
            if (isCutPoint(cfg, next)) {
                List<Integer> path = new ArrayList<>(current);
                path.add(next);
                paths.add(path);
            } else if (onPath.add(next)) {
                current.add(next);
                extend(cfg, current, onPath, paths);
                current.remove(current.size() - 1);
                onPath.remove(next);
            }
        }
    }
}
