package com.wp.verifier.cfg;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Renders a {@link ControlFlowGraph} in Graphviz DOT: one node declaration per block and one
 * edge declaration per edge, each on its own line.
 */
public final class CfgDotExporter {

    private static final Logger logger = LoggerFactory.getLogger(CfgDotExporter.class);

    private CfgDotExporter() {
    }

    public static String toDot(ControlFlowGraph cfg) {
        StringBuilder dot = new StringBuilder();
        dot.append("digraph \"").append(escape(cfg.getFunctionName())).append("\" {\n");
        for (BasicBlock block : cfg.getBlocks()) {
            dot.append("  ").append(node(cfg, block)).append('\n');
        }
        for (Edge edge : cfg.getEdges()) {
            dot.append("  ").append(edge(edge)).append('\n');
        }
        return dot.append("}\n").toString();
    }

    /**
     * Renders a single path, as produced by {@link CfgPaths#simplePaths}.
     */
    public static String toDot(ControlFlowGraph cfg, List<Integer> path) {
        StringBuilder dot = new StringBuilder("digraph Path {\n");
        for (int id : path) {
            dot.append("  ").append(node(cfg, cfg.getBlock(id))).append('\n');
        }
        for (int i = 0; i + 1 < path.size(); i++) {
            int from = path.get(i);
            int to = path.get(i + 1);
            for (Edge edge : cfg.getBlock(from).getOutgoing()) {
                if (edge.getTarget() == to) {
                    dot.append("  ").append(edge(edge)).append('\n');
                    break;
                }
            }
        }
        return dot.append("}\n").toString();
    }

    /**
     * Writes {@code <function>.dot} and one {@code <function>_path_<n>.dot} per simple path.
     *
     * @return number of files written
     */
    public static int export(ControlFlowGraph cfg, Path directory) throws IOException {
        Files.createDirectories(directory);
        String base = cfg.getFunctionName();
        write(directory.resolve(base + ".dot"), toDot(cfg));
        List<List<Integer>> paths = CfgPaths.simplePaths(cfg);
        for (int i = 0; i < paths.size(); i++) {
            write(directory.resolve(base + "_path_" + i + ".dot"), toDot(cfg, paths.get(i)));
        }
        logger.debug("Exported CFG of {} with {} paths to {}", base, paths.size(), directory);
        return paths.size() + 1;
    }

    private static void write(Path file, String content) throws IOException {
        try (FileWriter writer = new FileWriter(file.toFile())) {
            writer.write(content);
        }
    }

    private static String node(ControlFlowGraph cfg, BasicBlock block) {
        StringBuilder label = new StringBuilder("bb").append(block.getId());
        String shape;
        switch (block.getKind()) {
            case LOOP_HEADER:
                label.append("\\n@Inv: ").append(escape(block.getInvariant().getPredicate().toString()));
                shape = "diamond";
                break;
            case NORMAL_EXIT:
                label.append("\\nPost: ").append(escape(cfg.getPostcondition().getPredicate().toString()));
                shape = "ellipse";
                break;
            case ABORT_EXIT:
                label.append("\\nabort");
                shape = "ellipse";
                break;
            default:
                shape = block.getId() == cfg.getEntry() ? "Mdiamond"
                        : block.getInstructions().isEmpty() ? "circle" : "box";
        }
        for (Instruction instruction : block.getInstructions()) {
            label.append("\\n").append(escape(instruction.toString()));
        }
        return "bb" + block.getId() + " [label=\"" + label + "\", shape=" + shape + "];";
    }

    private static String edge(Edge edge) {
        String label;
        if (edge.getLabel() != null) {
            label = edge.getLabel();
        } else if (edge.getGuard() != null) {
            label = edge.getGuard().toString();
        } else {
            label = edge.getKind() == EdgeKind.LOOP_BACK ? "back" : "";
        }
        return "bb" + edge.getSource() + " -> bb" + edge.getTarget() + " [label=\"" + escape(label) + "\"];";
    }

    private static String escape(String input) {
        return input.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
