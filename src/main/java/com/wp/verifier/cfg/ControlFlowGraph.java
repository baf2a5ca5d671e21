package com.wp.verifier.cfg;

import com.wp.verifier.model.Annotation;
import com.wp.verifier.model.Diagnostic;

import java.util.ArrayList;
import java.util.List;

/**
 * Control-flow graph of one function. Blocks are stored in a flat table and refer to each
 * other by index, so loops are plain data rather than reference cycles. Immutable once built.
 */
public final class ControlFlowGraph {

    /** Index used for an exit block the function does not have. */
    public static final int NONE = -1;

    private final String functionName;
    private final List<BasicBlock> blocks;
    private final List<Edge> edges;
    private final int entry;
    private final int normalExit;
    private final int abortExit;
    private final List<LoopInfo> loops;
    private final List<Annotation> preconditions;
    private final Annotation postcondition;
    private final List<Diagnostic> diagnostics;

    ControlFlowGraph(String functionName, List<BasicBlock> blocks, List<Edge> edges, int entry,
                     int normalExit, int abortExit, List<LoopInfo> loops, List<Annotation> preconditions,
                     Annotation postcondition, List<Diagnostic> diagnostics) {
        this.functionName = functionName;
        this.blocks = List.copyOf(blocks);
        this.edges = List.copyOf(edges);
        this.entry = entry;
        this.normalExit = normalExit;
        this.abortExit = abortExit;
        this.loops = List.copyOf(loops);
        this.preconditions = List.copyOf(preconditions);
        this.postcondition = postcondition;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public String getFunctionName() {
        return functionName;
    }

    public List<BasicBlock> getBlocks() {
        return blocks;
    }

    public BasicBlock getBlock(int id) {
        return blocks.get(id);
    }

    public int size() {
        return blocks.size();
    }

    public List<Edge> getEdges() {
        return edges;
    }

    public int getEntry() {
        return entry;
    }

    /**
     * @return the normal exit block, or {@link #NONE} if every path panics or diverges
     */
    public int getNormalExit() {
        return normalExit;
    }

    /**
     * @return the abort exit block, or {@link #NONE} if the function never panics
     */
    public int getAbortExit() {
        return abortExit;
    }

    public boolean hasNormalExit() {
        return normalExit != NONE;
    }

    public boolean hasAbortExit() {
        return abortExit != NONE;
    }

    public List<LoopInfo> getLoops() {
        return loops;
    }

    /**
     * @return the loop whose header is {@code header}, or {@code null}
     */
    public LoopInfo getLoop(int header) {
        for (LoopInfo loop : loops) {
            if (loop.getHeader() == header) {
                return loop;
            }
        }
        return null;
    }

    public List<Annotation> getPreconditions() {
        return preconditions;
    }

    /**
     * The postcondition, implicit {@code true} if none was declared.
     */
    public Annotation getPostcondition() {
        return postcondition;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<Edge> getIncoming(int block) {
        List<Edge> incoming = new ArrayList<>();
        for (Edge edge : edges) {
            if (edge.getTarget() == block) {
                incoming.add(edge);
            }
        }
        return incoming;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("cfg ").append(functionName).append(" {\n");
        for (BasicBlock block : blocks) {
            sb.append("  ").append(block).append('\n');
            for (Instruction instruction : block.getInstructions()) {
                sb.append("    ").append(instruction).append('\n');
            }
            for (Edge edge : block.getOutgoing()) {
                sb.append("    ").append(edge).append('\n');
            }
        }
        return sb.append('}').toString();
    }
}
