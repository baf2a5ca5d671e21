package com.wp.verifier.cfg;

import com.wp.verifier.ast.FunctionDecl;
import com.wp.verifier.ast.Stmt;
import com.wp.verifier.model.Annotation;
import com.wp.verifier.model.ConditionKind;
import com.wp.verifier.model.Diagnostic;
import com.wp.verifier.model.Expr;
import com.wp.verifier.model.MethodContract;
import com.wp.verifier.model.Parameter;
import com.wp.verifier.model.SourceSpan;
import com.wp.verifier.model.Substitution;
import com.wp.verifier.model.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.wp.verifier.cfg.ControlFlowGraph.NONE;

/**
 * Translates a function body into a {@link ControlFlowGraph}.
 *
 * <p>Straight-line statements accumulate in the current block until a control construct ends it.
 * Join blocks and exit blocks are created only when some edge needs them, so every block of the
 * result is reachable from the entry and statements after an unconditional exit are dropped.
 *
 * <p>Calls are summarised by the contract of the callee when one is known: the arguments are
 * copied to fresh temporaries, the callee's preconditions become checks, the assigned variable is
 * havocked and the postconditions are assumed.
 *
 * <p>Instances hold no per-function state and may be shared between threads.
 */
public class CfgBuilder {

    private static final Logger logger = LoggerFactory.getLogger(CfgBuilder.class);

    private final ContractLookup contracts;

    public CfgBuilder() {
        this(ContractLookup.none());
    }

    public CfgBuilder(ContractLookup contracts) {
        this.contracts = contracts;
    }

    /**
     * Builds and validates the CFG of a function.
     *
     * @param function the function to translate
     * @return the immutable graph
     * @throws CfgConstructionException if the body contains a construct that cannot be represented
     */
    public ControlFlowGraph build(FunctionDecl function) throws CfgConstructionException {
        ControlFlowGraph cfg = new Construction(function).run();
        CfgCheck.check(cfg);
        logger.debug("Built CFG for {}: {} blocks, {} edges, {} loops",
                function.getQualifiedName(), cfg.size(), cfg.getEdges().size(), cfg.getLoops().size());
        return cfg;
    }

    /**
     * Mutable block used while the graph is under construction.
     */
    private static final class Draft {
        final int id;
        BlockKind kind;
        final List<Instruction> instructions = new ArrayList<>();
        Annotation invariant;
        final SourceSpan span;

        Draft(int id, BlockKind kind, SourceSpan span) {
            this.id = id;
            this.kind = kind;
            this.span = span;
        }
    }

    private static final class LoopFrame {
        final int header;
        final int exit;
        final List<Stmt> update;

        LoopFrame(int header, int exit, List<Stmt> update) {
            this.header = header;
            this.exit = exit;
            this.update = update;
        }
    }

    /**
     * State of a single translation.
     */
    private final class Construction {
        private final FunctionDecl function;
        private final List<Draft> drafts = new ArrayList<>();
        private final List<Edge> edges = new ArrayList<>();
        private final List<LoopInfo> loops = new ArrayList<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private final Deque<LoopFrame> loopStack = new ArrayDeque<>();
        private int normalExit = NONE;
        private int abortExit = NONE;
        private int temporaries = 0;

        Construction(FunctionDecl function) {
            this.function = function;
        }

        ControlFlowGraph run() throws CfgConstructionException {
            diagnostics.addAll(function.getDiagnostics());

            int entry = newBlock(BlockKind.NORMAL, function.getSpan());
            int end = lower(function.getBody(), entry);
            if (end != NONE) {
                if (normalExit == NONE) {
                    // no early return: the final block is the exit
                    drafts.get(end).kind = BlockKind.NORMAL_EXIT;
                    normalExit = end;
                } else {
                    addEdge(end, normalExit, EdgeKind.FALLTHROUGH, null, function.getSpan(), null);
                }
            }

            Annotation postcondition = function.getPostcondition();
            if (postcondition == null) {
                postcondition = Annotation.implicitTrue(Annotation.Kind.POSTCONDITION, function.getSpan());
                diagnostics.add(new Diagnostic(Diagnostic.Severity.INFO, Diagnostic.Code.MISSING_POSTCONDITION,
                        "function '" + function.getQualifiedName() + "' has no postcondition; assuming `true`",
                        function.getSpan()));
            }

            return new ControlFlowGraph(function.getQualifiedName(), freeze(), edges, entry, normalExit, abortExit,
                    loops, function.getPreconditions(), postcondition, diagnostics);
        }

        private List<BasicBlock> freeze() {
            Map<Integer, List<Edge>> outgoing = new HashMap<>();
            for (Edge edge : edges) {
                outgoing.computeIfAbsent(edge.getSource(), k -> new ArrayList<>()).add(edge);
            }
            List<BasicBlock> blocks = new ArrayList<>(drafts.size());
            for (Draft draft : drafts) {
                blocks.add(new BasicBlock(draft.id, draft.kind, draft.instructions,
                        outgoing.getOrDefault(draft.id, Collections.emptyList()), draft.invariant, draft.span));
            }
            return blocks;
        }

        private int newBlock(BlockKind kind, SourceSpan span) {
            Draft draft = new Draft(drafts.size(), kind, span);
            drafts.add(draft);
            return draft.id;
        }

        private void addEdge(int source, int target, EdgeKind kind, Expr guard, SourceSpan span, String label) {
            edges.add(new Edge(source, target, kind, guard, span, label));
        }

        private void emit(int block, Instruction instruction) {
            drafts.get(block).instructions.add(instruction);
        }

        private int normalExit() {
            if (normalExit == NONE) {
                normalExit = newBlock(BlockKind.NORMAL_EXIT, function.getSpan());
            }
            return normalExit;
        }

        private int abortExit() {
            if (abortExit == NONE) {
                abortExit = newBlock(BlockKind.ABORT_EXIT, function.getSpan());
            }
            return abortExit;
        }

        /**
         * Lowers a statement list starting in block {@code current}.
         *
         * @return the block control falls out of, or {@link ControlFlowGraph#NONE} if it never does
         */
        private int lower(List<Stmt> statements, int current) throws CfgConstructionException {
            for (Stmt stmt : statements) {
                if (current == NONE) {
                    logger.debug("Dropping unreachable statement '{}' at {}", stmt, stmt.getSpan());
                    break;
                }
                current = lower(stmt, current);
            }
            return current;
        }

        private int lower(Stmt stmt, int current) throws CfgConstructionException {
            if (stmt instanceof Stmt.Assign) {
                Stmt.Assign assign = (Stmt.Assign) stmt;
                emit(current, new Instruction.Assign(assign.getTarget(), assign.getValue()));
                return current;
            } else if (stmt instanceof Stmt.Assert) {
                Expr condition = ((Stmt.Assert) stmt).getCondition();
                emit(current, new Instruction.Check(condition, ConditionKind.ASSERTION, stmt.getSpan(),
                        "assertion `" + condition + "`"));
                return current;
            } else if (stmt instanceof Stmt.Invoke) {
                lowerInvoke((Stmt.Invoke) stmt, current);
                return current;
            } else if (stmt instanceof Stmt.If) {
                return lowerIf((Stmt.If) stmt, current);
            } else if (stmt instanceof Stmt.While) {
                Stmt.While loop = (Stmt.While) stmt;
                return lowerLoop(loop.getCondition(), loop.getInvariant(), loop.getBody(), loop.getUpdate(),
                        loop.getSpan(), current);
            } else if (stmt instanceof Stmt.ForRange) {
                return lowerForRange((Stmt.ForRange) stmt, current);
            } else if (stmt instanceof Stmt.Return) {
                Expr value = ((Stmt.Return) stmt).getValue();
                if (value != null) {
                    emit(current, new Instruction.Assign(Expr.var(Expr.RESULT, value.getType()), value));
                }
                addEdge(current, normalExit(), EdgeKind.EARLY_EXIT, null, stmt.getSpan(), null);
                return NONE;
            } else if (stmt instanceof Stmt.Panic) {
                addEdge(current, abortExit(), EdgeKind.EARLY_EXIT, null, stmt.getSpan(),
                        ((Stmt.Panic) stmt).getMessage());
                return NONE;
            } else if (stmt instanceof Stmt.Break) {
                LoopFrame frame = enclosingLoop(stmt);
                addEdge(current, frame.exit, EdgeKind.FALLTHROUGH, null, stmt.getSpan(), null);
                return NONE;
            } else if (stmt instanceof Stmt.Continue) {
                LoopFrame frame = enclosingLoop(stmt);
                int last = lower(frame.update, current);
                if (last != NONE) {
                    addEdge(last, frame.header, EdgeKind.LOOP_BACK, null, stmt.getSpan(), null);
                }
                return NONE;
            } else if (stmt instanceof Stmt.Unsupported) {
                throw new CfgConstructionException("unsupported statement in '" + function.getQualifiedName() + "': "
                        + ((Stmt.Unsupported) stmt).getDescription(), stmt.getSpan());
            }
            throw new CfgConstructionException("unknown statement kind " + stmt.getClass().getSimpleName(),
                    stmt.getSpan());
        }

        private LoopFrame enclosingLoop(Stmt stmt) throws CfgConstructionException {
            LoopFrame frame = loopStack.peek();
            if (frame == null) {
                throw new CfgConstructionException("'" + stmt + "' outside of a loop", stmt.getSpan());
            }
            return frame;
        }

        private int lowerIf(Stmt.If stmt, int current) throws CfgConstructionException {
            Expr condition = stmt.getCondition();

            int thenEntry = newBlock(BlockKind.NORMAL, stmt.getSpan());
            addEdge(current, thenEntry, EdgeKind.CONDITIONAL_TRUE, condition, stmt.getSpan(), null);
            int thenEnd = lower(stmt.getThenBranch(), thenEntry);

            int join = NONE;
            if (stmt.hasElse()) {
                int elseEntry = newBlock(BlockKind.NORMAL, stmt.getSpan());
                addEdge(current, elseEntry, EdgeKind.CONDITIONAL_FALSE, Expr.not(condition), stmt.getSpan(), null);
                int elseEnd = lower(stmt.getElseBranch(), elseEntry);
                if (thenEnd != NONE || elseEnd != NONE) {
                    join = newBlock(BlockKind.NORMAL, stmt.getSpan());
                }
                if (elseEnd != NONE) {
                    addEdge(elseEnd, join, EdgeKind.FALLTHROUGH, null, stmt.getSpan(), null);
                }
            } else {
                join = newBlock(BlockKind.NORMAL, stmt.getSpan());
                addEdge(current, join, EdgeKind.CONDITIONAL_FALSE, Expr.not(condition), stmt.getSpan(), null);
            }
            if (thenEnd != NONE) {
                addEdge(thenEnd, join, EdgeKind.FALLTHROUGH, null, stmt.getSpan(), null);
            }
            return join;
        }

        private int lowerForRange(Stmt.ForRange stmt, int current) throws CfgConstructionException {
            Expr.Variable variable = stmt.getVariable();
            emit(current, new Instruction.Assign(variable, stmt.getLower()));
            Expr condition = stmt.isInclusive()
                    ? Expr.le(variable, stmt.getUpper())
                    : Expr.lt(variable, stmt.getUpper());
            List<Stmt> update = Collections.singletonList(
                    new Stmt.Assign(variable, Expr.add(variable, Expr.intLit(1)), stmt.getSpan()));
            return lowerLoop(condition, stmt.getInvariant(), stmt.getBody(), update, stmt.getSpan(), current);
        }

        private int lowerLoop(Expr condition, Annotation invariant, List<Stmt> body, List<Stmt> update,
                              SourceSpan span, int current) throws CfgConstructionException {
            if (invariant == null) {
                invariant = Annotation.implicitTrue(Annotation.Kind.INVARIANT, span);
                diagnostics.add(new Diagnostic(Diagnostic.Severity.WARNING, Diagnostic.Code.MISSING_INVARIANT,
                        "loop `while " + condition + "` has no invariant; assuming `true`", span));
                logger.warn("Missing loop invariant in {} at {}", function.getQualifiedName(), span);
            }

            int header = newBlock(BlockKind.LOOP_HEADER, span);
            drafts.get(header).invariant = invariant;
            addEdge(current, header, EdgeKind.FALLTHROUGH, null, span, null);

            int exit = newBlock(BlockKind.NORMAL, span);
            int bodyEntry = newBlock(BlockKind.NORMAL, span);
            addEdge(header, bodyEntry, EdgeKind.CONDITIONAL_TRUE, condition, span, null);
            addEdge(header, exit, EdgeKind.CONDITIONAL_FALSE, Expr.not(condition), span, null);

            loopStack.push(new LoopFrame(header, exit, update));
            int bodyEnd = lower(body, bodyEntry);
            if (bodyEnd != NONE) {
                bodyEnd = lower(update, bodyEnd);
            }
            if (bodyEnd != NONE) {
                addEdge(bodyEnd, header, EdgeKind.LOOP_BACK, null, span, null);
            }
            loopStack.pop();

            Set<Integer> bodyBlocks = new HashSet<>();
            for (int id = bodyEntry; id < drafts.size(); id++) {
                if (!drafts.get(id).kind.isExit()) {
                    bodyBlocks.add(id);
                }
            }
            loops.add(new LoopInfo(header, bodyEntry, exit, condition, invariant, bodyBlocks, span));
            return exit;
        }

        private void lowerInvoke(Stmt.Invoke call, int current) {
            Expr.Variable target = call.getTarget();
            MethodContract contract = call.isReceiverCall()
                    ? null
                    : contracts.find(function.getOwner(), call.getCallee(), call.getArguments().size());

            if (contract == null) {
                if (target == null) {
                    logger.debug("Call to {} without contract has no logical effect", call.getCallee());
                } else if (call.isReceiverCall()) {
                    emit(current, new Instruction.Assign(target,
                            Expr.opaque(call.toString(), "value of a call through a receiver", target.getType())));
                } else {
                    emit(current, new Instruction.Assign(target,
                            Expr.apply(call.getCallee(), target.getType(), call.getArguments())));
                }
                return;
            }

            int site = temporaries++;
            Map<String, Expr> binding = new HashMap<>();
            List<Parameter> params = contract.getParameters();
            for (int i = 0; i < params.size(); i++) {
                Parameter param = params.get(i);
                Expr.Variable temp = Expr.var(call.getCallee() + "$" + param.getName() + "#" + site, param.getType());
                emit(current, new Instruction.Assign(temp, call.getArguments().get(i)));
                binding.put(param.getName(), temp);
            }
            Substitution toCallSite = new Substitution(binding);

            for (Expr pre : contract.getPreconditions()) {
                Expr condition = toCallSite.transform(Substitution.eraseOld(pre));
                emit(current, new Instruction.Check(condition, ConditionKind.CALL_PRECONDITION, call.getSpan(),
                        "precondition `" + pre + "` of call to " + call.getCallee()));
            }

            Type resultType = contract.getReturnType() != null ? contract.getReturnType() : Type.INT;
            Expr.Variable result = target != null
                    ? target
                    : Expr.var(call.getCallee() + "$result#" + site, resultType);
            emit(current, new Instruction.Havoc(result));
            Map<String, Expr> resultBinding = new HashMap<>(binding);
            resultBinding.put(Expr.RESULT, result);
            Substitution afterCall = new Substitution(resultBinding);
            for (Expr post : contract.getPostconditions()) {
                emit(current, new Instruction.Assume(afterCall.transform(Substitution.eraseOld(post))));
            }
        }
    }
}
