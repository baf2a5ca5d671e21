package com.wp.verifier.wp;

import com.wp.verifier.cfg.BasicBlock;
import com.wp.verifier.cfg.ControlFlowGraph;
import com.wp.verifier.cfg.Edge;
import com.wp.verifier.cfg.EdgeKind;
import com.wp.verifier.cfg.Instruction;
import com.wp.verifier.cfg.LoopInfo;
import com.wp.verifier.model.Annotation;
import com.wp.verifier.model.ConditionKind;
import com.wp.verifier.model.Expr;
import com.wp.verifier.model.SourceSpan;
import com.wp.verifier.model.Substitution;
import com.wp.verifier.model.VerificationCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes weakest preconditions backwards over a {@link ControlFlowGraph} and turns them into
 * verification conditions.
 *
 * <p>Loop headers are cut points: a header exposes its invariant to its predecessors and the
 * back edge is never followed. The graph is therefore split into segments, each starting at the
 * function entry (assuming the preconditions), at a loop body (assuming invariant and guard) or
 * after a loop (assuming invariant and negated guard). Within a segment every obligation site
 * that can be reached yields one condition {@code hypothesis ==> wp(start)}, where only that site
 * contributes its predicate and every other site contributes {@code true}.
 *
 * <p>Obligation sites are the normal exit (postcondition), loop headers (invariant), check
 * instructions (assertions and call preconditions) and edges into the abort exit (which contribute
 * {@code false}). Sites whose predicate is an implicit {@code true} produce no condition.
 */
public class WpTransformer {

    private static final Logger logger = LoggerFactory.getLogger(WpTransformer.class);

    /**
     * Generates the verification conditions of a function.
     */
    public WpResult transform(ControlFlowGraph cfg) {
        Run run = new Run(cfg);
        List<VerificationCondition> conditions = run.generate();
        Map<Integer, Expr> table = run.fullTable();
        logger.debug("Generated {} verification conditions for {}", conditions.size(), cfg.getFunctionName());
        return new WpResult(cfg.getFunctionName(), table, conditions);
    }

    private enum SiteType {
        NORMAL_EXIT, LOOP_HEADER, CHECK, PANIC
    }

    /**
     * A place where some predicate must hold. Compared by identity.
     */
    private static final class Site {
        final SiteType type;
        final int block;
        final SourceSpan span;
        final String text;
        final ConditionKind checkKind;

        Site(SiteType type, int block, SourceSpan span, String text, ConditionKind checkKind) {
            this.type = type;
            this.block = block;
            this.span = span;
            this.text = text;
            this.checkKind = checkKind;
        }
    }

    private static final class Segment {
        final int start;
        final Expr hypothesis;
        final boolean entry;
        final LoopInfo exitOf;
        final boolean implicitHypothesis;

        Segment(int start, Expr hypothesis, boolean entry, LoopInfo exitOf, boolean implicitHypothesis) {
            this.start = start;
            this.hypothesis = hypothesis;
            this.entry = entry;
            this.exitOf = exitOf;
            this.implicitHypothesis = implicitHypothesis;
        }
    }

    /**
     * State of one transformation: site tables and the fresh-name counter for havoc.
     */
    private static final class Run {
        private static final Site ALL = new Site(null, -1, SourceSpan.UNKNOWN, "", null);

        private final ControlFlowGraph cfg;
        private final Site exitSite;
        private final Map<Integer, Site> headerSites = new HashMap<>();
        private final Map<Instruction, Site> checkSites = new IdentityHashMap<>();
        private final Map<Edge, Site> panicSites = new IdentityHashMap<>();
        private int fresh = 0;

        Run(ControlFlowGraph cfg) {
            this.cfg = cfg;
            Annotation post = cfg.getPostcondition();
            this.exitSite = cfg.hasNormalExit()
                    ? new Site(SiteType.NORMAL_EXIT, cfg.getNormalExit(), post.getSpan(),
                    post.getPredicate().toString(), null)
                    : null;
            for (BasicBlock block : cfg.getBlocks()) {
                if (block.isLoopHeader()) {
                    Annotation inv = block.getInvariant();
                    SourceSpan span = inv.getSpan().isKnown() ? inv.getSpan() : block.getSpan();
                    headerSites.put(block.getId(), new Site(SiteType.LOOP_HEADER, block.getId(), span,
                            inv.getPredicate().toString(), null));
                }
                for (Instruction instruction : block.getInstructions()) {
                    if (instruction instanceof Instruction.Check) {
                        Instruction.Check check = (Instruction.Check) instruction;
                        checkSites.put(check, new Site(SiteType.CHECK, block.getId(), check.getSpan(),
                                check.getDescription(), check.getKind()));
                    }
                }
                for (Edge edge : block.getOutgoing()) {
                    if (isPanicEdge(edge)) {
                        String message = edge.getLabel() != null ? edge.getLabel() : "panic";
                        panicSites.put(edge, new Site(SiteType.PANIC, block.getId(), edge.getSpan(), message, null));
                    }
                }
            }
        }

        private boolean isPanicEdge(Edge edge) {
            return edge.getKind() == EdgeKind.EARLY_EXIT && edge.getTarget() == cfg.getAbortExit();
        }

        List<VerificationCondition> generate() {
            List<VerificationCondition> conditions = new ArrayList<>();
            for (Segment segment : segments()) {
                for (Site site : reachableSites(segment.start)) {
                    if (isImplicit(site)) {
                        continue;
                    }
                    Expr wp = wp(segment.start, site, new HashMap<>());
                    Expr formula = Expr.implies(segment.hypothesis, wp);
                    formula = segment.entry ? Substitution.eraseOld(formula) : Substitution.oldAsConstants(formula);
                    String id = cfg.getFunctionName() + "#" + conditions.size();
                    ConditionKind kind = kindOf(site, segment);
                    conditions.add(new VerificationCondition(id, cfg.getFunctionName(), formula, kind, site.span,
                            describe(site, kind), segment.implicitHypothesis));
                    logger.trace("{}: {}", id, formula);
                }
            }
            return conditions;
        }

        Map<Integer, Expr> fullTable() {
            Map<Integer, Expr> memo = new HashMap<>();
            for (BasicBlock block : cfg.getBlocks()) {
                wp(block.getId(), ALL, memo);
            }
            return memo;
        }

        private List<Segment> segments() {
            List<Segment> segments = new ArrayList<>();
            List<Expr> pre = new ArrayList<>();
            for (Annotation annotation : cfg.getPreconditions()) {
                pre.add(annotation.getPredicate());
            }
            segments.add(new Segment(cfg.getEntry(), Expr.and(pre), true, null, false));
            for (LoopInfo loop : cfg.getLoops()) {
                Expr inv = loop.getInvariant().getPredicate();
                boolean implicit = loop.getInvariant().isImplicit();
                segments.add(new Segment(loop.getBodyEntry(), Expr.and(inv, loop.getGuard()), false, null, implicit));
                segments.add(new Segment(loop.getExitTarget(), Expr.and(inv, Expr.not(loop.getGuard())), false,
                        loop, implicit));
            }
            return segments;
        }

        /**
         * Sites reachable from {@code start} without passing through a loop header, in block order.
         */
        private List<Site> reachableSites(int start) {
            Set<Integer> reached = new TreeSet<>();
            Deque<Integer> waiting = new ArrayDeque<>();
            waiting.add(start);
            while (!waiting.isEmpty()) {
                int id = waiting.poll();
                if (!reached.add(id) || cfg.getBlock(id).isLoopHeader()) {
                    continue;
                }
                for (Edge edge : cfg.getBlock(id).getOutgoing()) {
                    waiting.add(edge.getTarget());
                }
            }
            List<Site> sites = new ArrayList<>();
            for (int id : reached) {
                BasicBlock block = cfg.getBlock(id);
                if (block.isLoopHeader()) {
                    sites.add(headerSites.get(id));
                    continue;
                }
                for (Instruction instruction : block.getInstructions()) {
                    Site site = checkSites.get(instruction);
                    if (site != null) {
                        sites.add(site);
                    }
                }
                for (Edge edge : block.getOutgoing()) {
                    Site site = panicSites.get(edge);
                    if (site != null) {
                        sites.add(site);
                    }
                }
                if (id == cfg.getNormalExit()) {
                    sites.add(exitSite);
                }
            }
            return sites;
        }

        private boolean isImplicit(Site site) {
            switch (site.type) {
                case NORMAL_EXIT:
                    return cfg.getPostcondition().isImplicit();
                case LOOP_HEADER:
                    return cfg.getBlock(site.block).getInvariant().isImplicit();
                default:
                    return false;
            }
        }

        private ConditionKind kindOf(Site site, Segment segment) {
            return switch (site.type) {
                case NORMAL_EXIT -> segment.exitOf != null ? ConditionKind.LOOP_USE : ConditionKind.POSTCONDITION;
                case LOOP_HEADER -> cfg.getLoop(site.block).containsBlock(segment.start)
                        ? ConditionKind.LOOP_PRESERVATION
                        : ConditionKind.LOOP_INITIATION;
                case CHECK -> site.checkKind;
                case PANIC -> ConditionKind.PANIC_FREEDOM;
            };
        }

        private String describe(Site site, ConditionKind kind) {
            return switch (kind) {
                case POSTCONDITION -> "postcondition `" + site.text + "`";
                case LOOP_USE -> "postcondition `" + site.text + "` after loop exit";
                case LOOP_INITIATION -> "invariant `" + site.text + "` holds on loop entry";
                case LOOP_PRESERVATION -> "invariant `" + site.text + "` preserved by loop body";
                case PANIC_FREEDOM -> "panic unreachable: " + site.text;
                default -> site.text;
            };
        }

        private boolean contributes(Site site, Site selected) {
            return selected == ALL || selected == site;
        }

        /**
         * Weakest precondition of {@code block} with respect to the {@code selected} site, memoised in {@code memo}.
         */
        private Expr wp(int block, Site selected, Map<Integer, Expr> memo) {
            Expr cached = memo.get(block);
            if (cached != null) {
                return cached;
            }
            BasicBlock b = cfg.getBlock(block);
            Expr post;
            switch (b.getKind()) {
                case LOOP_HEADER:
                    post = contributes(headerSites.get(block), selected) ? b.getInvariant().getPredicate() : Expr.TRUE;
                    memo.put(block, post);
                    return post;
                case ABORT_EXIT:
                    post = Expr.TRUE;
                    break;
                case NORMAL_EXIT:
                    post = contributes(exitSite, selected) ? cfg.getPostcondition().getPredicate() : Expr.TRUE;
                    break;
                default:
                    post = successors(b, selected, memo);
            }
            Expr result = backward(b, post, selected);
            memo.put(block, result);
            return result;
        }

        private Expr successors(BasicBlock block, Site selected, Map<Integer, Expr> memo) {
            List<Expr> parts = new ArrayList<>();
            for (Edge edge : block.getOutgoing()) {
                Expr target;
                Site panic = panicSites.get(edge);
                if (panic != null) {
                    target = contributes(panic, selected) ? Expr.FALSE : Expr.TRUE;
                } else {
                    target = wp(edge.getTarget(), selected, memo);
                }
                parts.add(edge.getGuard() == null ? target : Expr.implies(edge.getGuard(), target));
            }
            return parts.size() == 1 ? parts.get(0) : Expr.and(parts);
        }

        private Expr backward(BasicBlock block, Expr post, Site selected) {
            Expr q = post;
            List<Instruction> instructions = block.getInstructions();
            for (int i = instructions.size() - 1; i >= 0; i--) {
                Instruction instruction = instructions.get(i);
                if (instruction instanceof Instruction.Assign) {
                    Instruction.Assign assign = (Instruction.Assign) instruction;
                    q = Substitution.replace(q, assign.getTarget().getName(), assign.getValue());
                } else if (instruction instanceof Instruction.Check) {
                    Instruction.Check check = (Instruction.Check) instruction;
                    q = contributes(checkSites.get(check), selected)
                            ? Expr.and(check.getCondition(), q)
                            : Expr.implies(check.getCondition(), q);
                } else if (instruction instanceof Instruction.Assume) {
                    q = Expr.implies(((Instruction.Assume) instruction).getCondition(), q);
                } else if (instruction instanceof Instruction.Havoc) {
                    Expr.Variable target = ((Instruction.Havoc) instruction).getTarget();
                    Expr.Variable renamed = Expr.var(target.getName() + "#" + (fresh++), target.getType());
                    q = Substitution.replace(q, target.getName(), renamed);
                }
            }
            return q;
        }
    }
}
