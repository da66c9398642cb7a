package org.cbug.analyzer.prepwork.cfg;

import org.cbug.analyzer.prepwork.StandardLibrary;
import org.cbug.analyzer.prepwork.cfg.impl.ControlFlowGraphImpl;
import org.cbug.analyzer.syntax.ConstantFolder;
import org.cbug.analyzer.syntax.FunctionDefinition;
import org.cbug.analyzer.syntax.expression.CallExpression;
import org.cbug.analyzer.syntax.expression.CommaExpression;
import org.cbug.analyzer.syntax.expression.Expression;
import org.cbug.analyzer.syntax.statement.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Builds the control flow graph of one function.
 * <p>
 * Sequential statements share a basic block; conditions of {@code if}, loops and {@code switch} get their own
 * node with typed outgoing edges. Join nodes, {@code for} update nodes and label targets are only created
 * when something flows into them. Code that cannot be reached is still placed in nodes, which then have no
 * predecessors. One builder builds one graph.
 */
public class ControlFlowBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(ControlFlowBuilder.class);

    private final FunctionDefinition function;
    private final List<CFGNode> nodes = new ArrayList<>();
    private final CFGNode entry;
    private final CFGNode exit;
    private final Deque<JumpTargets> jumpTargets = new ArrayDeque<>();
    private final Deque<CFGNode> switchNodes = new ArrayDeque<>();
    private final Map<String, Target> labels = new HashMap<>();
    private final Set<String> definedLabels = new HashSet<>();
    private final List<ComputeLoopRegions.LoopStart> loopStarts = new ArrayList<>();

    // null when the current point cannot be reached
    private CFGNode current;
    // the kind of the edge that leaves 'current' towards the next node
    private EdgeKind pending = EdgeKind.UNCONDITIONAL;

    /*
    a node that is only created when the first edge arrives
     */
    private final class Target {
        private final CFGNode.Kind kind;
        private CFGNode node;

        Target() {
            this(CFGNode.Kind.BASIC);
        }

        Target(CFGNode.Kind kind) {
            this.kind = kind;
        }

        Target(CFGNode node) {
            this.kind = node.kind();
            this.node = node;
        }

        CFGNode node() {
            if (node == null) node = newNode(kind);
            return node;
        }

        boolean isUsed() {
            return node != null;
        }
    }

    // continueTarget is null for a switch
    private record JumpTargets(Target breakTarget, Target continueTarget) {
    }

    public ControlFlowBuilder(FunctionDefinition function) {
        this.function = function;
        this.entry = newNode(CFGNode.Kind.ENTRY);
        this.exit = newNode(CFGNode.Kind.EXIT);
    }

    public static ControlFlowGraph build(FunctionDefinition function) {
        return new ControlFlowBuilder(function).build();
    }

    public ControlFlowGraph build() {
        current = entry;
        statement(function.body());
        flowTo(exit);
        for (Map.Entry<String, Target> e : labels.entrySet()) {
            if (!definedLabels.contains(e.getKey()) && e.getValue().isUsed()) {
                LOGGER.debug("Label {} is not defined in {}", e.getKey(), function.name());
                CFGNode.connect(e.getValue().node(), exit, EdgeKind.UNCONDITIONAL);
            }
        }
        List<LoopRegion> loopRegions = loopStarts.stream().map(ComputeLoopRegions::go).toList();
        ControlFlowGraph cfg = new ControlFlowGraphImpl(function, entry, exit, nodes, loopRegions);
        LOGGER.debug("CFG of {}: {} nodes, {} loops", function.name(), nodes.size(), loopRegions.size());
        return cfg;
    }

    private CFGNode newNode(CFGNode.Kind kind) {
        CFGNode node = new CFGNode(nodes.size(), kind);
        nodes.add(node);
        return node;
    }

    private void flowTo(CFGNode target) {
        if (current != null) CFGNode.connect(current, target, pending);
        current = target;
        pending = EdgeKind.UNCONDITIONAL;
    }

    /*
    ends the current block with an edge of the given kind; when we are right after a condition,
    an empty block keeps the branch edge
     */
    private void jump(Target target, EdgeKind kind) {
        if (current != null) {
            if (pending != EdgeKind.UNCONDITIONAL) flowTo(newNode(CFGNode.Kind.BASIC));
            CFGNode.connect(current, target.node(), kind);
        }
        current = null;
        pending = EdgeKind.UNCONDITIONAL;
    }

    private CFGNode block() {
        if (current == null || current.kind() != CFGNode.Kind.BASIC || !current.successors().isEmpty()
            || pending != EdgeKind.UNCONDITIONAL) {
            flowTo(newNode(CFGNode.Kind.BASIC));
        }
        return current;
    }

    private CFGNode ownNode(CFGNode.Kind kind, CFGElement element) {
        CFGNode node = newNode(kind);
        node.add(element);
        flowTo(node);
        return node;
    }

    private void continueAt(Target target) {
        current = target.isUsed() ? target.node() : null;
        pending = EdgeKind.UNCONDITIONAL;
    }

    private void statement(Statement statement) {
        if (statement instanceof Block block) {
            block.statements().forEach(this::statement);
        } else if (statement instanceof DeclarationStatement ds) {
            ds.declarations().forEach(vd -> block().add(new DeclarationElement(vd)));
        } else if (statement instanceof ExpressionStatement es) {
            expressionStatement(es.expression());
        } else if (statement instanceof IfStatement is) {
            ifStatement(is);
        } else if (statement instanceof WhileStatement ws) {
            whileOrFor(ws, ws.condition(), null, ws.body());
        } else if (statement instanceof ForStatement fs) {
            if (fs.initializer() != null) statement(fs.initializer());
            whileOrFor(fs, fs.condition(), fs.update(), fs.body());
        } else if (statement instanceof DoWhileStatement dws) {
            doWhile(dws);
        } else if (statement instanceof SwitchStatement ss) {
            switchStatement(ss);
        } else if (statement instanceof CaseStatement cs) {
            caseLabel(cs);
        } else if (statement instanceof ReturnStatement rs) {
            block().add(new ReturnElement(rs.value(), rs.location()));
            jump(new Target(exit), EdgeKind.UNCONDITIONAL);
        } else if (statement instanceof BreakStatement bs) {
            JumpTargets targets = jumpTargets.peek();
            if (targets == null) {
                LOGGER.debug("break outside loop or switch at {}", bs.location());
                current = null;
            } else {
                jump(targets.breakTarget(), EdgeKind.BREAK);
            }
        } else if (statement instanceof ContinueStatement cs) {
            Target target = jumpTargets.stream().map(JumpTargets::continueTarget).filter(Objects::nonNull)
                    .findFirst().orElse(null);
            if (target == null) {
                LOGGER.debug("continue outside loop at {}", cs.location());
                current = null;
            } else {
                jump(target, EdgeKind.CONTINUE);
            }
        } else if (statement instanceof GotoStatement gs) {
            if (current != null) {
                jump(labels.computeIfAbsent(gs.label(), l -> new Target()), EdgeKind.UNCONDITIONAL);
            }
        } else if (statement instanceof LabeledStatement ls) {
            definedLabels.add(ls.label());
            CFGNode node = labels.computeIfAbsent(ls.label(), l -> new Target()).node();
            flowTo(node);
            statement(ls.statement());
        } else if (statement instanceof UnknownStatement us) {
            ownNode(CFGNode.Kind.UNKNOWN_EFFECT, new UnknownEffectElement(us));
        } else if (!(statement instanceof EmptyStatement)) {
            throw new UnsupportedOperationException("Statement " + statement.getClass().getSimpleName());
        }
    }

    private void expressionStatement(Expression expression) {
        CFGNode node = block();
        node.add(new ExpressionElement(expression));
        if (terminatesProgram(expression)) {
            node.setProgramExit();
            current = null;
        }
    }

    private static boolean terminatesProgram(Expression expression) {
        Expression e = expression.withoutCasts();
        if (e instanceof CommaExpression ce) {
            return ce.expressions().stream().anyMatch(ControlFlowBuilder::terminatesProgram);
        }
        return e instanceof CallExpression call && call.callee() != null
               && StandardLibrary.isNoReturn(call.callee());
    }

    private void ifStatement(IfStatement is) {
        CFGNode branch = ownNode(CFGNode.Kind.BRANCH, new ConditionElement(is.condition(), is));
        Target join = new Target();
        pending = EdgeKind.TRUE_BRANCH;
        statement(is.thenStatement());
        if (current != null) flowTo(join.node());
        current = branch;
        pending = EdgeKind.FALSE_BRANCH;
        if (is.elseStatement() != null) statement(is.elseStatement());
        if (current != null) flowTo(join.node());
        continueAt(join);
    }

    private void whileOrFor(LoopStatement loop, Expression condition, Expression update, Statement body) {
        CFGNode header = newNode(CFGNode.Kind.LOOP_HEADER);
        if (condition != null) header.add(new ConditionElement(condition, loop));
        flowTo(header);
        Boolean truth = condition == null ? Boolean.TRUE : ConstantFolder.truthValue(condition);
        Target breakTarget = new Target();
        Target updateTarget = update == null ? new Target(header) : new Target();
        jumpTargets.push(new JumpTargets(breakTarget, updateTarget));
        if (Boolean.FALSE.equals(truth)) {
            current = null;
        } else {
            pending = EdgeKind.TRUE_BRANCH;
        }
        statement(body);
        jumpTargets.pop();
        if (update == null) {
            if (current != null) jump(updateTarget, EdgeKind.LOOP_BACK);
        } else {
            if (current != null) flowTo(updateTarget.node());
            if (updateTarget.isUsed()) {
                CFGNode updateNode = updateTarget.node();
                updateNode.add(new ExpressionElement(update));
                CFGNode.connect(updateNode, header, EdgeKind.LOOP_BACK);
            }
        }
        if (!Boolean.TRUE.equals(truth)) {
            CFGNode.connect(header, breakTarget.node(), EdgeKind.FALSE_BRANCH);
        }
        CFGNode bodyEntry = header.successors().stream().filter(e -> e.kind() == EdgeKind.TRUE_BRANCH)
                .map(CFGEdge::target).findFirst().orElse(null);
        loopStarts.add(new ComputeLoopRegions.LoopStart(loop, header, header, bodyEntry));
        continueAt(breakTarget);
    }

    private void doWhile(DoWhileStatement dws) {
        CFGNode bodyStart = newNode(CFGNode.Kind.BASIC);
        flowTo(bodyStart);
        Boolean truth = ConstantFolder.truthValue(dws.condition());
        Target breakTarget = new Target();
        Target conditionTarget = new Target(CFGNode.Kind.BRANCH);
        jumpTargets.push(new JumpTargets(breakTarget, conditionTarget));
        statement(dws.body());
        jumpTargets.pop();
        if (current != null) flowTo(conditionTarget.node());
        CFGNode conditionNode = null;
        if (conditionTarget.isUsed()) {
            conditionNode = conditionTarget.node();
            conditionNode.add(new ConditionElement(dws.condition(), dws));
            if (!Boolean.FALSE.equals(truth)) CFGNode.connect(conditionNode, bodyStart, EdgeKind.LOOP_BACK);
            if (!Boolean.TRUE.equals(truth)) CFGNode.connect(conditionNode, breakTarget.node(), EdgeKind.FALSE_BRANCH);
        }
        loopStarts.add(new ComputeLoopRegions.LoopStart(dws, bodyStart, conditionNode, bodyStart));
        continueAt(breakTarget);
    }

    private void switchStatement(SwitchStatement ss) {
        CFGNode switchNode = ownNode(CFGNode.Kind.SWITCH, new ConditionElement(ss.selector(), ss));
        Target breakTarget = new Target();
        jumpTargets.push(new JumpTargets(breakTarget, null));
        switchNodes.push(switchNode);
        current = null;
        statement(ss.body());
        switchNodes.pop();
        jumpTargets.pop();
        if (switchNode.successors().stream().noneMatch(e -> e.kind() == EdgeKind.FALSE_BRANCH)) {
            CFGNode.connect(switchNode, breakTarget.node(), EdgeKind.FALSE_BRANCH);
        }
        if (current != null) flowTo(breakTarget.node());
        continueAt(breakTarget);
    }

    private void caseLabel(CaseStatement cs) {
        CFGNode switchNode = switchNodes.peek();
        if (switchNode == null) {
            LOGGER.debug("case label outside switch at {}", cs.location());
            return;
        }
        CFGNode caseNode = newNode(CFGNode.Kind.BASIC);
        CFGNode.connect(switchNode, caseNode, cs.isDefault() ? EdgeKind.FALSE_BRANCH : EdgeKind.TRUE_BRANCH);
        flowTo(caseNode);
    }
}
