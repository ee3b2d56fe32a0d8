package com.modporter.logic.static_analysis;

import com.modporter.logic.ir.IrModel.ComplexityMetrics;
import com.modporter.logic.ir.IrModel.SyntaxNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Derives ComplexityMetrics from a node sequence.
 *
 * Cyclomatic complexity starts at 1 and grows only at decision points. Cognitive
 * complexity adds {@code weight * max(depth, 1)} for every node. Depth grows only when
 * descending into a nesting kind. Uses an explicit stack, so deep trees cannot
 * overflow the call stack.
 */
public class ComplexityCalculator {

    private record Frame(SyntaxNode node, int depth) {}

    public ComplexityMetrics calculate(List<SyntaxNode> nodes) {
        int cyclomatic = 1;
        int cognitive = 0;
        int maxDepth = 0;
        Set<Integer> lines = new HashSet<>();

        Deque<Frame> stack = new ArrayDeque<>();
        for (int i = nodes.size() - 1; i >= 0; i--) {
            stack.push(new Frame(nodes.get(i), 0));
        }

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            SyntaxNode node = frame.node();
            int weight = NodeRules.complexityWeight(node.kind());

            maxDepth = Math.max(maxDepth, frame.depth());
            if (node.kind().isDecisionPoint()) {
                cyclomatic += weight;
            }
            cognitive += weight * Math.max(frame.depth(), 1);
            if (node.position() != null && node.position().line() > 0) {
                lines.add(node.position().line());
            }

            int childDepth = node.kind().isNesting() ? frame.depth() + 1 : frame.depth();
            List<SyntaxNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Frame(children.get(i), childDepth));
            }
        }

        return new ComplexityMetrics(cyclomatic, cognitive, lines.size(), maxDepth);
    }
}
