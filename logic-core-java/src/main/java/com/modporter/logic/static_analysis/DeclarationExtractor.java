package com.modporter.logic.static_analysis;

import com.modporter.logic.ir.IrModel.ClassSummary;
import com.modporter.logic.ir.IrModel.FieldSummary;
import com.modporter.logic.ir.IrModel.MethodSummary;
import com.modporter.logic.ir.IrModel.NodeKind;
import com.modporter.logic.ir.IrModel.NodeMetadata;
import com.modporter.logic.ir.IrModel.SyntaxNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Harvests class, method and field declarations from a syntax tree, nested scopes included.
 * Results are in source (pre-order) order.
 */
public class DeclarationExtractor {

    public List<ClassSummary> extractClasses(List<SyntaxNode> nodes) {
        List<ClassSummary> classes = new ArrayList<>();
        for (SyntaxNode node : preOrder(nodes)) {
            if (node.kind() == NodeKind.CLASS_DECLARATION) {
                classes.add(new ClassSummary(
                        node.label(),
                        modifiersOf(node),
                        directMembers(node, NodeKind.METHOD_DECLARATION).stream().map(this::toMethod).toList(),
                        directMembers(node, NodeKind.FIELD_DECLARATION).stream().map(this::toField).toList(),
                        node.position().line()));
            }
        }
        return classes;
    }

    public List<MethodSummary> extractMethods(List<SyntaxNode> nodes) {
        List<MethodSummary> methods = new ArrayList<>();
        for (SyntaxNode node : preOrder(nodes)) {
            if (node.kind() == NodeKind.METHOD_DECLARATION) {
                methods.add(toMethod(node));
            }
        }
        return methods;
    }

    private MethodSummary toMethod(SyntaxNode node) {
        NodeMetadata meta = node.metadata();
        String returnType = meta.returnType() != null ? meta.returnType() : "void";
        return new MethodSummary(node.label(), returnType, meta.parameterNames(), meta.modifiers(),
                node.position().line(), meta.mappable());
    }

    private FieldSummary toField(SyntaxNode node) {
        return new FieldSummary(node.label(), modifiersOf(node), node.position().line());
    }

    private static List<String> modifiersOf(SyntaxNode node) {
        return node.metadata() != null ? node.metadata().modifiers() : List.of();
    }

    /** Members declared in the class body itself, not in nested classes. */
    private static List<SyntaxNode> directMembers(SyntaxNode classNode, NodeKind kind) {
        List<SyntaxNode> members = new ArrayList<>();
        for (SyntaxNode child : classNode.children()) {
            if (child.kind() == kind) members.add(child);
        }
        return members;
    }

    private static List<SyntaxNode> preOrder(List<SyntaxNode> roots) {
        List<SyntaxNode> ordered = new ArrayList<>();
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) stack.push(roots.get(i));
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            ordered.add(node);
            List<SyntaxNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) stack.push(children.get(i));
        }
        return ordered;
    }
}
