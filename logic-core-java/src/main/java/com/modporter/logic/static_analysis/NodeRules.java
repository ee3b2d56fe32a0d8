package com.modporter.logic.static_analysis;

import com.modporter.logic.ir.IrModel.NodeKind;
import com.modporter.logic.ir.IrModel.NodeMetadata;

import java.util.List;
import java.util.Set;

/**
 * Per-kind metadata tables: complexity weights, Java category names and the
 * allow-lists that decide whether a method or call site has a known Bedrock equivalent.
 * Not mappable means "needs manual translation", not "invalid".
 */
public final class NodeRules {

    private NodeRules() {}

    private static final Set<String> MAPPABLE_METHODS = Set.of("tick", "onUse", "onPlace", "onBreak");

    private static final Set<String> MAPPABLE_CALLS = Set.of("getWorld", "getPlayer", "sendMessage");

    public static int complexityWeight(NodeKind kind) {
        return switch (kind) {
            case IF_STATEMENT, SWITCH_STATEMENT, METHOD_CALL -> 1;
            case WHILE_LOOP, FOR_LOOP, TRY_STATEMENT -> 2;
            case CLASS_DECLARATION, METHOD_DECLARATION, FIELD_DECLARATION, ASSIGNMENT,
                 COMMENT, GENERIC_STATEMENT -> 0;
        };
    }

    public static String javaCategory(NodeKind kind) {
        return switch (kind) {
            case CLASS_DECLARATION -> "class";
            case METHOD_DECLARATION -> "method";
            case FIELD_DECLARATION -> "field";
            case IF_STATEMENT, FOR_LOOP, WHILE_LOOP, SWITCH_STATEMENT, TRY_STATEMENT -> "control_flow";
            case METHOD_CALL -> "method_call";
            case ASSIGNMENT -> "assignment";
            case COMMENT -> "comment";
            case GENERIC_STATEMENT -> "generic";
        };
    }

    public static boolean isMethodMappable(String methodName) {
        return MAPPABLE_METHODS.contains(methodName);
    }

    /** Call sites are matched on the last segment of a dotted name ({@code world.getPlayer} -> getPlayer). */
    public static boolean isCallMappable(String dottedName) {
        int dot = dottedName.lastIndexOf('.');
        return MAPPABLE_CALLS.contains(dot < 0 ? dottedName : dottedName.substring(dot + 1));
    }

    static NodeMetadata metadataFor(NodeKind kind, String label) {
        boolean mappable = switch (kind) {
            case METHOD_DECLARATION -> isMethodMappable(label);
            case METHOD_CALL -> isCallMappable(label);
            case GENERIC_STATEMENT -> false;
            case CLASS_DECLARATION, FIELD_DECLARATION, IF_STATEMENT, FOR_LOOP, WHILE_LOOP,
                 SWITCH_STATEMENT, TRY_STATEMENT, ASSIGNMENT, COMMENT -> true;
        };
        return new NodeMetadata(javaCategory(kind), complexityWeight(kind), mappable, null, List.of(), List.of());
    }

    static NodeMetadata declarationMetadata(NodeKind kind, String label, String returnType,
                                            List<String> parameterNames, List<String> modifiers) {
        NodeMetadata base = metadataFor(kind, label);
        return new NodeMetadata(base.javaCategory(), base.complexityWeight(), base.mappable(),
                returnType, parameterNames, modifiers);
    }
}
