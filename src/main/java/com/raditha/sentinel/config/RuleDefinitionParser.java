package com.raditha.sentinel.config;

import com.raditha.sentinel.model.BinaryOperator;
import com.raditha.sentinel.model.NodeKind;
import com.raditha.sentinel.rule.ChildShape;
import com.raditha.sentinel.rule.InvariantRule;
import com.raditha.sentinel.rule.OperandSide;
import com.raditha.sentinel.rule.OperationPredicate;
import com.raditha.sentinel.rule.OperationPredicate.BinaryPredicate;
import com.raditha.sentinel.rule.OperationPredicate.CallPredicate;
import com.raditha.sentinel.rule.OperationPredicate.TypeConversionPredicate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns the {@code invariants} section of the YAML configuration into {@link InvariantRule}s.
 * <p>
 * Each operation entry is a single-key map naming the operation kind:
 * <pre>
 * operations:
 *   - type_conversion: {literal: "0", target_type: address}
 *   - binary: {operator: "==", result_of: 0, reference_side: right, named_local: _to}
 *   - call: {signature: "require(bool,string)", argument: 0, result_of: 1}
 * </pre>
 */
public final class RuleDefinitionParser {

    private RuleDefinitionParser() {
    }

    public static List<InvariantRule> parseAll(List<?> definitions) {
        List<InvariantRule> rules = new ArrayList<>();
        for (int i = 0; i < definitions.size(); i++) {
            Object definition = definitions.get(i);
            if (!(definition instanceof Map<?, ?> map)) {
                throw new IllegalArgumentException("Invariant #" + i + " must be a mapping");
            }
            rules.add(parse(asStringMap(map)));
        }
        return rules;
    }

    /**
     * Parse one rule definition.
     *
     * @throws IllegalArgumentException naming the rule and the offending key
     */
    public static InvariantRule parse(Map<String, Object> definition) {
        String name = requireString(definition, "name", "invariant");
        try {
            return new InvariantRule(
                    name,
                    requireString(definition, "contract", name),
                    requireString(definition, "function", name),
                    getListString(definition, "expected_calls"),
                    requireString(definition, "guard_variable", name),
                    parseChildShape(definition.get("child_shape")),
                    parseOperations(definition.get("operations")));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid invariant " + name + ": " + e.getMessage(), e);
        }
    }

    private static ChildShape parseChildShape(Object raw) {
        if (raw == null) {
            return ChildShape.expressionThenBlockEnd();
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("child_shape must be a mapping");
        }
        Map<String, Object> shape = asStringMap(map);
        List<NodeKind> kinds = getListString(shape, "kinds").stream()
                .map(RuleDefinitionParser::parseNodeKind)
                .toList();
        return new ChildShape(kinds, getInt(shape, "expression_index", 0));
    }

    private static NodeKind parseNodeKind(String value) {
        NodeKind kind = NodeKind.fromString(value);
        if (kind == NodeKind.OTHER && !"OTHER".equalsIgnoreCase(value)) {
            throw new IllegalArgumentException("Unknown node kind in child_shape: " + value);
        }
        return kind;
    }

    private static List<OperationPredicate> parseOperations(Object raw) {
        if (!(raw instanceof List<?> list) || list.isEmpty()) {
            throw new IllegalArgumentException("operations must be a non-empty list");
        }
        List<OperationPredicate> predicates = new ArrayList<>();
        for (Object entry : list) {
            if (!(entry instanceof Map<?, ?> map) || map.size() != 1) {
                throw new IllegalArgumentException("each operation must be a single-key mapping, got: " + entry);
            }
            Map.Entry<?, ?> only = map.entrySet().iterator().next();
            if (!(only.getValue() instanceof Map<?, ?> body)) {
                throw new IllegalArgumentException("operation " + only.getKey() + " needs a mapping body");
            }
            predicates.add(parsePredicate(String.valueOf(only.getKey()), asStringMap(body)));
        }
        return predicates;
    }

    private static OperationPredicate parsePredicate(String kind, Map<String, Object> body) {
        return switch (kind) {
            case "type_conversion" -> new TypeConversionPredicate(
                    requireString(body, "literal", kind),
                    requireString(body, "target_type", kind));
            case "binary" -> new BinaryPredicate(
                    BinaryOperator.fromString(requireString(body, "operator", kind)),
                    requireInt(body, "result_of", kind),
                    OperandSide.fromString(getString(body, "reference_side", "right")),
                    requireString(body, "named_local", kind));
            case "call" -> new CallPredicate(
                    requireString(body, "signature", kind),
                    getInt(body, "argument", 0),
                    requireInt(body, "result_of", kind));
            default -> throw new IllegalArgumentException(
                    "Unknown operation kind: " + kind + ". Must be: type_conversion, binary, or call");
        };
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> asStringMap(Map<?, ?> map) {
        return (Map<String, Object>) map;
    }

    private static String requireString(Map<String, Object> map, String key, String owner) {
        String value = getString(map, key, null);
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(owner + " is missing required key '" + key + "'");
        }
        return value;
    }

    private static int requireInt(Map<String, Object> map, String key, String owner) {
        if (!(map.get(key) instanceof Number)) {
            throw new IllegalArgumentException(owner + " needs an integer '" + key + "'");
        }
        return getInt(map, key, 0);
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            return list.stream()
                    .map(String::valueOf)
                    .toList();
        }
        return List.of();
    }
}
