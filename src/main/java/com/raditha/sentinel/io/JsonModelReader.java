package com.raditha.sentinel.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.sentinel.model.AnalysisModel;
import com.raditha.sentinel.model.BinaryOperator;
import com.raditha.sentinel.model.CfgNode;
import com.raditha.sentinel.model.IrOperation;
import com.raditha.sentinel.model.ModelBuilder;
import com.raditha.sentinel.model.Mutability;
import com.raditha.sentinel.model.NodeKind;
import com.raditha.sentinel.model.Variable;
import com.raditha.sentinel.model.Visibility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads an analysis model exported by the program analyzer as JSON.
 * <p>
 * Layout (abbreviated):
 * <pre>
 * {"version": 1,
 *  "contracts": [{"name": "C", "inherits": ["B"], "constructor": {"parameters": []},
 *    "functions": [{"name": "f", "visibility": "public", "mutability": "view",
 *      "parameters": ["uint256"], "calls": ["Lib.g"],
 *      "nodes": [{"id": 0, "kind": "IF", "children": [1, 2],
 *                 "operations": [{"op": "condition", "value": {"local": "flag"}}]}]}]}]}
 * </pre>
 * Operands are {@code {"local": name}}, {@code {"literal": value}} or {@code {"temp": id}}, each with an
 * optional {@code "type"}. Temporary ids are scoped to their function: every reference to the same id
 * resolves to the same {@link Variable.Temporary}.
 */
public class JsonModelReader {

    private static final Logger logger = LoggerFactory.getLogger(JsonModelReader.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    public AnalysisModel read(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        }
    }

    public AnalysisModel read(InputStream in) throws IOException {
        JsonNode root = mapper.readTree(in);
        if (root == null || !root.isObject()) {
            throw new ModelFormatException("Analysis model must be a JSON object");
        }
        int version = root.path("version").asInt(AnalysisModel.ACCESSOR_VERSION);
        if (version > AnalysisModel.ACCESSOR_VERSION) {
            throw new ModelFormatException("Unsupported analysis model version " + version
                    + ", this reader supports up to " + AnalysisModel.ACCESSOR_VERSION);
        }

        ModelBuilder builder = new ModelBuilder();
        try {
            for (JsonNode contract : root.path("contracts")) {
                readContract(builder, contract);
            }
            AnalysisModel model = builder.build();
            logger.info("Loaded analysis model with {} contracts", model.contracts().size());
            return model;
        } catch (IllegalArgumentException e) {
            throw new ModelFormatException("Invalid analysis model: " + e.getMessage(), e);
        }
    }

    private void readContract(ModelBuilder builder, JsonNode json) {
        ModelBuilder.ContractBuilder contract = builder.contract(requireText(json, "name"));
        contract.inherits(textList(json.path("inherits")).toArray(String[]::new));

        JsonNode constructor = json.path("constructor");
        if (constructor.isObject()) {
            ModelBuilder.FunctionBuilder ctor = contract.constructor(
                    textList(constructor.path("parameters")).toArray(String[]::new));
            readBody(builder, ctor, constructor);
        }
        for (JsonNode function : json.path("functions")) {
            ModelBuilder.FunctionBuilder fb = contract.function(requireText(function, "name"))
                    .parameters(textList(function.path("parameters")).toArray(String[]::new))
                    .visibility(Visibility.fromString(function.path("visibility").asText("public")))
                    .mutability(Mutability.fromString(function.path("mutability").asText("mutating")));
            readBody(builder, fb, function);
        }
    }

    private void readBody(ModelBuilder builder, ModelBuilder.FunctionBuilder function, JsonNode json) {
        for (String call : textList(json.path("calls"))) {
            function.calls(call);
        }

        Map<String, Variable.Temporary> temporaries = new HashMap<>();
        List<JsonNode> nodes = new ArrayList<>();
        json.path("nodes").forEach(nodes::add);
        for (JsonNode node : nodes) {
            List<IrOperation> operations = new ArrayList<>();
            for (JsonNode op : node.path("operations")) {
                operations.add(readOperation(builder, temporaries, op));
            }
            function.node(requireInt(node, "id"), NodeKind.fromString(requireText(node, "kind")), operations);
        }
        for (JsonNode node : nodes) {
            CfgNode from = function.nodeById(node.get("id").asInt());
            for (JsonNode child : node.path("children")) {
                function.edge(from, function.nodeById(child.asInt()));
            }
        }
    }

    private IrOperation readOperation(ModelBuilder builder, Map<String, Variable.Temporary> temps, JsonNode op) {
        String kind = requireText(op, "op");
        return switch (kind) {
            case "condition" -> new IrOperation.Condition(readVariable(builder, temps, op.get("value")));
            case "convert", "type_conversion" -> new IrOperation.TypeConversion(
                    readVariable(builder, temps, op.get("source")),
                    requireText(op, "target_type"),
                    readTemporary(builder, temps, op.get("result")));
            case "binary" -> new IrOperation.Binary(
                    BinaryOperator.fromString(requireText(op, "operator")),
                    readVariable(builder, temps, op.get("left")),
                    readVariable(builder, temps, op.get("right")),
                    readTemporary(builder, temps, op.get("result")));
            case "call" -> {
                List<Variable> arguments = new ArrayList<>();
                for (JsonNode argument : op.path("arguments")) {
                    arguments.add(readVariable(builder, temps, argument));
                }
                JsonNode result = op.get("result");
                yield new IrOperation.Call(requireText(op, "signature"), arguments,
                        result == null || result.isNull() ? null : readTemporary(builder, temps, result));
            }
            default -> throw new IllegalArgumentException("Unknown operation kind: " + kind);
        };
    }

    private Variable readVariable(ModelBuilder builder, Map<String, Variable.Temporary> temps, JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new IllegalArgumentException("Operand must be an object, got: " + json);
        }
        String type = json.path("type").asText("");
        if (json.has("local")) {
            return new Variable.NamedLocal(json.get("local").asText(), type);
        }
        if (json.has("literal")) {
            return new Variable.Literal(json.get("literal").asText(), type);
        }
        if (json.has("temp")) {
            return readTemporary(builder, temps, json);
        }
        throw new IllegalArgumentException("Operand needs one of local, literal or temp: " + json);
    }

    private Variable.Temporary readTemporary(ModelBuilder builder, Map<String, Variable.Temporary> temps,
            JsonNode json) {
        if (json == null || !json.has("temp")) {
            throw new IllegalArgumentException("Expected a temporary, got: " + json);
        }
        String type = json.path("type").asText("");
        return temps.computeIfAbsent(json.get("temp").asText(), id -> builder.temporary(type));
    }

    private static String requireText(JsonNode json, String field) {
        JsonNode value = json.get(field);
        if (value == null || !value.isValueNode() || value.asText().isEmpty()) {
            throw new IllegalArgumentException("Missing '" + field + "' in " + json);
        }
        return value.asText();
    }

    private static int requireInt(JsonNode json, String field) {
        JsonNode value = json.get(field);
        if (value == null || !value.canConvertToInt()) {
            throw new IllegalArgumentException("Missing integer '" + field + "' in " + json);
        }
        return value.asInt();
    }

    private static List<String> textList(JsonNode array) {
        List<String> values = new ArrayList<>();
        for (JsonNode value : array) {
            values.add(value.asText());
        }
        return values;
    }
}
