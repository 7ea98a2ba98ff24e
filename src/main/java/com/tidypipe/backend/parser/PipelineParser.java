package com.tidypipe.backend.parser;

import java.util.ArrayList;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.tidypipe.backend.aggregator.AggregateFunc;
import com.tidypipe.backend.parser.statement.Data;
import com.tidypipe.backend.parser.statement.Filter;
import com.tidypipe.backend.parser.statement.GroupBy;
import com.tidypipe.backend.parser.statement.Join;
import com.tidypipe.backend.parser.statement.Mutate;
import com.tidypipe.backend.parser.statement.Notify;
import com.tidypipe.backend.parser.statement.Pipeline;
import com.tidypipe.backend.parser.statement.Program;
import com.tidypipe.backend.parser.statement.Select;
import com.tidypipe.backend.parser.statement.Sequence;
import com.tidypipe.backend.parser.statement.Sort;
import com.tidypipe.backend.parser.statement.Summarize;
import com.tidypipe.backend.parser.statement.Transform;
import com.tidypipe.common.Error;
import com.tidypipe.common.PipelineException;

/**
 * 解析块编辑器生成的 operation 数组。
 * <p>
 * 单个操作：{@code ["@transform", name, ...operands]}；
 * pipeline：操作数组的数组；
 * program：{@code ["@program", pipeline, ...]}，或直接是 pipeline 的数组。
 */
public class PipelineParser {

    private static final Gson GSON = new Gson();

    public static Program parseProgram(String json) throws PipelineException {
        return parseProgram(readJson(json));
    }

    public static Program parseProgram(JsonElement element) throws PipelineException {
        JsonArray array = requireArray(element, "program");
        // 单个 pipeline 直接包装成只有一个元素的 program
        if(isPipeline(array)) {
            return Program.of(parsePipeline(array));
        }
        int start = 0;
        if(array.size() > 0 && isTag(array.get(0), Program.TAG)) {
            start = 1;
        }
        List<Pipeline> pipelines = new ArrayList<>();
        for (int i = start; i < array.size(); i++) {
            pipelines.add(parsePipeline(array.get(i)));
        }
        return new Program(pipelines);
    }

    public static Pipeline parsePipeline(String json) throws PipelineException {
        return parsePipeline(readJson(json));
    }

    public static Pipeline parsePipeline(JsonElement element) throws PipelineException {
        JsonArray array = requireArray(element, "pipeline");
        List<Transform> transforms = new ArrayList<>();
        for (JsonElement op : array) {
            transforms.add(parseTransform(op));
        }
        return new Pipeline(transforms);
    }

    public static Transform parseTransform(JsonElement element) throws PipelineException {
        JsonArray op = requireArray(element, "operation");
        if(op.size() < 2 || !isTag(op.get(0), Transform.TAG)) {
            throw Error.malformedPipeline("Operation must start with \"" + Transform.TAG + "\": " + element);
        }
        String name = string(op, 1, "operation name");
        try {
            switch (name) {
                case "data":
                    expectOperands(op, 1);
                    return new Data(string(op, 2, "dataset name"));
                case "sequence":
                    expectOperands(op, 2);
                    return new Sequence(string(op, 2, "column"), integer(op, 3, "sequence length"));
                case "filter":
                    expectOperands(op, 1);
                    return new Filter(ExprCodec.deserialize(op.get(2)));
                case "mutate":
                    expectOperands(op, 2);
                    return new Mutate(string(op, 2, "column"), ExprCodec.deserialize(op.get(3)));
                case "select":
                    expectOperands(op, 1);
                    return new Select(strings(op, 2, "columns"));
                case "sort":
                    expectOperands(op, 2);
                    return new Sort(strings(op, 2, "columns"), bool(op, 3, "descending flag"));
                case "groupBy":
                    expectOperands(op, 1);
                    return new GroupBy(string(op, 2, "column"));
                case "ungroup":
                    expectOperands(op, 0);
                    return Transform.ungroup();
                case "summarize":
                    expectOperands(op, 1);
                    return new Summarize(summarizeItems(op.get(2)));
                case "join":
                    expectOperands(op, 4);
                    return new Join(string(op, 2, "left table"), string(op, 3, "left column"),
                            string(op, 4, "right table"), string(op, 5, "right column"));
                case "notify":
                    expectOperands(op, 1);
                    return new Notify(string(op, 2, "name"));
                default:
                    throw Error.malformedPipeline("Unknown operation \"" + name + "\"");
            }
        } catch (IllegalArgumentException e) {
            throw Error.malformedPipeline("Invalid " + name + " operation: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------- 序列化

    public static String toJson(Pipeline pipeline) {
        return GSON.toJson(serialize(pipeline));
    }

    public static JsonArray serialize(Pipeline pipeline) {
        JsonArray array = new JsonArray();
        for (Transform t : pipeline.getTransforms()) {
            array.add(serialize(t));
        }
        return array;
    }

    public static JsonArray serialize(Program program) {
        JsonArray array = new JsonArray();
        array.add(Program.TAG);
        for (Pipeline pipeline : program.getPipelines()) {
            array.add(serialize(pipeline));
        }
        return array;
    }

    public static JsonArray serialize(Transform t) {
        JsonArray op = new JsonArray();
        op.add(Transform.TAG);
        op.add(t.name());
        if(t instanceof Data) {
            op.add(((Data) t).dataset);
        } else if(t instanceof Sequence) {
            op.add(((Sequence) t).column);
            op.add(((Sequence) t).count);
        } else if(t instanceof Filter) {
            op.add(ExprCodec.serialize(((Filter) t).predicate));
        } else if(t instanceof Mutate) {
            op.add(((Mutate) t).column);
            op.add(ExprCodec.serialize(((Mutate) t).value));
        } else if(t instanceof Select) {
            op.add(stringArray(((Select) t).columns));
        } else if(t instanceof Sort) {
            op.add(stringArray(((Sort) t).columns));
            op.add(((Sort) t).descending);
        } else if(t instanceof GroupBy) {
            op.add(((GroupBy) t).column);
        } else if(t instanceof Summarize) {
            JsonArray items = new JsonArray();
            for (Summarize.Item item : ((Summarize) t).items) {
                JsonArray pair = new JsonArray();
                pair.add(item.func.label());
                pair.add(item.column);
                items.add(pair);
            }
            op.add(items);
        } else if(t instanceof Join) {
            Join join = (Join) t;
            op.add(join.leftName);
            op.add(join.leftColumn);
            op.add(join.rightName);
            op.add(join.rightColumn);
        } else if(t instanceof Notify) {
            op.add(((Notify) t).target);
        }
        return op;
    }

    // ---------------------------------------------------------------- 工具

    private static JsonElement readJson(String json) throws PipelineException {
        if(json == null || json.isBlank()) {
            throw Error.malformedPipeline("Pipeline text is empty");
        }
        try {
            return JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw Error.malformedPipeline("Pipeline is not valid JSON: " + e.getMessage(), e);
        }
    }

    private static boolean isPipeline(JsonArray array) {
        if(array.size() == 0 || !array.get(0).isJsonArray()) {
            return false;
        }
        JsonArray first = array.get(0).getAsJsonArray();
        return first.size() > 0 && isTag(first.get(0), Transform.TAG);
    }

    private static boolean isTag(JsonElement element, String tag) {
        return element.isJsonPrimitive() && element.getAsJsonPrimitive().isString()
                && tag.equals(element.getAsString());
    }

    private static JsonArray requireArray(JsonElement element, String what) throws PipelineException {
        if(element == null || !element.isJsonArray()) {
            throw Error.malformedPipeline("Expected " + what + " array, got " + element);
        }
        return element.getAsJsonArray();
    }

    private static void expectOperands(JsonArray op, int expected) throws PipelineException {
        int actual = op.size() - 2;
        if(actual != expected) {
            throw Error.malformedPipeline("Operation " + op.get(1).getAsString() + " takes "
                    + expected + " operand(s), got " + actual);
        }
    }

    private static String string(JsonArray op, int index, String what) throws PipelineException {
        JsonElement e = op.get(index);
        if(!e.isJsonPrimitive() || !e.getAsJsonPrimitive().isString()) {
            throw Error.malformedPipeline("Expected " + what + " to be a string, got " + e);
        }
        return e.getAsString();
    }

    private static int integer(JsonArray op, int index, String what) throws PipelineException {
        JsonElement e = op.get(index);
        if(!e.isJsonPrimitive() || !e.getAsJsonPrimitive().isNumber()) {
            throw Error.malformedPipeline("Expected " + what + " to be a number, got " + e);
        }
        double d = e.getAsDouble();
        if(d != Math.rint(d) || Math.abs(d) > Integer.MAX_VALUE) {
            throw Error.malformedPipeline("Expected " + what + " to be an integer, got " + e);
        }
        return (int) d;
    }

    private static boolean bool(JsonArray op, int index, String what) throws PipelineException {
        JsonElement e = op.get(index);
        if(!e.isJsonPrimitive() || !e.getAsJsonPrimitive().isBoolean()) {
            throw Error.malformedPipeline("Expected " + what + " to be true/false, got " + e);
        }
        return e.getAsBoolean();
    }

    private static List<String> strings(JsonArray op, int index, String what) throws PipelineException {
        JsonElement e = op.get(index);
        if(!e.isJsonArray()) {
            throw Error.malformedPipeline("Expected " + what + " to be an array of strings, got " + e);
        }
        List<String> values = new ArrayList<>();
        for (JsonElement item : e.getAsJsonArray()) {
            if(!item.isJsonPrimitive() || !item.getAsJsonPrimitive().isString()) {
                throw Error.malformedPipeline("Expected " + what + " to be an array of strings, got " + e);
            }
            values.add(item.getAsString());
        }
        return values;
    }

    private static List<Summarize.Item> summarizeItems(JsonElement element) throws PipelineException {
        JsonArray pairs = requireArray(element, "summarize pairs");
        List<Summarize.Item> items = new ArrayList<>();
        for (JsonElement pair : pairs) {
            JsonArray p = requireArray(pair, "(function, column) pair");
            if(p.size() != 2) {
                throw Error.malformedPipeline("Expected (function, column) pair, got " + pair);
            }
            items.add(new Summarize.Item(AggregateFunc.from(string(p, 0, "aggregate function")),
                    string(p, 1, "column")));
        }
        return items;
    }

    private static JsonArray stringArray(List<String> values) {
        JsonArray array = new JsonArray();
        for (String v : values) {
            array.add(new JsonPrimitive(v));
        }
        return array;
    }
}
