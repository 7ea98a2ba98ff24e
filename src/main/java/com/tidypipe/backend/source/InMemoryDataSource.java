package com.tidypipe.backend.source;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.tidypipe.backend.value.Missing;
import com.tidypipe.backend.value.Table;
import com.tidypipe.common.Error;
import com.tidypipe.common.PipelineException;

/**
 * 内存中的数据集集合，可以从 classpath 上的 JSON 文件预加载。
 * <p>
 * JSON 格式为对象数组，每个对象是一行；第一行的键顺序决定列顺序，null 读作 MISSING。
 */
public class InMemoryDataSource implements DataSource {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryDataSource.class);

    /** 随程序发布的内置数据集 */
    public static final List<String> BUILTIN = List.of("colors");

    private final Map<String, Table> tables = new ConcurrentHashMap<>();

    public InMemoryDataSource() {
    }

    /**
     * 创建包含全部内置数据集的数据源。
     */
    public static InMemoryDataSource withBuiltins() {
        InMemoryDataSource source = new InMemoryDataSource();
        for (String name : BUILTIN) {
            try {
                source.register(name, readResource("/datasets/" + name + ".json"));
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load builtin dataset " + name, e);
            }
        }
        return source;
    }

    public void register(String name, Table table) {
        tables.put(name, table);
        LOGGER.debug("Register dataset {} ({} rows)", name, table.size());
    }

    @Override
    public boolean contains(String name) {
        return tables.containsKey(name);
    }

    @Override
    public Table load(String name) throws PipelineException {
        Table table = tables.get(name);
        if(table == null) {
            throw Error.unknownDataset(name);
        }
        return table;
    }

    @Override
    public Set<String> names() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(tables.keySet()));
    }

    public static Table readResource(String path) throws IOException {
        InputStream in = InMemoryDataSource.class.getResourceAsStream(path);
        if(in == null) {
            throw new IOException("Resource not found: " + path);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return parseRows(JsonParser.parseReader(reader));
        } catch (JsonParseException | IllegalArgumentException e) {
            throw new IOException("Invalid dataset " + path + ": " + e.getMessage(), e);
        }
    }

    static Table parseRows(JsonElement element) {
        if(!element.isJsonArray()) {
            throw new IllegalArgumentException("dataset must be an array of objects");
        }
        JsonArray array = element.getAsJsonArray();
        List<String> columns = new ArrayList<>();
        if(array.size() > 0) {
            columns.addAll(array.get(0).getAsJsonObject().keySet());
        }
        Table.Builder builder = Table.builder(columns);
        for (JsonElement e : array) {
            JsonObject obj = e.getAsJsonObject();
            Map<String, Object> row = new LinkedHashMap<>();
            for (Map.Entry<String, JsonElement> entry : obj.entrySet()) {
                row.put(entry.getKey(), scalar(entry.getValue()));
            }
            builder.addRow(row);
        }
        return builder.build();
    }

    private static Object scalar(JsonElement value) {
        if(value == null || value.isJsonNull()) {
            return Missing.MISSING;
        }
        if(!value.isJsonPrimitive()) {
            throw new IllegalArgumentException("dataset cells must be scalars, got " + value);
        }
        JsonPrimitive p = value.getAsJsonPrimitive();
        if(p.isNumber()) {
            return p.getAsDouble();
        }
        if(p.isBoolean()) {
            return p.getAsBoolean();
        }
        return p.getAsString();
    }
}
