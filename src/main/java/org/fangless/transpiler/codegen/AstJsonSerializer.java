package org.fangless.transpiler.codegen;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.fangless.transpiler.api.SourceInfo;
import org.fangless.transpiler.frontend.parser.ast.AstNode;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.Collection;

/**
 * Dumps a syntax tree as JSON for inspection. Every node becomes an object with a {@code "node"} field
 * holding its type name, its position as {@code "line"} and {@code "column"} when known, and one field per component.
 */
public final class AstJsonSerializer {

    private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    /**
     * @param node The root node, usually a {@link org.fangless.transpiler.frontend.parser.ast.Module}.
     * @return The pretty-printed JSON document.
     */
    public String toJson(AstNode node) {
        return gson.toJson(toTree(node));
    }

    /**
     * @param value A node, a helper record, a list, an enum or a primitive value.
     * @return The JSON representation.
     */
    public JsonElement toTree(Object value) {
        if (value == null) {
            return JsonNull.INSTANCE;
        }
        if (value instanceof String s) {
            return new JsonPrimitive(s);
        }
        if (value instanceof Number n) {
            return new JsonPrimitive(n);
        }
        if (value instanceof Boolean b) {
            return new JsonPrimitive(b);
        }
        if (value instanceof Enum<?> e) {
            return new JsonPrimitive(e.name());
        }
        if (value instanceof Collection<?> collection) {
            JsonArray array = new JsonArray();
            for (Object element : collection) {
                array.add(toTree(element));
            }
            return array;
        }
        if (value instanceof Record record) {
            return recordToTree(record);
        }
        return new JsonPrimitive(value.toString());
    }

    private JsonObject recordToTree(Record record) {
        JsonObject object = new JsonObject();
        object.addProperty("node", record.getClass().getSimpleName());
        for (RecordComponent component : record.getClass().getRecordComponents()) {
            Object componentValue = read(record, component);
            if (componentValue instanceof SourceInfo info) {
                object.addProperty("line", info.lineNumber());
                object.addProperty("column", info.columnNumber());
            } else if (!"sourceInfo".equals(component.getName())) {
                object.add(component.getName(), toTree(componentValue));
            }
        }
        return object;
    }

    private static Object read(Record record, RecordComponent component) {
        try {
            return component.getAccessor().invoke(record);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException("Cannot read component '" + component.getName()
                    + "' of " + record.getClass().getSimpleName(), e);
        }
    }
}
