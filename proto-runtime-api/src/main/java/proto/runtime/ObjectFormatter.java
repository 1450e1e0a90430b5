package proto.runtime;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;

import java.util.Collection;
import java.util.Locale;

/**
 * 对象形状的调试快照。
 *
 * <p>只列出槽名，从不展开槽值；求值器和解析器从不依赖此类的输出。</p>
 */
public final class ObjectFormatter {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    private ObjectFormatter() {}

    /**
     * 单行描述，例如
     * {@code ProtoObject(primitive: 5, slots: {a, b}, parents: {b}, messages: [m], native: no)}
     */
    public static String describe(ProtoObject obj) {
        StringBuilder sb = new StringBuilder("ProtoObject(");
        sb.append("primitive: ").append(obj.getPrimitive());
        sb.append(", slots: {");
        join(sb, obj.getSlots().keySet());
        sb.append("}, parents: {");
        join(sb, obj.getParents());
        sb.append("}, messages: [");
        join(sb, obj.getMessages());
        sb.append("], native: ").append(obj.getNativeFunction() != null ? "yes" : "no");
        sb.append(")");
        return sb.toString();
    }

    /** 结构化快照，字段与 {@link #describe} 一致并附带种类 */
    public static JsonObject describeJson(ProtoObject obj) {
        JsonObject json = new JsonObject();
        json.addProperty("kind", obj.getKind().name().toLowerCase(Locale.ROOT));

        Object primitive = obj.getPrimitive();
        if (primitive == null) {
            json.add("primitive", JsonNull.INSTANCE);
        } else if (isNonFinite(primitive)) {
            // JSON 没有 NaN/Infinity 字面量，按字符串写出
            json.addProperty("primitive", primitive.toString());
        } else if (primitive instanceof Number) {
            json.addProperty("primitive", (Number) primitive);
        } else if (primitive instanceof Boolean) {
            json.addProperty("primitive", (Boolean) primitive);
        } else if (primitive instanceof Character) {
            json.addProperty("primitive", (Character) primitive);
        } else {
            json.addProperty("primitive", primitive.toString());
        }

        json.add("slots", toArray(obj.getSlots().keySet()));
        json.add("parents", toArray(obj.getParents()));
        json.add("messages", toArray(obj.getMessages()));
        json.addProperty("native", obj.getNativeFunction() != null);
        return json;
    }

    private static boolean isNonFinite(Object value) {
        if (value instanceof Double) {
            Double d = (Double) value;
            return d.isNaN() || d.isInfinite();
        }
        if (value instanceof Float) {
            Float f = (Float) value;
            return f.isNaN() || f.isInfinite();
        }
        return false;
    }

    /** {@link #describeJson} 的格式化文本 */
    public static String toJson(ProtoObject obj) {
        return GSON.toJson(describeJson(obj));
    }

    private static void join(StringBuilder sb, Collection<String> names) {
        boolean first = true;
        for (String name : names) {
            if (!first) sb.append(", ");
            first = false;
            sb.append(name);
        }
    }

    private static JsonArray toArray(Collection<String> names) {
        JsonArray array = new JsonArray();
        for (String name : names) {
            array.add(name);
        }
        return array;
    }
}
