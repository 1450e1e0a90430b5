package proto.runtime;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * ProtoLang 对象
 *
 * <p>原型对象模型中唯一的实体。对象通过具名槽引用其他对象，部分槽可以标记为父槽，
 * 直接查找失败时会沿父槽继续搜索。对象还可以携带原始值、原生计算和待发送给自身的消息序列。</p>
 *
 * <p>槽持有共享的非拥有引用：同一个对象可以被多个父对象引用（菱形共享），
 * 也可以形成环。对象的生命周期由宿主的可达性决定。</p>
 *
 * <p>此类不是线程安全的。</p>
 */
public final class ProtoObject {

    /** 参数化分发时绑定参数所用的约定槽名 */
    public static final String PARAMETER_SLOT = "parameter";

    private static final Logger LOG = Logger.getLogger(ProtoObject.class.getName());

    /** 形状纪元：每次可能改变查找结果的结构变更都会递增 */
    private static final AtomicLong SHAPE_EPOCH = new AtomicLong();

    private final Map<String, ProtoObject> slots;
    private final Set<String> parents;
    private final List<String> messages;
    private Object primitive;
    private NativeComputation nativeFunction;

    public ProtoObject() {
        this(new LinkedHashMap<String, ProtoObject>(), new LinkedHashSet<String>(), new ArrayList<String>());
    }

    private ProtoObject(Map<String, ProtoObject> slots, Set<String> parents, List<String> messages) {
        this.slots = slots;
        this.parents = parents;
        this.messages = messages;
    }

    // ============ 工厂方法 ============

    /** 创建装箱原始值对象 */
    public static ProtoObject of(Object primitive) {
        ProtoObject obj = new ProtoObject();
        obj.setPrimitive(Objects.requireNonNull(primitive, "primitive"));
        return obj;
    }

    /** 创建携带原生计算的对象 */
    public static ProtoObject nativeOf(NativeComputation computation) {
        ProtoObject obj = new ProtoObject();
        obj.setNativeFunction(Objects.requireNonNull(computation, "computation"));
        return obj;
    }

    /** 创建消息链对象 */
    public static ProtoObject chain(String... messages) {
        ProtoObject obj = new ProtoObject();
        obj.setMessages(messages);
        return obj;
    }

    /**
     * 当前形状纪元。
     *
     * <p>{@link #assignSlot} 和生效的 {@link #makeParent} 会推进纪元，
     * 查找缓存以此判断条目是否过期。</p>
     */
    public static long currentEpoch() {
        return SHAPE_EPOCH.get();
    }

    // ============ 复制 ============

    /**
     * 浅复制。
     *
     * <p>副本拥有新的 slots / parents / messages 容器，内容与顺序相同；
     * 槽引用的子对象与原对象共享，原始值和原生计算按引用复制。</p>
     */
    public ProtoObject copy() {
        ProtoObject copy = new ProtoObject(
                new LinkedHashMap<>(slots),
                new LinkedHashSet<>(parents),
                new ArrayList<>(messages));
        copy.primitive = primitive;
        copy.nativeFunction = nativeFunction;
        return copy;
    }

    /**
     * 返回绑定了 {@code "parameter"} 槽的副本，自身不受影响。
     *
     * <p>副本在返回前尚未被任何调用方持有，因此绑定不推进形状纪元。</p>
     */
    public ProtoObject bindParameter(ProtoObject parameter) {
        Objects.requireNonNull(parameter, "parameter");
        ProtoObject copy = copy();
        copy.slots.put(PARAMETER_SLOT, parameter);
        return copy;
    }

    // ============ 变更 API ============

    /**
     * 设置或覆盖槽。
     *
     * <p>已被标记为父槽的槽名被重新赋值时不做任何校验，继承边随之指向新值。</p>
     */
    public void assignSlot(String name, ProtoObject value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        slots.put(name, value);
        SHAPE_EPOCH.incrementAndGet();
    }

    /**
     * 将已存在的槽标记为父槽；槽不存在时静默忽略。
     */
    public void makeParent(String name) {
        Objects.requireNonNull(name, "name");
        if (!slots.containsKey(name)) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("makeParent 忽略: 槽 '" + name + "' 不存在");
            }
            return;
        }
        if (parents.add(name)) {
            SHAPE_EPOCH.incrementAndGet();
        }
    }

    /** {@link #assignSlot} 后接 {@link #makeParent}，一步建立继承边 */
    public void assignParentSlot(String name, ProtoObject value) {
        assignSlot(name, value);
        makeParent(name);
    }

    public void addMessage(String message) {
        messages.add(Objects.requireNonNull(message, "message"));
    }

    /** 以给定顺序替换整个消息序列 */
    public void setMessages(String... newMessages) {
        List<String> replacement = new ArrayList<>(newMessages.length);
        for (String message : newMessages) {
            replacement.add(Objects.requireNonNull(message, "message"));
        }
        messages.clear();
        messages.addAll(replacement);
    }

    /**
     * 设置原始值，传入 null 表示清除。
     *
     * @throws IllegalArgumentException 值不是受支持的不可变标量
     */
    public void setPrimitive(Object value) {
        if (value != null && !isSupportedPrimitive(value)) {
            throw new IllegalArgumentException("Unsupported primitive type: " + value.getClass().getName());
        }
        this.primitive = value;
    }

    public void setNativeFunction(NativeComputation nativeFunction) {
        this.nativeFunction = nativeFunction;
    }

    // ============ 读取 ============

    /** 槽引用的对象，不存在则返回 null */
    public ProtoObject getSlot(String name) {
        return slots.get(name);
    }

    public boolean hasSlot(String name) {
        return slots.containsKey(name);
    }

    /** 按插入顺序的只读槽视图 */
    public Map<String, ProtoObject> getSlots() {
        return Collections.unmodifiableMap(slots);
    }

    /** 按标记顺序的只读父槽名视图 */
    public Set<String> getParents() {
        return Collections.unmodifiableSet(parents);
    }

    public boolean isParent(String name) {
        return parents.contains(name);
    }

    public List<String> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public Object getPrimitive() {
        return primitive;
    }

    public boolean hasPrimitive() {
        return primitive != null;
    }

    public NativeComputation getNativeFunction() {
        return nativeFunction;
    }

    /**
     * 按固定优先级判定种类：原始值 > 原生计算 > 消息链 > 普通对象。
     */
    public ObjectKind getKind() {
        if (primitive != null) return ObjectKind.PRIMITIVE;
        if (nativeFunction != null) return ObjectKind.NATIVE;
        if (!messages.isEmpty()) return ObjectKind.MESSAGE_CHAIN;
        return ObjectKind.PLAIN;
    }

    // ============ 原始值访问 ============

    /** 原始值是否为整数类型 */
    public boolean isIntegral() {
        return primitive instanceof Long || primitive instanceof Integer
                || primitive instanceof Short || primitive instanceof Byte
                || primitive instanceof BigInteger;
    }

    public boolean isNumber() {
        return primitive instanceof Number;
    }

    public long asLong() {
        Object value = requirePrimitive("Long");
        if (!isIntegral()) {
            throw new ProtoException("Cannot convert " + getPrimitiveTypeName() + " to Long");
        }
        if (value instanceof BigInteger) {
            try {
                return ((BigInteger) value).longValueExact();
            } catch (ArithmeticException e) {
                throw new ProtoException("Integer overflow: " + value, e);
            }
        }
        return ((Number) value).longValue();
    }

    public int asInt() {
        long value = asLong();
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new ProtoException("Integer overflow: " + value);
        }
        return (int) value;
    }

    public double asDouble() {
        Object value = requirePrimitive("Double");
        if (!(value instanceof Number)) {
            throw new ProtoException("Cannot convert " + getPrimitiveTypeName() + " to Double");
        }
        return ((Number) value).doubleValue();
    }

    public boolean asBoolean() {
        Object value = requirePrimitive("Boolean");
        if (!(value instanceof Boolean)) {
            throw new ProtoException("Cannot convert " + getPrimitiveTypeName() + " to Boolean");
        }
        return (Boolean) value;
    }

    /** 任意原始值的字符串形式 */
    public String asString() {
        return String.valueOf(requirePrimitive("String"));
    }

    /** 原始值的类型名，无原始值时为 "None" */
    public String getPrimitiveTypeName() {
        return primitive == null ? "None" : primitive.getClass().getSimpleName();
    }

    private Object requirePrimitive(String target) {
        if (primitive == null) {
            throw new ProtoException("Cannot convert object without primitive to " + target);
        }
        return primitive;
    }

    static boolean isSupportedPrimitive(Object value) {
        return value instanceof String
                || value instanceof Boolean
                || value instanceof Character
                || value instanceof Long
                || value instanceof Integer
                || value instanceof Short
                || value instanceof Byte
                || value instanceof Double
                || value instanceof Float
                || value instanceof BigInteger
                || value instanceof BigDecimal;
    }

    @Override
    public String toString() {
        return ObjectFormatter.describe(this);
    }
}
