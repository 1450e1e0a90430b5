package proto.runtime;

import proto.runtime.interpreter.EvaluationPolicy;
import proto.runtime.interpreter.Interpreter;

/**
 * Proto 便捷 API
 *
 * <p>静态调用（共享一个延迟创建的默认解释器）：</p>
 * <pre>
 * ProtoObject n = ProtoObject.of(5L);
 * Proto.assignSlot(n, "increment", ProtoObject.nativeOf(StdlibNumbers.increment()));
 * ProtoObject six = Proto.dispatchWithParameter(n, "increment", n);
 * </pre>
 *
 * <p>实例调用（共享解释器和查找缓存）：</p>
 * <pre>
 * Proto proto = new Proto(EvaluationPolicy.defaults());
 * ProtoObject result = proto.eval(root);
 * </pre>
 */
public final class Proto {

    private final Interpreter interpreter;

    public Proto() {
        this(EvaluationPolicy.defaults());
    }

    public Proto(EvaluationPolicy policy) {
        this.interpreter = new Interpreter(policy);
    }

    public Interpreter getInterpreter() {
        return interpreter;
    }

    // ── 实例 API ──────────────────────────────────────────

    public ProtoObject eval(ProtoObject obj) {
        return interpreter.evaluate(obj);
    }

    public ProtoObject send(ProtoObject receiver, String name) {
        return interpreter.dispatch(receiver, name);
    }

    public ProtoObject send(ProtoObject receiver, String name, ProtoObject parameter) {
        return interpreter.dispatchWithParameter(receiver, name, parameter);
    }

    // ── 静态 API ──────────────────────────────────────────

    /** 首次静态调用时才创建 */
    private static final class Shared {
        static final Interpreter INSTANCE = new Interpreter();
    }

    /** 静态 API 背后的解释器，使用 {@link EvaluationPolicy#defaults()} */
    public static Interpreter sharedInterpreter() {
        return Shared.INSTANCE;
    }

    /** @throws MessageNotFoundException 消息链无法解析 */
    public static ProtoObject evaluate(ProtoObject obj) {
        return Shared.INSTANCE.evaluate(obj);
    }

    public static ProtoObject copy(ProtoObject obj) {
        return obj.copy();
    }

    /** 未找到返回 null */
    public static ProtoObject dispatch(ProtoObject receiver, String name) {
        return Shared.INSTANCE.dispatch(receiver, name);
    }

    /** 未找到返回 null */
    public static ProtoObject dispatchWithParameter(ProtoObject receiver, String name, ProtoObject parameter) {
        return Shared.INSTANCE.dispatchWithParameter(receiver, name, parameter);
    }

    public static void assignSlot(ProtoObject obj, String name, ProtoObject value) {
        obj.assignSlot(name, value);
    }

    public static void makeParent(ProtoObject obj, String name) {
        obj.makeParent(name);
    }

    public static void assignParentSlot(ProtoObject obj, String name, ProtoObject value) {
        obj.assignParentSlot(name, value);
    }

    public static String describe(ProtoObject obj) {
        return ObjectFormatter.describe(obj);
    }
}
