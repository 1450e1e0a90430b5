package proto.runtime.interpreter;

import proto.runtime.MessageNotFoundException;
import proto.runtime.NativeComputation;
import proto.runtime.ProtoException;
import proto.runtime.ProtoObject;
import proto.runtime.interpreter.cache.LookupCache;
import proto.runtime.interpreter.cache.LookupCacheStats;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * ProtoLang 求值器
 *
 * <p>按对象种类的固定优先级求值：</p>
 * <ol>
 *   <li>原始值：返回独立副本</li>
 *   <li>原生计算：以自身和 {@code "parameter"} 槽调用计算</li>
 *   <li>消息链：复制自身后依次发送消息，每条消息发给上一条的结果</li>
 *   <li>普通对象：返回自身（引用相同）</li>
 * </ol>
 *
 * <p>两种失败方式保持分离：消息链中找不到消息抛出 {@link MessageNotFoundException}；
 * 直接调用 {@link #dispatch} / {@link #dispatchWithParameter} 未找到时返回 null。</p>
 *
 * <p>同步执行，不是线程安全的。宿主若在多线程中共享对象图，需要在外部串行化变更和求值。</p>
 */
public final class Interpreter {

    private static final Logger LOG = Logger.getLogger(Interpreter.class.getName());

    private final EvaluationPolicy policy;
    private final InheritanceResolver resolver;
    private int depth;

    public Interpreter() {
        this(EvaluationPolicy.defaults());
    }

    public Interpreter(EvaluationPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
        LookupCache cache = policy.isLookupCacheEnabled()
                ? new LookupCache(policy.getLookupCacheSize())
                : null;
        this.resolver = new InheritanceResolver(cache);
    }

    public EvaluationPolicy getPolicy() {
        return policy;
    }

    // ============ 求值 ============

    /**
     * 求值对象。
     *
     * @throws MessageNotFoundException 消息链中的某条消息无法解析
     * @throws ProtoException           原生计算返回 null，或超出求值深度限制
     */
    public ProtoObject evaluate(ProtoObject obj) {
        Objects.requireNonNull(obj, "obj");
        int maxDepth = policy.getMaxEvaluationDepth();
        if (maxDepth > 0 && depth >= maxDepth) {
            throw new ProtoException("Maximum evaluation depth exceeded: " + maxDepth);
        }
        depth++;
        try {
            switch (obj.getKind()) {
                case PRIMITIVE:
                    return obj.copy();
                case NATIVE:
                    return invokeNative(obj);
                case MESSAGE_CHAIN:
                    return sendMessages(obj);
                default:
                    return obj;
            }
        } finally {
            depth--;
        }
    }

    private ProtoObject invokeNative(ProtoObject obj) {
        NativeComputation computation = obj.getNativeFunction();
        ProtoObject result = computation.compute(obj, obj.getSlot(ProtoObject.PARAMETER_SLOT));
        if (result == null) {
            throw new ProtoException("Native computation returned no object: " + obj);
        }
        return result;
    }

    private ProtoObject sendMessages(ProtoObject obj) {
        ProtoObject current = obj.copy();
        List<String> messages = current.getMessages();
        ProtoObject next = null;
        for (String message : messages) {
            next = dispatch(current, message);
            if (next == null) {
                throw new MessageNotFoundException(message);
            }
            current = next;
        }
        return next;
    }

    // ============ 分发 ============

    /**
     * 向接收者发送消息：找到的槽对象经求值后返回。
     *
     * @return 求值结果，未找到返回 null
     */
    public ProtoObject dispatch(ProtoObject receiver, String name) {
        Objects.requireNonNull(receiver, "receiver");
        Objects.requireNonNull(name, "name");
        ProtoObject holder = resolver.locate(receiver, name);
        trace(name, holder);
        if (holder == null) {
            return null;
        }
        return evaluate(holder.getSlot(name));
    }

    /**
     * 带参数发送消息：对找到的槽对象取副本，在副本的 {@code "parameter"} 槽绑定参数后求值。
     * 槽背后的共享原型对象不会被修改。
     *
     * @return 求值结果，未找到返回 null
     */
    public ProtoObject dispatchWithParameter(ProtoObject receiver, String name, ProtoObject parameter) {
        Objects.requireNonNull(receiver, "receiver");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(parameter, "parameter");
        ProtoObject holder = resolver.locate(receiver, name);
        trace(name, holder);
        if (holder == null) {
            return null;
        }
        return evaluate(holder.getSlot(name).bindParameter(parameter));
    }

    private void trace(String name, ProtoObject holder) {
        if (policy.isTraceDispatch() && LOG.isLoggable(Level.FINE)) {
            LOG.fine(holder != null
                    ? "dispatch '" + name + "' -> " + holder
                    : "dispatch '" + name + "' -> 未找到");
        }
    }

    // ============ 缓存 ============

    /** 查找缓存统计，未启用缓存时返回 null */
    public LookupCacheStats getLookupCacheStats() {
        LookupCache cache = resolver.getCache();
        return cache != null ? cache.getStats() : null;
    }

    public void clearLookupCache() {
        LookupCache cache = resolver.getCache();
        if (cache != null) {
            cache.clear();
        }
    }
}
