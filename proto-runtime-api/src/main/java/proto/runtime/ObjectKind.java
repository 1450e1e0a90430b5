package proto.runtime;

/**
 * 决定求值方式的对象种类，按优先级从高到低排列。
 *
 * <p>一个对象可以同时带有原始值、原生计算和消息序列，
 * 只有优先级最高的那一项决定求值行为。</p>
 */
public enum ObjectKind {
    /** 装箱的原始值，求值得到独立副本 */
    PRIMITIVE,
    /** 原生计算，求值时调用 {@link NativeComputation} */
    NATIVE,
    /** 消息链，按顺序向上一条消息的结果发送消息 */
    MESSAGE_CHAIN,
    /** 普通对象，求值结果就是自身 */
    PLAIN
}
