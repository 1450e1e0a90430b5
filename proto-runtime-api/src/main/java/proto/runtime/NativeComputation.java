package proto.runtime;

/**
 * 原生计算接口
 *
 * <p>内置运算（算术、比较等）的唯一扩展点。实现只应读取 {@code self} 的槽，
 * 并通过返回值与对象图交互。</p>
 */
@FunctionalInterface
public interface NativeComputation {

    /**
     * 执行计算
     *
     * @param self      携带此计算的对象
     * @param parameter {@code "parameter"} 槽当前绑定的对象，未绑定时为 null
     * @return 新的结果对象，不能为 null
     */
    ProtoObject compute(ProtoObject self, ProtoObject parameter);
}
