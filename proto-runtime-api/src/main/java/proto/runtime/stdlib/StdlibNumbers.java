package proto.runtime.stdlib;

import proto.runtime.NativeComputation;
import proto.runtime.ProtoException;
import proto.runtime.ProtoObject;

import java.util.function.DoubleUnaryOperator;
import java.util.function.LongUnaryOperator;

/**
 * 数值原生计算
 *
 * <p>均作用于 {@code "parameter"} 槽绑定对象的原始值：整数结果装箱为 Long，
 * 浮点结果装箱为 Double。每次调用都返回新对象。</p>
 *
 * <pre>
 * ProtoObject n = ProtoObject.of(5L);
 * n.assignSlot("increment", ProtoObject.nativeOf(StdlibNumbers.increment()));
 * interpreter.dispatchWithParameter(n, "increment", n);   // primitive = 6
 * </pre>
 */
public final class StdlibNumbers {

    private StdlibNumbers() {}

    public static NativeComputation increment() {
        return unary("increment", v -> v + 1, v -> v + 1);
    }

    public static NativeComputation decrement() {
        return unary("decrement", v -> v - 1, v -> v - 1);
    }

    public static NativeComputation negate() {
        return unary("negate", v -> -v, v -> -v);
    }

    /**
     * 参数加上原生对象自身 {@code operandSlot} 槽的原始值。
     */
    public static NativeComputation add(String operandSlot) {
        return (self, parameter) -> {
            ProtoObject left = StdlibUtils.requireParameter("add", parameter);
            ProtoObject right = StdlibUtils.requireOperand("add", self, operandSlot);
            requireNumber("add", left);
            requireNumber("add", right);
            if (left.isIntegral() && right.isIntegral()) {
                return ProtoObject.of(left.asLong() + right.asLong());
            }
            return ProtoObject.of(left.asDouble() + right.asDouble());
        };
    }

    /** 布尔结果：参数是否为零 */
    public static NativeComputation isZero() {
        return (self, parameter) -> {
            ProtoObject value = StdlibUtils.requireParameter("isZero", parameter);
            requireNumber("isZero", value);
            boolean zero = value.isIntegral() ? value.asLong() == 0 : value.asDouble() == 0.0;
            return ProtoObject.of(zero);
        };
    }

    private static NativeComputation unary(String name, LongUnaryOperator onLong, DoubleUnaryOperator onDouble) {
        return (self, parameter) -> {
            ProtoObject value = StdlibUtils.requireParameter(name, parameter);
            requireNumber(name, value);
            if (value.isIntegral()) {
                return ProtoObject.of(onLong.applyAsLong(value.asLong()));
            }
            return ProtoObject.of(onDouble.applyAsDouble(value.asDouble()));
        };
    }

    private static void requireNumber(String function, ProtoObject value) {
        if (!value.isNumber()) {
            throw new ProtoException("Cannot apply " + function + " to " + value.getPrimitiveTypeName());
        }
    }
}
