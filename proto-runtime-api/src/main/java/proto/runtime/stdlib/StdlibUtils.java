package proto.runtime.stdlib;

import proto.runtime.ProtoException;
import proto.runtime.ProtoObject;

/**
 * 标准原生计算共用的参数检查。
 */
final class StdlibUtils {

    private StdlibUtils() {}

    /** 参数必须已绑定且带有原始值 */
    static ProtoObject requireParameter(String function, ProtoObject parameter) {
        if (parameter == null) {
            throw new ProtoException("Missing parameter for " + function);
        }
        if (!parameter.hasPrimitive()) {
            throw new ProtoException(function + " expects a primitive parameter, got " + parameter);
        }
        return parameter;
    }

    /** 原生对象自身的操作数槽 */
    static ProtoObject requireOperand(String function, ProtoObject self, String slot) {
        ProtoObject operand = self.getSlot(slot);
        if (operand == null) {
            throw new ProtoException("Missing operand slot '" + slot + "' for " + function);
        }
        if (!operand.hasPrimitive()) {
            throw new ProtoException(function + " expects a primitive operand in slot '" + slot + "'");
        }
        return operand;
    }
}
