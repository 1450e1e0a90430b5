package proto.runtime.stdlib;

import proto.runtime.NativeComputation;
import proto.runtime.ProtoObject;

import java.util.Locale;

/**
 * 字符串原生计算，任何原始值都按其字符串形式处理。
 */
public final class StdlibStrings {

    private StdlibStrings() {}

    public static NativeComputation concat(String suffix) {
        return (self, parameter) ->
                ProtoObject.of(StdlibUtils.requireParameter("concat", parameter).asString() + suffix);
    }

    public static NativeComputation length() {
        return (self, parameter) ->
                ProtoObject.of((long) StdlibUtils.requireParameter("length", parameter).asString().length());
    }

    public static NativeComputation upperCase() {
        return (self, parameter) ->
                ProtoObject.of(StdlibUtils.requireParameter("upperCase", parameter).asString().toUpperCase(Locale.ROOT));
    }
}
