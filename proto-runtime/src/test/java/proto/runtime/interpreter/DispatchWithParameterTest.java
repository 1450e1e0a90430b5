package proto.runtime.interpreter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import proto.runtime.ProtoObject;
import proto.runtime.stdlib.StdlibNumbers;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("带参数分发测试")
class DispatchWithParameterTest {

    private Interpreter interpreter;

    @BeforeEach
    void setUp() {
        interpreter = new Interpreter();
    }

    @Test
    @DisplayName("N = 5 经 increment 得到 6")
    void testIncrementScenario() {
        ProtoObject n = ProtoObject.of(5L);
        ProtoObject inc = ProtoObject.nativeOf((self, parameter) ->
                ProtoObject.of(self.getSlot(ProtoObject.PARAMETER_SLOT).asLong() + 1));
        n.assignSlot("increment", inc);

        ProtoObject result = interpreter.dispatchWithParameter(n, "increment", n);

        assertThat(result.asLong()).isEqualTo(6L);
        assertThat(n.asLong()).isEqualTo(5L);
    }

    @Test
    @DisplayName("共享祖先上的原型不会留下参数绑定")
    void testParameterIsolation() {
        ProtoObject adder = ProtoObject.nativeOf(StdlibNumbers.add("operand"));
        adder.assignSlot("operand", ProtoObject.of(100L));
        ProtoObject ancestor = new ProtoObject();
        ancestor.assignSlot("add", adder);
        ProtoObject left = new ProtoObject();
        left.assignParentSlot("proto", ancestor);
        ProtoObject right = new ProtoObject();
        right.assignParentSlot("proto", ancestor);

        ProtoObject first = interpreter.dispatchWithParameter(left, "add", ProtoObject.of(1L));
        ProtoObject second = interpreter.dispatchWithParameter(right, "add", ProtoObject.of(2L));

        assertThat(first.asLong()).isEqualTo(101L);
        assertThat(second.asLong()).isEqualTo(102L);
        assertThat(adder.hasSlot(ProtoObject.PARAMETER_SLOT)).isFalse();
        assertThat(ancestor.getSlot("add")).isSameAs(adder);
    }

    @Test
    @DisplayName("原生计算看到的是绑定了参数的副本")
    void testNativeSeesTransientCopy() {
        List<ProtoObject> selves = new ArrayList<>();
        ProtoObject fn = ProtoObject.nativeOf((self, parameter) -> {
            selves.add(self);
            return parameter;
        });
        ProtoObject receiver = new ProtoObject();
        receiver.assignSlot("echo", fn);
        ProtoObject param = ProtoObject.of("p");

        ProtoObject result = interpreter.dispatchWithParameter(receiver, "echo", param);

        assertThat(result).isSameAs(param);
        assertThat(selves).hasSize(1);
        assertThat(selves.get(0)).isNotSameAs(fn);
        assertThat(selves.get(0).getSlot(ProtoObject.PARAMETER_SLOT)).isSameAs(param);
    }

    @Test
    @DisplayName("消息链槽通过参数副本求值")
    void testChainSlotReadsParameter() {
        ProtoObject chain = ProtoObject.chain(ProtoObject.PARAMETER_SLOT);
        ProtoObject receiver = new ProtoObject();
        receiver.assignSlot("identity", chain);

        ProtoObject result = interpreter.dispatchWithParameter(receiver, "identity", ProtoObject.of(7L));

        assertThat(result.asLong()).isEqualTo(7L);
        assertThat(chain.hasSlot(ProtoObject.PARAMETER_SLOT)).isFalse();
    }

    @Test
    @DisplayName("找不到时返回 null 而不是抛出异常")
    void testMissReturnsNull() {
        ProtoObject receiver = new ProtoObject();
        receiver.assignParentSlot("proto", new ProtoObject());

        assertThat(interpreter.dispatchWithParameter(receiver, "missing", ProtoObject.of(1L))).isNull();
    }

    @Test
    @DisplayName("参数不能为 null")
    void testNullParameterRejected() {
        ProtoObject receiver = new ProtoObject();
        receiver.assignSlot("x", new ProtoObject());

        assertThatNullPointerException()
                .isThrownBy(() -> interpreter.dispatchWithParameter(receiver, "x", null));
    }
}
