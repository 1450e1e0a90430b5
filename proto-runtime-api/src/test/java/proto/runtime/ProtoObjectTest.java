package proto.runtime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;

import static org.assertj.core.api.Assertions.*;

/**
 * ProtoObject（对象表示、复制、变更 API）单元测试
 */
@DisplayName("ProtoObject 测试")
class ProtoObjectTest {

    // ============ 复制 ============

    @Nested
    @DisplayName("浅复制")
    class CopyTests {

        @Test
        @DisplayName("副本新增槽不影响原对象，反之亦然")
        void testSlotContainersIndependent() {
            ProtoObject original = new ProtoObject();
            original.assignSlot("a", new ProtoObject());
            ProtoObject copy = original.copy();

            copy.assignSlot("b", new ProtoObject());
            original.assignSlot("c", new ProtoObject());

            assertThat(original.getSlots()).containsOnlyKeys("a", "c");
            assertThat(copy.getSlots()).containsOnlyKeys("a", "b");
        }

        @Test
        @DisplayName("引用的子对象共享，通过任一方修改都可见")
        void testSubObjectsShared() {
            ProtoObject shared = new ProtoObject();
            ProtoObject original = new ProtoObject();
            original.assignSlot("child", shared);
            ProtoObject copy = original.copy();

            assertThat(copy.getSlot("child")).isSameAs(shared);
            copy.getSlot("child").assignSlot("mark", ProtoObject.of(1L));
            assertThat(original.getSlot("child").hasSlot("mark")).isTrue();
        }

        @Test
        @DisplayName("父槽和消息序列按内容与顺序复制到新容器")
        void testParentsAndMessagesCopied() {
            ProtoObject original = new ProtoObject();
            original.assignParentSlot("p1", new ProtoObject());
            original.assignParentSlot("p2", new ProtoObject());
            original.setMessages("m1", "m2");
            ProtoObject copy = original.copy();

            assertThat(copy.getParents()).containsExactly("p1", "p2");
            assertThat(copy.getMessages()).containsExactly("m1", "m2");

            copy.addMessage("m3");
            copy.assignParentSlot("p3", new ProtoObject());
            assertThat(original.getMessages()).containsExactly("m1", "m2");
            assertThat(original.getParents()).containsExactly("p1", "p2");
        }

        @Test
        @DisplayName("原始值和原生计算按引用复制")
        void testPayloadCopied() {
            NativeComputation fn = (self, parameter) -> ProtoObject.of(1L);
            ProtoObject original = ProtoObject.of("text");
            original.setNativeFunction(fn);
            ProtoObject copy = original.copy();

            assertThat(copy).isNotSameAs(original);
            assertThat(copy.getPrimitive()).isEqualTo("text");
            assertThat(copy.getNativeFunction()).isSameAs(fn);
        }

        @Test
        @DisplayName("bindParameter 只在副本上绑定参数")
        void testBindParameter() {
            ProtoObject proto = new ProtoObject();
            ProtoObject param = ProtoObject.of(3L);

            ProtoObject bound = proto.bindParameter(param);

            assertThat(bound.getSlot(ProtoObject.PARAMETER_SLOT)).isSameAs(param);
            assertThat(proto.hasSlot(ProtoObject.PARAMETER_SLOT)).isFalse();
        }
    }

    // ============ 变更 API ============

    @Nested
    @DisplayName("变更 API")
    class MutationTests {

        @Test
        @DisplayName("assignSlot 覆盖已有槽并保持插入顺序")
        void testAssignSlotOverwrites() {
            ProtoObject obj = new ProtoObject();
            ProtoObject first = new ProtoObject();
            ProtoObject second = new ProtoObject();
            obj.assignSlot("a", first);
            obj.assignSlot("b", new ProtoObject());
            obj.assignSlot("a", second);

            assertThat(obj.getSlot("a")).isSameAs(second);
            assertThat(new ArrayList<>(obj.getSlots().keySet())).containsExactly("a", "b");
        }

        @Test
        @DisplayName("makeParent 对不存在的槽静默忽略")
        void testMakeParentMissingSlot() {
            ProtoObject obj = new ProtoObject();
            obj.makeParent("ghost");

            assertThat(obj.getParents()).isEmpty();
            assertThat(obj.hasSlot("ghost")).isFalse();
        }

        @Test
        @DisplayName("assignParentSlot 同时赋值并标记父槽")
        void testAssignParentSlot() {
            ProtoObject obj = new ProtoObject();
            ProtoObject parent = new ProtoObject();
            obj.assignParentSlot("proto", parent);

            assertThat(obj.getSlot("proto")).isSameAs(parent);
            assertThat(obj.isParent("proto")).isTrue();
        }

        @Test
        @DisplayName("父槽被重新赋值后不做校验，继承边指向新值")
        void testParentReassignmentIsPermissive() {
            ProtoObject obj = new ProtoObject();
            obj.assignParentSlot("proto", new ProtoObject());
            ProtoObject replacement = ProtoObject.of(7L);
            obj.assignSlot("proto", replacement);

            assertThat(obj.isParent("proto")).isTrue();
            assertThat(obj.getSlot("proto")).isSameAs(replacement);
        }

        @Test
        @DisplayName("assignSlot 拒绝 null 值")
        void testAssignSlotRejectsNull() {
            ProtoObject obj = new ProtoObject();
            assertThatNullPointerException().isThrownBy(() -> obj.assignSlot("a", null));
        }

        @Test
        @DisplayName("读取视图不可修改")
        void testViewsAreReadOnly() {
            ProtoObject obj = ProtoObject.chain("m");
            assertThatThrownBy(() -> obj.getMessages().add("x"))
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> obj.getSlots().put("x", new ProtoObject()))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    // ============ 形状纪元 ============

    @Nested
    @DisplayName("形状纪元")
    class EpochTests {

        @Test
        @DisplayName("assignSlot 推进纪元")
        void testAssignSlotAdvancesEpoch() {
            ProtoObject obj = new ProtoObject();
            long before = ProtoObject.currentEpoch();
            obj.assignSlot("a", new ProtoObject());
            assertThat(ProtoObject.currentEpoch()).isGreaterThan(before);
        }

        @Test
        @DisplayName("无效的 makeParent 不推进纪元")
        void testIgnoredMakeParentKeepsEpoch() {
            ProtoObject obj = new ProtoObject();
            long before = ProtoObject.currentEpoch();
            obj.makeParent("ghost");
            assertThat(ProtoObject.currentEpoch()).isEqualTo(before);
        }
    }

    // ============ 种类与原始值 ============

    @Nested
    @DisplayName("种类优先级")
    class KindTests {

        @Test
        @DisplayName("四项同时存在时原始值优先")
        void testPrimitiveWins() {
            ProtoObject obj = ProtoObject.of(1L);
            obj.setNativeFunction((self, parameter) -> self);
            obj.setMessages("m");
            assertThat(obj.getKind()).isEqualTo(ObjectKind.PRIMITIVE);
        }

        @Test
        @DisplayName("原生计算优先于消息链")
        void testNativeBeforeMessages() {
            ProtoObject obj = ProtoObject.nativeOf((self, parameter) -> self);
            obj.setMessages("m");
            assertThat(obj.getKind()).isEqualTo(ObjectKind.NATIVE);
        }

        @Test
        @DisplayName("只有消息时为消息链，什么都没有时为普通对象")
        void testChainAndPlain() {
            assertThat(ProtoObject.chain("m").getKind()).isEqualTo(ObjectKind.MESSAGE_CHAIN);
            assertThat(new ProtoObject().getKind()).isEqualTo(ObjectKind.PLAIN);
        }
    }

    @Nested
    @DisplayName("原始值访问")
    class PrimitiveTests {

        @Test
        @DisplayName("整数类型统一转换为 long")
        void testIntegralConversions() {
            assertThat(ProtoObject.of(5).asLong()).isEqualTo(5L);
            assertThat(ProtoObject.of(BigInteger.TEN).asInt()).isEqualTo(10);
            assertThat(ProtoObject.of(2.5).asDouble()).isEqualTo(2.5);
            assertThat(ProtoObject.of(true).asBoolean()).isTrue();
            assertThat(ProtoObject.of('x').asString()).isEqualTo("x");
        }

        @Test
        @DisplayName("类型不匹配抛出 ProtoException")
        void testConversionErrors() {
            assertThatThrownBy(() -> ProtoObject.of("abc").asLong())
                    .isInstanceOf(ProtoException.class)
                    .hasMessage("Cannot convert String to Long");
            assertThatThrownBy(() -> new ProtoObject().asString())
                    .isInstanceOf(ProtoException.class);
            assertThatThrownBy(() -> ProtoObject.of(Long.MAX_VALUE).asInt())
                    .isInstanceOf(ProtoException.class);
        }

        @Test
        @DisplayName("不支持的原始值类型被拒绝")
        void testUnsupportedPrimitive() {
            assertThatIllegalArgumentException().isThrownBy(() -> ProtoObject.of(new ArrayList<String>()));
        }
    }
}
