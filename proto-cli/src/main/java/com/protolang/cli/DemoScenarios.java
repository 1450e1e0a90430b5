package com.protolang.cli;

import proto.runtime.MessageNotFoundException;
import proto.runtime.ProtoObject;
import proto.runtime.interpreter.Interpreter;
import proto.runtime.stdlib.StdlibNumbers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 内置演示场景
 */
final class DemoScenarios {

    private static final Map<String, DemoScenario> SCENARIOS = new LinkedHashMap<>();

    static {
        register(new ChainScenario());
        register(new PriorityScenario());
        register(new IncrementScenario());
        register(new InheritanceScenario());
        register(new DiamondScenario());
    }

    private DemoScenarios() {}

    private static void register(DemoScenario scenario) {
        SCENARIOS.put(scenario.getName(), scenario);
    }

    static List<DemoScenario> all() {
        return Collections.unmodifiableList(new ArrayList<>(SCENARIOS.values()));
    }

    /** 按名称查找，不存在返回 null */
    static DemoScenario find(String name) {
        return SCENARIOS.get(name);
    }

    // ============ 场景 ============

    /** A 的消息链 [b, c]：c 发给 b 的结果，而 B 没有 c 槽 */
    static final class ChainScenario extends DemoScenario {
        ChainScenario() {
            super("chain", "消息链 [b, c]，第二条消息发给第一条的结果，预期 Message 'c' not found");
        }

        @Override
        Outcome run(Interpreter interpreter) {
            ProtoObject a = new ProtoObject();
            ProtoObject b = ProtoObject.of("I am B");
            ProtoObject c = ProtoObject.of("I am C");
            a.assignSlot("b", b);
            a.assignParentSlot("c", c);
            a.setMessages("b", "c");
            try {
                ProtoObject result = interpreter.evaluate(a);
                return Outcome.of(false, result, "意外成功: " + result.asString());
            } catch (MessageNotFoundException e) {
                return Outcome.of("c".equals(e.getMessageName()), null, e.getMessage());
            }
        }
    }

    /** 同时带原始值和消息链时原始值优先 */
    static final class PriorityScenario extends DemoScenario {
        PriorityScenario() {
            super("priority", "带原始值的对象忽略消息链，预期得到 \"I am A\" 的副本");
        }

        @Override
        Outcome run(Interpreter interpreter) {
            ProtoObject a = ProtoObject.of("I am A");
            a.assignSlot("b", ProtoObject.of("I am B"));
            a.assignParentSlot("c", ProtoObject.of("I am C"));
            a.setMessages("b", "c");
            ProtoObject result = interpreter.evaluate(a);
            boolean passed = result != a && "I am A".equals(result.getPrimitive());
            return Outcome.of(passed, result, "primitive = " + result.getPrimitive());
        }
    }

    /** N = 5，经 increment 原生计算得到 6 */
    static final class IncrementScenario extends DemoScenario {
        IncrementScenario() {
            super("increment", "dispatchWithParameter(N, \"increment\", N)，预期 5 -> 6");
        }

        @Override
        Outcome run(Interpreter interpreter) {
            ProtoObject n = ProtoObject.of(5L);
            ProtoObject inc = ProtoObject.nativeOf(StdlibNumbers.increment());
            n.assignSlot("increment", inc);
            ProtoObject result = interpreter.dispatchWithParameter(n, "increment", n);
            boolean passed = result != null && result.asLong() == 6L
                    && !inc.hasSlot(ProtoObject.PARAMETER_SLOT);
            return Outcome.of(passed, result, "primitive = " + (result != null ? result.getPrimitive() : null));
        }
    }

    /** 父对象优先于祖父对象，兄弟中先声明者优先 */
    static final class InheritanceScenario extends DemoScenario {
        InheritanceScenario() {
            super("inheritance", "A 的父对象 B、C 与祖父 D 都定义 x，预期取 B 的 x");
        }

        @Override
        Outcome run(Interpreter interpreter) {
            ProtoObject a = new ProtoObject();
            ProtoObject b = new ProtoObject();
            ProtoObject c = new ProtoObject();
            ProtoObject d = new ProtoObject();
            d.assignSlot("x", ProtoObject.of("from D"));
            b.assignParentSlot("d", d);
            b.assignSlot("x", ProtoObject.of("from B"));
            c.assignSlot("x", ProtoObject.of("from C"));
            a.assignParentSlot("b", b);
            a.assignParentSlot("c", c);
            ProtoObject result = interpreter.dispatch(a, "x");
            boolean passed = result != null && "from B".equals(result.getPrimitive());
            return Outcome.of(passed, result, "x = " + (result != null ? result.getPrimitive() : null));
        }
    }

    /** 菱形加回边的父对象图中查找不存在的槽 */
    static final class DiamondScenario extends DemoScenario {
        DiamondScenario() {
            super("diamond", "A -> {B, C} -> D -> A 的环形菱形中查找 x，预期终止并返回未找到");
        }

        @Override
        Outcome run(Interpreter interpreter) {
            ProtoObject a = new ProtoObject();
            ProtoObject b = new ProtoObject();
            ProtoObject c = new ProtoObject();
            ProtoObject d = new ProtoObject();
            a.assignParentSlot("b", b);
            a.assignParentSlot("c", c);
            b.assignParentSlot("d", d);
            c.assignParentSlot("d", d);
            d.assignParentSlot("a", a);
            ProtoObject result = interpreter.dispatch(a, "x");
            return Outcome.of(result == null, result, result == null ? "未找到" : "意外找到 " + result);
        }
    }
}
