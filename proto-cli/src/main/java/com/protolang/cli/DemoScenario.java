package com.protolang.cli;

import proto.runtime.ProtoObject;
import proto.runtime.interpreter.Interpreter;

/**
 * 演示场景：构建一张对象图，求值并判断结果是否符合预期。
 */
abstract class DemoScenario {

    private final String name;
    private final String description;

    DemoScenario(String name, String description) {
        this.name = name;
        this.description = description;
    }

    String getName() {
        return name;
    }

    String getDescription() {
        return description;
    }

    abstract Outcome run(Interpreter interpreter);

    /** 场景运行结果 */
    static final class Outcome {
        private final boolean passed;
        private final ProtoObject result;
        private final String detail;

        private Outcome(boolean passed, ProtoObject result, String detail) {
            this.passed = passed;
            this.result = result;
            this.detail = detail;
        }

        static Outcome of(boolean passed, ProtoObject result, String detail) {
            return new Outcome(passed, result, detail);
        }

        boolean isPassed() {
            return passed;
        }

        /** 求值结果，未产生结果时为 null */
        ProtoObject getResult() {
            return result;
        }

        String getDetail() {
            return detail;
        }
    }
}
