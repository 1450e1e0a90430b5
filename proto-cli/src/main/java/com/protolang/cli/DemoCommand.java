package com.protolang.cli;

import proto.runtime.ObjectFormatter;
import proto.runtime.ProtoException;
import proto.runtime.interpreter.EvaluationPolicy;
import proto.runtime.interpreter.Interpreter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * proto demo：运行内置演示场景
 */
@Command(name = "demo", mixinStandardHelpOptions = true,
         description = "构建内置示例对象图并求值")
public class DemoCommand implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(DemoCommand.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_UNKNOWN_SCENARIO = 2;

    @Spec
    CommandSpec spec;

    @Option(names = "--json", description = "以 JSON 输出结果对象快照")
    boolean json;

    @Option(names = "--trace", description = "在 stderr 输出分发跟踪日志")
    boolean trace;

    @Option(names = "--list", description = "列出可用场景")
    boolean list;

    @Option(names = "--no-cache", description = "关闭查找缓存")
    boolean noCache;

    @Option(names = "--max-depth", description = "最大求值深度（0 为不限制）", defaultValue = "0")
    int maxDepth;

    @Parameters(description = "场景名，省略时运行全部")
    List<String> names = new ArrayList<>();

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (list) {
            for (DemoScenario scenario : DemoScenarios.all()) {
                out.println(scenario.getName() + " - " + scenario.getDescription());
            }
            out.flush();
            return EXIT_OK;
        }

        List<DemoScenario> selected = new ArrayList<>();
        if (names == null || names.isEmpty()) {
            selected.addAll(DemoScenarios.all());
        } else {
            for (String name : names) {
                DemoScenario scenario = DemoScenarios.find(name);
                if (scenario == null) {
                    err.println("错误: 未知场景 '" + name + "'（使用 --list 查看）");
                    err.flush();
                    return EXIT_UNKNOWN_SCENARIO;
                }
                selected.add(scenario);
            }
        }

        if (trace) {
            LoggingSupport.configure(true);
        }
        EvaluationPolicy policy = EvaluationPolicy.custom()
                .lookupCacheSize(noCache ? 0 : EvaluationPolicy.DEFAULT_LOOKUP_CACHE_SIZE)
                .maxEvaluationDepth(maxDepth)
                .traceDispatch(trace)
                .build();

        int failures = 0;
        for (DemoScenario scenario : selected) {
            Interpreter interpreter = new Interpreter(policy);
            DemoScenario.Outcome outcome;
            try {
                outcome = scenario.run(interpreter);
            } catch (ProtoException e) {
                LOG.log(Level.WARNING, "场景 " + scenario.getName() + " 运行失败", e);
                outcome = DemoScenario.Outcome.of(false, null, e.getMessage());
            }
            if (!outcome.isPassed()) failures++;
            out.println("[" + (outcome.isPassed() ? "OK" : "FAIL") + "] "
                    + scenario.getName() + ": " + outcome.getDetail());
            if (outcome.getResult() != null) {
                out.println(json ? ObjectFormatter.toJson(outcome.getResult())
                                 : "    " + ObjectFormatter.describe(outcome.getResult()));
            }
        }
        out.flush();
        return failures == 0 ? EXIT_OK : EXIT_FAILED;
    }
}
