package com.protolang.cli;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/**
 * CLI 日志配置：所有日志输出到 stderr，不干扰 stdout 上的结果。
 */
final class LoggingSupport {

    /** 引擎日志根名（proto.runtime 及其子包） */
    static final String ENGINE_LOGGER = "proto.runtime";

    /** 持有强引用，避免 LogManager 回收后级别丢失 */
    private static final Logger ENGINE = Logger.getLogger(ENGINE_LOGGER);

    private LoggingSupport() {}

    /**
     * 替换根日志处理器为 stderr 处理器。
     *
     * @param trace 为 true 时引擎日志降到 FINE，输出分发跟踪
     */
    static void configure(boolean trace) {
        Logger rootLogger = Logger.getLogger("");
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }
        Handler stderrHandler = new StreamHandler(System.err, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        stderrHandler.setLevel(trace ? Level.FINE : Level.INFO);
        rootLogger.addHandler(stderrHandler);
        ENGINE.setLevel(trace ? Level.FINE : Level.INFO);
    }
}
