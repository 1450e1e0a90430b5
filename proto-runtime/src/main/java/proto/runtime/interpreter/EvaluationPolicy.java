package proto.runtime.interpreter;

/**
 * 求值策略配置类
 *
 * <p>控制解释器的查找缓存、求值深度限制和分发跟踪。</p>
 *
 * <p>使用示例：</p>
 * <pre>
 * // 预定义配置
 * Interpreter interp = new Interpreter(EvaluationPolicy.uncached());
 *
 * // 自定义配置
 * EvaluationPolicy policy = EvaluationPolicy.custom()
 *     .lookupCacheSize(1024)
 *     .maxEvaluationDepth(512)
 *     .traceDispatch(true)
 *     .build();
 * </pre>
 */
public final class EvaluationPolicy {

    /** 默认查找缓存容量（接收者个数） */
    public static final long DEFAULT_LOOKUP_CACHE_SIZE = 4096;

    private final long lookupCacheSize;     // 0=禁用
    private final int maxEvaluationDepth;   // 0=无限制
    private final boolean traceDispatch;

    private EvaluationPolicy(Builder builder) {
        this.lookupCacheSize = builder.lookupCacheSize;
        this.maxEvaluationDepth = builder.maxEvaluationDepth;
        this.traceDispatch = builder.traceDispatch;
    }

    // ============ 预定义工厂方法 ============

    /** 默认配置：启用查找缓存，不限制深度 */
    public static EvaluationPolicy defaults() {
        return new Builder().build();
    }

    /** 关闭查找缓存，每次分发都完整搜索 */
    public static EvaluationPolicy uncached() {
        return new Builder().lookupCacheSize(0).build();
    }

    public static Builder custom() {
        return new Builder();
    }

    // ============ Getters ============

    public long getLookupCacheSize() { return lookupCacheSize; }
    public boolean isLookupCacheEnabled() { return lookupCacheSize > 0; }
    public int getMaxEvaluationDepth() { return maxEvaluationDepth; }
    public boolean isTraceDispatch() { return traceDispatch; }

    @Override
    public String toString() {
        return "EvaluationPolicy{lookupCacheSize=" + lookupCacheSize
                + ", maxEvaluationDepth=" + maxEvaluationDepth
                + ", traceDispatch=" + traceDispatch + "}";
    }

    // ============ Builder ============

    public static final class Builder {
        private long lookupCacheSize = DEFAULT_LOOKUP_CACHE_SIZE;
        private int maxEvaluationDepth = 0;
        private boolean traceDispatch = false;

        private Builder() {}

        public Builder lookupCacheSize(long size) {
            if (size < 0) {
                throw new IllegalArgumentException("lookupCacheSize must not be negative: " + size);
            }
            this.lookupCacheSize = size;
            return this;
        }

        public Builder maxEvaluationDepth(int depth) {
            if (depth < 0) {
                throw new IllegalArgumentException("maxEvaluationDepth must not be negative: " + depth);
            }
            this.maxEvaluationDepth = depth;
            return this;
        }

        public Builder traceDispatch(boolean trace) {
            this.traceDispatch = trace;
            return this;
        }

        public EvaluationPolicy build() {
            return new EvaluationPolicy(this);
        }
    }
}
