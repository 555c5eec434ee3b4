package scss.runtime;

/**
 * 编译选项
 *
 * <p>不可变，通过预定义工厂方法或 Builder 创建：</p>
 * <pre>
 * CompileOptions options = CompileOptions.builder()
 *     .outputStyle(OutputStyle.COMPRESSED)
 *     .quietDeps(true)
 *     .seed(42L)
 *     .build();
 * </pre>
 */
public final class CompileOptions {

    private static final CompileOptions DEFAULTS = builder().build();

    private final OutputStyle outputStyle;
    private final int precision;
    private final boolean quietDeps;
    private final boolean allowLegacyImport;
    private final boolean sourceMap;
    private final Long seed;

    // --- 资源限制 ---
    private final long maxLoopIterations;
    private final int maxCallDepth;

    private final boolean emitCharset;

    private CompileOptions(Builder builder) {
        this.outputStyle = builder.outputStyle;
        this.precision = builder.precision;
        this.quietDeps = builder.quietDeps;
        this.allowLegacyImport = builder.allowLegacyImport;
        this.sourceMap = builder.sourceMap;
        this.seed = builder.seed;
        this.maxLoopIterations = builder.maxLoopIterations;
        this.maxCallDepth = builder.maxCallDepth;
        this.emitCharset = builder.emitCharset;
    }

    // ============ 预定义工厂方法 ============

    /** 展开格式，精度 10 位 */
    public static CompileOptions defaults() {
        return DEFAULTS;
    }

    /** 压缩格式，其余同默认 */
    public static CompileOptions compressed() {
        return builder().outputStyle(OutputStyle.COMPRESSED).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** 以当前选项为起点修改 */
    public Builder toBuilder() {
        return new Builder()
                .outputStyle(outputStyle)
                .precision(precision)
                .quietDeps(quietDeps)
                .allowLegacyImport(allowLegacyImport)
                .sourceMap(sourceMap)
                .seed(seed)
                .maxLoopIterations(maxLoopIterations)
                .maxCallDepth(maxCallDepth)
                .emitCharset(emitCharset);
    }

    public OutputStyle getOutputStyle() { return outputStyle; }
    public int getPrecision() { return precision; }
    public boolean isQuietDeps() { return quietDeps; }
    public boolean isAllowLegacyImport() { return allowLegacyImport; }
    public boolean isSourceMap() { return sourceMap; }
    /** 随机数种子；null 时取进程级种子序列 */
    public Long getSeed() { return seed; }
    public long getMaxLoopIterations() { return maxLoopIterations; }
    public int getMaxCallDepth() { return maxCallDepth; }
    public boolean isEmitCharset() { return emitCharset; }

    @Override
    public String toString() {
        return "CompileOptions{style=" + outputStyle + ", precision=" + precision
                + ", quietDeps=" + quietDeps + ", allowLegacyImport=" + allowLegacyImport
                + ", sourceMap=" + sourceMap + ", seed=" + seed + "}";
    }

    // ============ Builder ============

    public static final class Builder {
        private OutputStyle outputStyle = OutputStyle.EXPANDED;
        private int precision = 10;
        private boolean quietDeps;
        private boolean allowLegacyImport = true;
        private boolean sourceMap;
        private Long seed;
        private long maxLoopIterations = 1_000_000L;
        private int maxCallDepth = 512;
        private boolean emitCharset = true;

        Builder() {}

        public Builder outputStyle(OutputStyle outputStyle) {
            if (outputStyle == null) throw new IllegalArgumentException("outputStyle must not be null");
            this.outputStyle = outputStyle;
            return this;
        }

        public Builder precision(int precision) {
            if (precision < 0 || precision > 15) {
                throw new IllegalArgumentException("precision must be between 0 and 15: " + precision);
            }
            this.precision = precision;
            return this;
        }

        /** 不报告依赖（load path 中的样式表）产生的警告 */
        public Builder quietDeps(boolean quietDeps) {
            this.quietDeps = quietDeps;
            return this;
        }

        public Builder allowLegacyImport(boolean allow) {
            this.allowLegacyImport = allow;
            return this;
        }

        public Builder sourceMap(boolean sourceMap) {
            this.sourceMap = sourceMap;
            return this;
        }

        public Builder seed(Long seed) {
            this.seed = seed;
            return this;
        }

        /** {@code @while} 单个循环的最大迭代次数，0 表示不限制 */
        public Builder maxLoopIterations(long maxIterations) {
            if (maxIterations < 0) throw new IllegalArgumentException("maxLoopIterations must be >= 0");
            this.maxLoopIterations = maxIterations;
            return this;
        }

        /** 函数与 mixin 的最大嵌套调用深度，0 表示不限制 */
        public Builder maxCallDepth(int depth) {
            if (depth < 0) throw new IllegalArgumentException("maxCallDepth must be >= 0");
            this.maxCallDepth = depth;
            return this;
        }

        public Builder emitCharset(boolean emitCharset) {
            this.emitCharset = emitCharset;
            return this;
        }

        public CompileOptions build() {
            return new CompileOptions(this);
        }
    }
}
