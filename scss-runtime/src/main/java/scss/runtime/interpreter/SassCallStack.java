package scss.runtime.interpreter;

/**
 * 调用栈：记录调用帧用于错误堆栈跟踪
 *
 * <p>只保留最近的 {@value #MAX_FRAMES} 帧，深度计数独立于保留的帧数。</p>
 */
public final class SassCallStack {

    private static final int MAX_FRAMES = 64;
    private static final int DEFAULT_DISPLAY_LIMIT = 16;

    private final SassCallFrame[] frames = new SassCallFrame[MAX_FRAMES];
    private int size = 0;
    private int depth = 0;

    public void push(SassCallFrame frame) {
        if (size >= MAX_FRAMES) {
            // 丢弃最旧的帧
            System.arraycopy(frames, 1, frames, 0, MAX_FRAMES - 1);
            frames[MAX_FRAMES - 1] = frame;
        } else {
            frames[size++] = frame;
        }
        depth++;
    }

    public void pop() {
        if (depth > 0) depth--;
        if (size > 0) {
            frames[--size] = null;
        }
    }

    /** 实际调用深度 */
    public int depth() {
        return depth;
    }

    public SassCallFrame peek() {
        return size > 0 ? frames[size - 1] : null;
    }

    public void clear() {
        for (int i = 0; i < size; i++) {
            frames[i] = null;
        }
        size = 0;
        depth = 0;
    }

    /**
     * 格式化堆栈跟踪（最近的调用在前），帧数超过 displayLimit 时折叠中间部分
     *
     * @return 栈为空时返回 null
     */
    public String formatStackTrace(int displayLimit) {
        if (size == 0) return null;
        if (displayLimit <= 0) displayLimit = DEFAULT_DISPLAY_LIMIT;

        StringBuilder sb = new StringBuilder();
        if (size <= displayLimit) {
            for (int i = size - 1; i >= 0; i--) {
                appendFrame(sb, frames[i]);
            }
        } else {
            int half = displayLimit / 2;
            for (int i = size - 1; i >= size - half; i--) {
                appendFrame(sb, frames[i]);
            }
            sb.append("  ... ").append(size - displayLimit).append(" frames omitted ...\n");
            for (int i = half - 1; i >= 0; i--) {
                appendFrame(sb, frames[i]);
            }
        }
        return sb.toString();
    }

    public String formatStackTrace() {
        return formatStackTrace(DEFAULT_DISPLAY_LIMIT);
    }

    private static void appendFrame(StringBuilder sb, SassCallFrame frame) {
        sb.append("  ").append(frame.getFileName()).append(' ')
          .append(frame.getLine()).append(':').append(frame.getColumn())
          .append("  ").append(frame.getName()).append("()\n");
    }
}
