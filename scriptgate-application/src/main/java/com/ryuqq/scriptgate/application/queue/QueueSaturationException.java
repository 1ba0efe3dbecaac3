package com.ryuqq.scriptgate.application.queue;

/**
 * 종료되지 않은 Operation 수가 최대 깊이에 도달해 등록을 거부할 때 발생.
 *
 * <p>호출자에게 그대로 전달되며 재시도하지 않습니다.</p>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public class QueueSaturationException extends RuntimeException {

    private final int depth;
    private final int maxDepth;

    public QueueSaturationException(int depth, int maxDepth) {
        super("Operation queue is saturated (depth: " + depth + ", maxDepth: " + maxDepth + ")");
        this.depth = depth;
        this.maxDepth = maxDepth;
    }

    public int getDepth() {
        return depth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
