package com.work.anchor.core.exception;

/**
 * 尝试次数用尽仍未成功。
 */
public class RetriesExhaustedException extends AnchorException {

    private final int attempts;

    public RetriesExhaustedException(int attempts, Throwable lastFailure) {
        super("Failed to send transaction after " + attempts + " attempts", lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
