package com.example.logrelay.upstream;

public class UpstreamException extends RuntimeException {
    private final UpstreamStatus status;

    public UpstreamException(UpstreamStatus status, String message) {
        super(status + ": " + message);
        this.status = status;
    }

    public UpstreamException(UpstreamStatus status, String message, Throwable cause) {
        super(status + ": " + message, cause);
        this.status = status;
    }

    public UpstreamStatus getStatus() {
        return status;
    }

    public boolean isRetryable() {
        return status.isRetryable();
    }

    static UpstreamException wrap(Throwable t) {
        if (t instanceof UpstreamException) return (UpstreamException) t;
        String msg = t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
        return new UpstreamException(UpstreamStatus.classify(t), msg, t);
    }
}
