package net.lavalauncher.launcher.utils;

import java.util.concurrent.CancellationException;

public class OperationCancelledException extends CancellationException {
    private final CancellationToken.Reason reason;

    public OperationCancelledException(CancellationToken.Reason reason) {
        super(reason == CancellationToken.Reason.TIMEOUT ? "Operation timed out" : "Operation was cancelled");
        this.reason = reason;
    }

    public CancellationToken.Reason getReason() {
        return reason;
    }

    public boolean isTimeout() {
        return reason == CancellationToken.Reason.TIMEOUT;
    }
}
