package net.labsched.core.spi;

import java.util.concurrent.Callable;

/** Transaction boundary for entity store calls. Failures roll back and propagate unchanged. */
public interface TxRunner {
    <T> T required(Callable<T> body) throws Exception;
    <T> T requiresNew(Callable<T> body) throws Exception;

    /** Runs inline, for stores without transactions (in-memory fixtures, dry runs). */
    static TxRunner direct() {
        return new TxRunner() {
            @Override public <T> T required(Callable<T> body) throws Exception { return body.call(); }
            @Override public <T> T requiresNew(Callable<T> body) throws Exception { return body.call(); }
        };
    }
}
