package com.enterprise.securedb.db;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * @param query         processed SQL, or the template for failures
 * @param params        bound values, or the caller's raw values for failures
 * @param executionTime null before execution and on failure
 * @param timestamp     when the call started
 * @param caller        first stack frame outside this library
 * @param error         failure message, null on success
 */
public record QueryLogEntry(String query,
                            List<Object> params,
                            Duration executionTime,
                            Instant timestamp,
                            Caller caller,
                            String error) {

    public QueryLogEntry {
        params = Collections.unmodifiableList(new ArrayList<>(params));
    }

    public Optional<Duration> executionTimeIfCompleted() {
        return Optional.ofNullable(executionTime);
    }

    public boolean failed() {
        return error != null;
    }

    public record Caller(String className, String method, String file, int line) {

        static final Caller UNKNOWN = new Caller("unknown", "unknown", "unknown", 0);

        static Caller of(StackWalker.StackFrame frame) {
            String file = frame.getFileName();
            return new Caller(frame.getClassName(), frame.getMethodName(),
                    file == null ? "unknown" : file, Math.max(frame.getLineNumber(), 0));
        }
    }
}
