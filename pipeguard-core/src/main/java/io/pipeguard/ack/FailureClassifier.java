package io.pipeguard.ack;

import io.pipeguard.DocumentNotFoundException;
import io.pipeguard.FailureKind;
import io.pipeguard.PermanentFailureException;
import io.pipeguard.TransientFailureException;
import io.pipeguard.schema.ValidationException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.sql.SQLTransientException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Decides the {@link FailureKind} of an exception that escaped a unit of work.
 *
 * <p>Rules are checked in registration order against the exception and then each of its
 * causes; the first match wins. {@link ValidationException}, {@link TransientFailureException}
 * and {@link PermanentFailureException} always map to their own kind. Anything unmatched
 * gets the kind passed to {@link Builder#otherwise}, which every classifier must declare:
 *
 * <pre>{@code
 * FailureClassifier classifier = FailureClassifier.builder()
 *     .transientOnInfrastructureErrors()
 *     .permanentOn(IllegalArgumentException.class)
 *     .otherwise(FailureKind.PERMANENT)
 *     .build();
 * }</pre>
 */
public final class FailureClassifier {
    private static final int MAX_CAUSE_DEPTH = 16;

    private record Rule(Class<? extends Throwable> type, FailureKind kind) {
    }

    private final List<Rule> rules;
    private final FailureKind fallback;

    private FailureClassifier(Builder builder) {
        if (builder.fallback == null) {
            throw new IllegalStateException("A FailureClassifier must declare otherwise(kind) for unmatched errors");
        }
        this.rules = Collections.unmodifiableList(new ArrayList<>(builder.rules));
        this.fallback = builder.fallback;
    }

    public static Builder builder() {
        return new Builder();
    }

    public FailureKind classify(Throwable error) {
        Objects.requireNonNull(error, "error");
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            FailureKind kind = match(current);
            if (kind != null) {
                return kind;
            }
            current = current.getCause();
        }
        return fallback;
    }

    private FailureKind match(Throwable error) {
        if (error instanceof ValidationException) {
            return FailureKind.MALFORMED;
        }
        if (error instanceof TransientFailureException) {
            return FailureKind.TRANSIENT;
        }
        if (error instanceof PermanentFailureException) {
            return FailureKind.PERMANENT;
        }
        for (Rule rule : rules) {
            if (rule.type().isInstance(error)) {
                return rule.kind();
            }
        }
        return null;
    }

    /** Builder for {@link FailureClassifier}. */
    public static final class Builder {
        private final List<Rule> rules = new ArrayList<>();
        private FailureKind fallback;

        private Builder() {
        }

        @SafeVarargs
        public final Builder transientOn(Class<? extends Throwable>... types) {
            return on(FailureKind.TRANSIENT, types);
        }

        @SafeVarargs
        public final Builder permanentOn(Class<? extends Throwable>... types) {
            return on(FailureKind.PERMANENT, types);
        }

        @SafeVarargs
        public final Builder malformedOn(Class<? extends Throwable>... types) {
            return on(FailureKind.MALFORMED, types);
        }

        /**
         * Marks timeouts, refused or unresolvable connections, transient SQL errors and
         * rejected executions as {@link FailureKind#TRANSIENT}.
         */
        public Builder transientOnInfrastructureErrors() {
            return transientOn(ConnectException.class, SocketTimeoutException.class, UnknownHostException.class,
                    TimeoutException.class, SQLTransientException.class, RejectedExecutionException.class);
        }

        /**
         * Marks {@link DocumentNotFoundException} as {@link FailureKind#TRANSIENT}, for handlers
         * that look up the document an event announces before the write is visible to them.
         */
        public Builder transientOnDocumentNotFound() {
            return transientOn(DocumentNotFoundException.class);
        }

        /**
         * Sets the kind for errors no rule matches.
         *
         * <p><b>Required.</b> There is no implicit default.
         */
        public Builder otherwise(FailureKind kind) {
            this.fallback = Objects.requireNonNull(kind, "kind");
            return this;
        }

        @SafeVarargs
        private Builder on(FailureKind kind, Class<? extends Throwable>... types) {
            for (Class<? extends Throwable> type : types) {
                rules.add(new Rule(Objects.requireNonNull(type, "type"), kind));
            }
            return this;
        }

        /**
         * @throws IllegalStateException if {@link #otherwise} was not called
         */
        public FailureClassifier build() {
            return new FailureClassifier(this);
        }
    }
}
