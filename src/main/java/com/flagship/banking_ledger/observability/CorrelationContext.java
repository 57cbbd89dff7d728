package com.flagship.banking_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Correlation id and MDC helpers for the ledger.
 *
 * The correlation id ties together every log line written for one operation or one
 * scheduled run. Account and loan ids are pushed into the MDC for the duration of an
 * engine call through {@link #putScoped(String, Object)}, which restores whatever value
 * an enclosing call had set. A loan payment nests a withdrawal, and the outer loan's
 * MDC entries must survive the inner call.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ACCOUNT_ID_MDC_KEY = "accountId";
    public static final String LOAN_ID_MDC_KEY = "loanId";

    private CorrelationContext() {
    }

    public static void setCorrelationId(String id) {
        String value = (id != null && !id.isBlank()) ? id : generateCorrelationId();
        MDC.put(CORRELATION_ID_MDC_KEY, value);
    }

    public static void clear() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
    }

    /**
     * Short id, readable in log lines.
     */
    private static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Puts a value into the MDC until the returned scope is closed.
     * Closing restores the previous value, or removes the key if there was none.
     */
    public static MdcScope putScoped(String key, Object value) {
        String previous = MDC.get(key);
        MDC.put(key, String.valueOf(value));
        return new MdcScope(key, previous);
    }

    public static final class MdcScope implements AutoCloseable {

        private final String key;
        private final String previous;

        private MdcScope(String key, String previous) {
            this.key = key;
            this.previous = previous;
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, previous);
            }
        }
    }
}
