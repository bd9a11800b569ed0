package io.latmon.core.query;

public final class QueryException extends Exception {
    private final Reason reason;

    public QueryException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    public enum Reason {
        STORE_UNAVAILABLE("store_unavailable"),
        STORE_TIMEOUT("store_timeout"),
        AGGREGATOR_UNAVAILABLE("aggregator_unavailable");

        private final String code;

        Reason(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }
}
