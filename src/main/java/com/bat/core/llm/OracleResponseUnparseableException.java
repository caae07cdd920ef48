package com.bat.core.llm;

/**
 * Thrown when an oracle reply does not match the expected schema.
 * <p>
 * Internal to the decision protocol: callers degrade to "no decision" instead of propagating it.
 */
public class OracleResponseUnparseableException extends RuntimeException {

    private final String rawResponse;

    public OracleResponseUnparseableException(String message, String rawResponse) {
        super(message);
        this.rawResponse = rawResponse;
    }

    public OracleResponseUnparseableException(String message, String rawResponse, Throwable cause) {
        super(message, cause);
        this.rawResponse = rawResponse;
    }

    public String getRawResponse() {
        return rawResponse;
    }
}
