package com.bat.core.llm;

/**
 * Thrown when the oracle returns null or blank content instead of a response.
 */
public class OracleEmptyResponseException extends RuntimeException {

    public OracleEmptyResponseException(String message) {
        super(message);
    }
}
