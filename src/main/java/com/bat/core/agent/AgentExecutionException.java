package com.bat.core.agent;

/**
 * Any failure inside an agent's decision protocol, wrapped with a readable prefix.
 */
public class AgentExecutionException extends RuntimeException {

    public AgentExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
