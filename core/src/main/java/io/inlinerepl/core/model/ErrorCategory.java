package io.inlinerepl.core.model;

/**
 * Category of a failure that ended a run or dropped a value.
 */
public enum ErrorCategory {
    /** Malformed source rejected by the parser. */
    SYNTAX,
    /** Any other error thrown by the program. */
    RUNTIME,
    /** The loop guard's iteration ceiling was exceeded. */
    LOOP_LIMIT,
    /** The run was cancelled, cooperatively or by force. */
    CANCELLED,
    /** A transform pass failed on otherwise valid source. */
    TRANSPILATION,
    /** A single value could not be serialized. */
    SERIALIZATION;

    public static final String LOOP_LIMIT_MESSAGE = "Loop limit exceeded";
    public static final String CANCELLED_MESSAGE = "Execution cancelled";

    /** Categorizes an error thrown by user code from its message text. */
    public static ErrorCategory classifyThrown(String message) {
        if (message == null) {
            return RUNTIME;
        }
        if (message.startsWith(LOOP_LIMIT_MESSAGE)) {
            return LOOP_LIMIT;
        }
        if (message.equals(CANCELLED_MESSAGE)) {
            return CANCELLED;
        }
        return RUNTIME;
    }

    /** Terminal run state for a run that ended with this category. */
    public RunState terminalState() {
        return this == CANCELLED ? RunState.CANCELLED : RunState.FAILED;
    }
}
