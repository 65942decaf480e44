package com.memeinsight.common.alert;

/**
 * Escalation channel for failures an operator must act on. Today that is only an
 * upstream rejecting our credentials; everything else degrades silently into logs.
 *
 * <p>Implementations MUST be non-blocking (fire-and-forget). No {@code .block()}.
 */
public interface OperatorAlertSink {

    void raise(OperatorAlert alert);
}
