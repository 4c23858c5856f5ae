package com.amqpharness.diagnosis;

import com.amqpharness.amqp.AmqpConstants;
import com.amqpharness.config.BrokerUri;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Reclassifies ambiguous broker connection failures into bad credentials or a bad
 * virtual host. Brokers that reject a login drop the socket before tuning; older
 * brokers that reject a virtual host drop it after tuning. This is a heuristic: a
 * failure it cannot explain is reported unchanged.
 */
public class ConnectionDiagnoser {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionDiagnoser.class);

    public static final String BAD_CREDENTIALS_MESSAGE =
        "Error connecting to broker, probably caused by invalid credentials";
    public static final String BAD_VIRTUAL_HOST_MESSAGE =
        "Error connecting to broker, probably caused by using an invalid or unauthorized vhost";

    private final HandshakeProbe probe;

    public ConnectionDiagnoser(HandshakeProbe probe) {
        this.probe = probe;
    }

    /**
     * Classify a failed (or successful) handshake from how far it got and how it ended.
     */
    public static DiagnosisResult classify(HandshakePhase phase, HandshakeFailure failure) {
        if (failure == null) {
            return DiagnosisResult.ok();
        }

        Throwable cause = failure.getCause();
        if (!phase.hasStarted()) {
            return DiagnosisResult.unknown(cause);
        }

        switch (failure.getKind()) {
            case SOCKET_CLOSED:
                return phase.isTuneCompleted()
                    ? DiagnosisResult.badVirtualHost(cause)
                    : DiagnosisResult.badCredentials(cause);
            case BROKER_CLOSE:
                int replyCode = failure.getReplyCode();
                if (replyCode == AmqpConstants.REPLY_NOT_ALLOWED) {
                    return DiagnosisResult.badVirtualHost(cause);
                }
                if (replyCode == AmqpConstants.REPLY_ACCESS_REFUSED) {
                    return phase.isTuneCompleted()
                        ? DiagnosisResult.badVirtualHost(cause)
                        : DiagnosisResult.badCredentials(cause);
                }
                return DiagnosisResult.unknown(cause);
            default:
                return DiagnosisResult.unknown(cause);
        }
    }

    public DiagnosisResult diagnose(BrokerUri uri) {
        if (!uri.isHandshakeDiagnosable()) {
            logger.debug("Skipping diagnosis for scheme {}", uri.getScheme());
            return DiagnosisResult.notDiagnosed();
        }

        HandshakeOutcome outcome = probe.attempt(uri);
        DiagnosisResult result = classify(outcome.getPhase(), outcome.getFailure());
        if (result.isOk()) {
            logger.debug("Broker {} accepted the connection", uri);
        } else {
            logger.info("Connection to {} failed in phase {}: {}", uri, outcome.getPhase(), result.getOutcome());
        }
        return result;
    }

    /**
     * Attempt a connection and fail with a descriptive error if the broker refuses it.
     * Failures the heuristics cannot explain are rethrown as they were raised.
     *
     * @throws ConnectionRefusedException for bad credentials or a bad virtual host
     * @throws IOException for any other connection failure
     */
    public void verify(BrokerUri uri) throws IOException {
        DiagnosisResult result = diagnose(uri);
        switch (result.getOutcome()) {
            case OK:
                return;
            case BAD_CREDENTIALS:
                throw new ConnectionRefusedException(ConnectionRefusedException.Reason.BAD_CREDENTIALS,
                                                     BAD_CREDENTIALS_MESSAGE, result.getCause());
            case BAD_VIRTUAL_HOST:
                throw new ConnectionRefusedException(ConnectionRefusedException.Reason.BAD_VIRTUAL_HOST,
                                                     BAD_VIRTUAL_HOST_MESSAGE, result.getCause());
            default:
                rethrow(result.getCause());
        }
    }

    private static void rethrow(Throwable cause) throws IOException {
        if (cause == null) {
            return;
        }
        if (cause instanceof IOException) {
            throw (IOException) cause;
        }
        if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        throw new IOException(cause);
    }
}
