package com.amqpharness.diagnosis;

import java.io.IOException;

/**
 * The broker sent connection.close while the handshake was in progress.
 */
public class BrokerClosedException extends IOException {

    private final int replyCode;
    private final String replyText;
    private final int classId;
    private final int methodId;

    public BrokerClosedException(int replyCode, String replyText, int classId, int methodId) {
        super(String.format("Broker closed connection: %d %s (class %d, method %d)",
                            replyCode, replyText, classId, methodId));
        this.replyCode = replyCode;
        this.replyText = replyText;
        this.classId = classId;
        this.methodId = methodId;
    }

    public int getReplyCode() {
        return replyCode;
    }

    public String getReplyText() {
        return replyText;
    }

    public int getClassId() {
        return classId;
    }

    public int getMethodId() {
        return methodId;
    }
}
