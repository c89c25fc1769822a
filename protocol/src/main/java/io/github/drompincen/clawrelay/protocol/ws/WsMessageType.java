package io.github.drompincen.clawrelay.protocol.ws;

public enum WsMessageType {
    // Client -> Server
    SUBSCRIBE_CHAT,
    UNSUBSCRIBE,
    APPROVAL_DECISION,

    // Server -> Client
    SUBSCRIBED,
    UNSUBSCRIBED,
    JOB_QUEUED,
    JOB_STARTED,
    JOB_PROGRESS,
    APPROVAL_REQUESTED,
    JOB_COMPLETED,
    JOB_FAILED,
    JOB_CANCELLED,
    LOGIN_URL,
    LOGIN_RESULT,
    ERROR
}
