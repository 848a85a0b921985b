package com.flagship.payday.node;

/**
 * A node call failed. Nothing is appended for the command that made the call.
 */
public class NodeException extends RuntimeException {

    private final String nodeId;

    public NodeException(String nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
    }

    public NodeException(String nodeId, String message, Throwable cause) {
        super(message, cause);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
