package com.flagship.payday.node;

/**
 * The node did not answer in time. The outcome of the call is unknown.
 */
public class NodeTimeoutException extends NodeException {

    public NodeTimeoutException(String nodeId, String message) {
        super(nodeId, message);
    }
}
