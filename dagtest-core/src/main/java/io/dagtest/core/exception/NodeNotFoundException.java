package io.dagtest.core.exception;

import java.io.Serial;

/// Thrown when a node key is not present in a {@link io.dagtest.core.node.NodeRegistry}.
public class NodeNotFoundException extends Exception {

    @Serial private static final long serialVersionUID = -2201853356371450093L;

    public NodeNotFoundException(String message) {
        super(message);
    }
}
