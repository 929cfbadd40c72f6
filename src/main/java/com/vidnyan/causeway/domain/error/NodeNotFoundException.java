package com.vidnyan.causeway.domain.error;

import java.util.Collection;

public class NodeNotFoundException extends InterventionValidationException {

    private final String node;

    public NodeNotFoundException(String role, String node, Collection<String> available) {
        super(role + " node '" + node + "' not found in graph. Available nodes: " + available);
        this.node = node;
    }

    public String node() {
        return node;
    }
}
