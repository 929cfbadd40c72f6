package com.vidnyan.causeway.domain.graph;

/**
 * Caller to callee edge between function node ids.
 */
public record CallEdge(
    String callerId,
    String calleeId,
    int line
) {

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String callerId;
        private String calleeId;
        private int line;

        public Builder caller(String id) { this.callerId = id; return this; }
        public Builder callee(String id) { this.calleeId = id; return this; }
        public Builder line(int line) { this.line = line; return this; }

        public CallEdge build() {
            return new CallEdge(callerId, calleeId, line);
        }
    }
}
