package com.magicfolder.dispatch.server;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "magicfolder.server")
public class EndpointProperties {

    /** ZeroMQ endpoint the REP socket binds and clients connect to. */
    private String endpoint = "tcp://127.0.0.1:5555";
    /** How long a blocking receive waits before re-checking the stop flag. */
    private int pollTimeoutMs = 500;
    /** Reply timeout for the {@code classify} client command. */
    private int clientTimeoutMs = 120_000;

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public int getPollTimeoutMs() {
        return pollTimeoutMs;
    }

    public void setPollTimeoutMs(int pollTimeoutMs) {
        this.pollTimeoutMs = pollTimeoutMs;
    }

    public int getClientTimeoutMs() {
        return clientTimeoutMs;
    }

    public void setClientTimeoutMs(int clientTimeoutMs) {
        this.clientTimeoutMs = clientTimeoutMs;
    }
}
