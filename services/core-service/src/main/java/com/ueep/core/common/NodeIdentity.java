package com.ueep.core.common;

import java.net.InetAddress;
import java.net.UnknownHostException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class NodeIdentity {
    private static final Logger logger = LoggerFactory.getLogger(NodeIdentity.class);

    private final String hostname;

    public NodeIdentity() {
        this(resolveHostname());
    }

    public NodeIdentity(String hostname) {
        this.hostname = hostname;
    }

    public String getHostname() {
        return hostname;
    }

    private static String resolveHostname() {
        String fromEnv = System.getenv("HOSTNAME");
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv.trim();
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException ex) {
            logger.warn("hostname_unresolved error={}", ex.getMessage());
            return "unknown";
        }
    }
}
