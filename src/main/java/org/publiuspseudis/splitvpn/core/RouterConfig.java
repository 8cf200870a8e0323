/*
 * Copyright (C) 2024 Publius Pseudis
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.publiuspseudis.splitvpn.core;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

/**
 * <p>
 * The {@code RouterConfig} class carries the tunables of the router: how long flows and queued
 * packets live, how large the tables may grow and how DNS traffic is recognised.
 * </p>
 *
 * <p>
 * Instances are immutable and built with {@link #builder()} or read from properties:
 * </p>
 * <pre>{@code
 * splitvpn.connection.ttl.ms=300000
 * splitvpn.connection.max=10000
 * splitvpn.queue.timeout.ms=10000
 * splitvpn.queue.max=10000
 * splitvpn.dns.port=53
 * splitvpn.dns.default-tunnel=fr
 * }</pre>
 *
 * @author
 * Publius Pseudis
 */
public final class RouterConfig {

    public static final String CONNECTION_TTL_KEY = "splitvpn.connection.ttl.ms";
    public static final String CONNECTION_MAX_KEY = "splitvpn.connection.max";
    public static final String QUEUE_TIMEOUT_KEY = "splitvpn.queue.timeout.ms";
    public static final String QUEUE_MAX_KEY = "splitvpn.queue.max";
    public static final String DNS_PORT_KEY = "splitvpn.dns.port";
    public static final String DNS_DEFAULT_TUNNEL_KEY = "splitvpn.dns.default-tunnel";

    public static final long DEFAULT_CONNECTION_TTL = TimeUnit.SECONDS.toMillis(300);
    public static final int DEFAULT_MAX_CONNECTIONS = 10_000;
    public static final long DEFAULT_QUEUE_TIMEOUT = TimeUnit.SECONDS.toMillis(10);
    public static final int DEFAULT_MAX_QUEUE_SIZE = 10_000;
    public static final int DEFAULT_DNS_PORT = 53;

    private final long connectionTtlMillis;
    private final int maxConnections;
    private final long queueTimeoutMillis;
    private final int maxQueueSize;
    private final int dnsPort;
    private final String defaultDnsTunnel;
    private final Clock clock;

    private RouterConfig(Builder builder) {
        this.connectionTtlMillis = positive(builder.connectionTtlMillis, CONNECTION_TTL_KEY);
        this.maxConnections = (int) positive(builder.maxConnections, CONNECTION_MAX_KEY);
        this.queueTimeoutMillis = positive(builder.queueTimeoutMillis, QUEUE_TIMEOUT_KEY);
        this.maxQueueSize = (int) positive(builder.maxQueueSize, QUEUE_MAX_KEY);
        if (builder.dnsPort < 1 || builder.dnsPort > 65535) {
            throw new IllegalArgumentException(DNS_PORT_KEY + " out of range: " + builder.dnsPort);
        }
        this.dnsPort = builder.dnsPort;
        this.defaultDnsTunnel = builder.defaultDnsTunnel;
        this.clock = Objects.requireNonNull(builder.clock, "clock");
    }

    private static long positive(long value, String key) {
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive: " + value);
        }
        return value;
    }

    /**
     * @return a config with every default
     */
    public static RouterConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads a config from properties. Missing keys keep their default, unknown keys are ignored.
     *
     * @param properties source properties
     * @return the config
     * @throws IllegalArgumentException if a value is malformed, naming the key
     */
    public static RouterConfig fromProperties(Properties properties) {
        Builder builder = builder();
        builder.connectionTtlMillis(longValue(properties, CONNECTION_TTL_KEY, DEFAULT_CONNECTION_TTL));
        builder.maxConnections(intValue(properties, CONNECTION_MAX_KEY, DEFAULT_MAX_CONNECTIONS));
        builder.queueTimeoutMillis(longValue(properties, QUEUE_TIMEOUT_KEY, DEFAULT_QUEUE_TIMEOUT));
        builder.maxQueueSize(intValue(properties, QUEUE_MAX_KEY, DEFAULT_MAX_QUEUE_SIZE));
        builder.dnsPort(intValue(properties, DNS_PORT_KEY, DEFAULT_DNS_PORT));
        String tunnel = properties.getProperty(DNS_DEFAULT_TUNNEL_KEY);
        if (tunnel != null && !tunnel.isBlank()) {
            builder.defaultDnsTunnel(tunnel.trim());
        }
        return builder.build();
    }

    /**
     * Reads a config from a properties stream.
     *
     * @param in properties in {@link Properties#load(InputStream)} format
     * @return the config
     * @throws IOException if the stream cannot be read
     */
    public static RouterConfig load(InputStream in) throws IOException {
        Properties properties = new Properties();
        properties.load(in);
        return fromProperties(properties);
    }

    private static long longValue(Properties properties, String key, long defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + raw, e);
        }
    }

    private static int intValue(Properties properties, String key, int defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + raw, e);
        }
    }

    public long getConnectionTtlMillis() {
        return connectionTtlMillis;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public long getQueueTimeoutMillis() {
        return queueTimeoutMillis;
    }

    public int getMaxQueueSize() {
        return maxQueueSize;
    }

    public int getDnsPort() {
        return dnsPort;
    }

    /**
     * @return the tunnel DNS falls back to, or {@code null}
     */
    public String getDefaultDnsTunnel() {
        return defaultDnsTunnel;
    }

    public Clock getClock() {
        return clock;
    }

    @Override
    public String toString() {
        return "RouterConfig{connectionTtl=" + connectionTtlMillis + "ms, maxConnections=" + maxConnections
                + ", queueTimeout=" + queueTimeoutMillis + "ms, maxQueueSize=" + maxQueueSize
                + ", dnsPort=" + dnsPort + ", defaultDnsTunnel=" + defaultDnsTunnel + "}";
    }

    /**
     * Builder for {@link RouterConfig}.
     */
    public static final class Builder {
        private long connectionTtlMillis = DEFAULT_CONNECTION_TTL;
        private int maxConnections = DEFAULT_MAX_CONNECTIONS;
        private long queueTimeoutMillis = DEFAULT_QUEUE_TIMEOUT;
        private int maxQueueSize = DEFAULT_MAX_QUEUE_SIZE;
        private int dnsPort = DEFAULT_DNS_PORT;
        private String defaultDnsTunnel;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder connectionTtlMillis(long value) {
            this.connectionTtlMillis = value;
            return this;
        }

        public Builder maxConnections(int value) {
            this.maxConnections = value;
            return this;
        }

        public Builder queueTimeoutMillis(long value) {
            this.queueTimeoutMillis = value;
            return this;
        }

        public Builder maxQueueSize(int value) {
            this.maxQueueSize = value;
            return this;
        }

        public Builder dnsPort(int value) {
            this.dnsPort = value;
            return this;
        }

        public Builder defaultDnsTunnel(String value) {
            this.defaultDnsTunnel = value;
            return this;
        }

        public Builder clock(Clock value) {
            this.clock = value;
            return this;
        }

        public RouterConfig build() {
            return new RouterConfig(this);
        }
    }
}
