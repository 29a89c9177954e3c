/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.redis;

import com.intuitivedesigns.logship.spi.ConfigurationException;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One Redis server address. Endpoints are configured once, in order, and never reordered.
 */
public record Endpoint(String host, int port, int database) {

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 6379;
    public static final int DEFAULT_DATABASE = 0;

    // scheme://[host][:port][/db]
    private static final Pattern URL = Pattern.compile("^([A-Za-z][A-Za-z0-9+.-]*)://([^:/]*)(?::([^/]*))?(?:/(.*))?$");

    public Endpoint {
        Objects.requireNonNull(host, "host");
        if (port < 1 || port > 65535) {
            throw new ConfigurationException("Port out of range: " + port);
        }
        if (database < 0) {
            throw new ConfigurationException("Database index must not be negative: " + database);
        }
    }

    /**
     * Parses {@code redis://host:port/db}. Missing parts take the defaults
     * (localhost, 6379, database 0).
     *
     * @throws ConfigurationException if the text is not a URL or port/db are not numbers
     */
    public static Endpoint parse(String url) {
        if (url == null) {
            throw new ConfigurationException("Endpoint URL must not be null");
        }
        Matcher m = URL.matcher(url.trim());
        if (!m.matches()) {
            throw new ConfigurationException("Not an endpoint URL (expected scheme://[host][:port][/db]): '" + url + "'");
        }
        String host = m.group(2).isEmpty() ? DEFAULT_HOST : m.group(2);
        int port = number(m.group(3), DEFAULT_PORT, "port", url);
        int db = number(m.group(4), DEFAULT_DATABASE, "database", url);
        return new Endpoint(host, port, db);
    }

    private static int number(String raw, int defaultValue, String what, String url) {
        if (raw == null || raw.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid " + what + " '" + raw + "' in endpoint URL '" + url + "'", e);
        }
    }

    @Override
    public String toString() {
        return host + ":" + port + "/" + database;
    }
}
