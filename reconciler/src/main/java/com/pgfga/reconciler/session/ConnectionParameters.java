package com.pgfga.reconciler.session;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * libpq-style connection parameters (host, port, user, sslkey, ...) translated to what the
 * PostgreSQL JDBC driver expects.
 */
public class ConnectionParameters {

    public static final String HOST = "host";
    public static final String PORT = "port";
    public static final String USER = "user";
    public static final String PASSWORD = "password";
    public static final String DBNAME = "dbname";
    public static final String SSLKEY = "sslkey";

    private static final String DEFAULT_HOST = "localhost";
    private static final String DEFAULT_PORT = "5432";

    private static final List<String> SSL_PATH_KEYS = List.of("sslkey", "sslcert", "sslrootcert");

    // libpq key -> driver property, where the names differ
    private static final Map<String, String> DRIVER_PROPERTY_NAMES = Map.of(
            "connect_timeout", "connectTimeout",
            "application_name", "ApplicationName",
            "target_session_attrs", "targetServerType"
    );

    private final Map<String, String> params;

    public ConnectionParameters(Map<String, String> params) {
        this.params = new LinkedHashMap<>(params != null ? params : Map.of());
        for (String key : SSL_PATH_KEYS) {
            String value = this.params.get(key);
            if (value != null && !value.isBlank()) {
                this.params.put(key, resolvePath(value).toString());
            }
        }
    }

    /**
     * JDBC URL for one database of the cluster. A comma separated host list is kept as a
     * multi-host URL with the same port for every host.
     */
    public String jdbcUrl(String database) {
        String port = params.getOrDefault(PORT, DEFAULT_PORT);
        String hosts = List.of(params.getOrDefault(HOST, DEFAULT_HOST).split(",")).stream()
                .map(String::trim)
                .filter(host -> !host.isEmpty())
                .map(host -> host + ":" + port)
                .collect(Collectors.joining(","));
        return "jdbc:postgresql://" + hosts + "/" + URLEncoder.encode(database, StandardCharsets.UTF_8);
    }

    /**
     * Driver properties for every parameter except the ones that are part of the URL.
     */
    public Properties toDriverProperties() {
        Properties properties = new Properties();
        params.forEach((key, value) -> {
            if (value == null || HOST.equals(key) || PORT.equals(key) || DBNAME.equals(key)) {
                return;
            }
            properties.setProperty(DRIVER_PROPERTY_NAMES.getOrDefault(key, key), value);
        });
        return properties;
    }

    /**
     * The connection string in libpq format, without password and database name. Safe to log.
     */
    public String dsn() {
        return params.entrySet().stream()
                .filter(entry -> !PASSWORD.equals(entry.getKey()) && !DBNAME.equals(entry.getKey()))
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(" "));
    }

    public String sslKey() {
        String key = params.get(SSLKEY);
        return key == null || key.isBlank() ? null : key;
    }

    public String user() {
        return params.get(USER);
    }

    public String host() {
        return params.get(HOST);
    }

    static Path resolvePath(String value) {
        String expanded = value;
        if (expanded.equals("~") || expanded.startsWith("~/")) {
            expanded = System.getProperty("user.home") + expanded.substring(1);
        }
        Path path = Path.of(expanded).toAbsolutePath().normalize();
        if (Files.exists(path)) {
            try {
                return path.toRealPath();
            } catch (IOException e) {
                return path;
            }
        }
        return path;
    }
}
