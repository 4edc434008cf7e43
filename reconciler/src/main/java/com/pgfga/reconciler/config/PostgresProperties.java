package com.pgfga.reconciler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "pgfga.postgres")
public class PostgresProperties {

    /**
     * libpq-style connection parameters: host, port, user, password, sslmode, sslkey, ...
     */
    private Map<String, String> connection = new LinkedHashMap<>();

    /**
     * Database used for cluster-wide statements.
     */
    private String maintenanceDatabase = "postgres";
}
