package com.pgfga.reconciler.config;

import com.pgfga.reconciler.exception.InvalidConfigurationException;
import com.pgfga.reconciler.session.ConnectionParameters;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;

/**
 * Validates connection and directory settings on startup.
 * Fails fast if required configuration is missing or invalid.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupValidator {

    private final ConnectionParameters connectionParameters;
    private final LdapProperties ldapProperties;

    @PostConstruct
    public void validate() {
        log.info("Validating startup configuration...");

        validateConnection();
        validateClientKey();
        validateLdap();

        log.info("Startup configuration validation complete");
    }

    private void validateConnection() {
        String user = connectionParameters.user();
        if (user == null || user.isBlank()) {
            throw new InvalidConfigurationException(
                    "pgfga.postgres.connection.user must be configured");
        }
        log.info("Connecting as '{}' to {}", user, connectionParameters.host());
    }

    private void validateClientKey() {
        String sslKey = connectionParameters.sslKey();
        if (sslKey == null) {
            return;
        }

        File keyFile = new File(sslKey);
        if (!keyFile.exists()) {
            log.warn("SSL client key does not exist at: {}. Certificate authentication will fail.", sslKey);
        } else if (!keyFile.canRead()) {
            throw new InvalidConfigurationException("SSL client key exists but is not readable: " + sslKey);
        } else {
            log.info("SSL client key validated: {}", sslKey);
        }
    }

    private void validateLdap() {
        if (!ldapProperties.isEnabled()) {
            log.info("LDAP sync disabled");
            return;
        }

        if (ldapProperties.getServers() == null || ldapProperties.getServers().isEmpty()) {
            throw new InvalidConfigurationException("pgfga.ldap.servers must be set when LDAP sync is enabled");
        }
        if (isBlank(ldapProperties.getUser()) || isBlank(ldapProperties.getPassword())) {
            throw new InvalidConfigurationException(
                    "pgfga.ldap.user and pgfga.ldap.password must be set when LDAP sync is enabled");
        }
        if (ldapProperties.getPort() <= 0) {
            throw new InvalidConfigurationException("pgfga.ldap.port has invalid value: " + ldapProperties.getPort());
        }
        String template = ldapProperties.getFilterTemplate();
        if (!isBlank(template) && !template.contains("%s")) {
            throw new InvalidConfigurationException("pgfga.ldap.filter-template must contain %s: " + template);
        }
        if (isBlank(ldapProperties.getBasedn())) {
            log.warn("pgfga.ldap.basedn not configured. Every ldap group needs its own basedn.");
        }

        log.info("LDAP configuration validated: {} server(s)", ldapProperties.getServers().size());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
