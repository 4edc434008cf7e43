package com.pgfga.reconciler.config;

import com.pgfga.reconciler.catalog.CatalogQueryExecutor;
import com.pgfga.reconciler.model.StrictOptions;
import com.pgfga.reconciler.model.spec.DesiredState;
import com.pgfga.reconciler.session.ConnectionParameters;
import com.pgfga.reconciler.session.SecureKeyFileMaterializer;
import com.pgfga.reconciler.session.SessionManager;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.sql.DriverManager;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
public class ReconcilerConfig {

    @Bean
    public ConnectionParameters connectionParameters(PostgresProperties properties) {
        // dashed keys are accepted for libpq names: connect-timeout for connect_timeout
        Map<String, String> params = new LinkedHashMap<>();
        properties.getConnection().forEach((key, value) -> params.put(key.replace('-', '_'), value));
        return new ConnectionParameters(params);
    }

    @Bean(destroyMethod = "close")
    public SessionManager sessionManager(ConnectionParameters connectionParameters) {
        return new SessionManager(connectionParameters, new SecureKeyFileMaterializer(), DriverManager::getConnection);
    }

    @Bean
    public CatalogQueryExecutor catalogQueryExecutor(SessionManager sessionManager) {
        return new CatalogQueryExecutor(sessionManager);
    }

    @Bean
    @ConfigurationProperties(prefix = "pgfga.strict")
    public StrictOptions strictOptions() {
        return new StrictOptions();
    }

    @Bean
    @ConfigurationProperties(prefix = "pgfga.desired")
    public DesiredState desiredState() {
        return new DesiredState();
    }
}
