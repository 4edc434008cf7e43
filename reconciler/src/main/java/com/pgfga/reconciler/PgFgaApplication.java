package com.pgfga.reconciler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.ldap.LdapAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

// sessions are opened per database by SessionManager, not through a pooled DataSource
@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class, LdapAutoConfiguration.class})
@ConfigurationPropertiesScan
public class PgFgaApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PgFgaApplication.class, args)));
    }
}
