package com.pgfga.reconciler.config;

import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "pgfga.ldap")
public class LdapProperties {

    private boolean enabled = false;

    /**
     * Host names, tried in order.
     */
    private List<String> servers = new ArrayList<>();

    private int port = 636;

    /**
     * Bind DN.
     */
    private String user;

    @ToString.Exclude
    private String password;

    private String basedn;

    /**
     * Template used to expand short group names, e.g. {@code (&(objectClass=posixGroup)(cn=%s))}.
     */
    private String filterTemplate;

    private int pageSize = 5;

    private String memberAttribute = "memberUid";

    /**
     * Connection attempts per search.
     */
    private int connRetries = 3;
}
