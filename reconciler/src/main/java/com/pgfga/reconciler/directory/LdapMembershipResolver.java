package com.pgfga.reconciler.directory;

import com.pgfga.reconciler.config.LdapProperties;
import com.pgfga.reconciler.exception.DirectoryException;
import com.pgfga.reconciler.exception.InvalidConfigurationException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ldap.CommunicationException;
import org.springframework.ldap.NamingException;
import org.springframework.ldap.control.PagedResultsCookie;
import org.springframework.ldap.control.PagedResultsDirContextProcessor;
import org.springframework.ldap.core.AttributesMapper;
import org.springframework.ldap.core.ContextSource;
import org.springframework.ldap.core.LdapOperations;
import org.springframework.ldap.core.support.LdapContextSource;
import org.springframework.ldap.core.support.SingleContextSource;
import org.springframework.stereotype.Component;

import javax.naming.NamingEnumeration;
import javax.naming.directory.Attribute;
import javax.naming.directory.SearchControls;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Looks up group members over LDAPS with a paged subtree search.
 *
 * The bind happens on first use, not at startup, so a disabled or unused directory never
 * needs to be reachable.
 */
@Slf4j
@Component
public class LdapMembershipResolver implements DirectoryMembershipResolver {

    /**
     * Placeholder member some directories require in otherwise empty posix groups.
     */
    static final String PLACEHOLDER_MEMBER = "dummy";

    private final LdapProperties properties;
    private final Retry retry;

    private ContextSource contextSource;

    public LdapMembershipResolver(LdapProperties properties) {
        this.properties = properties;
        this.retry = Retry.of("ldap", RetryConfig.custom()
                .maxAttempts(Math.max(1, properties.getConnRetries()))
                .waitDuration(Duration.ofSeconds(1))
                .retryExceptions(CommunicationException.class)
                .build());
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("LDAP search failed, attempt {}: {}", event.getNumberOfRetryAttempts(),
                        event.getLastThrowable().getMessage()));
    }

    @Override
    public List<String> groupMembers(String baseDn, String filter) {
        if (!properties.isEnabled()) {
            log.info("LDAP sync is disabled, no members resolved for {}", filter);
            return List.of();
        }

        String base = baseDn == null || baseDn.isBlank() ? properties.getBasedn() : baseDn;
        String searchFilter = expandFilter(filter);

        try {
            List<String> members = retry.executeSupplier(() -> SingleContextSource.doWithSingleContext(
                    contextSource(), operations -> collectMembers(operations, base, searchFilter)));
            log.info("Resolved {} members for {}", members.size(), searchFilter);
            return members;
        } catch (NamingException e) {
            throw new DirectoryException("LDAP search for " + searchFilter + " under " + base + " failed: "
                    + e.getMessage(), e);
        }
    }

    /**
     * Expands short group names (no parenthesis) through the configured filter template.
     */
    String expandFilter(String filter) {
        if (filter == null || filter.isBlank()) {
            throw new InvalidConfigurationException("LDAP filter must not be empty");
        }
        if (filter.contains("(")) {
            return filter;
        }
        String template = properties.getFilterTemplate();
        if (template == null || template.isBlank()) {
            throw new InvalidConfigurationException("LDAP filter '" + filter
                    + "' is not a search filter and no filter template is set");
        }
        String expanded = String.format(template, filter);
        log.debug("Using {} for group {}", expanded, filter);
        return expanded;
    }

    List<String> collectMembers(LdapOperations operations, String base, String filter) {
        String memberAttribute = properties.getMemberAttribute();

        SearchControls controls = new SearchControls();
        controls.setSearchScope(SearchControls.SUBTREE_SCOPE);
        controls.setReturningAttributes(new String[]{memberAttribute});

        AttributesMapper<List<String>> mapper = attributes -> {
            List<String> values = new ArrayList<>();
            Attribute attribute = attributes.get(memberAttribute);
            if (attribute == null) {
                return values;
            }
            NamingEnumeration<?> all = attribute.getAll();
            while (all.hasMore()) {
                values.add(decode(all.next()));
            }
            return values;
        };

        PagedResultsDirContextProcessor processor = new PagedResultsDirContextProcessor(properties.getPageSize());
        Set<String> members = new TreeSet<>();
        do {
            operations.search(base, filter, controls, mapper, processor).forEach(members::addAll);
        } while (hasNextPage(processor));

        members.remove(PLACEHOLDER_MEMBER);
        return new ArrayList<>(members);
    }

    private static boolean hasNextPage(PagedResultsDirContextProcessor processor) {
        PagedResultsCookie cookie = processor.getCookie();
        return cookie != null && cookie.getCookie() != null && cookie.getCookie().length > 0;
    }

    private static String decode(Object value) {
        if (value instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        return String.valueOf(value);
    }

    private synchronized ContextSource contextSource() {
        if (contextSource == null) {
            LdapContextSource source = new LdapContextSource();
            source.setUrls(properties.getServers().stream()
                    .map(server -> "ldaps://" + server + ":" + properties.getPort())
                    .toArray(String[]::new));
            source.setUserDn(properties.getUser());
            source.setPassword(properties.getPassword());
            source.setPooled(false);
            source.afterPropertiesSet();
            contextSource = source;
            log.info("Using LDAP servers {}", properties.getServers());
        }
        return contextSource;
    }
}
