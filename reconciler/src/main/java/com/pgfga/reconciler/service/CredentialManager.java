package com.pgfga.reconciler.service;

import com.pgfga.reconciler.catalog.CatalogQueryExecutor;
import com.pgfga.reconciler.catalog.CatalogStatements;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.regex.Pattern;

import static com.pgfga.reconciler.catalog.CatalogQueryExecutor.NO_PARAMETERS;

/**
 * Keeps stored password verifiers and expiry timestamps of login roles in line with the desired state.
 * Plain-text passwords are never sent to the engine; only their md5 verifier is.
 */
@Slf4j
@Service
public class CredentialManager {

    private static final Pattern MD5_VERIFIER = Pattern.compile("^md5[0-9a-fA-F]{32}$");
    private static final String SCRAM_PREFIX = "SCRAM-SHA-256$";

    public boolean setPassword(ReconciliationSession session, String username, String password) {
        String verifier = hashPassword(username, password);
        CatalogQueryExecutor catalog = session.getCatalog();
        String database = session.getMaintenanceDatabase();

        if (!catalog.exists(database, CatalogStatements.PASSWORD_DIFFERS, List.of(username, verifier))) {
            log.debug("Password of '{}' is up to date", username);
            return false;
        }
        catalog.execute(database, CatalogStatements.setPassword(username, verifier), NO_PARAMETERS);
        log.info("Updated password of '{}'", username);
        return true;
    }

    /**
     * Clears the stored password, e.g. for users authenticating through the directory or certificates.
     * The session's own user is never touched.
     */
    public boolean resetPassword(ReconciliationSession session, String username) {
        CatalogQueryExecutor catalog = session.getCatalog();
        String database = session.getMaintenanceDatabase();

        if (!catalog.exists(database, CatalogStatements.PASSWORD_IS_SET, List.of(username))) {
            return false;
        }
        catalog.execute(database, CatalogStatements.resetPassword(username), NO_PARAMETERS);
        log.info("Reset password of '{}'", username);
        return true;
    }

    public boolean setExpiry(ReconciliationSession session, String username, String validUntil) {
        if (validUntil == null || validUntil.isBlank()) {
            return false;
        }
        CatalogQueryExecutor catalog = session.getCatalog();
        String database = session.getMaintenanceDatabase();

        if (!catalog.exists(database, CatalogStatements.EXPIRY_DIFFERS, List.of(username, validUntil))) {
            return false;
        }
        catalog.execute(database, CatalogStatements.setValidUntil(username, validUntil), NO_PARAMETERS);
        log.info("Set expiry of '{}' to {}", username, validUntil);
        return true;
    }

    /**
     * The verifier stored for a password: pre-hashed md5 or SCRAM values are returned as is,
     * anything else becomes {@code "md5" + md5(password + username)}.
     */
    public static String hashPassword(String username, String password) {
        if (isPreHashed(password)) {
            return password;
        }
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            byte[] digest = md5.digest((password + username).getBytes(StandardCharsets.UTF_8));
            return "md5" + HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    public static boolean isPreHashed(String password) {
        return password != null
                && (MD5_VERIFIER.matcher(password).matches() || password.startsWith(SCRAM_PREFIX));
    }
}
