package com.pgfga.reconciler.service;

import com.pgfga.reconciler.catalog.CatalogQueryExecutor;
import com.pgfga.reconciler.catalog.CatalogStatements;
import com.pgfga.reconciler.exception.ConnectionException;
import com.pgfga.reconciler.exception.QueryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

import static com.pgfga.reconciler.catalog.CatalogQueryExecutor.NO_PARAMETERS;

/**
 * Physical replication slots for standbys. Best effort: failures are logged and reported
 * as "no change", they never abort a reconciliation pass.
 */
@Slf4j
@Service
public class ReplicationSlotManager {

    public boolean ensureSlot(ReconciliationSession session, String slot) {
        try {
            if (slotExists(session, slot)) {
                log.debug("Replication slot '{}' already exists", slot);
                return false;
            }
            List<Map<String, Object>> rows = session.getCatalog().execute(session.getMaintenanceDatabase(),
                    CatalogStatements.CREATE_PHYSICAL_SLOT, List.of(slot));
            if (rows == null || rows.isEmpty()) {
                log.error("Creating replication slot '{}' returned no result", slot);
                return false;
            }
            log.info("Created replication slot '{}'", slot);
            return true;
        } catch (QueryException | ConnectionException e) {
            log.error("Failed to create replication slot '{}': {}", slot, e.getMessage());
            return false;
        }
    }

    public boolean dropSlot(ReconciliationSession session, String slot) {
        try {
            if (!slotExists(session, slot)) {
                return false;
            }
            session.getCatalog().execute(session.getMaintenanceDatabase(), CatalogStatements.DROP_SLOT, List.of(slot));
            log.info("Dropped replication slot '{}'", slot);
            return true;
        } catch (QueryException | ConnectionException e) {
            log.error("Failed to drop replication slot '{}': {}", slot, e.getMessage());
            return false;
        }
    }

    public List<String> listSlots(ReconciliationSession session) {
        try {
            return session.getCatalog().column(session.getMaintenanceDatabase(),
                    CatalogStatements.ALL_SLOTS, NO_PARAMETERS, "slot_name");
        } catch (QueryException | ConnectionException e) {
            log.error("Failed to list replication slots: {}", e.getMessage());
            return List.of();
        }
    }

    /**
     * Shared existence check. Lookup failures propagate to the public operations, which log them.
     */
    boolean slotExists(ReconciliationSession session, String slot) {
        CatalogQueryExecutor catalog = session.getCatalog();
        List<Map<String, Object>> rows = catalog.query(session.getMaintenanceDatabase(),
                CatalogStatements.SLOT_EXISTS, List.of(slot));
        return !rows.isEmpty() && Boolean.TRUE.equals(rows.get(0).get("exists"));
    }
}
