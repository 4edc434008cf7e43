package com.pgfga.reconciler.model.spec;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything one reconciliation pass should make true, keyed by object name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DesiredState {

    @Builder.Default
    private Map<String, DatabaseSpec> databases = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, RoleSpec> roles = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, UserSpec> users = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Ensure> replicationSlots = new LinkedHashMap<>();
}
