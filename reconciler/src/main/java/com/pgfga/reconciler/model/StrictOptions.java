package com.pgfga.reconciler.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per object class switches for destructive actions. By default
 * undeclared roles and extensions are removed, undeclared databases are kept.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrictOptions {

    @Builder.Default
    private boolean users = true;

    @Builder.Default
    private boolean databases = false;

    @Builder.Default
    private boolean extensions = true;

    public static StrictOptions disabled() {
        return new StrictOptions(false, false, false);
    }

    public static StrictOptions enabled() {
        return new StrictOptions(true, true, true);
    }
}
