package com.pgfga.reconciler.directory;

import java.util.List;

/**
 * Resolves the member user ids of a directory group.
 */
public interface DirectoryMembershipResolver {

    /**
     * @param baseDn search base, or {@code null} for the configured default
     * @param filter a full search filter, or a short group name expanded through the filter template
     * @return member ids, sorted and without duplicates; empty when directory sync is disabled
     */
    List<String> groupMembers(String baseDn, String filter);
}
