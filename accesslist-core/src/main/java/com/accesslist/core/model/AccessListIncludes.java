package com.accesslist.core.model;

import java.util.Set;

/**
 * Optional parts to load together with {@link AccessListInfo}.
 */
public enum AccessListIncludes {

    RESOURCE_CONNECTIONS,

    /** Resource connections including their actions. Implies {@link #RESOURCE_CONNECTIONS}. */
    RESOURCE_CONNECTIONS_ACTIONS;

    public static boolean resourceConnections(Set<AccessListIncludes> includes) {
        return includes.contains(RESOURCE_CONNECTIONS) || includes.contains(RESOURCE_CONNECTIONS_ACTIONS);
    }

    public static boolean resourceConnectionActions(Set<AccessListIncludes> includes) {
        return includes.contains(RESOURCE_CONNECTIONS_ACTIONS);
    }
}
