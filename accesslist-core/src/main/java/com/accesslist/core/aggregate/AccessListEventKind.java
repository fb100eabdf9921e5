package com.accesslist.core.aggregate;

/**
 * The closed set of access list event kinds, with the name each one is stored under.
 */
public enum AccessListEventKind {

    CREATED("created"),
    UPDATED("updated"),
    DELETED("deleted"),
    RESOURCE_CONNECTION_CREATED("resource_connection_created"),
    RESOURCE_CONNECTION_ACTIONS_ADDED("resource_connection_actions_added"),
    RESOURCE_CONNECTION_ACTIONS_REMOVED("resource_connection_actions_removed"),
    RESOURCE_CONNECTION_DELETED("resource_connection_deleted"),
    MEMBERS_ADDED("members_added"),
    MEMBERS_REMOVED("members_removed");

    private final String dbName;

    AccessListEventKind(String dbName) {
        this.dbName = dbName;
    }

    public String dbName() {
        return dbName;
    }

    public static AccessListEventKind fromDbName(String dbName) {
        for (AccessListEventKind kind : values()) {
            if (kind.dbName.equals(dbName)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown access list event kind: " + dbName);
    }
}
