package com.reasoning.kgml.engine;

/** What an executed command did. */
public enum CommandStatus {
    CREATED,
    UPDATED,
    DELETED,
    EVALUATED,
    /** An edge was declared. */
    DECLARED
}
