package org.Aayush.series.registry;

/**
 * Behavior when two inputs report the same range start.
 *
 * <p>The by-start view keys entries on start value, so two inputs with one start cannot both
 * be resolvable.</p>
 */
public enum DuplicateStartPolicy {
    /**
     * Later registration replaces the earlier one in the by-start view. The earlier input stays
     * reachable by index but never owns a requested time. A warning is logged.
     */
    REPLACE,
    /**
     * Registration fails with {@code FS_DUPLICATE_START}.
     */
    REJECT
}
