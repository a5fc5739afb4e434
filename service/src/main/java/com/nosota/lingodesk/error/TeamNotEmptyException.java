package com.nosota.lingodesk.error;

/**
 * Raised when deleting a team that still has users assigned.
 */
public class TeamNotEmptyException extends IllegalStateException {
    public TeamNotEmptyException(Long teamId, long userCount) {
        super("Cannot delete team " + teamId + ": " + userCount + " user(s) still assigned. Reassign or remove them first.");
    }
}
