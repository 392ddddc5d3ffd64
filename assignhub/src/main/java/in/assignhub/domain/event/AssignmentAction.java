package in.assignhub.domain.event;

/**
 * CRUD action recorded on an assignment change.
 */
public enum AssignmentAction {
    CREATE,
    UPDATE,
    DELETE
}
