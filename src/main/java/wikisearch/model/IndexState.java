package wikisearch.model;

/**
 * State of the search index during a rebuild.
 */
public enum IndexState {
    ABSENT,
    PRESENT;

    public static IndexState of(boolean exists) {
        return exists ? PRESENT : ABSENT;
    }

    public IndexState create() {
        if (this != ABSENT) {
            throw new IllegalStateException("Index can only be created when absent, current state: " + this);
        }
        return PRESENT;
    }

    public IndexState delete() {
        if (this != PRESENT) {
            throw new IllegalStateException("Index can only be deleted when present, current state: " + this);
        }
        return ABSENT;
    }
}
