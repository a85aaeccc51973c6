package hasync.core.model.realtime;

/**
 * Audience of a real-time event. Every event has exactly one target.
 */
public sealed interface EventTarget {

    /** All connections authorized for (and subscribed to) a scope. */
    record Scope(String scopeId) implements EventTarget {
        public Scope {
            if (scopeId == null || scopeId.isBlank()) {
                throw new IllegalArgumentException("Scope ID cannot be null or blank");
            }
        }
    }

    /** All connections of one subject. */
    record Subject(String subjectId) implements EventTarget {
        public Subject {
            if (subjectId == null || subjectId.isBlank()) {
                throw new IllegalArgumentException("Subject ID cannot be null or blank");
            }
        }
    }

    static EventTarget scope(String scopeId) {
        return new Scope(scopeId);
    }

    static EventTarget subject(String subjectId) {
        return new Subject(subjectId);
    }
}
