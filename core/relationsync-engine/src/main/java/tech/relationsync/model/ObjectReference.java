package tech.relationsync.model;

import java.util.Objects;

/**
 * A typed node in the relationship graph, e.g. {@code group:9aca5b38}.
 */
public record ObjectReference(String type, String id) implements Comparable<ObjectReference> {

    public ObjectReference {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(id, "id");
        if (type.isBlank() || id.isBlank()) {
            throw new IllegalArgumentException("Object type and id must not be blank");
        }
    }

    public static ObjectReference of(String type, String id) {
        return new ObjectReference(type, id);
    }

    @Override
    public int compareTo(ObjectReference other) {
        int byType = type.compareTo(other.type);
        return byType != 0 ? byType : id.compareTo(other.id);
    }

    @Override
    public String toString() {
        return type + ":" + id;
    }
}
