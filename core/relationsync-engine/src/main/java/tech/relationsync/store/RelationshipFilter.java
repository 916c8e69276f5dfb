package tech.relationsync.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import tech.relationsync.model.Relationship;

import java.util.Objects;

/**
 * Matches tuples field by field; null fields match anything.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RelationshipFilter(
    String objectType,
    String objectId,
    String relation,
    String subjectType,
    String subjectId,
    String subjectRelation
) {

    public static RelationshipFilter byObject(String objectType, String objectId) {
        return new RelationshipFilter(objectType, objectId, null, null, null, null);
    }

    public static RelationshipFilter byObject(String objectType, String objectId, String relation) {
        return new RelationshipFilter(objectType, objectId, relation, null, null, null);
    }

    public static RelationshipFilter bySubject(String subjectType, String subjectId) {
        return new RelationshipFilter(null, null, null, subjectType, subjectId, null);
    }

    public boolean matches(Relationship relationship) {
        return matches(objectType, relationship.object().type())
            && matches(objectId, relationship.object().id())
            && matches(relation, relationship.relation())
            && matches(subjectType, relationship.subject().object().type())
            && matches(subjectId, relationship.subject().object().id())
            && matches(subjectRelation, relationship.subject().relation());
    }

    private static boolean matches(String expected, String actual) {
        return expected == null || Objects.equals(expected, actual);
    }
}
