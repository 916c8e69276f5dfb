package tech.relationsync.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * One tuple {@code object#relation@subject} of the relationship graph.
 *
 * <p>Equality is structural. Ordering is total and stable, so sets of tuples
 * always iterate the same way regardless of how they were built.
 */
public record Relationship(ObjectReference object, String relation, SubjectReference subject)
        implements Comparable<Relationship> {

    private static final Comparator<Relationship> ORDER = Comparator
        .comparing(Relationship::object)
        .thenComparing(Relationship::relation)
        .thenComparing(Relationship::subject);

    public Relationship {
        Objects.requireNonNull(object, "object");
        Objects.requireNonNull(relation, "relation");
        Objects.requireNonNull(subject, "subject");
        if (relation.isBlank()) {
            throw new IllegalArgumentException("Relation must not be blank");
        }
    }

    public static Relationship of(ObjectReference object, String relation, ObjectReference subject) {
        return new Relationship(object, relation, SubjectReference.of(subject));
    }

    public static Relationship of(ObjectReference object, String relation, ObjectReference subject, String subjectRelation) {
        return new Relationship(object, relation, SubjectReference.of(subject, subjectRelation));
    }

    /**
     * Parse the zed notation {@code type:id#relation@type:id[#relation]}.
     */
    public static Relationship parse(String zed) {
        int at = zed.indexOf('@');
        if (at < 0) {
            throw new IllegalArgumentException("Missing '@' in relationship: " + zed);
        }
        String resource = zed.substring(0, at);
        String subject = zed.substring(at + 1);

        int hash = resource.lastIndexOf('#');
        if (hash < 0) {
            throw new IllegalArgumentException("Missing relation in relationship: " + zed);
        }
        ObjectReference object = parseObject(resource.substring(0, hash), zed);
        String relation = resource.substring(hash + 1);

        int subjectHash = subject.lastIndexOf('#');
        if (subjectHash < 0) {
            return new Relationship(object, relation, SubjectReference.of(parseObject(subject, zed)));
        }
        return new Relationship(object, relation,
            SubjectReference.of(parseObject(subject.substring(0, subjectHash), zed), subject.substring(subjectHash + 1)));
    }

    private static ObjectReference parseObject(String value, String zed) {
        // types may contain '/', ids never contain ':'
        int colon = value.lastIndexOf(':');
        if (colon <= 0 || colon == value.length() - 1) {
            throw new IllegalArgumentException("Malformed object reference '" + value + "' in: " + zed);
        }
        return new ObjectReference(value.substring(0, colon), value.substring(colon + 1));
    }

    @Override
    public int compareTo(Relationship other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return object + "#" + relation + "@" + subject;
    }
}
