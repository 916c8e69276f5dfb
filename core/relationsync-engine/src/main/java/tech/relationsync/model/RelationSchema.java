package tech.relationsync.model;

/**
 * Object types and relation names of the relationship-store schema.
 *
 * <pre>
 * definition rbac/v1role { relation role: role  relation binding: role_binding }
 * definition role        { relation &lt;permission&gt;: user:* }
 * definition group       { relation member: user | group#member }
 * definition role_binding { relation subject: user | group#member  relation granted: role }
 * definition workspace   { relation user_grant: role_binding  relation parent: workspace | tenant }
 * </pre>
 */
public final class RelationSchema {

    public static final String USER = "user";
    public static final String GROUP = "group";
    public static final String ROLE = "role";
    public static final String ROLE_BINDING = "role_binding";
    public static final String V1_ROLE = "rbac/v1role";
    public static final String WORKSPACE = "workspace";
    public static final String TENANT = "tenant";

    public static final String MEMBER = "member";
    public static final String GRANTED = "granted";
    public static final String SUBJECT = "subject";
    public static final String BINDING = "binding";
    public static final String ROLE_RELATION = "role";
    public static final String USER_GRANT = "user_grant";
    public static final String PARENT = "parent";

    public static final String WILDCARD = "*";

    private RelationSchema() {
    }
}
