package tech.relationsync.translate;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.relationsync.config.RelationSyncConfig;
import tech.relationsync.model.DomainObjectRef;
import tech.relationsync.model.ObjectReference;
import tech.relationsync.model.Relationship;
import tech.relationsync.model.RelationshipSet;
import tech.relationsync.rbac.CrossAccountStatus;
import tech.relationsync.rbac.DomainObjectState;
import tech.relationsync.rbac.DomainObjectState.CrossAccountRequestState;
import tech.relationsync.rbac.DomainObjectState.GroupState;
import tech.relationsync.rbac.DomainObjectState.RoleBindingState;
import tech.relationsync.rbac.DomainObjectState.RoleState;
import tech.relationsync.rbac.DomainObjectState.WorkspaceState;
import tech.relationsync.rbac.ResourceDefinition;
import tech.relationsync.rbac.RoleAccess;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Collectors;

import static tech.relationsync.model.RelationSchema.*;

/**
 * Derives the canonical tuple set of an RBAC domain object.
 *
 * <p>Translation is a pure function of the snapshot it is given: the same snapshot yields
 * an equal set on every call and in every process. Synthetic ids (scoped sub-roles and
 * role bindings) are content-derived for that reason.
 *
 * <p>Group nesting is emitted as {@code group:G#member@group:S#member} and never flattened;
 * the relationship store resolves transitive membership itself.
 */
@ApplicationScoped
public class RelationTranslator {

    private static final int SUB_ROLE_HASH_LENGTH = 12;

    private final String publicTenantName;

    @Inject
    public RelationTranslator(RelationSyncConfig config) {
        this(config.publicTenantName());
    }

    public RelationTranslator(String publicTenantName) {
        this.publicTenantName = publicTenantName;
    }

    /**
     * Canonical set for a domain object.
     *
     * @throws IncompleteDomainStateException if the snapshot references unresolved objects
     * @throws TranslationException if the object cannot be expressed in the schema
     */
    public RelationshipSet translate(DomainObjectState state) {
        if (state instanceof GroupState group) {
            return translateGroup(group);
        } else if (state instanceof RoleState role) {
            return translateRole(role);
        } else if (state instanceof RoleBindingState binding) {
            return translateRoleBinding(binding);
        } else if (state instanceof WorkspaceState workspace) {
            return translateWorkspace(workspace);
        } else if (state instanceof CrossAccountRequestState request) {
            return translateCrossAccountRequest(request);
        }
        throw new TranslationException("Unsupported domain object state: " + state.getClass().getSimpleName());
    }

    private RelationshipSet translateGroup(GroupState group) {
        ObjectReference groupRef = ObjectReference.of(GROUP, group.id());
        RelationshipSet.Builder tuples = RelationshipSet.builder();
        for (String principal : group.principals()) {
            tuples.add(Relationship.of(groupRef, MEMBER, ObjectReference.of(USER, principal)));
        }
        for (String subgroupId : group.subgroupIds()) {
            if (subgroupId.equals(group.id())) {
                throw new TranslationException("Group " + group.id() + " cannot be nested in itself");
            }
            tuples.add(Relationship.of(groupRef, MEMBER, ObjectReference.of(GROUP, subgroupId), MEMBER));
        }
        return tuples.build();
    }

    private RelationshipSet translateRole(RoleState role) {
        ObjectReference v1Role = ObjectReference.of(V1_ROLE, role.id());
        ObjectReference baseRole = ObjectReference.of(ROLE, role.id());
        RelationshipSet.Builder tuples = RelationshipSet.builder();

        Set<String> unscoped = unscopedPermissions(role);
        for (String permission : unscoped) {
            tuples.add(Relationship.of(baseRole, permission, ObjectReference.of(USER, WILDCARD)));
        }
        if (!unscoped.isEmpty()) {
            tuples.add(Relationship.of(v1Role, ROLE_RELATION, baseRole));
        }

        for (ScopedGrant grant : scopedGrants(role)) {
            ObjectReference subRole = ObjectReference.of(ROLE, grant.subRoleId());
            tuples.add(Relationship.of(subRole, grant.permission(), ObjectReference.of(USER, WILDCARD)));
            tuples.add(Relationship.of(v1Role, ROLE_RELATION, subRole));
        }
        return tuples.build();
    }

    private RelationshipSet translateRoleBinding(RoleBindingState binding) {
        DomainObjectRef ref = binding.ref();
        if (publicTenantName.equals(binding.tenantName())) {
            throw new TranslationException("Cannot bind role " + binding.roleId() + " to the " + publicTenantName + " tenant");
        }
        RoleState role = binding.role()
            .orElseThrow(() -> new IncompleteDomainStateException(ref, "Role " + binding.roleId() + " not found"));

        ObjectReference subject = ObjectReference.of(GROUP, binding.groupId());
        return bindRole(ref, role, binding.groupId(), subject, MEMBER, binding.defaultWorkspaceId());
    }

    private RelationshipSet translateWorkspace(WorkspaceState workspace) {
        ObjectReference parent = workspace.parentId() == null
            ? ObjectReference.of(TENANT, workspace.tenantId())
            : ObjectReference.of(WORKSPACE, workspace.parentId());
        if (workspace.id().equals(workspace.parentId())) {
            throw new TranslationException("Workspace " + workspace.id() + " cannot be its own parent");
        }
        return RelationshipSet.of(Relationship.of(ObjectReference.of(WORKSPACE, workspace.id()), PARENT, parent));
    }

    private RelationshipSet translateCrossAccountRequest(CrossAccountRequestState request) {
        if (request.status() != CrossAccountStatus.APPROVED) {
            return RelationshipSet.empty();
        }
        DomainObjectRef ref = request.ref();
        ObjectReference principal = ObjectReference.of(USER, request.principalName());
        RelationshipSet.Builder tuples = RelationshipSet.builder();
        for (String roleId : request.roleIds()) {
            RoleState role = request.roles().stream()
                .filter(r -> r.id().equals(roleId))
                .findFirst()
                .orElseThrow(() -> new IncompleteDomainStateException(ref, "Role " + roleId + " not found"));
            tuples.addAll(bindRole(ref, role, "car:" + request.requestId(), principal, null, request.defaultWorkspaceId()));
        }
        return tuples.build();
    }

    /**
     * Emit the role_binding nodes granting {@code role} to {@code subject}: one binding for the
     * unconditional permissions at the default workspace and one per scoped resource.
     */
    private RelationshipSet bindRole(DomainObjectRef owner, RoleState role, String subjectKey,
                                     ObjectReference subject, String subjectRelation,
                                     Optional<String> defaultWorkspaceId) {
        List<GrantTarget> targets = new ArrayList<>();
        if (!unscopedPermissions(role).isEmpty()) {
            String workspaceId = defaultWorkspaceId
                .orElseThrow(() -> new IncompleteDomainStateException(owner, "Default workspace not found"));
            targets.add(new GrantTarget(role.id(), ObjectReference.of(WORKSPACE, workspaceId)));
        }
        for (ScopedGrant grant : scopedGrants(role)) {
            for (ObjectReference scope : grant.scopes()) {
                targets.add(new GrantTarget(grant.subRoleId(), scope));
            }
        }

        ObjectReference v1Role = ObjectReference.of(V1_ROLE, role.id());
        RelationshipSet.Builder tuples = RelationshipSet.builder();
        for (GrantTarget target : targets) {
            ObjectReference binding = ObjectReference.of(ROLE_BINDING, bindingId(subjectKey, target));
            tuples.add(Relationship.of(binding, GRANTED, ObjectReference.of(ROLE, target.grantedRoleId())));
            tuples.add(Relationship.of(binding, SUBJECT, subject, subjectRelation));
            tuples.add(Relationship.of(v1Role, BINDING, binding));
            tuples.add(Relationship.of(target.scope(), USER_GRANT, binding));
        }
        return tuples.build();
    }

    private Set<String> unscopedPermissions(RoleState role) {
        return role.access().stream()
            .filter(access -> !access.isScoped())
            .map(access -> PermissionNames.toRelation(access.permission()))
            .collect(Collectors.toCollection(TreeSet::new));
    }

    private List<ScopedGrant> scopedGrants(RoleState role) {
        Set<ScopedGrant> grants = new LinkedHashSet<>();
        for (RoleAccess access : role.access()) {
            if (!access.isScoped()) {
                continue;
            }
            String permission = PermissionNames.toRelation(access.permission());
            List<ResourceDefinition> definitions = access.resourceDefinitions().stream()
                .sorted(Comparator.comparing(ResourceDefinition::canonical))
                .toList();
            String subRoleId = role.id() + "_" + permission + "_" + filterHash(definitions);

            Set<ObjectReference> scopes = new LinkedHashSet<>();
            for (ResourceDefinition definition : definitions) {
                String scopeType = PermissionNames.toScopeType(definition.key());
                for (String resourceId : resourceIds(definition)) {
                    scopes.add(ObjectReference.of(scopeType, resourceId));
                }
            }
            grants.add(new ScopedGrant(subRoleId, permission, List.copyOf(scopes)));
        }
        return List.copyOf(grants);
    }

    private List<String> resourceIds(ResourceDefinition definition) {
        String operation = definition.operation().trim().toLowerCase(Locale.ROOT);
        List<String> ids = switch (operation) {
            case ResourceDefinition.OPERATION_EQUAL -> List.of(definition.value().trim());
            case ResourceDefinition.OPERATION_IN -> Arrays.stream(definition.value().split(","))
                .map(String::trim)
                .toList();
            default -> throw new TranslationException(
                "Unsupported resource definition operation '" + definition.operation() + "' on " + definition.key());
        };
        List<String> nonBlank = ids.stream().filter(id -> !id.isEmpty()).distinct().toList();
        if (nonBlank.isEmpty()) {
            throw new TranslationException("Resource definition on " + definition.key() + " names no resource");
        }
        return nonBlank;
    }

    static String filterHash(List<ResourceDefinition> definitions) {
        String canonical = definitions.stream()
            .map(ResourceDefinition::canonical)
            .collect(Collectors.joining(";"));
        return sha256(canonical).substring(0, SUB_ROLE_HASH_LENGTH);
    }

    private static String bindingId(String subjectKey, GrantTarget target) {
        String seed = subjectKey + "|" + target.grantedRoleId() + "|" + target.scope().type() + "|" + target.scope().id();
        return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    private record ScopedGrant(String subRoleId, String permission, List<ObjectReference> scopes) {
    }

    private record GrantTarget(String grantedRoleId, ObjectReference scope) {
    }
}
