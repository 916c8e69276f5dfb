package tech.relationsync.rbac.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.agroal.api.AgroalDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.relationsync.model.DomainObjectRef;
import tech.relationsync.rbac.CrossAccountStatus;
import tech.relationsync.rbac.DomainObjectState;
import tech.relationsync.rbac.DomainObjectState.CrossAccountRequestState;
import tech.relationsync.rbac.DomainObjectState.GroupState;
import tech.relationsync.rbac.DomainObjectState.RoleBindingState;
import tech.relationsync.rbac.DomainObjectState.RoleState;
import tech.relationsync.rbac.DomainObjectState.WorkspaceState;
import tech.relationsync.rbac.RbacStateSource;
import tech.relationsync.rbac.ResourceDefinition;
import tech.relationsync.rbac.RoleAccess;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.StreamSupport;

/**
 * Reads RBAC state straight from the RBAC service's relational schema.
 * All reads are plain SELECTs on the default datasource; nothing is written.
 */
@ApplicationScoped
public class JdbcRbacStateSource implements RbacStateSource {

    private static final Logger LOG = Logger.getLogger(JdbcRbacStateSource.class);

    private static final String DEFAULT_WORKSPACE_TYPE = "default";

    @Inject
    AgroalDataSource dataSource;

    @Inject
    ObjectMapper objectMapper;

    @Override
    public Optional<DomainObjectState> load(DomainObjectRef ref) {
        try (Connection conn = dataSource.getConnection()) {
            return switch (ref.type()) {
                case GROUP -> loadGroup(conn, ref.id());
                case ROLE -> loadRole(conn, ref.id()).map(DomainObjectState.class::cast);
                case ROLE_BINDING -> loadRoleBinding(conn, ref.bindingGroupId(), ref.bindingRoleId());
                case WORKSPACE -> loadWorkspace(conn, ref.id());
                case CROSS_ACCOUNT_REQUEST -> loadCrossAccountRequest(conn, ref.id());
            };
        } catch (SQLException e) {
            LOG.errorf(e, "Failed to load RBAC state for %s", ref);
            throw new RbacQueryException("Failed to load RBAC state for " + ref, e);
        }
    }

    @Override
    public List<DomainObjectRef> listDomainObjects() {
        List<DomainObjectRef> refs = new ArrayList<>();
        try (Connection conn = dataSource.getConnection()) {
            queryStrings(conn, "SELECT uuid FROM management_group ORDER BY uuid")
                .forEach(id -> refs.add(DomainObjectRef.group(id)));
            queryStrings(conn, "SELECT uuid FROM management_role ORDER BY uuid")
                .forEach(id -> refs.add(DomainObjectRef.role(id)));
            refs.addAll(queryBindings(conn, """
                SELECT DISTINCT g.uuid, r.uuid
                FROM management_policy p
                JOIN management_group g ON g.id = p.group_id
                JOIN management_policy_roles pr ON pr.policy_id = p.id
                JOIN management_role r ON r.id = pr.role_id
                ORDER BY g.uuid, r.uuid
                """, null));
            queryStrings(conn, "SELECT id FROM management_workspace ORDER BY id")
                .forEach(id -> refs.add(DomainObjectRef.workspace(id)));
            queryStrings(conn, "SELECT request_id FROM api_crossaccountrequest ORDER BY request_id")
                .forEach(id -> refs.add(DomainObjectRef.crossAccountRequest(id)));
        } catch (SQLException e) {
            LOG.errorf(e, "Failed to list RBAC domain objects");
            throw new RbacQueryException("Failed to list RBAC domain objects", e);
        }
        return refs;
    }

    @Override
    public List<DomainObjectRef> findDependents(DomainObjectRef ref) {
        List<DomainObjectRef> dependents = new ArrayList<>();
        try (Connection conn = dataSource.getConnection()) {
            switch (ref.type()) {
                case GROUP -> {
                    dependents.addAll(queryBindings(conn, """
                        SELECT DISTINCT g.uuid, r.uuid
                        FROM management_policy p
                        JOIN management_group g ON g.id = p.group_id
                        JOIN management_policy_roles pr ON pr.policy_id = p.id
                        JOIN management_role r ON r.id = pr.role_id
                        WHERE g.uuid = ?
                        """, ref.id()));
                    queryStrings(conn, """
                        SELECT parent.uuid
                        FROM management_group_subgroups s
                        JOIN management_group parent ON parent.id = s.from_group_id
                        JOIN management_group child ON child.id = s.to_group_id
                        WHERE child.uuid = ?
                        """, ref.id()).forEach(id -> dependents.add(DomainObjectRef.group(id)));
                }
                case ROLE -> {
                    dependents.addAll(queryBindings(conn, """
                        SELECT DISTINCT g.uuid, r.uuid
                        FROM management_policy p
                        JOIN management_group g ON g.id = p.group_id
                        JOIN management_policy_roles pr ON pr.policy_id = p.id
                        JOIN management_role r ON r.id = pr.role_id
                        WHERE r.uuid = ?
                        """, ref.id()));
                    queryStrings(conn, """
                        SELECT DISTINCT car.request_id
                        FROM api_crossaccountrequest car
                        JOIN api_crossaccountrequest_roles cr ON cr.crossaccountrequest_id = car.request_id
                        JOIN management_role r ON r.id = cr.role_id
                        WHERE r.uuid = ?
                        """, ref.id()).forEach(id -> dependents.add(DomainObjectRef.crossAccountRequest(id)));
                }
                case WORKSPACE -> queryStrings(conn,
                    "SELECT id FROM management_workspace WHERE parent_id = ?", ref.id())
                    .forEach(id -> dependents.add(DomainObjectRef.workspace(id)));
                case ROLE_BINDING, CROSS_ACCOUNT_REQUEST -> {
                    // leaf objects
                }
            }
        } catch (SQLException e) {
            LOG.errorf(e, "Failed to find dependents of %s", ref);
            throw new RbacQueryException("Failed to find dependents of " + ref, e);
        }
        return dependents;
    }

    private Optional<DomainObjectState> loadGroup(Connection conn, String groupId) throws SQLException {
        String sql = """
            SELECT g.uuid, t.org_id
            FROM management_group g
            JOIN api_tenant t ON t.id = g.tenant_id
            WHERE g.uuid = ?
            """;
        String tenantId;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, groupId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                tenantId = rs.getString(2);
            }
        }

        List<String> principals = queryStrings(conn, """
            SELECT p.username
            FROM management_group_principals gp
            JOIN management_group g ON g.id = gp.group_id
            JOIN management_principal p ON p.id = gp.principal_id
            WHERE g.uuid = ?
            """, groupId);
        List<String> subgroups = queryStrings(conn, """
            SELECT child.uuid
            FROM management_group_subgroups s
            JOIN management_group parent ON parent.id = s.from_group_id
            JOIN management_group child ON child.id = s.to_group_id
            WHERE parent.uuid = ?
            """, groupId);

        return Optional.of(new GroupState(groupId, tenantId, new LinkedHashSet<>(principals), new LinkedHashSet<>(subgroups)));
    }

    private Optional<RoleState> loadRole(Connection conn, String roleId) throws SQLException {
        String sql = """
            SELECT r.uuid, r.system, t.org_id
            FROM management_role r
            LEFT JOIN api_tenant t ON t.id = r.tenant_id
            WHERE r.uuid = ?
            """;
        boolean system;
        String tenantId;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, roleId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                system = rs.getBoolean(2);
                tenantId = rs.getString(3);
            }
        }

        String accessSql = """
            SELECT a.id, perm.permission, rd.attributeFilter
            FROM management_access a
            JOIN management_role r ON r.id = a.role_id
            JOIN management_permission perm ON perm.id = a.permission_id
            LEFT JOIN management_resourcedefinition rd ON rd.access_id = a.id
            WHERE r.uuid = ?
            ORDER BY a.id, rd.id
            """;
        Map<Long, String> permissions = new LinkedHashMap<>();
        Map<Long, List<ResourceDefinition>> definitions = new LinkedHashMap<>();
        try (PreparedStatement stmt = conn.prepareStatement(accessSql)) {
            stmt.setString(1, roleId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    long accessId = rs.getLong(1);
                    permissions.put(accessId, rs.getString(2));
                    List<ResourceDefinition> forAccess = definitions.computeIfAbsent(accessId, k -> new ArrayList<>());
                    String filter = rs.getString(3);
                    if (filter != null) {
                        forAccess.add(parseAttributeFilter(filter, roleId));
                    }
                }
            }
        }

        List<RoleAccess> access = new ArrayList<>();
        permissions.forEach((accessId, permission) ->
            access.add(new RoleAccess(permission, definitions.get(accessId))));
        return Optional.of(new RoleState(roleId, tenantId, system, access));
    }

    private Optional<DomainObjectState> loadRoleBinding(Connection conn, String groupId, String roleId) throws SQLException {
        String sql = """
            SELECT t.id, t.tenant_name
            FROM management_policy p
            JOIN management_group g ON g.id = p.group_id
            JOIN management_policy_roles pr ON pr.policy_id = p.id
            JOIN management_role r ON r.id = pr.role_id
            JOIN api_tenant t ON t.id = g.tenant_id
            WHERE g.uuid = ? AND r.uuid = ?
            LIMIT 1
            """;
        long tenantPk;
        String tenantName;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, groupId);
            stmt.setString(2, roleId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                tenantPk = rs.getLong(1);
                tenantName = rs.getString(2);
            }
        }

        return Optional.of(new RoleBindingState(
            groupId, roleId, loadRole(conn, roleId), tenantName, defaultWorkspace(conn, tenantPk)));
    }

    private Optional<DomainObjectState> loadWorkspace(Connection conn, String workspaceId) throws SQLException {
        String sql = """
            SELECT w.id, w.parent_id, t.org_id
            FROM management_workspace w
            JOIN api_tenant t ON t.id = w.tenant_id
            WHERE w.id = ?
            """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, workspaceId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new WorkspaceState(rs.getString(1), rs.getString(3), rs.getString(2)));
            }
        }
    }

    private Optional<DomainObjectState> loadCrossAccountRequest(Connection conn, String requestId) throws SQLException {
        String sql = """
            SELECT car.user_id, car.target_org, car.status, t.id
            FROM api_crossaccountrequest car
            LEFT JOIN api_tenant t ON t.org_id = car.target_org
            WHERE car.request_id = ?
            """;
        String userId;
        String targetOrg;
        CrossAccountStatus status;
        Long tenantPk;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, requestId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                userId = rs.getString(1);
                targetOrg = rs.getString(2);
                status = CrossAccountStatus.fromValue(rs.getString(3));
                long pk = rs.getLong(4);
                tenantPk = rs.wasNull() ? null : pk;
            }
        }

        List<String> roleIds = queryStrings(conn, """
            SELECT r.uuid
            FROM api_crossaccountrequest_roles cr
            JOIN management_role r ON r.id = cr.role_id
            WHERE cr.crossaccountrequest_id = ?
            ORDER BY r.uuid
            """, requestId);
        List<RoleState> roles = new ArrayList<>();
        for (String roleId : roleIds) {
            loadRole(conn, roleId).ifPresent(roles::add);
        }
        Optional<String> workspace = tenantPk == null ? Optional.empty() : defaultWorkspace(conn, tenantPk);

        return Optional.of(new CrossAccountRequestState(requestId, userId, targetOrg, status, roleIds, roles, workspace));
    }

    private Optional<String> defaultWorkspace(Connection conn, long tenantPk) throws SQLException {
        String sql = "SELECT id FROM management_workspace WHERE tenant_id = ? AND type = ?";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, tenantPk);
            stmt.setString(2, DEFAULT_WORKSPACE_TYPE);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString(1)) : Optional.empty();
            }
        }
    }

    /**
     * Parse an {@code attributeFilter} column. The value is either a string or, for
     * the {@code in} operation, possibly a JSON array.
     */
    ResourceDefinition parseAttributeFilter(String json, String roleId) {
        try {
            JsonNode node = objectMapper.readTree(json);
            JsonNode value = node.path("value");
            String flattened = value.isArray()
                ? String.join(",", StreamSupport.stream(value.spliterator(), false).map(JsonNode::asText).toList())
                : value.asText();
            return new ResourceDefinition(node.path("key").asText(), node.path("operation").asText(), flattened);
        } catch (JsonProcessingException e) {
            throw new RbacQueryException("Invalid attributeFilter on role " + roleId + ": " + json, e);
        }
    }

    private List<String> queryStrings(Connection conn, String sql) throws SQLException {
        return queryStrings(conn, sql, null);
    }

    private List<String> queryStrings(Connection conn, String sql, String param) throws SQLException {
        List<String> values = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            if (param != null) {
                stmt.setString(1, param);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    values.add(rs.getString(1));
                }
            }
        }
        return values;
    }

    private List<DomainObjectRef> queryBindings(Connection conn, String sql, String param) throws SQLException {
        Set<DomainObjectRef> bindings = new LinkedHashSet<>();
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            if (param != null) {
                stmt.setString(1, param);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    bindings.add(DomainObjectRef.roleBinding(rs.getString(1), rs.getString(2)));
                }
            }
        }
        return List.copyOf(bindings);
    }
}
