package tech.relationsync.translate;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PermissionNamesTest {

    @ParameterizedTest
    @CsvSource({
        "cost-management:*:read, cost_management_all_read",
        "inventory:hosts:write, inventory_hosts_write",
        "rbac:*:*, rbac_all_all"
    })
    void mapsV1PermissionsToRelations(String v1, String relation) {
        assertThat(PermissionNames.toRelation(v1)).isEqualTo(relation);
    }

    @ParameterizedTest
    @CsvSource({
        "cost-management.aws.account, cost_management/aws_account",
        "cost-management.openshift.cluster, cost_management/openshift_cluster",
        "inventory.groups, workspace"
    })
    void mapsResourceKeysToScopeTypes(String key, String type) {
        assertThat(PermissionNames.toScopeType(key)).isEqualTo(type);
    }

    @Test
    void rejectsMalformedNames() {
        assertThatThrownBy(() -> PermissionNames.toRelation("app::read")).isInstanceOf(TranslationException.class);
        assertThatThrownBy(() -> PermissionNames.toRelation(null)).isInstanceOf(TranslationException.class);
        assertThatThrownBy(() -> PermissionNames.toScopeType("account")).isInstanceOf(TranslationException.class);
    }
}
