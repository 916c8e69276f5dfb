package tech.relationsync.reconcile;

import org.jboss.logging.Logger;
import tech.relationsync.model.RelationshipSet;
import tech.relationsync.model.SyncRecord;
import tech.relationsync.record.SyncRecordRepository;
import tech.relationsync.store.RelationshipFilter;
import tech.relationsync.sync.SyncExecutor;

import java.util.List;

import static tech.relationsync.model.RelationSchema.*;

/**
 * Deletes tuples of the engine's own shapes that no domain object owns.
 *
 * <p>Per-object reconciliation only finds tuples it can attribute to a live object or a sync
 * record. A binding node granting a live group a role it was never bound to, or the members of
 * a group that never existed, have no owner and are only caught here.
 *
 * <p>The store is read before the records. A live sync saves its possible additions in its
 * record before writing them, so any tuple a concurrent sync has just written is already owned
 * by the time the records are read.
 */
class UnownedTupleSweeper {

    private static final Logger LOG = Logger.getLogger(UnownedTupleSweeper.class);

    static final List<RelationshipFilter> ENGINE_TUPLES = List.of(
        RelationshipFilter.byObject(GROUP, null, MEMBER),
        RelationshipFilter.byObject(ROLE, null),
        RelationshipFilter.byObject(V1_ROLE, null),
        RelationshipFilter.byObject(ROLE_BINDING, null),
        RelationshipFilter.byObject(WORKSPACE, null, PARENT),
        new RelationshipFilter(null, null, USER_GRANT, ROLE_BINDING, null, null));

    private final SyncExecutor executor;
    private final SyncRecordRepository records;

    UnownedTupleSweeper(SyncExecutor executor, SyncRecordRepository records) {
        this.executor = executor;
        this.records = records;
    }

    /**
     * @return number of tuples deleted
     */
    int sweep() {
        RelationshipSet present = executor.readActual(ENGINE_TUPLES);

        RelationshipSet.Builder owned = RelationshipSet.builder();
        for (SyncRecord record : records.findAll()) {
            owned.addAll(record.lastAppliedSet());
        }

        RelationshipSet unowned = present.minus(owned.build());
        if (unowned.isEmpty()) {
            return 0;
        }
        LOG.warnf("Removing %d tuples no domain object owns: %s", Integer.valueOf(unowned.size()), unowned);
        executor.deleteAll(unowned);
        return unowned.size();
    }
}
