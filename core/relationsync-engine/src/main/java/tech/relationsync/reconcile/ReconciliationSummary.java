package tech.relationsync.reconcile;

/**
 * Tally of one reconciliation pass.
 *
 * @param checked objects examined
 * @param repaired objects whose store contents had drifted and were repaired
 * @param failed objects that could not be brought in line this pass, plus one if the
 *               unowned-tuple sweep could not finish
 * @param skipped objects not examined because replication is disabled
 * @param unownedRemoved tuples deleted because no domain object owns them
 */
public record ReconciliationSummary(int checked, int repaired, int failed, int skipped, int unownedRemoved) {

    public static ReconciliationSummary empty() {
        return new ReconciliationSummary(0, 0, 0, 0, 0);
    }

    public boolean converged() {
        return failed == 0;
    }
}
