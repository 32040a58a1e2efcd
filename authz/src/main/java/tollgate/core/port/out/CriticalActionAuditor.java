package tollgate.core.port.out;

import tollgate.core.model.auth.CriticalActionAudit;

/**
 * Port interface for the audit trail of critical operations.
 */
public interface CriticalActionAuditor {

    /**
     * Record that a critical operation was allowed.
     *
     * @param audit the audit record
     */
    void record(CriticalActionAudit audit);
}
