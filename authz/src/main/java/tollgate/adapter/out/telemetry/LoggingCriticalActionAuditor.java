package tollgate.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import tollgate.core.model.auth.CriticalActionAudit;
import tollgate.core.port.out.CriticalActionAuditor;

/**
 * Writes critical action audit records to a dedicated log category.
 *
 * <p>Category: {@code tollgate.audit.authorization}. Route it to a separate handler to
 * keep the audit trail apart from application logs:
 * <pre>{@code
 * quarkus.log.category."tollgate.audit.authorization".level=INFO
 * quarkus.log.category."tollgate.audit.authorization".handlers=AUDIT
 * }</pre>
 *
 * <p>Each record is exactly one line of space-separated {@code key=value} pairs. Whitespace
 * and control characters inside values are replaced with {@code _} so that a value can
 * neither add fields nor start a new line.
 */
@ApplicationScoped
public class LoggingCriticalActionAuditor implements CriticalActionAuditor {

    static final String CATEGORY = "tollgate.audit.authorization";

    private static final Logger AUDIT_LOG = Logger.getLogger(CATEGORY);

    @Override
    public void record(CriticalActionAudit audit) {
        AUDIT_LOG.infof(
                "CRITICAL_ACTION timestamp=%s principal=%s client=%s ip=%s permission=%s purpose=%s",
                audit.timestamp(),
                field(audit.principalId()),
                field(audit.clientId().orElse("unknown")),
                field(audit.sourceIp().orElse("unknown")),
                field(audit.permission()),
                field(audit.purpose().orElse("unspecified")));
    }

    static String field(String value) {
        if (value == null || value.isEmpty()) {
            return "unknown";
        }
        final var sb = new StringBuilder(value.length());
        for (var i = 0; i < value.length(); i++) {
            final var c = value.charAt(i);
            sb.append(Character.isWhitespace(c) || Character.isISOControl(c) || Character.isSpaceChar(c) ? '_' : c);
        }
        return sb.toString();
    }
}
