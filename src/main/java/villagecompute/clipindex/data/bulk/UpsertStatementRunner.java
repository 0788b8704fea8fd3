package villagecompute.clipindex.data.bulk;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Query;
import jakarta.transaction.Transactional;
import villagecompute.clipindex.exceptions.ScanNotRunningException;

import java.util.List;
import java.util.Map;

/**
 * Executes one upsert statement of a scan in its own transaction, so a failing chunk rolls back alone.
 *
 * <p>
 * The statement only runs while the channel's scan row is RUNNING. The row is read {@code FOR SHARE}, so a purge or
 * stop that moves the row to CANCELLED waits for an in-flight chunk to commit, and every chunk after it sees the
 * cancellation. Purges delete data only after their cancel committed, so no scan output can land behind a purge.
 */
@ApplicationScoped
public class UpsertStatementRunner {

    @Inject
    EntityManager entityManager;

    /**
     * @throws ScanNotRunningException
     *             if the scan of {@code channelId} is not RUNNING; nothing is written
     */
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public int execute(String scanChannelId, String sql, Map<String, Object> parameters) {
        @SuppressWarnings("unchecked")
        List<Object> status = entityManager
                .createNativeQuery("SELECT status FROM channel_scan_status WHERE channel_id = :channelId FOR SHARE")
                .setParameter("channelId", scanChannelId).getResultList();
        if (status.isEmpty() || !"RUNNING".equals(status.get(0).toString())) {
            throw new ScanNotRunningException(scanChannelId);
        }

        Query query = entityManager.createNativeQuery(sql);
        parameters.forEach(query::setParameter);
        return query.executeUpdate();
    }
}
