package com.lantern.query;

import com.lantern.filter.Filter;
import com.lantern.filter.FilterList;
import com.lantern.filter.TableTag;
import com.lantern.filter.UnsupportedTableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a metric query has to join a secondary table.
 *
 * A join is emitted only when a filter needs a column of the joined table, or
 * when the metric itself needs the joined rows. ClickHouse has no index-based
 * join pruning, so a join that no predicate needs still scans the whole table.
 */
public class JoinPlanner {

    private static final Logger log = LoggerFactory.getLogger(JoinPlanner.class);

    /**
     * @throws UnsupportedTableException if a filter targets a table that is neither
     *         the base table nor the policy's join target
     */
    public JoinPlan plan(TableTag base, FilterList filters, JoinPolicy policy) {
        for (Filter filter : filters.getFilters()) {
            TableTag table = filter.getLogicalTable();
            if (table != base && table != policy.getTarget()) {
                throw new UnsupportedTableException(filter.getColumn().getName(), table, base);
            }
        }

        TableTag target = policy.getTarget();
        if (target == null) {
            return JoinPlan.none(base);
        }
        if (target == base || !base.isTraceChild() || target != TableTag.TRACES) {
            throw new IllegalArgumentException(
                "Cannot join " + target.getTableName() + " from " + base.getTableName());
        }

        boolean filtered = filters.anyMatch(filter -> filter.getLogicalTable() == target);
        if (!policy.isMandatory() && !filtered) {
            log.debug("No filter on {}, omitting join from {}", target.getTableName(), base.getTableName());
            return JoinPlan.none(base);
        }

        JoinPlan plan = JoinPlan.join(base, policy);
        log.debug("Planned {}", plan);
        return plan;
    }
}
