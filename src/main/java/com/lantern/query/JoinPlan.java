package com.lantern.query;

import com.lantern.filter.TableTag;

/**
 * The join decision for one metric query. When no join is required the plan
 * renders to nothing; the query then never touches the secondary table.
 */
public final class JoinPlan {

    private final TableTag base;
    private final JoinPolicy policy;
    private final boolean required;

    private JoinPlan(TableTag base, JoinPolicy policy, boolean required) {
        this.base = base;
        this.policy = policy;
        this.required = required;
    }

    static JoinPlan none(TableTag base) {
        return new JoinPlan(base, JoinPolicy.none(), false);
    }

    static JoinPlan join(TableTag base, JoinPolicy policy) {
        return new JoinPlan(base, policy, true);
    }

    public boolean isRequired() {
        return required;
    }

    public boolean joins(TableTag table) {
        return required && policy.getTarget() == table;
    }

    public TableTag getBase() {
        return base;
    }

    /**
     * Join kind, or null when no join is required
     */
    public JoinPolicy.JoinKind getKind() {
        return required ? policy.getKind() : null;
    }

    /**
     * {@code LEFT JOIN traces t ON o.trace_id = t.id AND o.project_id = t.project_id},
     * or an empty string when no join is required
     */
    public String toSql() {
        if (!required) {
            return "";
        }
        TableTag target = policy.getTarget();
        StringBuilder sql = new StringBuilder();
        sql.append(policy.getKind().getKeyword())
            .append(" ")
            .append(target.getTableName())
            .append(" ")
            .append(target.getAlias());
        if (policy.isFinalRead()) {
            sql.append(" FINAL");
        }
        sql.append(" ON ")
            .append(base.qualify("trace_id")).append(" = ").append(target.qualify("id"))
            .append(" AND ")
            .append(base.qualify("project_id")).append(" = ").append(target.qualify("project_id"));
        return sql.toString();
    }

    @Override
    public String toString() {
        return required ? "JoinPlan{" + toSql() + "}" : "JoinPlan{none}";
    }
}
