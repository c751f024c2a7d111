package com.lantern.query;

import com.lantern.filter.TableTag;

/**
 * How a metric may join a secondary table: which table, with which join kind, and
 * whether the join is needed regardless of the filters.
 */
public final class JoinPolicy {

    public enum JoinKind {
        /**
         * The joined table only narrows base rows through filters; unmatched base rows survive.
         */
        LEFT("LEFT JOIN"),

        /**
         * The metric needs the joined row to exist.
         */
        INNER("JOIN");

        private final String keyword;

        JoinKind(String keyword) {
            this.keyword = keyword;
        }

        public String getKeyword() {
            return keyword;
        }
    }

    private static final JoinPolicy NONE = new JoinPolicy(null, null, false, false);

    private final TableTag target;
    private final JoinKind kind;
    private final boolean mandatory;
    private final boolean finalRead;

    private JoinPolicy(TableTag target, JoinKind kind, boolean mandatory, boolean finalRead) {
        this.target = target;
        this.kind = kind;
        this.mandatory = mandatory;
        this.finalRead = finalRead;
    }

    /**
     * The metric joins nothing; filters must all target the base table.
     */
    public static JoinPolicy none() {
        return NONE;
    }

    public static JoinPolicy leftOnDemand(TableTag target) {
        return new JoinPolicy(target, JoinKind.LEFT, false, false);
    }

    public static JoinPolicy innerOnDemand(TableTag target) {
        return new JoinPolicy(target, JoinKind.INNER, false, false);
    }

    public static JoinPolicy innerAlways(TableTag target) {
        return new JoinPolicy(target, JoinKind.INNER, true, false);
    }

    /**
     * Read the joined table with {@code FINAL} so that unmerged duplicates are collapsed.
     */
    public JoinPolicy readFinal() {
        if (target == null) {
            throw new IllegalStateException("No join target to read FINAL");
        }
        return new JoinPolicy(target, kind, mandatory, true);
    }

    /**
     * Join target, or null when the metric never joins
     */
    public TableTag getTarget() {
        return target;
    }

    public JoinKind getKind() {
        return kind;
    }

    public boolean isMandatory() {
        return mandatory;
    }

    public boolean isFinalRead() {
        return finalRead;
    }
}
