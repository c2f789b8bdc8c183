package com.challenges.eql.ast;

import java.util.Objects;

/**
 * Performs a subquery of a specific relation and is true when the current event is related to a match.
 */
public record NamedSubquery(QueryType queryType, EventQuery query) implements Expression {

    public enum QueryType {
        /** pid/unique_pid of the event descends from the subquery process. */
        DESCENDANT("descendant"),
        /** pid/unique_pid of the event is a child of the subquery process. */
        CHILD("child"),
        /** pid/unique_pid of the event matches the subquery process. */
        EVENT("event");

        private final String keyword;

        QueryType(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        public static QueryType fromKeyword(String keyword) {
            for (QueryType type : values()) {
                if (type.keyword.equals(keyword)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown subquery type: " + keyword);
        }
    }

    public NamedSubquery {
        Objects.requireNonNull(queryType, "queryType");
        Objects.requireNonNull(query, "query");
    }
}
