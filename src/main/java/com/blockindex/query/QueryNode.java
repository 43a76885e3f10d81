package com.blockindex.query;

public interface QueryNode {

    /** 布尔操作类型 */
    enum BoolOp {
        AND,
        OR
    }

    record TermQuery(String term) implements QueryNode {
        public TermQuery {
            if (term == null || term.isEmpty()) {
                throw new IllegalArgumentException("term不能为空");
            }
        }
    }

    record BooleanQuery(BoolOp op, QueryNode left, QueryNode right) implements QueryNode {
        public BooleanQuery {
            if (op == null || left == null || right == null) {
                throw new IllegalArgumentException("布尔查询的操作符与操作数不能为null");
            }
        }
    }

    record NotQuery(QueryNode child) implements QueryNode {
        public NotQuery {
            if (child == null) {
                throw new IllegalArgumentException("NOT查询的子节点不能为null");
            }
        }
    }

    static QueryNode term(String term) {
        return new TermQuery(term);
    }

    static QueryNode and(QueryNode left, QueryNode right) {
        return new BooleanQuery(BoolOp.AND, left, right);
    }

    static QueryNode or(QueryNode left, QueryNode right) {
        return new BooleanQuery(BoolOp.OR, left, right);
    }

    static QueryNode not(QueryNode child) {
        return new NotQuery(child);
    }
}
