package domain.model;

/** Top-level clauses that contribute to a statement signature. */
public enum ClauseKind {
    FROM,
    JOIN,
    WHERE,
    GROUP_BY,
    ORDER_BY
}
