package eu.okaeri.docstore.filter.condition;

public enum LogicalOperator {
    AND,
    OR
}
