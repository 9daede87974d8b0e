package eu.okaeri.docstore.filter.predicate;

public interface Predicate {

    boolean check(Object leftOperand);
}
