package eu.okaeri.docstore.filter;

public enum OrderDirection {
    ASC,
    DESC;

    public OrderDirection invert() {
        return (this == ASC) ? DESC : ASC;
    }
}
