package ember.db;

public enum DataType {
    STRING("string"),
    LIST("list");

    private final String wireName;

    DataType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
