package ember.db;

/**
 * Signals an operation against a key holding the wrong kind of value.
 */
public class WrongTypeException extends RuntimeException {
    public WrongTypeException(DataType expected, DataType actual) {
        super("expected " + expected.wireName() + " but key holds " + actual.wireName());
    }
}
