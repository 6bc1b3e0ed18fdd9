package ember.protocol;

/**
 * Raised when a request frame cannot be tokenized into a command.
 */
public class RespProtocolException extends RuntimeException {
    public RespProtocolException(String msg) {
        super(msg);
    }
}
