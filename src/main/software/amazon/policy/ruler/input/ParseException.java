package software.amazon.policy.ruler.input;

/**
 * A RuntimeException that indicates a structurally malformed pattern source, such as unbalanced template delimiters.
 */
public class ParseException extends RuntimeException {

    public ParseException(String msg) {
        super(msg);
    }

}
