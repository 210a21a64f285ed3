package reia.lower;

// нарушение контракта фронтенд/lowering, не восстанавливается
public class LoweringException extends RuntimeException {
    private final int line;

    public LoweringException(int line, String message) {
        super(String.format("line %d: %s", line, message));
        this.line = line;
    }

    public int line() { return line; }
}
