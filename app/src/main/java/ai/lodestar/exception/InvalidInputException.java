package ai.lodestar.exception;

/** Thrown when a caller hands the evidence engine a value it cannot work with, instead of computing garbage. */
public class InvalidInputException extends IllegalArgumentException {
    public InvalidInputException(String message) {
        super(message);
    }

    public static void check(boolean condition, String message) {
        if (!condition) {
            throw new InvalidInputException(message);
        }
    }
}
