package az.zeynalov.balanced.exception;

public class InvalidPriorityException extends IllegalArgumentException {

  private InvalidPriorityException(String message) {
    super(message);
  }

  public static InvalidPriorityException of(String message) {
    return new InvalidPriorityException(message);
  }
}
