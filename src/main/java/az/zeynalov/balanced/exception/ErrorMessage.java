package az.zeynalov.balanced.exception;

public class ErrorMessage {

  public final static String NULL_VALUE = "Null values cannot be stored!";
  public final static String HEAP_DRAINED = "Heap has been drained!";
  public final static String QUEUE_DRAINED = "Queue has been drained!";
  public final static String PRIORITY_NOT_A_NUMBER = "Priority must be a number, got NaN!";

}
