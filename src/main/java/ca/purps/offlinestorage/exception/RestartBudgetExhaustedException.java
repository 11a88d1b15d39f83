package ca.purps.offlinestorage.exception;

public class RestartBudgetExhaustedException extends WorkerException {

    public RestartBudgetExhaustedException(String message) {
        super(message);
    }

    public RestartBudgetExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }

}
