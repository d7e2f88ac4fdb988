package logsim.monitor;

public class MonitorException extends RuntimeException {

    public MonitorException(String message) {
        super(message);
    }
}
