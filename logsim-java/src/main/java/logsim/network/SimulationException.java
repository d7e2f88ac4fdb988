package logsim.network;

public class SimulationException extends Exception {

    public SimulationException(String message) {
        super(message);
    }
}
