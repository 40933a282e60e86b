package telesim.core;

public enum WorkerState {
    IDLE,
    RUNNING,
    STOPPED
}
