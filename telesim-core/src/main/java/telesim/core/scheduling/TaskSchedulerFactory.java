package telesim.core.scheduling;

/**
 * Creates the private scheduler of one device.
 */
@FunctionalInterface
public interface TaskSchedulerFactory {

    TaskScheduler create(String deviceId, int threads);
}
