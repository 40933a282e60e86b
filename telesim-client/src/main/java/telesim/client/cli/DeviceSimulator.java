package telesim.client.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import telesim.client.codec.MessageCodec;
import telesim.client.impl.HttpTransportSender;
import telesim.client.replay.FileReplayer;
import telesim.client.replay.ReplaySummary;
import telesim.core.FleetCoordinator;
import telesim.core.events.LoggingSimulationEvents;

import java.io.IOException;
import java.time.Duration;

/**
 * Entry point of the device simulator: either runs a simulated fleet or replays a message file.
 */
public class DeviceSimulator {
    private static final Logger logger = LoggerFactory.getLogger(DeviceSimulator.class);

    public static void main(String[] args) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println("error: " + e.getMessage());
            System.err.println(CliOptions.usage());
            System.exit(2);
            return;
        }
        if (options.help()) {
            System.out.println(CliOptions.usage());
            return;
        }

        HttpTransportSender transport = new HttpTransportSender(options.host(), options.port(), "/");
        try {
            if (options.mode() == CliOptions.Mode.REPLAY) {
                replay(options, transport);
            } else {
                simulate(options, transport);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted, exiting");
        } catch (IOException e) {
            logger.error("Failed to read {}: {}", options.file(), e.getMessage());
            System.exit(1);
        } finally {
            transport.close();
        }
    }

    private static void replay(CliOptions options, HttpTransportSender transport) throws IOException, InterruptedException {
        logger.info("Replaying {} to {} every {}s", options.file(), transport.getEndpoint(), options.replayInterval().toSeconds());
        ReplaySummary summary = new FileReplayer(transport, new MessageCodec(), options.replayInterval()).replay(options.file());
        System.out.println("Replay finished: " + summary.sent() + " sent, " + summary.failed() + " failed, "
                + summary.skipped() + " skipped");
    }

    private static void simulate(CliOptions options, HttpTransportSender transport) throws InterruptedException {
        FleetCoordinator fleet = new FleetCoordinator(options.simConfig(), transport, new LoggingSimulationEvents());
        Runtime.getRuntime().addShutdownHook(new Thread(fleet::shutdown, "fleet-shutdown"));
        logger.info("Sending to {}", transport.getEndpoint());
        fleet.start();

        // Devices run until shutdown or until every one of them has faulted
        while (!fleet.awaitTermination(Duration.ofMinutes(1))) {
            logger.debug("{} devices running", fleet.getRunningCount());
        }
        logger.info("All devices stopped");
    }
}
