package telesim.client.cli;

import telesim.client.server.TelemetryServer;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;

/**
 * Starts the collecting server. Usage: {@code TelemetryServerMain [port]} (default 8080).
 */
public class TelemetryServerMain {

    public static void main(String[] args) throws IOException, InterruptedException {
        int port = CliOptions.DEFAULT_PORT;
        if (args.length > 0) {
            try {
                port = CliOptions.positiveInteger("port", args[0]);
            } catch (IllegalArgumentException e) {
                System.err.println("error: " + e.getMessage());
                System.err.println("Usage: TelemetryServerMain [port]");
                System.exit(2);
                return;
            }
        }

        TelemetryServer server = new TelemetryServer(port);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            stopped.countDown();
        }, "server-shutdown"));
        server.start();
        stopped.await();
    }
}
