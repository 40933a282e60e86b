package telesim.client.cli;

import telesim.config.SimConfig;
import telesim.core.priority.PriorityPolicies;
import telesim.core.priority.PriorityPolicy;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Command line options of the device simulator.
 */
public record CliOptions(Mode mode,
                         Path file,
                         Duration replayInterval,
                         String host,
                         int port,
                         SimConfig simConfig,
                         boolean help) {

    public enum Mode {
        SIMULATE,
        REPLAY
    }

    public static final int DEFAULT_PORT = 8080;
    public static final String DEFAULT_HOST = "localhost";
    public static final long DEFAULT_REPLAY_INTERVAL_SECONDS = 1;

    private static final Map<String, String> ALIASES = Map.of(
            "-f", "--file",
            "-i", "--interval",
            "-s", "--simulate",
            "-n", "--number",
            "-p", "--port",
            "-h", "--help");

    private static final Set<String> FLAGS = Set.of("--simulate", "--help");

    private static final Set<String> VALUED = Set.of(
            "--file", "--interval", "--log-interval", "--sensor-interval", "--write-interval",
            "--buffer-size", "--number", "--port", "--host", "--priority");

    private static final List<String> SIMULATE_ONLY = List.of(
            "--log-interval", "--sensor-interval", "--write-interval", "--buffer-size", "--number", "--priority");

    /**
     * Parses the command line.
     *
     * @throws IllegalArgumentException describing the first invalid option
     */
    public static CliOptions parse(String[] args) {
        Map<String, String> values = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String option = ALIASES.getOrDefault(args[i], args[i]);
            String inlineValue = null;
            int eq = option.indexOf('=');
            if (option.startsWith("--") && eq > 0) {
                inlineValue = option.substring(eq + 1);
                option = option.substring(0, eq);
            }
            if (FLAGS.contains(option)) {
                values.put(option, "true");
            } else if (VALUED.contains(option)) {
                String value = inlineValue;
                if (value == null) {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Option " + option + " requires a value");
                    }
                    value = args[++i];
                }
                values.put(option, value);
            } else {
                throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        if (values.containsKey("--help")) {
            return new CliOptions(Mode.SIMULATE, null, null, DEFAULT_HOST, DEFAULT_PORT, null, true);
        }

        boolean replay = values.containsKey("--file");
        boolean simulate = values.containsKey("--simulate");
        if (replay && simulate) {
            throw new IllegalArgumentException("--file cannot be used with --simulate");
        }
        if (values.containsKey("--interval") && !replay) {
            throw new IllegalArgumentException("--interval requires --file");
        }
        if (replay) {
            for (String option : SIMULATE_ONLY) {
                if (values.containsKey(option)) {
                    throw new IllegalArgumentException(option + " requires --simulate");
                }
            }
        }

        String host = values.getOrDefault("--host", DEFAULT_HOST);
        int port = values.containsKey("--port") ? positiveInteger("--port", values.get("--port")) : DEFAULT_PORT;
        if (port > 65535) {
            throw new IllegalArgumentException("--port: The value must be a valid port number.");
        }

        if (replay) {
            long seconds = values.containsKey("--interval")
                    ? positiveInteger("--interval", values.get("--interval"))
                    : DEFAULT_REPLAY_INTERVAL_SECONDS;
            return new CliOptions(Mode.REPLAY, Path.of(values.get("--file")), Duration.ofSeconds(seconds),
                    host, port, null, false);
        }

        PriorityPolicy policy;
        try {
            policy = values.containsKey("--priority") ? PriorityPolicies.parse(values.get("--priority")) : null;
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("--priority: " + e.getMessage(), e);
        }

        SimConfig config = new SimConfig.Builder()
                .DeviceCount(optionalPositive(values, "--number"))
                .LogInterval(optionalMillis(values, "--log-interval"))
                .SensorInterval(optionalMillis(values, "--sensor-interval"))
                .WriteInterval(optionalMillis(values, "--write-interval"))
                .BufferCapacity(optionalPositive(values, "--buffer-size"))
                .PriorityPolicy(policy)
                .build();
        return new CliOptions(Mode.SIMULATE, null, null, host, port, config, false);
    }

    private static Integer optionalPositive(Map<String, String> values, String option) {
        return values.containsKey(option) ? positiveInteger(option, values.get(option)) : null;
    }

    private static Duration optionalMillis(Map<String, String> values, String option) {
        return values.containsKey(option) ? Duration.ofMillis(positiveInteger(option, values.get(option))) : null;
    }

    static int positiveInteger(String option, String value) {
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + ": The value must be an integer.");
        }
        if (parsed <= 0) {
            throw new IllegalArgumentException(option + ": The value must be greater than 0.");
        }
        return parsed;
    }

    public static String usage() {
        return """
                Usage: device [OPTIONS]

                  -s, --simulate               Simulate message generation and sending (default mode)
                  -f, --file <PATH>            Path to the NDJSON file to replay
                  -i, --interval <SECONDS>     Timing interval between replayed messages (default: 1)
                      --log-interval <MS>      Time between log messages for a single device (default: 500)
                      --sensor-interval <MS>   Time between sensor messages for a single device (default: 500)
                      --write-interval <MS>    Time between sending messages for a single device (default: 500)
                      --buffer-size <N>        Number of messages a device can send per write (default: 3)
                      --priority <ORDER>       log>sensorData, sensorData>log or errors-first (default: log>sensorData)
                  -n, --number <N>             Number of devices to simulate (default: 3)
                      --host <HOST>            The host to send messages to (default: localhost)
                  -p, --port <PORT>            The port to try to hit at http://<HOST>:<PORT> (default: 8080)
                  -h, --help                   Print this help
                """;
    }
}
