package tap.java.config;

import java.nio.file.Path;

/**
 * Command-line options of the server.
 *
 * @param port gRPC port
 * @param configPath JSON config file, null for built-in defaults
 * @param validateOnly load and validate the config, then exit
 * @param help print usage and exit
 */
public record ServerOptions(int port, Path configPath, boolean validateOnly, boolean help) {

    public static final int DEFAULT_PORT = 9090;

    public static final String USAGE = """
        Usage: tap-server [options]

        Options:
          --port,   -p  <port>  gRPC port (default: 9090)
          --config, -c  <path>  JSON configuration file (default: built-in)
          --validate-config     Load and validate the configuration, then exit
          --help,   -h          Show this help message
        """;

    /**
     * Supported flags:
     *   --port, -p &lt;port&gt;
     *   --config, -c &lt;path&gt;
     *   --validate-config
     *   --help, -h
     *
     * @throws IllegalArgumentException on unknown flags, missing values or a bad port
     */
    public static ServerOptions fromArgs(String[] args) {
        if (args == null) throw new IllegalArgumentException("args cannot be null");

        int port = DEFAULT_PORT;
        Path config = null;
        boolean validateOnly = false;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> help = true;

                case "--port", "-p" -> {
                    String value = valueOf(args, i++);
                    try {
                        port = Integer.parseInt(value);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid port: " + value, e);
                    }
                    if (port <= 0 || port > 65_535) {
                        throw new IllegalArgumentException("Port out of range: " + port);
                    }
                }

                case "--config", "-c" -> config = Path.of(valueOf(args, i++));

                case "--validate-config" -> validateOnly = true;

                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        if (validateOnly && config == null) {
            throw new IllegalArgumentException("--validate-config needs --config");
        }
        return new ServerOptions(port, config, validateOnly, help);
    }

    private static String valueOf(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
        return args[i + 1];
    }
}
