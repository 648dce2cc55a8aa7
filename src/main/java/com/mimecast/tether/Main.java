package com.mimecast.tether;

import com.mimecast.tether.config.ClientConfig;
import com.mimecast.tether.connection.ConnectionHandler;
import com.mimecast.tether.connection.ConnectionStateMachine;
import com.mimecast.tether.transport.SocketTransport;
import com.mimecast.tether.trust.BouncyCastleRequestGenerator;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.help.HelpFormatter;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;

/**
 * Main runnable.
 *
 * <p>Runs the desktop connection client until the process is terminated.
 * <br>Without a configuration file the defaults apply: desktop on localhost, ports 8088 and 8089.
 *
 * @see ConnectionStateMachine
 */
public class Main {
    private static final Logger log = LogManager.getLogger(Main.class);

    /**
     * Application jar name.
     */
    private static final String NAME = "tether.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME;

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "Device to desktop connection client";

    private final String[] args;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        new Main(args).run();
    }

    /**
     * Constructs a new Main instance.
     *
     * @param args String array.
     */
    Main(String[] args) {
        this.args = args;
    }

    /**
     * Parses arguments and runs the client.
     */
    void run() {
        Optional<CommandLine> opt = parseArgs(options());
        if (opt.isEmpty()) {
            return;
        }

        CommandLine cmd = opt.get();
        if (cmd.hasOption("help")) {
            optionsUsage(options());
            return;
        }

        Optional<ClientConfig> config = loadConfig(cmd.getOptionValue("config"));
        if (config.isEmpty()) {
            return;
        }

        runClient(config.get());
    }

    /**
     * Loads client configuration.
     *
     * @param path Configuration file path or null for defaults.
     * @return Optional of ClientConfig.
     */
    Optional<ClientConfig> loadConfig(String path) {
        if (StringUtils.isBlank(path)) {
            return Optional.of(new ClientConfig());
        }

        try {
            return Optional.of(new ClientConfig(path));
        } catch (IOException e) {
            log("Unable to read config: " + e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Runs the client until the JVM shuts down.
     *
     * @param config ClientConfig instance.
     */
    private void runClient(ClientConfig config) {
        SocketTransport transport = new SocketTransport();
        ConnectionStateMachine client = new ConnectionStateMachine(config, transport, new BouncyCastleRequestGenerator());

        client.setMessageHandler(message -> log.info("Message from desktop: {}", message));
        client.setConnectionHandler(new ConnectionHandler() {
            @Override
            public void onConnected() {
                log.info("Desktop connected");
            }

            @Override
            public void onDisconnected() {
                log.info("Desktop disconnected");
            }
        });

        CountDownLatch done = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            client.close();
            transport.close();
            done.countDown();
        }, "tether-shutdown"));

        log.info("Connecting to desktop at {} ports {}/{}", config.getHost(), config.getSecurePort(), config.getInsecurePort());
        client.start();

        try {
            done.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * CLI options.
     * <i>Listing order will be alphabetical</i>.
     *
     * @return Options instance.
     */
    private Options options() {
        Options options = new Options();
        options.addOption("c", "config", true, "Path to client configuration file");
        options.addOption("h", "help", false, "Show usage");
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options Options instance.
     */
    public void optionsUsage(Options options) {
        log(USAGE);
        log(" " + DESCRIPTION);
        log("");

        // Capture System.out to get help output.
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PrintStream ps = new PrintStream(baos);
        PrintStream oldOut = System.out;
        System.setOut(ps);

        try {
            HelpFormatter formatter = HelpFormatter.builder()
                .setShowSince(false)
                .get();
            formatter.printHelp(" ", "", options, "", true);
            System.out.flush();
        } catch (IOException e) {
            throw new IllegalStateException(e);
        } finally {
            System.setOut(oldOut);
        }

        log(baos.toString());
        log("");
    }

    /**
     * Parser for CLI arguments.
     *
     * @param options Options instance.
     * @return Optional of CommandLine.
     */
    public Optional<CommandLine> parseArgs(Options options) {
        CommandLine cmd = null;

        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (Exception e) {
            log("Options error: " + e.getMessage());
            log("");
            optionsUsage(options);
        }

        return Optional.ofNullable(cmd);
    }

    /**
     * Logging wrapper.
     *
     * @param string String.
     */
    public void log(String string) {
        System.out.println(string);
    }
}
