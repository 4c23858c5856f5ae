package com.amqpharness;

import com.amqpharness.config.BrokerUri;
import com.amqpharness.config.HarnessConfig;
import com.amqpharness.diagnosis.ConnectionDiagnoser;
import com.amqpharness.diagnosis.DiagnosisResult;
import com.amqpharness.diagnosis.HandshakeProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.time.Duration;

public class AmqpHarnessApplication {
    private static final Logger logger = LoggerFactory.getLogger(AmqpHarnessApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;

    public static void main(String[] args) {
        System.exit(run(args, HarnessConfig.load(), System.out));
    }

    /**
     * Check that the broker accepts the configured connection and print the outcome.
     */
    static int run(String[] args, HarnessConfig config, PrintStream out) {
        BrokerUri uri;
        HandshakeProbe probe;
        try {
            if (!parseArguments(args, config)) {
                printUsage(out);
                return EXIT_OK;
            }
            uri = config.getBrokerUri();
            probe = new HandshakeProbe(config.getTlsSettings(), Duration.ofMillis(config.getHandshakeTimeoutMs()));
        } catch (IllegalArgumentException e) {
            out.println(e.getMessage());
            printUsage(out);
            return EXIT_FAILED;
        }

        logger.info("Checking broker {}", uri);
        DiagnosisResult result = new ConnectionDiagnoser(probe).diagnose(uri);

        switch (result.getOutcome()) {
            case OK:
                out.println("OK: " + uri + " accepted the connection");
                return EXIT_OK;
            case BAD_CREDENTIALS:
                out.println("FAILED: " + ConnectionDiagnoser.BAD_CREDENTIALS_MESSAGE);
                return EXIT_FAILED;
            case BAD_VIRTUAL_HOST:
                out.println("FAILED: " + ConnectionDiagnoser.BAD_VIRTUAL_HOST_MESSAGE);
                return EXIT_FAILED;
            default:
                if (result.getCause() == null) {
                    out.println("SKIPPED: scheme " + uri.getScheme() + " cannot be checked");
                    return EXIT_FAILED;
                }
                out.println("FAILED: " + result.getCause());
                return EXIT_FAILED;
        }
    }

    /**
     * Apply command-line options on top of the loaded configuration.
     * Returns false when help was requested.
     */
    static boolean parseArguments(String[] args, HarnessConfig config) {
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--uri":
                    config.setAmqpUri(value(args, ++i, "--uri"));
                    break;
                case "--ca-certs":
                    config.setSslCaCerts(value(args, ++i, "--ca-certs"));
                    break;
                case "--certfile":
                    config.setSslCertfile(value(args, ++i, "--certfile"));
                    break;
                case "--keyfile":
                    config.setSslKeyfile(value(args, ++i, "--keyfile"));
                    break;
                case "--help":
                    return false;
                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        return true;
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    private static void printUsage(PrintStream out) {
        out.println("AMQP Harness - broker connection check");
        out.println();
        out.println("Usage: java -jar amqp-harness.jar [OPTIONS]");
        out.println();
        out.println("Options:");
        out.println("  --uri URI             Broker URI (default: amqp.uri or AMQP_URI)");
        out.println("  --ca-certs PATH       CA certificates used to verify the broker");
        out.println("  --certfile PATH       Client certificate (requires --keyfile)");
        out.println("  --keyfile PATH        Client private key (requires --certfile)");
        out.println("  --help                Show this help message");
        out.println();
        out.println("Exit code is 0 when the broker accepts the connection, 1 otherwise.");
    }
}
