package com.questrail.dtnclient.cli;

import com.questrail.dtnclient.client.DataException;
import com.questrail.dtnclient.client.DtnClient;
import com.questrail.dtnclient.client.DtndException;
import com.questrail.dtnclient.config.DtnClientConfig;
import com.questrail.dtnclient.eid.EidException;
import com.questrail.dtnclient.eid.EndpointId;
import com.questrail.dtnclient.transport.DaemonNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Function;

/**
 * DtnClientCli
 * =============================================================================
 * Command-line front end for (un)registering endpoints with dtnd.
 *
 * <pre>
 *   dtnclient [-s|--socket PATH] [-v] register [-u|--unregister] EndpointID
 * </pre>
 *
 * <h2>Exit codes</h2>
 * <ul>
 *   <li>0: the operation succeeded</li>
 *   <li>1: no command given, or the call to dtnd failed</li>
 *   <li>2: the arguments could not be parsed</li>
 * </ul>
 *
 * <p>{@code -v} switches logging to DEBUG. The switch is applied through the
 * {@code dtnclient.log.level} system property before the first logger is
 * obtained, so no logger is held in a static field here.</p>
 */
public final class DtnClientCli
{
    static final String LOG_LEVEL_PROPERTY = "dtnclient.log.level";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE =
            "usage: dtnclient [-h] [-s SOCKET] [-v] {register} ...\n"
          + "       dtnclient register [-h] [-u] EndpointID";

    private DtnClientCli() {}

    public static void main(String[] args) {
        System.exit(run(args, System.err));
    }

    static int run(String[] args, PrintStream err) {
        return run(args, err, DtnClient::new);
    }

    static int run(String[] args, PrintStream err, Function<DtnClientConfig, DtnClient> clientFactory) {
        Objects.requireNonNull(args, "args");
        Objects.requireNonNull(err, "err");
        Objects.requireNonNull(clientFactory, "clientFactory");

        Arguments parsed;
        try {
            parsed = Arguments.parse(args);
        } catch (UsageException e) {
            err.println(USAGE);
            err.println("dtnclient: error: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (parsed.help) {
            err.println(USAGE);
            return EXIT_OK;
        }

        System.setProperty(LOG_LEVEL_PROPERTY, parsed.verbose ? "DEBUG" : "INFO");

        if (parsed.command == null) {
            err.println("Must choose a command");
            err.flush();
            return EXIT_FAILURE;
        }
        if (parsed.socket == null) {
            err.println(USAGE);
            err.println("dtnclient: error: the following arguments are required: -s/--socket");
            return EXIT_USAGE;
        }
        return register(parsed, clientFactory);
    }

    private static int register(Arguments parsed, Function<DtnClientConfig, DtnClient> clientFactory) {
        Logger log = LoggerFactory.getLogger(DtnClientCli.class);
        try {
            DtnClientConfig config = DtnClientConfig.builder()
                    .withSocketPath(parsed.socket)
                    .build();
            clientFactory.apply(config).registerUnregister(parsed.endpoint, !parsed.unregister);
            log.info("success");
            return EXIT_OK;
        } catch (DaemonNotFoundException e) {
            log.error("Could not connect to agent socket");
            log.debug("Connection failure", e);
            return EXIT_FAILURE;
        } catch (DataException e) {
            log.error("Error communicating with dtnd: {}", e.getMessage());
            return EXIT_FAILURE;
        } catch (DtndException e) {
            log.error("dtnd responded with error: {}", e.getMessage());
            return EXIT_FAILURE;
        } catch (Exception e) {
            log.error("Generic error: {}", e.getMessage());
            log.debug("Failure detail", e);
            return EXIT_FAILURE;
        }
    }

    // ------------------------------------------------------------------------
    // Argument parsing
    // ------------------------------------------------------------------------

    static final class UsageException extends Exception
    {
        UsageException(String message) {
            super(message);
        }
    }

    static final class Arguments
    {
        Path socket;
        boolean verbose;
        boolean help;
        String command;
        boolean unregister;
        EndpointId endpoint;

        static Arguments parse(String[] args) throws UsageException {
            Arguments result = new Arguments();
            int i = 0;

            // Global options come before the command.
            while (i < args.length && result.command == null) {
                String arg = args[i++];
                switch (arg) {
                    case "-h", "--help" -> result.help = true;
                    case "-v" -> result.verbose = true;
                    case "-s", "--socket" -> {
                        if (i >= args.length) {
                            throw new UsageException("argument -s/--socket: expected one argument");
                        }
                        result.socket = Path.of(args[i++]);
                    }
                    case "register" -> result.command = arg;
                    default -> {
                        if (arg.startsWith("--socket=")) {
                            result.socket = Path.of(arg.substring("--socket=".length()));
                        } else if (arg.startsWith("-")) {
                            throw new UsageException("unrecognized arguments: " + arg);
                        } else {
                            throw new UsageException("argument command: invalid choice: '" + arg
                                    + "' (choose from 'register')");
                        }
                    }
                }
            }

            if (result.command == null || result.help) {
                return result;
            }

            String endpointText = null;
            while (i < args.length) {
                String arg = args[i++];
                switch (arg) {
                    case "-u", "--unregister" -> result.unregister = true;
                    case "-h", "--help" -> result.help = true;
                    default -> {
                        if (arg.startsWith("-") && arg.length() > 1) {
                            throw new UsageException("unrecognized arguments: " + arg);
                        }
                        if (endpointText != null) {
                            throw new UsageException("unrecognized arguments: " + arg);
                        }
                        endpointText = arg;
                    }
                }
            }

            if (result.help) {
                return result;
            }
            if (endpointText == null) {
                throw new UsageException("the following arguments are required: EndpointID");
            }
            try {
                result.endpoint = EndpointId.parse(endpointText);
            } catch (EidException e) {
                throw new UsageException("argument EndpointID: invalid EID value: '" + endpointText
                        + "' (" + e.getMessage() + ")");
            }
            return result;
        }
    }
}
