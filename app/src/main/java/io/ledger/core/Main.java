package io.ledger.core;

import io.ledger.core.node.Node;
import io.ledger.core.node.NodeConfig;
import io.ledger.core.rpc.RpcServer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws Exception {
        installLogging();
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        NodeConfig config = loadConfig(options);
        LOG.info("Starting node: " + config);

        RpcServer rpcServer = null;
        try (Node node = Node.inMemory(config)) {
            node.start();

            if (options.enableRpc()) {
                rpcServer = new RpcServer(node, options.rpcBind(), options.rpcPort(), options.rpcToken());
                rpcServer.start();
            }

            if (options.keepAlive()) {
                node.startSealing();
                CountDownLatch shutdownLatch = new CountDownLatch(1);
                Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "ledger-shutdown"));
                LOG.info("Node running. Press CTRL+C to exit.");
                shutdownLatch.await();
            } else {
                LOG.info("No --keep-alive or --enable-rpc given; sealing one block and exiting");
                node.tick();
                LOG.info("=== Metrics ===\n" + node.metrics().scrapeMetrics());
            }
        } finally {
            if (rpcServer != null) {
                rpcServer.stop();
            }
        }
    }

    static NodeConfig loadConfig(CliOptions options) {
        NodeConfig config = options.configFile() != null
                ? NodeConfig.load(options.configFile())
                : NodeConfig.defaultLocal();
        long interval = options.sealIntervalMillis() > 0 ? options.sealIntervalMillis() : config.sealIntervalMillis;
        long gasLimit = options.blockGasLimit() > 0 ? options.blockGasLimit() : config.blockGasLimit;
        return config.withSealing(interval, gasLimit);
    }

    /** Uses the bundled logging.properties unless the JVM was pointed at another file. */
    private static void installLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Failed to load bundled logging.properties: " + e.getMessage());
        }
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path configFile,
            boolean keepAlive,
            boolean enableRpc,
            String rpcBind,
            int rpcPort,
            String rpcToken,
            long sealIntervalMillis,
            long blockGasLimit
    ) {
        static CliOptions parse(String[] args) {
            Path configFile = envPath("LEDGER_CONFIG", null);
            boolean keepAlive = false;
            boolean enableRpc = "true".equalsIgnoreCase(System.getenv("LEDGER_ENABLE_RPC"));
            String rpcBind = envOrDefault("LEDGER_RPC_BIND", "127.0.0.1");
            int rpcPort = 9090;
            String rpcToken = System.getenv("LEDGER_RPC_TOKEN");
            long sealIntervalMillis = -1L;
            long blockGasLimit = -1L;
            boolean showHelp = false;
            String error = null;

            try {
                rpcPort = envPort("LEDGER_RPC_PORT", 9090);
                String sealEnv = System.getenv("LEDGER_SEAL_INTERVAL_MS");
                if (sealEnv != null && !sealEnv.isBlank()) {
                    sealIntervalMillis = parsePositiveLong(sealEnv, "LEDGER_SEAL_INTERVAL_MS");
                }
                String gasEnv = System.getenv("LEDGER_BLOCK_GAS_LIMIT");
                if (gasEnv != null && !gasEnv.isBlank()) {
                    blockGasLimit = parsePositiveLong(gasEnv, "LEDGER_BLOCK_GAS_LIMIT");
                }
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--config=")) {
                        configFile = Path.of(arg.substring("--config=".length()));
                    } else if (arg.equals("--keep-alive")) {
                        keepAlive = true;
                    } else if (arg.equals("--enable-rpc")) {
                        enableRpc = true;
                    } else if (arg.startsWith("--rpc-bind=")) {
                        rpcBind = arg.substring("--rpc-bind=".length());
                    } else if (arg.startsWith("--rpc-port=")) {
                        try {
                            rpcPort = parsePort(arg.substring("--rpc-port=".length()), "--rpc-port");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--rpc-token=")) {
                        rpcToken = arg.substring("--rpc-token=".length());
                    } else if (arg.startsWith("--seal-interval-ms=")) {
                        try {
                            sealIntervalMillis = parsePositiveLong(arg.substring("--seal-interval-ms=".length()), "--seal-interval-ms");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--block-gas-limit=")) {
                        try {
                            blockGasLimit = parsePositiveLong(arg.substring("--block-gas-limit=".length()), "--block-gas-limit");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            if (rpcToken != null && rpcToken.isBlank()) {
                rpcToken = null;
            }
            keepAlive = keepAlive || enableRpc || "true".equalsIgnoreCase(System.getenv("LEDGER_KEEP_ALIVE"));

            if (configFile != null && !showHelp && !Files.isRegularFile(configFile)) {
                showHelp = true;
                error = "Config file not found: " + configFile;
            }

            return new CliOptions(
                    showHelp,
                    error,
                    configFile,
                    keepAlive,
                    enableRpc,
                    rpcBind,
                    rpcPort,
                    rpcToken,
                    sealIntervalMillis,
                    blockGasLimit
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: ledger-txpool [options]

Options:
  --help, -h                 Show this help message and exit
  --config=<path>            JSON node config (chain id, gas limit, genesis allocations, txPool)
  --keep-alive               Keep the node sealing until interrupted
  --enable-rpc               Start the RPC server (default bind 127.0.0.1:9090)
  --rpc-bind=<host>          Bind address for the RPC server
  --rpc-port=<port>          Port for the RPC server (default 9090)
  --rpc-token=<token>        Require Bearer/X-API-Key token for the RPC server
  --seal-interval-ms=<ms>    Delay between sealing attempts (default 2000)
  --block-gas-limit=<gas>    Gas budget handed to the pool per block (default 20000000)

Environment overrides:
  LEDGER_CONFIG              Override --config
  LEDGER_ENABLE_RPC          Set to "true" to enable RPC without CLI flag
  LEDGER_RPC_BIND            Bind address for the RPC server
  LEDGER_RPC_PORT            Port for the RPC server
  LEDGER_RPC_TOKEN           Token for RPC auth (if --rpc-token not supplied)
  LEDGER_SEAL_INTERVAL_MS    Delay between sealing attempts
  LEDGER_BLOCK_GAS_LIMIT     Gas budget per block
  LEDGER_KEEP_ALIVE          Set to "true" to force keep-alive mode
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static String envOrDefault(String key, String fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static int envPort(String key, int fallback) {
            String value = System.getenv(key);
            if (value == null || value.isBlank()) {
                return fallback;
            }
            return parsePort(value, key);
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value);
                if (port <= 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }

        private static long parsePositiveLong(String value, String flag) {
            try {
                long parsed = Long.parseLong(value);
                if (parsed <= 0) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }
    }
}
