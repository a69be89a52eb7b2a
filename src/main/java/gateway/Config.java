package gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import gateway.broker.RoutingMode;
import gateway.routing.OverflowPolicy;
import gateway.utils.Log;

import java.io.*;
import java.util.Locale;

public class Config {

    public String version = "0.1.0";
    public int port = 8765;
    public String path = "/ws";
    public int maxFrameSize = 65536;
    public boolean debug = false;
    public RoutingMode routing = RoutingMode.CHANNEL;
    public Broker broker = new Broker();
    public Delivery delivery = new Delivery();

    public Config() {
        // Default constructor for Jackson
    }

    public static class Broker {
        // "local" keeps everything in this JVM, "resp" talks to a Redis compatible server
        public String type = "local";
        public String host = "127.0.0.1";
        public int port = 6379;
        public String password;
        public String channel = "gateway";
        public long timeoutMillis = 5000;

        public Broker() { }
    }

    public static class Delivery {
        public int threads = 4;
        public int queueCapacity = 1024;
        public OverflowPolicy overflowPolicy = OverflowPolicy.BLOCK;
        public long sendTimeoutMillis = 5000;

        public Delivery() { }
    }

    public static Config load(String filename) {
        // Try loading from YAML
        File f = new File(filename);
        if (!f.exists()) {
            // Try looking for .yaml extension if .conf was passed
            if (filename.endsWith(".conf")) {
                File yamlFile = new File(filename.replace(".conf", ".yaml"));
                if (yamlFile.exists()) f = yamlFile;
            }
        }

        Config config = new Config();

        if (!f.exists()) {
            Log.warn("⚠️ Config file not found: " + filename + ". Using defaults.");
        } else {
            try {
                ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
                config = mapper.readValue(f, Config.class);
                if (config.broker == null) config.broker = new Broker();
                if (config.delivery == null) config.delivery = new Delivery();
                if (config.routing == null) config.routing = RoutingMode.CHANNEL;
            } catch (Exception e) {
                Log.warn("⚠️ Failed to load config as YAML (" + e.getMessage() + "). Attempting legacy parse...");
                config = loadLegacy(f, new Config());
            }
        }

        applyEnv(config);
        return config;
    }

    static void applyEnv(Config config) {
        String port = System.getenv("GATEWAY_PORT");
        if (port != null) {
            try {
                config.port = Integer.parseInt(port.trim());
            } catch (NumberFormatException e) {
                Log.warn("⚠️ Ignoring GATEWAY_PORT=" + port + ": not a number");
            }
        }
        if (System.getenv("GATEWAY_CHANNEL") != null) {
            config.broker.channel = System.getenv("GATEWAY_CHANNEL");
        }
    }

    static Config loadLegacy(File f, Config config) {
        try (BufferedReader br = new BufferedReader(new FileReader(f))) {
            String line;
            while ((line = br.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] parts = line.split("\\s+", 2);
                if (parts.length < 2) continue;

                String key = parts[0];
                String val = parts[1].trim();

                switch (key) {
                    case "port": config.port = Integer.parseInt(val); break;
                    case "path": config.path = val; break;
                    case "debug": config.debug = Boolean.parseBoolean(val); break;
                    case "routing": config.routing = RoutingMode.valueOf(val.toUpperCase(Locale.ROOT)); break;
                    case "broker": config.broker.type = val; break;
                    case "broker-host": config.broker.host = val; break;
                    case "broker-port": config.broker.port = Integer.parseInt(val); break;
                    case "requirepass": config.broker.password = val; break;
                    case "channel": config.broker.channel = val; break;
                    case "delivery-threads": config.delivery.threads = Integer.parseInt(val); break;
                    case "delivery-queue": config.delivery.queueCapacity = Integer.parseInt(val); break;
                    case "overflow-policy":
                        config.delivery.overflowPolicy = OverflowPolicy.valueOf(val.toUpperCase(Locale.ROOT).replace('-', '_'));
                        break;
                    case "send-timeout": config.delivery.sendTimeoutMillis = Long.parseLong(val); break;
                    default:
                        Log.warn("⚠️ Unknown config key: " + key);
                }
            }
            Log.info("✅ Loaded legacy config.");
        } catch (IOException | IllegalArgumentException e) {
            Log.error("⚠️ Error loading legacy config: " + e.getMessage());
        }
        return config;
    }
}
