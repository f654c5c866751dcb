package org.muma.mini.kv.config;

import lombok.Getter;
import lombok.Setter;
import org.muma.mini.kv.protocol.RespLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

/**
 * 全局配置中心
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (minikv.properties) > 默认值
 */
@Getter
@Setter
public class MiniKvConfig {

    private static final Logger log = LoggerFactory.getLogger(MiniKvConfig.class);
    private static final MiniKvConfig INSTANCE = new MiniKvConfig();

    public static final String DEFAULT_CONFIG_FILE = "minikv.properties";

    // --- Core Settings ---
    private String host = "localhost";
    private int port = 6379;
    private int workerThreads = 0; // 0 = Netty default

    private String configFilePath = DEFAULT_CONFIG_FILE;

    // --- Protocol Limits ---
    private int maxDepth = RespLimits.DEFAULT.maxDepth();
    private int maxArrayLength = RespLimits.DEFAULT.maxArrayLength();
    private int maxBulkLength = RespLimits.DEFAULT.maxBulkLength();
    private int maxLineLength = RespLimits.DEFAULT.maxLineLength();

    public MiniKvConfig() {
    }

    public static MiniKvConfig getInstance() {
        return INSTANCE;
    }

    // --- Loading Logic ---

    /**
     * 完整加载流程：配置文件 -> 环境变量 -> 命令行
     */
    public void load(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                this.configFilePath = args[i + 1];
            }
        }
        loadConfig(configFilePath);
        parseArgs(args);
    }

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for option " + arg);
            }
            switch (arg) {
                case "--config" -> this.configFilePath = args[++i];
                case "--host" -> this.host = args[++i];
                case "--port" -> this.port = parsePort(args[++i]);
                case "--workers" -> this.workerThreads = parseInt("--workers", args[++i]);
                default -> throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }
        log.info("Config loaded from args: host={}, port={}", host, port);
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        // 1. Core
        this.host = getString(props, "server.host", this.host);
        this.port = parsePort(getString(props, "server.port", String.valueOf(this.port)));
        this.workerThreads = getInt(props, "server.worker_threads", this.workerThreads);

        // 2. Protocol
        this.maxDepth = getInt(props, "protocol.max_depth", this.maxDepth);
        this.maxArrayLength = getInt(props, "protocol.max_array_length", this.maxArrayLength);
        this.maxBulkLength = getInt(props, "protocol.max_bulk_length", this.maxBulkLength);
        this.maxLineLength = getInt(props, "protocol.max_line_length", this.maxLineLength);

        // 3. Env Vars Override
        applyEnvOverrides(System.getenv());

        log.info("MiniKvConfig initialized: {}", this);
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            // 如果是 classpath 资源
            if (is != null) {
                props.load(is);
                log.info("Loaded config from classpath: {}", path);
            } else {
                // 尝试作为文件系统路径加载
                try (InputStream fis = new FileInputStream(path)) {
                    props.load(fis);
                    log.info("Loaded config from file: {}", path);
                } catch (IOException e) {
                    log.warn("Config file not found: {}, using defaults.", path);
                }
            }
        } catch (IOException e) {
            log.error("Error loading config", e);
        }
        return props;
    }

    void applyEnvOverrides(Map<String, String> env) {
        String envHost = env.get("MINIKV_HOST");
        if (envHost != null) {
            this.host = envHost;
            log.info("Host overridden by ENV: {}", this.host);
        }

        String envPort = env.get("MINIKV_PORT");
        if (envPort != null) {
            this.port = parsePort(envPort);
            log.info("Port overridden by ENV: {}", this.port);
        }
    }

    public RespLimits toRespLimits() {
        return new RespLimits(maxDepth, maxArrayLength, maxBulkLength, maxLineLength);
    }

    private static int parsePort(String value) {
        int p = parseInt("port", value);
        if (p < 0 || p > 65535) {
            throw new IllegalArgumentException("Port out of range: " + p);
        }
        return p;
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value, e);
        }
    }

    private int getInt(Properties props, String key, int defaultValue) {
        String val = props.getProperty(key);
        return val != null ? parseInt(key, val) : defaultValue;
    }

    private String getString(Properties props, String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    @Override
    public String toString() {
        return "Config{host=" + host + ", port=" + port + ", workers=" + workerThreads
                + ", limits=" + toRespLimits() + "}";
    }
}
