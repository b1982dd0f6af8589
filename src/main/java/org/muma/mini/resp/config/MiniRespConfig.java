package org.muma.mini.resp.config;

import lombok.Getter;
import lombok.Setter;
import org.muma.mini.resp.protocol.RespFrameParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * 全局配置中心
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (mini-resp.properties) > 默认值
 */
@Getter
@Setter
public class MiniRespConfig {

    private static final Logger log = LoggerFactory.getLogger(MiniRespConfig.class);
    private static final MiniRespConfig INSTANCE = new MiniRespConfig();

    public static final String DEFAULT_CONFIG_FILE = "mini-resp.properties";

    // --- Core Settings ---
    private String bindHost = "127.0.0.1";
    private int port = 6379;
    private int workerThreads = 0; // 0 = Netty default

    // --- Protocol ---
    private long maxBulkLength = RespFrameParser.DEFAULT_MAX_BULK_LENGTH;

    // --- Diagnostics ---
    private long slowLogThresholdMs = 10;

    private String configFilePath = DEFAULT_CONFIG_FILE;

    // --- Singleton Access ---
    MiniRespConfig() {
    }

    public static MiniRespConfig getInstance() {
        return INSTANCE;
    }

    // --- Loading Logic ---

    /**
     * 完整加载流程：先确定配置文件路径，再依次叠加文件、环境变量、命令行参数
     */
    public void load(String[] args, Map<String, String> env) {
        String path = findConfigPath(args);
        if (path != null) {
            this.configFilePath = path;
        }
        loadConfig(configFilePath);
        applyEnvOverrides(env);
        parseArgs(args);
        log.info("MiniRespConfig initialized: {}", this);
    }

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (i + 1 >= args.length) {
                log.warn("Ignoring argument without value: {}", arg);
                break;
            }
            switch (arg) {
                case "--config" -> this.configFilePath = args[++i];
                case "--port" -> this.port = parseInt("--port", args[++i], this.port);
                case "--bind" -> this.bindHost = args[++i];
                case "--workers" -> this.workerThreads = parseInt("--workers", args[++i], this.workerThreads);
                default -> log.warn("Unknown argument: {}", arg);
            }
        }
        log.debug("Config loaded from args: bind={}, port={}", bindHost, port);
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        // 1. Core
        this.bindHost = props.getProperty("server.bind", this.bindHost).trim();
        this.port = getInt(props, "server.port", this.port);
        this.workerThreads = getInt(props, "server.worker_threads", this.workerThreads);

        // 2. Protocol
        String maxBulk = props.getProperty("proto-max-bulk-len");
        if (maxBulk != null) {
            try {
                long size = parseSize(maxBulk);
                if (size <= 0 || size > RespFrameParser.MAX_BULK_LENGTH_LIMIT) {
                    log.warn("proto-max-bulk-len '{}' out of range (1..{}), using default {}.",
                            maxBulk, RespFrameParser.MAX_BULK_LENGTH_LIMIT, this.maxBulkLength);
                } else {
                    this.maxBulkLength = size;
                }
            } catch (NumberFormatException | ArithmeticException e) {
                log.warn("Invalid proto-max-bulk-len '{}', using default {}.", maxBulk, this.maxBulkLength);
            }
        }

        // 3. Diagnostics
        String slowLog = props.getProperty("slowlog-log-slower-than-ms");
        if (slowLog != null) {
            try {
                this.slowLogThresholdMs = Long.parseLong(slowLog.trim());
            } catch (NumberFormatException e) {
                log.warn("Invalid slowlog-log-slower-than-ms '{}', using default {}.", slowLog, this.slowLogThresholdMs);
            }
        }
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
        String envBind = env.get("RESP_BIND");
        if (envBind != null) {
            this.bindHost = envBind;
            log.info("Bind address overridden by ENV: {}", this.bindHost);
        }

        String envPort = env.get("RESP_PORT");
        if (envPort != null) {
            this.port = parseInt("RESP_PORT", envPort, this.port);
            log.info("Port overridden by ENV: {}", this.port);
        }
    }

    private String findConfigPath(String[] args) {
        for (int i = 0; i + 1 < args.length; i++) {
            if ("--config".equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    // 辅助：解析带单位的大小 (64mb, 1gb)
    static long parseSize(String sizeStr) {
        String s = sizeStr.toLowerCase(Locale.ROOT).trim();
        long multiplier = 1;
        if (s.endsWith("kb")) {
            multiplier = 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("mb")) {
            multiplier = 1024 * 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("gb")) {
            multiplier = 1024 * 1024 * 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("b")) {
            s = s.substring(0, s.length() - 1);
        }
        // 溢出时抛 ArithmeticException
        return Math.multiplyExact(Long.parseLong(s.trim()), multiplier);
    }

    private int parseInt(String name, String value, int defaultValue) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid value for {}: '{}', keeping {}.", name, value, defaultValue);
            return defaultValue;
        }
    }

    private int getInt(Properties props, String key, int defaultValue) {
        String val = props.getProperty(key);
        return val != null ? parseInt(key, val, defaultValue) : defaultValue;
    }

    @Override
    public String toString() {
        return "Config{bind=" + bindHost + ", port=" + port + ", workers=" + workerThreads
                + ", maxBulkLength=" + maxBulkLength + ", slowLogMs=" + slowLogThresholdMs + "}";
    }
}
