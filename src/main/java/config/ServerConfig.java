package config;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ServerConfig {
    private static final Logger log = LoggerFactory.getLogger(ServerConfig.class);

    public static final String PORT = "server.webserver.port";
    public static final String ADDRESS = "server.webserver.address";
    public static final String MAX_THREADS = "server.webserver.maxthreads";
    public static final String HTTP_LOG_ENABLED = "server.http.log.enabled";
    public static final String DATABASE_PATH = "server.database.path";
    public static final String BCRYPT_ROUNDS = "security.bcrypt.rounds";

    private static final Map<String, Object> config = new HashMap<>();

    // 默认值
    static {
        resetToDefaults();
    }

    static synchronized void resetToDefaults() {
        config.clear();
        config.put(PORT, 5000);
        config.put(ADDRESS, "0.0.0.0");
        config.put(MAX_THREADS, 200);
        config.put(HTTP_LOG_ENABLED, true);
        config.put(DATABASE_PATH, "users.db");
        config.put(BCRYPT_ROUNDS, 12);
    }

    /**
     * 加载Properties配置文件，文件中的值覆盖默认值。
     * 文件不存在时保留默认值。
     */
    public static synchronized void loadPropertiesConfig(String path) {
        try (InputStream input = new FileInputStream(path)) {
            Properties props = new Properties();
            props.load(input);

            for (String key : props.stringPropertyNames()) {
                config.put(key, convert(props.getProperty(key).trim()));
            }
            log.info("已加载配置文件: {} ({} 项)", path, props.size());
        } catch (IOException e) {
            log.warn("无法加载配置文件 {}，使用默认配置: {}", path, e.getMessage());
        }
    }

    // 尝试转换为布尔值或数字，否则保持为字符串
    private static Object convert(String value) {
        if (value.equalsIgnoreCase("true") || value.equalsIgnoreCase("false")) {
            return Boolean.parseBoolean(value);
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return value;
        }
    }

    /**
     * 获取配置值
     */
    public static synchronized Object get(String key) {
        return config.get(key);
    }

    /**
     * 获取整数配置值
     */
    public static synchronized int getInt(String key, int defaultValue) {
        Object value = config.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    /**
     * 获取字符串配置值
     */
    public static synchronized String getString(String key, String defaultValue) {
        Object value = config.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    /**
     * 获取布尔配置值
     */
    public static synchronized boolean getBoolean(String key, boolean defaultValue) {
        Object value = config.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }
}
