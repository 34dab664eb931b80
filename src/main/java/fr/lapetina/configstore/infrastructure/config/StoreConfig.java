package fr.lapetina.configstore.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root bootstrap configuration: which sources to register and how to serve them.
 * Designed to be populated from YAML.
 */
public class StoreConfig {

    private ServerConfig server = new ServerConfig();
    private RefreshConfig refresh = new RefreshConfig();
    private MetricsConfig metrics = new MetricsConfig();
    private List<SourceConfig> sources = new ArrayList<>();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public RefreshConfig getRefresh() { return refresh; }
    public void setRefresh(RefreshConfig refresh) { this.refresh = refresh; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    public List<SourceConfig> getSources() { return sources; }
    public void setSources(List<SourceConfig> sources) { this.sources = sources; }

    /**
     * HTTP query API configuration.
     */
    public static class ServerConfig {
        private boolean enabled = true;
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }
    }

    /**
     * File refresh configuration.
     */
    public static class RefreshConfig {
        private long intervalMs = 10000;

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "configstore";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }

    /**
     * One configuration source. Which fields apply depends on {@code type}:
     * {@code file} and {@code filelist} use {@code path} (and {@code format});
     * {@code file} also uses {@code refresh}; {@code env} uses {@code prefix};
     * {@code inmemory} uses {@code name} and {@code items}.
     */
    public static class SourceConfig {
        private String type;
        private String path;
        private boolean refresh = false;
        private String format = "yaml";
        private String prefix = "";
        private String name;
        private List<ItemConfig> items = new ArrayList<>();

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public boolean isRefresh() { return refresh; }
        public void setRefresh(boolean refresh) { this.refresh = refresh; }

        public String getFormat() { return format; }
        public void setFormat(String format) { this.format = format; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public List<ItemConfig> getItems() { return items; }
        public void setItems(List<ItemConfig> items) { this.items = items; }
    }

    /**
     * Inline item for {@code inmemory} sources.
     */
    public static class ItemConfig {
        private String key;
        private String value;
        private long priority = 0;

        public String getKey() { return key; }
        public void setKey(String key) { this.key = key; }

        public String getValue() { return value; }
        public void setValue(String value) { this.value = value; }

        public long getPriority() { return priority; }
        public void setPriority(long priority) { this.priority = priority; }
    }
}
