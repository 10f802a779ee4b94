package fr.lapetina.possibility.infrastructure.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for the possibility orchestrator.
 * Designed to be populated from YAML.
 */
public class OrchestratorConfig {

    private PoolConfig pool = new PoolConfig();
    private EndpointConfig endpoint = new EndpointConfig();
    private LifecycleConfig lifecycle = new LifecycleConfig();
    private GenerationConfig generation = new GenerationConfig();
    private MetricsConfig metrics = new MetricsConfig();

    public PoolConfig getPool() { return pool; }
    public void setPool(PoolConfig pool) { this.pool = pool; }

    public EndpointConfig getEndpoint() { return endpoint; }
    public void setEndpoint(EndpointConfig endpoint) { this.endpoint = endpoint; }

    public LifecycleConfig getLifecycle() { return lifecycle; }
    public void setLifecycle(LifecycleConfig lifecycle) { this.lifecycle = lifecycle; }

    public GenerationConfig getGeneration() { return generation; }
    public void setGeneration(GenerationConfig generation) { this.generation = generation; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Possibility pool and its command ring buffer.
     */
    public static class PoolConfig {
        private int maxConcurrentConnections = 6;
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public int getMaxConcurrentConnections() { return maxConcurrentConnections; }
        public void setMaxConcurrentConnections(int maxConcurrentConnections) { this.maxConcurrentConnections = maxConcurrentConnections; }

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Generation endpoint location and wire format.
     */
    public static class EndpointConfig {
        private String baseUrl = "http://localhost:3000";
        private String pathTemplate = "/api/possibility/{id}";
        private String dataPrefix = "data: ";
        private long connectTimeoutMs = 10_000;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getPathTemplate() { return pathTemplate; }
        public void setPathTemplate(String pathTemplate) { this.pathTemplate = pathTemplate; }

        public String getDataPrefix() { return dataPrefix; }
        public void setDataPrefix(String dataPrefix) { this.dataPrefix = dataPrefix; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    }

    public static class LifecycleConfig {
        private int maxRetries = 3;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    }

    /**
     * Defaults and heuristics used to build possibility metadata.
     */
    public static class GenerationConfig {
        private int defaultMaxTokens = 100;
        private double defaultTemperature = 0.7;
        private List<String> popularModels = new ArrayList<>(List.of(
                "gpt-4o",
                "gpt-4o-mini",
                "claude-3-5-sonnet-20241022",
                "claude-3-5-haiku-20241022",
                "gemini-1.5-pro-latest",
                "gemini-1.5-flash-latest"
        ));
        private Map<String, Integer> providerBaseLoadMs = new LinkedHashMap<>(Map.of(
                "openai", 2000,
                "anthropic", 3000,
                "google", 2500,
                "mistral", 2000,
                "together", 1500
        ));
        private int defaultBaseLoadMs = 3000;
        private List<String> enabledModels = new ArrayList<>();
        private List<Double> temperatures = new ArrayList<>();

        public int getDefaultMaxTokens() { return defaultMaxTokens; }
        public void setDefaultMaxTokens(int defaultMaxTokens) { this.defaultMaxTokens = defaultMaxTokens; }

        public double getDefaultTemperature() { return defaultTemperature; }
        public void setDefaultTemperature(double defaultTemperature) { this.defaultTemperature = defaultTemperature; }

        public List<String> getPopularModels() { return popularModels; }
        public void setPopularModels(List<String> popularModels) { this.popularModels = popularModels; }

        public Map<String, Integer> getProviderBaseLoadMs() { return providerBaseLoadMs; }
        public void setProviderBaseLoadMs(Map<String, Integer> providerBaseLoadMs) { this.providerBaseLoadMs = providerBaseLoadMs; }

        public int getDefaultBaseLoadMs() { return defaultBaseLoadMs; }
        public void setDefaultBaseLoadMs(int defaultBaseLoadMs) { this.defaultBaseLoadMs = defaultBaseLoadMs; }

        /** Models of the command line round, as {@code provider/model}. */
        public List<String> getEnabledModels() { return enabledModels; }
        public void setEnabledModels(List<String> enabledModels) { this.enabledModels = enabledModels; }

        public List<Double> getTemperatures() { return temperatures; }
        public void setTemperatures(List<Double> temperatures) { this.temperatures = temperatures; }
    }

    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "possibility";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
