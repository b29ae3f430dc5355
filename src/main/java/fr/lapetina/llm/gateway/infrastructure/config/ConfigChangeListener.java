package fr.lapetina.llm.gateway.infrastructure.config;

/**
 * Listener interface for configuration changes.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * Called when a validated configuration has been loaded.
     *
     * @param oldConfig The previous configuration (may be null on initial load)
     * @param newConfig The new configuration
     */
    void onConfigChanged(GatewayConfig oldConfig, GatewayConfig newConfig);
}
