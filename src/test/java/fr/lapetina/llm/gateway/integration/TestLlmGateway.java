package fr.lapetina.llm.gateway.integration;

import fr.lapetina.llm.gateway.LlmGateway;
import fr.lapetina.llm.gateway.infrastructure.config.ConfigLoader;
import fr.lapetina.llm.gateway.support.StubProviderClient;

import java.time.Clock;

/**
 * Test extension of LlmGateway wired to a scriptable provider client.
 */
public final class TestLlmGateway extends LlmGateway {

    private final StubProviderClient client;

    private TestLlmGateway(ConfigLoader loader, StubProviderClient client) {
        super(loader, loader.load(), client, Clock.systemUTC());
        this.client = client;
    }

    /**
     * Creates a started gateway from the default test configuration.
     */
    public static TestLlmGateway create() {
        return create("test-config.yaml");
    }

    /**
     * Creates a started gateway from a custom configuration path.
     */
    public static TestLlmGateway create(String configPath) {
        TestLlmGateway gateway = createStopped(configPath);
        gateway.start();
        return gateway;
    }

    public static TestLlmGateway createStopped(String configPath) {
        return new TestLlmGateway(new ConfigLoader(configPath), new StubProviderClient());
    }

    public StubProviderClient getClient() {
        return client;
    }
}
