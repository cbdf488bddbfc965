package com.z254.verity.domain.repository;

import com.z254.verity.domain.model.DeploymentEvent;
import org.junit.jupiter.api.Test;

import static com.z254.verity.TestSignals.at;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link InMemoryEventRegistry}.
 */
class InMemoryEventRegistryTest {

    @Test
    void filtersByWindowAndService() {
        InMemoryEventRegistry registry = new InMemoryEventRegistry();
        registry.register(deploy("checkout", 120, "v2"));
        registry.register(deploy("checkout", 10, "v1"));
        registry.register(deploy("payments", 60, "v7"));
        registry.register(deploy("checkout", 900, "v3"));

        assertThat(registry.inWindow(at(0), at(300)))
                .extracting(DeploymentEvent::getVersion)
                .containsExactly("v1", "v7", "v2");
        assertThat(registry.forService("checkout", at(10), at(120)))
                .extracting(DeploymentEvent::getVersion)
                .containsExactly("v1", "v2");
    }

    private static DeploymentEvent deploy(String service, long seconds, String version) {
        return DeploymentEvent.builder().service(service).timestamp(at(seconds)).version(version).build();
    }
}
