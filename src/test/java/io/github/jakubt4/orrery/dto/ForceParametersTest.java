package io.github.jakubt4.orrery.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jakubt4.orrery.dynamics.ForceConfiguration;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ForceParametersTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void deserializesAndMapsToConfiguration() throws Exception {
        final var parameters = objectMapper.readValue("""
                {
                    "flags": {"drag": true, "srp": true, "thirdBody": false, "j2": true},
                    "area": 1.5,
                    "mass": 250.0,
                    "reflectivity": 1.3
                }
                """, ForceParameters.class);

        final var config = parameters.toConfiguration();

        assertThat(config.drag()).isTrue();
        assertThat(config.srp()).isTrue();
        assertThat(config.thirdBody()).isFalse();
        assertThat(config.j2()).isTrue();
        assertThat(config.area()).isEqualTo(1.5);
        assertThat(config.reflectivity()).isEqualTo(1.3);
        assertThat(config.dragCoefficient()).isEqualTo(2.2);
        assertThat(config.bodies()).isEmpty();
    }

    @Test
    void missingFlagsMeanTwoBody() {
        final var parameters = new ForceParameters(null, null, null, null, null, null);

        assertThat(parameters.toConfiguration()).isEqualTo(ForceConfiguration.twoBody());
    }

    @Test
    void rejectedResponsesSerializeWithStatus() throws Exception {
        final var tree = objectMapper.readTree(objectMapper.writeValueAsString(
                PropagationResponse.rejected("Initial state must have 6 elements")));

        assertThat(tree.get("status").asText()).isEqualTo("REJECTED");
        assertThat(tree.get("message").asText()).contains("6 elements");
        assertThat(tree.get("state").isNull()).isTrue();
        assertThat(tree.get("approximatedJacobians")).isEmpty();
    }

    @Test
    void bodiesArePassedThrough() {
        final var parameters = new ForceParameters(new ForceFlags(false, false, true, false),
                null, null, null, null, List.of("SUN", "MOON"));

        assertThat(parameters.toConfiguration().bodies()).containsExactly("SUN", "MOON");
    }
}
