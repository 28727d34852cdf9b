package io.lexstream.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ModelFallbackControllerTest {

    @Test
    void shouldStartOnPrimaryAndSwitchWhenExhausted() {
        ModelFallbackController controller = new ModelFallbackController("gemini-2.5-flash", "gemini-2.5-flash-lite");

        assertThat(controller.activeTier()).isEqualTo(ModelTier.PRIMARY);
        assertThat(controller.activeModel()).isEqualTo("gemini-2.5-flash");

        controller.markExhausted();
        controller.markExhausted();

        assertThat(controller.activeTier()).isEqualTo(ModelTier.FALLBACK);
        assertThat(controller.activeModel()).isEqualTo("gemini-2.5-flash-lite");
    }

    @Test
    void shouldReturnToPrimaryOnlyOnReset() {
        ModelFallbackController controller = new ModelFallbackController("primary", "fallback");
        controller.markExhausted();

        controller.reset();

        assertThat(controller.activeModel()).isEqualTo("primary");
    }
}
