package io.vision.spring.boot;

import io.vision.normalize.KeyCasing;
import io.vision.normalize.NormalizationConfig;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VisionPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(VisionProperties.class);
            assertTrue(props.getConsole().isEnabled());
            assertFalse(props.getNormalization().isEnabled());
            assertEquals(KeyCasing.SNAKE_CASE, props.getNormalization().getKeyCasing());
            assertTrue(props.getNormalization().isDeep());
            assertFalse(props.getNormalization().toConfig().isActive());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("vision", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "vision.console.enabled=false",
                "vision.normalization.enabled=true",
                "vision.normalization.key-casing=kebab-case",
                "vision.normalization.deep=false",
                "vision.metrics.enabled=false",
                "vision.metrics.name-prefix=orders.vision"
        ).run(ctx -> {
            var props = ctx.getBean(VisionProperties.class);
            assertFalse(props.getConsole().isEnabled());
            assertEquals(new NormalizationConfig(true, KeyCasing.KEBAB_CASE, false),
                    props.getNormalization().toConfig());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("orders.vision", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(VisionProperties.class)
    static class PropsConfig {
    }
}
