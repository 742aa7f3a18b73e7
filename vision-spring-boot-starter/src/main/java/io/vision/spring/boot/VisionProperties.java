package io.vision.spring.boot;

import io.vision.normalize.KeyCasing;
import io.vision.normalize.NormalizationConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the vision runtime.
 *
 * @see VisionAutoConfiguration
 */
@ConfigurationProperties(prefix = "vision")
public class VisionProperties {

    private final Console console = new Console();
    private final Normalization normalization = new Normalization();
    private final Metrics metrics = new Metrics();

    public Console getConsole() {
        return console;
    }

    public Normalization getNormalization() {
        return normalization;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Console {
        /**
         * Whether the JSON-lines console sink is registered.
         */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Normalization {
        /**
         * Whether sinks receive units with normalized keys.
         */
        private boolean enabled = false;

        /**
         * Target key casing, e.g. {@code snake_case} or {@code camel-case}.
         */
        private KeyCasing keyCasing = KeyCasing.SNAKE_CASE;

        /**
         * Whether nested maps and lists are normalized too.
         */
        private boolean deep = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public KeyCasing getKeyCasing() {
            return keyCasing;
        }

        public void setKeyCasing(KeyCasing keyCasing) {
            this.keyCasing = keyCasing;
        }

        public boolean isDeep() {
            return deep;
        }

        public void setDeep(boolean deep) {
            this.deep = deep;
        }

        NormalizationConfig toConfig() {
            return new NormalizationConfig(enabled, keyCasing, deep);
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "vision";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
