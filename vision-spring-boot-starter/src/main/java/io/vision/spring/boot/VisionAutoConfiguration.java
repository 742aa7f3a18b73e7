package io.vision.spring.boot;

import io.vision.Vision;
import io.vision.sink.ConsoleSink;
import io.vision.sink.Sink;
import io.vision.spi.MetricsExporter;
import io.vision.store.ThreadLocalUnitStore;
import io.vision.store.UnitStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Auto-configuration for the vision runtime.
 *
 * <p>Builds one {@link Vision} from {@link VisionProperties} and every {@link Sink} bean in
 * the context, in {@code @Order} order. The console sink is itself a bean, so disabling it
 * with {@code vision.console.enabled=false} leaves only the application's sinks.
 *
 * @see VisionProperties
 * @see VisionMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(Vision.class)
@EnableConfigurationProperties(VisionProperties.class)
public class VisionAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(UnitStore.class)
    public ThreadLocalUnitStore unitStore() {
        return new ThreadLocalUnitStore();
    }

    @Bean
    @ConditionalOnMissingBean(ConsoleSink.class)
    @ConditionalOnProperty(prefix = "vision.console", name = "enabled", matchIfMissing = true)
    public ConsoleSink consoleSink() {
        return new ConsoleSink();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public Vision vision(VisionProperties props,
                         UnitStore unitStore,
                         ObjectProvider<Sink> sinkProvider,
                         ObjectProvider<MetricsExporter> metricsProvider) {

        MetricsExporter metrics = metricsProvider.getIfAvailable();
        List<Sink> sinks = sinkProvider.orderedStream().toList();

        var builder = Vision.builder()
                .unitStore(unitStore)
                .sinks(sinks)
                .defaultSink(false)
                .normalization(props.getNormalization().toConfig());
        if (metrics != null) {
            builder.metrics(metrics);
        }
        return builder.build();
    }
}
