package com.causalflow.tracer.autoconfigure;

import com.causalflow.tracer.CausalTracer;
import com.causalflow.tracer.ChainInspector;
import com.causalflow.tracer.GlobalTracer;
import com.causalflow.tracer.TracerHealthCheck;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates the application's single {@link CausalTracer} and the beans that read from it.
 *
 * <p>The tracer records into the context's {@link MeterRegistry} when one exists, otherwise into a
 * private {@link SimpleMeterRegistry}. Every bean backs off when the application defines its own.
 *
 * @see CausalTracerProperties
 */
@AutoConfiguration
@EnableConfigurationProperties(CausalTracerProperties.class)
public class CausalTracerAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CausalTracerAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public CausalTracer causalTracer(CausalTracerProperties properties, ObjectProvider<MeterRegistry> registry) {
        CausalTracer tracer = new CausalTracer(properties.toTracerProperties(),
                registry.getIfAvailable(SimpleMeterRegistry::new), Clock.systemUTC());
        if (properties.installGlobal()) {
            GlobalTracer.install(tracer);
        }
        log.info("Causal tracer ready: enabled={}, maxChains={}, activeSpanTtl={}, service={}",
                tracer.isEnabled(), properties.maxChains(), properties.activeSpanTtl(), properties.serviceName());
        return tracer;
    }

    @Bean
    @ConditionalOnMissingBean
    public ChainInspector chainInspector(CausalTracer tracer) {
        return new ChainInspector(tracer);
    }

    @Bean
    @ConditionalOnMissingBean
    public TracerHealthCheck tracerHealthCheck(CausalTracer tracer) {
        return new TracerHealthCheck(tracer);
    }
}
