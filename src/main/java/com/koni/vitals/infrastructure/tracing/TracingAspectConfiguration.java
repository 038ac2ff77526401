package com.koni.vitals.infrastructure.tracing;

import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.aop.ObservedAspect;
import io.micrometer.tracing.Tracer;
import io.micrometer.tracing.annotation.DefaultNewSpanParser;
import io.micrometer.tracing.annotation.ImperativeMethodInvocationProcessor;
import io.micrometer.tracing.annotation.MethodInvocationProcessor;
import io.micrometer.tracing.annotation.NewSpanParser;
import io.micrometer.tracing.annotation.SpanAspect;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * Enables the {@code @Observed} and {@code @ContinueSpan} annotations used on the sync,
 * archival and queue entry points.
 *
 * Annotated methods only produce observations when called through the Spring proxy, so the
 * annotations sit on public entry points and never on self-invoked helpers.
 */
@Configuration
@EnableAspectJAutoProxy
public class TracingAspectConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ObservedAspect observedAspect(ObservationRegistry observationRegistry) {
        return new ObservedAspect(observationRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public SpanAspect spanAspect(MethodInvocationProcessor methodInvocationProcessor) {
        return new SpanAspect(methodInvocationProcessor);
    }

    @Bean
    @ConditionalOnMissingBean
    public NewSpanParser newSpanParser() {
        return new DefaultNewSpanParser();
    }

    /**
     * Falls back to the no-op tracer in slices that leave tracing auto-configuration out.
     */
    @Bean
    @ConditionalOnMissingBean
    public MethodInvocationProcessor methodInvocationProcessor(NewSpanParser newSpanParser,
                                                               ObjectProvider<Tracer> tracer) {
        return new ImperativeMethodInvocationProcessor(newSpanParser, tracer.getIfAvailable(() -> Tracer.NOOP));
    }
}
