package com.delayq;

import com.delayq.config.DelayQProperties;
import com.delayq.internal.DelayQMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.MeterRegistry;
import org.hibernate.boot.model.naming.CamelCaseToUnderscoresNamingStrategy;
import org.hibernate.boot.model.naming.Identifier;
import org.hibernate.engine.jdbc.env.spi.JdbcEnvironment;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.jpa.JpaRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernatePropertiesCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.FilterType;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.time.ZoneId;

@AutoConfiguration(
        before = { HibernateJpaAutoConfiguration.class, JpaRepositoriesAutoConfiguration.class },
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@AutoConfigurationPackage
@ComponentScan(basePackages = "com.delayq", excludeFilters = @ComponentScan.Filter(
        type = FilterType.ASSIGNABLE_TYPE, classes = DelayQAutoConfiguration.class))
@EnableScheduling
@EnableConfigurationProperties(DelayQProperties.class)
public class DelayQAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "delayqObjectMapper")
    public ObjectMapper delayqObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    /**
     * Storage clock. All workers sharing a table must use the same zone and have
     * synchronized system clocks.
     */
    @Bean
    @ConditionalOnMissingBean(name = "delayqClock")
    public Clock delayqClock(DelayQProperties properties) {
        return Clock.system(ZoneId.of(properties.getDatabase().getTimeZone()));
    }

    @Bean
    @ConditionalOnMissingBean(name = "delayqHibernatePropertiesCustomizer")
    public HibernatePropertiesCustomizer delayqHibernatePropertiesCustomizer(DelayQProperties properties) {
        return hibernateProperties -> {
            String prefix = properties.getDatabase().getTablePrefix();
            if (prefix != null && !prefix.trim().isEmpty()) {
                hibernateProperties.put("hibernate.physical_naming_strategy",
                        new CamelCaseToUnderscoresNamingStrategy() {
                            @Override
                            public Identifier toPhysicalTableName(Identifier name, JdbcEnvironment jdbcEnvironment) {
                                Identifier original = super.toPhysicalTableName(name, jdbcEnvironment);
                                // Only intercept DelayQ tables
                                if (original.getText().toLowerCase().startsWith("delayq_")) {
                                    return new Identifier(prefix.trim() + original.getText(), original.isQuoted());
                                }
                                return original;
                            }
                        });
            }
        };
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        public DelayQMetrics delayqMetrics(JobRepository jobRepository, MeterRegistry meterRegistry,
                Clock delayqClock) {
            return new DelayQMetrics(jobRepository, meterRegistry, delayqClock);
        }
    }
}
