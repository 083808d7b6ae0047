package com.obsinity.metricstream.spring.autoconfigure;

import com.obsinity.metricstream.config.EnrichmentSettings;
import com.obsinity.metricstream.enrich.MetricStreamEnricher;
import com.obsinity.metricstream.firehose.FirehoseRecordProcessor;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties(MetricStreamProperties.class)
public class MetricStreamAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public EnrichmentSettings enrichmentSettings(MetricStreamProperties properties) {
        return properties.toSettings();
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricStreamEnricher metricStreamEnricher(EnrichmentSettings settings) {
        return new MetricStreamEnricher(settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public FirehoseRecordProcessor firehoseRecordProcessor(MetricStreamEnricher enricher) {
        return new FirehoseRecordProcessor(enricher);
    }
}
