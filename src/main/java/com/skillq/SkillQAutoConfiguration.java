package com.skillq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.skillq.config.SkillQProperties;
import com.skillq.internal.RetryBackoff;
import com.skillq.internal.SkillQMetrics;
import com.skillq.skill.impl.BatchExtractorSkill;
import com.skillq.skill.impl.RegulatoryResearchSkill;
import com.skillq.spi.ContentSanitizer;
import com.skillq.spi.DocumentAccessor;
import com.skillq.spi.PlainTextSanitizer;
import com.skillq.spi.ResearchProvider;
import com.skillq.spi.StructuredExtractor;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@AutoConfiguration(before = HibernateJpaAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@AutoConfigurationPackage
@ComponentScan("com.skillq")
@EnableScheduling
@EnableConfigurationProperties(SkillQProperties.class)
public class SkillQAutoConfiguration {

    static final int MAX_PERSISTED_TEXT_LENGTH = 255;

    @Bean
    @ConditionalOnMissingBean(name = "skillqObjectMapper")
    public ObjectMapper skillqObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean
    public ContentSanitizer skillqContentSanitizer() {
        return new PlainTextSanitizer(MAX_PERSISTED_TEXT_LENGTH);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryBackoff skillqRetryBackoff(SkillQProperties properties) {
        return new RetryBackoff(properties.getJobs().getRetryBaseDelay(), properties.getJobs().getRetryMaxDelay());
    }

    @Bean
    @ConditionalOnBean({ DocumentAccessor.class, StructuredExtractor.class })
    public BatchExtractorSkill batchExtractorSkill(DocumentAccessor documentAccessor, StructuredExtractor extractor,
            ContentSanitizer sanitizer) {
        return new BatchExtractorSkill(documentAccessor, extractor, sanitizer);
    }

    @Bean
    @ConditionalOnBean(ResearchProvider.class)
    public RegulatoryResearchSkill regulatoryResearchSkill(ResearchProvider researchProvider) {
        return new RegulatoryResearchSkill(researchProvider);
    }

    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    public SkillQMetrics skillqMetrics(JobRepository jobRepository, MeterRegistry meterRegistry,
            SkillQProperties properties) {
        return new SkillQMetrics(jobRepository, meterRegistry, properties);
    }
}
