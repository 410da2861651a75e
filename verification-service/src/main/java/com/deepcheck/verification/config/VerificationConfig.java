package com.deepcheck.verification.config;

import com.deepcheck.common.aggregation.FrameAggregator;
import com.deepcheck.common.consensus.ConsensusEngine;
import com.deepcheck.common.consensus.ConsensusSettings;
import com.deepcheck.common.consensus.DualSourceConsensusStrategy;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class VerificationConfig {

    @Value("${verification.consensus.agreement-bonus:0.05}")
    private double agreementBonus;

    @Value("${verification.consensus.disagreement-penalty:0.20}")
    private double disagreementPenalty;

    @Value("${verification.consensus.partial-penalty:0.10}")
    private double partialPenalty;

    @Value("${verification.consensus.degraded-factor:0.80}")
    private double degradedFactor;

    @Value("${verification.frames.count:5}")
    private int frameCount;

    @Value("${verification.frames.fan-out:5}")
    private int frameFanOut;

    @Value("${verification.frames.temporal-flip-ratio:0.5}")
    private double temporalFlipRatio;

    @Value("${verification.frames.sampling-timeout:5m}")
    private Duration samplingTimeout;

    @Value("${verification.call-timeout:30s}")
    private Duration callTimeout;

    @Bean
    public ConsensusSettings consensusSettings() {
        return new ConsensusSettings(agreementBonus, disagreementPenalty, partialPenalty, degradedFactor);
    }

    @Bean
    public ConsensusEngine consensusEngine(ConsensusSettings consensusSettings) {
        return new DualSourceConsensusStrategy(consensusSettings);
    }

    @Bean
    public FrameAggregator frameAggregator() {
        return new FrameAggregator(temporalFlipRatio);
    }

    @Bean
    public PipelineSettings pipelineSettings() {
        return new PipelineSettings(callTimeout, frameCount, frameFanOut, samplingTimeout);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
