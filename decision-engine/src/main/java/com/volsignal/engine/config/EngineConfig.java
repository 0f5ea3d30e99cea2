package com.volsignal.engine.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.volsignal.core.calendar.CalendarOverlay;
import com.volsignal.core.classifier.CompositeClassifier;
import com.volsignal.core.risk.RiskBudgetSizer;
import com.volsignal.core.signal.SignalCalculator;
import com.volsignal.core.structure.StructureSelector;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Wires the five core components from {@link SignalEngineProperties}. The
 * components are immutable and stateless, so one instance of each serves every request.
 */
@Configuration
@EnableConfigurationProperties(SignalEngineProperties.class)
public class EngineConfig {

    @Bean
    public SignalCalculator signalCalculator(SignalEngineProperties props) {
        return new SignalCalculator(props.getThresholds().toConfig());
    }

    @Bean
    public CalendarOverlay calendarOverlay(SignalEngineProperties props) {
        return new CalendarOverlay(props.getCalendar().toConfig());
    }

    @Bean
    public CompositeClassifier compositeClassifier(SignalEngineProperties props) {
        return new CompositeClassifier(props.getClassifier().toConfig());
    }

    @Bean
    public RiskBudgetSizer riskBudgetSizer(SignalEngineProperties props) {
        return new RiskBudgetSizer(props.getSizing().toConfig());
    }

    @Bean
    public StructureSelector structureSelector(SignalEngineProperties props) {
        return new StructureSelector(props.getSelector().toConfig());
    }

    @Bean
    public Clock decisionClock(SignalEngineProperties props) {
        return Clock.system(ZoneId.of(props.getZone()));
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
