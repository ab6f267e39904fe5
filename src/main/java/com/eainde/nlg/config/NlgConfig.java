package com.eainde.nlg.config;

import com.eainde.nlg.planner.PlannerSettings;
import com.eainde.nlg.planner.PlannerStrategies;
import com.eainde.nlg.planner.PlannerStrategy;
import com.eainde.nlg.template.ChatModelTemplateTranslator;
import com.eainde.nlg.template.TemplateTranslator;
import com.eainde.nlg.thread.MdcAwareExecutor;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneOffset;

@Log4j2
@Configuration
@EnableConfigurationProperties(NlgProperties.class)
public class NlgConfig {

    /** Fixed at the reference date when one is configured, so that old snapshots still score as recent. */
    @Bean
    public Clock clock(NlgProperties properties) {
        if (properties.getReferenceDate() == null) {
            return Clock.systemUTC();
        }
        log.info("Using reference date {}", properties.getReferenceDate());
        return Clock.fixed(properties.getReferenceDate().atStartOfDay(ZoneOffset.UTC).toInstant(), ZoneOffset.UTC);
    }

    @Bean
    public PlannerSettings plannerSettings(NlgProperties properties) {
        NlgProperties.Planner planner = properties.getPlanner();
        return new PlannerSettings(
                planner.getMaxParagraphs(),
                planner.getMaxSatellites(),
                planner.getMinSatellites(),
                planner.getNewParagraphAbsoluteThreshold(),
                planner.getSatelliteRelativeThreshold(),
                planner.getSatelliteAbsoluteThreshold(),
                planner.getNucleusWeight(),
                planner.getLaterParagraphFactor(),
                planner.getOverviewTopicCount());
    }

    @Bean
    public PlannerStrategy plannerStrategy(NlgProperties properties, PlannerSettings settings) {
        log.info("Using the {} document planner", properties.getPlanner().getVariant());
        return PlannerStrategies.forVariant(properties.getPlanner().getVariant(), settings);
    }

    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor bulkExecutor(NlgProperties properties) {
        return new MdcAwareExecutor(properties.getBulk().getThreads());
    }

    /** Templates of languages nobody wrote any for are translated only when a chat model bean exists. */
    @Bean
    public TemplateTranslator templateTranslator(ObjectProvider<ChatModel> chatModel) {
        ChatModel model = chatModel.getIfAvailable();
        if (model == null) {
            log.info("No chat model configured, template translation disabled");
            return TemplateTranslator.NONE;
        }
        return new ChatModelTemplateTranslator(model);
    }
}
