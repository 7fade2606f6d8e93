package com.zzf.selfpatch.llm;

import com.zzf.selfpatch.config.SelfPatchProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OracleConfig {

    @Bean
    @ConditionalOnMissingBean(LanguageModelOracle.class)
    public LanguageModelOracle languageModelOracle(SelfPatchProperties properties) {
        return new OpenAiLanguageModelOracle(properties.getOracle());
    }
}
