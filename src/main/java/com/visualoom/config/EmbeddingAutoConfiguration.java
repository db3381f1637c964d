package com.visualoom.config;

import com.visualoom.service.embedding.DisabledEmbeddingModel;
import com.visualoom.service.embedding.EmbeddingModel;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * Falls back to a model that produces no vectors when the deployment does not
 * provide its own {@link EmbeddingModel} bean.
 *
 * Registered in {@code META-INF/spring/...AutoConfiguration.imports} so it is
 * evaluated after every user configuration.
 */
@AutoConfiguration
public class EmbeddingAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(EmbeddingModel.class)
    public EmbeddingModel embeddingModel() {
        return new DisabledEmbeddingModel();
    }
}
