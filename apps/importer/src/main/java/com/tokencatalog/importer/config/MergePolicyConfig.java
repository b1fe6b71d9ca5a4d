package com.tokencatalog.importer.config;

import com.tokencatalog.importer.merge.CoalescingMergePolicy;
import com.tokencatalog.importer.merge.MergeFieldSet;
import com.tokencatalog.importer.merge.MergePolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class MergePolicyConfig {

    @Bean
    public MergePolicy defaultMergePolicy(TokenImportProperties properties) {
        MergeFieldSet fieldSet = MergeFieldSet.of(properties.isExtendedFieldSetEnabled());
        log.info("Token merge policy uses fields {}", fieldSet);
        return new CoalescingMergePolicy(fieldSet);
    }
}
