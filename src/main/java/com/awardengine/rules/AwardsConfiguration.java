package com.awardengine.rules;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AwardsConfiguration {

    @Bean
    public AwardCatalog awardCatalog() {
        AwardCatalog catalog = new AwardCatalog();
        catalog.load(GerbilPhysicsAwards.definitions());
        return catalog;
    }
}
