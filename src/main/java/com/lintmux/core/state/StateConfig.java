package com.lintmux.core.state;

import com.lintmux.core.engine.PluginProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StateConfig {

    @Bean
    public ReactiveStore reactiveStore(ActiveChildResolver resolver, PluginProperties properties) {
        return StateKeys.newStore(resolver, properties.getDefaultVersionCheck());
    }
}
