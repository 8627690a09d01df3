package com.lorasim.node;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class NodeConfig {

    @Bean
    public NodeLauncher nodeLauncher() {
        return new ProcessNodeLauncher();
    }
}
