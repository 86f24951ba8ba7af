package com.signalmix.app;

import com.signalmix.app.properties.CollaboratorProperties;
import com.signalmix.config.Config;
import com.signalmix.external.Collaborators;
import com.signalmix.runner.PipelineRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;

@Configuration
@EnableConfigurationProperties({CollaboratorProperties.class})
public class SignalMixBootstrapConfig {
    @Bean
    public Config signalMixConfig(Environment environment) {
        Map<String, Object> rawProperties = Binder.get(environment)
                .bind("", Bindable.mapOf(String.class, Object.class))
                .orElseGet(Map::of);
        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        return Config.fromConfigurationProperties(workingDir, rawProperties);
    }

    @Bean
    public Collaborators collaborators(CollaboratorProperties properties, Config config) {
        if (properties == null) {
            return Collaborators.fromConfig(config);
        }
        return Collaborators.fromCommands(properties.getCommands(), properties.getWorkers(), config.workingDir());
    }

    @Bean
    @Lazy
    public PipelineRunner pipelineRunner(Config config, Collaborators collaborators) {
        return new PipelineRunner(config, collaborators, Clock.systemUTC());
    }
}
