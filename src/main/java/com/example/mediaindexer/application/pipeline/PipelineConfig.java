package com.example.mediaindexer.application.pipeline;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.ExecutorService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PipelineConfig {

    @Bean
    public ActorMailbox actorMailbox(PipelineCommandHandler pipelineCommandHandler,
                                     @Qualifier("pipelineMailboxExecutor") ExecutorService pipelineMailboxExecutor,
                                     ObjectProvider<MeterRegistry> meterRegistryProvider) {
        return new QueuedActorMailbox(pipelineCommandHandler, pipelineMailboxExecutor,
                meterRegistryProvider.getIfAvailable());
    }
}
