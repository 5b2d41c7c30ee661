package com.project.image.editdetection.config;

import com.project.image.editdetection.service.RegionOverlayRenderer;
import com.project.image.editdetection.service.scoring.PatchScorerHandle;
import com.project.image.editdetection.service.scoring.SsimPatchScorer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Beans for the perceptual path: the bounded worker pool and the lazily built patch scorer.
 */
@Configuration
public class PerceptualExecutorConfig {

    @Bean(name = "perceptualExecutor")
    public ThreadPoolTaskExecutor perceptualExecutor(DetectionProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getExecutor().getPoolSize());
        executor.setMaxPoolSize(properties.getExecutor().getPoolSize());
        executor.setQueueCapacity(properties.getExecutor().getQueueCapacity());
        executor.setThreadNamePrefix("perceptual-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }

    // the scorer is built on first use, not at startup
    @Bean
    public PatchScorerHandle patchScorerHandle(DetectionProperties properties) {
        DetectionProperties.Ssim ssim = properties.getSsim();
        return new PatchScorerHandle("ssim", () -> new SsimPatchScorer(ssim.getWindowSize(), ssim.getSigma()));
    }

    @Bean
    public RegionOverlayRenderer regionOverlayRenderer(DetectionProperties properties) {
        return new RegionOverlayRenderer(properties.getOverlay().isLabels());
    }
}
