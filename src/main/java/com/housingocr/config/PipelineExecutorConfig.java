package com.housingocr.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 流水线线程池配置
 *
 * <ul>
 *   <li>pipelineTaskExecutor: 每个文档一次处理运行，并发数由调度器的信号量控制</li>
 *   <li>pdfRenderExecutor: PDF 栅格化属于 CPU 密集操作，单独线程池执行，不阻塞网络调用</li>
 * </ul>
 *
 * @author housing-ocr
 * @since 2025-01-12
 */
@Configuration
public class PipelineExecutorConfig {

    @Bean("pipelineTaskExecutor")
    public ThreadPoolTaskExecutor pipelineTaskExecutor(PipelineProperties pipelineProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pipelineProperties.getMaxConcurrent());
        executor.setMaxPoolSize(pipelineProperties.getMaxConcurrent());
        executor.setThreadNamePrefix("pipeline-");
        // 关闭时等待在途任务结束，不中断外部调用
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) pipelineProperties.getShutdownTimeout().toSeconds());
        executor.initialize();
        return executor;
    }

    @Bean("pdfRenderExecutor")
    public ThreadPoolTaskExecutor pdfRenderExecutor() {
        int cpus = Runtime.getRuntime().availableProcessors();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, cpus / 2));
        executor.setMaxPoolSize(Math.max(1, cpus / 2));
        executor.setQueueCapacity(64);
        executor.setThreadNamePrefix("pdf-render-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
