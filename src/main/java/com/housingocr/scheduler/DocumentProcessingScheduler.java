package com.housingocr.scheduler;

import com.housingocr.config.PipelineProperties;
import com.housingocr.model.dto.PipelineTask;
import com.housingocr.model.entity.DocumentDO;
import com.housingocr.service.DocumentPipelineService;
import com.housingocr.service.DocumentStoreService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 文档处理调度器
 *
 * 单线程轮询待处理文档，按优先级分发到 pipelineTaskExecutor。
 * 并发数由信号量限制，同一文档同一时刻最多一个处理单元（在途ID集合）。
 * 启动时先把遗留的 processing 状态恢复为 pending，关闭时等待在途任务完成。
 *
 * @author housing-ocr
 * @since 2025-01-12
 */
@Slf4j
@Component
public class DocumentProcessingScheduler implements SmartLifecycle {

    private static final long WAKE_UP = -1L;

    private final DocumentStoreService documentStoreService;
    private final DocumentPipelineService documentPipelineService;
    private final Executor taskExecutor;
    private final PipelineProperties pipelineProperties;

    private final Semaphore permits;
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();
    private final LinkedBlockingQueue<Long> signals = new LinkedBlockingQueue<>();
    private final PriorityBlockingQueue<PipelineTask> manualTasks = new PriorityBlockingQueue<>();
    private final AtomicLong sequence = new AtomicLong();

    private volatile boolean running = false;
    private Thread pollThread;

    public DocumentProcessingScheduler(DocumentStoreService documentStoreService,
                                       DocumentPipelineService documentPipelineService,
                                       @Qualifier("pipelineTaskExecutor") Executor taskExecutor,
                                       PipelineProperties pipelineProperties) {
        this.documentStoreService = documentStoreService;
        this.documentPipelineService = documentPipelineService;
        this.taskExecutor = taskExecutor;
        this.pipelineProperties = pipelineProperties;
        this.permits = new Semaphore(pipelineProperties.getMaxConcurrent());
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        if (!Boolean.TRUE.equals(pipelineProperties.getEnabled())) {
            log.info("文档处理调度器未启用");
            return;
        }

        int recovered = documentStoreService.resetStaleProcessing();
        if (recovered > 0) {
            log.warn("恢复中断的处理中文档: count={}", recovered);
        }

        running = true;
        pollThread = new Thread(this::pollLoop, "pipeline-scheduler");
        // 非守护线程：应用没有 Web 容器，空闲时由轮询线程维持进程
        pollThread.setDaemon(false);
        pollThread.start();
        log.info("文档处理调度器已启动: maxConcurrent={}, batchSize={}, pollInterval={}",
            pipelineProperties.getMaxConcurrent(), pipelineProperties.getBatchSize(), pipelineProperties.getPollInterval());
    }

    @Override
    public void stop() {
        Thread thread;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            thread = pollThread;
        }
        log.info("停止文档处理调度器，等待在途任务: inFlight={}", inFlight.size());
        signals.offer(WAKE_UP);
        try {
            thread.join(pipelineProperties.getShutdownTimeout().toMillis() + 1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("文档处理调度器已停止: remaining={}", inFlight.size());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * 手动触发处理，排在自动任务之前
     */
    public void submitManual(Long documentId) {
        manualTasks.offer(PipelineTask.builder()
            .documentId(documentId)
            .priority(PipelineTask.PRIORITY_MANUAL)
            .manual(true)
            .sequence(sequence.incrementAndGet())
            .build());
        signals.offer(WAKE_UP);
        log.info("手动任务已入队: documentId={}", documentId);
    }

    /**
     * 当前在途的文档数
     */
    public int getInFlightCount() {
        return inFlight.size();
    }

    private void pollLoop() {
        while (running) {
            try {
                runCycle();
                // 无在途任务时相当于空闲休眠，有在途任务时任一完成即唤醒
                Long signal = signals.poll(pipelineProperties.getPollInterval().toMillis(), TimeUnit.MILLISECONDS);
                if (signal != null) {
                    signals.clear();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("调度循环异常", e);
                sleepQuietly();
            }
        }
        awaitInFlight();
    }

    /**
     * 一轮调度: 合并手动任务与查询结果，排序后尽可能分发
     */
    void runCycle() {
        // 先查询再取手动任务，查询失败时手动任务仍留在队列中
        List<DocumentDO> documents = documentStoreService.getEligibleDocuments(pipelineProperties.getBatchSize());

        List<PipelineTask> tasks = new ArrayList<>();
        manualTasks.drainTo(tasks);
        for (DocumentDO document : documents) {
            boolean favorite = Integer.valueOf(1).equals(document.getFavorite());
            tasks.add(PipelineTask.builder()
                .documentId(document.getId())
                .priority(favorite ? PipelineTask.PRIORITY_FAVORITE : PipelineTask.PRIORITY_DEFAULT)
                .manual(false)
                .sequence(sequence.incrementAndGet())
                .build());
        }
        if (tasks.isEmpty()) {
            return;
        }
        tasks.sort(null);

        Set<Long> seen = new HashSet<>();
        for (int i = 0; i < tasks.size(); i++) {
            PipelineTask task = tasks.get(i);
            Long documentId = task.getDocumentId();
            if (!seen.add(documentId)) {
                continue;
            }
            if (!running || !permits.tryAcquire()) {
                // 并发已满，未分发的手动任务留到下一轮
                requeueManual(tasks.subList(i, tasks.size()));
                return;
            }
            if (!inFlight.add(documentId)) {
                permits.release();
                log.debug("文档正在处理中，跳过: documentId={}", documentId);
                continue;
            }
            dispatch(documentId);
        }
    }

    private void dispatch(Long documentId) {
        try {
            taskExecutor.execute(() -> runUnit(documentId));
            log.debug("分发文档处理: documentId={}, inFlight={}", documentId, inFlight.size());
        } catch (RejectedExecutionException e) {
            log.error("线程池拒绝任务: documentId={}", documentId, e);
            inFlight.remove(documentId);
            permits.release();
        }
    }

    private void runUnit(Long documentId) {
        try {
            boolean remaining = documentPipelineService.processDocument(documentId);
            log.debug("处理单元结束: documentId={}, remaining={}", documentId, remaining);
        } catch (Exception e) {
            log.error("处理单元异常: documentId={}", documentId, e);
        } finally {
            inFlight.remove(documentId);
            permits.release();
            signals.offer(documentId);
        }
    }

    private void requeueManual(List<PipelineTask> pending) {
        for (PipelineTask task : pending) {
            if (task.isManual() && !inFlight.contains(task.getDocumentId())) {
                manualTasks.offer(task);
            }
        }
    }

    private void awaitInFlight() {
        long deadline = System.nanoTime() + pipelineProperties.getShutdownTimeout().toNanos();
        while (!inFlight.isEmpty()) {
            long remainingNanos = deadline - System.nanoTime();
            if (remainingNanos <= 0) {
                log.warn("等待在途任务超时: inFlight={}", inFlight);
                return;
            }
            try {
                signals.poll(remainingNanos, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void sleepQuietly() {
        try {
            Thread.sleep(pipelineProperties.getPollInterval().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
