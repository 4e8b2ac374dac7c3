package com.williamcallahan.crossref.logging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.crossref.domain.report.CrossReferenceResult;
import com.williamcallahan.crossref.domain.report.ResolutionReport;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Logging aspect for the cross-reference pipeline.
 * Logs each run and each CLI batch to the {@code PIPELINE} logger with timing.
 */
@Aspect
@Component
public class ProcessingLogger {
    private static final Logger log = LoggerFactory.getLogger(ProcessingLogger.class);
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");
    private static final AtomicLong INVOCATIONS = new AtomicLong();
    private final ObjectMapper objectMapper = new ObjectMapper();

    // Thread-local label for the invocation being logged
    private static final ThreadLocal<String> INVOCATION_ID = ThreadLocal.withInitial(() ->
        "PIPE-" + Thread.currentThread().getId() + "-" + INVOCATIONS.incrementAndGet()
    );

    /**
     * Log a whole engine run
     */
    @Around("execution(* com.williamcallahan.crossref.service.CrossReferenceEngine.process(..))")
    public Object logEngineRun(ProceedingJoinPoint joinPoint) throws Throwable {
        String invocationId = INVOCATION_ID.get();
        long startTime = System.currentTimeMillis();

        Object[] args = joinPoint.getArgs();
        int chunkCount = args.length > 0 && args[0] instanceof List<?> chunks ? chunks.size() : 0;
        PIPELINE_LOG.info("[{}] CROSS-REFERENCE RUN - Starting with {} chunks", invocationId, chunkCount);

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;

            if (result instanceof CrossReferenceResult crossReferenceResult) {
                ResolutionReport report = crossReferenceResult.report();
                PIPELINE_LOG.info("[{}] CROSS-REFERENCE RUN - {} finished with status {} in {}ms",
                    invocationId, report.runId(), report.status(), duration);
                if (PIPELINE_LOG.isDebugEnabled()) {
                    PIPELINE_LOG.debug("[{}] Report: {}", invocationId, toJson(report));
                }
            } else {
                PIPELINE_LOG.info("[{}] CROSS-REFERENCE RUN - Completed in {}ms", invocationId, duration);
            }
            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] CROSS-REFERENCE RUN - Failed: {}", invocationId, e.getMessage());
            throw e;
        } finally {
            INVOCATION_ID.remove();
        }
    }

    /**
     * Log a CLI directory batch
     */
    @Around("execution(* com.williamcallahan.crossref.cli.ChunkDirectoryProcessor.processDirectory(..))")
    public Object logDirectoryBatch(ProceedingJoinPoint joinPoint) throws Throwable {
        long startTime = System.currentTimeMillis();
        Object[] args = joinPoint.getArgs();
        Object inputDir = args.length > 0 ? args[0] : "?";

        PIPELINE_LOG.info("DIRECTORY BATCH - Starting for {}", inputDir);
        try {
            Object result = joinPoint.proceed();
            PIPELINE_LOG.info("DIRECTORY BATCH - Completed in {}ms", System.currentTimeMillis() - startTime);
            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("DIRECTORY BATCH - Failed for {}: {}", inputDir, e.getMessage());
            throw e;
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.debug("Could not serialize {} for logging: {}", value.getClass().getSimpleName(), e.getMessage());
            return String.valueOf(value);
        }
    }
}
