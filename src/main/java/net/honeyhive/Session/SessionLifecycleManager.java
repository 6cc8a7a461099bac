package net.honeyhive.Session;

import net.honeyhive.Aspect.Components.Utility.MetricsRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Obtains a session id for a tracer.
 *
 * Failure of any kind degrades to a null session id with a warning; nothing is thrown
 * to the caller. The blocking path is bounded by the configured timeout; the async
 * path never completes exceptionally.
 */
public class SessionLifecycleManager {

    private static final Logger logger = LoggerFactory.getLogger(SessionLifecycleManager.class);

    private final SessionApi sessionApi;
    private final MetricsRecorder metricsRecorder;
    private final Executor executor;
    private final long timeoutMillis;

    public SessionLifecycleManager(SessionApi sessionApi,
                                   MetricsRecorder metricsRecorder,
                                   Executor executor,
                                   long timeoutMillis) {
        this.sessionApi = sessionApi;
        this.metricsRecorder = metricsRecorder;
        this.executor = executor;
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * Blocks up to the configured timeout for a session id.
     *
     * @return the session id, or null when the backend could not be reached in time
     */
    @Nullable
    public String createSession(String project, String source, String sessionName) {
        long startTime = System.currentTimeMillis();
        CompletableFuture<String> call = CompletableFuture.supplyAsync(
                () -> sessionApi.createSession(project, source, sessionName), executor);
        try {
            String sessionId = call.get(timeoutMillis, TimeUnit.MILLISECONDS);
            return succeeded(project, sessionId, startTime);
        } catch (TimeoutException e) {
            call.cancel(true);
            return failed(project, "timed out after " + timeoutMillis + "ms", startTime);
        } catch (ExecutionException e) {
            return failed(project, describe(e.getCause()), startTime);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(project, "interrupted", startTime);
        }
    }

    /**
     * Non-blocking variant. The future completes with null on failure or timeout.
     */
    public CompletableFuture<String> createSessionAsync(String project, String source, String sessionName) {
        long startTime = System.currentTimeMillis();
        return CompletableFuture
                .supplyAsync(() -> sessionApi.createSession(project, source, sessionName), executor)
                .orTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .handle((sessionId, error) -> error == null
                        ? succeeded(project, sessionId, startTime)
                        : failed(project, describe(error), startTime));
    }

    private String succeeded(String project, String sessionId, long startTime) {
        metricsRecorder.recordSession(true, startTime);
        logger.info("HoneyHive session {} created for project {}", sessionId, project);
        return sessionId;
    }

    @Nullable
    private String failed(String project, String reason, long startTime) {
        metricsRecorder.recordSession(false, startTime);
        logger.warn("Could not create HoneyHive session for project {}: {}. Continuing without a session id",
                project, reason);
        return null;
    }

    private static String describe(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            return "timed out";
        }
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
