package com.mailbridge.webhooks.sync;

import com.mailbridge.observability.CorrelationContextHolder;
import com.mailbridge.observability.TenantMetrics;
import com.mailbridge.tenantapi.TenantApiClient;
import com.mailbridge.webhooks.manifest.RemoteWebhook;
import com.mailbridge.webhooks.manifest.WebhookDiff;
import com.mailbridge.webhooks.manifest.WebhookKey;
import com.mailbridge.webhooks.manifest.WebhookManifestDiffer;
import com.mailbridge.webhooks.manifest.WebhookManifestEntry;
import com.mailbridge.webhooks.manifest.WebhookManifestSource;
import com.mailbridge.webhooks.manifest.WebhookUpdate;
import com.mailbridge.webhooks.registry.WebhookRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Brings the webhooks registered on a tenant in line with the app's manifest.
 * <p>
 * A run lists the remote webhooks, diffs them against the desired manifest, then applies
 * deletions before creations and updates. Mutations within a batch run on the shared task
 * executor, at most {@code maxConcurrency} of them in flight at once. Each mutation goes
 * through the retry template (see {@link #retryTemplate}); one that keeps failing is recorded
 * and the rest still run. Failures are reported together
 * at the end as {@link WebhookReconciliationException}.
 * <p>
 * Runs are idempotent: a second run without manifest changes finds an empty diff and makes no
 * remote mutation. A run cut short leaves the tenant in some intermediate state that the next
 * run corrects.
 */
public class WebhookSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(WebhookSynchronizer.class);

    static final String MUTATIONS_METRIC = "mailbridge.webhooks.mutations";
    static final String FAILURES_METRIC = "mailbridge.webhooks.failures";

    private static final Duration MAX_BACKOFF = Duration.ofSeconds(10);

    private final Function<TenantApiClient, WebhookRegistry> registryFactory;
    private final TenantMetrics metrics;
    private final TaskExecutor executor;
    private final RetryTemplate retryTemplate;
    private final int maxConcurrency;

    public WebhookSynchronizer(Function<TenantApiClient, WebhookRegistry> registryFactory, TenantMetrics metrics,
                               TaskExecutor executor, RetryTemplate retryTemplate, int maxConcurrency) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1");
        }
        this.registryFactory = registryFactory;
        this.metrics = metrics;
        this.executor = executor;
        this.retryTemplate = retryTemplate;
        this.maxConcurrency = maxConcurrency;
    }

    /**
     * Retry policy for remote mutations: {@code maxAttempts} attempts with exponential backoff
     * starting at {@code initialBackoff}, doubling up to ten seconds. A backoff under one
     * millisecond retries immediately.
     */
    public static RetryTemplate retryTemplate(int maxAttempts, Duration initialBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        var builder = RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .retryOn(RuntimeException.class);
        long initialMillis = initialBackoff == null ? 0 : initialBackoff.toMillis();
        if (initialMillis < 1) {
            builder.noBackoff();
        } else {
            builder.exponentialBackoff(initialMillis, 2.0, Math.max(initialMillis * 2, MAX_BACKOFF.toMillis()));
        }
        return builder.build();
    }

    /**
     * @return what was changed
     * @throws WebhookReconciliationException if any mutation failed after all attempts
     * @throws com.mailbridge.tenantapi.TenantApiException if the remote webhooks cannot be listed
     */
    public ReconciliationReport reconcile(WebhookManifestSource source, TenantApiClient client) {
        List<WebhookManifestEntry> desired = source.desiredManifest();
        WebhookRegistry registry = registryFactory.apply(client);
        List<RemoteWebhook> actual = registry.list();

        WebhookDiff diff = new WebhookManifestDiffer(source.ownership()).diff(desired, actual);
        if (diff.isEmpty()) {
            log.debug("Webhooks of {} are up to date ({} desired)", client.tenantApiUrl(), desired.size());
            return ReconciliationReport.unchanged(client.tenantApiUrl());
        }
        log.info("Reconciling webhooks of {}: {} to create, {} to update, {} to delete",
                client.tenantApiUrl(), diff.toCreate().size(), diff.toUpdate().size(), diff.toDelete().size());

        Queue<FailedWebhookOperation> failures = new ConcurrentLinkedQueue<>();
        AtomicInteger created = new AtomicInteger();
        AtomicInteger updated = new AtomicInteger();
        AtomicInteger deleted = new AtomicInteger();

        List<Mutation> deletions = new ArrayList<>();
        for (RemoteWebhook remote : diff.toDelete()) {
            deletions.add(new Mutation(WebhookOperation.DELETE, remote.key(), remote.remoteId(),
                    () -> registry.delete(remote.remoteId()), deleted));
        }
        runBatch(deletions, failures);

        List<Mutation> upserts = new ArrayList<>();
        for (WebhookUpdate update : diff.toUpdate()) {
            upserts.add(new Mutation(WebhookOperation.UPDATE, update.desired().key(), update.remoteId(),
                    () -> registry.update(update.remoteId(), update.desired()), updated));
        }
        for (WebhookManifestEntry entry : diff.toCreate()) {
            upserts.add(new Mutation(WebhookOperation.CREATE, entry.key(), null,
                    () -> registry.create(entry), created));
        }
        runBatch(upserts, failures);

        ReconciliationReport report = new ReconciliationReport(client.tenantApiUrl(),
                created.get(), updated.get(), deleted.get(), new ArrayList<>(failures));
        if (report.hasFailures()) {
            throw new WebhookReconciliationException(report);
        }
        log.info("Webhooks of {} reconciled: {} created, {} updated, {} deleted",
                client.tenantApiUrl(), report.created(), report.updated(), report.deleted());
        return report;
    }

    private void runBatch(List<Mutation> batch, Queue<FailedWebhookOperation> failures) {
        if (batch.isEmpty()) {
            return;
        }
        Queue<Mutation> pending = new ConcurrentLinkedQueue<>(batch);
        Runnable worker = CorrelationContextHolder.wrap(() -> {
            Mutation mutation;
            while ((mutation = pending.poll()) != null) {
                apply(mutation, failures);
            }
        });
        List<CompletableFuture<Void>> workers = new ArrayList<>();
        for (int i = 0; i < Math.min(maxConcurrency, batch.size()); i++) {
            workers.add(CompletableFuture.runAsync(worker, executor));
        }
        try {
            CompletableFuture.allOf(workers.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            throw new IllegalStateException("Webhook mutation task failed unexpectedly", e.getCause());
        }
    }

    private void apply(Mutation mutation, Queue<FailedWebhookOperation> failures) {
        retryTemplate.execute(context -> {
            try {
                mutation.action().run();
            } catch (RuntimeException e) {
                log.warn("Webhook {} of {} failed (attempt {}): {}",
                        mutation.operation().tag(), mutation.key(), context.getRetryCount() + 1, e.getMessage());
                throw e;
            }
            mutation.successes().incrementAndGet();
            count(MUTATIONS_METRIC, "Remote webhook mutations", mutation.operation());
            return null;
        }, context -> {
            count(FAILURES_METRIC, "Remote webhook mutations that failed after all attempts", mutation.operation());
            Throwable last = context.getLastThrowable();
            failures.add(new FailedWebhookOperation(mutation.operation(), mutation.key(), mutation.remoteId(),
                    context.getRetryCount(), last == null ? "unknown error" : last.getMessage()));
            return null;
        });
    }

    private void count(String metric, String description, WebhookOperation operation) {
        if (metrics != null) {
            metrics.counter(metric, description, "operation", operation.tag()).increment();
        }
    }

    private record Mutation(
            WebhookOperation operation,
            WebhookKey key,
            String remoteId,
            Runnable action,
            AtomicInteger successes
    ) {
    }
}
