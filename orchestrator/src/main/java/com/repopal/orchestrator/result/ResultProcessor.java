package com.repopal.orchestrator.result;

import com.repopal.orchestrator.event.StandardizedEvent;
import com.repopal.orchestrator.executor.dto.ExecutionResult;
import com.repopal.orchestrator.executor.dto.FileChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Turns an ExecutionResult into a change request and notifications.
 *
 * Notification failures are logged and never change the outcome. A change-request
 * failure is raised as {@link ChangeRequestException} so the stage can be retried.
 */
@Component
public class ResultProcessor {

    private static final Logger log = LoggerFactory.getLogger(ResultProcessor.class);

    private final RepositoryAdapter repositoryAdapter;          // null: change requests are skipped
    private final Map<String, ServiceAdapter> serviceAdapters;

    @Autowired
    public ResultProcessor(ObjectProvider<RepositoryAdapter> repositoryAdapter,
                           List<ServiceAdapter> serviceAdapters) {
        this(repositoryAdapter.getIfAvailable(), serviceAdapters);
    }

    public ResultProcessor(RepositoryAdapter repositoryAdapter, List<ServiceAdapter> serviceAdapters) {
        this.repositoryAdapter = repositoryAdapter;
        Map<String, ServiceAdapter> byName = new LinkedHashMap<>();
        serviceAdapters.forEach(a -> byName.put(a.serviceName(), a));
        this.serviceAdapters = Map.copyOf(byName);
    }

    /**
     * Validate, open a change request if there is something to publish, and notify.
     *
     * @throws InvalidResultException if the result is malformed (nothing is published)
     * @throws ChangeRequestException if the repository adapter failed (nothing is notified)
     */
    public PipelineSummary process(UUID pipelineId, StandardizedEvent event, String command,
                                   String targetBranch, ExecutionResult result) {
        ResultValidator.validate(result);

        List<FileChange> files = result.changeSet().files();
        String changeRequestUrl = null;

        boolean publishable = result.success()
                && !files.isEmpty()
                && event.repository().canWrite()
                && result.changeSet().finalCommit() != null;

        if (publishable && repositoryAdapter == null) {
            log.warn("No repository adapter configured; commit {} is not published",
                    result.changeSet().finalCommit());
        } else if (publishable) {
            try {
                ChangeRequestRef ref = repositoryAdapter.createChangeRequest(
                        event.repository().name(), event.baseBranch(), targetBranch,
                        result.changeSet().originalCommit(), result.changeSet().finalCommit(), files);
                changeRequestUrl = ref.url();
                log.info("Opened change request {} for {}", ref.url(), event.repository().name());
            } catch (RuntimeException e) {
                throw new ChangeRequestException("Could not open change request: " + e.getMessage(), e);
            }
        }

        String error = result.success() ? null : result.status().error();
        PipelineSummary summary = new PipelineSummary(pipelineId, event.repository().name(), command,
                result.success(), files, summarize(files), changeRequestUrl, error);

        if (result.success()) {
            forEachAdapter(event, a -> a.notifySuccess(summary), "success");
        } else {
            forEachAdapter(event, a -> a.notifyError(summary, error), "error");
        }
        return summary;
    }

    /**
     * Report a pipeline that failed before producing a result.
     * Never throws: notification is best-effort.
     */
    public void notifyFailure(UUID pipelineId, StandardizedEvent event, String command, String error) {
        PipelineSummary summary = new PipelineSummary(pipelineId, event.repository().name(), command,
                false, List.of(), summarize(List.of()), null, error);
        forEachAdapter(event, a -> a.notifyError(summary, error), "error");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** The originating service plus anything listed under metadata {@code notify}. */
    static Set<String> recipients(StandardizedEvent event) {
        Set<String> names = new LinkedHashSet<>();
        names.add(event.service());
        Object extra = event.metadata().get("notify");
        if (extra instanceof Collection<?> list) {
            list.forEach(n -> names.add(String.valueOf(n)));
        } else if (extra instanceof String single && !single.isBlank()) {
            names.add(single);
        }
        return names;
    }

    static String summarize(List<FileChange> files) {
        if (files.isEmpty()) return "no changes";
        Map<FileChange.Status, Long> counts = files.stream()
                .collect(Collectors.groupingBy(FileChange::status,
                        () -> new EnumMap<>(FileChange.Status.class), Collectors.counting()));
        List<String> parts = new ArrayList<>();
        counts.forEach((status, n) -> parts.add(n + " " + status.name().toLowerCase()));
        return String.join(", ", parts);
    }

    private void forEachAdapter(StandardizedEvent event,
                                Consumer<ServiceAdapter> call, String kind) {
        for (String name : recipients(event)) {
            ServiceAdapter adapter = serviceAdapters.get(name);
            if (adapter == null) {
                log.warn("No service adapter for '{}', {} notification dropped", name, kind);
                continue;
            }
            try {
                call.accept(adapter);
            } catch (RuntimeException e) {
                log.warn("Service adapter '{}' failed to deliver {} notification: {}",
                        name, kind, e.getMessage());
            }
        }
    }
}
