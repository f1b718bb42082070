package com.example.evaluator.orchestrator;

import com.example.evaluator.agent.EvaluationTask;
import com.example.evaluator.config.EvaluationProperties;
import com.example.evaluator.model.TaskOutput;
import com.example.evaluator.model.TaskResult;
import com.example.evaluator.service.TaskExecutionMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls a task capability with a timeout and turns whatever happens into a {@link TaskResult}.
 * Never throws for task-level problems: exceptions and timeouts become FAILED results.
 * A call that times out is cancelled and its worker thread interrupted.
 * The returned result is not persisted yet.
 */
@Component
public class TaskInvoker {

    private static final Logger log = LoggerFactory.getLogger(TaskInvoker.class);

    private final Executor agentExecutor;
    private final Duration timeout;
    private final TaskExecutionMonitor monitor;

    @Autowired
    public TaskInvoker(@Qualifier("agentExecutor") Executor agentExecutor,
                       EvaluationProperties properties,
                       TaskExecutionMonitor monitor) {
        this(agentExecutor, properties.taskTimeout(), monitor);
    }

    TaskInvoker(Executor agentExecutor, Duration timeout, TaskExecutionMonitor monitor) {
        this.agentExecutor = agentExecutor;
        this.timeout = timeout;
        this.monitor = monitor;
    }

    public TaskResult invoke(EvaluationTask task, CaseContext context) {
        String caseId = context.caseId();
        monitor.started(caseId, task.name());

        TaskResult result;
        FutureTask<TaskOutput> call = new FutureTask<>(() -> task.run(context));
        agentExecutor.execute(call);
        try {
            TaskOutput output = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (output == null) {
                result = TaskResult.failed(caseId, task.name(), "task returned no output");
            } else {
                result = TaskResult.success(caseId, task.name(), output);
            }
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("{}: timed out after {}ms", task.name(), timeout.toMillis());
            result = TaskResult.failed(caseId, task.name(), "timed out after " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("{}: failed — {}", task.name(), rootCauseMessage(cause));
            log.debug("{}: failure detail", task.name(), cause);
            result = TaskResult.failed(caseId, task.name(), rootCauseMessage(cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            result = TaskResult.failed(caseId, task.name(), "interrupted");
        }

        monitor.finished(caseId, task.name(), result.status(), result.errorMessage());
        return result;
    }

    static String rootCauseMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        String msg = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return msg.length() > 300 ? msg.substring(0, 300) + "..." : msg;
    }
}
