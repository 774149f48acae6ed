package com.coordinator.examples.transfer;

import com.coordinator.core.config.CoordinationOptions;
import com.coordinator.core.model.ActivityTask;
import com.coordinator.core.model.TerminationOutcome;
import com.coordinator.worker.CoordinatedActivityAdapter;
import com.coordinator.worker.diagnostics.CompositeDiagnosticListener;
import com.coordinator.worker.diagnostics.LoggingDiagnosticListener;
import com.coordinator.worker.diagnostics.MicrometerDiagnosticListener;
import com.coordinator.worker.interceptor.ActivityInterceptor;
import com.coordinator.worker.interceptor.FuncInterceptor;
import com.coordinator.worker.interceptor.InterceptingCoordinator;
import com.coordinator.worker.signal.WorkflowSignalTaskUpdateSignaler;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.UUID;

/**
 * Runs one simulated file transfer end to end against the in-memory service.
 *
 * Usage: {@code java com.coordinator.examples.transfer.TransferWorkflowDemo [cancel]}
 */
public class TransferWorkflowDemo {

    private static final Logger log = LoggerFactory.getLogger(TransferWorkflowDemo.class);

    public static void main(String[] args) throws Exception {
        boolean cancelMidway = args.length > 0 && "cancel".equals(args[0]);
        CoordinationOptions options = loadOptions();
        ObjectMapper mapper = new ObjectMapper();

        InMemoryOrchestrationService service = new InMemoryOrchestrationService();
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        FileTransferActivity activity = new FileTransferActivity();

        CoordinatedActivityAdapter<TransferRequest, TransferProgress> adapter = new CoordinatedActivityAdapter<>(
            activity,
            options,
            service,
            new WorkflowSignalTaskUpdateSignaler(service, mapper),
            CompositeDiagnosticListener.of(new LoggingDiagnosticListener(), new MicrometerDiagnosticListener(registry))
        );
        ActivityInterceptor audit = FuncInterceptor.builder()
            .afterTaskComplete((task, result) -> log.info("Reporting completion of {}: {}", task.activityId(), result))
            .afterTaskFailed((task, error) -> log.warn("Reporting failure of {}", task.activityId(), error))
            .afterTaskCanceled((task, details) -> log.info("Reporting cancellation of {} details='{}'", task.activityId(), details))
            .build();
        InterceptingCoordinator<TransferRequest, TransferProgress> coordinator =
            new InterceptingCoordinator<>(adapter, audit);

        String token = UUID.randomUUID().toString();
        service.open(token);
        TransferRequest request = new TransferRequest("s3://bucket/archive.tar", "/data/archive.tar", 10_000_000, 1_000_000);
        ActivityTask task = new ActivityTask(token, "backup-" + token.substring(0, 8), null,
            FileTransferActivity.ACTIVITY_TYPE, "transfer-1", mapper.valueToTree(request));

        if (cancelMidway) {
            Thread canceler = new Thread(() -> {
                try {
                    Thread.sleep(options.tickMinInterval().toMillis() * 4);
                    service.requestCancel(token);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "demo-canceler");
            canceler.setDaemon(true);
            canceler.start();
        }

        TerminationOutcome<TransferProgress> outcome = coordinator.coordinateJson(task);

        log.info("Outcome: {} result={} heartbeats={} signals={}",
            outcome.type(), outcome.result(), service.getHeartbeatCount(token), service.getSignals().size());
        registry.getMeters().forEach(meter ->
            log.info("{} {} = {}", meter.getId().getName(), meter.getId().getTags(), meter.measure().iterator().next().getValue()));
    }

    static CoordinationOptions loadOptions() throws IOException {
        Properties properties = new Properties();
        try (InputStream in = TransferWorkflowDemo.class.getResourceAsStream("/coordinator.properties")) {
            if (in != null) {
                properties.load(in);
            }
        }
        return CoordinationOptions.fromProperties(properties);
    }
}
