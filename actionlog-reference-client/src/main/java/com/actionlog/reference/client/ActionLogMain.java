package com.actionlog.reference.client;

import com.actionlog.client.transport.okhttp.OkHttpEventSender;
import com.actionlog.core.dispatch.LogDispatcher;
import com.actionlog.core.loki.LokiClient;
import com.actionlog.core.loki.LokiSettings;
import com.actionlog.core.model.LogRecord;
import com.actionlog.core.model.Severity;
import com.actionlog.core.record.LogRecordFactory;
import com.actionlog.core.template.TemplateRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the dispatch pipeline from the environment and sends one action event.
 *
 * <pre>
 * LOKI_ENABLED=true LOKI_PUSH_URL=http://localhost:3100/loki/api/v1/push LOKI_JOB=action-events \
 *   java -jar actionlog-reference-client.jar customer-42 call_started
 * </pre>
 */
public class ActionLogMain {
    private static final Logger log = LoggerFactory.getLogger(ActionLogMain.class);

    static final String ACTION_RECORDED = "ActionRecorded";

    public static void main(String[] args) throws Exception {
        String customerId = args.length > 0 ? args[0] : "demo-customer";
        String eventType = args.length > 1 ? args[1] : "demo_event";

        LokiSettings settings = LokiSettings.fromEnvironment();
        LokiClient loki = settings.active()
                ? new LokiClient(settings, new OkHttpEventSender(settings.transport()))
                : new LokiClient(settings, null);

        TemplateRegistry registry = new TemplateRegistry().loadDefaults();
        registry.addTemplate(ACTION_RECORDED, "Action event (%s) recorded for customer %s");
        LogRecordFactory records = new LogRecordFactory(registry.freeze());

        try (loki;
                LogDispatcher dispatcher = LogDispatcher.builder().lokiClient(loki).build()) {
            log.atInfo()
                    .addKeyValue("loki_enabled", settings.enabled())
                    .addKeyValue("loki_push_url", settings.pushUrl())
                    .addKeyValue("loki_job", settings.job())
                    .log("Initialized action event logger");

            LogRecord record = records.buildLog(
                    "phone_action", ACTION_RECORDED, Severity.INFO, actionFields(customerId, eventType), eventType, customerId);
            dispatcher.enqueue(record);
        }
    }

    static Map<String, Object> actionFields(String customerId, String eventType) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("customer_id", customerId);
        fields.put("event_type", eventType);
        return fields;
    }
}
