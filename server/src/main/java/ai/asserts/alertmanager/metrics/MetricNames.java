/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.metrics;

public final class MetricNames {
    public static final String ALERTS_PROCESSED = "alertmanager_alerts_processed_total";
    public static final String ALERT_FAILURES = "alertmanager_alert_failures_total";
    public static final String SUPPRESSED = "alertmanager_suppressed_total";
    public static final String EVENTS_DROPPED = "alertmanager_events_dropped_total";
    public static final String EVENTS_PUBLISHED = "alertmanager_events_published_total";
    public static final String REFRESH = "alertmanager_refresh_total";
    public static final String PUBLISH = "alertmanager_publish_total";
    public static final String ENRICHMENT = "alertmanager_enrichment_total";
    public static final String PIPELINE_LATENCY = "alertmanager_pipeline_milliseconds";
    public static final String REFRESH_LATENCY = "alertmanager_refresh_milliseconds";

    public static final String OUTCOME_LABEL = "outcome";
    public static final String ERROR_TYPE_LABEL = "error_type";
    public static final String REASON_LABEL = "reason";
    public static final String SUBSCRIBER_LABEL = "subscriber";
    public static final String EVENT_TYPE_LABEL = "event_type";
    public static final String TARGET_LABEL = "target";

    private MetricNames() {
    }
}
