package io.uvlanalyzer.standalone.server;

import io.javalin.http.Context;
import io.javalin.http.Handler;

/** Serves the {@link AnalysisMetrics} snapshot as JSON. */
public final class MetricsHandler implements Handler {

    private final AnalysisMetrics metrics;

    public MetricsHandler(AnalysisMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public void handle(Context ctx) {
        ctx.status(200);
        ctx.contentType("application/json");
        ctx.result(metrics.snapshot().toString());
    }
}
