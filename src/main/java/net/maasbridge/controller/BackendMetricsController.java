/**
 * Controller for exposing MAAS API usage metrics
 * - Exposes both human-readable and JSON formats
 * - Supports operational monitoring of backend call volume and failures
 *
 * @author William Callahan
 */
package net.maasbridge.controller;

import java.util.Map;
import net.maasbridge.service.BackendRequestMonitor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for accessing backend usage metrics
 * Primarily used for operational monitoring and debugging
 */
@RestController
@RequestMapping("/admin/backend-metrics")
public class BackendMetricsController {

    private final BackendRequestMonitor backendRequestMonitor;

    public BackendMetricsController(BackendRequestMonitor backendRequestMonitor) {
        this.backendRequestMonitor = backendRequestMonitor;
    }

    /**
     * Returns a human-readable report of backend usage metrics
     * @return Plain text report of current metrics
     */
    @GetMapping(value = "/report", produces = MediaType.TEXT_PLAIN_VALUE)
    public String getBackendMetricsReport() {
        return backendRequestMonitor.generateReport();
    }

    /**
     * Returns backend metrics in JSON format
     * @return JSON object containing all backend metrics
     */
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> getBackendMetrics() {
        return backendRequestMonitor.getMetricsMap();
    }
}
