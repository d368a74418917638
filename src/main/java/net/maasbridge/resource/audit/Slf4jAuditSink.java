/**
 * Audit sink writing one JSON line per event to the {@code maas.audit} logger
 *
 * @author William Callahan
 *
 * Features:
 * - Masks values whose key contains a configured sensitive substring
 * - Drops the served payload unless resource state logging is enabled
 * - Never throws; serialization problems are logged and the event is skipped
 */
package net.maasbridge.resource.audit;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.maasbridge.config.AuditProperties;
import net.maasbridge.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

@Component
public class Slf4jAuditSink implements AuditSink {

    static final String MASK = "********";
    static final String RESOURCE_STATE = "resourceState";

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("maas.audit");
    private static final Logger logger = LoggerFactory.getLogger(Slf4jAuditSink.class);

    private final AuditProperties properties;
    private final ObjectMapper objectMapper;

    public Slf4jAuditSink(AuditProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void record(AuditEvent event) {
        if (!properties.isEnabled() || event == null) {
            return;
        }
        try {
            AUDIT_LOG.info(objectMapper.writeValueAsString(toAuditTree(event)));
        } catch (JacksonException e) {
            LoggingUtils.warn(logger, e, "Could not serialize audit event {} for {}", event.eventType(), event.resourceType());
        }
    }

    /**
     * Visible for tests: the tree that is written for {@code event}.
     */
    ObjectNode toAuditTree(AuditEvent event) {
        Map<String, Object> details = new LinkedHashMap<>(event.details());
        if (!properties.isIncludeResourceState()) {
            details.remove(RESOURCE_STATE);
        }
        ObjectNode tree = objectMapper.valueToTree(event.withDetails(details));
        if (properties.isMaskSensitiveFields() && tree.has("details")) {
            tree.set("details", mask(tree.get("details")));
        }
        return tree;
    }

    private JsonNode mask(JsonNode node) {
        if (node.isObject()) {
            ObjectNode copy = objectMapper.createObjectNode();
            for (Map.Entry<String, JsonNode> property : node.properties()) {
                if (isSensitive(property.getKey())) {
                    copy.put(property.getKey(), MASK);
                } else {
                    copy.set(property.getKey(), mask(property.getValue()));
                }
            }
            return copy;
        }
        if (node.isArray()) {
            ArrayNode copy = objectMapper.createArrayNode();
            for (int i = 0; i < node.size(); i++) {
                copy.add(mask(node.get(i)));
            }
            return copy;
        }
        return node;
    }

    private boolean isSensitive(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        List<String> sensitive = properties.getSensitiveFields();
        return sensitive.stream().anyMatch(fragment -> !fragment.isBlank()
                && lower.contains(fragment.toLowerCase(Locale.ROOT)));
    }
}
