package net.maasbridge.resource.schema;

import java.util.Map;
import java.util.function.Supplier;
import net.maasbridge.resource.error.BridgeFailure;
import net.maasbridge.resource.error.FailureCode;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/**
 * Turns raw string parameters extracted from a resource URI into validated, typed parameters.
 *
 * <p>Failures are always {@link BridgeFailure}s: schema issues become 400 {@code invalid_parameters}
 * with the issues under {@code details.issues}; a {@code BridgeFailure} thrown by the extraction step
 * is propagated unchanged; anything else thrown while extracting becomes 500 {@code unexpected_error}.
 */
@Component
public class ParameterValidator {

    private final ObjectMapper objectMapper;

    public ParameterValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public <P> P validate(Supplier<Map<String, String>> extraction, Schema<P> schema, String kindLabel) {
        return validate(extract(extraction, kindLabel), schema, kindLabel);
    }

    public <P> P validate(Map<String, String> rawParams, Schema<P> schema, String kindLabel) {
        try {
            return schema.validate(objectMapper.valueToTree(rawParams));
        } catch (SchemaValidationException e) {
            throw new BridgeFailure(FailureCode.INVALID_PARAMETERS,
                    "Invalid parameters for " + kindLabel + " request",
                    Map.of("issues", e.getIssues()), e);
        }
    }

    /**
     * Runs an extraction step under the validator's failure policy.
     */
    public <R> R extract(Supplier<R> extraction, String kindLabel) {
        try {
            return extraction.get();
        } catch (BridgeFailure failure) {
            throw failure;
        } catch (RuntimeException e) {
            throw BridgeFailure.unexpected(
                    "Error processing " + kindLabel + " request: " + e.getMessage(), e);
        }
    }
}
