package net.maasbridge.testutil;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import net.maasbridge.resource.backend.BackendClient;
import net.maasbridge.resource.backend.CancellationToken;
import reactor.core.publisher.Mono;
import tools.jackson.databind.JsonNode;

/** Scripted backend: responses are registered per path and every call is recorded. */
public final class StubBackendClient implements BackendClient {

    /** One recorded backend call. */
    public record Call(String path, Map<String, String> query) {}

    private final Map<String, Supplier<Mono<JsonNode>>> responses = new HashMap<>();
    private final List<Call> calls = new ArrayList<>();

    public StubBackendClient respond(String path, String json) {
        responses.put(path, () -> Mono.just(TestSchemas.json(json)));
        return this;
    }

    public StubBackendClient respondEmpty(String path) {
        responses.put(path, Mono::empty);
        return this;
    }

    public StubBackendClient fail(String path, Throwable error) {
        responses.put(path, () -> Mono.error(error));
        return this;
    }

    public StubBackendClient respondWith(String path, Supplier<Mono<JsonNode>> response) {
        responses.put(path, response);
        return this;
    }

    @Override
    public Mono<JsonNode> get(String path, Map<String, String> query, CancellationToken token) {
        return Mono.defer(() -> {
            synchronized (calls) {
                calls.add(new Call(path, Map.copyOf(query)));
            }
            Supplier<Mono<JsonNode>> response = responses.get(path);
            if (response == null) {
                return Mono.error(new IllegalStateException("No stubbed response for " + path));
            }
            return token.observe(response.get());
        });
    }

    public List<Call> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    public int callCount(String path) {
        return (int) calls().stream().filter(call -> call.path().equals(path)).count();
    }
}
