package net.maasbridge.resource.kinds;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.maasbridge.resource.handler.ResourceHandler;
import net.maasbridge.resource.handler.ResourceHandlerSupport;
import net.maasbridge.resource.handler.ResourceKind;
import net.maasbridge.resource.schema.SchemaFactory;
import org.springframework.stereotype.Component;

/**
 * Creates one generic handler per MAAS resource kind and registers it with the host registry.
 */
@Slf4j
@Component
public class MaasResourceCatalog {

    private final Map<String, ResourceHandler<?, ?>> handlers = new LinkedHashMap<>();

    public MaasResourceCatalog(ResourceHandlerSupport support, SchemaFactory schemas) {
        add("machineDetails", MaasResourceKinds.machineDetails(schemas), support);
        add("machinesList", MaasResourceKinds.machinesList(schemas), support);
        add("tagDetails", MaasResourceKinds.tagDetails(schemas), support);
        add("tagsList", MaasResourceKinds.tagsList(schemas), support);
        add("tagMachines", MaasResourceKinds.tagMachines(schemas), support);
        add("subnetDetails", MaasResourceKinds.subnetDetails(schemas), support);
        add("subnetsList", MaasResourceKinds.subnetsList(schemas), support);
        add("zoneDetails", MaasResourceKinds.zoneDetails(schemas), support);
        add("zonesList", MaasResourceKinds.zonesList(schemas), support);
        add("deviceDetails", MaasResourceKinds.deviceDetails(schemas), support);
        add("devicesList", MaasResourceKinds.devicesList(schemas), support);
        add("domainDetails", MaasResourceKinds.domainDetails(schemas), support);
        add("domainsList", MaasResourceKinds.domainsList(schemas), support);
        log.info("Registered {} MAAS resource handlers", handlers.size());
    }

    private <P, T> void add(String name, ResourceKind<P, T> kind, ResourceHandlerSupport support) {
        ResourceHandler<P, T> handler = new ResourceHandler<>(kind, support);
        handler.register(name);
        handlers.put(name, handler);
    }

    public Optional<ResourceHandler<?, ?>> handler(String name) {
        return Optional.ofNullable(handlers.get(name));
    }

    public Map<String, ResourceHandler<?, ?>> handlers() {
        return Collections.unmodifiableMap(handlers);
    }
}
