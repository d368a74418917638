/**
 * Definitions of every MAAS resource kind served by the generic handler
 *
 * @author William Callahan
 *
 * Features:
 * - Detail kinds for machines, tags, subnets, zones, devices and domains
 * - List kinds with strict filter and pagination parameters forwarded to MAAS
 * - Tag machines: probes the tag, then lists the machines carrying it
 * - Per-kind Cache-Control directives and cache key allow-lists
 */
package net.maasbridge.resource.kinds;

import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import net.maasbridge.model.Device;
import net.maasbridge.model.Domain;
import net.maasbridge.model.Machine;
import net.maasbridge.model.Subnet;
import net.maasbridge.model.Tag;
import net.maasbridge.model.Zone;
import net.maasbridge.model.query.DeviceListQuery;
import net.maasbridge.model.query.DomainIdParams;
import net.maasbridge.model.query.DomainListQuery;
import net.maasbridge.model.query.ListQueryParameters;
import net.maasbridge.model.query.MachineListQuery;
import net.maasbridge.model.query.SubnetIdParams;
import net.maasbridge.model.query.SubnetListQuery;
import net.maasbridge.model.query.SystemIdParams;
import net.maasbridge.model.query.TagListQuery;
import net.maasbridge.model.query.TagNameParams;
import net.maasbridge.model.query.ZoneIdParams;
import net.maasbridge.model.query.ZoneListQuery;
import net.maasbridge.resource.cache.CacheControlDirectives;
import net.maasbridge.resource.cache.ResourceCacheOptions;
import net.maasbridge.resource.error.BridgeFailure;
import net.maasbridge.resource.handler.ResourceFetcher;
import net.maasbridge.resource.handler.ResourceKind;
import net.maasbridge.resource.handler.ResourceKind.Variant;
import net.maasbridge.resource.schema.SchemaFactory;
import net.maasbridge.util.LoggingUtils;
import reactor.core.publisher.Mono;
import tools.jackson.databind.JsonNode;

@Slf4j
public final class MaasResourceKinds {

    public static final String SCHEME = "maas://";

    private MaasResourceKinds() {
    }

    public static ResourceKind<SystemIdParams, Machine> machineDetails(SchemaFactory schemas) {
        return ResourceKind.<SystemIdParams, Machine>builder()
                .label("Machine")
                .template(SCHEME + "machine/{system_id}/details")
                .variant(Variant.DETAIL)
                .parameterSchema(schemas.parameters(SystemIdParams.class))
                .payloadSchema(schemas.payload(Machine.class))
                .idExtractor(SystemIdParams::systemId)
                .fetcher(ResourceFetcher.byId("/machines"))
                .defaultCacheOptions(detailOptions(CacheControlDirectives.MUST_REVALIDATE))
                .description("Details of a single MAAS machine")
                .build();
    }

    public static ResourceKind<MachineListQuery, List<Machine>> machinesList(SchemaFactory schemas) {
        return ResourceKind.<MachineListQuery, List<Machine>>builder()
                .label("Machines")
                .template(SCHEME + "machines/list")
                .variant(Variant.LIST)
                .parameterSchema(schemas.strictParameters(MachineListQuery.class))
                .payloadSchema(schemas.payloadList(Machine.class))
                .fetcher(ResourceFetcher.collection("/machines"))
                .defaultCacheOptions(listOptions(MachineListQuery.FILTERS))
                .filterParameters(MachineListQuery.FILTERS)
                .description("MAAS machines, optionally filtered and paginated")
                .build();
    }

    public static ResourceKind<TagNameParams, Tag> tagDetails(SchemaFactory schemas) {
        return ResourceKind.<TagNameParams, Tag>builder()
                .label("Tag")
                .template(SCHEME + "tag/{tag_name}/details")
                .variant(Variant.DETAIL)
                .parameterSchema(schemas.parameters(TagNameParams.class))
                .payloadSchema(schemas.payload(Tag.class))
                .idExtractor(TagNameParams::tagName)
                .fetcher(ResourceFetcher.byId("/tags"))
                .defaultCacheOptions(detailOptions(CacheControlDirectives.NONE))
                .description("Details of a single MAAS tag")
                .build();
    }

    public static ResourceKind<TagListQuery, List<Tag>> tagsList(SchemaFactory schemas) {
        return ResourceKind.<TagListQuery, List<Tag>>builder()
                .label("Tags")
                .template(SCHEME + "tags/list")
                .variant(Variant.LIST)
                .parameterSchema(schemas.strictParameters(TagListQuery.class))
                .payloadSchema(schemas.payloadList(Tag.class))
                .fetcher(ResourceFetcher.collection("/tags"))
                .defaultCacheOptions(listOptions(TagListQuery.FILTERS))
                .filterParameters(TagListQuery.FILTERS)
                .description("MAAS tags")
                .build();
    }

    /**
     * Machines carrying a tag. Keyed and invalidated by the tag name; a missing tag is reported as
     * {@code Tag '<name>' not found}.
     */
    public static ResourceKind<TagNameParams, List<Machine>> tagMachines(SchemaFactory schemas) {
        return ResourceKind.<TagNameParams, List<Machine>>builder()
                .label("TagMachines")
                .subject("Tag")
                .template(SCHEME + "tag/{tag_name}/machines")
                .variant(Variant.DETAIL)
                .parameterSchema(schemas.parameters(TagNameParams.class))
                .payloadSchema(schemas.payloadList(Machine.class))
                .idExtractor(TagNameParams::tagName)
                .fetcher(tagMachinesFetcher())
                .defaultCacheOptions(detailOptions(CacheControlDirectives.NONE))
                .description("Machines carrying a MAAS tag")
                .build();
    }

    public static ResourceKind<SubnetIdParams, Subnet> subnetDetails(SchemaFactory schemas) {
        return ResourceKind.<SubnetIdParams, Subnet>builder()
                .label("Subnet")
                .template(SCHEME + "subnet/{subnet_id}/details")
                .variant(Variant.DETAIL)
                .parameterSchema(schemas.parameters(SubnetIdParams.class))
                .payloadSchema(schemas.payload(Subnet.class))
                .idExtractor(SubnetIdParams::subnetId)
                .fetcher(ResourceFetcher.byId("/subnets"))
                .defaultCacheOptions(detailOptions(CacheControlDirectives.NONE))
                .description("Details of a single MAAS subnet")
                .build();
    }

    public static ResourceKind<SubnetListQuery, List<Subnet>> subnetsList(SchemaFactory schemas) {
        return ResourceKind.<SubnetListQuery, List<Subnet>>builder()
                .label("Subnets")
                .template(SCHEME + "subnets/list")
                .variant(Variant.LIST)
                .parameterSchema(schemas.strictParameters(SubnetListQuery.class))
                .payloadSchema(schemas.payloadList(Subnet.class))
                .fetcher(ResourceFetcher.collection("/subnets"))
                .defaultCacheOptions(listOptions(SubnetListQuery.FILTERS))
                .filterParameters(SubnetListQuery.FILTERS)
                .description("MAAS subnets")
                .build();
    }

    public static ResourceKind<ZoneIdParams, Zone> zoneDetails(SchemaFactory schemas) {
        return ResourceKind.<ZoneIdParams, Zone>builder()
                .label("Zone")
                .template(SCHEME + "zone/{zone_id}/details")
                .variant(Variant.DETAIL)
                .parameterSchema(schemas.parameters(ZoneIdParams.class))
                .payloadSchema(schemas.payload(Zone.class))
                .idExtractor(ZoneIdParams::zoneId)
                .fetcher(ResourceFetcher.byId("/zones"))
                .defaultCacheOptions(detailOptions(CacheControlDirectives.NONE))
                .description("Details of a single MAAS availability zone")
                .build();
    }

    public static ResourceKind<ZoneListQuery, List<Zone>> zonesList(SchemaFactory schemas) {
        return ResourceKind.<ZoneListQuery, List<Zone>>builder()
                .label("Zones")
                .template(SCHEME + "zones/list")
                .variant(Variant.LIST)
                .parameterSchema(schemas.strictParameters(ZoneListQuery.class))
                .payloadSchema(schemas.payloadList(Zone.class))
                .fetcher(ResourceFetcher.collection("/zones"))
                .defaultCacheOptions(listOptions(ZoneListQuery.FILTERS))
                .filterParameters(ZoneListQuery.FILTERS)
                .description("MAAS availability zones")
                .build();
    }

    public static ResourceKind<SystemIdParams, Device> deviceDetails(SchemaFactory schemas) {
        return ResourceKind.<SystemIdParams, Device>builder()
                .label("Device")
                .template(SCHEME + "device/{system_id}/details")
                .variant(Variant.DETAIL)
                .parameterSchema(schemas.parameters(SystemIdParams.class))
                .payloadSchema(schemas.payload(Device.class))
                .idExtractor(SystemIdParams::systemId)
                .fetcher(ResourceFetcher.byId("/devices"))
                .defaultCacheOptions(detailOptions(CacheControlDirectives.MUST_REVALIDATE))
                .description("Details of a single MAAS device")
                .build();
    }

    public static ResourceKind<DeviceListQuery, List<Device>> devicesList(SchemaFactory schemas) {
        return ResourceKind.<DeviceListQuery, List<Device>>builder()
                .label("Devices")
                .template(SCHEME + "devices/list")
                .variant(Variant.LIST)
                .parameterSchema(schemas.strictParameters(DeviceListQuery.class))
                .payloadSchema(schemas.payloadList(Device.class))
                .fetcher(ResourceFetcher.collection("/devices"))
                .defaultCacheOptions(listOptions(DeviceListQuery.FILTERS))
                .filterParameters(DeviceListQuery.FILTERS)
                .description("MAAS devices")
                .build();
    }

    public static ResourceKind<DomainIdParams, Domain> domainDetails(SchemaFactory schemas) {
        return ResourceKind.<DomainIdParams, Domain>builder()
                .label("Domain")
                .template(SCHEME + "domain/{domain_id}/details")
                .variant(Variant.DETAIL)
                .parameterSchema(schemas.parameters(DomainIdParams.class))
                .payloadSchema(schemas.payload(Domain.class))
                .idExtractor(DomainIdParams::domainId)
                .fetcher(ResourceFetcher.byId("/domains"))
                .defaultCacheOptions(detailOptions(CacheControlDirectives.NONE))
                .description("Details of a single MAAS DNS domain")
                .build();
    }

    public static ResourceKind<DomainListQuery, List<Domain>> domainsList(SchemaFactory schemas) {
        return ResourceKind.<DomainListQuery, List<Domain>>builder()
                .label("Domains")
                .template(SCHEME + "domains/list")
                .variant(Variant.LIST)
                .parameterSchema(schemas.strictParameters(DomainListQuery.class))
                .payloadSchema(schemas.payloadList(Domain.class))
                .fetcher(ResourceFetcher.collection("/domains"))
                .defaultCacheOptions(listOptions(DomainListQuery.FILTERS))
                .filterParameters(DomainListQuery.FILTERS)
                .description("MAAS DNS domains")
                .build();
    }

    /**
     * Probes {@code /tags/<name>/} so an unknown tag reads as not found rather than as an empty
     * machine list. Probe failures other than 404 are logged and the listing goes ahead.
     */
    static ResourceFetcher<TagNameParams> tagMachinesFetcher() {
        return (backend, request, token) -> {
            String tagName = request.resourceId();
            Mono<JsonNode> probe = backend.get("/tags/" + tagName + "/", token)
                    .onErrorMap(MaasResourceKinds::isNotFound,
                            error -> BridgeFailure.notFound("Tag '" + tagName + "' not found"))
                    .onErrorResume(error -> !isNotFound(error) && !token.isCancelled(), error -> {
                        LoggingUtils.warn(log, error, "Could not verify tag '{}'; listing its machines anyway", tagName);
                        return Mono.empty();
                    });
            return probe.then(backend.get("/machines/", Map.of("tags", tagName), token));
        };
    }

    private static boolean isNotFound(Throwable error) {
        return error instanceof BridgeFailure failure && failure.getStatus() == 404;
    }

    // TTLs come from maas.cache.resource-ttl.<label> so operators can tune them per kind
    private static ResourceCacheOptions detailOptions(CacheControlDirectives directives) {
        return ResourceCacheOptions.defaults().withDirectives(directives);
    }

    private static ResourceCacheOptions listOptions(Set<String> filters) {
        return ResourceCacheOptions.defaults().withKeyQueryParams(ListQueryParameters.withPagination(filters));
    }
}
