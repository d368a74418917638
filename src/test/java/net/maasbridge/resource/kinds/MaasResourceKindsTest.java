package net.maasbridge.resource.kinds;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import net.maasbridge.model.Machine;
import net.maasbridge.model.query.TagNameParams;
import net.maasbridge.resource.backend.CancellationToken;
import net.maasbridge.resource.error.BridgeFailure;
import net.maasbridge.resource.error.FailureCode;
import net.maasbridge.resource.handler.RegisteredResource;
import net.maasbridge.resource.handler.ResourceContent;
import net.maasbridge.resource.handler.ResourceHandler;
import net.maasbridge.resource.handler.ResourceKind;
import net.maasbridge.testutil.HandlerFixture;
import net.maasbridge.testutil.MaasFixtures;
import net.maasbridge.testutil.StubBackendClient;
import net.maasbridge.testutil.TestSchemas;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

class MaasResourceKindsTest {

    private HandlerFixture fixture;
    private ResourceHandler<TagNameParams, List<Machine>> tagMachines;

    @BeforeEach
    void setUp() {
        fixture = new HandlerFixture();
        tagMachines = new ResourceHandler<>(MaasResourceKinds.tagMachines(TestSchemas.schemaFactory()), fixture.support);
    }

    @Test
    void shouldListMachinesOfExistingTag() {
        fixture.backend.respond("/tags/virtual/", MaasFixtures.tagJson("virtual"));
        fixture.backend.respond("/machines/", MaasFixtures.machineListJson("abc", "def"));

        ResourceContent content = tagMachines.resolve("maas://tag/virtual/machines", Map.of(), CancellationToken.none())
                .block()
                .first();

        assertThat(content.text()).contains("\"abc\"", "\"def\"");
        assertThat(fixture.backend.calls())
                .extracting(StubBackendClient.Call::path)
                .containsExactly("/tags/virtual/", "/machines/");
        assertThat(fixture.backend.calls().get(1).query()).containsExactlyEntriesOf(Map.of("tags", "virtual"));
    }

    @Test
    void shouldReportUnknownTagAsTagNotFound() {
        fixture.backend.fail("/tags/ghost/", new BridgeFailure(FailureCode.RESOURCE_NOT_FOUND, "Not Found"));
        fixture.backend.respond("/machines/", "[]");

        StepVerifier.create(tagMachines.resolve("maas://tag/ghost/machines", Map.of(), CancellationToken.none()))
                .expectErrorSatisfies(error -> {
                    BridgeFailure failure = (BridgeFailure) error;
                    assertThat(failure.getStatus()).isEqualTo(404);
                    assertThat(failure.getMessage()).isEqualTo("Tag 'ghost' not found");
                })
                .verify(Duration.ofSeconds(5));
        assertThat(fixture.backend.callCount("/machines/")).isZero();
    }

    @Test
    void shouldStillListMachinesWhenTagProbeFailsOtherwise() {
        fixture.backend.fail("/tags/virtual/", new BridgeFailure(FailureCode.BACKEND_ERROR, "Bad Gateway"));
        fixture.backend.respond("/machines/", MaasFixtures.machineListJson("abc"));

        ResourceContent content = tagMachines.resolve("maas://tag/virtual/machines", Map.of(), CancellationToken.none())
                .block()
                .first();

        assertThat(content.text()).contains("\"abc\"");
    }

    @Test
    void shouldRejectTagNameWithIllegalCharacters() {
        StepVerifier.create(tagMachines.resolve("maas://tag/no%20spaces!/machines", Map.of(), CancellationToken.none()))
                .expectErrorSatisfies(error -> {
                    BridgeFailure failure = (BridgeFailure) error;
                    assertThat(failure.getCode()).isEqualTo(FailureCode.INVALID_PARAMETERS);
                    assertThat(failure.getMessage()).isEqualTo("Invalid parameters for TagMachines request");
                })
                .verify(Duration.ofSeconds(5));
        assertThat(fixture.backend.calls()).isEmpty();
    }

    @Test
    void shouldCacheTagMachinesUnderTagName() {
        fixture.backend.respond("/tags/virtual/", MaasFixtures.tagJson("virtual"));
        fixture.backend.respond("/machines/", MaasFixtures.machineListJson("abc"));

        tagMachines.resolve("maas://tag/virtual/machines", Map.of(), CancellationToken.none()).block();
        tagMachines.resolve("maas://tag/virtual/machines", Map.of(), CancellationToken.none()).block();

        assertThat(fixture.backend.callCount("/machines/")).isEqualTo(1);
        assertThat(tagMachines.invalidateCacheById("virtual")).isEqualTo(1);
    }

    @Test
    void shouldServeZoneDetailsWithNumericId() {
        ResourceHandler<?, ?> zones = new ResourceHandler<>(MaasResourceKinds.zoneDetails(TestSchemas.schemaFactory()),
                fixture.support);
        fixture.backend.respond("/zones/3/", MaasFixtures.zoneJson(3, "rack-a"));

        ResourceContent content = zones.resolve("maas://zone/3/details", Map.of(), CancellationToken.none())
                .block()
                .first();

        assertThat(content.text()).contains("\"rack-a\"");
        assertThat(content.header(ResourceContent.CACHE_CONTROL)).isEqualTo("max-age=600");
    }

    @Test
    void shouldDescribeEveryKindWithUniqueTemplate() {
        List<ResourceKind<?, ?>> kinds = List.of(
                MaasResourceKinds.machineDetails(TestSchemas.schemaFactory()),
                MaasResourceKinds.machinesList(TestSchemas.schemaFactory()),
                MaasResourceKinds.tagDetails(TestSchemas.schemaFactory()),
                MaasResourceKinds.tagsList(TestSchemas.schemaFactory()),
                MaasResourceKinds.tagMachines(TestSchemas.schemaFactory()),
                MaasResourceKinds.subnetDetails(TestSchemas.schemaFactory()),
                MaasResourceKinds.subnetsList(TestSchemas.schemaFactory()),
                MaasResourceKinds.zoneDetails(TestSchemas.schemaFactory()),
                MaasResourceKinds.zonesList(TestSchemas.schemaFactory()),
                MaasResourceKinds.deviceDetails(TestSchemas.schemaFactory()),
                MaasResourceKinds.devicesList(TestSchemas.schemaFactory()),
                MaasResourceKinds.domainDetails(TestSchemas.schemaFactory()),
                MaasResourceKinds.domainsList(TestSchemas.schemaFactory()));

        assertThat(kinds).extracting(ResourceKind::getTemplate).doesNotHaveDuplicates()
                .allSatisfy(template -> assertThat(template).startsWith(MaasResourceKinds.SCHEME));
        assertThat(kinds).filteredOn(kind -> kind.getVariant() == ResourceKind.Variant.DETAIL)
                .allSatisfy(kind -> assertThat(kind.isIdScoped()).isTrue());
        assertThat(kinds).filteredOn(kind -> kind.getVariant() == ResourceKind.Variant.LIST)
                .allSatisfy(kind -> assertThat(kind.getFilterParameters()).isNotEmpty());
    }

    @Test
    void catalogShouldRegisterEveryKind() {
        MaasResourceCatalog catalog = new MaasResourceCatalog(fixture.support, TestSchemas.schemaFactory());

        assertThat(catalog.handlers()).hasSize(13);
        assertThat(fixture.registry.list()).extracting(RegisteredResource::name).containsExactly(
                "machineDetails", "machinesList", "tagDetails", "tagsList", "tagMachines",
                "subnetDetails", "subnetsList", "zoneDetails", "zonesList",
                "deviceDetails", "devicesList", "domainDetails", "domainsList");
        assertThat(fixture.registry.resolve("maas://tag/virtual/machines"))
                .get()
                .extracting(resolution -> resolution.resource().name())
                .isEqualTo("tagMachines");
        assertThat(catalog.handler("zonesList")).isPresent();
        assertThat(catalog.handler("unknown")).isEmpty();
    }
}
